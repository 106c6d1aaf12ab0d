/*
 * Copyright 2026 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.lightcurve.model;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A catalogue upper limit table: one {@link MultiBandRow} per observation.
 * Rows may carry different bands; a band can be merged over a selection
 * only when every selected row carries it.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class MultiBandTable {

    /**
     * Public constructor.
     *
     * @param name A description of the table, used in error messages.
     * @param rows The rows.
     */
    public MultiBandTable(final String name, final List<MultiBandRow> rows) {
        _name = name;
        _rows = ImmutableList.copyOf(rows);
    }

    public String getName() {
        return _name;
    }

    public ImmutableList<MultiBandRow> getRows() {
        return _rows;
    }

    public int size() {
        return _rows.size();
    }

    /**
     * Whether every selected row carries a band. Rows outside the selection
     * are not considered.
     *
     * @param band The band.
     * @param selection The rows to check.
     * @return True if and only if every selected row has columns for the band.
     * @throws InconsistentSelectionException if a selected row is not in this table.
     */
    public boolean hasBand(final Band band, final RowSelection selection) {
        selection.checkWithin(_name, _rows.size());
        for (final int index : selection.getIndices()) {
            if (!_rows.get(index).getBand(band).isPresent()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Get the columns of one band for the selected rows.
     *
     * @param band The band.
     * @param selection The rows to select.
     * @return The selected columns in row order.
     * @throws InconsistentSelectionException if a selected row is not in this table.
     * @throws IllegalArgumentException if a selected row does not carry the band.
     */
    public ImmutableList<BandColumns> select(final Band band, final RowSelection selection) {
        if (!hasBand(band, selection)) {
            throw new IllegalArgumentException(String.format(
                    "Invalid band for selection; table=%s, band=%s, selection=%s",
                    _name,
                    band,
                    selection.getIndices()));
        }
        final ImmutableList.Builder<BandColumns> selected = ImmutableList.builder();
        for (final int index : selection.getIndices()) {
            selected.add(_rows.get(index).getBands().get(band));
        }
        return selected.build();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Name", _name)
                .add("Rows", _rows.size())
                .toString();
    }

    private final String _name;
    private final ImmutableList<MultiBandRow> _rows;
}
