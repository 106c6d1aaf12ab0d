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

import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.primitives.Ints;

import java.util.Collection;

/**
 * An explicit, non-empty set of row indices into a {@link Dataset} or a
 * {@link MultiBandTable}. Indices are held in ascending order without
 * duplicates.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class RowSelection {

    /**
     * Create a selection of the given rows.
     *
     * @param indices The row indices.
     * @return New {@link RowSelection}.
     * @throws IllegalArgumentException if no rows are given.
     */
    public static RowSelection of(final int... indices) {
        return of(Ints.asList(indices));
    }

    /**
     * Create a selection of the given rows.
     *
     * @param indices The row indices.
     * @return New {@link RowSelection}.
     * @throws IllegalArgumentException if no rows are given.
     */
    public static RowSelection of(final Collection<Integer> indices) {
        Preconditions.checkArgument(!indices.isEmpty(), "Invalid selection; selection is empty");
        return new RowSelection(ImmutableSortedSet.copyOf(indices));
    }

    /**
     * Create a selection of the contiguous rows {@code [fromIndex, toIndex)}.
     *
     * @param fromIndex The first selected row, inclusive.
     * @param toIndex The last selected row, exclusive.
     * @return New {@link RowSelection}.
     * @throws IllegalArgumentException if the range is empty.
     */
    public static RowSelection range(final int fromIndex, final int toIndex) {
        Preconditions.checkArgument(
                toIndex > fromIndex,
                "Invalid selection; fromIndex=%s, toIndex=%s",
                fromIndex,
                toIndex);
        final ImmutableSortedSet.Builder<Integer> indices = ImmutableSortedSet.naturalOrder();
        for (int i = fromIndex; i < toIndex; ++i) {
            indices.add(i);
        }
        return new RowSelection(indices.build());
    }

    /**
     * Ensure that every selected row exists in a table.
     *
     * @param table A description of the table, used in the error message.
     * @param rowCount The number of rows in the table.
     * @throws InconsistentSelectionException if a selected row is not in the table.
     */
    public void checkWithin(final String table, final int rowCount) {
        if (_indices.first() < 0 || _indices.last() >= rowCount) {
            throw new InconsistentSelectionException(table, this, rowCount);
        }
    }

    public ImmutableSortedSet<Integer> getIndices() {
        return _indices;
    }

    public int size() {
        return _indices.size();
    }

    /**
     * Whether a row is selected.
     *
     * @param index The row index.
     * @return True if and only if the row is selected.
     */
    public boolean contains(final int index) {
        return _indices.contains(index);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        return _indices.equals(((RowSelection) object)._indices);
    }

    @Override
    public int hashCode() {
        return _indices.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Indices", _indices)
                .toString();
    }

    private RowSelection(final ImmutableSortedSet<Integer> indices) {
        _indices = indices;
    }

    private final ImmutableSortedSet<Integer> _indices;
}
