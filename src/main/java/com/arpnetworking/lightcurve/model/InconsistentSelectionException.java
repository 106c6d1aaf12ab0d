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

/**
 * Thrown when a {@link RowSelection} names rows that are not in the table it
 * is applied to.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class InconsistentSelectionException extends RuntimeException {

    /**
     * Public constructor.
     *
     * @param table A description of the table.
     * @param selection The offending selection.
     * @param rowCount The number of rows in the table.
     */
    public InconsistentSelectionException(final String table, final RowSelection selection, final int rowCount) {
        super(String.format(
                "Selection is not within table; table=%s, rowCount=%d, selection=%s",
                table,
                rowCount,
                selection.getIndices()));
        _selection = selection;
        _rowCount = rowCount;
    }

    public RowSelection getSelection() {
        return _selection;
    }

    public int getRowCount() {
        return _rowCount;
    }

    private final transient RowSelection _selection;
    private final int _rowCount;

    private static final long serialVersionUID = -2387110046655310938L;
}
