package com.doseobjectives.converter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One raw spreadsheet row: column name to cell text.
 *
 * @invariant rowNumber is the 1-based row in the source sheet (the header is row 1).
 * @invariant cell values are stored stripped of leading and trailing whitespace; absent cells read as "".
 */
public final class ClinicalGoalRow {

    private final int rowNumber;
    private final Map<String, String> cells;

    public ClinicalGoalRow(int rowNumber, Map<String, String> cells) {
        this.rowNumber = rowNumber;
        Map<String, String> copy = new LinkedHashMap<>();
        cells.forEach((column, value) -> copy.put(column, value == null ? "" : value.strip()));
        this.cells = Collections.unmodifiableMap(copy);
    }

    public int getRowNumber() {
        return rowNumber;
    }

    /**
     * @param column a column name from {@link ConstraintColumns}
     * @return the stripped cell text, or "" when the column is absent or the cell is blank
     */
    public String get(String column) {
        return cells.getOrDefault(column, "");
    }

    public Map<String, String> getCells() {
        return cells;
    }

    @Override
    public String toString() {
        return "ClinicalGoalRow{row=" + rowNumber + ", cells=" + cells + '}';
    }
}
