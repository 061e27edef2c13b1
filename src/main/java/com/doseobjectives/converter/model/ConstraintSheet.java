package com.doseobjectives.converter.model;

import com.doseobjectives.converter.exception.MissingColumnException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A constraint worksheet as delivered by a row source: its header names in column order and
 * its non-empty data rows in sheet order.
 */
public final class ConstraintSheet {

    private final String sheetName;
    private final List<String> headers;
    private final List<ClinicalGoalRow> rows;

    public ConstraintSheet(String sheetName, List<String> headers, List<ClinicalGoalRow> rows) {
        this.sheetName = sheetName;
        this.headers = List.copyOf(headers);
        this.rows = List.copyOf(rows);
    }

    public String getSheetName() {
        return sheetName;
    }

    public List<String> getHeaders() {
        return headers;
    }

    public List<ClinicalGoalRow> getRows() {
        return rows;
    }

    /**
     * Verifies that every required column is present in the header row.
     *
     * @param required the column names that must be present
     * @throws MissingColumnException listing every absent column
     */
    public void requireColumns(Collection<String> required) {
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!headers.contains(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingColumnException(sheetName, missing);
        }
    }
}
