package com.doseobjectives.converter.core;

import com.doseobjectives.converter.exception.MissingSheetException;
import com.doseobjectives.converter.model.ClinicalGoalRow;
import com.doseobjectives.converter.model.ConstraintColumns;
import com.doseobjectives.converter.model.ConstraintSheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Assembles a {@link ConstraintSheet} from the header and data row events a reader emits.
 * Column indices are translated into canonical column names using the header row.
 *
 * @invariant rows are kept in the order received; fully blank rows are dropped.
 * @invariant the header is taken from the first header event only.
 */
public class SheetRowCollector {

    private static final Logger logger = LoggerFactory.getLogger(SheetRowCollector.class);

    private final String sheetName;
    private final Map<Integer, String> columnNames = new TreeMap<>();
    private final List<ClinicalGoalRow> rows = new ArrayList<>();
    private boolean headerSeen;

    public SheetRowCollector(String sheetName) {
        this.sheetName = sheetName;
    }

    /**
     * @param headerCells 0-based column index to raw header text
     */
    public void onHeader(Map<Integer, String> headerCells) {
        if (headerSeen) {
            logger.warn("Ignoring additional header row for sheet '{}': {}", sheetName, headerCells);
            return;
        }
        headerSeen = true;
        for (Map.Entry<Integer, String> entry : new TreeMap<>(headerCells).entrySet()) {
            String name = ConstraintColumns.canonicalName(entry.getValue());
            if (name.isEmpty()) {
                continue;
            }
            if (columnNames.containsValue(name)) {
                logger.warn("Duplicate column '{}' in sheet '{}'; the first occurrence is used.", name, sheetName);
                continue;
            }
            if (!ConstraintColumns.ALL.contains(name)) {
                logger.debug("Column '{}' in sheet '{}' is not a constraint column; its values are not converted.", name, sheetName);
            }
            columnNames.put(entry.getKey(), name);
        }
        logger.debug("Header of sheet '{}': {}", sheetName, columnNames);
    }

    /**
     * @param rowNumber 1-based spreadsheet row number
     * @param cells 0-based column index to cell text; null values are blank cells
     */
    public void onRow(int rowNumber, Map<Integer, String> cells) {
        if (!headerSeen) {
            throw new IllegalStateException("Data row " + rowNumber + " received before the header row");
        }
        Map<String, String> named = new LinkedHashMap<>();
        boolean blank = true;
        for (Map.Entry<Integer, String> column : columnNames.entrySet()) {
            String value = cells.get(column.getKey());
            String text = value == null ? "" : value.strip();
            named.put(column.getValue(), text);
            blank &= text.isEmpty();
        }
        if (blank) {
            logger.trace("Dropping blank row {}.", rowNumber);
            return;
        }
        rows.add(new ClinicalGoalRow(rowNumber, named));
    }

    public boolean isHeaderSeen() {
        return headerSeen;
    }

    /**
     * @return the collected sheet
     * @throws MissingSheetException if no header row was ever received
     */
    public ConstraintSheet toSheet() {
        if (!headerSeen) {
            throw new MissingSheetException(sheetName, "was not found or has no header row");
        }
        return new ConstraintSheet(sheetName, new ArrayList<>(columnNames.values()), rows);
    }
}
