package com.doseobjectives.converter.core.poi;

import com.doseobjectives.converter.core.SheetRowCollector;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.xssf.eventusermodel.XSSFSheetXMLHandler.SheetContentsHandler;
import org.apache.poi.xssf.usermodel.XSSFComment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

/**
 * {@link SheetContentsHandler} that assembles rows from POI's SAX cell events and hands them
 * to a {@link SheetRowCollector}. The first row of the sheet is the header.
 *
 * @inv {@code currentRowMap} holds the cells of the current row between startRow and endRow.
 */
public class ConstraintSheetContentsHandler implements SheetContentsHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ConstraintSheetContentsHandler.class);
    private static final int HEADER_ROW = 0;

    private final SheetRowCollector collector;
    private final Map<Integer, String> currentRowMap = new TreeMap<>();
    private int currentRowNum = -1;

    public ConstraintSheetContentsHandler(SheetRowCollector collector) {
        this.collector = collector;
    }

    /**
     * @param rowNum 0-based row number
     */
    @Override
    public void startRow(int rowNum) {
        currentRowNum = rowNum;
        currentRowMap.clear();
    }

    @Override
    public void cell(String cellReference, String formattedValue, XSSFComment comment) {
        if (cellReference == null) {
            LOG.warn("Cell reference is null for row {}. Skipping cell.", currentRowNum);
            return;
        }
        int colIdx = new CellReference(cellReference).getCol();
        currentRowMap.put(colIdx, formattedValue);
        LOG.trace("  Cell: {}[{}], Value: '{}'", cellReference, colIdx, formattedValue);
    }

    /**
     * @param rowNum 0-based row number
     * @post the header or data row is passed to the collector; rows above a missing header are ignored
     */
    @Override
    public void endRow(int rowNum) {
        if (currentRowNum != rowNum) {
            LOG.warn("endRow called with rowNum {} but current row is {}.", rowNum, currentRowNum);
        }
        if (!collector.isHeaderSeen()) {
            if (currentRowMap.isEmpty()) {
                return;
            }
            if (rowNum != HEADER_ROW) {
                LOG.warn("Header expected in row 1 but first populated row is {}. Using it as header.", rowNum + 1);
            }
            collector.onHeader(new TreeMap<>(currentRowMap));
            return;
        }
        collector.onRow(rowNum + 1, new TreeMap<>(currentRowMap));
    }

    @Override
    public void headerFooter(String text, boolean isHeader, String tagName) {
        // page headers and footers carry no constraint data
    }
}
