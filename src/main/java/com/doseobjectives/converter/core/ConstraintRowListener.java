package com.doseobjectives.converter.core;

import com.alibaba.excel.context.AnalysisContext;
import com.alibaba.excel.event.AnalysisEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * An EasyExcel {@link AnalysisEventListener} feeding header and data rows of the constraint
 * sheet into a {@link SheetRowCollector}.
 *
 * @invariant rowsReceived counts every data row EasyExcel delivered, blank or not.
 */
public class ConstraintRowListener extends AnalysisEventListener<Map<Integer, String>> {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintRowListener.class);

    private final SheetRowCollector collector;
    private long rowsReceived;

    public ConstraintRowListener(SheetRowCollector collector) {
        this.collector = collector;
    }

    /**
     * Called by EasyExcel for the header row.
     *
     * @param headMap 0-based column index to header text
     * @param context the analysis context
     */
    @Override
    public void invokeHeadMap(Map<Integer, String> headMap, AnalysisContext context) {
        logger.debug("Header row received from sheet '{}': {}", sheetName(context), headMap);
        collector.onHeader(headMap);
    }

    /**
     * Called by EasyExcel for each data row after the header.
     *
     * @param data 0-based column index to cell text
     * @param context the analysis context, used for the row index
     */
    @Override
    public void invoke(Map<Integer, String> data, AnalysisContext context) {
        rowsReceived++;
        int rowNumber = context != null && context.readRowHolder() != null
                ? context.readRowHolder().getRowIndex() + 1
                : (int) rowsReceived + 1;
        collector.onRow(rowNumber, data);
    }

    @Override
    public void doAfterAllAnalysed(AnalysisContext context) {
        logger.debug("Finished analysing sheet '{}'. Data rows received: {}.", sheetName(context), rowsReceived);
    }

    /**
     * Called by EasyExcel if reading fails. Reading problems are fatal for the file, so the
     * exception is rethrown.
     */
    @Override
    public void onException(Exception exception, AnalysisContext context) throws Exception {
        logger.error("Exception while reading sheet '{}' near row {}: {}",
                sheetName(context),
                context != null && context.readRowHolder() != null ? context.readRowHolder().getRowIndex() + 1 : "N/A",
                exception.getMessage());
        throw exception;
    }

    public long getRowsReceived() {
        return rowsReceived;
    }

    private static String sheetName(AnalysisContext context) {
        return context != null && context.readSheetHolder() != null
                ? context.readSheetHolder().getSheetName()
                : "<unknown>";
    }
}
