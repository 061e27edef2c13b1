package com.doseobjectives.converter.batch;

import com.doseobjectives.converter.model.RowError;
import com.doseobjectives.converter.pipeline.ConversionResult;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * What happened to one input file.
 */
public final class FileOutcome {

    public enum Status {
        CONVERTED,
        CONVERTED_WITH_ROW_ERRORS,
        FAILED
    }

    private final Path source;
    private final Path output;
    private final Status status;
    private final int goalCount;
    private final int groupCount;
    private final int itemCount;
    private final int skippedRows;
    private final List<RowError> rowErrors;
    private final String failureMessage;

    private FileOutcome(Path source, Path output, Status status, int goalCount, int groupCount, int itemCount,
                        int skippedRows, List<RowError> rowErrors, String failureMessage) {
        this.source = source;
        this.output = output;
        this.status = status;
        this.goalCount = goalCount;
        this.groupCount = groupCount;
        this.itemCount = itemCount;
        this.skippedRows = skippedRows;
        this.rowErrors = List.copyOf(rowErrors);
        this.failureMessage = failureMessage;
    }

    public static FileOutcome converted(Path source, Path output, ConversionResult result) {
        Status status = result.hasRowErrors() ? Status.CONVERTED_WITH_ROW_ERRORS : Status.CONVERTED;
        return new FileOutcome(source, output, status, result.getGoals().size(), result.getGroups().size(),
                result.getDocument().getItemCount(), result.getSkippedRows(), result.getRowErrors(), null);
    }

    public static FileOutcome failed(Path source, String failureMessage) {
        return new FileOutcome(source, null, Status.FAILED, 0, 0, 0, 0, Collections.emptyList(), failureMessage);
    }

    public Path getSource() {
        return source;
    }

    public Optional<Path> getOutput() {
        return Optional.ofNullable(output);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public int getGoalCount() {
        return goalCount;
    }

    public int getGroupCount() {
        return groupCount;
    }

    public int getItemCount() {
        return itemCount;
    }

    public int getSkippedRows() {
        return skippedRows;
    }

    public List<RowError> getRowErrors() {
        return rowErrors;
    }

    public Optional<String> getFailureMessage() {
        return Optional.ofNullable(failureMessage);
    }

    @Override
    public String toString() {
        if (isFailed()) {
            return source.getFileName() + ": FAILED (" + failureMessage + ")";
        }
        return source.getFileName() + ": " + status + " -> " + output.getFileName() + " (" + itemCount
                + " items, " + rowErrors.size() + " row errors, " + skippedRows + " skipped)";
    }
}
