package com.doseobjectives.converter.batch;

import java.util.List;

/**
 * Outcomes of a run, one per input file in processing order.
 */
public final class BatchSummary {

    private final List<FileOutcome> outcomes;

    public BatchSummary(List<FileOutcome> outcomes) {
        this.outcomes = List.copyOf(outcomes);
    }

    public List<FileOutcome> getOutcomes() {
        return outcomes;
    }

    public int getFileCount() {
        return outcomes.size();
    }

    public long count(FileOutcome.Status status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }

    public int getRowErrorCount() {
        return outcomes.stream().mapToInt(o -> o.getRowErrors().size()).sum();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(FileOutcome::isFailed);
    }

    @Override
    public String toString() {
        return outcomes.size() + " file(s): " + count(FileOutcome.Status.CONVERTED) + " converted, "
                + count(FileOutcome.Status.CONVERTED_WITH_ROW_ERRORS) + " converted with row errors, "
                + count(FileOutcome.Status.FAILED) + " failed";
    }
}
