package com.doseobjectives.converter.pipeline;

import com.doseobjectives.converter.document.DoseObjectivesDocument;
import com.doseobjectives.converter.model.ClinicalGoal;
import com.doseobjectives.converter.model.RowError;
import com.doseobjectives.converter.model.TemplateGroup;

import java.util.List;

/**
 * Everything one sheet conversion produced: the resolved goals, their grouping, the document
 * tree, and the rows that were skipped or rejected.
 */
public final class ConversionResult {

    private final List<ClinicalGoal> goals;
    private final List<TemplateGroup> groups;
    private final DoseObjectivesDocument document;
    private final List<RowError> rowErrors;
    private final int skippedRows;

    public ConversionResult(List<ClinicalGoal> goals, List<TemplateGroup> groups, DoseObjectivesDocument document,
                            List<RowError> rowErrors, int skippedRows) {
        this.goals = List.copyOf(goals);
        this.groups = List.copyOf(groups);
        this.document = document;
        this.rowErrors = List.copyOf(rowErrors);
        this.skippedRows = skippedRows;
    }

    public List<ClinicalGoal> getGoals() {
        return goals;
    }

    public List<TemplateGroup> getGroups() {
        return groups;
    }

    public DoseObjectivesDocument getDocument() {
        return document;
    }

    public List<RowError> getRowErrors() {
        return rowErrors;
    }

    public int getSkippedRows() {
        return skippedRows;
    }

    public boolean hasRowErrors() {
        return !rowErrors.isEmpty();
    }
}
