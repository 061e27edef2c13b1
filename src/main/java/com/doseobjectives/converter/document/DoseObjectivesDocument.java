package com.doseobjectives.converter.document;

import java.util.List;

/**
 * In-memory tree of a DoseObjectives template file: one {@link MeasureGroup} per TemplateID,
 * in output order.
 */
public final class DoseObjectivesDocument {

    public static final String VERSION = "1.0";

    private final List<MeasureGroup> groups;

    public DoseObjectivesDocument(List<MeasureGroup> groups) {
        this.groups = List.copyOf(groups);
    }

    public List<MeasureGroup> getGroups() {
        return groups;
    }

    public int getItemCount() {
        int count = 0;
        for (MeasureGroup group : groups) {
            count += group.getItems().size();
        }
        return count;
    }
}
