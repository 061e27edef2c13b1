package com.doseobjectives.converter.model;

/**
 * Outcome of the TemplateID rule for one row: the effective grouping key and whether the
 * rule replaced the sheet's TemplateID value.
 */
public final class TemplateAssignment {

    private final String effectiveTemplateId;
    private final boolean overridden;

    public TemplateAssignment(String effectiveTemplateId, boolean overridden) {
        this.effectiveTemplateId = effectiveTemplateId;
        this.overridden = overridden;
    }

    public String getEffectiveTemplateId() {
        return effectiveTemplateId;
    }

    public boolean isOverridden() {
        return overridden;
    }

    @Override
    public String toString() {
        return effectiveTemplateId + (overridden ? " (overridden)" : "");
    }
}
