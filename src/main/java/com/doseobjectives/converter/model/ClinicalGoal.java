package com.doseobjectives.converter.model;

import java.util.List;
import java.util.Optional;

/**
 * A fully resolved clinical goal, ready to be grouped and written.
 * <p>
 * Source, raw TemplateID, notes and endpoint are carried for QA inspection and logging only.
 * They are never part of the exported document.
 *
 * @invariant aliases is non-empty, holds no blank or duplicate entries, first-seen order.
 * @invariant evaluationPoint is present whenever the metric requires it.
 */
public final class ClinicalGoal {

    private final int rowNumber;
    private final StructureIdentity structure;
    private final List<String> aliases;
    private final Metric metric;
    private final Quantity evaluationPoint;
    private final Quantity variation;
    private final int priority;
    private final String templateId;
    private final boolean templateIdOverridden;
    private final String source;
    private final String rawTemplateId;
    private final String notes;
    private final String endpoint;

    /**
     * @param row the validated row this goal comes from
     * @param structure the resolved structure identity
     * @param aliases the output entry identifiers, see invariant
     * @param assignment the TemplateID decided by the rule engine
     * @throws IllegalArgumentException if aliases is empty or the evaluation point is missing
     */
    public ClinicalGoal(ParsedRow row, StructureIdentity structure, List<String> aliases,
                        TemplateAssignment assignment) {
        if (aliases.isEmpty()) {
            throw new IllegalArgumentException("Row " + row.getRowNumber() + " resolved to no aliases");
        }
        if (row.getMetric().requiresEvaluationPoint() && row.getEvaluationPoint().isEmpty()) {
            throw new IllegalArgumentException("Row " + row.getRowNumber() + " has no evaluation point for "
                    + row.getMetric().getFamily().getLabel());
        }
        this.rowNumber = row.getRowNumber();
        this.structure = structure;
        this.aliases = List.copyOf(aliases);
        this.metric = row.getMetric();
        this.evaluationPoint = row.getEvaluationPoint().orElse(null);
        this.variation = row.getVariation().orElse(null);
        this.priority = row.getPriority();
        this.templateId = assignment.getEffectiveTemplateId();
        this.templateIdOverridden = assignment.isOverridden();
        this.source = row.getSource();
        this.rawTemplateId = row.getTemplateId();
        this.notes = row.getNotes();
        this.endpoint = row.getEndpoint();
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public StructureIdentity getStructure() {
        return structure;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public Metric getMetric() {
        return metric;
    }

    public Optional<Quantity> getEvaluationPoint() {
        return Optional.ofNullable(evaluationPoint);
    }

    /**
     * The value substituted into a parametrized metric: the inline parameter when the objective
     * has one, the evaluation point otherwise.
     *
     * @return the metric parameter, empty for fixed-form metrics
     */
    public Optional<Quantity> getMetricParameter() {
        if (!metric.getFamily().isParametrized()) {
            return Optional.empty();
        }
        return metric.getInlineParameter().or(this::getEvaluationPoint);
    }

    public Optional<Quantity> getVariation() {
        return Optional.ofNullable(variation);
    }

    public int getPriority() {
        return priority;
    }

    /** Effective TemplateID after the override rule. */
    public String getTemplateId() {
        return templateId;
    }

    public boolean isTemplateIdOverridden() {
        return templateIdOverridden;
    }

    public String getSource() {
        return source;
    }

    public String getRawTemplateId() {
        return rawTemplateId;
    }

    public String getNotes() {
        return notes;
    }

    public String getEndpoint() {
        return endpoint;
    }

    @Override
    public String toString() {
        return "ClinicalGoal{row=" + rowNumber + ", structure=" + structure + ", aliases=" + aliases
                + ", metric=" + metric + ", priority=" + priority + ", templateId=" + templateId + '}';
    }
}
