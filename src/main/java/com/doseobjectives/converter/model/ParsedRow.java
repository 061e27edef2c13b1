package com.doseobjectives.converter.model;

import java.util.Optional;

/**
 * A row that passed validation: every field typed, nothing resolved yet.
 * Structure identity, aliases and the effective TemplateID are derived from it downstream.
 */
public final class ParsedRow {

    private final int rowNumber;
    private final String structureIds;
    private final String structureCodes;
    private final String idAliases;
    private final Metric metric;
    private final Quantity evaluationPoint;
    private final Quantity variation;
    private final int priority;
    private final String templateId;
    private final String source;
    private final String notes;
    private final String endpoint;

    private ParsedRow(Builder builder) {
        this.rowNumber = builder.rowNumber;
        this.structureIds = builder.structureIds;
        this.structureCodes = builder.structureCodes;
        this.idAliases = builder.idAliases;
        this.metric = builder.metric;
        this.evaluationPoint = builder.evaluationPoint;
        this.variation = builder.variation;
        this.priority = builder.priority;
        this.templateId = builder.templateId;
        this.source = builder.source;
        this.notes = builder.notes;
        this.endpoint = builder.endpoint;
    }

    public static Builder builder(int rowNumber) {
        return new Builder(rowNumber);
    }

    public int getRowNumber() {
        return rowNumber;
    }

    /** Raw "Structure IDs" text, trimmed. */
    public String getStructureIds() {
        return structureIds;
    }

    public String getStructureCodes() {
        return structureCodes;
    }

    public String getIdAliases() {
        return idAliases;
    }

    public Metric getMetric() {
        return metric;
    }

    public Optional<Quantity> getEvaluationPoint() {
        return Optional.ofNullable(evaluationPoint);
    }

    public Optional<Quantity> getVariation() {
        return Optional.ofNullable(variation);
    }

    public int getPriority() {
        return priority;
    }

    /** Raw "TemplateID" text, before the override rule is applied. */
    public String getTemplateId() {
        return templateId;
    }

    public String getSource() {
        return source;
    }

    public String getNotes() {
        return notes;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public static final class Builder {
        private final int rowNumber;
        private String structureIds = "";
        private String structureCodes = "";
        private String idAliases = "";
        private Metric metric;
        private Quantity evaluationPoint;
        private Quantity variation;
        private int priority;
        private String templateId = "";
        private String source = "";
        private String notes = "";
        private String endpoint = "";

        private Builder(int rowNumber) {
            this.rowNumber = rowNumber;
        }

        public Builder structureIds(String value) {
            this.structureIds = value;
            return this;
        }

        public Builder structureCodes(String value) {
            this.structureCodes = value;
            return this;
        }

        public Builder idAliases(String value) {
            this.idAliases = value;
            return this;
        }

        public Builder metric(Metric value) {
            this.metric = value;
            return this;
        }

        public Builder evaluationPoint(Quantity value) {
            this.evaluationPoint = value;
            return this;
        }

        public Builder variation(Quantity value) {
            this.variation = value;
            return this;
        }

        public Builder priority(int value) {
            this.priority = value;
            return this;
        }

        public Builder templateId(String value) {
            this.templateId = value;
            return this;
        }

        public Builder source(String value) {
            this.source = value;
            return this;
        }

        public Builder notes(String value) {
            this.notes = value;
            return this;
        }

        public Builder endpoint(String value) {
            this.endpoint = value;
            return this;
        }

        public ParsedRow build() {
            if (metric == null) {
                throw new IllegalStateException("metric is required");
            }
            return new ParsedRow(this);
        }
    }
}
