package com.doseobjectives.converter.document;

import com.doseobjectives.converter.model.Quantity;

import java.util.Optional;

/**
 * One exported clinical goal entry.
 * <p>
 * Holds exactly the exported fields: entry id, structure reference, metric type with its
 * parameter and reporting flag, priority and acceptable variation. QA columns of the sheet
 * have no place here.
 */
public final class MeasureItem {

    private final String id;
    private final String structureId;
    private final Long structureCode;
    private final String codeScheme;
    private final String codeSchemeVersion;
    private final int type;
    private final Quantity typeSpecifier;
    private final Boolean reportInAbsoluteUnits;
    private final int priority;
    private final Quantity variationAcceptable;

    private MeasureItem(Builder builder) {
        this.id = builder.id;
        this.structureId = builder.structureId;
        this.structureCode = builder.structureCode;
        this.codeScheme = builder.codeScheme;
        this.codeSchemeVersion = builder.codeSchemeVersion;
        this.type = builder.type;
        this.typeSpecifier = builder.typeSpecifier;
        this.reportInAbsoluteUnits = builder.reportInAbsoluteUnits;
        this.priority = builder.priority;
        this.variationAcceptable = builder.variationAcceptable;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getStructureId() {
        return structureId;
    }

    public Optional<Long> getStructureCode() {
        return Optional.ofNullable(structureCode);
    }

    public String getCodeScheme() {
        return codeScheme;
    }

    public String getCodeSchemeVersion() {
        return codeSchemeVersion;
    }

    public int getType() {
        return type;
    }

    public Optional<Quantity> getTypeSpecifier() {
        return Optional.ofNullable(typeSpecifier);
    }

    public Optional<Boolean> getReportInAbsoluteUnits() {
        return Optional.ofNullable(reportInAbsoluteUnits);
    }

    public int getPriority() {
        return priority;
    }

    public Optional<Quantity> getVariationAcceptable() {
        return Optional.ofNullable(variationAcceptable);
    }

    public static final class Builder {
        private final String id;
        private String structureId;
        private Long structureCode;
        private String codeScheme;
        private String codeSchemeVersion;
        private int type;
        private Quantity typeSpecifier;
        private Boolean reportInAbsoluteUnits;
        private int priority;
        private Quantity variationAcceptable;

        private Builder(String id) {
            this.id = id;
        }

        public Builder structure(String structureId, Long code, String codeScheme, String codeSchemeVersion) {
            this.structureId = structureId;
            this.structureCode = code;
            this.codeScheme = codeScheme;
            this.codeSchemeVersion = codeSchemeVersion;
            return this;
        }

        public Builder type(int type, Quantity typeSpecifier) {
            this.type = type;
            this.typeSpecifier = typeSpecifier;
            return this;
        }

        public Builder reportInAbsoluteUnits(Boolean value) {
            this.reportInAbsoluteUnits = value;
            return this;
        }

        public Builder priority(int value) {
            this.priority = value;
            return this;
        }

        public Builder variationAcceptable(Quantity value) {
            this.variationAcceptable = value;
            return this;
        }

        public MeasureItem build() {
            if (id == null || id.isBlank() || structureId == null) {
                throw new IllegalStateException("Measure item needs an id and a structure");
            }
            return new MeasureItem(this);
        }
    }
}
