package com.doseobjectives.converter.core.writers;

import com.doseobjectives.converter.document.DoseObjectivesDocument;
import com.doseobjectives.converter.document.MeasureGroup;
import com.doseobjectives.converter.document.MeasureItem;
import com.doseobjectives.converter.document.PreviewHeader;
import com.doseobjectives.converter.model.Quantity;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;

import java.util.ArrayList;
import java.util.List;

/**
 * Jackson XML binding of the importer's DoseObjectives vocabulary. Element and attribute names
 * are fixed by the importer.
 */
final class DoseObjectivesXmlTree {

    static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";
    static final String PRESCRIPTION_VERSION = "1.10";

    private DoseObjectivesXmlTree() {
    }

    static Root from(DoseObjectivesDocument document) {
        List<Group> groups = new ArrayList<>(document.getGroups().size());
        for (MeasureGroup group : document.getGroups()) {
            List<Item> items = new ArrayList<>(group.getItems().size());
            for (MeasureItem item : group.getItems()) {
                items.add(new Item(item));
            }
            groups.add(new Group(group.getId(), new Preview(group.getPreview()), new Prescription(items)));
        }
        return new Root(groups);
    }

    @JacksonXmlRootElement(localName = "DoseObjectives")
    @JsonPropertyOrder({"Version", "xmlns:xsi", "MeasureGroup"})
    public static final class Root {

        @JacksonXmlProperty(isAttribute = true, localName = "Version")
        public final String version = DoseObjectivesDocument.VERSION;

        // written as a plain attribute, the importer does not bind the prefix
        @JacksonXmlProperty(isAttribute = true, localName = "xmlns:xsi")
        public final String xsiNamespace = XSI_NAMESPACE;

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "MeasureGroup")
        public final List<Group> groups;

        Root(List<Group> groups) {
            this.groups = groups;
        }
    }

    @JsonPropertyOrder({"ID", "Preview", "Prescription"})
    public static final class Group {

        @JacksonXmlProperty(isAttribute = true, localName = "ID")
        public final String id;

        @JacksonXmlProperty(localName = "Preview")
        public final Preview preview;

        @JacksonXmlProperty(localName = "Prescription")
        public final Prescription prescription;

        Group(String id, Preview preview, Prescription prescription) {
            this.id = id;
            this.preview = preview;
            this.prescription = prescription;
        }
    }

    @JsonPropertyOrder({"Version", "ID", "Type", "ApprovalStatus", "Diagnosis", "TreatmentSite", "Description",
            "AssignedUsers", "LastModified", "ApprovalHistory"})
    public static final class Preview {

        @JacksonXmlProperty(isAttribute = true, localName = "Version")
        public final String version = PreviewHeader.VERSION;

        @JacksonXmlProperty(isAttribute = true, localName = "ID")
        public final String id;

        @JacksonXmlProperty(isAttribute = true, localName = "Type")
        public final String type = PreviewHeader.TYPE;

        @JacksonXmlProperty(isAttribute = true, localName = "ApprovalStatus")
        public final String approvalStatus = PreviewHeader.APPROVAL_STATUS;

        @JacksonXmlProperty(isAttribute = true, localName = "Diagnosis")
        public final String diagnosis = "";

        @JacksonXmlProperty(isAttribute = true, localName = "TreatmentSite")
        public final String treatmentSite = "";

        @JacksonXmlProperty(isAttribute = true, localName = "Description")
        public final String description;

        @JacksonXmlProperty(isAttribute = true, localName = "AssignedUsers")
        public final String assignedUsers;

        @JacksonXmlProperty(isAttribute = true, localName = "LastModified")
        public final String lastModified;

        @JacksonXmlProperty(isAttribute = true, localName = "ApprovalHistory")
        public final String approvalHistory;

        Preview(PreviewHeader header) {
            this.id = header.getId();
            this.description = header.getDescription();
            this.assignedUsers = header.getAssignedUsers();
            this.lastModified = header.getLastModified();
            this.approvalHistory = header.getApprovalHistory();
        }
    }

    @JsonPropertyOrder({"Version", "MeasureItem"})
    public static final class Prescription {

        @JacksonXmlProperty(isAttribute = true, localName = "Version")
        public final String version = PRESCRIPTION_VERSION;

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "MeasureItem")
        public final List<Item> items;

        Prescription(List<Item> items) {
            this.items = items;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"ID", "Structure", "Type", "TypeSpecifier", "ReportDQPValueInAbsoluteUnits", "Priority",
            "VariationAcceptable"})
    public static final class Item {

        @JacksonXmlProperty(isAttribute = true, localName = "ID")
        public final String id;

        @JacksonXmlProperty(localName = "Structure")
        public final Structure structure;

        @JacksonXmlProperty(localName = "Type")
        public final int type;

        @JacksonXmlProperty(localName = "TypeSpecifier")
        public final Value typeSpecifier;

        @JacksonXmlProperty(localName = "ReportDQPValueInAbsoluteUnits")
        public final String reportInAbsoluteUnits;

        @JacksonXmlProperty(localName = "Priority")
        public final int priority;

        @JacksonXmlProperty(localName = "VariationAcceptable")
        public final Value variationAcceptable;

        Item(MeasureItem item) {
            this.id = item.getId();
            this.structure = new Structure(item);
            this.type = item.getType();
            this.typeSpecifier = item.getTypeSpecifier()
                    .map(p -> new Value(DoseObjectivesXmlWriter.formatParameter(p), p))
                    .orElse(null);
            this.reportInAbsoluteUnits = item.getReportInAbsoluteUnits().map(Object::toString).orElse(null);
            this.priority = item.getPriority();
            this.variationAcceptable = item.getVariationAcceptable()
                    .map(v -> new Value(DoseObjectivesXmlWriter.formatDecimal(v.getValue()), v))
                    .orElse(null);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"ID", "StructureCode"})
    public static final class Structure {

        @JacksonXmlProperty(isAttribute = true, localName = "ID")
        public final String id;

        @JacksonXmlProperty(localName = "StructureCode")
        public final StructureCode code;

        Structure(MeasureItem item) {
            this.id = item.getStructureId();
            this.code = item.getStructureCode()
                    .map(c -> new StructureCode(c, item.getCodeScheme(), item.getCodeSchemeVersion()))
                    .orElse(null);
        }
    }

    @JsonPropertyOrder({"Code", "CodeScheme", "CodeSchemeVersion"})
    public static final class StructureCode {

        @JacksonXmlProperty(isAttribute = true, localName = "Code")
        public final String code;

        @JacksonXmlProperty(isAttribute = true, localName = "CodeScheme")
        public final String codeScheme;

        @JacksonXmlProperty(isAttribute = true, localName = "CodeSchemeVersion")
        public final String codeSchemeVersion;

        StructureCode(long code, String codeScheme, String codeSchemeVersion) {
            this.code = Long.toString(code);
            this.codeScheme = codeScheme;
            this.codeSchemeVersion = codeSchemeVersion;
        }
    }

    /** A formatted number with an optional {@code Unit} attribute. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"Unit", "value"})
    public static final class Value {

        @JacksonXmlProperty(isAttribute = true, localName = "Unit")
        public final String unit;

        @JacksonXmlText
        public final String value;

        Value(String formatted, Quantity quantity) {
            this.unit = quantity.getUnit().orElse(null);
            this.value = formatted;
        }
    }
}
