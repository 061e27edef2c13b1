package com.doseobjectives.converter.pipeline;

import com.doseobjectives.converter.model.ParsedRow;
import com.doseobjectives.converter.model.TemplateAssignment;

import java.util.List;

/**
 * Decides the effective TemplateID of a row.
 * <p>
 * Rows whose raw "Structure IDs" text contains "Conv" or "Fx" are grouped under that text,
 * whatever the TemplateID column says. The test is a case-sensitive substring search over the
 * whole cell, so a name such as "Converted_Bladder" matches as well. Every other row uses its
 * TemplateID cell, or {@value #DEFAULT_TEMPLATE_ID} when that cell is blank.
 */
public class TemplateIdRule {

    public static final String DEFAULT_TEMPLATE_ID = "ClinicalGoals";

    private static final List<String> OVERRIDE_MARKERS = List.of("Conv", "Fx");

    /**
     * @param structureIds the raw "Structure IDs" text
     * @return true when the TemplateID override applies
     */
    public boolean matches(String structureIds) {
        if (structureIds == null) {
            return false;
        }
        for (String marker : OVERRIDE_MARKERS) {
            if (structureIds.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    public TemplateAssignment apply(ParsedRow row) {
        String structureIds = row.getStructureIds().strip();
        if (matches(structureIds)) {
            return new TemplateAssignment(structureIds, true);
        }
        String templateId = row.getTemplateId().strip();
        return new TemplateAssignment(templateId.isEmpty() ? DEFAULT_TEMPLATE_ID : templateId, false);
    }
}
