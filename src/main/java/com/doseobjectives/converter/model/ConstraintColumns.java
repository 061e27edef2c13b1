package com.doseobjectives.converter.model;

import java.util.List;
import java.util.Map;

/**
 * Column names recognized on the "Constraints" worksheet.
 * <p>
 * Headers are matched after trimming. A few historical spellings found in existing template
 * workbooks are mapped onto the canonical names by {@link #canonicalName(String)}.
 */
public final class ConstraintColumns {

    public static final String DEFAULT_SHEET_NAME = "Constraints";

    public static final String STRUCTURE_IDS = "Structure IDs";
    public static final String STRUCTURE_CODES = "Structure Codes";
    public static final String ID_ALIASES = "IDAliases";
    public static final String DVH_OBJECTIVE = "DVH Objective";
    public static final String EVALUATION_POINT = "Evaluation Point";
    public static final String VARIATION = "Variation";
    public static final String PRIORITY = "Priority";

    // Informational only, never exported
    public static final String SOURCE = "Source";
    public static final String TEMPLATE_ID = "TemplateID";
    public static final String ZUSATZINFO = "ZusatzInfo";
    public static final String ENDPOINT = "Endpoint (grade ≥ 3)";

    public static final List<String> REQUIRED = List.of(STRUCTURE_IDS, DVH_OBJECTIVE, PRIORITY);

    public static final List<String> ALL = List.of(
            STRUCTURE_IDS, STRUCTURE_CODES, ID_ALIASES, DVH_OBJECTIVE, EVALUATION_POINT,
            VARIATION, SOURCE, PRIORITY, TEMPLATE_ID, ZUSATZINFO, ENDPOINT);

    private static final Map<String, String> VARIANT_SPELLINGS = Map.of(
            "Zusatzinfo", ZUSATZINFO,
            "Endpoint (grade >= 3)", ENDPOINT,
            "Endpoint (grade >=3)", ENDPOINT);

    private ConstraintColumns() {
    }

    /**
     * Maps a raw header cell onto the canonical column name.
     *
     * @param header the raw header text, may be null
     * @return the canonical name for known variants, otherwise the trimmed header ("" for null)
     */
    public static String canonicalName(String header) {
        if (header == null) {
            return "";
        }
        String trimmed = header.replace("\uFEFF", "").strip();
        return VARIANT_SPELLINGS.getOrDefault(trimmed, trimmed);
    }
}
