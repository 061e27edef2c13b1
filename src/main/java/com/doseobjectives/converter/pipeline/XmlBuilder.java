package com.doseobjectives.converter.pipeline;

import com.doseobjectives.converter.document.DoseObjectivesDocument;
import com.doseobjectives.converter.document.MeasureGroup;
import com.doseobjectives.converter.document.MeasureItem;
import com.doseobjectives.converter.document.PreviewHeader;
import com.doseobjectives.converter.model.ClinicalGoal;
import com.doseobjectives.converter.model.Quantity;
import com.doseobjectives.converter.model.StructureIdentity;
import com.doseobjectives.converter.model.TemplateGroup;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Groups resolved goals by TemplateID and builds the DoseObjectives document tree.
 * <p>
 * Group order is the order in which each TemplateID is first met; goals keep their row order
 * inside a group. The importer displays goals in document order, so this ordering is part of
 * the output.
 *
 * @invariant one MeasureItem per (goal, alias) pair, aliases in goal order; with the preview id
 *            alias enabled, the group id is one more alias unless the goal already carries it
 */
public class XmlBuilder {

    public static final String DEFAULT_CODE_SCHEME = "FMA";
    public static final String DEFAULT_CODE_SCHEME_VERSION = "3.2";

    private static final DateTimeFormatter LAST_MODIFIED_FORMAT =
            DateTimeFormatter.ofPattern(" MMMM dd yyyy HH:mm:ss:SSS", Locale.ENGLISH);
    private static final DateTimeFormatter DESCRIPTION_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

    private final Clock clock;
    private final String codeScheme;
    private final String codeSchemeVersion;
    private final String assignedUsers;
    private final boolean addPreviewIdAlias;

    public XmlBuilder(Clock clock) {
        this(clock, DEFAULT_CODE_SCHEME, DEFAULT_CODE_SCHEME_VERSION, "");
    }

    /**
     * @param clock source of the preview timestamps
     * @param codeScheme coding scheme written with structure codes
     * @param codeSchemeVersion version of that scheme
     * @param assignedUsers users the importer assigns the templates to, comma separated
     */
    public XmlBuilder(Clock clock, String codeScheme, String codeSchemeVersion, String assignedUsers) {
        this(clock, codeScheme, codeSchemeVersion, assignedUsers, false);
    }

    /**
     * @param addPreviewIdAlias also emit each goal under the id of the group it lands in
     */
    public XmlBuilder(Clock clock, String codeScheme, String codeSchemeVersion, String assignedUsers,
                      boolean addPreviewIdAlias) {
        this.clock = clock;
        this.codeScheme = codeScheme;
        this.codeSchemeVersion = codeSchemeVersion;
        this.assignedUsers = assignedUsers == null ? "" : assignedUsers;
        this.addPreviewIdAlias = addPreviewIdAlias;
    }

    /**
     * Groups goals by effective TemplateID.
     *
     * @param goals resolved goals in sheet row order
     * @return groups in first-encounter order, each holding its goals in row order
     */
    public List<TemplateGroup> group(List<ClinicalGoal> goals) {
        Map<String, TemplateGroup> groups = new LinkedHashMap<>();
        for (ClinicalGoal goal : goals) {
            groups.computeIfAbsent(goal.getTemplateId(), TemplateGroup::new).add(goal);
        }
        return new ArrayList<>(groups.values());
    }

    /**
     * Builds the document tree.
     *
     * @param groups the template groups in output order
     * @param previewIdOverride replaces the id of the first group when non-blank
     * @param sourceName file name quoted in each preview description
     * @return the document, ready for serialization
     */
    public DoseObjectivesDocument build(List<TemplateGroup> groups, String previewIdOverride, String sourceName) {
        LocalDateTime now = LocalDateTime.now(clock);
        String lastModified = LAST_MODIFIED_FORMAT.format(now);
        String description = "Source: " + sourceName + " | Converted: " + DESCRIPTION_FORMAT.format(now);

        List<MeasureGroup> measureGroups = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            TemplateGroup group = groups.get(i);
            String id = group.getTemplateId();
            if (i == 0 && previewIdOverride != null && !previewIdOverride.isBlank()) {
                id = previewIdOverride.strip();
            }
            List<MeasureItem> items = new ArrayList<>(group.getItemCount());
            for (ClinicalGoal goal : group.getGoals()) {
                for (String alias : itemIds(goal, id)) {
                    items.add(toItem(alias, goal));
                }
            }
            PreviewHeader preview = new PreviewHeader(id, description, assignedUsers, lastModified);
            measureGroups.add(new MeasureGroup(id, preview, items));
        }
        return new DoseObjectivesDocument(measureGroups);
    }

    /**
     * Convenience for {@link #group(List)} followed by {@link #build(List, String, String)}.
     */
    public DoseObjectivesDocument build(List<ClinicalGoal> goals, String sourceName) {
        return build(group(goals), null, sourceName);
    }

    private Collection<String> itemIds(ClinicalGoal goal, String previewId) {
        if (!addPreviewIdAlias) {
            return goal.getAliases();
        }
        Set<String> ids = new LinkedHashSet<>(goal.getAliases());
        ids.add(previewId);
        return ids;
    }

    private MeasureItem toItem(String alias, ClinicalGoal goal) {
        StructureIdentity structure = goal.getStructure();
        Quantity parameter = goal.getMetricParameter().orElse(null);
        return MeasureItem.builder(alias)
                .structure(structure.getCanonicalId(), structure.getCode().orElse(null), codeScheme, codeSchemeVersion)
                .type(goal.getMetric().getFamily().typeCode(parameter), parameter)
                .reportInAbsoluteUnits(goal.getMetric().reportsAbsoluteUnits().orElse(null))
                .priority(goal.getPriority())
                .variationAcceptable(goal.getVariation().orElse(null))
                .build();
    }
}
