package com.doseobjectives.converter.pipeline;

import com.doseobjectives.converter.document.DoseObjectivesDocument;
import com.doseobjectives.converter.exception.MissingColumnException;
import com.doseobjectives.converter.exception.RowValidationException;
import com.doseobjectives.converter.model.ClinicalGoal;
import com.doseobjectives.converter.model.ClinicalGoalRow;
import com.doseobjectives.converter.model.ConstraintColumns;
import com.doseobjectives.converter.model.ConstraintSheet;
import com.doseobjectives.converter.model.ParsedRow;
import com.doseobjectives.converter.model.RowError;
import com.doseobjectives.converter.model.StructureIdentity;
import com.doseobjectives.converter.model.TemplateAssignment;
import com.doseobjectives.converter.model.TemplateGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts one constraint sheet into a DoseObjectives document tree.
 * <p>
 * Stages: {@link RowParser} → {@link TemplateIdRule} → {@link IdentityResolver} →
 * {@link XmlBuilder}. Row-level failures are collected and logged; they never stop the
 * remaining rows.
 *
 * @invariant no state survives a call to {@link #convert}; instances may be reused across files.
 */
public class ConversionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ConversionPipeline.class);

    private final RowParser rowParser;
    private final TemplateIdRule templateIdRule;
    private final IdentityResolver identityResolver;
    private final XmlBuilder xmlBuilder;

    public ConversionPipeline(RowParser rowParser, TemplateIdRule templateIdRule,
                              IdentityResolver identityResolver, XmlBuilder xmlBuilder) {
        this.rowParser = rowParser;
        this.templateIdRule = templateIdRule;
        this.identityResolver = identityResolver;
        this.xmlBuilder = xmlBuilder;
    }

    /**
     * @param sheet the rows to convert
     * @param previewIdOverride optional id for the first group, may be null
     * @param sourceName name of the source file, quoted in the preview description
     * @return goals, groups, document and collected row errors
     * @throws MissingColumnException if a required column is absent
     */
    public ConversionResult convert(ConstraintSheet sheet, String previewIdOverride, String sourceName) {
        sheet.requireColumns(ConstraintColumns.REQUIRED);
        logger.debug("Converting sheet '{}' with {} rows. Headers: {}",
                sheet.getSheetName(), sheet.getRows().size(), sheet.getHeaders());

        List<ClinicalGoal> goals = new ArrayList<>();
        List<RowError> rowErrors = new ArrayList<>();
        int skipped = 0;

        for (ClinicalGoalRow row : sheet.getRows()) {
            RowParseResult result = rowParser.parse(row);
            switch (result.getStatus()) {
                case SKIPPED:
                    skipped++;
                    logger.debug("Row {} has no structure id, skipped.", row.getRowNumber());
                    break;
                case FAILED:
                    RowValidationException error = result.getError();
                    logger.warn("Rejected {}", error.getMessage());
                    rowErrors.add(RowError.from(error));
                    break;
                case PARSED:
                default:
                    goals.add(resolve(result.getParsedRow()));
                    break;
            }
        }

        List<TemplateGroup> groups = xmlBuilder.group(goals);
        DoseObjectivesDocument document = xmlBuilder.build(groups, previewIdOverride, sourceName);
        logger.info("Sheet '{}': {} goals in {} template group(s), {} measure items, {} skipped, {} rejected.",
                sheet.getSheetName(), goals.size(), groups.size(), document.getItemCount(), skipped, rowErrors.size());
        return new ConversionResult(goals, groups, document, rowErrors, skipped);
    }

    private ClinicalGoal resolve(ParsedRow row) {
        TemplateAssignment assignment = templateIdRule.apply(row);
        if (assignment.isOverridden()) {
            logger.info("Row {}: TemplateID '{}' overridden to '{}' (structure ids contain Conv/Fx).",
                    row.getRowNumber(), row.getTemplateId(), assignment.getEffectiveTemplateId());
        }
        StructureIdentity identity = identityResolver.resolveIdentity(row);
        List<String> aliases = identityResolver.resolveAliases(row, identity);
        ClinicalGoal goal = new ClinicalGoal(row, identity, aliases, assignment);
        logger.trace("Resolved {}", goal);
        return goal;
    }
}
