package com.doseobjectives.converter.pipeline;

import com.doseobjectives.converter.exception.InvalidEvaluationPointException;
import com.doseobjectives.converter.exception.InvalidObjectiveException;
import com.doseobjectives.converter.exception.InvalidPriorityException;
import com.doseobjectives.converter.exception.RowValidationException;
import com.doseobjectives.converter.model.ClinicalGoalRow;
import com.doseobjectives.converter.model.Metric;
import com.doseobjectives.converter.model.MetricFamily;
import com.doseobjectives.converter.model.ParsedRow;
import com.doseobjectives.converter.model.Quantity;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.doseobjectives.converter.model.ConstraintColumns.DVH_OBJECTIVE;
import static com.doseobjectives.converter.model.ConstraintColumns.ENDPOINT;
import static com.doseobjectives.converter.model.ConstraintColumns.EVALUATION_POINT;
import static com.doseobjectives.converter.model.ConstraintColumns.ID_ALIASES;
import static com.doseobjectives.converter.model.ConstraintColumns.PRIORITY;
import static com.doseobjectives.converter.model.ConstraintColumns.SOURCE;
import static com.doseobjectives.converter.model.ConstraintColumns.STRUCTURE_CODES;
import static com.doseobjectives.converter.model.ConstraintColumns.STRUCTURE_IDS;
import static com.doseobjectives.converter.model.ConstraintColumns.TEMPLATE_ID;
import static com.doseobjectives.converter.model.ConstraintColumns.VARIATION;
import static com.doseobjectives.converter.model.ConstraintColumns.ZUSATZINFO;

/**
 * Turns a raw {@link ClinicalGoalRow} into a validated {@link ParsedRow}.
 * <p>
 * Pure function of its input: no logging, no state. Validation stops at the first failing
 * column, checked in the order DVH Objective, Priority, Evaluation Point, Variation.
 */
public class RowParser {

    private static final Pattern QUANTITY = Pattern.compile("^(\\d+(?:[.,]\\d+)?|[.,]\\d+)\\s*([A-Za-z%]*)$");

    private final MetricParser metricParser;

    public RowParser() {
        this(new MetricParser());
    }

    public RowParser(MetricParser metricParser) {
        this.metricParser = metricParser;
    }

    /**
     * @param row the raw row
     * @return SKIPPED when "Structure IDs" holds no structure, FAILED with the first validation
     *         error, PARSED otherwise
     */
    public RowParseResult parse(ClinicalGoalRow row) {
        if (IdentityResolver.structureIds(row.get(STRUCTURE_IDS)).isEmpty()) {
            return RowParseResult.skipped(row.getRowNumber());
        }
        try {
            return RowParseResult.parsed(validate(row));
        } catch (RowValidationException e) {
            return RowParseResult.failed(e);
        }
    }

    private ParsedRow validate(ClinicalGoalRow row) throws RowValidationException {
        int rowNumber = row.getRowNumber();

        String objective = row.get(DVH_OBJECTIVE);
        Optional<Metric> parsedMetric = metricParser.parse(objective);
        if (parsedMetric.isEmpty()) {
            throw new InvalidObjectiveException(rowNumber, DVH_OBJECTIVE, objective,
                    metricParser.describeRejection(objective));
        }
        Metric metric = parsedMetric.get();

        int priority = parsePriority(rowNumber, row.get(PRIORITY));
        Quantity evaluationPoint = parseEvaluationPoint(rowNumber, row.get(EVALUATION_POINT), metric);
        Quantity variation = parseQuantity(rowNumber, VARIATION, row.get(VARIATION));

        return ParsedRow.builder(rowNumber)
                .structureIds(row.get(STRUCTURE_IDS))
                .structureCodes(row.get(STRUCTURE_CODES))
                .idAliases(row.get(ID_ALIASES))
                .metric(metric)
                .evaluationPoint(evaluationPoint)
                .variation(variation)
                .priority(priority)
                .templateId(row.get(TEMPLATE_ID))
                .source(row.get(SOURCE))
                .notes(row.get(ZUSATZINFO))
                .endpoint(row.get(ENDPOINT))
                .build();
    }

    /**
     * Priority is taken as written. Spreadsheet numerics such as "2.0" are integers too.
     */
    static int parsePriority(int rowNumber, String raw) throws InvalidPriorityException {
        if (raw.isEmpty()) {
            throw new InvalidPriorityException(rowNumber, PRIORITY, raw, "Priority is required");
        }
        try {
            return new BigDecimal(raw).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidPriorityException(rowNumber, PRIORITY, raw, "Priority must be an integer");
        }
    }

    private Quantity parseEvaluationPoint(int rowNumber, String raw, Metric metric)
            throws InvalidEvaluationPointException {
        Quantity point = parseQuantity(rowNumber, EVALUATION_POINT, raw);
        if (!metric.requiresEvaluationPoint()) {
            return point;
        }
        MetricFamily family = metric.getFamily();
        if (point == null) {
            throw new InvalidEvaluationPointException(rowNumber, EVALUATION_POINT, raw,
                    "an evaluation point is required for " + family.getLabel());
        }
        String unit = point.getUnit().orElse(null);
        Optional<String> canonical = family.canonicalUnit(unit);
        if (canonical.isEmpty()) {
            throw new InvalidEvaluationPointException(rowNumber, EVALUATION_POINT, raw,
                    "unit '" + (unit == null ? "" : unit) + "' is not valid for " + family.getLabel()
                            + "; expected one of " + family.getParameterUnits());
        }
        return point.withUnit(canonical.get());
    }

    /**
     * Splits "20Gy" into 20 and "Gy". Both '.' and ',' are read as the decimal separator.
     *
     * @return the quantity, or null when the cell is blank
     */
    static Quantity parseQuantity(int rowNumber, String column, String raw) throws InvalidEvaluationPointException {
        if (raw.isEmpty()) {
            return null;
        }
        Matcher m = QUANTITY.matcher(raw);
        if (!m.matches()) {
            throw new InvalidEvaluationPointException(rowNumber, column, raw,
                    "expected a number followed by an optional unit, e.g. 20Gy or 5%");
        }
        String number = m.group(1).replace(',', '.');
        if (number.startsWith(".")) {
            number = "0" + number;
        }
        return new Quantity(new BigDecimal(number), m.group(2));
    }
}
