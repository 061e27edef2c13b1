package com.doseobjectives.converter.exception;

/**
 * Thrown when an Evaluation Point or Variation cell cannot be read as a number with an optional unit,
 * when a parametrized metric has no evaluation point, or when the unit does not suit the metric.
 */
public class InvalidEvaluationPointException extends RowValidationException {

    private static final long serialVersionUID = 1L;

    public InvalidEvaluationPointException(int rowNumber, String column, String rawValue, String message) {
        super(rowNumber, column, rawValue, message);
    }

    @Override
    public String getKind() {
        return "INVALID_EVALUATION_POINT";
    }
}
