package com.record.dedup.core.exception;

/**
 * Thrown when a run parameter is outside its accepted range.
 * Raised before any processing starts.
 */
public class InvalidParameterException extends IllegalArgumentException {

    private final String parameter;

    public InvalidParameterException(String parameter, String message) {
        super(parameter + " " + message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }

    /**
     * Ensures {@code value} lies in {@code [min, max]}.
     */
    public static double requireInRange(String parameter, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new InvalidParameterException(parameter,
                    "must be between " + min + " and " + max + ", got " + value);
        }
        return value;
    }

    /**
     * Ensures {@code value} lies in {@code [min, max]}.
     */
    public static int requireInRange(String parameter, int value, int min, int max) {
        if (value < min || value > max) {
            throw new InvalidParameterException(parameter,
                    "must be between " + min + " and " + max + ", got " + value);
        }
        return value;
    }
}
