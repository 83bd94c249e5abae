package com.anthem.iamx.graph.exception;

/**
 * A query pattern is empty or uses characters outside the action/ARN alphabet.
 */
public class InvalidPatternException extends IamGraphException {

    public static final String CODE = "INVALID_PATTERN";

    private final String field;
    private final String pattern;

    public InvalidPatternException(String field, String pattern, String message) {
        super(CODE, String.format("Invalid %s pattern '%s': %s", field, pattern, message));
        this.field = field;
        this.pattern = pattern;
    }

    public String getField() {
        return field;
    }

    public String getPattern() {
        return pattern;
    }
}
