package com.anthem.iamx.graph.query;

import com.anthem.iamx.graph.exception.InvalidPatternException;
import com.anthem.iamx.graph.pattern.WildcardPattern;

import java.util.regex.Pattern;

/**
 * Validates query patterns against the characters IAM allows in action names and ARNs.
 */
public final class PatternValidator {

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9*?:/._+=,@#${}!~-]+");

    private PatternValidator() {
    }

    /**
     * @param field name used in the error message, e.g. {@code action}
     * @throws InvalidPatternException if the value is empty or has a character outside the alphabet
     */
    public static WildcardPattern validate(String field, String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidPatternException(field, String.valueOf(value), "pattern must not be empty");
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new InvalidPatternException(field, value,
                    "illegal character '" + firstIllegal(value) + "'");
        }
        return WildcardPattern.of(value);
    }

    private static char firstIllegal(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!ALLOWED.matcher(String.valueOf(c)).matches()) {
                return c;
            }
        }
        return value.charAt(0);
    }
}
