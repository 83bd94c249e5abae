package com.anthem.iamx.explorer.service;

import com.anthem.iamx.explorer.exception.InvalidQueryException;

public enum OutputFormat {
    TABLE,
    JSON;

    public static OutputFormat from(String value) {
        for (OutputFormat format : values()) {
            if (format.name().equalsIgnoreCase(value)) {
                return format;
            }
        }
        throw new InvalidQueryException("Unknown output format '" + value + "'; expected table or json");
    }
}
