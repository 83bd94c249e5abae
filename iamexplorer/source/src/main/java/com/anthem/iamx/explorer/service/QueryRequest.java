package com.anthem.iamx.explorer.service;

import com.anthem.iamx.explorer.exception.InvalidQueryException;
import lombok.Value;

/**
 * One query of a batch: {@code who-can-do <action> [resource]} or
 * {@code what-can-do <identity>}.
 */
@Value
public class QueryRequest {

    public enum Type { WHO_CAN_DO, WHAT_CAN_DO }

    Type type;
    String action;
    String resource;
    String identity;

    public static QueryRequest whoCanDo(String action, String resource) {
        return new QueryRequest(Type.WHO_CAN_DO, action, resource == null ? "*" : resource, null);
    }

    public static QueryRequest whatCanDo(String identity) {
        return new QueryRequest(Type.WHAT_CAN_DO, null, null, identity);
    }

    /**
     * Parse one batch line. Tokens are separated by whitespace.
     *
     * @throws InvalidQueryException if the line names no known query or has the wrong arity
     */
    public static QueryRequest parse(String line) {
        String[] tokens = line.trim().split("\\s+");
        String command = tokens[0];
        if ("who-can-do".equals(command) && (tokens.length == 2 || tokens.length == 3)) {
            return whoCanDo(tokens[1], tokens.length == 3 ? tokens[2] : null);
        }
        if ("what-can-do".equals(command) && tokens.length == 2) {
            return whatCanDo(tokens[1]);
        }
        throw new InvalidQueryException("Cannot parse query '" + line.trim()
                + "'; expected 'who-can-do <action> [resource]' or 'what-can-do <identity>'");
    }

    /**
     * The query as it would be written in a batch file.
     */
    public String describe() {
        return type == Type.WHO_CAN_DO
                ? "who-can-do " + action + " " + resource
                : "what-can-do " + identity;
    }
}
