package com.anthem.iamx.graph.model;

import com.anthem.iamx.graph.pattern.PatternSet;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One Allow or Deny rule of a policy document.
 *
 * <p>{@code resources} is null only for trust policy statements, which carry no Resource
 * element and apply to the role that owns them. {@code principals} is empty except on
 * trust policies. The condition block is kept as-is and never evaluated.
 */
@Value
public class Statement {

    int index;
    String sid;
    Effect effect;
    PatternSet actions;
    PatternSet resources;
    Map<String, List<String>> principals;
    JsonNode condition;

    @Builder
    public Statement(int index, String sid, Effect effect, PatternSet actions, PatternSet resources,
                     Map<String, List<String>> principals, JsonNode condition) {
        this.index = index;
        this.sid = sid;
        this.effect = Objects.requireNonNull(effect, "effect");
        this.actions = Objects.requireNonNull(actions, "actions");
        this.resources = resources;
        this.principals = principals == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(principals));
        this.condition = condition;
    }

    public boolean isAllow() {
        return effect == Effect.ALLOW;
    }

    public boolean isDeny() {
        return effect == Effect.DENY;
    }

    public boolean hasCondition() {
        return condition != null && !condition.isNull() && condition.size() > 0;
    }

    /**
     * Resource element, or match-all when the statement has none.
     */
    public PatternSet effectiveResources() {
        return resources != null ? resources : PatternSet.ANY;
    }

    /**
     * Human readable location, e.g. {@code arn:aws:iam::1:policy/p#0(ReadOnly)}.
     */
    public String locationIn(PolicyDocument document) {
        return document.getId() + "#" + index + (sid != null ? "(" + sid + ")" : "");
    }
}
