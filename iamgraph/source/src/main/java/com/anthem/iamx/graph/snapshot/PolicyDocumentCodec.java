package com.anthem.iamx.graph.snapshot;

import com.anthem.iamx.graph.exception.MalformedEntityException;
import com.anthem.iamx.graph.model.Effect;
import com.anthem.iamx.graph.model.PolicyDocument;
import com.anthem.iamx.graph.model.PolicyKind;
import com.anthem.iamx.graph.model.Statement;
import com.anthem.iamx.graph.pattern.PatternSet;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between the AWS policy JSON grammar and {@link PolicyDocument}.
 *
 * <p>Accepts the shapes IAM produces: {@code Statement} as an object or an array,
 * {@code Action}/{@code Resource} (and their {@code Not} forms) as a string or an array,
 * {@code Principal} as {@code "*"} or an object of string/array values. A document may
 * also arrive as a JSON string, URL-encoded or not, as returned by the IAM API.
 */
public class PolicyDocumentCodec {

    private static final String DEFAULT_VERSION = "2012-10-17";
    private static final String AWS_PRINCIPAL = "AWS";

    private final ObjectMapper objectMapper;

    public PolicyDocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse and validate a policy document.
     *
     * @param raw       document JSON (object or encoded string)
     * @param kind      managed, inline or trust
     * @param id        document identifier used in error messages
     * @param name      policy or inline name
     * @param ownerArn  owning identity for inline and trust documents
     * @param awsManaged whether a managed policy is AWS-managed
     */
    public PolicyDocument parse(JsonNode raw, PolicyKind kind, String id, String name,
                                String ownerArn, boolean awsManaged) {
        JsonNode document = unwrap(raw, id);
        if (!document.isObject()) {
            throw new MalformedEntityException(id, "policy document must be a JSON object");
        }

        JsonNode statementNode = document.path("Statement");
        if (statementNode.isMissingNode() || statementNode.isNull()) {
            throw new MalformedEntityException(id, "policy document has no Statement element");
        }

        List<Statement> statements = new ArrayList<>();
        if (statementNode.isArray()) {
            int index = 0;
            for (JsonNode node : statementNode) {
                statements.add(parseStatement(node, index++, kind, id));
            }
        } else {
            statements.add(parseStatement(statementNode, 0, kind, id));
        }

        return PolicyDocument.builder()
                .id(id)
                .name(name)
                .kind(kind)
                .ownerArn(ownerArn)
                .awsManaged(awsManaged)
                .version(document.path("Version").asText(DEFAULT_VERSION))
                .statements(statements)
                .build();
    }

    /**
     * Render a document back to the policy grammar. Lists are always written as arrays.
     */
    public ObjectNode toJson(PolicyDocument document) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("Version", document.getVersion() != null ? document.getVersion() : DEFAULT_VERSION);
        ArrayNode statements = root.putArray("Statement");

        for (Statement statement : document.getStatements()) {
            ObjectNode node = statements.addObject();
            if (statement.getSid() != null) {
                node.put("Sid", statement.getSid());
            }
            node.put("Effect", statement.getEffect().getValue());
            if (!statement.getPrincipals().isEmpty()) {
                ObjectNode principal = node.putObject("Principal");
                statement.getPrincipals().forEach((type, values) -> {
                    ArrayNode array = principal.putArray(type);
                    values.forEach(array::add);
                });
            }
            writePatterns(node, statement.getActions(), "Action", "NotAction");
            if (statement.getResources() != null) {
                writePatterns(node, statement.getResources(), "Resource", "NotResource");
            }
            if (statement.getCondition() != null) {
                node.set("Condition", statement.getCondition().deepCopy());
            }
        }
        return root;
    }

    /**
     * Decode a percent-encoded policy document. IAM encodes per RFC 3986, so a literal
     * {@code +} is kept rather than read as a space.
     */
    public static String urlDecode(String encoded) {
        return URLDecoder.decode(encoded.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    private JsonNode unwrap(JsonNode raw, String id) {
        if (raw == null || raw.isMissingNode() || raw.isNull()) {
            throw new MalformedEntityException(id, "policy document is missing");
        }
        if (!raw.isTextual()) {
            return raw;
        }

        String text = raw.asText().trim();
        if (text.startsWith("%")) {
            text = urlDecode(text);
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MalformedEntityException(id, "policy document is not valid JSON: " + e.getOriginalMessage());
        }
    }

    private Statement parseStatement(JsonNode node, int index, PolicyKind kind, String id) {
        String location = id + " statement " + index;
        if (!node.isObject()) {
            throw new MalformedEntityException(location, "statement must be a JSON object");
        }
        if (node.has("NotPrincipal")) {
            throw new MalformedEntityException(location, "NotPrincipal is not supported");
        }

        Effect effect = Effect.fromValue(node.path("Effect").asText(null));
        if (effect == null) {
            throw new MalformedEntityException(location, "Effect must be exactly Allow or Deny");
        }

        PatternSet actions = parsePatterns(node, "Action", "NotAction", location);
        if (actions == null) {
            throw new MalformedEntityException(location, "Action or NotAction is required");
        }

        PatternSet resources = parsePatterns(node, "Resource", "NotResource", location);
        if (resources == null && kind != PolicyKind.TRUST) {
            throw new MalformedEntityException(location, "Resource or NotResource is required");
        }

        JsonNode condition = node.get("Condition");
        if (condition != null && !condition.isNull() && !condition.isObject()) {
            throw new MalformedEntityException(location, "Condition must be a JSON object");
        }

        return Statement.builder()
                .index(index)
                .sid(node.hasNonNull("Sid") ? node.get("Sid").asText() : null)
                .effect(effect)
                .actions(actions)
                .resources(resources)
                .principals(parsePrincipals(node.get("Principal"), location))
                .condition(condition == null || condition.isNull() ? null : condition.deepCopy())
                .build();
    }

    private PatternSet parsePatterns(JsonNode node, String field, String negatedField, String location) {
        boolean positive = node.has(field);
        boolean negated = node.has(negatedField);
        if (positive && negated) {
            throw new MalformedEntityException(location, field + " and " + negatedField + " are mutually exclusive");
        }
        if (!positive && !negated) {
            return null;
        }

        String used = positive ? field : negatedField;
        List<String> values = stringValues(node.get(used), location, used);
        if (values.isEmpty()) {
            throw new MalformedEntityException(location, used + " must not be empty");
        }
        return positive ? PatternSet.of(values) : PatternSet.not(values);
    }

    private Map<String, List<String>> parsePrincipals(JsonNode principal, String location) {
        Map<String, List<String>> principals = new LinkedHashMap<>();
        if (principal == null || principal.isNull()) {
            return principals;
        }
        if (principal.isTextual()) {
            if (!"*".equals(principal.asText())) {
                throw new MalformedEntityException(location, "Principal string must be \"*\"");
            }
            // "Principal": "*" is the same as {"AWS": "*"}
            principals.put(AWS_PRINCIPAL, List.of("*"));
            return principals;
        }
        if (!principal.isObject()) {
            throw new MalformedEntityException(location, "Principal must be \"*\" or an object");
        }

        Iterator<Map.Entry<String, JsonNode>> fields = principal.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            principals.put(entry.getKey(), stringValues(entry.getValue(), location, "Principal." + entry.getKey()));
        }
        return principals;
    }

    private List<String> stringValues(JsonNode value, String location, String field) {
        List<String> values = new ArrayList<>();
        if (value == null || value.isNull()) {
            return values;
        }
        if (value.isTextual()) {
            values.add(value.asText());
            return values;
        }
        if (!value.isArray()) {
            throw new MalformedEntityException(location, field + " must be a string or an array of strings");
        }
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw new MalformedEntityException(location, field + " must contain strings only");
            }
            values.add(item.asText());
        }
        return values;
    }

    private void writePatterns(ObjectNode node, PatternSet patterns, String field, String negatedField) {
        ArrayNode array = node.putArray(patterns.isNegated() ? negatedField : field);
        patterns.getValues().forEach(array::add);
    }
}
