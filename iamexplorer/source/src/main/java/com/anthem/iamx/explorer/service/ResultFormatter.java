package com.anthem.iamx.explorer.service;

import com.anthem.iamx.graph.Attribution;
import com.anthem.iamx.graph.GraphStats;
import com.anthem.iamx.graph.exception.GraphSerializationException;
import com.anthem.iamx.graph.query.AccessEntry;
import com.anthem.iamx.graph.query.ExcludedIdentity;
import com.anthem.iamx.graph.query.PermissionReport;
import com.anthem.iamx.graph.query.PermissionTuple;
import com.anthem.iamx.graph.query.QueryWarning;
import com.anthem.iamx.graph.query.WhoCanDoReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders query results as aligned text tables or pretty-printed JSON.
 */
@Component
@RequiredArgsConstructor
public class ResultFormatter {

    private static final String NL = System.lineSeparator();

    private final ObjectMapper objectMapper;

    public String whoCanDo(WhoCanDoReport report, OutputFormat format) {
        if (format == OutputFormat.JSON) {
            return json(report);
        }
        List<AccessEntry> entries = report.getEntries();
        StringBuilder out = new StringBuilder();
        List<QueryWarning> warnings = new ArrayList<>();
        if (entries.isEmpty()) {
            out.append("No identities can perform ").append(report.getAction())
                    .append(" on ").append(report.getResource()).append(NL);
        } else {
            List<List<String>> rows = new ArrayList<>();
            for (AccessEntry entry : entries) {
                rows.add(List.of(
                        entry.getIdentityName(),
                        entry.getIdentityType().getLabel(),
                        entry.getAttribution().getLabel(),
                        String.join(" ", entry.getMatchedActions()),
                        String.join(" ", entry.getSourcePolicies())));
                warnings.addAll(entry.getWarnings());
            }
            out.append("Identities that can perform ").append(report.getAction()).append(" on ")
                    .append(report.getResource()).append(" (").append(entries.size()).append(')').append(NL);
            out.append(table(List.of("IDENTITY", "TYPE", "VIA", "ACTIONS", "SOURCE"), rows));
        }
        appendExclusions(out, report.getExclusions());
        appendWarnings(out, warnings);
        return out.toString();
    }

    public String whatCanDo(PermissionReport report, OutputFormat format) {
        if (format == OutputFormat.JSON) {
            return json(report);
        }
        StringBuilder out = new StringBuilder();
        out.append(report.getIdentityType().getLabel()).append(' ').append(report.getIdentityName())
                .append(" (").append(report.getIdentityArn()).append(')').append(NL);

        if (report.getPermissions().isEmpty()) {
            out.append("No permissions").append(NL);
        } else {
            List<List<String>> rows = new ArrayList<>();
            for (PermissionTuple tuple : report.getPermissions()) {
                rows.add(List.of(
                        tuple.getEffect().name(),
                        (tuple.isNotAction() ? "NOT " : "") + tuple.getAction(),
                        (tuple.isNotResource() ? "NOT " : "") + tuple.getResource(),
                        tuple.getSourcePolicy(),
                        tuple.getAttribution().getLabel() + (tuple.isConditioned() ? " (conditional)" : "")));
            }
            out.append(table(List.of("EFFECT", "ACTION", "RESOURCE", "SOURCE", "VIA"), rows));
        }

        if (!report.getAssumableRoles().isEmpty()) {
            out.append(NL).append("Assumable roles:").append(NL);
            for (Attribution chain : report.getAssumableRoles()) {
                out.append("  ").append(chain.getLabel()).append(NL);
            }
        }
        appendWarnings(out, report.getWarnings());
        return out.toString();
    }

    public String stats(GraphStats stats, OutputFormat format) {
        if (format == OutputFormat.JSON) {
            return json(stats);
        }
        Map<String, Integer> values = new LinkedHashMap<>();
        values.put("Nodes", stats.getTotalNodes());
        values.put("Edges", stats.getTotalEdges());
        values.put("Users", stats.getUsers());
        values.put("Groups", stats.getGroups());
        values.put("Roles", stats.getRoles());
        values.put("Managed policies", stats.getPolicies());
        values.put("Inline policies", stats.getInlinePolicies());
        values.put("Trust relationships", stats.getTrustRelationships());

        List<List<String>> rows = new ArrayList<>();
        values.forEach((name, value) -> rows.add(List.of(name, String.valueOf(value))));
        return table(List.of("METRIC", "COUNT"), rows);
    }

    public String batch(List<QueryOutcome> outcomes, OutputFormat format) {
        if (format == OutputFormat.JSON) {
            return json(outcomes);
        }
        StringBuilder out = new StringBuilder();
        for (QueryOutcome outcome : outcomes) {
            out.append("== ").append(outcome.getQuery()).append(" [").append(outcome.getStatus()).append(']').append(NL);
            if (!outcome.isSuccess()) {
                out.append("Error [").append(outcome.getErrorCode()).append("]: ").append(outcome.getMessage()).append(NL);
            } else if (outcome.getReport() != null) {
                out.append(whatCanDo(outcome.getReport(), OutputFormat.TABLE));
            } else {
                out.append(table(List.of("IDENTITY", "TYPE", "VIA"), outcome.getEntries().stream()
                        .map(e -> List.of(e.getIdentityName(), e.getIdentityType().getLabel(), e.getAttribution().getLabel()))
                        .collect(Collectors.toList())));
                if (outcome.getExclusions() != null) {
                    appendExclusions(out, outcome.getExclusions());
                }
            }
            out.append(NL);
        }
        return out.toString();
    }

    private String json(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value) + NL;
        } catch (JsonProcessingException e) {
            throw new GraphSerializationException("Failed to render result as JSON", e);
        }
    }

    private static void appendExclusions(StringBuilder out, List<ExcludedIdentity> exclusions) {
        if (exclusions.isEmpty()) {
            return;
        }
        out.append(NL).append("Excluded by a Deny with an unevaluated Condition:").append(NL);
        for (ExcludedIdentity excluded : exclusions) {
            out.append("  ").append(excluded.getIdentityName())
                    .append(" (").append(excluded.getIdentityType().getLabel()).append(')');
            excluded.getWarnings().forEach(w -> out.append(' ').append(w.getLocation()));
            out.append(NL);
        }
    }

    private static void appendWarnings(StringBuilder out, List<QueryWarning> warnings) {
        if (warnings.isEmpty()) {
            return;
        }
        out.append(NL).append("Warnings:").append(NL);
        warnings.stream().distinct().forEach(w ->
                out.append("  ").append(w.getCode()).append(' ').append(w.getLocation())
                        .append(": ").append(w.getMessage()).append(NL));
    }

    static String table(List<String> headers, List<List<String>> rows) {
        int[] widths = new int[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            widths[i] = headers.get(i).length();
        }
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }
        StringBuilder out = new StringBuilder();
        appendRow(out, headers, widths);
        List<String> rule = new ArrayList<>();
        for (int width : widths) {
            rule.add("-".repeat(width));
        }
        appendRow(out, rule, widths);
        rows.forEach(row -> appendRow(out, row, widths));
        return out.toString();
    }

    private static void appendRow(StringBuilder out, List<String> cells, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                line.append("  ");
            }
            line.append(String.format("%-" + widths[i] + "s", cells.get(i)));
        }
        out.append(line.toString().stripTrailing()).append(NL);
    }
}
