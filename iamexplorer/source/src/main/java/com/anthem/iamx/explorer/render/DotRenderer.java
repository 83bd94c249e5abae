package com.anthem.iamx.explorer.render;

import com.anthem.iamx.graph.GraphExport;
import com.anthem.iamx.graph.model.EdgeKind;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders a {@link GraphExport} as a Graphviz DOT digraph.
 */
public class DotRenderer {

    public String render(GraphExport export) {
        return render(export, List.of());
    }

    /**
     * @param filter identity or policy names (or ids) to focus on; the result keeps those
     *               nodes, their direct neighbours and the edges touching them. Empty keeps
     *               the whole graph.
     */
    public String render(GraphExport export, Collection<String> filter) {
        List<GraphExport.Edge> edges = export.getEdges();
        Set<String> nodeIds;

        if (filter.isEmpty()) {
            nodeIds = export.getNodes().stream().map(GraphExport.Node::getId).collect(Collectors.toSet());
        } else {
            Set<String> focus = export.getNodes().stream()
                    .filter(n -> filter.contains(n.getName()) || filter.contains(n.getId()))
                    .map(GraphExport.Node::getId)
                    .collect(Collectors.toSet());
            edges = edges.stream()
                    .filter(e -> focus.contains(e.getSource()) || focus.contains(e.getTarget()))
                    .collect(Collectors.toList());
            nodeIds = new HashSet<>(focus);
            for (GraphExport.Edge edge : edges) {
                nodeIds.add(edge.getSource());
                nodeIds.add(edge.getTarget());
            }
        }

        StringBuilder dot = new StringBuilder();
        dot.append("digraph iam {\n");
        dot.append("  rankdir=LR;\n");
        dot.append("  node [style=filled, fontname=\"Helvetica\"];\n");

        Set<String> written = new LinkedHashSet<>();
        for (GraphExport.Node node : export.getNodes()) {
            if (nodeIds.contains(node.getId()) && written.add(node.getId())) {
                dot.append("  ").append(quote(node.getId()))
                        .append(" [label=").append(quote(node.getName()))
                        .append(", shape=").append(shape(node.getKind()))
                        .append(", fillcolor=").append(color(node.getKind()))
                        .append("];\n");
            }
        }
        for (GraphExport.Edge edge : edges) {
            dot.append("  ").append(quote(edge.getSource())).append(" -> ").append(quote(edge.getTarget()))
                    .append(" [label=").append(quote(edge.getKind().name().toLowerCase(Locale.ROOT).replace('_', ' ')));
            if (edge.getKind() == EdgeKind.TRUSTS) {
                dot.append(", style=dashed");
            }
            dot.append("];\n");
        }
        dot.append("}\n");
        return dot.toString();
    }

    private static String shape(GraphExport.NodeKind kind) {
        switch (kind) {
            case USER:
                return "ellipse";
            case GROUP:
                return "box";
            case ROLE:
                return "hexagon";
            case POLICY:
                return "note";
            default:
                return "diamond";
        }
    }

    private static String color(GraphExport.NodeKind kind) {
        switch (kind) {
            case USER:
                return "lightblue";
            case GROUP:
                return "lightgreen";
            case ROLE:
                return "orange";
            case POLICY:
                return "lightyellow";
            default:
                return "lightgrey";
        }
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
