package com.anthem.iamx.graph;

import com.anthem.iamx.graph.model.EdgeKind;
import lombok.Value;

import java.util.List;

/**
 * Nodes and edges of the graph, enough for a renderer to draw it.
 * No layout information is included.
 */
@Value
public class GraphExport {

    public enum NodeKind { USER, GROUP, ROLE, POLICY, PRINCIPAL }

    List<Node> nodes;
    List<Edge> edges;

    @Value
    public static class Node {
        String id;
        String name;
        NodeKind kind;
    }

    @Value
    public static class Edge {
        EdgeKind kind;
        String source;
        String target;
    }
}
