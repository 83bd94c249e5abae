package com.anthem.iamx.explorer.render;

import com.anthem.iamx.explorer.ExplorerFixtures;
import com.anthem.iamx.graph.GraphExport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DotRendererTest {

    private final DotRenderer renderer = new DotRenderer();
    private final GraphExport export = ExplorerFixtures.sampleGraph().export();

    @Test
    void rendersEveryNodeAndEdge() {
        String dot = renderer.render(export);

        assertThat(dot).startsWith("digraph iam {").endsWith("}\n");
        assertThat(dot.lines().filter(l -> l.contains(" [label=") && !l.contains("->")).count())
                .isEqualTo(export.getNodes().size());
        assertThat(dot.lines().filter(l -> l.contains(" -> ")).count()).isEqualTo(export.getEdges().size());
        assertThat(dot).contains("\"arn:aws:iam::123456789012:user/alice\" [label=\"alice\", shape=ellipse, fillcolor=lightblue];");
        assertThat(dot).contains("\"arn:aws:iam::123456789012:user/alice\" -> \"arn:aws:iam::123456789012:group/developers\" [label=\"member of\"];");
    }

    @Test
    void trustEdgesAreDashedAndExternalPrincipalsAreDiamonds() {
        String dot = renderer.render(export);

        assertThat(dot).contains("\"Service:ec2.amazonaws.com\" [label=\"ec2.amazonaws.com\", shape=diamond, fillcolor=lightgrey];");
        assertThat(dot).contains("\"Service:ec2.amazonaws.com\" -> \"arn:aws:iam::123456789012:role/AuditRole\" [label=\"trusts\", style=dashed];");
    }

    @Test
    void filterKeepsNamedNodesAndDirectNeighbours() {
        String dot = renderer.render(export, List.of("bob"));

        assertThat(dot).contains("[label=\"bob\"", "[label=\"readers\"");
        assertThat(dot).doesNotContain("[label=\"alice\"", "[label=\"S3ReadOnly\"", "DeployRole");
        assertThat(dot.lines().filter(l -> l.contains(" -> ")).count()).isEqualTo(1);
    }

    @Test
    void escapesQuotes() {
        GraphExport odd = new GraphExport(
                List.of(new GraphExport.Node("id\"1", "say \"hi\"", GraphExport.NodeKind.USER)),
                List.of());

        assertThat(renderer.render(odd)).contains("\"id\\\"1\" [label=\"say \\\"hi\\\"\"");
    }
}
