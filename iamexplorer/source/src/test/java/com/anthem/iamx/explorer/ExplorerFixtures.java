package com.anthem.iamx.explorer;

import com.anthem.iamx.explorer.config.IamxProperties;
import com.anthem.iamx.explorer.service.GraphStore;
import com.anthem.iamx.graph.GraphBuilder;
import com.anthem.iamx.graph.PermissionGraph;
import com.anthem.iamx.graph.io.GraphSerializer;
import com.anthem.iamx.graph.policy.PolicyEvaluator;
import com.anthem.iamx.graph.policy.TrustPolicyEvaluator;
import com.anthem.iamx.graph.snapshot.PolicyDocumentCodec;
import com.anthem.iamx.graph.snapshot.SnapshotReader;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Graph services wired by hand, plus the sample snapshot on disk.
 */
public final class ExplorerFixtures {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private ExplorerFixtures() {
    }

    public static GraphBuilder graphBuilder() {
        return new GraphBuilder(new PolicyDocumentCodec(MAPPER), new TrustPolicyEvaluator());
    }

    public static GraphSerializer graphSerializer() {
        return new GraphSerializer(MAPPER, new PolicyDocumentCodec(MAPPER), graphBuilder());
    }

    public static GraphStore graphStore() {
        return new GraphStore(new SnapshotReader(MAPPER), graphBuilder(), graphSerializer(), new PolicyEvaluator());
    }

    public static PermissionGraph sampleGraph() {
        try (InputStream in = ExplorerFixtures.class.getResourceAsStream("/sample-snapshot.json")) {
            return graphBuilder().build(new SnapshotReader(MAPPER).read(in));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Copy the sample snapshot into the directory and return its path.
     */
    public static Path writeSampleSnapshot(Path dir) {
        Path file = dir.resolve("iam_data.json");
        try (InputStream in = ExplorerFixtures.class.getResourceAsStream("/sample-snapshot.json")) {
            Files.copy(in, file, StandardCopyOption.REPLACE_EXISTING);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Build and persist the sample graph in the directory and return the graph file.
     */
    public static Path writeSampleGraph(Path dir) {
        Path graphFile = dir.resolve("iam_graph.json");
        graphSerializer().save(sampleGraph(), graphFile);
        return graphFile;
    }

    public static IamxProperties properties(Path dir) {
        IamxProperties properties = new IamxProperties();
        properties.setSnapshotFile(dir.resolve("iam_data.json").toString());
        properties.setGraphFile(dir.resolve("iam_graph.json").toString());
        properties.setDotFile(dir.resolve("iam_graph.dot").toString());
        return properties;
    }
}
