package com.anthem.iamx.explorer.service;

import com.anthem.iamx.graph.GraphBuilder;
import com.anthem.iamx.graph.PermissionGraph;
import com.anthem.iamx.graph.io.GraphSerializer;
import com.anthem.iamx.graph.policy.PolicyEvaluator;
import com.anthem.iamx.graph.query.QueryEngine;
import com.anthem.iamx.graph.snapshot.Snapshot;
import com.anthem.iamx.graph.snapshot.SnapshotReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds graphs from snapshot files and loads persisted graphs, keeping each loaded graph
 * for the life of the process.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphStore {

    private final SnapshotReader snapshotReader;
    private final GraphBuilder graphBuilder;
    private final GraphSerializer graphSerializer;
    private final PolicyEvaluator policyEvaluator;

    private final Map<Path, PermissionGraph> loaded = new ConcurrentHashMap<>();

    /**
     * Read the snapshot, build the graph and persist it.
     */
    public PermissionGraph build(Path snapshotFile, Path graphFile) {
        Snapshot snapshot = snapshotReader.read(snapshotFile);
        PermissionGraph graph = graphBuilder.build(snapshot);
        graphSerializer.save(graph, graphFile);
        loaded.put(key(graphFile), graph);
        return graph;
    }

    public PermissionGraph load(Path graphFile) {
        return loaded.computeIfAbsent(key(graphFile), graphSerializer::load);
    }

    public QueryEngine queryEngine(Path graphFile) {
        return new QueryEngine(load(graphFile), policyEvaluator);
    }

    private static Path key(Path file) {
        return file.toAbsolutePath().normalize();
    }
}
