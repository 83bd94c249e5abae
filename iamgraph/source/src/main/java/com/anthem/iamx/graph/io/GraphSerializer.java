package com.anthem.iamx.graph.io;

import com.anthem.iamx.graph.GraphBuilder;
import com.anthem.iamx.graph.PermissionGraph;
import com.anthem.iamx.graph.exception.GraphSerializationException;
import com.anthem.iamx.graph.model.Identity;
import com.anthem.iamx.graph.model.IdentityType;
import com.anthem.iamx.graph.model.PolicyDocument;
import com.anthem.iamx.graph.snapshot.PolicyDocumentCodec;
import com.anthem.iamx.graph.snapshot.Snapshot;
import com.anthem.iamx.graph.snapshot.SnapshotGroup;
import com.anthem.iamx.graph.snapshot.SnapshotPolicy;
import com.anthem.iamx.graph.snapshot.SnapshotReader;
import com.anthem.iamx.graph.snapshot.SnapshotRole;
import com.anthem.iamx.graph.snapshot.SnapshotUser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists a built graph and loads it back.
 *
 * <p>The stored form is a versioned JSON envelope around the graph's canonical snapshot:
 * <pre>
 * { "format_version": 1, "created_at": "...", "snapshot": { "users": [...], ... } }
 * </pre>
 * Loading rebuilds the graph through {@link GraphBuilder}, so a loaded graph is validated
 * exactly like a freshly built one and answers every query identically.
 */
public class GraphSerializer {

    private static final Logger log = LoggerFactory.getLogger(GraphSerializer.class);

    public static final int FORMAT_VERSION = 1;

    private final ObjectMapper objectMapper;
    private final PolicyDocumentCodec codec;
    private final SnapshotReader snapshotReader;
    private final GraphBuilder graphBuilder;
    private final Clock clock;

    public GraphSerializer(ObjectMapper objectMapper, PolicyDocumentCodec codec, GraphBuilder graphBuilder) {
        this(objectMapper, codec, graphBuilder, Clock.systemUTC());
    }

    public GraphSerializer(ObjectMapper objectMapper, PolicyDocumentCodec codec, GraphBuilder graphBuilder, Clock clock) {
        this.objectMapper = objectMapper;
        this.codec = codec;
        this.snapshotReader = new SnapshotReader(objectMapper);
        this.graphBuilder = graphBuilder;
        this.clock = clock;
    }

    public byte[] serialize(PermissionGraph graph) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("format_version", FORMAT_VERSION);
        envelope.put("created_at", Instant.now(clock).toString());
        envelope.set("snapshot", objectMapper.valueToTree(toSnapshot(graph)));
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(envelope);
        } catch (IOException e) {
            throw new GraphSerializationException("Failed to serialize graph", e);
        }
    }

    public PermissionGraph deserialize(byte[] bytes) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(bytes);
        } catch (IOException e) {
            throw new GraphSerializationException("Graph file is not valid JSON: " + e.getMessage(), e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new GraphSerializationException("Graph file must contain a JSON object");
        }
        int version = envelope.path("format_version").asInt(-1);
        if (version != FORMAT_VERSION) {
            throw new GraphSerializationException("Unsupported graph format version: " + envelope.path("format_version"));
        }
        JsonNode snapshot = envelope.get("snapshot");
        if (snapshot == null || !snapshot.isObject()) {
            throw new GraphSerializationException("Graph file has no snapshot");
        }
        return graphBuilder.build(snapshotReader.read(snapshot));
    }

    public void save(PermissionGraph graph, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(file, serialize(graph));
            log.info("Graph saved: file={}, identities={}", file, graph.identityCount());
        } catch (IOException e) {
            throw new GraphSerializationException("Failed to write graph file: " + file, e);
        }
    }

    public PermissionGraph load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new GraphSerializationException("Graph file not found: " + file + " (run build-graph first)");
        }
        try {
            PermissionGraph graph = deserialize(Files.readAllBytes(file));
            log.info("Graph loaded: file={}, identities={}", file, graph.identityCount());
            return graph;
        } catch (IOException e) {
            throw new GraphSerializationException("Failed to read graph file: " + file, e);
        }
    }

    /**
     * Canonical snapshot of the graph: every document re-rendered in the policy grammar,
     * group memberships by ARN.
     */
    public Snapshot toSnapshot(PermissionGraph graph) {
        Snapshot snapshot = new Snapshot();
        snapshot.setPolicies(graph.getManagedPolicies().stream()
                .map(policy -> SnapshotPolicy.builder()
                        .arn(policy.getId())
                        .name(policy.getName())
                        .policyDocument(codec.toJson(policy))
                        .awsManaged(policy.isAwsManaged())
                        .build())
                .collect(Collectors.toList()));

        snapshot.setUsers(graph.allIdentities()
                .filter(i -> i.getType() == IdentityType.USER)
                .map(user -> SnapshotUser.builder()
                        .arn(user.getArn())
                        .name(user.getName())
                        .path(user.getPath())
                        .attachedPolicies(user.getAttachedPolicyArns())
                        .inlinePolicies(inline(user))
                        .groups(user.getGroupRefs())
                        .build())
                .collect(Collectors.toList()));

        snapshot.setGroups(graph.allIdentities()
                .filter(i -> i.getType() == IdentityType.GROUP)
                .map(group -> SnapshotGroup.builder()
                        .arn(group.getArn())
                        .name(group.getName())
                        .path(group.getPath())
                        .attachedPolicies(group.getAttachedPolicyArns())
                        .inlinePolicies(inline(group))
                        .build())
                .collect(Collectors.toList()));

        snapshot.setRoles(graph.allIdentities()
                .filter(i -> i.getType() == IdentityType.ROLE)
                .map(role -> SnapshotRole.builder()
                        .arn(role.getArn())
                        .name(role.getName())
                        .path(role.getPath())
                        .assumeRolePolicy(codec.toJson(role.getTrustPolicy().orElseThrow()))
                        .attachedPolicies(role.getAttachedPolicyArns())
                        .inlinePolicies(inline(role))
                        .build())
                .collect(Collectors.toList()));

        snapshot.setMetadata(graph.getMetadata().orElse(null));
        return snapshot;
    }

    private Map<String, JsonNode> inline(Identity identity) {
        Map<String, JsonNode> documents = new LinkedHashMap<>();
        for (PolicyDocument document : identity.getInlinePolicies()) {
            documents.put(document.getName(), codec.toJson(document));
        }
        return documents;
    }
}
