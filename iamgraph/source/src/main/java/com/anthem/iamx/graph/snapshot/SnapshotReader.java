package com.anthem.iamx.graph.snapshot;

import com.anthem.iamx.graph.exception.GraphSerializationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Reads snapshot JSON files ({@code iam_data.json}).
 */
public class SnapshotReader {

    private static final Logger log = LoggerFactory.getLogger(SnapshotReader.class);

    private final ObjectMapper objectMapper;

    public SnapshotReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Snapshot read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new GraphSerializationException("Snapshot file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            Snapshot snapshot = read(in);
            log.info("Loaded snapshot: file={}, users={}, groups={}, roles={}, policies={}",
                    file, snapshot.getUsers().size(), snapshot.getGroups().size(),
                    snapshot.getRoles().size(), snapshot.getPolicies().size());
            return snapshot;
        } catch (IOException e) {
            throw new GraphSerializationException("Failed to read snapshot file: " + file, e);
        }
    }

    public Snapshot read(InputStream in) {
        try {
            return normalize(objectMapper.readValue(in, Snapshot.class));
        } catch (IOException e) {
            throw new GraphSerializationException("Snapshot is not valid JSON: " + e.getMessage(), e);
        }
    }

    public Snapshot read(JsonNode node) {
        try {
            return normalize(objectMapper.treeToValue(node, Snapshot.class));
        } catch (IOException e) {
            throw new GraphSerializationException("Snapshot does not match the expected schema: " + e.getMessage(), e);
        }
    }

    // explicit nulls in the file would otherwise override the builder defaults
    private Snapshot normalize(Snapshot snapshot) {
        if (snapshot == null) {
            throw new GraphSerializationException("Snapshot is empty");
        }
        if (snapshot.getUsers() == null) snapshot.setUsers(new ArrayList<>());
        if (snapshot.getGroups() == null) snapshot.setGroups(new ArrayList<>());
        if (snapshot.getRoles() == null) snapshot.setRoles(new ArrayList<>());
        if (snapshot.getPolicies() == null) snapshot.setPolicies(new ArrayList<>());
        return snapshot;
    }
}
