package com.anthem.iamx.graph.snapshot;

import com.anthem.iamx.graph.exception.GraphSerializationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class SnapshotWriter {

    private static final Logger log = LoggerFactory.getLogger(SnapshotWriter.class);

    private final ObjectMapper objectMapper;

    public SnapshotWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(Snapshot snapshot, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), snapshot);
            log.info("Snapshot saved: file={}", file);
        } catch (IOException e) {
            throw new GraphSerializationException("Failed to write snapshot file: " + file, e);
        }
    }
}
