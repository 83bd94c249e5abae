package com.anthem.iamx.graph.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalized point-in-time extract of an account's identities and policies,
 * as written by the fetcher and read by the graph builder.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Snapshot {

    @Builder.Default
    private List<SnapshotUser> users = new ArrayList<>();

    @Builder.Default
    private List<SnapshotGroup> groups = new ArrayList<>();

    @Builder.Default
    private List<SnapshotRole> roles = new ArrayList<>();

    @Builder.Default
    private List<SnapshotPolicy> policies = new ArrayList<>();

    private SnapshotMetadata metadata;
}
