package com.anthem.iamx.graph.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SnapshotRole {

    private String arn;
    private String name;
    private String path;

    /**
     * Trust policy naming the principals allowed to assume the role.
     */
    private JsonNode assumeRolePolicy;

    @Builder.Default
    private List<String> attachedPolicies = new ArrayList<>();

    @Builder.Default
    private Map<String, JsonNode> inlinePolicies = new LinkedHashMap<>();
}
