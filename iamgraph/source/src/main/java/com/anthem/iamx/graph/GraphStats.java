package com.anthem.iamx.graph;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GraphStats {

    int totalNodes;
    int totalEdges;
    int users;
    int groups;
    int roles;
    int policies;
    int inlinePolicies;
    int trustRelationships;
}
