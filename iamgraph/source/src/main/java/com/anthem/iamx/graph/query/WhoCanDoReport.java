package com.anthem.iamx.graph.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of a who-can-do query, with the identities dropped by conditioned Deny statements.
 */
@Value
@Builder
public class WhoCanDoReport {

    String action;
    String resource;

    @Singular
    List<AccessEntry> entries;

    @Singular
    List<ExcludedIdentity> exclusions;
}
