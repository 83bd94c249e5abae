package com.anthem.iamx.graph;

import com.anthem.iamx.graph.model.PolicyDocument;
import lombok.Value;

/**
 * A policy document reachable from an identity, with the path it was reached by.
 */
@Value
public class PolicyGrant {

    PolicyDocument document;
    Attribution attribution;
}
