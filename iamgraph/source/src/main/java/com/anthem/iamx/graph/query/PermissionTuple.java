package com.anthem.iamx.graph.query;

import com.anthem.iamx.graph.Attribution;
import com.anthem.iamx.graph.model.Effect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One (action pattern, resource pattern, effect, source policy) grant of a what-can-do report.
 *
 * <p>For a {@code NotAction} or {@code NotResource} element the pattern holds the
 * comma-joined excluded patterns and the matching flag is set.
 */
@Value
@Builder
public class PermissionTuple {

    String action;
    boolean notAction;
    String resource;
    boolean notResource;
    Effect effect;
    String sourcePolicy;
    Attribution attribution;
    boolean conditioned;

    @JsonIgnore
    public boolean isDeny() {
        return effect == Effect.DENY;
    }

    /**
     * Identity of the tuple for de-duplication; the attribution is not part of it.
     */
    Object key() {
        return List.of(action, notAction, resource, notResource, effect, sourcePolicy);
    }
}
