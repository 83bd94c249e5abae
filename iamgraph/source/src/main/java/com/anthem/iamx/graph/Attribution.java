package com.anthem.iamx.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * How a policy reaches an identity: {@code direct}, {@code via-group:<name>} or
 * {@code via-role:<role>[-><role>...]}.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Attribution {

    public enum Kind { DIRECT, VIA_GROUP, VIA_ROLE }

    private static final Attribution DIRECT = new Attribution(Kind.DIRECT, List.of());

    private final Kind kind;
    private final List<String> path;

    public static Attribution direct() {
        return DIRECT;
    }

    public static Attribution viaGroup(String groupName) {
        return new Attribution(Kind.VIA_GROUP, List.of(groupName));
    }

    public static Attribution viaRole(List<String> roleChain) {
        return new Attribution(Kind.VIA_ROLE, List.copyOf(roleChain));
    }

    /**
     * Extend a role chain with the next assumed role.
     */
    public Attribution thenRole(String roleName) {
        List<String> chain = new ArrayList<>(kind == Kind.VIA_ROLE ? path : List.of());
        chain.add(roleName);
        return viaRole(chain);
    }

    @JsonValue
    public String getLabel() {
        switch (kind) {
            case VIA_GROUP:
                return "via-group:" + path.get(0);
            case VIA_ROLE:
                return "via-role:" + String.join("->", path);
            default:
                return "direct";
        }
    }

    @Override
    public String toString() {
        return getLabel();
    }
}
