package com.anthem.iamx.graph.model;

public enum IdentityType {
    USER("User"),
    GROUP("Group"),
    ROLE("Role");

    private final String label;

    IdentityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Users and roles can act as principals in a trust policy; groups cannot.
     */
    public boolean canAssumeRoles() {
        return this != GROUP;
    }

    public static IdentityType fromLabel(String value) {
        for (IdentityType type : values()) {
            if (type.label.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
