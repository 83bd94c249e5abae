package com.anthem.iamx.graph.model;

public enum Effect {
    ALLOW("Allow"),
    DENY("Deny");

    private final String value;

    Effect(String value) {
        this.value = value;
    }

    /**
     * Policy grammar spelling ("Allow" / "Deny").
     */
    public String getValue() {
        return value;
    }

    /**
     * Parse the Effect element. Anything other than Allow or Deny yields null.
     */
    public static Effect fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (Effect effect : values()) {
            if (effect.value.equals(value)) {
                return effect;
            }
        }
        return null;
    }
}
