package org.brighted.runtime.model;

import java.util.Locale;

/**
 * The closed set of resource kinds an effect can target.
 * <p>
 * The wire name is the camel-case key used in persisted effect documents.
 */
public enum ResourceKind {
    CURRENCY("currency"),
    TIME_UNITS("timeUnits"),
    ENERGY("energy"),
    INVENTORY("inventory"),
    REPUTATION("reputation");

    private final String wireName;

    ResourceKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a kind from its wire name (case-insensitive).
     *
     * @param name the persisted name, e.g. {@code "timeUnits"}
     * @return the matching kind
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ResourceKind fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Resource kind name cannot be null or empty");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ResourceKind kind : values()) {
            if (kind.wireName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown resource kind: '" + name + "'");
    }
}
