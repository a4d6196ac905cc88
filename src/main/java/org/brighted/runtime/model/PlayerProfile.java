package org.brighted.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Cross-session player state. Rules only read {@code skills} and {@code reputation};
 * {@code resources} is the balance a new session starts from.
 */
public record PlayerProfile(String userId, Map<String, Integer> skills, Map<String, Integer> reputation,
                            ResourceBundle resources) {

    /** Skill values every new profile starts with. */
    public static final Map<String, Integer> DEFAULT_SKILLS =
            Map.of("financialLiteracy", 50, "discipline", 50, "communication", 50);

    public PlayerProfile {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(resources, "resources");
        skills = Collections.unmodifiableMap(new LinkedHashMap<>(skills));
        reputation = Collections.unmodifiableMap(new LinkedHashMap<>(reputation));
    }

    public static PlayerProfile newPlayer(String userId, ResourceBundle startingResources) {
        return new PlayerProfile(userId, DEFAULT_SKILLS, Map.of(), startingResources);
    }

    public PlayerProfile withResources(ResourceBundle next) {
        return new PlayerProfile(userId, skills, reputation, next);
    }

    public int skill(String name) {
        return skills.getOrDefault(name, 0);
    }
}
