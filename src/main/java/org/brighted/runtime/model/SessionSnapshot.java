package org.brighted.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-session container mutated by decisions and ticks.
 *
 * @param resources  the player's resources as seen by this session
 * @param reputation actor id to standing (signed, unclamped)
 * @param business   business practical state, {@code null} for sessions of other stories
 */
public record SessionSnapshot(ResourceBundle resources, Map<String, Integer> reputation, BusinessSimState business) {

    public SessionSnapshot {
        Objects.requireNonNull(resources, "resources");
        reputation = Collections.unmodifiableMap(new LinkedHashMap<>(reputation));
    }

    public SessionSnapshot withResources(ResourceBundle next) {
        return new SessionSnapshot(next, reputation, business);
    }

    public SessionSnapshot withReputation(Map<String, Integer> next) {
        return new SessionSnapshot(resources, next, business);
    }

    public SessionSnapshot withBusiness(BusinessSimState next) {
        return new SessionSnapshot(resources, reputation, next);
    }
}
