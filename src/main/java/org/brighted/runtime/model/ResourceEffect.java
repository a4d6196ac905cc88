package org.brighted.runtime.model;

import java.util.Objects;

/**
 * A single signed change to one resource. Effects are applied left-to-right by
 * {@link org.brighted.runtime.ledger.ResourceLedger}; repeated inventory keys accumulate.
 * <p>
 * Each case carries only the fields its kind needs. Consumers dispatch on {@link #kind()}
 * with an exhaustive switch, so adding a case here without handling it is a compile error.
 */
public sealed interface ResourceEffect
        permits ResourceEffect.Currency, ResourceEffect.TimeUnits, ResourceEffect.Energy,
                ResourceEffect.Inventory, ResourceEffect.Reputation {

    ResourceKind kind();

    int amount();

    /**
     * Change to the player's B-Coin balance.
     * @param amount signed delta
     */
    record Currency(int amount) implements ResourceEffect {
        @Override
        public ResourceKind kind() {
            return ResourceKind.CURRENCY;
        }
    }

    /**
     * Change to the player's time budget.
     * @param amount signed delta
     */
    record TimeUnits(int amount) implements ResourceEffect {
        @Override
        public ResourceKind kind() {
            return ResourceKind.TIME_UNITS;
        }
    }

    /**
     * Change to the player's energy.
     * @param amount signed delta
     */
    record Energy(int amount) implements ResourceEffect {
        @Override
        public ResourceKind kind() {
            return ResourceKind.ENERGY;
        }
    }

    /**
     * Change to the quantity of one inventory item.
     * @param itemId item identifier, never blank
     * @param amount signed delta
     */
    record Inventory(String itemId, int amount) implements ResourceEffect {
        public Inventory {
            Objects.requireNonNull(itemId, "itemId");
            if (itemId.isBlank()) {
                throw new IllegalArgumentException("Inventory effect requires a non-blank itemId");
            }
        }

        @Override
        public ResourceKind kind() {
            return ResourceKind.INVENTORY;
        }
    }

    /**
     * Change to the session's standing with one actor (e.g. {@code "regulator"}).
     * Not part of the resource bundle; applied to the session snapshot's reputation map.
     * @param actorId the actor whose opinion changes
     * @param amount signed delta
     */
    record Reputation(String actorId, int amount) implements ResourceEffect {
        public Reputation {
            Objects.requireNonNull(actorId, "actorId");
            if (actorId.isBlank()) {
                throw new IllegalArgumentException("Reputation effect requires a non-blank actorId");
            }
        }

        @Override
        public ResourceKind kind() {
            return ResourceKind.REPUTATION;
        }
    }

    static ResourceEffect currency(int amount) {
        return new Currency(amount);
    }

    static ResourceEffect timeUnits(int amount) {
        return new TimeUnits(amount);
    }

    static ResourceEffect energy(int amount) {
        return new Energy(amount);
    }

    static ResourceEffect inventory(String itemId, int amount) {
        return new Inventory(itemId, amount);
    }

    static ResourceEffect reputation(String actorId, int amount) {
        return new Reputation(actorId, amount);
    }
}
