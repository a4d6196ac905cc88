package org.brighted.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a player's resources.
 * <p>
 * Currency and inventory quantities are never negative. An item whose quantity reached
 * zero stays in the map with an explicit zero.
 *
 * @param currency  B-Coin balance, {@code >= 0}
 * @param timeUnits time budget, {@code >= 0} after any ledger application
 * @param energy    current energy
 * @param inventory item id to quantity, unmodifiable
 */
public record ResourceBundle(int currency, int timeUnits, int energy, Map<String, Integer> inventory) {

    public ResourceBundle {
        if (currency < 0) {
            throw new IllegalArgumentException("currency cannot be negative: " + currency);
        }
        Objects.requireNonNull(inventory, "inventory");
        Map<String, Integer> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : inventory.entrySet()) {
            Integer qty = Objects.requireNonNull(e.getValue(), "quantity for " + e.getKey());
            if (qty < 0) {
                throw new IllegalArgumentException("inventory quantity cannot be negative: " + e.getKey() + "=" + qty);
            }
            copy.put(e.getKey(), qty);
        }
        inventory = Collections.unmodifiableMap(copy);
    }

    public static ResourceBundle of(int currency, int timeUnits, int energy) {
        return new ResourceBundle(currency, timeUnits, energy, Map.of());
    }

    public static ResourceBundle empty() {
        return of(0, 0, 0);
    }

    /**
     * Returns the quantity held for an item, or zero when the item was never seen.
     */
    public int quantityOf(String itemId) {
        return inventory.getOrDefault(itemId, 0);
    }
}
