package org.brighted.runtime.ledger;

import org.brighted.runtime.Config;
import org.brighted.runtime.model.ResourceBundle;
import org.brighted.runtime.model.ResourceEffect;
import org.brighted.runtime.model.SessionSnapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure algebra over a player's {@link ResourceBundle}.
 * <p>
 * <strong>Clamping policy:</strong> any delta that would drive currency, time units or an
 * inventory quantity below zero is floored at zero instead of being rejected; energy is
 * clamped into {@code [0, maxEnergy]}. The clamp runs after every single effect, so applying
 * two lists in sequence always equals applying their concatenation. A floor is not
 * invertible, though: once a value hits a bound, netting or reordering effects changes the
 * result. With currency 10, {@code [-20, +15]} yields 15, the netted {@code [-5]} yields 5,
 * and the reordered {@code [+15, -20]} yields 5.
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class ResourceLedger {

    private static final ResourceLedger STANDARD = new ResourceLedger(Config.MAX_ENERGY);

    private final int maxEnergy;

    /**
     * Creates a ledger with a custom energy ceiling.
     *
     * @param maxEnergy upper energy bound, must be positive
     */
    public ResourceLedger(int maxEnergy) {
        if (maxEnergy <= 0) {
            throw new IllegalArgumentException("maxEnergy must be positive, got " + maxEnergy);
        }
        this.maxEnergy = maxEnergy;
    }

    /**
     * Returns the ledger using {@link Config#MAX_ENERGY}.
     */
    public static ResourceLedger standard() {
        return STANDARD;
    }

    public int getMaxEnergy() {
        return maxEnergy;
    }

    /**
     * Applies effects left-to-right and returns the resulting bundle. Total: never throws
     * for well-formed input. Reputation effects are ignored here; see
     * {@link #applyToSnapshot(SessionSnapshot, List)}.
     *
     * @param bundle  starting bundle
     * @param effects effects in application order
     * @return the new bundle; equal to {@code bundle} when {@code effects} is empty
     */
    public ResourceBundle applyDelta(ResourceBundle bundle, List<? extends ResourceEffect> effects) {
        if (effects.isEmpty()) {
            return bundle;
        }
        Scalars scalars = new Scalars(bundle.currency(), bundle.timeUnits(), bundle.energy());
        Map<String, Integer> inventory = new LinkedHashMap<>(bundle.inventory());

        // switch expression: a new ResourceKind without a case here does not compile
        for (ResourceEffect effect : effects) {
            int amount = effect.amount();
            scalars = switch (effect.kind()) {
                case CURRENCY -> new Scalars(floorAtZero(scalars.currency, amount), scalars.timeUnits, scalars.energy);
                case TIME_UNITS -> new Scalars(scalars.currency, floorAtZero(scalars.timeUnits, amount), scalars.energy);
                case ENERGY -> new Scalars(scalars.currency, scalars.timeUnits,
                        clamp((long) scalars.energy + amount, 0, maxEnergy));
                case INVENTORY -> {
                    String itemId = ((ResourceEffect.Inventory) effect).itemId();
                    inventory.put(itemId, floorAtZero(inventory.getOrDefault(itemId, 0), amount));
                    yield scalars;
                }
                case REPUTATION -> scalars; // standing lives on the session snapshot
            };
        }
        return new ResourceBundle(scalars.currency, scalars.timeUnits, scalars.energy, inventory);
    }

    /**
     * Applies resource effects to the snapshot's bundle and reputation effects to its
     * reputation map. Reputation is a signed standing and is not clamped.
     *
     * @param snapshot session state
     * @param effects  effects in application order
     * @return the updated snapshot
     */
    public SessionSnapshot applyToSnapshot(SessionSnapshot snapshot, List<? extends ResourceEffect> effects) {
        if (effects.isEmpty()) {
            return snapshot;
        }
        Map<String, Integer> reputation = new LinkedHashMap<>(snapshot.reputation());
        boolean reputationChanged = false;
        for (ResourceEffect effect : effects) {
            if (effect instanceof ResourceEffect.Reputation rep) {
                long next = (long) reputation.getOrDefault(rep.actorId(), 0) + rep.amount();
                reputation.put(rep.actorId(), clamp(next, Integer.MIN_VALUE, Integer.MAX_VALUE));
                reputationChanged = true;
            }
        }
        SessionSnapshot next = snapshot.withResources(applyDelta(snapshot.resources(), effects));
        return reputationChanged ? next.withReputation(reputation) : next;
    }

    /**
     * Returns true when the bundle covers both costs without clamping.
     */
    public boolean canAfford(ResourceBundle bundle, int currencyCost, int timeUnitsCost) {
        return bundle.currency() >= currencyCost && bundle.timeUnits() >= timeUnitsCost;
    }

    /**
     * Sums two inventories key by key.
     */
    public static Map<String, Integer> mergeInventory(Map<String, Integer> a, Map<String, Integer> b) {
        Map<String, Integer> out = new LinkedHashMap<>(a);
        b.forEach((item, qty) -> out.merge(item, qty, (x, y) -> clamp((long) x + y, 0, Integer.MAX_VALUE)));
        return out;
    }

    private record Scalars(int currency, int timeUnits, int energy) {
    }

    private static int floorAtZero(int current, int delta) {
        return clamp((long) current + delta, 0, Integer.MAX_VALUE);
    }

    private static int clamp(long value, int min, int max) {
        return (int) Math.max(min, Math.min(max, value));
    }
}
