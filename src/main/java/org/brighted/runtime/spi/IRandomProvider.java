package org.brighted.runtime.spi;

/**
 * Source of randomness for every non-deterministic engine decision
 * (market fluctuation, cooldown length, lab coin rewards).
 * <p>
 * Engine functions never reach for a global generator; callers pass a provider in,
 * so tests can supply a fixed sequence and assert exact boundary values.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     * Use this to give each session or user an independent stream (e.g. scope "market", key = session id).
     *
     * @param scope a stable, descriptive scope name
     * @param key a stable key within the scope
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, String key);
}
