package org.brighted.runtime.internal.services;

import org.apache.commons.math3.random.Well19937c;
import org.brighted.runtime.spi.IRandomProvider;

import java.nio.charset.StandardCharsets;

/**
 * {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * Child streams are derived from the seed and a (scope, key) pair only, so the market
 * stream of one session does not depend on how many draws other sessions made first.
 */
public final class SeededRandomProvider implements IRandomProvider {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final long seed;
    private final Well19937c generator;

    /**
     * @param seed seed of the underlying generator
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.generator = new Well19937c(seed);
    }

    @Override
    public synchronized int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive, got " + bound);
        }
        return generator.nextInt(bound);
    }

    @Override
    public synchronized double nextDouble() {
        return generator.nextDouble();
    }

    @Override
    public IRandomProvider deriveFor(String scope, String key) {
        long derived = scramble(seed);
        derived = scramble(derived ^ scramble(fnv1a(scope)));
        derived = scramble(derived ^ scramble(fnv1a(key)));
        return new SeededRandomProvider(derived);
    }

    public long getSeed() {
        return seed;
    }

    // FNV-1a over the UTF-8 bytes; null hashes to 0
    private static long fnv1a(String text) {
        if (text == null) {
            return 0L;
        }
        long hash = FNV_OFFSET;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            hash = (hash ^ (b & 0xFF)) * FNV_PRIME;
        }
        return hash;
    }

    // SplitMix64 finalizer
    private static long scramble(long value) {
        long z = (value ^ (value >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }
}
