package org.gridsweep.runtime.internal.services;

import java.lang.reflect.Field;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Random;

import org.apache.commons.math3.random.RandomAdaptor;
import org.apache.commons.math3.random.Well19937c;
import org.gridsweep.runtime.spi.IRandomProvider;

/**
 * Default implementation of {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * Supports deterministic derivation of child providers using a stable hashing scheme, so the
 * same run seed always yields the same grid, start positions and tie-breaks.
 * </p>
 * <p>
 * The generator state (the {@code v} array and {@code index} of {@code AbstractWell}) is read
 * and written through reflection for {@link #saveState()} and {@link #loadState(byte[])}.
 * </p>
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Well19937c rng;
    private final Random javaRandom;

    // Cached reflection fields, resolved once per provider
    private final Field vField;
    private final Field indexField;

    /**
     * Creates a new seeded random provider.
     * @param seed The initial seed for the random number generator.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
        this.javaRandom = new RandomAdaptor(rng);
        try {
            this.vField = rng.getClass().getSuperclass().getDeclaredField("v");
            this.indexField = rng.getClass().getSuperclass().getDeclaredField("index");
            this.vField.setAccessible(true);
            this.indexField.setAccessible(true);
        } catch (NoSuchFieldException e) {
            throw new IllegalStateException("Failed to initialize RNG reflection fields", e);
        }
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public Random asJavaRandom() {
        return javaRandom;
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        long h = mix64(seed);
        h = mix64(h ^ mix64(hashString(scope)));
        h = mix64(h ^ mix64(key));
        return new SeededRandomProvider(h);
    }

    /**
     * Hashes a string using the FNV-1a 64-bit algorithm.
     * @param s The string to hash.
     * @return The hashed value.
     */
    private static long hashString(String s) {
        if (s == null) return 0L;
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        long h = 1469598103934665603L; // FNV-1a 64-bit offset basis
        for (byte value : b) {
            h ^= (value & 0xFF);
            h *= 1099511628211L; // FNV-1a prime
        }
        return h;
    }

    /**
     * A SplitMix64 mix function for good bit diffusion.
     * @param z The value to mix.
     * @return The mixed value.
     */
    private static long mix64(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }

    @Override
    public byte[] saveState() {
        try {
            int[] v = (int[]) vField.get(rng);
            ByteBuffer buffer = ByteBuffer.allocate(4 + v.length * 4);
            buffer.putInt(indexField.getInt(rng));
            for (int value : v) {
                buffer.putInt(value);
            }
            return buffer.array();
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Failed to serialize RNG state", e);
        }
    }

    @Override
    public void loadState(byte[] state) {
        if (state == null) {
            throw new IllegalArgumentException("RNG state cannot be null");
        }
        try {
            ByteBuffer buffer = ByteBuffer.wrap(state);
            int index = buffer.getInt();
            int[] v = (int[]) vField.get(rng);
            if (buffer.remaining() != v.length * 4) {
                throw new IllegalArgumentException("RNG state has " + state.length + " bytes, expected "
                        + (4 + v.length * 4));
            }
            // v is final in AbstractWell, so it is overwritten in place
            for (int i = 0; i < v.length; i++) {
                v[i] = buffer.getInt();
            }
            indexField.setInt(rng, index);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Failed to deserialize RNG state", e);
        }
    }
}
