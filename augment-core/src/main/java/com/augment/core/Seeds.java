package com.augment.core;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** Stable seed derivation: the same (base seed, key) gives the same seed in every JVM. */
public final class Seeds {
    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private Seeds() {}

    public static long derive(long baseSeed, String key) {
        Objects.requireNonNull(key, "key");
        long h = FNV_OFFSET;
        for (byte b : key.getBytes(StandardCharsets.UTF_8)) {
            h ^= (b & 0xFF);
            h *= FNV_PRIME;
        }
        return mix(baseSeed ^ mix(h));
    }

    // splitmix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
