package com.questhub.engineservice.combat;

import com.questhub.engineservice.engine.core.RandomSource;

/**
 * 可复现的骰子：第 n 次取值只由 (seed, n) 决定。
 * 游标随游戏状态一起保存，撤销后重放会得到相同的结果。
 */
public class CombatDice implements RandomSource {

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private final long seed;
    private long cursor;

    public CombatDice(long seed, long cursor) {
        this.seed = seed;
        this.cursor = cursor;
    }

    @Override
    public double nextDouble() {
        long z = mix64(seed + (cursor++ + 1) * GOLDEN_GAMMA);
        return (z >>> 11) * 0x1.0p-53;
    }

    public long cursor() {
        return cursor;
    }

    // SplitMix64 finalizer
    private static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
