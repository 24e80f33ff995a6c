package com.questhub.engineservice.engine.core;

/**
 * 随机数来源抽象。
 * 战斗结算与敌人决策都通过它取随机值，便于用固定种子复现整场战斗。
 */
public interface RandomSource {

    /**
     * @return [0, 1) 区间的随机数
     */
    double nextDouble();

    /**
     * @return [0, bound) 区间的随机整数
     */
    default int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive");
        }
        return (int) Math.floor(nextDouble() * bound);
    }

    /**
     * 掷一个 n 面骰，结果 1..n。
     */
    default int roll(int sides) {
        return nextInt(sides) + 1;
    }
}
