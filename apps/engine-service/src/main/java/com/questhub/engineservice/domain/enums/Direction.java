package com.questhub.engineservice.domain.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * 移动方向及其坐标增量。
 */
public enum Direction {
    NORTH(0, 1),
    SOUTH(0, -1),
    EAST(1, 0),
    WEST(-1, 0);

    private final int dx;
    private final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public int dx() {
        return dx;
    }

    public int dy() {
        return dy;
    }

    public static Optional<Direction> parse(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Direction.valueOf(String.valueOf(raw).trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
