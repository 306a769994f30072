package com.ryuqq.solar.core.model;

/**
 * 평면 좌표 (Dock 기준).
 *
 * <p>Dock은 원점이며, 거리 단위는 설정의 totalRange와 동일해야 합니다.</p>
 *
 * @param x X 좌표
 * @param y Y 좌표
 * @author Solar Team
 * @since 1.0.0
 */
public record Position(double x, double y) {

    /**
     * Dock 위치 (원점).
     */
    public static final Position ORIGIN = new Position(0.0, 0.0);

    public Position {
        if (Double.isNaN(x) || Double.isInfinite(x)) {
            throw new IllegalArgumentException("x must be a finite number (current: " + x + ")");
        }
        if (Double.isNaN(y) || Double.isInfinite(y)) {
            throw new IllegalArgumentException("y must be a finite number (current: " + y + ")");
        }
    }

    /**
     * 다른 좌표까지의 유클리드 거리.
     *
     * @param other 대상 좌표
     * @return 거리 (0 이상)
     */
    public double distanceTo(Position other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return Math.hypot(x - other.x, y - other.y);
    }
}
