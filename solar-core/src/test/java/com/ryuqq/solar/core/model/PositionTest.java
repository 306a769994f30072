package com.ryuqq.solar.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PositionTest {

    @Test
    void distanceTo_PythagoreanTriple_ReturnsHypotenuse() {
        Position a = new Position(0.0, 0.0);
        Position b = new Position(3.0, 4.0);

        assertEquals(5.0, a.distanceTo(b), 1e-9);
        assertEquals(5.0, b.distanceTo(a), 1e-9);
    }

    @Test
    void distanceTo_Self_IsZero() {
        Position p = new Position(12.5, -3.0);

        assertEquals(0.0, p.distanceTo(p));
    }

    @Test
    void constructor_NonFiniteCoordinate_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Position(Double.NaN, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new Position(0.0, Double.POSITIVE_INFINITY));
    }
}
