package com.ryuqq.solar.core.safety;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SafetyPolicy / SafetyEnvelope 테스트.
 *
 * <ul>
 *   <li>허용 거리 계산식과 단조성</li>
 *   <li>저전압 경계 (임계값 자체는 저전압 아님)</li>
 *   <li>stale 엔벨로프는 항상 저전압, 허용 거리 0</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
class SafetyPolicyTest {

    private final SafetyPolicy policy = new SafetyPolicy();

    @Test
    void allowedDistance_DefaultPolicy_MatchesFormula() {
        assertEquals(25.0, policy.allowedDistance(50.0), 1e-9);
        assertEquals(50.0, policy.allowedDistance(100.0), 1e-9);
        assertEquals(0.0, policy.allowedDistance(0.0), 1e-9);
    }

    @Test
    void allowedDistance_IsMonotonicInPercentage() {
        double previous = -1.0;
        for (int p = 0; p <= 100; p++) {
            double current = policy.allowedDistance(p);
            assertTrue(current >= previous, "allowedDistance decreased at " + p);
            previous = current;
        }
    }

    @Test
    void isLow_ThresholdBoundary() {
        assertTrue(policy.isLow(19.99));
        assertFalse(policy.isLow(20.0));
        assertFalse(policy.isLow(80.0));
    }

    @Test
    void envelope_LowBatteryExactlyBelowThreshold() {
        assertTrue(SafetyEnvelope.of(policy, 10.0).lowBattery());
        assertFalse(SafetyEnvelope.of(policy, 20.0).lowBattery());
        assertFalse(SafetyEnvelope.of(policy, 20.0).stale());
    }

    @Test
    void envelope_Permits_RespectsDistanceAndLowBattery() {
        SafetyEnvelope envelope = SafetyEnvelope.of(policy, 80.0);

        assertTrue(envelope.permits(40.0));
        assertFalse(envelope.permits(40.01));
        assertFalse(SafetyEnvelope.of(policy, 5.0).permits(0.0));
    }

    @Test
    void staleEnvelope_IsLowWithZeroDistance() {
        SafetyEnvelope envelope = SafetyEnvelope.stale(90.0);

        assertTrue(envelope.stale());
        assertTrue(envelope.lowBattery());
        assertEquals(0.0, envelope.allowedDistance());
        assertFalse(envelope.permits(0.0));
    }

    @Test
    void staleEnvelopeWithoutLowBattery_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new SafetyEnvelope(50.0, 0.0, false, true));
    }

    @Test
    void constructor_InvalidValues_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> policy.withMinBatteryThreshold(101.0));
        assertThrows(IllegalArgumentException.class, () -> policy.withMaxDistanceFactor(0.0));
        assertThrows(IllegalArgumentException.class, () -> policy.withTotalRange(-1.0));
        assertThrows(IllegalArgumentException.class, () -> policy.withStaleAfter(Duration.ZERO));
    }

    @Test
    void batteryState_OutOfRange_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new BatteryState(100.5, java.time.Instant.EPOCH));
        assertThrows(IllegalArgumentException.class, () -> new BatteryState(-0.1, java.time.Instant.EPOCH));
    }
}
