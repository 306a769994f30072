package com.ryuqq.solar.application.safety;

import com.ryuqq.solar.core.safety.SafetyEnvelope;
import com.ryuqq.solar.core.safety.SafetyPolicy;
import com.ryuqq.solar.core.spi.BatterySource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

/**
 * BatterySafetyMonitor 유닛 테스트.
 *
 * <ul>
 *   <li>샘플링 성공/실패/빈 값</li>
 *   <li>클램프</li>
 *   <li>staleness → 보수적 엔벨로프</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BatterySafetyMonitorTest {

    private static final Instant T0 = Instant.parse("2026-06-01T08:00:00Z");

    @Mock
    private BatterySource source;

    @Mock
    private Clock clock;

    private final AtomicReference<Instant> now = new AtomicReference<>(T0);
    private BatterySafetyMonitor monitor;

    @BeforeEach
    void setUp() {
        when(clock.instant()).thenAnswer(invocation -> now.get());
        monitor = new BatterySafetyMonitor(source, new SafetyPolicy(), clock);
    }

    @Test
    void envelope_샘플이_없으면_stale() {
        SafetyEnvelope envelope = monitor.envelope();

        assertThat(envelope.stale()).isTrue();
        assertThat(envelope.lowBattery()).isTrue();
        assertThat(envelope.allowedDistance()).isZero();
    }

    @Test
    void sample_성공하면_엔벨로프_계산() {
        when(source.readPercentage()).thenReturn(OptionalDouble.of(50.0));

        monitor.sample();
        SafetyEnvelope envelope = monitor.envelope();

        assertThat(envelope.stale()).isFalse();
        assertThat(envelope.lowBattery()).isFalse();
        assertThat(envelope.allowedDistance()).isCloseTo(25.0, within(1e-9));
        assertThat(monitor.latest()).get().extracting(state -> state.sampledAt()).isEqualTo(T0);
    }

    @Test
    void sample_범위_밖_값은_클램프() {
        when(source.readPercentage()).thenReturn(OptionalDouble.of(104.2), OptionalDouble.of(-3.0));

        assertThat(monitor.sample()).get().extracting(state -> state.percentage()).isEqualTo(100.0);
        assertThat(monitor.sample()).get().extracting(state -> state.percentage()).isEqualTo(0.0);
    }

    @Test
    void sample_소스_예외면_이전_샘플_유지() {
        when(source.readPercentage())
            .thenReturn(OptionalDouble.of(80.0))
            .thenThrow(new IllegalStateException("i2c bus error"));

        monitor.sample();
        now.set(T0.plusSeconds(1));
        monitor.sample();

        assertThat(monitor.latest()).get().extracting(state -> state.percentage()).isEqualTo(80.0);
        assertThat(monitor.latest()).get().extracting(state -> state.sampledAt()).isEqualTo(T0);
    }

    @Test
    void sample_빈_값이면_이전_샘플_유지() {
        when(source.readPercentage()).thenReturn(OptionalDouble.of(70.0), OptionalDouble.empty());

        monitor.sample();
        monitor.sample();

        assertThat(monitor.latest()).get().extracting(state -> state.percentage()).isEqualTo(70.0);
    }

    @Test
    void envelope_staleAfter_초과하면_stale() {
        monitor.record(90.0);

        now.set(T0.plus(Duration.ofSeconds(10)));
        assertThat(monitor.envelope().stale()).isFalse();

        now.set(T0.plus(Duration.ofSeconds(10)).plusMillis(1));
        SafetyEnvelope envelope = monitor.envelope();
        assertThat(envelope.stale()).isTrue();
        assertThat(envelope.lowBattery()).isTrue();
        assertThat(envelope.batteryPercentage()).isEqualTo(90.0);
        assertThat(envelope.allowedDistance()).isZero();
    }

    @Test
    void envelope_퍼센트에_대해_단조() {
        double previous = -1.0;
        for (int p = 0; p <= 100; p += 5) {
            monitor.record(p);
            double allowed = monitor.envelope().allowedDistance();
            assertThat(allowed).isGreaterThanOrEqualTo(previous);
            previous = allowed;
        }
    }
}
