package com.ryuqq.solar.testkit.contract;

import com.ryuqq.solar.core.spi.BatterySource;

import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory BatterySource whose reading can be changed from the test thread.
 *
 * <p>Supports three modes: a fixed percentage, no reading ({@link #clear()}),
 * and a failing sensor ({@link #failWith(RuntimeException)}).</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public class MutableBatterySource implements BatterySource {

    private final AtomicReference<Double> percentage = new AtomicReference<>();
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
    private final AtomicInteger reads = new AtomicInteger();

    public MutableBatterySource() {
    }

    public MutableBatterySource(double initialPercentage) {
        set(initialPercentage);
    }

    @Override
    public OptionalDouble readPercentage() {
        reads.incrementAndGet();
        RuntimeException error = failure.get();
        if (error != null) {
            throw error;
        }
        Double value = percentage.get();
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * Sets the next reading and clears any configured failure.
     */
    public void set(double value) {
        failure.set(null);
        percentage.set(value);
    }

    /**
     * Makes subsequent reads return no value.
     */
    public void clear() {
        failure.set(null);
        percentage.set(null);
    }

    /**
     * Makes subsequent reads throw the given exception.
     */
    public void failWith(RuntimeException error) {
        failure.set(error);
    }

    public int readCount() {
        return reads.get();
    }
}
