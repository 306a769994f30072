package com.ryuqq.solar.testkit.contract;

import com.ryuqq.solar.application.runner.AbstractRunner;
import com.ryuqq.solar.core.runner.RunnerSettings;

import java.time.Clock;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runner whose initialization and cycle outcomes are scripted by the test.
 *
 * <p>Cycles succeed unless a failure was queued with {@link #failNextCycles(int)}.
 * Each outcome is consumed in order.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public class ScriptedRunner extends AbstractRunner {

    private final AtomicBoolean initializeSucceeds = new AtomicBoolean(true);
    private final ConcurrentLinkedQueue<Boolean> failures = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean healthy = new AtomicBoolean(true);
    private final AtomicInteger cycles = new AtomicInteger();
    private final AtomicInteger cleanups = new AtomicInteger();
    private final CountDownLatch firstSuccess = new CountDownLatch(1);

    public ScriptedRunner(RunnerSettings settings) {
        super(settings);
    }

    public ScriptedRunner(RunnerSettings settings, Clock clock) {
        super(settings, clock);
    }

    @Override
    protected boolean initialize() {
        return initializeSucceeds.get();
    }

    @Override
    protected void workCycle() {
        cycles.incrementAndGet();
        if (failures.poll() != null) {
            throw new IllegalStateException("scripted cycle failure");
        }
        firstSuccess.countDown();
    }

    @Override
    protected boolean checkHealth() {
        return healthy.get();
    }

    @Override
    protected void cleanup() {
        cleanups.incrementAndGet();
    }

    public ScriptedRunner failInitialization() {
        initializeSucceeds.set(false);
        return this;
    }

    public ScriptedRunner failNextCycles(int count) {
        for (int i = 0; i < count; i++) {
            failures.add(Boolean.TRUE);
        }
        return this;
    }

    public void reportHealthy(boolean value) {
        healthy.set(value);
    }

    public int cycleCount() {
        return cycles.get();
    }

    public int cleanupCount() {
        return cleanups.get();
    }

    public CountDownLatch firstSuccess() {
        return firstSuccess;
    }
}
