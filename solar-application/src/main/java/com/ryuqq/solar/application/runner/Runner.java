package com.ryuqq.solar.application.runner;

import com.ryuqq.solar.core.model.RunnerKey;
import com.ryuqq.solar.core.runner.RunnerSettings;
import com.ryuqq.solar.core.runner.RunnerStatus;
import com.ryuqq.solar.core.statemachine.RunnerState;

/**
 * Read view of a supervised unit of periodic work.
 *
 * <p>Instances are created and owned by {@link RunnerManager}. Callers outside the manager
 * only observe a runner through this interface; lifecycle control stays with the manager.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * CREATED → INITIALIZING → RUNNING ⇄ ERROR → STOPPED
 * </pre>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>All methods may be called from any thread</li>
 *   <li>{@link #status()} returns a consistent snapshot (no torn reads)</li>
 *   <li>No method takes a lock shared with another runner</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public interface Runner {

    /**
     * Unique key of this runner.
     *
     * @return key
     */
    RunnerKey key();

    /**
     * Settings the runner was created from.
     *
     * @return immutable settings
     */
    RunnerSettings settings();

    /**
     * Current lifecycle state.
     *
     * @return state
     */
    RunnerState state();

    /**
     * Health check without side effects.
     *
     * <p>True iff the runner is RUNNING, has not exceeded its error ceiling, completed a
     * successful cycle within three intervals, and its own health hook agrees.</p>
     *
     * @return true if healthy
     */
    boolean isHealthy();

    /**
     * Immutable status snapshot.
     *
     * @return status
     */
    RunnerStatus status();
}
