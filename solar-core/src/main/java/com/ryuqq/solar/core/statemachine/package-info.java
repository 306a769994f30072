/**
 * Runner lifecycle state machine.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.solar.core.statemachine.RunnerState} - runner lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.solar.core.statemachine.RunnerStateTransition} - transition validation</li>
 *   <li>{@link com.ryuqq.solar.core.statemachine.EvaluationState} - schedule engine tick states</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * CREATED → INITIALIZING (worker started)
 * INITIALIZING → RUNNING | ERROR
 * RUNNING ⇄ ERROR (cycle failure / recovery)
 * any non-terminal → STOPPED
 *
 * Forbidden:
 * - STOPPED → * (terminal state)
 * - * → CREATED
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * RunnerState state = RunnerState.CREATED;
 * state = RunnerStateTransition.transition(state, RunnerState.INITIALIZING);
 * state = RunnerStateTransition.transition(state, RunnerState.RUNNING);
 *
 * // This will throw IllegalStateException
 * RunnerStateTransition.validate(RunnerState.STOPPED, RunnerState.RUNNING);
 * </pre>
 *
 * @since 1.0.0
 * @author Solar Team
 */
package com.ryuqq.solar.core.statemachine;
