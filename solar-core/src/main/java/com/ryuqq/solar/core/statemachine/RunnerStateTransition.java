package com.ryuqq.solar.core.statemachine;

/**
 * Runner 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CREATED → INITIALIZING, STOPPED</li>
 *   <li>INITIALIZING → RUNNING, ERROR, STOPPED</li>
 *   <li>RUNNING → ERROR, STOPPED</li>
 *   <li>ERROR → RUNNING, STOPPED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>STOPPED에서는 어떤 상태로도 전이 불가</li>
 *   <li>CREATED로 되돌아가는 전이 불가</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class RunnerStateTransition {

    // Utility class - prevent instantiation
    private RunnerStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 허용 여부.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(RunnerState from, RunnerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case CREATED -> to == RunnerState.INITIALIZING || to == RunnerState.STOPPED;
            case INITIALIZING -> to == RunnerState.RUNNING || to == RunnerState.ERROR || to == RunnerState.STOPPED;
            case RUNNING -> to == RunnerState.ERROR || to == RunnerState.STOPPED;
            case ERROR -> to == RunnerState.RUNNING || to == RunnerState.STOPPED;
            case STOPPED -> false; // 종료 상태
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RunnerState from, RunnerState to) {
        if (from != null && from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RunnerState transition(RunnerState current, RunnerState next) {
        validate(current, next);
        return next;
    }
}
