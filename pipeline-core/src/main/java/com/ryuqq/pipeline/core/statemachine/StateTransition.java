package com.ryuqq.pipeline.core.statemachine;

/**
 * Job 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → READY, SKIPPED, CANCELED</li>
 *   <li>READY → RUNNING, FAILED, CANCELED</li>
 *   <li>RUNNING → SUCCESS, FAILED, CANCELED</li>
 *   <li>FAILED → READY (재시도)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> SUCCESS, SKIPPED, CANCELED에서는 어떤 상태로도 전이 불가.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(JobState from, JobState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case PENDING -> to == JobState.READY || to == JobState.SKIPPED || to == JobState.CANCELED;
            case READY -> to == JobState.RUNNING || to == JobState.FAILED || to == JobState.CANCELED;
            case RUNNING -> to == JobState.SUCCESS || to == JobState.FAILED || to == JobState.CANCELED;
            case FAILED -> to == JobState.READY;
            case SUCCESS, SKIPPED, CANCELED -> false;
        };

        if (!valid) {
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
    public static JobState transition(JobState current, JobState next) {
        validate(current, next);
        return next;
    }
}
