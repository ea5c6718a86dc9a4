package com.ryuqq.pipeline.core.statemachine;

/**
 * JobInstance의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING ──► READY ──► RUNNING ──► SUCCESS
 *    │          │          │
 *    │          │          ├─► FAILED ──► READY (재시도)
 *    │          ├─► FAILED (디스패치 전 실패)
 *    ├─► SKIPPED│          └─► CANCELED
 *    └─► CANCELED ◄────────┘
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum JobState {

    /**
     * 선행 Job 대기 중.
     */
    PENDING,

    /**
     * 디스패치 가능 (슬롯 대기 또는 재시도 backoff 중).
     */
    READY,

    /**
     * Executor에서 실행 중.
     */
    RUNNING,

    SUCCESS,

    FAILED,

    /**
     * 디스패치 없이 건너뜀 ({@link SkipReason} 참고).
     */
    SKIPPED,

    CANCELED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>FAILED는 종료 상태지만 재시도 예산이 남아 있으면 READY로 돌아갈 수 있습니다.</p>
     *
     * @return SUCCESS, FAILED, SKIPPED, CANCELED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == SKIPPED || this == CANCELED;
    }
}
