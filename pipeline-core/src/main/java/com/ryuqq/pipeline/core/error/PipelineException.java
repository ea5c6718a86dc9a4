package com.ryuqq.pipeline.core.error;

/**
 * 파이프라인 정의/그래프 단계에서 발생하는 치명적 오류의 상위 타입.
 *
 * <p>이 예외 계열은 파이프라인이 시작되기 전에 전체 실행을 중단시킵니다.
 * 개별 Job 실행 중 발생하는 실패는 예외가 아니라
 * {@link com.ryuqq.pipeline.core.outcome.ExecutionOutcome}으로 표현됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
