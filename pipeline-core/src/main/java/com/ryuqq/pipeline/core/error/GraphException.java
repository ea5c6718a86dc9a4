package com.ryuqq.pipeline.core.error;

/**
 * Job 그래프 구성 오류.
 *
 * <p>순환 의존, 해석할 수 없는 needs 참조, 이후 stage를 가리키는 needs 등
 * DAG를 만들 수 없는 경우 그래프 빌드 시점에 발생합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class GraphException extends PipelineException {

    public GraphException(String message) {
        super(message);
    }

    public GraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
