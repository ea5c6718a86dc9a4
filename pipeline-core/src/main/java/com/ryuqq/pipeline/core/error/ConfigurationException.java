package com.ryuqq.pipeline.core.error;

/**
 * 파이프라인 정의 오류.
 *
 * <p>정의 문서 로드 시점에 발생하며, 파이프라인은 시작되지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>잘못된 rules 조건식 ({@code $A ==})</li>
 *   <li>존재하지 않는 extends 대상</li>
 *   <li>순환 extends ({@code .a → .b → .a})</li>
 *   <li>알 수 없는 when / retry 값</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConfigurationException extends PipelineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
