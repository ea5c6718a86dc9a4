package com.ryuqq.pipeline.core.rule;

/**
 * rules 평가 결과: Job 포함 여부와 실행 정책.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum JobInclusion {

    ON_SUCCESS,
    ALWAYS,
    MANUAL,

    /** 매칭된 rule이 never이거나, 어떤 rule도 매칭되지 않음. */
    EXCLUDED;

    /**
     * 파이프라인에 포함되는지 확인.
     *
     * @return EXCLUDED가 아니면 true
     */
    public boolean isIncluded() {
        return this != EXCLUDED;
    }
}
