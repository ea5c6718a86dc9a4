package com.ryuqq.pipeline.core.statemachine;

/**
 * SKIPPED 상태가 된 이유.
 *
 * <p>정당한 skip(rules 제외, 수동 Job 미실행, 그 여파)은 파이프라인 성공을 막지 않지만
 * upstream 실패로 인한 skip은 파이프라인을 실패시킵니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SkipReason {

    RULES_EXCLUDED(true),

    MANUAL_NOT_PLAYED(true),

    /**
     * needs 대상이 정당하게 skip되어 실행할 수 없음.
     */
    UPSTREAM_SKIPPED(true),

    /**
     * upstream Job이 실패해 실행하지 않음.
     */
    UPSTREAM_FAILED(false);

    private final boolean legitimate;

    SkipReason(boolean legitimate) {
        this.legitimate = legitimate;
    }

    public boolean isLegitimate() {
        return legitimate;
    }
}
