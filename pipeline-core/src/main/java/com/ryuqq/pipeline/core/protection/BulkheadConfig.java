package com.ryuqq.pipeline.core.protection;

/**
 * Bulkhead 설정.
 *
 * @param maxConcurrentCalls 최대 동시 실행 수 (예: 태그별 runner 수)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record BulkheadConfig(int maxConcurrentCalls) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if maxConcurrentCalls is not positive
     */
    public BulkheadConfig {
        if (maxConcurrentCalls <= 0) {
            throw new IllegalArgumentException("maxConcurrentCalls must be positive");
        }
    }
}
