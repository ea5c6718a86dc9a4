package com.ryuqq.pipeline.core.protection.noop;

import com.ryuqq.pipeline.core.protection.Bulkhead;
import com.ryuqq.pipeline.core.protection.BulkheadConfig;

/**
 * Bulkhead NoOp 구현.
 *
 * <p>동시 실행 수 제한을 적용하지 않습니다. 제한이 설정되지 않은 태그의 Job에 사용됩니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>tryAcquire(): 항상 true 반환</li>
 *   <li>release(): 아무 동작 안 함</li>
 *   <li>getCurrentConcurrency(): 항상 0 반환</li>
 *   <li>getConfig(): 무제한 설정 반환</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpBulkhead implements Bulkhead {

    public static final NoOpBulkhead INSTANCE = new NoOpBulkhead();

    private static final BulkheadConfig UNLIMITED_CONFIG = new BulkheadConfig(Integer.MAX_VALUE);

    @Override
    public boolean tryAcquire(String holder) {
        return true;
    }

    @Override
    public void release(String holder) {
        // NoOp
    }

    @Override
    public int getCurrentConcurrency() {
        return 0;
    }

    @Override
    public BulkheadConfig getConfig() {
        return UNLIMITED_CONFIG;
    }
}
