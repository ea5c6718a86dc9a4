package com.ryuqq.pipeline.core.protection;

/**
 * Bulkhead SPI.
 *
 * <p>동시 실행 수를 제한하여 유한한 runner 풀(태그)과 resource group을 모델링합니다.
 * 스케줄러는 블로킹하지 않으므로 진입은 항상 즉시 판정됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (!bulkhead.tryAcquire(job.id())) {
 *     // 슬롯이 빌 때까지 READY로 대기
 *     return;
 * }
 * executor.dispatch(job, environment)
 *     .whenComplete((outcome, error) -> bulkhead.release(job.id()));
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Bulkhead {

    /**
     * Bulkhead 진입 시도 (비블로킹).
     *
     * @param holder 슬롯을 점유할 주체 (JobInstance id, 로깅용)
     * @return true: 진입 허용, false: 동시 실행 제한 초과
     */
    boolean tryAcquire(String holder);

    /**
     * Bulkhead 진입 해제.
     *
     * @param holder 슬롯을 점유했던 주체
     */
    void release(String holder);

    /**
     * 현재 동시 실행 수 조회.
     *
     * @return 현재 진입 중인 작업 수
     */
    int getCurrentConcurrency();

    /**
     * Bulkhead 설정 정보 조회.
     *
     * @return Bulkhead 설정
     */
    BulkheadConfig getConfig();
}
