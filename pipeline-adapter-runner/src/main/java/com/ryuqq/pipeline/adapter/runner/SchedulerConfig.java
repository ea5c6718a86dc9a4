package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.core.protection.EnvironmentProtection;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DagScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>tagConcurrency: 태그별 최대 동시 실행 Job 수 (runner 풀 크기)</li>
 *   <li>defaultConcurrency: 목록에 없는 태그와 태그 없는 Job의 풀 크기 (0이면 무제한, 기본 0)</li>
 *   <li>defaultJobTimeout: timeout을 지정하지 않은 Job의 제한 시간 (null이면 없음, 기본 1시간)</li>
 *   <li>cancelGracePeriod: 취소 신호 후 강제 CANCELED까지의 유예 시간 (기본 30초)</li>
 *   <li>environmentProtection: 보호된 environment 규칙 (기본 없음)</li>
 *   <li>timerThreads: 타이머/완료 처리 스레드 수 (기본 2)</li>
 * </ul>
 *
 * @param tagConcurrency 태그 → 최대 동시 실행 수
 * @param defaultConcurrency 기본 풀 크기 (0 이상)
 * @param defaultJobTimeout 기본 Job 제한 시간
 * @param cancelGracePeriod 취소 유예 시간 (양수)
 * @param environmentProtection environment 보호 규칙
 * @param timerThreads 타이머 스레드 수 (1 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SchedulerConfig(
    Map<String, Integer> tagConcurrency,
    int defaultConcurrency,
    Duration defaultJobTimeout,
    Duration cancelGracePeriod,
    EnvironmentProtection environmentProtection,
    int timerThreads
) {

    public static final int UNLIMITED = 0;

    /**
     * 기본 설정 생성자.
     */
    public SchedulerConfig() {
        this(Map.of(), UNLIMITED, Duration.ofHours(1), Duration.ofSeconds(30), EnvironmentProtection.NONE, 2);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SchedulerConfig {
        if (tagConcurrency == null) {
            tagConcurrency = Map.of();
        }
        tagConcurrency.forEach((tag, limit) -> {
            if (limit == null || limit <= 0) {
                throw new IllegalArgumentException(
                    "Concurrency of tag '" + tag + "' must be positive (current: " + limit + ")"
                );
            }
        });
        tagConcurrency = Map.copyOf(tagConcurrency);
        if (defaultConcurrency < 0) {
            throw new IllegalArgumentException(
                "defaultConcurrency cannot be negative (current: " + defaultConcurrency + ")"
            );
        }
        if (defaultJobTimeout != null && (defaultJobTimeout.isNegative() || defaultJobTimeout.isZero())) {
            throw new IllegalArgumentException(
                "defaultJobTimeout must be positive (current: " + defaultJobTimeout + ")"
            );
        }
        if (cancelGracePeriod == null || cancelGracePeriod.isNegative() || cancelGracePeriod.isZero()) {
            throw new IllegalArgumentException(
                "cancelGracePeriod must be positive (current: " + cancelGracePeriod + ")"
            );
        }
        if (environmentProtection == null) {
            throw new IllegalArgumentException("environmentProtection cannot be null");
        }
        if (timerThreads <= 0) {
            throw new IllegalArgumentException(
                "timerThreads must be positive (current: " + timerThreads + ")"
            );
        }
    }

    /**
     * 태그의 풀 크기.
     *
     * @param tag 태그 (null이면 태그 없는 Job의 기본 풀)
     * @return 최대 동시 실행 수, 무제한이면 {@link #UNLIMITED}
     */
    public int concurrencyOf(String tag) {
        if (tag == null) {
            return defaultConcurrency;
        }
        return tagConcurrency.getOrDefault(tag, defaultConcurrency);
    }

    /**
     * 태그 하나의 풀 크기만 추가/변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withTagConcurrency(String tag, int limit) {
        Map<String, Integer> copy = new LinkedHashMap<>(tagConcurrency);
        copy.put(tag, limit);
        return new SchedulerConfig(copy, defaultConcurrency, defaultJobTimeout, cancelGracePeriod, environmentProtection, timerThreads);
    }

    /**
     * defaultConcurrency만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withDefaultConcurrency(int defaultConcurrency) {
        return new SchedulerConfig(tagConcurrency, defaultConcurrency, defaultJobTimeout, cancelGracePeriod, environmentProtection, timerThreads);
    }

    /**
     * defaultJobTimeout만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withDefaultJobTimeout(Duration defaultJobTimeout) {
        return new SchedulerConfig(tagConcurrency, defaultConcurrency, defaultJobTimeout, cancelGracePeriod, environmentProtection, timerThreads);
    }

    /**
     * cancelGracePeriod만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withCancelGracePeriod(Duration cancelGracePeriod) {
        return new SchedulerConfig(tagConcurrency, defaultConcurrency, defaultJobTimeout, cancelGracePeriod, environmentProtection, timerThreads);
    }

    /**
     * environmentProtection만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withEnvironmentProtection(EnvironmentProtection environmentProtection) {
        return new SchedulerConfig(tagConcurrency, defaultConcurrency, defaultJobTimeout, cancelGracePeriod, environmentProtection, timerThreads);
    }

    /**
     * timerThreads만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withTimerThreads(int timerThreads) {
        return new SchedulerConfig(tagConcurrency, defaultConcurrency, defaultJobTimeout, cancelGracePeriod, environmentProtection, timerThreads);
    }
}
