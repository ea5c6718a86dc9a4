package com.ryuqq.pipeline.core.definition;

import java.util.List;

/**
 * Job의 캐시 선언 ({@code cache}).
 *
 * @param key 캐시 키 (변수 확장 대상, null: {@value #DEFAULT_KEY})
 * @param paths 캐시 경로 (null 가능)
 * @param policy 사용 정책 (null: pull-push)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CacheSpec(String key, List<String> paths, CachePolicy policy) {

    public static final String DEFAULT_KEY = "default";

    public CacheSpec {
        paths = paths == null ? null : List.copyOf(paths);
    }

    public static CacheSpec of(String key, List<String> paths) {
        return new CacheSpec(key, paths, null);
    }

    public String effectiveKey() {
        return key == null || key.isBlank() ? DEFAULT_KEY : key;
    }

    public CachePolicy effectivePolicy() {
        return policy == null ? CachePolicy.PULL_PUSH : policy;
    }

    public List<String> effectivePaths() {
        return paths == null ? List.of() : paths;
    }

    /**
     * 부모 설정 위에 이 설정을 키 단위로 덮어쓴 결과.
     *
     * @param parent 부모 설정 (null 가능)
     * @return 병합 결과
     */
    public CacheSpec mergeOver(CacheSpec parent) {
        if (parent == null) {
            return this;
        }
        return new CacheSpec(
            key != null ? key : parent.key,
            paths != null ? paths : parent.paths,
            policy != null ? policy : parent.policy
        );
    }
}
