package com.ryuqq.pipeline.core.artifact;

import com.ryuqq.pipeline.core.executor.FileContent;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 파이프라인 실행 간에 공유되는 캐시 항목.
 *
 * @param key 캐시 키 (변수 확장 후)
 * @param files 경로 → 내용
 * @param savedAt 저장 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CacheEntry(String key, Map<String, FileContent> files, Instant savedAt) {

    public CacheEntry {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (savedAt == null) {
            throw new IllegalArgumentException("savedAt cannot be null");
        }
        files = files == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }
}
