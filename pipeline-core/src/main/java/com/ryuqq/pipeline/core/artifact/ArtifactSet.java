package com.ryuqq.pipeline.core.artifact;

import com.ryuqq.pipeline.core.executor.FileContent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 한 Job 시도가 생산한 아티팩트 묶음.
 *
 * @param reference 참조 정보
 * @param files 경로 → 내용
 * @param dotenv dotenv 리포트 변수 (없으면 빈 맵)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ArtifactSet(
    ArtifactReference reference,
    Map<String, FileContent> files,
    Map<String, String> dotenv
) {

    public ArtifactSet {
        if (reference == null) {
            throw new IllegalArgumentException("reference cannot be null");
        }
        files = files == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(files));
        dotenv = dotenv == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(dotenv));
    }
}
