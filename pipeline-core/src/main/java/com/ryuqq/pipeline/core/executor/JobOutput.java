package com.ryuqq.pipeline.core.executor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Job 실행 후 워크스페이스에 남은 파일.
 *
 * <p>경로는 워크스페이스 기준 상대 경로('/' 구분)입니다. 아티팩트와 캐시는
 * 이 파일들 중 Job 정의의 paths와 일치하는 것만 수집됩니다.</p>
 *
 * @param files 경로 → 내용
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobOutput(Map<String, FileContent> files) {

    public static final JobOutput EMPTY = new JobOutput(Map.of());

    public JobOutput {
        files = files == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    public static JobOutput of(Map<String, FileContent> files) {
        return new JobOutput(files);
    }

    /**
     * 텍스트 파일만으로 생성 (UTF-8).
     */
    public static JobOutput ofText(Map<String, String> files) {
        Map<String, FileContent> contents = new LinkedHashMap<>();
        files.forEach((path, text) -> contents.put(path, FileContent.ofText(text)));
        return new JobOutput(contents);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
