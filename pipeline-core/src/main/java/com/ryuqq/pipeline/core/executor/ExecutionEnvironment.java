package com.ryuqq.pipeline.core.executor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 디스패치 시점에 확정된 Job 실행 환경.
 *
 * @param variables 최종 변수 (컨텍스트 &lt; dotenv &lt; Job 변수)
 * @param files 복원된 캐시와 upstream 아티팩트 파일 (경로 → 내용, 아티팩트가 캐시를 덮어씀)
 * @param image 변수가 확장된 이미지 (없으면 null)
 * @param script 실행할 스크립트 (엔진은 해석하지 않음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExecutionEnvironment(
    Map<String, String> variables,
    Map<String, FileContent> files,
    String image,
    List<String> script
) {

    public ExecutionEnvironment {
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        files = files == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(files));
        script = script == null ? List.of() : List.copyOf(script);
    }

    public String variable(String name) {
        return variables.get(name);
    }
}
