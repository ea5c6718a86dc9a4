package com.ryuqq.pipeline.core.model;

import java.util.Arrays;

/**
 * 파이프라인을 트리거한 이벤트 종류 ({@code CI_PIPELINE_SOURCE}).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum PipelineSource {

    PUSH("push"),
    SCHEDULE("schedule"),
    MERGE_REQUEST_EVENT("merge_request_event"),
    WEB("web"),
    TRIGGER("trigger"),
    API("api"),
    PIPELINE("pipeline"),
    PARENT_PIPELINE("parent_pipeline"),
    EXTERNAL("external"),
    EXTERNAL_PULL_REQUEST_EVENT("external_pull_request_event"),
    CHAT("chat"),
    WEBIDE("webide");

    private final String wireValue;

    PipelineSource(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * 변수 값으로 노출되는 문자열.
     *
     * @return 예: {@code "schedule"}
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * 문자열로부터 PipelineSource 조회.
     *
     * <p>{@code merge_request}는 {@code merge_request_event}의 별칭으로 허용합니다.</p>
     *
     * @param value 변수 값
     * @return PipelineSource
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static PipelineSource fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("pipeline source cannot be null or blank");
        }
        if ("merge_request".equals(value)) {
            return MERGE_REQUEST_EVENT;
        }
        return Arrays.stream(values())
            .filter(source -> source.wireValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown pipeline source: " + value));
    }
}
