package com.ryuqq.pipeline.core.model;

import java.util.UUID;

/**
 * 파이프라인 실행의 고유 식별자.
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PipelineId {

    private final String value;

    private PipelineId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("PipelineId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("PipelineId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException(
                "PipelineId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    public static PipelineId of(String value) {
        return new PipelineId(value);
    }

    /**
     * 무작위 UUID 기반 PipelineId 생성.
     */
    public static PipelineId generate() {
        return new PipelineId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PipelineId that = (PipelineId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "PipelineId{" + value + '}';
    }
}
