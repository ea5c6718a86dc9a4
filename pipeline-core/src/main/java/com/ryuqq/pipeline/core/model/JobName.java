package com.ryuqq.pipeline.core.model;

/**
 * 파이프라인 내 Job의 식별자.
 *
 * <p>정의 문서의 Job 키를 그대로 사용합니다. 공백과 슬래시를 포함할 수 있습니다
 * (예: {@code "vanilla current"}, {@code "docs build"}).</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>제어 문자 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JobName {

    private final String value;

    private JobName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("JobName cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("JobName length cannot exceed 255 characters");
        }
        if (value.chars().anyMatch(Character::isISOControl)) {
            throw new IllegalArgumentException("JobName cannot contain control characters");
        }
        this.value = value;
    }

    /**
     * JobName 생성.
     *
     * @param value Job 이름
     * @return JobName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static JobName of(String value) {
        return new JobName(value);
    }

    /**
     * JobName 값 조회.
     *
     * @return Job 이름
     */
    public String getValue() {
        return value;
    }

    /**
     * 템플릿 전용(숨김) Job인지 확인.
     *
     * <p>이름이 {@code .}으로 시작하는 Job은 extends 대상으로만 사용되며 실행되지 않습니다.</p>
     *
     * @return 숨김 Job이면 true
     */
    public boolean isHidden() {
        return value.startsWith(".");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobName jobName = (JobName) o;
        return value.equals(jobName.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
