package com.ryuqq.pipeline.core.retry;

import com.ryuqq.pipeline.core.error.ConfigurationException;

import java.util.Arrays;

/**
 * Job 실패 분류.
 *
 * <p>인프라 실패(러너/API/스케줄러)와 Job 자체의 실패를 구분합니다.
 * 인프라 실패는 재시도 예산이 남아있는 한 항상 재시도 대상이며,
 * Job 실패는 {@code retry.when}에 명시된 경우에만 재시도됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailureReason {

    UNKNOWN_FAILURE("unknown_failure", false),
    SCRIPT_FAILURE("script_failure", false),
    JOB_EXECUTION_TIMEOUT("job_execution_timeout", false),
    API_FAILURE("api_failure", true),
    RUNNER_SYSTEM_FAILURE("runner_system_failure", true),
    RUNNER_UNSUPPORTED("runner_unsupported", true),
    STUCK_OR_TIMEOUT_FAILURE("stuck_or_timeout_failure", true),
    SCHEDULER_FAILURE("scheduler_failure", true),
    DATA_INTEGRITY_FAILURE("data_integrity_failure", true),

    /** 필수 upstream 아티팩트 없음 (디스패치 전 판정, 재시도 불가). */
    MISSING_DEPENDENCY_FAILURE("missing_dependency_failure", false),

    /** 보호된 environment에 대한 배포 거부 (디스패치 전 판정, 재시도 불가). */
    PROTECTED_ENVIRONMENT_FAILURE("protected_environment_failure", false);

    private final String wireValue;
    private final boolean infrastructure;

    FailureReason(String wireValue, boolean infrastructure) {
        this.wireValue = wireValue;
        this.infrastructure = infrastructure;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * 인프라 실패 여부.
     *
     * @return 러너/API/스케줄러 측 실패이면 true
     */
    public boolean isInfrastructure() {
        return infrastructure;
    }

    /**
     * 디스패치 이전에 판정되는 실패인지 확인.
     *
     * @return 재시도 대상이 될 수 없는 사전 실패이면 true
     */
    public boolean isPreDispatch() {
        return this == MISSING_DEPENDENCY_FAILURE || this == PROTECTED_ENVIRONMENT_FAILURE;
    }

    /**
     * 정의 문서 값으로부터 조회.
     *
     * @param value 예: {@code "runner_system_failure"}
     * @return FailureReason
     * @throws ConfigurationException 알 수 없는 값인 경우
     */
    public static FailureReason fromWireValue(String value) {
        return Arrays.stream(values())
            .filter(reason -> reason.wireValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException("Unknown retry reason: " + value));
    }
}
