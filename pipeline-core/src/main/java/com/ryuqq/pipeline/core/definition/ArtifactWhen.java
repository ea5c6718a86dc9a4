package com.ryuqq.pipeline.core.definition;

import com.ryuqq.pipeline.core.error.ConfigurationException;

import java.util.Arrays;

/**
 * 아티팩트 수집 정책 ({@code artifacts.when}).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ArtifactWhen {

    ON_SUCCESS("on_success"),
    ON_FAILURE("on_failure"),
    ALWAYS("always");

    private final String wireValue;

    ArtifactWhen(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Job 결과에 대해 수집 여부 결정.
     *
     * @param succeeded Job 성공 여부
     * @return 수집하면 true
     */
    public boolean collects(boolean succeeded) {
        return switch (this) {
            case ON_SUCCESS -> succeeded;
            case ON_FAILURE -> !succeeded;
            case ALWAYS -> true;
        };
    }

    public static ArtifactWhen fromWireValue(String value) {
        return Arrays.stream(values())
            .filter(when -> when.wireValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException("Unknown artifacts:when value: " + value));
    }
}
