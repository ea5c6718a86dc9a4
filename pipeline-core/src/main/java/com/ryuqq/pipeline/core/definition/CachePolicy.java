package com.ryuqq.pipeline.core.definition;

import com.ryuqq.pipeline.core.error.ConfigurationException;

import java.util.Arrays;

/**
 * 캐시 사용 정책 ({@code cache.policy}).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CachePolicy {

    PULL_PUSH("pull-push"),
    PULL("pull"),
    PUSH("push");

    private final String wireValue;

    CachePolicy(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean pulls() {
        return this != PUSH;
    }

    public boolean pushes() {
        return this != PULL;
    }

    public static CachePolicy fromWireValue(String value) {
        return Arrays.stream(values())
            .filter(policy -> policy.wireValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException("Unknown cache policy: " + value));
    }
}
