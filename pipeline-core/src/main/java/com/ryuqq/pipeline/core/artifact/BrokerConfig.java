package com.ryuqq.pipeline.core.artifact;

import java.time.Duration;

/**
 * {@link ArtifactBroker} 설정.
 *
 * @param defaultExpireIn expire_in을 지정하지 않은 아티팩트의 보존 기간 (null이면 만료 없음)
 * @param maxDotenvVariables dotenv 리포트에서 읽을 최대 변수 개수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record BrokerConfig(Duration defaultExpireIn, int maxDotenvVariables) {

    public static final Duration DEFAULT_EXPIRE_IN = Duration.ofDays(30);
    public static final int DEFAULT_MAX_DOTENV_VARIABLES = 50;

    public BrokerConfig {
        if (defaultExpireIn != null && (defaultExpireIn.isNegative() || defaultExpireIn.isZero())) {
            throw new IllegalArgumentException("defaultExpireIn must be positive (current: " + defaultExpireIn + ")");
        }
        if (maxDotenvVariables <= 0) {
            throw new IllegalArgumentException("maxDotenvVariables must be positive (current: " + maxDotenvVariables + ")");
        }
    }

    public BrokerConfig() {
        this(DEFAULT_EXPIRE_IN, DEFAULT_MAX_DOTENV_VARIABLES);
    }

    public BrokerConfig withDefaultExpireIn(Duration defaultExpireIn) {
        return new BrokerConfig(defaultExpireIn, maxDotenvVariables);
    }

    public BrokerConfig withMaxDotenvVariables(int maxDotenvVariables) {
        return new BrokerConfig(defaultExpireIn, maxDotenvVariables);
    }
}
