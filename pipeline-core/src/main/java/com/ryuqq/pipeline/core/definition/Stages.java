package com.ryuqq.pipeline.core.definition;

import com.ryuqq.pipeline.core.error.ConfigurationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 순서가 있는 stage 목록.
 *
 * <p>{@code .pre}는 항상 첫 번째, {@code .post}는 항상 마지막 stage로 포함됩니다.
 * stage N의 모든 Job이 종료되어야 stage N+1의 Job이 시작됩니다 (needs로 우회 가능).</p>
 *
 * @param names stage 이름 (선언 순서)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Stages(List<String> names) {

    public static final String PRE = ".pre";
    public static final String POST = ".post";

    /**
     * stage를 지정하지 않은 Job의 기본 stage.
     */
    public static final String DEFAULT_JOB_STAGE = "test";

    /**
     * stages를 선언하지 않은 정의의 기본 목록.
     */
    public static final Stages DEFAULT = of(List.of("build", "test", "deploy"));

    /**
     * Compact Constructor.
     *
     * @throws ConfigurationException 빈 이름이나 중복 stage가 있는 경우
     */
    public Stages {
        if (names == null || names.isEmpty()) {
            throw new ConfigurationException("stages cannot be empty");
        }
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("stage name cannot be blank");
            }
            if (!seen.add(name)) {
                throw new ConfigurationException("Duplicate stage: " + name);
            }
        }
        names = List.copyOf(names);
    }

    /**
     * 선언된 stage 목록에 {@code .pre}/{@code .post}를 더해 생성.
     *
     * @param declared 정의 문서의 stages
     * @return Stages
     */
    public static Stages of(List<String> declared) {
        List<String> all = new ArrayList<>();
        all.add(PRE);
        for (String name : declared) {
            if (!PRE.equals(name) && !POST.equals(name)) {
                all.add(name);
            }
        }
        all.add(POST);
        return new Stages(all);
    }

    /**
     * stage 순서 조회.
     *
     * @param name stage 이름
     * @return 0부터 시작하는 순서, 없으면 -1
     */
    public int indexOf(String name) {
        return names.indexOf(name);
    }

    public boolean contains(String name) {
        return names.contains(name);
    }
}
