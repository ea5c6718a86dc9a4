package com.ryuqq.pipeline.core.protection;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 보호된 environment에 대한 배포 제한.
 *
 * <p>보호된 environment(패턴)에 배포하는 Job은 보호된 ref(패턴)에서만 실행할 수 있습니다.
 * 패턴에서 {@code *}는 임의의 문자열과 일치합니다 (예: {@code production}, {@code review/*},
 * {@code release-*}).</p>
 *
 * @param protectedEnvironments 보호된 environment 이름 패턴
 * @param protectedRefs 보호된 environment에 배포할 수 있는 ref 패턴
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EnvironmentProtection(List<String> protectedEnvironments, List<String> protectedRefs) {

    /**
     * 보호 없음.
     */
    public static final EnvironmentProtection NONE = new EnvironmentProtection(List.of(), List.of());

    public EnvironmentProtection {
        protectedEnvironments = protectedEnvironments == null ? List.of() : List.copyOf(protectedEnvironments);
        protectedRefs = protectedRefs == null ? List.of() : List.copyOf(protectedRefs);
    }

    public static EnvironmentProtection of(List<String> protectedEnvironments, List<String> protectedRefs) {
        return new EnvironmentProtection(protectedEnvironments, protectedRefs);
    }

    public boolean isProtected(String environment) {
        return environment != null && matchesAny(protectedEnvironments, environment);
    }

    /**
     * ref에서 environment로 배포할 수 있는지 확인.
     *
     * @param environment environment 이름 (null이면 항상 허용)
     * @param ref 파이프라인 ref 이름
     * @return 허용되면 true
     */
    public boolean isAllowed(String environment, String ref) {
        return !isProtected(environment) || matchesAny(protectedRefs, ref);
    }

    private static boolean matchesAny(List<String> patterns, String value) {
        for (String pattern : patterns) {
            if (toRegex(pattern).matcher(value).matches()) {
                return true;
            }
        }
        return false;
    }

    private static Pattern toRegex(String wildcard) {
        StringBuilder regex = new StringBuilder();
        String[] parts = wildcard.split("\\*", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(parts[i]));
        }
        return Pattern.compile(regex.toString());
    }
}
