package com.ryuqq.pipeline.core.model;

import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 문자열 내 변수 참조 확장.
 *
 * <p>지원 형식:</p>
 * <ul>
 *   <li>{@code $VAR}</li>
 *   <li>{@code ${VAR}}</li>
 *   <li>{@code ${VAR:-default}} (미정의 또는 빈 값이면 default)</li>
 * </ul>
 * <p>정의되지 않은 변수는 빈 문자열로 확장됩니다. {@code $$}는 리터럴 {@code $}입니다.
 * 확장은 한 번만 수행되며 결과를 다시 확장하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class VariableExpander {

    private static final Pattern REFERENCE = Pattern.compile(
        "\\$\\$|\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::-([^}]*))?}|\\$([A-Za-z_][A-Za-z0-9_]*)"
    );

    // Utility class - prevent instantiation
    private VariableExpander() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 변수 맵을 사용해 확장.
     *
     * @param text 원본 문자열 (null이면 null 반환)
     * @param variables 변수 맵
     * @return 확장된 문자열
     */
    public static String expand(String text, Map<String, String> variables) {
        return expand(text, variables::get);
    }

    /**
     * 변수 조회 함수를 사용해 확장.
     *
     * @param text 원본 문자열 (null이면 null 반환)
     * @param lookup 변수 조회 함수 (미정의 시 null 반환)
     * @return 확장된 문자열
     */
    public static String expand(String text, Function<String, String> lookup) {
        if (text == null || text.indexOf('$') < 0) {
            return text;
        }
        Matcher matcher = REFERENCE.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement;
            if (matcher.group().equals("$$")) {
                replacement = "$";
            } else if (matcher.group(1) != null) {
                String value = lookup.apply(matcher.group(1));
                String fallback = matcher.group(2);
                if (fallback != null && (value == null || value.isEmpty())) {
                    value = fallback;
                }
                replacement = value == null ? "" : value;
            } else {
                String value = lookup.apply(matcher.group(3));
                replacement = value == null ? "" : value;
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
