package com.ryuqq.pipeline.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 파이프라인 호출 컨텍스트 (불변).
 *
 * <p>트리거 이벤트가 제공하는 메타데이터와 변수 집합입니다. 파이프라인 실행마다 한 번 생성되며,
 * rules 평가와 변수 확장에 사용되는 유일한 입력입니다. 전역 가변 상태는 존재하지 않습니다.</p>
 *
 * <p><strong>사전 정의 변수:</strong></p>
 * <ul>
 *   <li>{@code CI_PIPELINE_SOURCE} ← source</li>
 *   <li>{@code CI_COMMIT_REF_NAME} ← refName</li>
 *   <li>{@code CI_COMMIT_REF_SLUG} ← refName (slug 변환)</li>
 *   <li>{@code CI_COMMIT_TAG} ← commitTag (태그 파이프라인에서만 정의)</li>
 *   <li>{@code CI_COMMIT_BRANCH} ← commitBranch (브랜치 파이프라인에서만 정의)</li>
 * </ul>
 * <p>사전 정의 변수는 {@code variables}의 동일 키보다 항상 우선합니다.</p>
 *
 * @param refName 브랜치 또는 태그 이름
 * @param source 트리거 종류
 * @param commitTag 커밋 태그 (null 가능)
 * @param commitBranch 커밋 브랜치 (null 가능)
 * @param variables 추가 변수 (이미지 태그 등)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PipelineContext(
    String refName,
    PipelineSource source,
    String commitTag,
    String commitBranch,
    Map<String, String> variables
) {

    public static final String CI_PIPELINE_SOURCE = "CI_PIPELINE_SOURCE";
    public static final String CI_COMMIT_REF_NAME = "CI_COMMIT_REF_NAME";
    public static final String CI_COMMIT_REF_SLUG = "CI_COMMIT_REF_SLUG";
    public static final String CI_COMMIT_TAG = "CI_COMMIT_TAG";
    public static final String CI_COMMIT_BRANCH = "CI_COMMIT_BRANCH";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException refName 또는 source가 null인 경우
     */
    public PipelineContext {
        if (refName == null || refName.isBlank()) {
            throw new IllegalArgumentException("refName cannot be null or blank");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        // commitTag, commitBranch는 null 허용
        variables = variables == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /**
     * 브랜치 push 파이프라인 컨텍스트 생성.
     *
     * @param branch 브랜치 이름
     * @param source 트리거 종류
     * @return PipelineContext
     */
    public static PipelineContext forBranch(String branch, PipelineSource source) {
        return new PipelineContext(branch, source, null, branch, Map.of());
    }

    /**
     * 태그 파이프라인 컨텍스트 생성.
     *
     * @param tag 태그 이름
     * @return PipelineContext
     */
    public static PipelineContext forTag(String tag) {
        return new PipelineContext(tag, PipelineSource.PUSH, tag, null, Map.of());
    }

    /**
     * 환경 변수 형태의 key/value로부터 컨텍스트 생성.
     *
     * <p>{@code CI_PIPELINE_SOURCE}가 없으면 push, {@code CI_COMMIT_REF_NAME}이 없으면
     * 태그 또는 브랜치 이름을 ref로 사용합니다.</p>
     *
     * @param environment 트리거가 제공한 변수
     * @return PipelineContext
     * @throws IllegalArgumentException ref를 결정할 수 없거나 source 값이 잘못된 경우
     */
    public static PipelineContext fromVariables(Map<String, String> environment) {
        Map<String, String> env = environment == null ? Map.of() : environment;
        String tag = blankToNull(env.get(CI_COMMIT_TAG));
        String branch = blankToNull(env.get(CI_COMMIT_BRANCH));
        String ref = blankToNull(env.get(CI_COMMIT_REF_NAME));
        if (ref == null) {
            ref = tag != null ? tag : branch;
        }
        String sourceValue = blankToNull(env.get(CI_PIPELINE_SOURCE));
        PipelineSource source = sourceValue == null ? PipelineSource.PUSH : PipelineSource.fromWireValue(sourceValue);
        return new PipelineContext(ref, source, tag, branch, env);
    }

    /**
     * 변수 조회 (사전 정의 변수 우선).
     *
     * @param name 변수 이름 ({@code $} 없이)
     * @return 변수 값, 정의되지 않았으면 null
     */
    public String variable(String name) {
        return switch (name) {
            case CI_PIPELINE_SOURCE -> source.wireValue();
            case CI_COMMIT_REF_NAME -> refName;
            case CI_COMMIT_REF_SLUG -> slug(refName);
            case CI_COMMIT_TAG -> commitTag;
            case CI_COMMIT_BRANCH -> commitBranch;
            default -> variables.get(name);
        };
    }

    /**
     * 사전 정의 변수를 포함한 전체 변수 맵.
     *
     * @return 불변 맵 (정의된 변수만 포함)
     */
    public Map<String, String> allVariables() {
        Map<String, String> all = new LinkedHashMap<>(variables);
        all.put(CI_PIPELINE_SOURCE, source.wireValue());
        all.put(CI_COMMIT_REF_NAME, refName);
        all.put(CI_COMMIT_REF_SLUG, slug(refName));
        if (commitTag != null) {
            all.put(CI_COMMIT_TAG, commitTag);
        } else {
            all.remove(CI_COMMIT_TAG);
        }
        if (commitBranch != null) {
            all.put(CI_COMMIT_BRANCH, commitBranch);
        } else {
            all.remove(CI_COMMIT_BRANCH);
        }
        return Collections.unmodifiableMap(all);
    }

    /**
     * 변수 하나를 추가/대체한 새 컨텍스트 생성.
     */
    public PipelineContext withVariable(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(variables);
        copy.put(name, value);
        return new PipelineContext(refName, source, commitTag, commitBranch, copy);
    }

    /**
     * 컨텍스트에 없는 변수만 기본값으로 채운 새 컨텍스트 생성.
     *
     * @param defaults 기본 변수 (파이프라인 정의의 전역 변수 등)
     * @return 기존 변수가 우선하는 새 컨텍스트
     */
    public PipelineContext withDefaultVariables(Map<String, String> defaults) {
        if (defaults == null || defaults.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new LinkedHashMap<>(defaults);
        merged.putAll(variables);
        return new PipelineContext(refName, source, commitTag, commitBranch, merged);
    }

    /**
     * source만 변경한 새 컨텍스트 생성.
     */
    public PipelineContext withSource(PipelineSource source) {
        return new PipelineContext(refName, source, commitTag, commitBranch, variables);
    }

    /**
     * ref 이름을 slug 형태로 변환 (소문자, 영숫자 외 문자는 '-', 최대 63자).
     */
    static String slug(String ref) {
        String lowered = ref.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "-");
        if (lowered.length() > 63) {
            lowered = lowered.substring(0, 63);
        }
        return lowered.replaceAll("^-+|-+$", "");
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
