package com.ryuqq.pipeline.core.definition;

import java.time.Duration;
import java.util.List;

/**
 * Job의 아티팩트 선언 ({@code artifacts}).
 *
 * <p>템플릿 병합 시 키 단위로 병합됩니다 (null = 미지정). paths는 목록이므로 통째로 교체됩니다.</p>
 *
 * @param name 아티팩트 이름 (변수 확장 대상, null 가능)
 * @param paths 수집 경로 패턴 (null 가능)
 * @param when 수집 정책 (null: on_success)
 * @param expireIn 보존 기간 (null: 만료 없음)
 * @param dotenvReport dotenv 리포트 파일 경로 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ArtifactSpec(
    String name,
    List<String> paths,
    ArtifactWhen when,
    Duration expireIn,
    String dotenvReport
) {

    public static final String DEFAULT_NAME = "artifacts";

    public ArtifactSpec {
        if (expireIn != null && (expireIn.isNegative() || expireIn.isZero())) {
            throw new IllegalArgumentException("expireIn must be positive (current: " + expireIn + ")");
        }
        paths = paths == null ? null : List.copyOf(paths);
    }

    public static ArtifactSpec of(List<String> paths) {
        return new ArtifactSpec(null, paths, null, null, null);
    }

    public ArtifactWhen effectiveWhen() {
        return when == null ? ArtifactWhen.ON_SUCCESS : when;
    }

    public String effectiveName() {
        return name == null ? DEFAULT_NAME : name;
    }

    public List<String> effectivePaths() {
        return paths == null ? List.of() : paths;
    }

    /**
     * 부모 설정 위에 이 설정을 키 단위로 덮어쓴 결과.
     *
     * @param parent 부모 설정 (null 가능)
     * @return 병합 결과
     */
    public ArtifactSpec mergeOver(ArtifactSpec parent) {
        if (parent == null) {
            return this;
        }
        return new ArtifactSpec(
            name != null ? name : parent.name,
            paths != null ? paths : parent.paths,
            when != null ? when : parent.when,
            expireIn != null ? expireIn : parent.expireIn,
            dotenvReport != null ? dotenvReport : parent.dotenvReport
        );
    }

    public ArtifactSpec withWhen(ArtifactWhen when) {
        return new ArtifactSpec(name, paths, when, expireIn, dotenvReport);
    }

    public ArtifactSpec withExpireIn(Duration expireIn) {
        return new ArtifactSpec(name, paths, when, expireIn, dotenvReport);
    }

    public ArtifactSpec withDotenvReport(String dotenvReport) {
        return new ArtifactSpec(name, paths, when, expireIn, dotenvReport);
    }
}
