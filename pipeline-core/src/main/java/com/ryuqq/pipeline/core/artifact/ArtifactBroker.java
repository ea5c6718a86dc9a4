package com.ryuqq.pipeline.core.artifact;

import com.ryuqq.pipeline.core.definition.ArtifactSpec;
import com.ryuqq.pipeline.core.definition.CacheSpec;
import com.ryuqq.pipeline.core.definition.JobDefinition;
import com.ryuqq.pipeline.core.error.DependencyUnavailableException;
import com.ryuqq.pipeline.core.executor.ExecutionEnvironment;
import com.ryuqq.pipeline.core.executor.FileContent;
import com.ryuqq.pipeline.core.executor.JobInstance;
import com.ryuqq.pipeline.core.executor.JobOutput;
import com.ryuqq.pipeline.core.graph.ArtifactSource;
import com.ryuqq.pipeline.core.model.PipelineContext;
import com.ryuqq.pipeline.core.model.VariableExpander;
import com.ryuqq.pipeline.core.spi.ArtifactStore;
import com.ryuqq.pipeline.core.spi.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 아티팩트와 캐시를 Job 실행 환경으로 옮기고, 실행 결과에서 다시 수집합니다.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>디스패치 전: upstream 아티팩트 해석, 캐시 복원, 변수 병합 ({@link #prepare})</li>
 *   <li>완료 후: 수집 정책에 따른 아티팩트 발행 ({@link #publish}), 캐시 저장 ({@link #saveCache})</li>
 *   <li>만료: 읽는 시점에 보존 기간이 지난 아티팩트는 없는 것으로 취급하고 삭제</li>
 * </ul>
 *
 * <p>저장소 쓰기는 (파이프라인, Job) 또는 캐시 키 단위이며 read-modify-write가 없습니다.
 * 이 클래스는 thread-safe합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ArtifactBroker {

    private static final Logger log = LoggerFactory.getLogger(ArtifactBroker.class);

    private final ArtifactStore artifactStore;
    private final CacheStore cacheStore;
    private final Clock clock;
    private final BrokerConfig config;

    public ArtifactBroker(ArtifactStore artifactStore, CacheStore cacheStore) {
        this(artifactStore, cacheStore, Clock.systemUTC(), new BrokerConfig());
    }

    public ArtifactBroker(ArtifactStore artifactStore, CacheStore cacheStore, Clock clock, BrokerConfig config) {
        if (artifactStore == null) {
            throw new IllegalArgumentException("artifactStore cannot be null");
        }
        if (cacheStore == null) {
            throw new IllegalArgumentException("cacheStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.artifactStore = artifactStore;
        this.cacheStore = cacheStore;
        this.clock = clock;
        this.config = config;
    }

    /**
     * Job의 실행 환경 준비.
     *
     * <p>변수 우선순위 (낮음 → 높음): 파이프라인 컨텍스트, upstream dotenv, Job 변수.
     * 파일은 캐시를 먼저 복원하고 upstream 아티팩트로 덮어씁니다.</p>
     *
     * @param job 디스패치할 Job
     * @param context 파이프라인 컨텍스트
     * @return 실행 환경
     * @throws DependencyUnavailableException 필수 upstream 아티팩트가 없거나 만료된 경우
     */
    public ExecutionEnvironment prepare(JobInstance job, PipelineContext context) throws DependencyUnavailableException {
        List<ArtifactSet> upstream = resolve(job);
        JobDefinition definition = job.definition();

        Map<String, String> variables = new LinkedHashMap<>(context.allVariables());
        upstream.forEach(set -> variables.putAll(set.dotenv()));
        Map<String, String> inherited = new LinkedHashMap<>(variables);
        definition.variables().forEach((name, value) -> variables.put(name, VariableExpander.expand(value, inherited)));

        Map<String, FileContent> files = new LinkedHashMap<>();
        restoreCache(job, variables).ifPresent(entry -> files.putAll(entry.files()));
        upstream.forEach(set -> files.putAll(set.files()));

        String image = definition.image() == null ? null : VariableExpander.expand(definition.image(), variables);
        return new ExecutionEnvironment(variables, files, image, definition.script());
    }

    /**
     * upstream 아티팩트 해석.
     *
     * @param job 디스패치할 Job
     * @return 사용 가능한 아티팩트 (artifact source 순서)
     * @throws DependencyUnavailableException 필수 아티팩트가 없거나 만료된 경우
     */
    public List<ArtifactSet> resolve(JobInstance job) throws DependencyUnavailableException {
        List<ArtifactSet> resolved = new ArrayList<>();
        for (ArtifactSource source : job.node().artifactSources()) {
            Optional<ArtifactSet> found = lookup(job, source);
            if (found.isPresent()) {
                resolved.add(found.get());
            } else if (source.required()) {
                throw new DependencyUnavailableException(job.name(), source.job(),
                    "Job '" + job.name() + "' requires artifacts of '" + source.job()
                        + "' but none are available (upstream skipped, failed or artifacts expired)");
            }
        }
        return resolved;
    }

    private Optional<ArtifactSet> lookup(JobInstance job, ArtifactSource source) {
        Optional<ArtifactSet> found = artifactStore.get(job.pipelineId(), source.job());
        if (found.isPresent() && found.get().reference().isExpired(clock.instant())) {
            log.debug("Artifacts of {} expired at {}, treating as absent",
                source.job(), found.get().reference().expiresAt());
            artifactStore.remove(job.pipelineId(), source.job());
            return Optional.empty();
        }
        return found;
    }

    /**
     * Job 완료 후 아티팩트 발행.
     *
     * @param job 완료된 Job
     * @param output 실행 후 워크스페이스 파일
     * @param succeeded Job 성공 여부
     * @return 발행한 참조, artifacts 설정이 없거나 수집 정책에 해당하지 않으면 empty
     */
    public Optional<ArtifactReference> publish(JobInstance job, JobOutput output, boolean succeeded) {
        ArtifactSpec spec = job.definition().artifacts();
        if (spec == null || !spec.effectiveWhen().collects(succeeded)) {
            return Optional.empty();
        }
        Map<String, String> variables = variablesOf(job);
        Map<String, FileContent> files = PathPatterns.select(output.files(), spec.effectivePaths());

        Map<String, String> dotenv = Map.of();
        if (spec.dotenvReport() != null) {
            FileContent content = output.files().get(PathPatterns.normalize(spec.dotenvReport()));
            if (content == null) {
                log.warn("Job {} declares dotenv report '{}' but did not produce it", job.name(), spec.dotenvReport());
            } else {
                dotenv = DotenvParser.parse(content.asText(), config.maxDotenvVariables());
            }
        }

        Instant now = clock.instant();
        Duration retention = spec.expireIn() != null ? spec.expireIn() : config.defaultExpireIn();
        ArtifactReference reference = new ArtifactReference(
            job.pipelineId(),
            job.name(),
            VariableExpander.expand(spec.effectiveName(), variables),
            List.copyOf(files.keySet()),
            now,
            retention == null ? null : now.plus(retention)
        );
        artifactStore.put(new ArtifactSet(reference, files, dotenv));
        job.attachArtifact(reference);
        log.debug("Published artifacts '{}' of {}: {} files, {} dotenv variables",
            reference.name(), job.id(), files.size(), dotenv.size());
        return Optional.of(reference);
    }

    /**
     * 캐시 복원 (cache miss는 오류가 아님).
     *
     * @param job 디스패치할 Job
     * @param variables 캐시 키 확장에 사용할 변수
     * @return 캐시 항목, 설정이 없거나 pull 정책이 아니거나 miss면 empty
     */
    public Optional<CacheEntry> restoreCache(JobInstance job, Map<String, String> variables) {
        CacheSpec spec = job.definition().cache();
        if (spec == null || !spec.effectivePolicy().pulls()) {
            return Optional.empty();
        }
        String key = VariableExpander.expand(spec.effectiveKey(), variables);
        Optional<CacheEntry> entry = cacheStore.get(key);
        log.debug("Cache {} for {} (key={})", entry.isPresent() ? "hit" : "miss", job.id(), key);
        return entry;
    }

    /**
     * 성공한 Job의 캐시 저장.
     *
     * @param job 성공한 Job
     * @param output 실행 후 워크스페이스 파일
     */
    public void saveCache(JobInstance job, JobOutput output) {
        CacheSpec spec = job.definition().cache();
        if (spec == null || !spec.effectivePolicy().pushes()) {
            return;
        }
        String key = VariableExpander.expand(spec.effectiveKey(), variablesOf(job));
        Map<String, FileContent> files = PathPatterns.select(output.files(), spec.effectivePaths());
        cacheStore.put(new CacheEntry(key, files, clock.instant()));
        log.debug("Saved cache for {} (key={}, {} files)", job.id(), key, files.size());
    }

    private static Map<String, String> variablesOf(JobInstance job) {
        ExecutionEnvironment environment = job.environment();
        return environment == null ? job.definition().variables() : environment.variables();
    }
}
