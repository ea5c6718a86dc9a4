package com.ryuqq.pipeline.core.error;

import com.ryuqq.pipeline.core.model.JobName;

/**
 * 디스패치 직전에 필수 upstream 아티팩트를 찾을 수 없는 경우.
 *
 * <p>해당 Job만 실패시키며(재시도 없음), 그 후속 Job들에게는
 * 일반적인 upstream 실패로 전파됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DependencyUnavailableException extends Exception {

    private final JobName job;
    private final JobName upstream;

    public DependencyUnavailableException(JobName job, JobName upstream, String message) {
        super(message);
        this.job = job;
        this.upstream = upstream;
    }

    public JobName getJob() {
        return job;
    }

    public JobName getUpstream() {
        return upstream;
    }
}
