package com.ryuqq.pipeline.cli;

import com.ryuqq.pipeline.application.result.JobResult;
import com.ryuqq.pipeline.application.result.PipelineResult;
import com.ryuqq.pipeline.core.statemachine.JobState;

import java.io.PrintWriter;
import java.util.Locale;

/**
 * 파이프라인 결과 요약 출력.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class ResultPrinter {

    private static final String ROW = "%-12s %-30s %-10s %8s  %s%n";

    private ResultPrinter() {
    }

    static void print(PipelineResult result, PrintWriter out) {
        out.printf("Pipeline %s finished: %s (exit %d) in %d ms%n",
            result.pipelineId().getValue(),
            result.status().name().toLowerCase(Locale.ROOT),
            result.exitCode(),
            result.duration().toMillis());
        out.printf(ROW, "STAGE", "JOB", "STATE", "ATTEMPTS", "DETAIL");
        for (JobResult job : result.jobs()) {
            out.printf(ROW,
                job.stage(),
                job.name().getValue(),
                job.state().name().toLowerCase(Locale.ROOT),
                job.attempts(),
                detail(job));
        }
        if (result.hasWarnings()) {
            out.println("Passed with warnings: allowed failures present.");
        }
        out.flush();
    }

    private static String detail(JobResult job) {
        StringBuilder detail = new StringBuilder();
        if (job.state() == JobState.SKIPPED) {
            detail.append(job.skipReason().name().toLowerCase(Locale.ROOT));
        }
        if (job.failureReason() != null) {
            detail.append(job.failureReason().wireValue());
        }
        if (job.message() != null) {
            if (detail.length() > 0) {
                detail.append(": ");
            }
            detail.append(job.message());
        }
        if (job.isWarning()) {
            detail.append(" (allowed to fail)");
        }
        return detail.toString();
    }
}
