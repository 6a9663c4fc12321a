package net.sentiflow.core.service;

import net.sentiflow.core.model.UnitFailure;

import java.util.List;

/**
 * 파이프라인 한 번 실행 결과.
 * 실패한 유닛이 하나라도 있으면 성공이 아니다. 임계값으로 건너뛴 장면은 성공으로 친다.
 */
public record PipelineReport(
        String pipeline,
        Long batchRunId,
        List<String> datasets,
        List<String> artifacts,
        List<UnitFailure> failures,
        int skipped,
        List<String> warnings,
        boolean cancelled
) {
    public PipelineReport {
        datasets = List.copyOf(datasets);
        artifacts = List.copyOf(artifacts);
        failures = List.copyOf(failures);
        warnings = List.copyOf(warnings);
    }

    public boolean successful() { return failures.isEmpty() && !cancelled; }

    public String summary() {
        return pipeline + ": " + artifacts.size() + " artifact(s), " + datasets.size() + " dataset(s), "
                + failures.size() + " failure(s), " + skipped + " skipped"
                + (cancelled ? ", cancelled" : "");
    }
}
