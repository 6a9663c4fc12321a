package net.sentiflow.core.service;

import net.sentiflow.core.model.BatchRun;

/** 배치 실행/유닛 결과 기록 */
public interface RunLedger {

    /** 기록하지 않는 구현 */
    RunLedger NONE = (kind, runKey, workers, memoryMb) -> new Session() {};

    Session open(BatchRun.Kind kind, String runKey, int workers, long memoryMb) throws Exception;

    /** 배치 하나의 기록 세션. 풀 리스너로 유닛 결과를 받는다. */
    interface Session extends PoolListener {
        default Long batchRunId() { return null; }

        /** 풀에 들어가지 않고 끝난 유닛 (임계값 skip 등) */
        default void skipped(String unitId, String subject, String stepName, String note) throws Exception {}

        default void finish(PipelineReport report) throws Exception {}

        default void abort(Throwable cause) throws Exception {}
    }
}
