package net.sentiflow.core.spi;

import net.sentiflow.core.model.UnitRun;

import java.util.List;
import java.util.Optional;

public interface UnitRunRepository {
    /** (BATCH_RUN_ID, UNIT_ID) 멱등 생성. 이미 있으면 attempt++ 후 RUNNING 으로 되돌린다. */
    UnitRun start(long batchRunId, String unitId, String subject, String stepName,
                  int workerId, String namespace) throws Exception;

    void markDone(long batchRunId, String unitId) throws Exception;

    void markFailed(long batchRunId, String unitId, String error) throws Exception;

    /** 실행 없이 끝난 유닛 (임계값 skip, 취소) 기록 */
    void record(long batchRunId, String unitId, String subject, String stepName,
                UnitRun.Status status, String note) throws Exception;

    Optional<UnitRun> find(long batchRunId, String unitId) throws Exception;

    List<UnitRun> findAllByBatchRun(long batchRunId) throws Exception;
}
