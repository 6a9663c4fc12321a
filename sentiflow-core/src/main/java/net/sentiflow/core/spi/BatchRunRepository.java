package net.sentiflow.core.spi;

import net.sentiflow.core.model.BatchRun;

import java.time.Instant;
import java.util.Optional;

public interface BatchRunRepository {
    /** (KIND, RUN_KEY) 기반 멱등 생성 */
    BatchRun upsert(BatchRun.Kind kind, String runKey, int workers, long memoryMb) throws Exception;

    Optional<BatchRun> findById(long id) throws Exception;

    void markStarted(long batchRunId) throws Exception;
    void markFinished(long batchRunId, BatchRun.Status status, String summary) throws Exception;

    /** 오래된 종료 건 삭제 */
    int deleteFinishedOlderThan(Instant threshold) throws Exception;
}
