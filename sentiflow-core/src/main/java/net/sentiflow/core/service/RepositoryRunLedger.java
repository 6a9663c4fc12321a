package net.sentiflow.core.service;

import net.sentiflow.core.model.BatchRun;
import net.sentiflow.core.model.StepResult;
import net.sentiflow.core.model.UnitRun;
import net.sentiflow.core.model.WorkUnit;
import net.sentiflow.core.model.WorkerContext;
import net.sentiflow.core.spi.BatchRunRepository;
import net.sentiflow.core.spi.TxRunner;
import net.sentiflow.core.spi.UnitRunRepository;

/**
 * 저장소 SPI 로 배치/유닛 결과를 남긴다.
 * 유닛 기록은 워커 스레드에서 호출되므로 매번 새 트랜잭션(requiresNew)으로 감싼다.
 */
public final class RepositoryRunLedger implements RunLedger {
    private static final int MAX_ERROR = 2000;

    private final BatchRunRepository batchRuns;
    private final UnitRunRepository unitRuns;
    private final TxRunner tx;

    public RepositoryRunLedger(BatchRunRepository batchRuns, UnitRunRepository unitRuns, TxRunner tx) {
        this.batchRuns = batchRuns;
        this.unitRuns = unitRuns;
        this.tx = tx;
    }

    @Override
    public Session open(BatchRun.Kind kind, String runKey, int workers, long memoryMb) throws Exception {
        BatchRun run = tx.required(() -> {
            BatchRun r = batchRuns.upsert(kind, runKey, workers, memoryMb);
            batchRuns.markStarted(r.id());
            return r;
        });
        return new LedgerSession(run.id());
    }

    private final class LedgerSession implements Session {
        private final long id;

        LedgerSession(long id) { this.id = id; }

        @Override public Long batchRunId() { return id; }

        @Override
        public void onStart(WorkUnit unit, WorkerContext context) throws Exception {
            tx.requiresNew(() -> unitRuns.start(id, unit.id(), unit.subject(), unit.request().stepName(),
                    context.workerId(), context.namespace()));
        }

        @Override
        public void onSuccess(WorkUnit unit, WorkerContext context, StepResult result) throws Exception {
            tx.requiresNew(() -> { unitRuns.markDone(id, unit.id()); return null; });
        }

        @Override
        public void onFailure(WorkUnit unit, String reason) throws Exception {
            tx.requiresNew(() -> {
                if (unitRuns.find(id, unit.id()).isPresent()) {
                    unitRuns.markFailed(id, unit.id(), truncate(reason));
                } else {
                    unitRuns.record(id, unit.id(), unit.subject(), unit.request().stepName(),
                            UnitRun.Status.FAILED, truncate(reason));
                }
                return null;
            });
        }

        @Override
        public void onCancelled(WorkUnit unit) throws Exception {
            tx.requiresNew(() -> {
                unitRuns.record(id, unit.id(), unit.subject(), unit.request().stepName(),
                        UnitRun.Status.CANCELLED, "cancelled");
                return null;
            });
        }

        @Override
        public void skipped(String unitId, String subject, String stepName, String note) throws Exception {
            tx.requiresNew(() -> {
                unitRuns.record(id, unitId, subject, stepName, UnitRun.Status.SKIPPED, note);
                return null;
            });
        }

        @Override
        public void finish(PipelineReport report) throws Exception {
            BatchRun.Status status = report.cancelled() ? BatchRun.Status.CANCELLED
                    : report.successful() ? BatchRun.Status.DONE : BatchRun.Status.FAILED;
            tx.required(() -> { batchRuns.markFinished(id, status, truncate(report.summary())); return null; });
        }

        @Override
        public void abort(Throwable cause) throws Exception {
            tx.required(() -> {
                batchRuns.markFinished(id, BatchRun.Status.FAILED, truncate(String.valueOf(cause)));
                return null;
            });
        }
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_ERROR) return s;
        return s.substring(0, MAX_ERROR);
    }
}
