package net.sentiflow.core.maintenance;

import net.sentiflow.core.spi.BatchRunRepository;
import net.sentiflow.core.spi.Clock;
import net.sentiflow.core.spi.NamespaceStore;
import net.sentiflow.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * 실행 전 점검.
 * 같은 작업 공간에서 다른 실행이 돌고 있지 않을 때만 호출한다.
 */
public final class WorkspaceJanitor {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceJanitor.class);

    private final NamespaceStore namespaces;
    private final BatchRunRepository batchRuns;   // null 이면 원장 정리 생략
    private final TxRunner tx;
    private final Clock clock;

    public WorkspaceJanitor(NamespaceStore namespaces,
                            BatchRunRepository batchRuns,
                            TxRunner tx,
                            Clock clock) {
        this.namespaces = namespaces;
        this.batchRuns = batchRuns;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * - 비정상 종료로 남은 워커 네임스페이스 삭제 (접두사 일치)
     * - 오래된 종료 배치 기록 삭제 (TTL 지난 것)
     */
    public JanitorReport runOnce(String workerPrefix, Duration finishedTtl) throws Exception {
        Instant now = clock.now();
        JanitorReport r = new JanitorReport();

        // 1) 고아 네임스페이스
        for (String ns : namespaces.namespaces(workerPrefix + "_")) {
            log.warn("Removing orphaned worker namespace <{}>", ns);
            namespaces.delete(ns);
            r.removedNamespaces++;
        }

        // 2) 종료 기록 정리
        if (batchRuns != null && finishedTtl != null && !finishedTtl.isZero() && !finishedTtl.isNegative()) {
            Instant threshold = now.minus(finishedTtl);
            r.deletedBatchRuns = tx.required(() -> batchRuns.deleteFinishedOlderThan(threshold));
        }

        r.timestamp = now;
        return r;
    }

    public static final class JanitorReport {
        public Instant timestamp;
        public int removedNamespaces;
        public int deletedBatchRuns;

        @Override public String toString() {
            return "JanitorReport{" +
                    "timestamp=" + timestamp +
                    ", removedNamespaces=" + removedNamespaces +
                    ", deletedBatchRuns=" + deletedBatchRuns +
                    '}';
        }
    }
}
