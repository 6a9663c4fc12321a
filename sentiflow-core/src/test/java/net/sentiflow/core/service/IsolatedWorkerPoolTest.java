package net.sentiflow.core.service;

import net.sentiflow.core.model.CompletedUnit;
import net.sentiflow.core.model.PoolReport;
import net.sentiflow.core.model.StepRequest;
import net.sentiflow.core.model.UnitFailure;
import net.sentiflow.core.model.WorkUnit;
import net.sentiflow.core.testing.FakeStepRunner;
import net.sentiflow.core.testing.InMemoryNamespaceStore;
import net.sentiflow.core.testing.RecordingLedger;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 풀 동작 검증
 * - 동시 실행 상한, 실패 격리, 취소, drain timeout
 * - 스텝은 FakeStepRunner 가 private 네임스페이스에 null layer 를 쓰는 것으로 대신한다
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class IsolatedWorkerPoolTest {

    private static final String SHARED = "PERMANENT";

    private InMemoryNamespaceStore store;
    private FakeStepRunner steps;

    @BeforeEach
    void init() {
        store = new InMemoryNamespaceStore(SHARED);
        steps = new FakeStepRunner(store);
    }

    private static List<WorkUnit> units(int n) {
        List<WorkUnit> out = new ArrayList<>();
        for (int i = 1; i <= n; i++) {
            out.add(WorkUnit.of("u" + i, "S2_2021061" + i + "T103021", new StepRequest.NullLayer("layer_" + i)));
        }
        return out;
    }

    @Test
    void t1_never_more_than_n_units_at_once() throws Exception {
        steps.delay(Duration.ofMillis(80));
        PoolReport report;
        try (IsolatedWorkerPool pool = new IsolatedWorkerPool(store, steps, SHARED, PoolConfig.of(3, 900), null)) {
            pool.submitAll(units(9));
            report = pool.awaitAll();
            assertTrue(pool.peakActive() <= 3);
        }

        assertEquals(9, report.submitted());
        assertEquals(9, report.completed().size());
        assertTrue(report.peakActive() <= 3);
        assertTrue(steps.peakConcurrent() <= 3);
        // 워커 슬롯은 0..N-1, 컨텍스트는 유닛마다 다르다
        Set<Integer> slots = report.completed().stream().map(c -> c.context().workerId()).collect(Collectors.toSet());
        assertThat(slots).isSubsetOf(0, 1, 2);
        Set<String> namespaces = report.completed().stream().map(c -> c.context().namespace()).collect(Collectors.toSet());
        assertEquals(9, namespaces.size());
        assertThat(namespaces).allMatch(ns -> ns.startsWith(PoolConfig.DEFAULT_PREFIX + "_u"));
        assertEquals(300, report.completed().get(0).context().memoryMb());
    }

    @Test
    void t2_one_failure_does_not_stop_siblings() throws Exception {
        steps.failIf(r -> r instanceof StepRequest.NullLayer n && n.output().equals("layer_3"));
        RecordingLedger ledger = new RecordingLedger();
        RunLedgerSession session = new RunLedgerSession(ledger);

        PoolReport report;
        try (IsolatedWorkerPool pool = new IsolatedWorkerPool(store, steps, SHARED, PoolConfig.of(2, 100), session.get())) {
            pool.submitAll(units(5));
            report = pool.awaitAll();
        }

        assertEquals(4, report.completed().size());
        assertEquals(1, report.failures().size());
        UnitFailure f = report.failures().get(0);
        assertEquals("u3", f.unitId());
        assertThat(f.reason()).startsWith("exit status 2").contains("null-layer failed");
        assertTrue(report.partialFailure());
        assertFalse(report.cancelled());

        // 실패한 유닛의 네임스페이스는 바로 지워지고, 성공한 것들은 reconcile 을 기다린다
        assertEquals(1, store.deletedNamespaces().size());
        for (CompletedUnit c : report.completed()) {
            assertTrue(store.exists(c.context().namespace()));
        }
        assertEquals(5, ledger.count("start:"));
        assertEquals(4, ledger.count("done:"));
        assertEquals(1, ledger.count("failed:"));
    }

    @Test
    void t3_exceptions_become_failures() throws Exception {
        steps.throwIf(r -> r instanceof StepRequest.NullLayer n && n.output().equals("layer_1"));
        PoolReport report;
        try (IsolatedWorkerPool pool = new IsolatedWorkerPool(store, steps, SHARED, PoolConfig.of(1, 100), null)) {
            pool.submitAll(units(2));
            report = pool.awaitAll();
        }
        assertEquals(1, report.completed().size());
        assertThat(report.failures().get(0).reason()).contains("IllegalStateException").contains("step crashed");
    }

    @Test
    void t4_duplicate_subject_and_late_submit_are_rejected() throws Exception {
        try (IsolatedWorkerPool pool = new IsolatedWorkerPool(store, steps, SHARED, PoolConfig.of(1, 100), null)) {
            pool.submit(WorkUnit.of("a", "S2_20210615T103021", new StepRequest.NullLayer("x")));
            assertThatThrownBy(() -> pool.submit(WorkUnit.of("b", "S2_20210615T103021", new StepRequest.NullLayer("y"))))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> pool.submit(WorkUnit.of("a", "S2_20210616T103021", new StepRequest.NullLayer("z"))))
                    .isInstanceOf(IllegalArgumentException.class);
            pool.awaitAll();
            assertThatThrownBy(() -> pool.submit(WorkUnit.of("c", "S2_20210617T103021", new StepRequest.NullLayer("w"))))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void t5_cancel_discards_every_context() throws Exception {
        steps.delay(Duration.ofSeconds(5));
        RecordingLedger ledger = new RecordingLedger();
        RunLedgerSession session = new RunLedgerSession(ledger);
        PoolConfig cfg = new PoolConfig(2, 100, PoolConfig.DEFAULT_PREFIX, null, Duration.ofSeconds(2));

        PoolReport report;
        try (IsolatedWorkerPool pool = new IsolatedWorkerPool(store, steps, SHARED, cfg, session.get())) {
            pool.submitAll(units(6));
            Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> pool.activeCount() == 2);
            report = pool.cancel();
        }

        assertTrue(report.cancelled());
        assertTrue(report.completed().isEmpty());
        assertEquals(6, report.failures().size());
        assertEquals(4, ledger.count("cancelled:"));
        assertThat(store.namespaces(PoolConfig.DEFAULT_PREFIX)).isEmpty();
    }

    @Test
    void t6_drain_timeout_cancels_remaining_units() throws Exception {
        steps.delay(Duration.ofSeconds(3)).ignoreInterrupt(true);
        PoolConfig cfg = new PoolConfig(1, 100, "tmo", Duration.ofMillis(200), Duration.ofMillis(100));

        PoolReport report;
        try (IsolatedWorkerPool pool = new IsolatedWorkerPool(store, steps, SHARED, cfg, null)) {
            pool.submitAll(units(3));
            report = pool.awaitAll();
        }

        assertTrue(report.cancelled());
        assertEquals(3, report.failures().size());
        assertThat(report.failures()).allMatch(f -> f.reason().startsWith("timed out after"));
        // 인터럽트를 무시한 스텝의 컨텍스트도 정리된다
        assertThat(store.namespaces("tmo")).isEmpty();
    }

    @Test
    void t7_sanitize_namespace_names() {
        assertEquals("sen2cor_0", IsolatedWorkerPool.sanitize("sen2cor_0"));
        assertEquals("a_b_c", IsolatedWorkerPool.sanitize("a-b.c"));
    }

    @Test
    void t8_unit_finishing_after_the_report_leaves_no_namespace() throws Exception {
        steps.delay(Duration.ofMillis(600)).ignoreInterrupt(true);
        PoolConfig cfg = new PoolConfig(1, 100, "late", Duration.ofMillis(100), Duration.ofMillis(50));

        IsolatedWorkerPool pool = new IsolatedWorkerPool(store, steps, SHARED, cfg, null);
        pool.submit(units(1).get(0));
        PoolReport report = pool.awaitAll();
        assertTrue(report.cancelled());
        assertTrue(report.completed().isEmpty());

        // 스텝은 보고 이후에 성공으로 끝나지만 결과는 버려진다
        Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> pool.activeCount() == 0);
        assertThat(store.namespaces("late")).isEmpty();
        assertSame(report, pool.awaitAll());
        assertThat(report.failures()).extracting(UnitFailure::unitId).containsExactly("u1");
        pool.close();
    }

    /** 기록 세션 열기 (RecordingLedger 는 예외를 던지지 않는다) */
    private record RunLedgerSession(RecordingLedger ledger) {
        RunLedger.Session get() throws Exception {
            return ledger.open(net.sentiflow.core.model.BatchRun.Kind.IMPORT, "test", 1, 1);
        }
    }
}
