package net.sentiflow.core.service;

import net.sentiflow.core.error.IsolationViolationException;
import net.sentiflow.core.model.Artifact;
import net.sentiflow.core.model.WorkerContext;
import net.sentiflow.core.testing.InMemoryNamespaceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class ResultReconcilerTest {

    private static final String SHARED = "PERMANENT";

    private InMemoryNamespaceStore store;

    @BeforeEach
    void init() {
        store = new InMemoryNamespaceStore(SHARED);
        store.put(SHARED, Artifact.raster("T32UNE_20210601T103021_B04"));
    }

    private WorkerContext worker(String unit, String... rasters) {
        String ns = "sentiflow_w_" + unit;
        store.create(ns);
        for (String r : rasters) store.put(ns, Artifact.raster(r));
        return new WorkerContext(unit, ns, SHARED, 0, 100, Path.of("/sessions", ns));
    }

    @Test
    void t1_copies_private_artifacts_and_deletes_namespace() throws Exception {
        ResultReconciler rec = new ResultReconciler(store, SHARED);
        WorkerContext w = worker("a", "T32UNE_20210615T103021_B04", "T32UNE_20210615T103021_B08");

        List<Artifact> moved = rec.reconcile(w);

        assertEquals(2, moved.size());
        assertThat(store.names(SHARED)).contains("T32UNE_20210615T103021_B04", "T32UNE_20210615T103021_B08");
        assertFalse(store.exists(w.namespace()));
    }

    @Test
    void t2_empty_context_returns_empty_list() throws Exception {
        ResultReconciler rec = new ResultReconciler(store, SHARED);
        WorkerContext w = worker("empty");

        assertThat(rec.reconcile(w)).isEmpty();
        assertFalse(store.exists(w.namespace()));
    }

    @Test
    void t3_reconciling_same_names_twice_overwrites() throws Exception {
        ResultReconciler rec = new ResultReconciler(store, SHARED);
        rec.reconcile(worker("a", "T32UNE_20210615T103021_B04"));
        rec.reconcile(worker("b", "T32UNE_20210615T103021_B04"));

        assertThat(store.names(SHARED)).containsExactly(
                "T32UNE_20210601T103021_B04", "T32UNE_20210615T103021_B04");
    }

    @Test
    void t4_foreign_write_to_shared_namespace_is_an_isolation_violation() throws Exception {
        ResultReconciler rec = new ResultReconciler(store, SHARED);
        WorkerContext w = worker("a", "T32UNE_20210615T103021_B04");
        store.touch(SHARED, Artifact.raster("T32UNE_20210601T103021_B04"));

        assertThatThrownBy(() -> rec.reconcile(w))
                .isInstanceOf(IsolationViolationException.class)
                .hasMessageContaining("modified");
        // 실패해도 private 네임스페이스는 지운다
        assertFalse(store.exists(w.namespace()));
    }

    @Test
    void t5_rebaseline_accepts_own_post_processing() throws Exception {
        ResultReconciler rec = new ResultReconciler(store, SHARED);
        store.putNull(SHARED, Artifact.raster("A_20210615T103021_clouds"));
        rec.rebaseline();

        assertThat(rec.reconcile(worker("a", "A_20210615T103021_B02"))).hasSize(1);
    }

    @Test
    void t6_active_namespace_must_be_shared() throws Exception {
        store.switchActive("sentiflow_w_x");
        assertThatThrownBy(() -> new ResultReconciler(store, SHARED))
                .isInstanceOf(IsolationViolationException.class);

        store.switchActive(SHARED);
        ResultReconciler rec = new ResultReconciler(store, SHARED);
        WorkerContext w = worker("a", "A_20210615T103021_B02");
        store.switchActive(w.namespace());
        assertThatThrownBy(() -> rec.reconcile(w)).isInstanceOf(IsolationViolationException.class);
    }

    @Test
    void t7_custom_transfer_can_drop_artifacts() throws Exception {
        ResultReconciler rec = new ResultReconciler(store, SHARED);
        WorkerContext w = worker("a", "A_20210615T103021_clouds", "A_20210615T103021_clouds_tmp");

        List<Artifact> moved = rec.reconcile(w, (ctx, a) ->
                a.name().endsWith("_tmp") ? null : rec.copy().apply(ctx, a));

        assertThat(moved).extracting(Artifact::name).containsExactly("A_20210615T103021_clouds");
        assertThat(store.names(SHARED)).doesNotContain("A_20210615T103021_clouds_tmp");
    }
}
