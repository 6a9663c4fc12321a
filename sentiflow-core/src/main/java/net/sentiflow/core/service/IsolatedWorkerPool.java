package net.sentiflow.core.service;

import net.sentiflow.core.model.CompletedUnit;
import net.sentiflow.core.model.PoolReport;
import net.sentiflow.core.model.StepResult;
import net.sentiflow.core.model.UnitFailure;
import net.sentiflow.core.model.WorkUnit;
import net.sentiflow.core.model.WorkerContext;
import net.sentiflow.core.spi.NamespaceStore;
import net.sentiflow.core.spi.StepRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 동시 실행 수가 제한된 격리 워커 풀.
 * <ul>
 *   <li>FIFO 제출, 우선순위 없음, 완료 순서는 보장하지 않는다.</li>
 *   <li>유닛마다 새 private 네임스페이스(WorkerContext)를 만든다. 이름에 난수가 붙으므로 재시도에도 재사용되지 않는다.</li>
 *   <li>실패한 유닛은 기록만 하고 나머지는 계속 실행한다. 실패한 유닛의 컨텍스트는 즉시 삭제한다.</li>
 *   <li>성공한 유닛의 컨텍스트는 호출자가 reconcile 할 때까지 남는다.</li>
 * </ul>
 * 한 번 awaitAll/cancel 한 풀은 다시 쓰지 않는다.
 */
public final class IsolatedWorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IsolatedWorkerPool.class);

    private final NamespaceStore namespaces;
    private final StepRunner steps;
    private final String sharedNamespace;
    private final PoolConfig config;
    private final PoolListener listener;

    private final ExecutorService executor;
    private final BlockingQueue<Integer> freeSlots;          // 워커 슬롯 0..N-1
    private final Map<String, WorkUnit> queued = new ConcurrentHashMap<>();
    private final Set<String> subjects = ConcurrentHashMap.newKeySet();
    private final Map<String, WorkerContext> running = new ConcurrentHashMap<>();
    private final Map<String, WorkUnit> dispatched = new ConcurrentHashMap<>();
    private final Set<String> failedIds = ConcurrentHashMap.newKeySet();   // 유닛당 실패 기록은 하나
    private final Queue<CompletedUnit> completed = new ConcurrentLinkedQueue<>();
    private final Queue<UnitFailure> failures = new ConcurrentLinkedQueue<>();
    private final AtomicInteger submitted = new AtomicInteger();
    private final AtomicInteger started = new AtomicInteger();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();
    private final Object handoff = new Object();             // completed 추가와 drain/snapshot 을 묶는다

    private volatile boolean accepting = true;
    private volatile String cancelReason;      // null 이면 취소되지 않음
    private volatile PoolReport report;

    public IsolatedWorkerPool(NamespaceStore namespaces,
                              StepRunner steps,
                              String sharedNamespace,
                              PoolConfig config,
                              PoolListener listener) {
        this.namespaces = namespaces;
        this.steps = steps;
        this.sharedNamespace = sharedNamespace;
        this.config = config;
        this.listener = listener == null ? PoolListener.NONE : listener;
        this.freeSlots = new ArrayBlockingQueue<>(config.concurrency());
        for (int i = 0; i < config.concurrency(); i++) freeSlots.add(i);
        AtomicInteger threadSeq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(config.concurrency(), r -> {
            Thread t = new Thread(r, "sentiflow-worker-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** 같은 subject(장면) 의 유닛을 동시에 두 번 넣을 수 없다. */
    public void submit(WorkUnit unit) {
        if (!accepting) throw new IllegalStateException("Pool no longer accepts units");
        if (!subjects.add(unit.subject())) {
            throw new IllegalArgumentException("A unit for <" + unit.subject() + "> is already submitted");
        }
        if (queued.putIfAbsent(unit.id(), unit) != null) {
            subjects.remove(unit.subject());
            throw new IllegalArgumentException("Duplicate unit id <" + unit.id() + ">");
        }
        submitted.incrementAndGet();
        executor.execute(() -> run(unit));
    }

    public void submitAll(List<WorkUnit> units) {
        units.forEach(this::submit);
    }

    /**
     * 제출된 모든 유닛이 끝날 때까지 기다린다 (성공/실패).
     * 반환 시점에 실행 중인 컨텍스트는 없다. drainTimeout 을 넘기면 풀을 취소하고 남은 유닛은 실패로 기록한다.
     */
    public PoolReport awaitAll() throws InterruptedException {
        if (report != null) return report;
        accepting = false;
        executor.shutdown();
        if (config.drainTimeout() == null) {
            while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                log.info("Waiting for {} running / {} queued units ...", running.size(), queued.size());
            }
        } else if (!executor.awaitTermination(config.drainTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Pool did not drain within {}, cancelling remaining units", config.drainTimeout());
            cancel("timed out after " + config.drainTimeout());
        }
        return finish();
    }

    /** 실행 중인 유닛을 중단하고 모든 컨텍스트를 버린다. 완료됐지만 reconcile 전인 결과도 버린다. */
    public PoolReport cancel() throws InterruptedException {
        cancel("cancelled");
        return finish();
    }

    public int peakActive() { return peak.get(); }

    public int activeCount() { return active.get(); }

    @Override
    public void close() throws InterruptedException {
        if (report == null) cancel();
    }

    // --- 내부 ---

    private void cancel(String reason) throws InterruptedException {
        if (cancelReason != null) return;
        cancelReason = reason;
        accepting = false;
        executor.shutdownNow();

        for (String id : List.copyOf(queued.keySet())) {
            WorkUnit never = queued.remove(id);
            if (never != null) {
                if (recordFailure(never, reason)) notifyCancelled(never);
            }
        }
        if (!executor.awaitTermination(config.cancelGrace().toMillis(), TimeUnit.MILLISECONDS)) {
            // 외부 스텝을 강제로 끊을 수는 없다. 남은 컨텍스트만 정리한다.
            log.warn("{} unit(s) still running after {}: {}", running.size(), config.cancelGrace(), running.keySet());
            for (WorkUnit unit : List.copyOf(dispatched.values())) {
                if (recordFailure(unit, reason)) notifyCancelled(unit);
                WorkerContext ctx = running.get(unit.id());
                if (ctx != null) discard(ctx);
            }
        }
        List<CompletedUnit> drained = new ArrayList<>();
        synchronized (handoff) {
            CompletedUnit done;
            while ((done = completed.poll()) != null) drained.add(done);
        }
        for (CompletedUnit done : drained) {
            discard(done.context());
            if (recordFailure(done.unit(), reason)) notifyCancelled(done.unit());
        }
    }

    private PoolReport finish() {
        if (report == null) {
            List<CompletedUnit> ok;
            synchronized (handoff) {
                ok = new ArrayList<>(completed);
                completed.clear();
                report = new PoolReport(submitted.get(), ok, new ArrayList<>(failures), peak.get(), cancelReason != null);
            }
            log.info("Pool finished: {} submitted, {} succeeded, {} failed, peak {} concurrent",
                    report.submitted(), ok.size(), report.failures().size(), report.peakActive());
        }
        return report;
    }

    private void run(WorkUnit unit) {
        if (queued.remove(unit.id()) == null) return;  // 취소로 이미 처리됨
        Integer slot = freeSlots.poll();
        if (slot == null) {
            // 스레드 수 == 슬롯 수 이므로 생기지 않아야 한다
            recordFailure(unit, "no free worker slot");
            return;
        }
        WorkUnit assigned = unit.assignedTo(slot);
        dispatched.put(unit.id(), assigned);
        int now = active.incrementAndGet();
        peak.accumulateAndGet(now, Math::max);
        WorkerContext ctx = null;
        try {
            log.info("Processing {} of {}: <{}> on worker {}",
                    started.incrementAndGet(), submitted.get(), unit.subject(), slot);
            ctx = open(assigned, slot);
            running.put(unit.id(), ctx);
            listener.onStart(assigned, ctx);

            StepResult result = steps.invoke(unit.request(), ctx.target());
            if (!result.ok()) {
                fail(assigned, ctx, "exit status " + result.exitStatus()
                        + (result.diagnostics() == null ? "" : ": " + result.diagnostics()));
                return;
            }
            // 취소나 finish 이후에 끝난 유닛은 넘길 곳이 없다
            String late = handOff(new CompletedUnit(assigned, ctx, result));
            if (late != null) {
                fail(assigned, ctx, late);
                return;
            }
            notifySuccess(assigned, ctx, result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(assigned, ctx, cancelReason == null ? "interrupted" : cancelReason);
        } catch (Exception e) {
            log.warn("Unit <{}> failed", unit.subject(), e);
            fail(assigned, ctx, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            running.remove(unit.id());
            dispatched.remove(unit.id());
            active.decrementAndGet();
            freeSlots.offer(slot);
        }
    }

    /** 결과를 completed 에 넣는다. 넣지 못하면 그 이유를 돌려준다. */
    private String handOff(CompletedUnit done) {
        synchronized (handoff) {
            if (cancelReason != null) return cancelReason;
            if (report != null) return "pool already finished";
            completed.add(done);
            return null;
        }
    }

    private WorkerContext open(WorkUnit unit, int slot) throws Exception {
        String ns = config.namespacePrefix() + "_" + sanitize(unit.id()) + "_"
                + UUID.randomUUID().toString().substring(0, 8);
        namespaces.create(ns);
        Path cfg = namespaces.privateConfig(ns);
        return new WorkerContext(unit.id(), ns, sharedNamespace, slot, config.memoryMb(), cfg);
    }

    private void fail(WorkUnit unit, WorkerContext ctx, String reason) {
        if (ctx != null) discard(ctx);
        if (!recordFailure(unit, reason)) return;   // 취소 중 이미 기록됨
        log.warn("Unit <{}> failed: {}", unit.subject(), reason);
        try {
            listener.onFailure(unit, reason);
        } catch (Exception e) {
            log.warn("Pool listener failed on failure of <{}>", unit.id(), e);
        }
    }

    private boolean recordFailure(WorkUnit unit, String reason) {
        if (!failedIds.add(unit.id())) return false;
        failures.add(new UnitFailure(unit.id(), unit.subject(), reason));
        return true;
    }

    private void discard(WorkerContext ctx) {
        try {
            namespaces.delete(ctx.namespace());
        } catch (Exception e) {
            log.warn("Could not remove worker namespace <{}>", ctx.namespace(), e);
        }
    }

    private void notifySuccess(WorkUnit unit, WorkerContext ctx, StepResult result) {
        try {
            listener.onSuccess(unit, ctx, result);
        } catch (Exception e) {
            log.warn("Pool listener failed on success of <{}>", unit.id(), e);
        }
    }

    private void notifyCancelled(WorkUnit unit) {
        try {
            listener.onCancelled(unit);
        } catch (Exception e) {
            log.warn("Pool listener failed on cancel of <{}>", unit.id(), e);
        }
    }

    static String sanitize(String id) {
        return id.replaceAll("[^A-Za-z0-9_]", "_");
    }
}
