package net.sentiflow.core.service;

import net.sentiflow.core.error.IsolationViolationException;
import net.sentiflow.core.model.Artifact;
import net.sentiflow.core.model.CompletedUnit;
import net.sentiflow.core.model.NamespaceFingerprint;
import net.sentiflow.core.model.WorkerContext;
import net.sentiflow.core.spi.NamespaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 워커 결과를 공유 네임스페이스로 옮긴다.
 * <p>
 * 생성 시점의 공유 네임스페이스 지문과 활성 네임스페이스를 기준으로 삼고,
 * reconcile 할 때마다 다시 확인한다. 기준과 다르면 워커가 공유 공간을 건드린 것이다.
 * 공유 네임스페이스 쓰기는 이 객체의 락 아래에서만 일어난다.
 */
public final class ResultReconciler {
    private static final Logger log = LoggerFactory.getLogger(ResultReconciler.class);

    /** private 아티팩트 하나를 공유 네임스페이스로 옮긴다. 옮기지 않으면 null. */
    @FunctionalInterface
    public interface Transfer {
        Artifact apply(WorkerContext from, Artifact artifact) throws Exception;
    }

    private final NamespaceStore namespaces;
    private final String sharedNamespace;
    private final Transfer copy;
    private NamespaceFingerprint baseline;

    public ResultReconciler(NamespaceStore namespaces, String sharedNamespace) throws Exception {
        this.namespaces = namespaces;
        this.sharedNamespace = sharedNamespace;
        this.copy = (from, artifact) -> {
            namespaces.copy(from.namespace(), artifact, sharedNamespace);
            return artifact;
        };
        String active = namespaces.activeNamespace();
        if (!sharedNamespace.equals(active)) {
            throw new IsolationViolationException(
                    "Active namespace <" + active + "> is not the shared namespace <" + sharedNamespace + ">");
        }
        this.baseline = namespaces.fingerprint(sharedNamespace);
    }

    public Transfer copy() { return copy; }

    public List<Artifact> reconcile(WorkerContext ctx) throws Exception {
        return reconcile(ctx, copy);
    }

    /** 결과 복사 후 private 네임스페이스를 무조건 지운다. 빈 컨텍스트는 빈 목록. */
    public synchronized List<Artifact> reconcile(WorkerContext ctx, Transfer transfer) throws Exception {
        try {
            verify(ctx);
            List<Artifact> moved = new ArrayList<>();
            for (Artifact a : namespaces.list(ctx.namespace())) {
                Artifact out = transfer.apply(ctx, a);
                if (out != null) moved.add(out);
            }
            log.debug("Reconciled {} artifact(s) from <{}>", moved.size(), ctx.namespace());
            return moved;
        } finally {
            namespaces.delete(ctx.namespace());
            baseline = namespaces.fingerprint(sharedNamespace);
        }
    }

    /**
     * 완료된 유닛 전부를 순서대로 reconcile 한다.
     * 하나가 실패하면 남은 컨텍스트를 지우고 예외를 다시 던진다.
     */
    public Map<String, List<Artifact>> reconcileAll(List<CompletedUnit> completed, Transfer transfer) throws Exception {
        Map<String, List<Artifact>> out = new LinkedHashMap<>();
        Iterator<CompletedUnit> it = completed.iterator();
        try {
            while (it.hasNext()) {
                CompletedUnit u = it.next();
                out.put(u.unit().id(), reconcile(u.context(), transfer));
            }
            return out;
        } catch (Exception e) {
            while (it.hasNext()) discard(it.next().context());
            throw e;
        }
    }

    /** 결과를 버리고 컨텍스트만 지운다. */
    public synchronized void discard(WorkerContext ctx) {
        try {
            namespaces.delete(ctx.namespace());
        } catch (Exception e) {
            log.warn("Could not remove worker namespace <{}>", ctx.namespace(), e);
        }
    }

    /** 공유 네임스페이스에 대한 이 프로세스의 변경을 기준에 반영한다 (후처리 스텝 이후). */
    public synchronized void rebaseline() throws Exception {
        baseline = namespaces.fingerprint(sharedNamespace);
    }

    private void verify(WorkerContext ctx) throws Exception {
        String active = namespaces.activeNamespace();
        if (!sharedNamespace.equals(active)) {
            throw new IsolationViolationException("Active namespace switched to <" + active
                    + "> while reconciling <" + ctx.unitId() + ">");
        }
        NamespaceFingerprint now = namespaces.fingerprint(sharedNamespace);
        if (!now.stamps().equals(baseline.stamps())) {
            throw new IsolationViolationException("Shared namespace <" + sharedNamespace
                    + "> was modified outside reconciliation before <" + ctx.unitId() + ">: " + baseline.diff(now));
        }
    }
}
