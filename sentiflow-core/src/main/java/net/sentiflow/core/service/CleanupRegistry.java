package net.sentiflow.core.service;

import net.sentiflow.core.model.Artifact;
import net.sentiflow.core.spi.NamespaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * 실행 한 번 동안 생긴 임시 아티팩트/네임스페이스/디렉터리 목록.
 * close() 에서 등록 순서대로 지운다. 이미 없는 대상은 조용히 넘어가고, 삭제 실패는 경고만 남긴다.
 */
public final class CleanupRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CleanupRegistry.class);

    private sealed interface Target permits ArtifactTarget, NamespaceTarget, PathTarget {}
    private record ArtifactTarget(String namespace, Artifact artifact) implements Target {}
    private record NamespaceTarget(String namespace) implements Target {}
    private record PathTarget(Path path) implements Target {}

    private final NamespaceStore namespaces;
    private final List<Target> targets = new ArrayList<>();

    public CleanupRegistry(NamespaceStore namespaces) {
        this.namespaces = namespaces;
    }

    public synchronized void artifact(String namespace, Artifact artifact) {
        targets.add(new ArtifactTarget(namespace, artifact));
    }

    public synchronized void namespace(String namespace) {
        targets.add(new NamespaceTarget(namespace));
    }

    public synchronized void path(Path path) {
        targets.add(new PathTarget(path));
    }

    public synchronized int size() { return targets.size(); }

    /** 등록된 대상을 지우고 목록을 비운다. 지운 개수를 돌려준다. */
    public synchronized int drain() {
        int removed = 0;
        for (Target t : targets) {
            try {
                if (remove(t)) removed++;
            } catch (Exception e) {
                log.warn("Cleanup of {} failed", t, e);
            }
        }
        targets.clear();
        if (removed > 0) log.info("Cleaned up {} temporary item(s)", removed);
        return removed;
    }

    @Override
    public void close() {
        drain();
    }

    private boolean remove(Target t) throws Exception {
        if (t instanceof ArtifactTarget a) {
            if (!namespaces.contains(a.namespace(), a.artifact())) return false;
            namespaces.remove(a.namespace(), a.artifact());
            return true;
        }
        if (t instanceof NamespaceTarget n) {
            if (!namespaces.exists(n.namespace())) return false;
            namespaces.delete(n.namespace());
            return true;
        }
        PathTarget p = (PathTarget) t;
        return deleteRecursively(p.path());
    }

    private static boolean deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) return false;
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
        return true;
    }
}
