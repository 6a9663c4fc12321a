package net.sentiflow.adapter.local.fs;

import net.sentiflow.core.model.Artifact;
import net.sentiflow.core.model.NamespaceFingerprint;
import net.sentiflow.core.spi.NamespaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Stream;

/**
 * 디렉터리 기반 네임스페이스 저장소.
 * <pre>
 * {root}/session.properties              현재 세션 (NAMESPACE=...)
 * {root}/{namespace}/raster/{name}/...   아티팩트 하나 = 디렉터리 하나
 * {root}/{namespace}/vector/{name}/...
 * {root}/{namespace}/.session.properties 워커 전용 세션 사본
 * </pre>
 * 값이 전부 null 인 레이어는 아티팩트 디렉터리에 {@value #NULL_MARKER} 파일을 둔다.
 */
public final class FileSystemNamespaceStore implements NamespaceStore {
    private static final Logger log = LoggerFactory.getLogger(FileSystemNamespaceStore.class);

    public static final String SESSION_FILE = "session.properties";
    public static final String PRIVATE_SESSION_FILE = ".session.properties";
    public static final String NAMESPACE_KEY = "NAMESPACE";
    public static final String NULL_MARKER = "null";

    private final Path root;
    private final String sharedNamespace;

    public FileSystemNamespaceStore(Path root, String sharedNamespace) throws IOException {
        this.root = root;
        this.sharedNamespace = sharedNamespace;
        Files.createDirectories(root.resolve(sharedNamespace));
        Path session = root.resolve(SESSION_FILE);
        if (!Files.exists(session)) writeSession(session, sharedNamespace);
    }

    public Path root() { return root; }

    public String sharedNamespace() { return sharedNamespace; }

    /** 아티팩트 디렉터리 경로 (스텝 실행기와 테스트용) */
    public Path location(String namespace, Artifact artifact) {
        return root.resolve(namespace).resolve(artifact.type().element()).resolve(artifact.name());
    }

    @Override
    public String activeNamespace() throws IOException {
        Properties p = new Properties();
        try (Reader r = Files.newBufferedReader(root.resolve(SESSION_FILE), StandardCharsets.UTF_8)) {
            p.load(r);
        }
        return p.getProperty(NAMESPACE_KEY);
    }

    @Override
    public boolean exists(String namespace) {
        return Files.isDirectory(root.resolve(namespace));
    }

    @Override
    public void create(String namespace) throws IOException {
        Path dir = root.resolve(namespace);
        if (Files.exists(dir)) {
            log.warn("Namespace <{}> already exists, recreating it empty", namespace);
            deleteTree(dir);
        }
        Files.createDirectories(dir);
    }

    @Override
    public void delete(String namespace) throws IOException {
        if (sharedNamespace.equals(namespace)) {
            throw new IllegalArgumentException("Refusing to delete the shared namespace <" + namespace + ">");
        }
        deleteTree(root.resolve(namespace));
    }

    @Override
    public List<String> namespaces(String prefix) throws IOException {
        try (Stream<Path> s = Files.list(root)) {
            return s.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> n.startsWith(prefix) && !n.equals(sharedNamespace))
                    .sorted()
                    .toList();
        }
    }

    @Override
    public Path privateConfig(String namespace) throws IOException {
        Path dir = root.resolve(namespace);
        if (!Files.isDirectory(dir)) throw new IllegalStateException("Namespace <" + namespace + "> does not exist");
        Path cfg = dir.resolve(PRIVATE_SESSION_FILE);
        writeSession(cfg, namespace);
        return cfg;
    }

    @Override
    public List<Artifact> list(String namespace) throws IOException {
        List<Artifact> out = new ArrayList<>();
        for (Artifact.Type type : Artifact.Type.values()) {
            Path dir = root.resolve(namespace).resolve(type.element());
            if (!Files.isDirectory(dir)) continue;
            try (Stream<Path> s = Files.list(dir)) {
                s.map(p -> p.getFileName().toString())
                        .filter(n -> !n.startsWith("."))
                        .sorted()
                        .forEach(n -> out.add(new Artifact(n, type)));
            }
        }
        return out;
    }

    @Override
    public boolean contains(String namespace, Artifact artifact) {
        return Files.exists(location(namespace, artifact));
    }

    @Override
    public void copy(String fromNamespace, Artifact artifact, String toNamespace) throws IOException {
        Path src = location(fromNamespace, artifact);
        if (!Files.exists(src)) {
            throw new IllegalArgumentException("Artifact " + artifact + " not found in <" + fromNamespace + ">");
        }
        Path dst = location(toNamespace, artifact);
        if (Files.exists(dst)) {
            log.debug("Overwriting {} in <{}>", artifact, toNamespace);
            deleteTree(dst);
        }
        Files.createDirectories(dst.getParent());
        copyTree(src, dst);
    }

    @Override
    public void remove(String namespace, Artifact artifact) throws IOException {
        deleteTree(location(namespace, artifact));
    }

    @Override
    public boolean isNull(String namespace, Artifact artifact) {
        return Files.exists(location(namespace, artifact).resolve(NULL_MARKER));
    }

    /** 값이 전부 null 인 레이어를 만든다 (기존 내용은 버림) */
    public void writeNull(String namespace, Artifact artifact) throws IOException {
        Path dir = location(namespace, artifact);
        deleteTree(dir);
        Files.createDirectories(dir);
        Files.createFile(dir.resolve(NULL_MARKER));
    }

    @Override
    public NamespaceFingerprint fingerprint(String namespace) throws IOException {
        Map<String, Long> stamps = new LinkedHashMap<>();
        for (Artifact a : list(namespace)) {
            stamps.put(a.type().element() + "/" + a.name(), stamp(location(namespace, a)));
        }
        return NamespaceFingerprint.of(namespace, stamps);
    }

    // --- 내부 ---

    private static long stamp(Path p) throws IOException {
        long[] acc = {17};
        Files.walkFileTree(p, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                acc[0] = acc[0] * 31 + attrs.lastModifiedTime().toMillis();
                acc[0] = acc[0] * 31 + attrs.size();
                acc[0] = acc[0] * 31 + file.getFileName().toString().hashCode();
                return FileVisitResult.CONTINUE;
            }
        });
        return acc[0];
    }

    private static void writeSession(Path file, String namespace) throws IOException {
        Properties p = new Properties();
        p.setProperty(NAMESPACE_KEY, namespace);
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            p.store(w, "sentiflow session");
        }
    }

    private static void copyTree(Path src, Path dst) throws IOException {
        try (Stream<Path> walk = Files.walk(src)) {
            for (Path from : walk.toList()) {
                Path to = dst.resolve(src.relativize(from).toString());
                if (Files.isDirectory(from)) {
                    Files.createDirectories(to);
                } else {
                    Files.copy(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                }
            }
        }
    }

    static void deleteTree(Path dir) throws IOException {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
