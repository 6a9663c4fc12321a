package net.sentiflow.adapter.local.fs;

import net.sentiflow.core.model.SceneInput;
import net.sentiflow.core.spi.SceneSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 로컬 디렉터리에서 장면 입력을 찾는다.
 * <ul>
 *   <li>장면별 폴더: 하위 디렉터리 하나가 장면 하나 (다운로드/대기보정 결과)</li>
 *   <li>평면 구성: {@code .SAFE} 또는 {@code .zip} 항목 하나가 장면 하나. 그 외 항목은 경고 후 제외.
 *       같은 장면이 두 형식으로 있으면 {@code .SAFE} 를 쓴다.</li>
 * </ul>
 */
public final class LocalSceneSource implements SceneSource {
    private static final Logger log = LoggerFactory.getLogger(LocalSceneSource.class);

    public static final String SAFE = ".SAFE";
    public static final String ZIP = ".zip";

    @Override
    public List<SceneInput> scan(Path directory, boolean singleFolders) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Input directory " + directory + " does not exist");
        }
        List<Path> entries;
        try (Stream<Path> s = Files.list(directory)) {
            entries = s.sorted().toList();
        }
        List<SceneInput> out = new ArrayList<>();
        Map<String, Integer> byPattern = new HashMap<>();
        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            if (singleFolders) {
                if (!Files.isDirectory(entry)) {
                    log.warn("{} is not a scene folder, skipping...", entry);
                    continue;
                }
                out.add(new SceneInput(name, entry, null, findSafe(entry).orElse(null)));
                continue;
            }
            String pattern = patternFile(name);
            if (pattern == null) {
                log.warn("{} is not in .SAFE or .zip format, skipping...", entry);
                continue;
            }
            Integer seen = byPattern.get(pattern);
            if (seen == null) {
                byPattern.put(pattern, out.size());
                out.add(new SceneInput(pattern, directory, pattern, entry));
                continue;
            }
            // 압축 파일과 풀린 .SAFE 가 함께 있으면 .SAFE 하나만 남긴다
            SceneInput kept = out.get(seen);
            if (name.endsWith(SAFE) && !kept.hasSafeProduct()) {
                log.warn("{} duplicates scene {}, skipping {}", entry, pattern, kept.product());
                out.set(seen, new SceneInput(pattern, directory, pattern, entry));
            } else {
                log.warn("{} duplicates scene {}, skipping...", entry, pattern);
            }
        }
        return out;
    }

    /** 항목 이름에서 .SAFE/.zip 을 뗀 장면 이름. 형식이 아니면 null */
    static String patternFile(String name) {
        if (name.endsWith(SAFE)) return name.substring(0, name.length() - SAFE.length());
        if (name.endsWith(ZIP)) {
            String base = name.substring(0, name.length() - ZIP.length());
            int safe = base.indexOf(SAFE);
            return safe >= 0 ? base.substring(0, safe) : base;
        }
        return null;
    }

    private static Optional<Path> findSafe(Path folder) throws IOException {
        try (Stream<Path> s = Files.list(folder)) {
            return s.filter(p -> p.getFileName().toString().endsWith(SAFE)).sorted().findFirst();
        }
    }
}
