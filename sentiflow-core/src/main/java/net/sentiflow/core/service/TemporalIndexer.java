package net.sentiflow.core.service;

import net.sentiflow.core.error.IncompleteSceneException;
import net.sentiflow.core.model.ArtifactName;
import net.sentiflow.core.model.LayerClass;
import net.sentiflow.core.model.RegisterEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 아티팩트 이름에서 시각을 뽑아 시계열 등록 항목을 만든다.
 * 이름이 유일한 시각 정보원이다. 입력 순서를 유지하고 같은 이름은 한 번만 남긴다.
 */
public final class TemporalIndexer {

    /** 분할 키: (이름 접두사, 레이어 종류) */
    public record Partition(String prefix, LayerClass layerClass) {}

    public static final String LABEL_PREFIX = "S2_";

    private final boolean semanticLabels;

    public TemporalIndexer(boolean semanticLabels) {
        this.semanticLabels = semanticLabels;
    }

    /** 밴드 레이어에는 semantic label 을 붙인다 (설정된 경우). */
    public List<RegisterEntry> entries(Collection<String> names) {
        List<RegisterEntry> out = new ArrayList<>();
        for (String name : dedupe(names)) {
            ArtifactName n = ArtifactName.parse(name);
            String label = semanticLabels && LayerClass.of(name) == LayerClass.BAND ? semanticLabel(n.token()) : null;
            out.add(new RegisterEntry(name, n.acquiredAt(), label));
        }
        return out;
    }

    /** label 없이 시각만 */
    public List<RegisterEntry> plainEntries(Collection<String> names) {
        List<RegisterEntry> out = new ArrayList<>();
        for (String name : dedupe(names)) {
            out.add(RegisterEntry.of(name, ArtifactName.parse(name).acquiredAt()));
        }
        return out;
    }

    public Map<Partition, List<String>> partition(Collection<String> names) {
        Map<Partition, List<String>> out = new LinkedHashMap<>();
        for (String name : dedupe(names)) {
            ArtifactName n = ArtifactName.parse(name);
            out.computeIfAbsent(new Partition(n.prefix(), LayerClass.of(name)), k -> new ArrayList<>()).add(name);
        }
        return out;
    }

    /**
     * 장면 id → (밴드 → 아티팩트 이름).
     * 같은 장면/밴드가 두 번 나오면 나중 것이 남는다.
     */
    public static Map<String, Map<String, String>> groupByScene(Collection<String> names) {
        Map<String, Map<String, String>> out = new LinkedHashMap<>();
        for (String name : dedupe(names)) {
            ArtifactName n = ArtifactName.parse(name);
            out.computeIfAbsent(n.sceneId(), k -> new LinkedHashMap<>()).put(n.token(), name);
        }
        return out;
    }

    /** 필요한 밴드가 빠진 장면이 있으면 IncompleteSceneException */
    public static void requireComplete(Map<String, Map<String, String>> scenes, Collection<String> required) {
        for (var e : scenes.entrySet()) {
            Set<String> missing = new TreeSet<>(required);
            missing.removeAll(e.getValue().keySet());
            if (!missing.isEmpty()) throw new IncompleteSceneException(e.getKey(), missing);
        }
    }

    /** B04 → S2_4, B8A → S2_8A, B11 → S2_11 */
    public static String semanticLabel(String band) {
        return LABEL_PREFIX + band.replace("B0", "").replace("B", "");
    }

    /**
     * 밴드 패턴을 밴드 토큰 목록으로 펼친다.
     * {@code pre(a|b)post} → [preapost, prebpost], {@code a|b} → [a, b].
     * resampled 면 토큰의 20/60 을 10 으로 바꾼다.
     */
    public static List<String> bandTokens(String pattern, boolean resampled) {
        if (pattern == null || pattern.isBlank()) return List.of();
        List<String> raw = new ArrayList<>();
        int open = pattern.indexOf('(');
        int close = open < 0 ? -1 : pattern.indexOf(')', open);
        if (open >= 0 && close > open) {
            String before = pattern.substring(0, open);
            String after = pattern.substring(close + 1);
            for (String opt : pattern.substring(open + 1, close).split("\\|", -1)) {
                raw.add(before + opt + after);
            }
        } else {
            raw.addAll(List.of(pattern.split("\\|", -1)));
        }
        Set<String> out = new LinkedHashSet<>();
        for (String band : raw) {
            if (resampled && (band.contains("20") || band.contains("60"))) {
                band = band.replace("20", "10").replace("60", "10");
            }
            if (!band.isEmpty()) out.add(band);
        }
        return List.copyOf(out);
    }

    private static Collection<String> dedupe(Collection<String> names) {
        return new LinkedHashSet<>(names);
    }
}
