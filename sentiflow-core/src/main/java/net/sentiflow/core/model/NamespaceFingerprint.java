package net.sentiflow.core.model;

import java.util.Map;
import java.util.TreeMap;

/** 네임스페이스 내용 요약: 요소/이름 → 변경 스탬프 */
public record NamespaceFingerprint(String namespace, Map<String, Long> stamps) {
    public NamespaceFingerprint {
        stamps = Map.copyOf(stamps);
    }

    public static NamespaceFingerprint of(String namespace, Map<String, Long> stamps) {
        return new NamespaceFingerprint(namespace, stamps);
    }

    /** 두 지문의 차이를 사람이 읽을 수 있는 형태로 */
    public String diff(NamespaceFingerprint other) {
        Map<String, String> changes = new TreeMap<>();
        for (var e : stamps.entrySet()) {
            Long o = other.stamps.get(e.getKey());
            if (o == null) changes.put(e.getKey(), "removed");
            else if (!o.equals(e.getValue())) changes.put(e.getKey(), "modified");
        }
        for (String k : other.stamps.keySet()) {
            if (!stamps.containsKey(k)) changes.put(k, "added");
        }
        return changes.toString();
    }
}
