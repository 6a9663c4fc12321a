package net.sentiflow.core.model;

import java.util.List;
import java.util.Locale;

/** 일반 밴드 레이어인지 마스크 레이어인지 */
public enum LayerClass {
    BAND, MASK;

    /** 이름에 이 중 하나가 들어 있으면 마스크 */
    public static final List<String> MASK_MARKERS = List.of("CLOUDS", "SHADOWS");

    public static LayerClass of(Artifact artifact) {
        if (artifact.type() == Artifact.Type.VECTOR) return MASK;
        return of(artifact.name());
    }

    public static LayerClass of(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        for (String marker : MASK_MARKERS) {
            if (upper.contains(marker)) return MASK;
        }
        return BAND;
    }
}
