package net.sentiflow.core.model;

import java.nio.file.Path;
import java.util.Map;

public record SceneMetadata(
        Path source,
        Double cloudyPixelPercentage,   // CLOUDY_PIXEL_PERCENTAGE, 없으면 null
        Map<String, Object> raw
) {
    public SceneMetadata {
        raw = raw == null ? Map.of() : Map.copyOf(raw);
    }
}
