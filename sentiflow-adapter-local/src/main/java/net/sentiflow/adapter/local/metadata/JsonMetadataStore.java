package net.sentiflow.adapter.local.metadata;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.sentiflow.core.model.SceneMetadata;
import net.sentiflow.core.spi.MetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * 가져오기 단계가 남긴 {@code <dir>/<artifact>/description.json} 을 읽는다.
 * CLOUDY_PIXEL_PERCENTAGE 는 숫자나 문자열 둘 다 받는다.
 */
public final class JsonMetadataStore implements MetadataStore {
    private static final Logger log = LoggerFactory.getLogger(JsonMetadataStore.class);

    public static final String FILE_NAME = "description.json";
    public static final String CLOUDY_PIXEL_PERCENTAGE = "CLOUDY_PIXEL_PERCENTAGE";

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private final Path dir;
    private final ObjectMapper om;

    public JsonMetadataStore(Path dir, ObjectMapper om) {
        this.dir = dir;
        this.om = om;
    }

    @Override
    public Optional<SceneMetadata> find(String bandArtifact) throws IOException {
        Path file = dir.resolve(bandArtifact).resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) {
            log.debug("No metadata for {} at {}", bandArtifact, file);
            return Optional.empty();
        }
        Map<String, Object> raw = om.readValue(file.toFile(), MAP);
        return Optional.of(new SceneMetadata(file, cloudy(raw.get(CLOUDY_PIXEL_PERCENTAGE), file), raw));
    }

    static Double cloudy(Object v, Path file) {
        if (v == null) return null;
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.valueOf(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid " + CLOUDY_PIXEL_PERCENTAGE + " '" + v + "' in " + file, e);
        }
    }
}
