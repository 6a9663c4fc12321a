package net.sentiflow.adapter.local.process;

import net.sentiflow.core.model.StepRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** 스텝 요청 → {@code key=value} 인자 목록 */
public final class StepArguments {
    private StepArguments() {}

    public static List<String> of(StepRequest request) {
        List<String> a = new ArrayList<>();
        if (request instanceof StepRequest.AtmosphericCorrection r) {
            put(a, "input_file", r.input());
            put(a, "output_dir", r.outputDir());
            put(a, "sen2cor_path", r.sen2corHome());
        } else if (request instanceof StepRequest.SceneImport r) {
            put(a, "input", r.input());
            put(a, "pattern_file", r.patternFile());
            put(a, "pattern", r.bandPattern());
            put(a, "region", r.region());
            put(a, "metadata", r.metadataDir());
            if (r.zeroToNull()) put(a, "zero_to_null", "true");
            mode(a, r.mode());
        } else if (request instanceof StepRequest.CloudMask r) {
            bands(a, r.bands());
            put(a, "cloud_raster", r.cloudRaster());
        } else if (request instanceof StepRequest.CloudShadowMask r) {
            bands(a, r.bands());
            put(a, "cloud_raster", r.cloudRaster());
            put(a, "shadow_raster", r.shadowRaster());
            put(a, "metadata", r.metadataFile());
            put(a, "shadow_threshold", r.shadowThreshold());
        } else if (request instanceof StepRequest.AreaFilter r) {
            put(a, "input", r.input() + "@" + r.sourceNamespace());
            put(a, "output", r.output());
            put(a, "value", r.minSizeHectares());
            put(a, "mode", "greater");
        } else if (request instanceof StepRequest.Patch r) {
            put(a, "input", String.join(",", r.inputs()));
            put(a, "output", r.output());
        } else if (request instanceof StepRequest.NullLayer r) {
            put(a, "output", r.output());
        } else if (request instanceof StepRequest.OffsetAdjust r) {
            put(a, "raster", r.raster());
            put(a, "offset", r.offset());
        } else {
            throw new IllegalArgumentException("Unsupported step request " + request);
        }
        return a;
    }

    private static void mode(List<String> a, StepRequest.ImportMode mode) {
        if (mode instanceof StepRequest.Resampled) {
            put(a, "resample", "true");
        } else if (mode instanceof StepRequest.WithClouds m) {
            put(a, "cloud_output", m.cloudOutput().element());
        } else if (mode instanceof StepRequest.ResampledWithClouds m) {
            put(a, "resample", "true");
            put(a, "cloud_output", m.cloudOutput().element());
        }
    }

    /** 역할 이름 순으로 고정 */
    private static void bands(List<String> a, Map<String, String> bands) {
        new TreeMap<>(bands).forEach((role, raster) -> put(a, role, raster));
    }

    private static void put(List<String> a, String key, Object value) {
        if (value != null) a.add(key + "=" + value);
    }
}
