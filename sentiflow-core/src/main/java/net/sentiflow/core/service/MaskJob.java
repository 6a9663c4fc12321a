package net.sentiflow.core.service;

import java.time.Duration;
import java.util.Objects;

/**
 * 마스크 파이프라인 한 번의 입력/출력과 옵션.
 * outputShadows 가 있으면 그림자 마스크도 계산한다.
 */
public record MaskJob(
        String input,
        String outputClouds,
        String outputShadows,
        double threshold,
        Double minSizeClouds,
        Double minSizeShadows,
        int workers,
        long memoryMb,
        Duration drainTimeout
) {
    public MaskJob {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(outputClouds, "outputClouds");
    }

    public MaskSettings settings() {
        return new MaskSettings(threshold, outputShadows != null, minSizeClouds, minSizeShadows,
                MaskSettings.DEFAULT_SHADOW_THRESHOLD);
    }
}
