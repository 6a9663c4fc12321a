package net.sentiflow.core.service;

/**
 * 마스크 계산 옵션.
 * @param threshold       CLOUDY_PIXEL_PERCENTAGE 가 이 값보다 작으면 계산을 건너뛴다. 0 이면 항상 계산
 * @param shadows         그림자 마스크도 만들지
 * @param minSizeClouds   이 면적(ha) 이하 구름 영역 제거, null 이면 그대로 복사
 * @param minSizeShadows  그림자용 최소 면적
 * @param shadowThreshold 그림자 계산 임계값
 */
public record MaskSettings(
        double threshold,
        boolean shadows,
        Double minSizeClouds,
        Double minSizeShadows,
        int shadowThreshold
) {
    public static final int DEFAULT_SHADOW_THRESHOLD = 1000;

    public MaskSettings {
        if (threshold < 0 || threshold > 100) {
            throw new IllegalArgumentException("threshold must be within 0..100, got " + threshold);
        }
    }

    public static MaskSettings cloudsOnly() {
        return new MaskSettings(0, false, null, null, DEFAULT_SHADOW_THRESHOLD);
    }

    /** 메타데이터가 필요한지 */
    public boolean needsMetadata() { return threshold > 0 || shadows; }
}
