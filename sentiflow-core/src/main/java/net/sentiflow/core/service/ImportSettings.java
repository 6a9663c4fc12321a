package net.sentiflow.core.service;

import net.sentiflow.core.model.Artifact;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 장면 import 실행 옵션.
 * @param inputDir       장면이 있는 디렉터리
 * @param singleFolders  true 면 하위 폴더 하나가 장면 하나 (다운로드 결과 구성)
 * @param tempDir        대기보정 결과 등 임시 디렉터리, null 이면 시스템 임시 디렉터리
 * @param extent         import 범위
 * @param region         extent=REGION 일 때 넘길 호출자 region 이름
 * @param cloudOutput    import 시 함께 만들 구름 마스크 형태, null 이면 만들지 않음
 * @param offset         밴드 값에 더할 값 (0 미만은 0), null 이면 적용하지 않음
 * @param dataset        밴드 데이터셋 이름, null 이면 등록하지 않음
 * @param cloudDataset   구름 데이터셋 이름, null 이면 {dataset}_clouds
 */
public record ImportSettings(
        Path inputDir,
        boolean singleFolders,
        Path tempDir,
        int workers,
        long memoryMb,
        String bandPattern,
        boolean resample,
        boolean zeroToNull,
        Extent extent,
        String region,
        Artifact.Type cloudOutput,
        boolean atmosphericCorrection,
        Path sen2corHome,
        Integer offset,
        Path metadataDir,
        String dataset,
        String cloudDataset,
        Duration drainTimeout
) {
    public enum Extent { REGION, INPUT }

    public static final String CLOUD_DATASET_SUFFIX = "_clouds";

    public ImportSettings {
        Objects.requireNonNull(inputDir, "inputDir");
        if (extent == null) extent = Extent.INPUT;
        if (extent == Extent.REGION && (region == null || region.isBlank())) {
            throw new IllegalArgumentException("extent=region requires a region name");
        }
        if (atmosphericCorrection && sen2corHome == null) {
            throw new IllegalArgumentException("atmospheric correction requires the sen2cor installation path");
        }
    }

    public String cloudDatasetName() {
        if (cloudDataset != null && !cloudDataset.isBlank()) return cloudDataset;
        return dataset == null ? null : dataset + CLOUD_DATASET_SUFFIX;
    }
}
