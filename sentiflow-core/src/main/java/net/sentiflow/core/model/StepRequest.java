package net.sentiflow.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 외부 처리 스텝 요청. 한 요청은 정확히 한 종류의 스텝을 기술한다.
 * 실행기는 {@code instanceof} 패턴으로 분기한다.
 */
public sealed interface StepRequest
        permits StepRequest.AtmosphericCorrection,
                StepRequest.SceneImport,
                StepRequest.CloudMask,
                StepRequest.CloudShadowMask,
                StepRequest.AreaFilter,
                StepRequest.Patch,
                StepRequest.NullLayer,
                StepRequest.OffsetAdjust {

    String ATMOSPHERIC_CORRECTION = "atmospheric-correction";
    String SCENE_IMPORT = "scene-import";
    String MASK = "mask";
    String AREA_FILTER = "area-filter";
    String PATCH = "patch";
    String NULL_LAYER = "null-layer";
    String OFFSET = "offset";

    /** 실행기 설정에서 명령 템플릿을 찾는 키 */
    String stepName();

    /** sen2cor 대기보정. 결과는 outputDir 아래 디렉터리로 남는다. */
    record AtmosphericCorrection(Path input, Path outputDir, Path sen2corHome) implements StepRequest {
        public AtmosphericCorrection {
            Objects.requireNonNull(input, "input");
            Objects.requireNonNull(outputDir, "outputDir");
            Objects.requireNonNull(sen2corHome, "sen2corHome");
        }
        @Override public String stepName() { return ATMOSPHERIC_CORRECTION; }
    }

    /**
     * 장면 하나 import.
     * @param patternFile 평면 디렉터리 구성일 때 장면을 고르는 파일 패턴, 아니면 null
     * @param region      extent=region 일 때 호출자 region 이름, extent=input 이면 null
     */
    record SceneImport(Path input,
                       String patternFile,
                       String bandPattern,
                       String region,
                       Path metadataDir,
                       boolean zeroToNull,
                       ImportMode mode) implements StepRequest {
        public SceneImport {
            Objects.requireNonNull(input, "input");
            Objects.requireNonNull(mode, "mode");
        }
        @Override public String stepName() { return SCENE_IMPORT; }
    }

    /** import 변형: 리샘플링 여부와 클라우드 마스크 출력 형태 */
    sealed interface ImportMode permits Plain, Resampled, WithClouds, ResampledWithClouds {

        static ImportMode of(boolean resample, Artifact.Type clouds) {
            if (clouds == null) return resample ? new Resampled() : new Plain();
            return resample ? new ResampledWithClouds(clouds) : new WithClouds(clouds);
        }
    }

    record Plain() implements ImportMode {}

    /** 20/60m 밴드를 10m 로 리샘플링 */
    record Resampled() implements ImportMode {}

    record WithClouds(Artifact.Type cloudOutput) implements ImportMode {}

    record ResampledWithClouds(Artifact.Type cloudOutput) implements ImportMode {}

    /** 클라우드 마스크만 계산 */
    record CloudMask(Map<String, String> bands, String cloudRaster) implements StepRequest {
        public CloudMask {
            bands = Map.copyOf(bands);
            Objects.requireNonNull(cloudRaster, "cloudRaster");
        }
        @Override public String stepName() { return MASK; }
    }

    /** 클라우드 + 그림자 마스크 계산. 그림자 계산에는 장면 메타데이터 파일이 필요하다. */
    record CloudShadowMask(Map<String, String> bands,
                           String cloudRaster,
                           String shadowRaster,
                           Path metadataFile,
                           int shadowThreshold) implements StepRequest {
        public CloudShadowMask {
            bands = Map.copyOf(bands);
            Objects.requireNonNull(cloudRaster, "cloudRaster");
            Objects.requireNonNull(shadowRaster, "shadowRaster");
            Objects.requireNonNull(metadataFile, "metadataFile");
        }
        @Override public String stepName() { return MASK; }
    }

    /** 최소 면적(ha)보다 큰 영역만 남긴다. 남는 영역이 없으면 실패로 끝난다. */
    record AreaFilter(String sourceNamespace, String input, String output, double minSizeHectares)
            implements StepRequest {
        @Override public String stepName() { return AREA_FILTER; }
    }

    /** 여러 래스터를 공간적으로 겹쳐 하나로 만든다 (앞쪽 입력 우선). */
    record Patch(List<String> inputs, String output) implements StepRequest {
        public Patch {
            inputs = List.copyOf(inputs);
            if (inputs.size() < 2) throw new IllegalArgumentException("patch needs at least 2 inputs");
        }
        @Override public String stepName() { return PATCH; }
    }

    /** 값이 전부 null 인 래스터 생성 */
    record NullLayer(String output) implements StepRequest {
        @Override public String stepName() { return NULL_LAYER; }
    }

    /** 밴드 값에 offset 을 더하고 0 미만은 0 으로 자른다. */
    record OffsetAdjust(String raster, int offset) implements StepRequest {
        @Override public String stepName() { return OFFSET; }
    }
}
