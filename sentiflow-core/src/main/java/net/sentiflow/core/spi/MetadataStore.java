package net.sentiflow.core.spi;

import net.sentiflow.core.model.SceneMetadata;

import java.util.Optional;

/** 장면 메타데이터 (읽기 전용). 밴드 아티팩트 이름으로 찾는다. */
public interface MetadataStore {
    Optional<SceneMetadata> find(String bandArtifact) throws Exception;
}
