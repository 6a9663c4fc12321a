package net.sentiflow.core.spi;

import net.sentiflow.core.model.Artifact;
import net.sentiflow.core.model.RegisterEntry;

import java.util.List;

/** 시계열 데이터셋 저장소. append-only, 재생성에 멱등. */
public interface TemporalDatasetStore {

    /** 이미 같은 이름이 있으면 비우고 다시 만든다. */
    void create(String dataset, Artifact.Type type, String title, String description) throws Exception;

    boolean exists(String dataset) throws Exception;

    /** 같은 아티팩트가 이미 등록돼 있으면 시각/label 을 갱신한다. */
    void register(String dataset, List<RegisterEntry> entries) throws Exception;

    /** 시작 시각 순 */
    List<RegisterEntry> list(String dataset) throws Exception;

    /** 이름에 token 이 들어간 항목만 모은 하위 데이터셋을 만든다. 복사된 건수를 반환. */
    int extract(String source, String token, String output) throws Exception;
}
