package net.sentiflow.core.service;

import net.sentiflow.core.model.DateGroup;
import net.sentiflow.core.model.PoolReport;
import net.sentiflow.core.model.RegisterEntry;
import net.sentiflow.core.model.SceneMask;
import net.sentiflow.core.model.UnitFailure;

import java.util.List;

/** 마스크 계산 결과: 장면별 최종 상태, 등록 항목, 실패 */
public record MaskOutcome(
        List<SceneMask> scenes,
        List<DateGroup> groups,
        List<RegisterEntry> clouds,
        List<RegisterEntry> shadows,
        List<UnitFailure> failures,
        int skipped,            // 임계값으로 계산을 건너뛴 장면 수
        PoolReport pool
) {
    public MaskOutcome {
        scenes = List.copyOf(scenes);
        groups = List.copyOf(groups);
        clouds = List.copyOf(clouds);
        shadows = List.copyOf(shadows);
        failures = List.copyOf(failures);
    }
}
