package net.sentiflow.core.model;

import java.util.List;

public record Allocation(
        int effectiveWorkers,
        long effectiveMemoryMb,
        long perWorkerMemoryMb,
        List<String> warnings
) {
    public Allocation {
        warnings = List.copyOf(warnings);
    }

    /** 풀 크기. 처리할 유닛이 없어도 1 이상 */
    public int poolSize() { return Math.max(effectiveWorkers, 1); }
}
