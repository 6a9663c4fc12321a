package net.sentiflow.core.model;

import java.nio.file.Path;

/** 유닛 하나가 실행되는 격리 컨텍스트. 동시에 실행 중인 두 유닛이 공유하지 않는다. */
public record WorkerContext(
        String unitId,
        String namespace,
        String sharedNamespace,
        int workerId,
        long memoryMb,
        Path configHandle
) {
    public ExecutionTarget target() {
        return new ExecutionTarget(namespace, sharedNamespace, memoryMb, configHandle);
    }
}
