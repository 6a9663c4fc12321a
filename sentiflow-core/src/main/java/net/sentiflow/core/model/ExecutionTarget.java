package net.sentiflow.core.model;

import java.nio.file.Path;

/**
 * 외부 스텝이 실행될 대상.
 * 워커는 자기 private namespace 로만, 공유 네임스페이스 후처리 스텝은 shared 로 실행된다.
 */
public record ExecutionTarget(
        String namespace,
        String sharedNamespace,
        long memoryMb,
        Path configHandle      // 워커 전용 설정 사본, 공유 실행이면 null
) {
    public static ExecutionTarget shared(String sharedNamespace, long memoryMb) {
        return new ExecutionTarget(sharedNamespace, sharedNamespace, memoryMb, null);
    }

    public boolean isolated() { return !namespace.equals(sharedNamespace); }
}
