package net.sentiflow.core.service;

import java.time.Duration;
import java.util.Objects;

/**
 * @param concurrency     동시에 실행할 최대 유닛 수 N
 * @param memoryMb        워커당 메모리
 * @param namespacePrefix private 네임스페이스 이름 접두사
 * @param drainTimeout    awaitAll 최대 대기, null 이면 무제한
 * @param cancelGrace     취소 시 실행 중 스텝이 끝나기를 기다리는 시간
 */
public record PoolConfig(
        int concurrency,
        long memoryMb,
        String namespacePrefix,
        Duration drainTimeout,
        Duration cancelGrace
) {
    public static final String DEFAULT_PREFIX = "sentiflow_w";
    public static final Duration DEFAULT_CANCEL_GRACE = Duration.ofSeconds(30);

    public PoolConfig {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1, got " + concurrency);
        Objects.requireNonNull(namespacePrefix, "namespacePrefix");
        if (cancelGrace == null) cancelGrace = DEFAULT_CANCEL_GRACE;
    }

    public static PoolConfig of(int concurrency, long memoryMb) {
        return new PoolConfig(concurrency, memoryMb, DEFAULT_PREFIX, null, DEFAULT_CANCEL_GRACE);
    }

    public PoolConfig withDrainTimeout(Duration timeout) {
        return new PoolConfig(concurrency, memoryMb, namespacePrefix, timeout, cancelGrace);
    }

    public PoolConfig withNamespacePrefix(String prefix) {
        return new PoolConfig(concurrency, memoryMb, prefix, drainTimeout, cancelGrace);
    }
}
