package net.sentiflow.core.spi;

import net.sentiflow.core.model.HostCapacity;

@FunctionalInterface
public interface HostProbe {
    /** 조회 실패 시 예외 대신 HostCapacity.unknown() 을 돌려줄 것 */
    HostCapacity probe();
}
