package net.sentiflow.adapter.local.host;

import net.sentiflow.core.model.HostCapacity;
import net.sentiflow.core.spi.HostProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/** 가용 메모리 = 여유 물리 메모리 + 여유 스왑 (MB) */
public final class SystemHostProbe implements HostProbe {
    private static final Logger log = LoggerFactory.getLogger(SystemHostProbe.class);

    private static final long MB = 1024L * 1024L;

    @Override
    public HostCapacity probe() {
        try {
            int cpus = Runtime.getRuntime().availableProcessors();
            OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
            Long freeMb = null;
            if (os instanceof com.sun.management.OperatingSystemMXBean sun) {
                freeMb = (sun.getFreeMemorySize() + sun.getFreeSwapSpaceSize()) / MB;
            }
            return new HostCapacity(cpus, freeMb);
        } catch (RuntimeException | LinkageError e) {
            log.warn("Unable to probe host capacity: {}", e.toString());
            return HostCapacity.unknown();
        }
    }
}
