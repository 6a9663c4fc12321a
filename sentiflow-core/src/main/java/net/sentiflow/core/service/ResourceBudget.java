package net.sentiflow.core.service;

import net.sentiflow.core.model.Allocation;
import net.sentiflow.core.model.HostCapacity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 동시 실행 수와 워커당 메모리 계산. 부작용은 경고 로그뿐이다.
 */
public final class ResourceBudget {
    private static final Logger log = LoggerFactory.getLogger(ResourceBudget.class);

    /** CPU 수보다 많이 요청했을 때 */
    public enum CpuPolicy {
        /** 경고만 하고 요청대로 */
        WARN,
        /** 경고하고 CPU 수로 줄인다 */
        CLAMP
    }

    private ResourceBudget() {}

    public static Allocation compute(int requestedWorkers,
                                     long requestedMemoryMb,
                                     int pendingUnits,
                                     HostCapacity host,
                                     CpuPolicy cpuPolicy) {
        if (requestedWorkers < 1) {
            throw new IllegalArgumentException("requested workers must be >= 1, got " + requestedWorkers);
        }
        if (requestedMemoryMb < 0) {
            throw new IllegalArgumentException("requested memory must be >= 0, got " + requestedMemoryMb);
        }
        if (host == null) host = HostCapacity.unknown();
        List<String> warnings = new ArrayList<>();

        int workers = requestedWorkers;
        Integer cpus = host.cpuCount();
        if (cpus != null && cpus > 0 && requestedWorkers > cpus) {
            if (cpuPolicy == CpuPolicy.CLAMP) {
                warnings.add(String.format(
                        "Using %d parallel processes but only %d CPUs available. Setting workers to %d.",
                        requestedWorkers, cpus, cpus));
                workers = cpus;
            } else {
                warnings.add(String.format(
                        "Using %d parallel processes but only %d CPUs available.", requestedWorkers, cpus));
            }
        }

        long memory = requestedMemoryMb;
        Long free = host.freeMemoryMb();
        if (free != null && free >= 0 && requestedMemoryMb > free) {
            warnings.add(String.format("Using %d MB but only %d MB RAM available. Set used memory to %d MB.",
                    requestedMemoryMb, free, free));
            memory = free;
        }

        int effective = Math.max(Math.min(workers, pendingUnits), 0);
        long perWorker = Math.round((double) memory / Math.max(effective, 1));

        warnings.forEach(log::warn);
        return new Allocation(effective, memory, perWorker, warnings);
    }
}
