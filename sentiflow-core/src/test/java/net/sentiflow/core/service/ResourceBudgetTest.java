package net.sentiflow.core.service;

import net.sentiflow.core.model.Allocation;
import net.sentiflow.core.model.HostCapacity;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@TestMethodOrder(MethodOrderer.MethodName.class)
class ResourceBudgetTest {

    @Test
    void t1_memory_is_clamped_to_free_memory() {
        Allocation a = ResourceBudget.compute(4, 10000, 4, new HostCapacity(8, 4000L),
                ResourceBudget.CpuPolicy.WARN);

        assertEquals(4, a.effectiveWorkers());
        assertEquals(4000, a.effectiveMemoryMb());
        assertEquals(1000, a.perWorkerMemoryMb());
        assertThat(a.warnings()).hasSize(1);
        assertThat(a.warnings().get(0)).contains("10000 MB").contains("4000 MB");
    }

    @Test
    void t2_cpu_overcommit_warns_or_clamps() {
        Allocation warn = ResourceBudget.compute(16, 1000, 20, new HostCapacity(4, null),
                ResourceBudget.CpuPolicy.WARN);
        assertEquals(16, warn.effectiveWorkers());
        assertThat(warn.warnings()).hasSize(1);
        assertThat(warn.warnings().get(0)).contains("only 4 CPUs");

        Allocation clamp = ResourceBudget.compute(16, 1000, 20, new HostCapacity(4, null),
                ResourceBudget.CpuPolicy.CLAMP);
        assertEquals(4, clamp.effectiveWorkers());
        assertEquals(250, clamp.perWorkerMemoryMb());
    }

    @Test
    void t3_workers_never_exceed_pending_units() {
        Allocation a = ResourceBudget.compute(8, 900, 3, HostCapacity.unknown(), ResourceBudget.CpuPolicy.WARN);
        assertEquals(3, a.effectiveWorkers());
        assertEquals(300, a.perWorkerMemoryMb());
        assertThat(a.warnings()).isEmpty();

        Allocation none = ResourceBudget.compute(8, 900, 0, HostCapacity.unknown(), ResourceBudget.CpuPolicy.WARN);
        assertEquals(0, none.effectiveWorkers());
        assertEquals(1, none.poolSize());
        assertEquals(900, none.perWorkerMemoryMb());
    }

    @Test
    void t4_invalid_requests() {
        assertThatThrownBy(() -> ResourceBudget.compute(0, 100, 1, null, ResourceBudget.CpuPolicy.WARN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResourceBudget.compute(1, -1, 1, null, ResourceBudget.CpuPolicy.WARN))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
