package net.sentiflow.core.model;

import java.util.List;

public record PoolReport(
        int submitted,
        List<CompletedUnit> completed,
        List<UnitFailure> failures,
        int peakActive,
        boolean cancelled
) {
    public PoolReport {
        completed = List.copyOf(completed);
        failures = List.copyOf(failures);
    }

    public boolean partialFailure() { return !failures.isEmpty(); }
}
