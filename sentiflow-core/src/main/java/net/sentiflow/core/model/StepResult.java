package net.sentiflow.core.model;

import java.util.List;

public record StepResult(int exitStatus, List<String> produced, String diagnostics) {
    public StepResult {
        produced = produced == null ? List.of() : List.copyOf(produced);
    }

    public static StepResult success(List<String> produced) { return new StepResult(0, produced, null); }

    public static StepResult failure(int exitStatus, String diagnostics) {
        return new StepResult(exitStatus, List.of(), diagnostics);
    }

    public boolean ok() { return exitStatus == 0; }
}
