package net.sentiflow.core.model;

import java.util.Objects;

public record WorkUnit(
        String id,
        String subject,        // scene id 또는 date-group id
        StepRequest request,
        Integer workerId       // 디스패치 전에는 null
) {
    public WorkUnit {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(request, "request");
    }

    public static WorkUnit of(String id, String subject, StepRequest request) {
        return new WorkUnit(id, subject, request, null);
    }

    public WorkUnit assignedTo(int workerId) {
        return new WorkUnit(id, subject, request, workerId);
    }

    public boolean dispatched() { return workerId != null; }
}
