package net.sentiflow.core.model;

import java.time.Instant;

public record UnitRun(
        Long id,
        Long batchRunId,
        String unitId,
        String subject,
        String stepName,
        Status status,
        Integer workerId,
        Long attempt,
        String namespace,
        Instant startedAt,
        Instant finishedAt,
        Instant createdAt,
        Instant updatedAt,
        String lastError
) {
    public enum Status {
        RUNNING, DONE, FAILED, SKIPPED, CANCELLED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }
}
