package net.sentiflow.core.model;

import java.time.Instant;

public record BatchRun(
        Long id,
        Kind kind,
        String runKey,     // 예: "import:2021-06-15T10:30:00Z"
        Status status,
        Integer workers,
        Long memoryMb,
        String summary,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant finishedAt
) {
    public enum Kind {
        IMPORT, MASK, UNKNOWN;

        public static Kind from(String s) {
            if (s == null) return UNKNOWN;
            try { return Kind.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }

    public enum Status {
        CREATED, RUNNING, DONE, FAILED, CANCELLED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }
}
