package net.sentiflow.core.model;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record Scene(String id, LocalDateTime acquiredAt) {
    public LocalDate acquisitionDate() { return acquiredAt.toLocalDate(); }
}
