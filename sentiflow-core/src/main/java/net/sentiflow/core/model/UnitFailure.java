package net.sentiflow.core.model;

public record UnitFailure(String unitId, String subject, String reason) {
    @Override public String toString() { return unitId + " (" + subject + "): " + reason; }
}
