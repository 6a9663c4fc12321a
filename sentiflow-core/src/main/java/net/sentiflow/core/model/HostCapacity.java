package net.sentiflow.core.model;

/** 호스트 자원. 조회 실패 시 필드는 null (= 알 수 없음, 경고하지 않음) */
public record HostCapacity(Integer cpuCount, Long freeMemoryMb) {
    public static HostCapacity unknown() { return new HostCapacity(null, null); }
}
