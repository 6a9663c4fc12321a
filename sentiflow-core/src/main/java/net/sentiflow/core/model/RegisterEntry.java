package net.sentiflow.core.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/** 시계열 데이터셋 등록 항목: (아티팩트, 시각, 선택적 semantic label) */
public record RegisterEntry(
        String artifact,
        LocalDateTime start,
        String semanticLabel   // null 허용
) {
    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public RegisterEntry {
        Objects.requireNonNull(artifact, "artifact");
        Objects.requireNonNull(start, "start");
    }

    public static RegisterEntry of(String artifact, LocalDateTime start) {
        return new RegisterEntry(artifact, start, null);
    }

    /** register 파일 한 줄: {@code name|YYYY-MM-DD HH:MM:SS[|label]} */
    public String line() {
        String s = artifact + "|" + TIMESTAMP.format(start);
        return semanticLabel == null ? s : s + "|" + semanticLabel;
    }
}
