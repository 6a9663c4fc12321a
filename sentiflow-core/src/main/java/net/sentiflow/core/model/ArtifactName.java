package net.sentiflow.core.model;

import net.sentiflow.core.error.MalformedArtifactNameException;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 위치 기반 아티팩트 이름 토크나이저.
 * <p>
 * {@code {prefix}_{YYYYMMDDTHHMMSS}_{band_or_kind}[_...]} 형식만 허용한다.
 * 날짜/시각 문자열은 이름에서 그대로 잘라 쓴다.
 */
public record ArtifactName(
        String name,
        String prefix,
        String stamp,          // "20210615T103021"
        String token,          // 밴드 또는 종류 (B04, CLOUDS, clouds ...)
        List<String> tail,     // token 이후 나머지 세그먼트
        LocalDateTime acquiredAt
) {
    public static final char SEPARATOR = '_';
    public static final char DATE_TIME_SEPARATOR = 'T';
    private static final int STAMP_LENGTH = 15;

    public static ArtifactName parse(String name) {
        if (name == null || name.isBlank()) {
            throw new MalformedArtifactNameException(name, "empty name");
        }
        String[] parts = name.split(String.valueOf(SEPARATOR), -1);
        if (parts.length < 3) {
            throw new MalformedArtifactNameException(name,
                    "expected at least 3 segments separated by '" + SEPARATOR + "', got " + parts.length);
        }
        String stamp = parts[1];
        if (stamp.length() != STAMP_LENGTH || stamp.charAt(8) != DATE_TIME_SEPARATOR) {
            throw new MalformedArtifactNameException(name,
                    "second segment must be YYYYMMDDTHHMMSS, got '" + stamp + "'");
        }
        for (int i = 0; i < STAMP_LENGTH; i++) {
            if (i != 8 && !Character.isDigit(stamp.charAt(i))) {
                throw new MalformedArtifactNameException(name, "non-digit in date/time segment '" + stamp + "'");
            }
        }
        if (parts[0].isEmpty() || parts[2].isEmpty()) {
            throw new MalformedArtifactNameException(name, "empty prefix or band segment");
        }
        LocalDateTime at;
        try {
            at = LocalDateTime.of(
                    Integer.parseInt(stamp.substring(0, 4)),
                    Integer.parseInt(stamp.substring(4, 6)),
                    Integer.parseInt(stamp.substring(6, 8)),
                    Integer.parseInt(stamp.substring(9, 11)),
                    Integer.parseInt(stamp.substring(11, 13)),
                    Integer.parseInt(stamp.substring(13, 15)));
        } catch (DateTimeException e) {
            throw new MalformedArtifactNameException(name, "invalid date/time '" + stamp + "': " + e.getMessage());
        }
        List<String> tail = parts.length > 3 ? List.of(parts).subList(3, parts.length) : List.of();
        return new ArtifactName(name, parts[0], stamp, parts[2], tail, at);
    }

    /** {@code prefix_YYYYMMDDTHHMMSS} */
    public String sceneId() { return prefix + SEPARATOR + stamp; }

    /** YYYY-MM-DD */
    public String date() {
        return stamp.substring(0, 4) + "-" + stamp.substring(4, 6) + "-" + stamp.substring(6, 8);
    }

    /** HH:MM:SS */
    public String time() {
        return stamp.substring(9, 11) + ":" + stamp.substring(11, 13) + ":" + stamp.substring(13, 15);
    }

    public String timestamp() { return date() + " " + time(); }

    public Scene scene() { return new Scene(sceneId(), acquiredAt); }
}
