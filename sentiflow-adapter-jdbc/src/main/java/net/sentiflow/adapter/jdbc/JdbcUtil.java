package net.sentiflow.adapter.jdbc;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;

public final class JdbcUtil {
    private JdbcUtil() {}

    public static final char LIKE_ESCAPE = '\\';

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    /** 촬영 시각은 시간대 없는 값 그대로 저장한다 */
    public static Timestamp ts(LocalDateTime t) { return t == null ? null : Timestamp.valueOf(t); }

    public static LocalDateTime toLocal(Timestamp ts) { return ts == null ? null : ts.toLocalDateTime(); }

    /** {@code %token%} LIKE 패턴. '_' 와 '%' 는 글자 그대로 비교한다 */
    public static String containsPattern(String token) {
        StringBuilder sb = new StringBuilder("%");
        for (char ch : token.toCharArray()) {
            if (ch == '%' || ch == '_' || ch == LIKE_ESCAPE) sb.append(LIKE_ESCAPE);
            sb.append(ch);
        }
        return sb.append('%').toString();
    }
}
