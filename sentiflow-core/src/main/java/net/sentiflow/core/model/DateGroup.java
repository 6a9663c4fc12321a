package net.sentiflow.core.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/** 같은 촬영일의 장면 묶음. 둘 이상이면 마스크를 하나로 합친다. */
public final class DateGroup {
    public static final DateTimeFormatter BASIC_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final LocalDate date;
    private final List<SceneMask> members = new ArrayList<>();
    private String cloudArtifact;
    private String shadowArtifact;

    public DateGroup(LocalDate date) {
        this.date = date;
    }

    public void add(SceneMask member) {
        if (!member.scene().acquisitionDate().equals(date)) {
            throw new IllegalArgumentException("Scene " + member.scene().id() + " is not acquired on " + date);
        }
        members.add(member);
    }

    public LocalDate date() { return date; }
    public List<SceneMask> members() { return Collections.unmodifiableList(members); }
    public String cloudArtifact() { return cloudArtifact; }
    public String shadowArtifact() { return shadowArtifact; }

    public boolean needsMerge() { return members.size() > 1; }

    /** 합친 결과 이름은 날짜에서 결정된다: {@code clouds_patched_YYYYMMDD} */
    public String patchedName(String kind) {
        return kind + "_patched_" + BASIC_DATE.format(date);
    }

    public void merged(String clouds, String shadows) {
        this.cloudArtifact = clouds;
        this.shadowArtifact = shadows;
    }

    /** 등록 시각: 가장 이른 촬영 시각 */
    public LocalDateTime registerTime() {
        return members.stream()
                .map(m -> m.scene().acquiredAt())
                .min(Comparator.naturalOrder())
                .orElseThrow(() -> new IllegalStateException("empty date group " + date));
    }
}
