package net.sentiflow.core.model;

import java.util.EnumSet;
import java.util.Set;

/** 장면별 마스크 상태: PENDING_DECISION → {SKIPPED, COMPUTED} → {STANDALONE, MERGED} */
public enum MaskState {
    PENDING_DECISION, SKIPPED, COMPUTED, FAILED, STANDALONE, MERGED;

    public boolean canMoveTo(MaskState next) {
        return allowedNext().contains(next);
    }

    public Set<MaskState> allowedNext() {
        return switch (this) {
            case PENDING_DECISION -> EnumSet.of(SKIPPED, COMPUTED);
            case COMPUTED -> EnumSet.of(STANDALONE, FAILED);
            case SKIPPED -> EnumSet.of(STANDALONE);
            case STANDALONE -> EnumSet.of(MERGED);
            case FAILED, MERGED -> EnumSet.noneOf(MaskState.class);
        };
    }

    /** 등록 대상이 될 수 있는 최종 상태 */
    public boolean terminal() {
        return this == STANDALONE || this == MERGED || this == FAILED;
    }
}
