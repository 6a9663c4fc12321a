package net.sentiflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 장면 하나의 마스크 처리 상태.
 * MaskMergeEngine 이 단일 스레드에서만 변경한다.
 */
public final class SceneMask {
    private final Scene scene;
    private final Map<String, String> bands;
    private final SceneMetadata metadata;
    private MaskState state = MaskState.PENDING_DECISION;
    private String cloudArtifact;
    private String shadowArtifact;
    private String failure;

    public SceneMask(Scene scene, Map<String, String> bands, SceneMetadata metadata,
                     String cloudArtifact, String shadowArtifact) {
        this.scene = scene;
        this.bands = Collections.unmodifiableMap(new LinkedHashMap<>(bands));
        this.metadata = metadata;
        this.cloudArtifact = cloudArtifact;
        this.shadowArtifact = shadowArtifact;
    }

    public Scene scene() { return scene; }
    public Map<String, String> bands() { return bands; }
    public SceneMetadata metadata() { return metadata; }
    public MaskState state() { return state; }
    public String cloudArtifact() { return cloudArtifact; }
    public String shadowArtifact() { return shadowArtifact; }
    public String failure() { return failure; }

    public void skip() { moveTo(MaskState.SKIPPED); }

    public void compute() { moveTo(MaskState.COMPUTED); }

    public void standalone() { moveTo(MaskState.STANDALONE); }

    public void fail(String reason) {
        moveTo(MaskState.FAILED);
        this.failure = reason;
    }

    /** 같은 날짜 장면들과 합쳐진 결과를 가리키도록 포인터를 바꾼다. */
    public void mergedInto(String mergedClouds, String mergedShadows) {
        moveTo(MaskState.MERGED);
        this.cloudArtifact = mergedClouds;
        if (shadowArtifact != null) this.shadowArtifact = mergedShadows;
    }

    private void moveTo(MaskState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Scene " + scene.id() + ": illegal mask transition " + state + " -> " + next);
        }
        state = next;
    }

    @Override public String toString() {
        return "SceneMask{" +
                "scene=" + scene.id() +
                ", state=" + state +
                ", clouds='" + cloudArtifact + '\'' +
                ", shadows='" + shadowArtifact + '\'' +
                '}';
    }
}
