package net.sentiflow.core.error;

import java.util.Set;

public class IncompleteSceneException extends PreconditionException {
    private final String sceneId;
    private final Set<String> missing;

    public IncompleteSceneException(String sceneId, Set<String> missing) {
        super("Not all needed bands are given for scene <" + sceneId + ">, missing " + missing);
        this.sceneId = sceneId;
        this.missing = Set.copyOf(missing);
    }

    public String sceneId() { return sceneId; }
    public Set<String> missing() { return missing; }
}
