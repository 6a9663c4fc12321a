package net.sentiflow.core.error;

public class MalformedArtifactNameException extends IllegalArgumentException {
    private final String artifactName;

    public MalformedArtifactNameException(String artifactName, String reason) {
        super("Malformed artifact name <" + artifactName + ">: " + reason);
        this.artifactName = artifactName;
    }

    public String artifactName() { return artifactName; }
}
