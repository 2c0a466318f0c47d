package org.caureq.fabricops.service.error;

public class CommitNotFoundException extends FabricOpsException {
    private final String commitId;

    public CommitNotFoundException(Stage stage, String commitId) {
        super(stage, null, "commit not found: " + commitId, null);
        this.commitId = commitId;
    }

    public String commitId() { return commitId; }
}
