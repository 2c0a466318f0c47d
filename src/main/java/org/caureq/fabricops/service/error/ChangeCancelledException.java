package org.caureq.fabricops.service.error;

/**
 * Caller gave up waiting. Before commit nothing happened; after commit the
 * apply keeps running and its outcome still lands in the apply log.
 */
public class ChangeCancelledException extends FabricOpsException {
    private final String commitId;

    public ChangeCancelledException(Stage stage, String device, String commitId) {
        super(stage, device, commitId == null
                ? "change cancelled before commit, nothing was written"
                : "change cancelled while applying commit " + commitId + ", outcome will still be recorded", null);
        this.commitId = commitId;
    }

    public String commitId() { return commitId; }
}
