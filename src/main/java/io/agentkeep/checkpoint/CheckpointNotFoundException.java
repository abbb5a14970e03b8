package io.agentkeep.checkpoint;

/**
 * Thrown when a checkpoint id does not exist in the project.
 */
public class CheckpointNotFoundException extends RuntimeException {

    private final String checkpointId;

    public CheckpointNotFoundException(String checkpointId) {
        super("Checkpoint not found: " + checkpointId);
        this.checkpointId = checkpointId;
    }

    public String getCheckpointId() {
        return checkpointId;
    }
}
