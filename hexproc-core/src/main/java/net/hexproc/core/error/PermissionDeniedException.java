package net.hexproc.core.error;

public class PermissionDeniedException extends ProcessEngineException {
    private final long processId;
    private final long userId;

    public PermissionDeniedException(long processId, long userId) {
        super("process " + processId + " is not owned by user " + userId);
        this.processId = processId;
        this.userId = userId;
    }

    public long processId() { return processId; }

    public long userId() { return userId; }
}
