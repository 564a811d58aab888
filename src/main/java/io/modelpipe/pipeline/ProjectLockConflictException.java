package io.modelpipe.pipeline;

import io.modelpipe.model.ProjectLock;

public final class ProjectLockConflictException extends RuntimeException {
    private final String projectId;
    private final String ownerAgentId;
    private final String ownerSessionId;
    private final long expiresAtMs;

    public ProjectLockConflictException(String projectId, ProjectLock lock) {
        super("Project lock conflict for " + projectId + ". Locked by " + lock.ownerAgentId() + ".");
        this.projectId = projectId;
        this.ownerAgentId = lock.ownerAgentId();
        this.ownerSessionId = lock.ownerSessionId();
        this.expiresAtMs = lock.expiresAtMs();
    }

    public String projectId() {
        return projectId;
    }

    public String ownerAgentId() {
        return ownerAgentId;
    }

    public String ownerSessionId() {
        return ownerSessionId;
    }

    public long expiresAtMs() {
        return expiresAtMs;
    }
}
