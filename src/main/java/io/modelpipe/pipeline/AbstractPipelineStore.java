package io.modelpipe.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelpipe.model.Job;
import io.modelpipe.model.JobSubmission;
import io.modelpipe.model.Project;
import io.modelpipe.model.ProjectEvent;
import io.modelpipe.model.ProjectFolder;
import io.modelpipe.model.ProjectLock;
import io.modelpipe.model.ProjectTree;
import io.modelpipe.observability.AuditLogger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Store behaviour shared by every backend. Subclasses only decide how a mutation or read gets exclusive,
 * consistent access to a {@link PipelineState}; audit rows are written after the mutation has been committed.
 */
public abstract class AbstractPipelineStore implements PipelineStore {
    private static final String API_ACTOR = "api";

    private final AuditLogger auditLogger;

    protected AbstractPipelineStore(AuditLogger auditLogger) {
        this.auditLogger = auditLogger;
    }

    protected abstract <T> T mutate(Function<PipelineOperations, T> mutation);

    protected abstract <T> T read(Function<PipelineOperations, T> reader);

    @Override
    public Job submitJob(JobSubmission submission) {
        Job job;
        try {
            job = mutate(ops -> ops.jobs().submit(submission));
        } catch (JobContractException e) {
            audit("job.submit", API_ACTOR, "project:" + submission.projectId(), "rejected",
                    submission.projectId(), null, Map.of("kind", String.valueOf(submission.kind()), "error", e.getMessage()));
            throw e;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("kind", job.kind().wireName());
        details.put("max_attempts", job.maxAttempts());
        details.put("lease_ms", job.leaseMs());
        audit("job.submit", API_ACTOR, "job:" + job.id(), "ok", job.projectId(), job.id(), details);
        return job;
    }

    @Override
    public Job claimNextJob(String workerId) {
        JobQueue.Claim claim = mutate(ops -> ops.jobs().claim(workerId));
        for (String recovered : claim.recoveredJobIds()) {
            audit("job.lease_expired", "system", "job:" + recovered, "requeued", null, recovered, Map.of());
        }
        Job job = claim.job();
        if (job != null) {
            audit("job.claim", workerId, "job:" + job.id(), "ok", job.projectId(), job.id(),
                    Map.of("attempt", job.attemptCount(), "lease_expires_at_ms", job.leaseExpiresAtMs()));
        }
        return job;
    }

    @Override
    public Job completeJob(String jobId, JsonNode result) {
        Job job = mutate(ops -> ops.jobs().complete(jobId, result));
        if (job != null) {
            audit("job.complete", actorOf(job), "job:" + job.id(), job.status().wireName(), job.projectId(), job.id(),
                    Map.of("attempt", job.attemptCount()));
        }
        return job;
    }

    @Override
    public Job failJob(String jobId, String error) {
        Job job = mutate(ops -> ops.jobs().fail(jobId, error));
        if (job != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("attempt", job.attemptCount());
            details.put("dead_letter", job.deadLetter());
            details.put("error", job.error() == null ? "" : job.error());
            if (job.nextRetryAtMs() != null) {
                details.put("next_retry_at_ms", job.nextRetryAtMs());
            }
            audit("job.fail", actorOf(job), "job:" + job.id(), job.status().wireName(), job.projectId(), job.id(), details);
        }
        return job;
    }

    @Override
    public List<Job> listProjectJobs(String projectId) {
        return read(ops -> ops.jobs().listProjectJobs(projectId));
    }

    @Override
    public Job getJob(String jobId) {
        return read(ops -> ops.jobs().get(jobId));
    }

    @Override
    public List<Project> listProjects(String query) {
        return readMaintained(ops -> ops.tree().listProjects(query));
    }

    @Override
    public Project getProject(String projectId) {
        return readMaintained(ops -> ops.tree().getProject(projectId));
    }

    @Override
    public ProjectTree getProjectTree(String query) {
        return readMaintained(ops -> ops.tree().getProjectTree(query));
    }

    @Override
    public ProjectFolder createFolder(String name, String parentFolderId, Integer index) {
        ProjectFolder folder = mutate(ops -> ops.tree().createFolder(name, parentFolderId, index));
        audit("folder.create", API_ACTOR, "folder:" + folder.folderId(), "ok", null, null,
                Map.of("name", folder.name()));
        return folder;
    }

    @Override
    public ProjectFolder renameFolder(String folderId, String name) {
        ProjectFolder folder = mutate(ops -> ops.tree().renameFolder(folderId, name));
        if (folder != null) {
            audit("folder.rename", API_ACTOR, "folder:" + folderId, "ok", null, null, Map.of("name", folder.name()));
        }
        return folder;
    }

    @Override
    public ProjectFolder moveFolder(String folderId, String parentFolderId, Integer index) {
        ProjectFolder folder = mutate(ops -> ops.tree().moveFolder(folderId, parentFolderId, index));
        if (folder != null) {
            audit("folder.move", API_ACTOR, "folder:" + folderId, "ok", null, null,
                    Map.of("parent_folder_id", String.valueOf(folder.parentFolderId())));
        }
        return folder;
    }

    @Override
    public boolean deleteFolder(String folderId) {
        List<String> removedProjects = mutate(ops -> ops.tree().deleteFolder(folderId));
        if (removedProjects == null) {
            return false;
        }
        audit("folder.delete", API_ACTOR, "folder:" + folderId, "ok", null, null,
                Map.of("deleted_projects", removedProjects));
        return true;
    }

    @Override
    public Project createProject(String name, String parentFolderId, Integer index) {
        Project project = mutate(ops -> ops.tree().createProject(name, parentFolderId, index));
        audit("project.create", API_ACTOR, "project:" + project.projectId(), "ok", project.projectId(), null,
                Map.of("name", project.name()));
        return project;
    }

    @Override
    public Project renameProject(String projectId, String name) {
        Project project = mutate(ops -> ops.tree().renameProject(projectId, name));
        if (project != null) {
            audit("project.rename", API_ACTOR, "project:" + projectId, "ok", projectId, null,
                    Map.of("name", project.name()));
        }
        return project;
    }

    @Override
    public Project moveProject(String projectId, String parentFolderId, Integer index) {
        Project project = mutate(ops -> ops.tree().moveProject(projectId, parentFolderId, index));
        if (project != null) {
            audit("project.move", API_ACTOR, "project:" + projectId, "ok", projectId, null,
                    Map.of("parent_folder_id", String.valueOf(project.parentFolderId())));
        }
        return project;
    }

    @Override
    public boolean deleteProject(String projectId) {
        boolean deleted = mutate(ops -> ops.tree().deleteProject(projectId));
        if (deleted) {
            audit("project.delete", API_ACTOR, "project:" + projectId, "ok", projectId, null, Map.of());
        }
        return deleted;
    }

    @Override
    public ProjectLock getProjectLock(String projectId) {
        return readMaintained(ops -> ops.locks().get(projectId));
    }

    @Override
    public ProjectLock acquireProjectLock(String projectId, String ownerAgentId, String ownerSessionId, Number ttlMs) {
        ProjectLock lock;
        try {
            lock = mutate(ops -> ops.locks().acquire(projectId, ownerAgentId, ownerSessionId, ttlMs));
        } catch (ProjectLockConflictException e) {
            audit("lock.acquire", ownerAgentId, "project:" + projectId, "conflict", projectId, null,
                    Map.of("held_by", e.ownerAgentId()));
            throw e;
        }
        audit("lock.acquire", lock.ownerAgentId(), "project:" + projectId, "ok", projectId, null,
                Map.of("expires_at_ms", lock.expiresAtMs()));
        return lock;
    }

    @Override
    public ProjectLock renewProjectLock(String projectId, String ownerAgentId, String ownerSessionId, Number ttlMs) {
        ProjectLock lock = mutate(ops -> ops.locks().renew(projectId, ownerAgentId, ownerSessionId, ttlMs));
        if (lock != null) {
            audit("lock.renew", lock.ownerAgentId(), "project:" + projectId, "ok", projectId, null,
                    Map.of("expires_at_ms", lock.expiresAtMs()));
        }
        return lock;
    }

    @Override
    public boolean releaseProjectLock(String projectId, String ownerAgentId, String ownerSessionId) {
        boolean released = mutate(ops -> ops.locks().release(projectId, ownerAgentId, ownerSessionId));
        if (released) {
            audit("lock.release", ownerAgentId, "project:" + projectId, "ok", projectId, null, Map.of());
        }
        return released;
    }

    @Override
    public int releaseProjectLocksByOwner(String ownerAgentId) {
        int released = mutate(ops -> ops.locks().releaseByOwner(ownerAgentId, null, false));
        if (released > 0) {
            audit("lock.release_owner", ownerAgentId, "agent:" + ownerAgentId, "ok", null, null,
                    Map.of("released", released));
        }
        return released;
    }

    @Override
    public int releaseProjectLocksByOwner(String ownerAgentId, String ownerSessionId) {
        int released = mutate(ops -> ops.locks().releaseByOwner(ownerAgentId, ownerSessionId, true));
        if (released > 0) {
            audit("lock.release_owner", ownerAgentId, "agent:" + ownerAgentId, "ok", null, null,
                    Map.of("released", released, "session", String.valueOf(ownerSessionId)));
        }
        return released;
    }

    @Override
    public List<ProjectEvent> getProjectEventsSince(String projectId, long lastSeq) {
        return read(ops -> ops.eventLog().since(projectId, lastSeq));
    }

    @Override
    public ObjectNode exportState() {
        return read(ops -> StateCodec.serialize(ops.state()));
    }

    @Override
    public void reset() {
        mutate(ops -> {
            ops.reset();
            return null;
        });
        audit("state.reset", API_ACTOR, "state", "ok", null, null, Map.of());
    }

    /**
     * Reads through the mutation path when expired locks are waiting to be released, so readers never
     * observe a lapsed lock.
     */
    protected <T> T readMaintained(Function<PipelineOperations, T> reader) {
        boolean hasExpired = read(ops -> ops.locks().hasExpired());
        if (!hasExpired) {
            return read(reader);
        }
        MaintainedRead<T> outcome = mutate(ops -> new MaintainedRead<>(ops.locks().releaseExpired(), reader.apply(ops)));
        for (String projectId : outcome.releasedLocks()) {
            audit("lock.expired", "system", "project:" + projectId, "released", projectId, null, Map.of());
        }
        return outcome.value();
    }

    protected void audit(
            String action,
            String actor,
            String resource,
            String result,
            String projectId,
            String jobId,
            Map<String, Object> details
    ) {
        if (auditLogger == null) {
            return;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(action, actor, resource, result, projectId, jobId, details));
    }

    private static String actorOf(Job job) {
        return job.workerId() == null ? API_ACTOR : job.workerId();
    }

    private record MaintainedRead<T>(List<String> releasedLocks, T value) {
    }
}
