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

import java.util.List;

/**
 * Job queue and project revision/event log. Unknown ids yield {@code null} or {@code false}; contract
 * violations throw {@link JobContractException} before anything changes.
 */
public interface PipelineStore {

    Job submitJob(JobSubmission submission);

    /**
     * Sweeps expired leases, then claims the first due queued job for {@code workerId}.
     *
     * @return the claimed job, or {@code null} when nothing is eligible
     */
    Job claimNextJob(String workerId);

    Job completeJob(String jobId, JsonNode result);

    Job failJob(String jobId, String error);

    List<Job> listProjectJobs(String projectId);

    Job getJob(String jobId);

    List<Project> listProjects(String query);

    Project getProject(String projectId);

    ProjectTree getProjectTree(String query);

    ProjectFolder createFolder(String name, String parentFolderId, Integer index);

    ProjectFolder renameFolder(String folderId, String name);

    ProjectFolder moveFolder(String folderId, String parentFolderId, Integer index);

    boolean deleteFolder(String folderId);

    Project createProject(String name, String parentFolderId, Integer index);

    Project renameProject(String projectId, String name);

    Project moveProject(String projectId, String parentFolderId, Integer index);

    boolean deleteProject(String projectId);

    ProjectLock getProjectLock(String projectId);

    ProjectLock acquireProjectLock(String projectId, String ownerAgentId, String ownerSessionId, Number ttlMs);

    ProjectLock renewProjectLock(String projectId, String ownerAgentId, String ownerSessionId, Number ttlMs);

    boolean releaseProjectLock(String projectId, String ownerAgentId, String ownerSessionId);

    /**
     * Releases every lock held by the agent regardless of session.
     */
    int releaseProjectLocksByOwner(String ownerAgentId);

    int releaseProjectLocksByOwner(String ownerAgentId, String ownerSessionId);

    List<ProjectEvent> getProjectEventsSince(String projectId, long lastSeq);

    ObjectNode exportState();

    void reset();
}
