package io.modelpipe.pipeline;

import io.modelpipe.model.Job;
import io.modelpipe.model.Project;
import io.modelpipe.model.ProjectEvent;
import io.modelpipe.model.ProjectFolder;
import io.modelpipe.model.ProjectLock;
import io.modelpipe.model.TreeChildRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state owned by one store instance. Only the repositories in this package mutate it, always under
 * the owning store's exclusion.
 */
public final class PipelineState {
    final Map<String, Project> projects = new LinkedHashMap<>();
    final Map<String, ProjectFolder> folders = new LinkedHashMap<>();
    final List<TreeChildRef> rootChildren = new ArrayList<>();
    final Map<String, Job> jobs = new LinkedHashMap<>();
    final PendingJobQueue pending = new PendingJobQueue();
    final Map<String, ProjectLock> locks = new LinkedHashMap<>();
    final Map<String, List<ProjectEvent>> events = new LinkedHashMap<>();
    long nextJobId = 1;
    long nextEntityNonce = 1;
    long nextSeq = 1;

    public long nextJobId() {
        return nextJobId;
    }

    public long nextEntityNonce() {
        return nextEntityNonce;
    }

    public long nextSeq() {
        return nextSeq;
    }

    public int projectCount() {
        return projects.size();
    }

    public int jobCount() {
        return jobs.size();
    }

    public List<String> pendingJobIds() {
        return pending.orderedIds();
    }

    String allocateJobId() {
        String id = "job-" + nextJobId;
        nextJobId += 1;
        return id;
    }

    long allocateSeq() {
        long seq = nextSeq;
        nextSeq += 1;
        return seq;
    }

    long allocateEntityNonce() {
        long nonce = nextEntityNonce;
        nextEntityNonce += 1;
        return nonce;
    }

    void clear() {
        projects.clear();
        folders.clear();
        rootChildren.clear();
        jobs.clear();
        pending.clear();
        locks.clear();
        events.clear();
        nextJobId = 1;
        nextEntityNonce = 1;
        nextSeq = 1;
    }
}
