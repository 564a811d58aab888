package io.modelpipe.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelpipe.config.PipelineConfig;
import io.modelpipe.model.Job;
import io.modelpipe.model.JobKind;
import io.modelpipe.model.JobStatus;
import io.modelpipe.model.JobSubmission;
import io.modelpipe.model.Project;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Job state machine: {@code queued -> running -> completed}, {@code running -> queued} on retry or lease expiry,
 * {@code running -> failed} once attempts are exhausted. Completed and failed are terminal.
 */
public final class JobQueue {
    private final PipelineState state;
    private final EventLog eventLog;
    private final ProjectTreeRepository tree;
    private final Clock clock;

    public JobQueue(PipelineState state, EventLog eventLog, ProjectTreeRepository tree, Clock clock) {
        this.state = state;
        this.eventLog = eventLog;
        this.tree = tree;
        this.clock = clock;
    }

    public Job submit(JobSubmission submission) {
        String projectId = submission.projectId() == null ? "" : submission.projectId().trim();
        if (projectId.isEmpty()) {
            throw new IllegalArgumentException("projectId is required");
        }
        JobKind kind = JobContracts.normalizeKind(submission.kind());
        ObjectNode payload = JobContracts.normalizePayload(kind, submission.payload());
        int maxAttempts = (int) Clamp.integer(submission.maxAttempts(), PipelineConfig.DEFAULT_MAX_ATTEMPTS,
                PipelineConfig.MIN_MAX_ATTEMPTS, PipelineConfig.MAX_MAX_ATTEMPTS);
        long leaseMs = Clamp.integer(submission.leaseMs(), PipelineConfig.DEFAULT_LEASE_MS,
                PipelineConfig.MIN_LEASE_MS, PipelineConfig.MAX_LEASE_MS);

        Project project = tree.ensureProject(projectId);
        long nowMs = clock.millis();
        Job job = Job.builder()
                .id(state.allocateJobId())
                .projectId(project.projectId())
                .kind(kind)
                .payload(payload)
                .status(JobStatus.QUEUED)
                .attemptCount(0)
                .maxAttempts(maxAttempts)
                .leaseMs(leaseMs)
                .createdAtMs(nowMs)
                .build();
        state.jobs.put(job.id(), job);
        state.pending.offer(job.id(), nowMs);
        updateProject(job, false);
        return job;
    }

    public Claim claim(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        long nowMs = clock.millis();
        List<String> recovered = recoverExpiredLeases(nowMs);
        while (true) {
            String nextId = state.pending.pollDue(nowMs);
            if (nextId == null) {
                return new Claim(null, recovered);
            }
            Job job = state.jobs.get(nextId);
            if (job == null || job.status() != JobStatus.QUEUED) {
                continue;
            }
            Long retryAt = job.nextRetryAtMs();
            if (retryAt != null && retryAt > nowMs) {
                state.pending.offer(job.id(), retryAt);
                continue;
            }
            Job claimed = job.toBuilder()
                    .status(JobStatus.RUNNING)
                    .workerId(workerId)
                    .startedAtMs(nowMs)
                    .attemptCount(job.attemptCount() + 1)
                    .leaseExpiresAtMs(nowMs + job.leaseMs())
                    .nextRetryAtMs(null)
                    .error(null)
                    .completedAtMs(null)
                    .build();
            state.jobs.put(claimed.id(), claimed);
            updateProject(claimed, false);
            return new Claim(claimed, recovered);
        }
    }

    /**
     * Marks the job completed. Returns {@code null} for an unknown id and the unchanged job when it is already
     * terminal.
     */
    public Job complete(String jobId, JsonNode result) {
        Job job = state.jobs.get(jobId);
        if (job == null) {
            return null;
        }
        if (job.status().terminal()) {
            return job;
        }
        ObjectNode normalized = JobContracts.normalizeResult(job.kind(), result);
        Job completed = job.toBuilder()
                .status(JobStatus.COMPLETED)
                .result(normalized)
                .completedAtMs(clock.millis())
                .leaseExpiresAtMs(null)
                .nextRetryAtMs(null)
                .deadLetter(false)
                .build();
        state.jobs.put(completed.id(), completed);
        state.pending.remove(completed.id());
        updateProject(completed, true);
        return completed;
    }

    /**
     * Records a failed attempt: re-queues with backoff while attempts remain, otherwise dead-letters the job.
     */
    public Job fail(String jobId, String error) {
        Job job = state.jobs.get(jobId);
        if (job == null) {
            return null;
        }
        if (job.status().terminal()) {
            return job;
        }
        long nowMs = clock.millis();
        Job.Builder next = job.toBuilder()
                .error(error == null ? "" : error)
                .leaseExpiresAtMs(null);
        Job failed;
        if (job.attemptCount() < job.maxAttempts()) {
            long retryAt = nowMs + backoffMs(job.attemptCount());
            failed = next.status(JobStatus.QUEUED)
                    .nextRetryAtMs(retryAt)
                    .completedAtMs(null)
                    .workerId(null)
                    .startedAtMs(null)
                    .build();
            state.pending.offer(failed.id(), retryAt);
        } else {
            failed = next.status(JobStatus.FAILED)
                    .deadLetter(true)
                    .completedAtMs(nowMs)
                    .nextRetryAtMs(null)
                    .build();
            state.pending.remove(failed.id());
        }
        state.jobs.put(failed.id(), failed);
        updateProject(failed, true);
        return failed;
    }

    public Job get(String jobId) {
        return state.jobs.get(jobId);
    }

    public List<Job> listProjectJobs(String projectId) {
        List<Job> out = new ArrayList<>();
        for (Job job : state.jobs.values()) {
            if (job.projectId().equals(projectId)) {
                out.add(job);
            }
        }
        out.sort(Comparator.comparingLong(Job::createdAtMs).thenComparingLong(job -> jobCounter(job.id())));
        return out;
    }

    /**
     * {@code min(5000, 250 * 2^(max(0, attemptCount - 1)))} milliseconds.
     */
    public static long backoffMs(int attemptCount) {
        int exponent = Math.max(0, attemptCount - 1);
        if (exponent >= 16) {
            return PipelineConfig.DEFAULT_MAX_BACKOFF_MS;
        }
        return Math.min(PipelineConfig.DEFAULT_MAX_BACKOFF_MS, PipelineConfig.DEFAULT_BASE_BACKOFF_MS << exponent);
    }

    static long jobCounter(String jobId) {
        if (jobId == null || !jobId.startsWith("job-")) {
            return 0;
        }
        String digits = jobId.substring(4);
        if (digits.isEmpty() || digits.length() > 18) {
            return 0;
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) {
                return 0;
            }
        }
        return Long.parseLong(digits);
    }

    private List<String> recoverExpiredLeases(long nowMs) {
        List<String> recovered = new ArrayList<>();
        for (Job job : new ArrayList<>(state.jobs.values())) {
            if (job.status() != JobStatus.RUNNING || job.leaseExpiresAtMs() == null) {
                continue;
            }
            long expiresAt = job.leaseExpiresAtMs();
            if (expiresAt > nowMs) {
                continue;
            }
            Job requeued = job.toBuilder()
                    .status(JobStatus.QUEUED)
                    .workerId(null)
                    .startedAtMs(null)
                    .leaseExpiresAtMs(null)
                    .build();
            state.jobs.put(requeued.id(), requeued);
            state.pending.offer(requeued.id(), expiresAt);
            recovered.add(requeued.id());
        }
        return recovered;
    }

    private void updateProject(Job job, boolean bumpRevision) {
        Project project = state.projects.get(job.projectId());
        if (project == null) {
            return;
        }
        Project next = project.withActiveJob(job.asActiveJob());
        if (bumpRevision) {
            next = next.withRevision(project.revision() + 1);
        }
        if (job.status() == JobStatus.COMPLETED && job.kind() == JobKind.GLTF_CONVERT) {
            JsonNode result = job.result();
            if (result != null && result.path("hierarchy").isArray()) {
                next = next.withHierarchy(StateCodec.readHierarchy(result.get("hierarchy")));
            }
            next = ProjectSnapshots.synchronize(next);
        }
        state.projects.put(next.projectId(), next);
        eventLog.append(next);
    }

    /**
     * Outcome of a claim attempt: the claimed job (or {@code null}) plus the ids whose expired lease was
     * recovered by the sweep that ran first.
     */
    public record Claim(Job job, List<String> recoveredJobIds) {
        public Claim {
            recoveredJobIds = List.copyOf(recoveredJobIds);
        }
    }
}
