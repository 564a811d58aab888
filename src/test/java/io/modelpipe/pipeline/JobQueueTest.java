package io.modelpipe.pipeline;

import io.modelpipe.MutableClock;
import io.modelpipe.model.Job;
import io.modelpipe.model.JobStatus;
import io.modelpipe.model.JobSubmission;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class JobQueueTest {

    @Test
    void backoffDoublesFromBaseAndCaps() {
        Assertions.assertEquals(250L, JobQueue.backoffMs(0));
        Assertions.assertEquals(250L, JobQueue.backoffMs(1));
        Assertions.assertEquals(500L, JobQueue.backoffMs(2));
        Assertions.assertEquals(1_000L, JobQueue.backoffMs(3));
        Assertions.assertEquals(4_000L, JobQueue.backoffMs(5));
        Assertions.assertEquals(5_000L, JobQueue.backoffMs(6));
        Assertions.assertEquals(5_000L, JobQueue.backoffMs(1_000));
    }

    @Test
    void jobCounterParsesNumericSuffix() {
        Assertions.assertEquals(12L, JobQueue.jobCounter("job-12"));
        Assertions.assertEquals(0L, JobQueue.jobCounter("job-"));
        Assertions.assertEquals(0L, JobQueue.jobCounter("job-1a"));
        Assertions.assertEquals(0L, JobQueue.jobCounter("task-3"));
        Assertions.assertEquals(0L, JobQueue.jobCounter(null));
    }

    @Test
    void claimRejectsBlankWorkerAndSubmitRejectsBlankProject() {
        PipelineOperations ops = new PipelineOperations(new PipelineState(), new MutableClock(0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ops.jobs().claim(" "));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> ops.jobs().submit(JobSubmission.of("  ", "gltf.convert", null)));
    }

    @Test
    void claimReportsRecoveredLeasesAndRequeuesAtExpiry() {
        MutableClock clock = new MutableClock(1_000);
        PipelineOperations ops = new PipelineOperations(new PipelineState(), clock);
        Job job = ops.jobs().submit(new JobSubmission("p1", "gltf.convert", null, null, 5_000));
        ops.jobs().claim("worker-a");

        clock.advance(6_000);
        JobQueue.Claim claim = ops.jobs().claim("worker-b");
        Assertions.assertEquals(List.of(job.id()), claim.recoveredJobIds());
        Assertions.assertEquals("worker-b", claim.job().workerId());
        Assertions.assertEquals(2, claim.job().attemptCount());
    }

    @Test
    void staleQueueEntriesAreSkipped() {
        MutableClock clock = new MutableClock(1_000);
        PipelineState state = new PipelineState();
        PipelineOperations ops = new PipelineOperations(state, clock);
        Job job = ops.jobs().submit(JobSubmission.of("p1", "gltf.convert", null));
        ops.jobs().claim("worker-a");
        ops.jobs().complete(job.id(), null);

        state.pending.offer(job.id(), 0);
        state.pending.offer("job-404", 0);
        Assertions.assertNull(ops.jobs().claim("worker-b").job());
        Assertions.assertEquals(JobStatus.COMPLETED, ops.jobs().get(job.id()).status());
        Assertions.assertEquals(0, state.pending.size());
    }
}
