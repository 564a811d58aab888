package io.modelpipe.stream;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelpipe.MutableClock;
import io.modelpipe.model.Job;
import io.modelpipe.model.JobSubmission;
import io.modelpipe.model.ProjectEvent;
import io.modelpipe.pipeline.InMemoryPipelineStore;
import io.modelpipe.pipeline.PipelineStore;
import io.modelpipe.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ProjectEventStreamTest {

    @Test
    void lastEventIdParsingAndNormalization() {
        Assertions.assertEquals(12L, ProjectEventStream.parseLastEventId("12"));
        Assertions.assertEquals(12L, ProjectEventStream.parseLastEventId(" 12abc"));
        Assertions.assertEquals(-5L, ProjectEventStream.parseLastEventId("-5"));
        Assertions.assertNull(ProjectEventStream.parseLastEventId("abc"));
        Assertions.assertNull(ProjectEventStream.parseLastEventId("-"));
        Assertions.assertNull(ProjectEventStream.parseLastEventId(null));
        Assertions.assertNull(ProjectEventStream.parseLastEventId("99999999999999999999999"));

        Assertions.assertEquals(-1L, ProjectEventStream.normalizeLastEventId(null));
        Assertions.assertEquals(-1L, ProjectEventStream.normalizeLastEventId(-5L));
        Assertions.assertEquals(-1L, ProjectEventStream.normalizeLastEventId(-1L));
        Assertions.assertEquals(0L, ProjectEventStream.normalizeLastEventId(0L));
        Assertions.assertEquals(7L, ProjectEventStream.normalizeLastEventId(7L));
    }

    @Test
    void frameFormatting() {
        ObjectNode data = Jsons.mapper().createObjectNode();
        data.put("projectId", "p1");
        Assertions.assertEquals("id: 3\nevent: project_snapshot\ndata: {\"projectId\":\"p1\"}\n\n",
                ProjectEventStream.format("project_snapshot", 3, data));
    }

    @Test
    void resumeReplaysStoredEventsThenOnlyNewOnes() {
        PipelineStore store = new InMemoryPipelineStore(new MutableClock(0), null);
        Job job = store.submitJob(JobSubmission.of("p1", "gltf.convert", null));
        List<ProjectEvent> stored = store.getProjectEventsSince("p1", -1);

        ProjectEventStream stream = new ProjectEventStream(store, "p1", ProjectEventStream.NO_EVENT_ID);
        List<ProjectEventStream.Frame> frames = stream.resume();
        Assertions.assertEquals(stored.size(), frames.size());
        Assertions.assertEquals(stored.get(stored.size() - 1).seq(), stream.cursor());
        Assertions.assertEquals("p1", frames.get(0).data().path("projectId").asText());
        Assertions.assertTrue(stream.poll().isEmpty());

        store.claimNextJob("worker-a");
        store.completeJob(job.id(), null);
        List<ProjectEventStream.Frame> next = stream.poll();
        Assertions.assertEquals(2, next.size());
        Assertions.assertEquals(2L, next.get(1).data().path("revision").asLong());
        Assertions.assertTrue(next.get(1).format().startsWith("id: " + next.get(1).id() + "\nevent: project_snapshot\n"));
    }

    @Test
    void caughtUpCursorGetsSynthesizedSnapshot() {
        PipelineStore store = new InMemoryPipelineStore(new MutableClock(0), null);
        store.submitJob(JobSubmission.of("p1", "gltf.convert", null));

        ProjectEventStream stream = new ProjectEventStream(store, "p1", 100);
        List<ProjectEventStream.Frame> frames = stream.resume();
        Assertions.assertEquals(1, frames.size());
        ProjectEventStream.Frame frame = frames.get(0);
        Assertions.assertEquals(101L, frame.id());
        Assertions.assertEquals(ProjectEvent.PROJECT_SNAPSHOT, frame.event());
        Assertions.assertEquals(101L, frame.data().path("revision").asLong());
        Assertions.assertEquals(101L, stream.cursor());
        Assertions.assertTrue(stream.poll().isEmpty());
    }

    @Test
    void missingProjectIsReportedOnResumeAndPoll() {
        PipelineStore store = new InMemoryPipelineStore(new MutableClock(0), null);
        Assertions.assertNull(new ProjectEventStream(store, "ghost", -1).resume());

        store.submitJob(JobSubmission.of("p1", "gltf.convert", null));
        ProjectEventStream stream = new ProjectEventStream(store, "p1", -1);
        stream.resume();
        long cursor = stream.cursor();
        store.deleteProject("p1");

        List<ProjectEventStream.Frame> frames = stream.poll();
        Assertions.assertEquals(1, frames.size());
        Assertions.assertEquals(ProjectEventStream.STREAM_ERROR, frames.get(0).event());
        Assertions.assertEquals(cursor + 1, frames.get(0).id());
        Assertions.assertEquals("stream_unavailable", frames.get(0).data().path("code").asText());
    }
}
