package io.modelpipe.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelpipe.MutableClock;
import io.modelpipe.model.Job;
import io.modelpipe.model.JobStatus;
import io.modelpipe.model.JobSubmission;
import io.modelpipe.model.Project;
import io.modelpipe.model.ProjectEvent;
import io.modelpipe.model.ProjectFolder;
import io.modelpipe.model.TreeChildRef;
import io.modelpipe.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class StateCodecTest {

    @Test
    void roundTripNeedsNoRepairs() {
        MutableClock clock = new MutableClock(10_000);
        PipelineOperations ops = new PipelineOperations(new PipelineState(), clock);
        ProjectFolder folder = ops.tree().createFolder("Folder", null, null);
        Project project = ops.tree().createProject("Robot", folder.folderId(), null);
        Job first = ops.jobs().submit(JobSubmission.of(project.projectId(), "gltf.convert", null));
        ops.jobs().submit(JobSubmission.of("p2", "texture.preflight", Jsons.parse("{\"maxDimension\":256}")));
        ops.jobs().claim("worker-a");
        ops.jobs().fail(first.id(), "boom");
        ops.locks().acquire(project.projectId(), "agent", "session", null);

        ObjectNode document = StateCodec.serialize(ops.state());
        Assertions.assertEquals(StateCodec.DOCUMENT_VERSION, document.path("version").asInt());

        StateCodec.Decoded decoded = StateCodec.decode(document);
        Assertions.assertNotNull(decoded);
        Assertions.assertEquals(0, decoded.repairs());
        PipelineState state = decoded.state();
        Assertions.assertEquals(ops.state().nextJobId(), state.nextJobId());
        Assertions.assertEquals(ops.state().nextEntityNonce(), state.nextEntityNonce());
        Assertions.assertEquals(ops.state().pendingJobIds(), state.pendingJobIds());
        Assertions.assertEquals(ops.state().projects.get(project.projectId()), state.projects.get(project.projectId()));
        Assertions.assertEquals(ops.state().folders, state.folders);
        Assertions.assertEquals(ops.state().rootChildren, state.rootChildren);
        Assertions.assertEquals(ops.state().locks, state.locks);

        Job reloaded = state.jobs.get(first.id());
        Assertions.assertEquals(JobStatus.QUEUED, reloaded.status());
        Assertions.assertEquals("boom", reloaded.error());
        Assertions.assertEquals(clock.millis() + 250L, reloaded.nextRetryAtMs());
        Assertions.assertEquals(256, state.jobs.get("job-2").payload().path("maxDimension").asInt());
    }

    @Test
    void reloadSynthesizesOneSnapshotPerProjectAfterStoredSequence() {
        PipelineOperations ops = new PipelineOperations(new PipelineState(), new MutableClock(0));
        ops.jobs().submit(JobSubmission.of("b", "gltf.convert", null));
        ops.jobs().submit(JobSubmission.of("a", "gltf.convert", null));
        long storedNextSeq = ops.state().nextSeq();

        PipelineState state = StateCodec.deserialize(StateCodec.serialize(ops.state()));
        EventLog log = new EventLog(state);
        List<ProjectEvent> a = log.since("a", -1);
        List<ProjectEvent> b = log.since("b", -1);
        Assertions.assertEquals(1, a.size());
        Assertions.assertEquals(1, b.size());
        Assertions.assertEquals(storedNextSeq, a.get(0).seq());
        Assertions.assertEquals(storedNextSeq + 1, b.get(0).seq());
        Assertions.assertEquals(storedNextSeq + 2, state.nextSeq());
    }

    @Test
    void refreshKeepsStoredEventsAndDropsOrphanedOnes() {
        PipelineOperations ops = new PipelineOperations(new PipelineState(), new MutableClock(0));
        ops.jobs().submit(JobSubmission.of("a", "gltf.convert", null));
        ops.jobs().claim("worker-a");
        ObjectNode document = StateCodec.serialize(ops.state());

        StateCodec.Decoded refreshed = StateCodec.decode(document, true);
        Assertions.assertNotNull(refreshed);
        Assertions.assertEquals(0, refreshed.repairs());
        List<ProjectEvent> events = new EventLog(refreshed.state()).since("a", -1);
        Assertions.assertEquals(List.of(1L, 2L, 3L), events.stream().map(ProjectEvent::seq).toList());
        Assertions.assertEquals(4L, refreshed.state().nextSeq());
        JsonNode reserialized = StateCodec.serialize(refreshed.state());
        Assertions.assertEquals(document.get("projectEvents"), reserialized.get("projectEvents"));

        ObjectNode withOrphan = document.deepCopy();
        ((ArrayNode) withOrphan.get("projectEvents")).addObject().put("projectId", "ghost").putArray("events");
        StateCodec.Decoded repaired = StateCodec.decode(withOrphan, true);
        Assertions.assertEquals(1, repaired.repairs());
        Assertions.assertTrue(new EventLog(repaired.state()).since("ghost", -1).isEmpty());
        Assertions.assertEquals(3, new EventLog(repaired.state()).since("a", -1).size());
    }

    @Test
    void unsupportedDocumentsAreRejectedWholesale() {
        Assertions.assertNull(StateCodec.decode(null));
        Assertions.assertNull(StateCodec.decode(Jsons.parse("[]")));
        Assertions.assertNull(StateCodec.decode(Jsons.parse(emptyDocument(1))));
        Assertions.assertNull(StateCodec.decode(Jsons.parse(emptyDocument(3))));

        ObjectNode missingSection = (ObjectNode) Jsons.parse(emptyDocument(2));
        missingSection.remove("queuedJobIds");
        Assertions.assertNull(StateCodec.decode(missingSection));

        StateCodec.Decoded empty = StateCodec.decode(Jsons.parse(emptyDocument(2)));
        Assertions.assertNotNull(empty);
        Assertions.assertEquals(0, empty.state().projectCount());
        Assertions.assertEquals(1L, empty.state().nextJobId());
    }

    @Test
    void countersAreRaisedAboveStoredIds() {
        PipelineOperations ops = new PipelineOperations(new PipelineState(), new MutableClock(0));
        for (int i = 0; i < 7; i++) {
            ops.jobs().submit(JobSubmission.of("p1", "gltf.convert", null));
        }
        ObjectNode document = StateCodec.serialize(ops.state());
        document.put("nextJobId", 2);
        document.put("nextSeq", -4);

        PipelineState state = StateCodec.deserialize(document);
        Assertions.assertEquals(8L, state.nextJobId());
        Assertions.assertTrue(state.nextSeq() > ops.state().nextSeq() - 1);
        Assertions.assertEquals("job-8", state.allocateJobId());
    }

    @Test
    void queueIndexIsRebuiltFromJobStatuses() {
        MutableClock clock = new MutableClock(0);
        PipelineOperations ops = new PipelineOperations(new PipelineState(), clock);
        ops.jobs().submit(JobSubmission.of("p1", "gltf.convert", null));
        ops.jobs().submit(JobSubmission.of("p1", "gltf.convert", null));
        ops.jobs().claim("worker-a");

        ObjectNode document = StateCodec.serialize(ops.state());
        document.putArray("queuedJobIds").add("job-1").add("job-404").add(7);

        StateCodec.Decoded decoded = StateCodec.decode(document);
        Assertions.assertEquals(List.of("job-2"), decoded.state().pendingJobIds());
        Assertions.assertEquals(4, decoded.repairs());
    }

    @Test
    void malformedEntriesAreDroppedAndForestIsRepaired() {
        String document = """
                {
                  "version": 2,
                  "nextJobId": 1,
                  "nextEntityNonce": 9,
                  "nextSeq": 1,
                  "projects": [
                    %s,
                    %s,
                    {"projectId": "broken"}
                  ],
                  "folders": [
                    {"folderId": "fA", "name": "A", "parentFolderId": "fB",
                     "children": [{"kind": "project", "id": "p1"}, {"kind": "folder", "id": "fB"}]},
                    {"folderId": "fB", "name": "B", "parentFolderId": "fA",
                     "children": [{"kind": "folder", "id": "fA"}]}
                  ],
                  "rootChildren": [
                    {"kind": "project", "id": "p1"},
                    {"kind": "project", "id": "p1"},
                    {"kind": "project", "id": "ghost"}
                  ],
                  "jobs": [],
                  "queuedJobIds": [],
                  "projectEvents": []
                }
                """.formatted(project("p1", "fA"), project("p2", "fA"));

        StateCodec.Decoded decoded = StateCodec.decode(Jsons.parse(document));
        Assertions.assertNotNull(decoded);
        PipelineState state = decoded.state();
        Assertions.assertTrue(decoded.repairs() > 0);
        Assertions.assertEquals(2, state.projectCount());
        Assertions.assertNull(state.projects.get("broken"));

        Assertions.assertEquals(List.of(TreeChildRef.project("p1"), TreeChildRef.folder("fA")), state.rootChildren);
        Assertions.assertEquals(List.of(TreeChildRef.folder("fB"), TreeChildRef.project("p2")),
                state.folders.get("fA").children());
        Assertions.assertTrue(state.folders.get("fB").children().isEmpty());
        Assertions.assertNull(state.folders.get("fA").parentFolderId());
        Assertions.assertEquals("fA", state.folders.get("fB").parentFolderId());
        Assertions.assertNull(state.projects.get("p1").parentFolderId());
        Assertions.assertEquals("fA", state.projects.get("p2").parentFolderId());
        Assertions.assertEquals(9L, state.nextEntityNonce());
    }

    @Test
    void readerHelpersRejectMalformedValues() {
        Assertions.assertNull(StateCodec.readChildRef(Jsons.parse("{\"kind\":\"drive\",\"id\":\"x\"}")));
        Assertions.assertNull(StateCodec.readFolder(Jsons.parse("{\"folderId\":1,\"name\":\"x\"}")));
        Assertions.assertNull(StateCodec.readProject(Jsons.parse("{\"projectId\":\"p\",\"name\":\"p\",\"revision\":\"1\"}")));
        Assertions.assertEquals(1L, StateCodec.normalizeCounter(Jsons.parse("0"), 1));
        Assertions.assertEquals(5L, StateCodec.normalizeCounter(Jsons.parse("5.9"), 1));
        Assertions.assertEquals(1L, StateCodec.normalizeCounter(null, 1));

        JsonNode hierarchy = Jsons.parse("""
                [{"id": "a", "name": "a", "kind": "bone", "children": [
                  {"id": "b", "name": "b", "kind": "plane", "children": []},
                  {"id": "c", "name": "c", "kind": "cube", "children": []}
                ]}]
                """);
        Assertions.assertEquals(1, StateCodec.readHierarchy(hierarchy).get(0).children().size());
        Assertions.assertEquals(1, ProjectSnapshots.deriveStats(StateCodec.readHierarchy(hierarchy)).cubes());
    }

    private static String project(String id, String parent) {
        return """
                {"projectId": "%s", "name": "%s", "parentFolderId": "%s", "revision": 3, "hasGeometry": false,
                 "stats": {"bones": 0, "cubes": 0}, "hierarchy": [], "animations": [], "textures": []}
                """.formatted(id, id, parent);
    }

    private static String emptyDocument(int version) {
        return """
                {"version": %d, "nextJobId": 1, "nextEntityNonce": 1, "nextSeq": 1, "projects": [], "folders": [],
                 "rootChildren": [], "jobs": [], "queuedJobIds": [], "projectEvents": []}
                """.formatted(version);
    }
}
