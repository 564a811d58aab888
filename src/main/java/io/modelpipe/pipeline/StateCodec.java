package io.modelpipe.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelpipe.model.ActiveJob;
import io.modelpipe.model.AnimationSummary;
import io.modelpipe.model.HierarchyNode;
import io.modelpipe.model.Job;
import io.modelpipe.model.JobKind;
import io.modelpipe.model.JobStatus;
import io.modelpipe.model.Project;
import io.modelpipe.model.ProjectEvent;
import io.modelpipe.model.ProjectFolder;
import io.modelpipe.model.ProjectLock;
import io.modelpipe.model.TreeChildRef;
import io.modelpipe.util.Jsons;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Versioned JSON document for {@link PipelineState}. Decoding is lenient per entry and strict per document:
 * malformed entries are dropped and the forest repaired, while a wrong version or a missing section
 * rejects the whole document.
 */
public final class StateCodec {
    public static final int DOCUMENT_VERSION = 2;
    private static final List<String> REQUIRED_ARRAYS = List.of(
            "projects", "folders", "rootChildren", "jobs", "queuedJobIds", "projectEvents"
    );

    private StateCodec() {
    }

    public static ObjectNode serialize(PipelineState state) {
        ObjectMapper mapper = Jsons.mapper();
        ObjectNode root = mapper.createObjectNode();
        root.put("version", DOCUMENT_VERSION);
        root.put("nextJobId", state.nextJobId);
        root.put("nextEntityNonce", state.nextEntityNonce);
        root.put("nextSeq", state.nextSeq);
        ArrayNode projects = root.putArray("projects");
        for (Project project : state.projects.values()) {
            projects.add(mapper.valueToTree(project));
        }
        ArrayNode folders = root.putArray("folders");
        for (ProjectFolder folder : state.folders.values()) {
            folders.add(mapper.valueToTree(folder));
        }
        ArrayNode rootChildren = root.putArray("rootChildren");
        for (TreeChildRef ref : state.rootChildren) {
            rootChildren.add(mapper.valueToTree(ref));
        }
        ArrayNode jobs = root.putArray("jobs");
        for (Job job : state.jobs.values()) {
            jobs.add(mapper.valueToTree(job));
        }
        ArrayNode queued = root.putArray("queuedJobIds");
        for (String jobId : state.pending.orderedIds()) {
            queued.add(jobId);
        }
        ArrayNode locks = root.putArray("projectLocks");
        for (Map.Entry<String, ProjectLock> entry : state.locks.entrySet()) {
            ObjectNode item = locks.addObject();
            item.put("projectId", entry.getKey());
            item.set("lock", mapper.valueToTree(entry.getValue()));
        }
        ArrayNode events = root.putArray("projectEvents");
        for (Map.Entry<String, List<ProjectEvent>> entry : state.events.entrySet()) {
            ObjectNode bucket = events.addObject();
            bucket.put("projectId", entry.getKey());
            ArrayNode items = bucket.putArray("events");
            for (ProjectEvent event : entry.getValue()) {
                items.add(mapper.valueToTree(event));
            }
        }
        return root;
    }

    /**
     * @return the decoded state, or {@code null} when the document is not a version {@value #DOCUMENT_VERSION}
     * object carrying every required section
     */
    public static PipelineState deserialize(JsonNode value) {
        Decoded decoded = decode(value);
        return decoded == null ? null : decoded.state();
    }

    /**
     * Decodes a document the way a restarting process does: stored events are discarded and
     * {@link EventLog#rebuild()} synthesizes one snapshot per project.
     */
    public static Decoded decode(JsonNode value) {
        return decode(value, false);
    }

    /**
     * @param restoreEvents keep the stored event history instead of rebuilding it; used when a running store
     *                      refreshes its copy of a document another writer committed
     */
    public static Decoded decode(JsonNode value, boolean restoreEvents) {
        if (value == null || !value.isObject()) {
            return null;
        }
        JsonNode version = value.get("version");
        if (version == null || !version.isNumber() || version.asDouble() != DOCUMENT_VERSION) {
            return null;
        }
        for (String field : REQUIRED_ARRAYS) {
            if (!value.path(field).isArray()) {
                return null;
            }
        }

        PipelineState state = new PipelineState();
        int[] repairs = new int[1];

        for (JsonNode raw : value.get("folders")) {
            ProjectFolder folder = readFolder(raw);
            if (folder == null) {
                repairs[0]++;
                continue;
            }
            state.folders.put(folder.folderId(), folder);
        }
        for (JsonNode raw : value.get("projects")) {
            Project project = readProject(raw);
            if (project == null) {
                repairs[0]++;
                continue;
            }
            state.projects.put(project.projectId(), project);
        }
        repairs[0] += repairForest(state, value.get("rootChildren"));

        long maxJobCounter = 0;
        for (JsonNode raw : value.get("jobs")) {
            Job job = readJob(raw);
            if (job == null) {
                repairs[0]++;
                continue;
            }
            state.jobs.put(job.id(), job);
            maxJobCounter = Math.max(maxJobCounter, JobQueue.jobCounter(job.id()));
        }

        for (JsonNode raw : value.get("queuedJobIds")) {
            String jobId = raw.isTextual() ? raw.textValue() : null;
            Job job = jobId == null ? null : state.jobs.get(jobId);
            if (job == null || job.status() != JobStatus.QUEUED || state.pending.contains(jobId)) {
                repairs[0]++;
                continue;
            }
            state.pending.offer(jobId, dueAt(job));
        }
        for (Job job : state.jobs.values()) {
            if (job.status() == JobStatus.QUEUED && !state.pending.contains(job.id())) {
                state.pending.offer(job.id(), dueAt(job));
                repairs[0]++;
            }
        }

        for (JsonNode raw : value.path("projectLocks")) {
            JsonNode projectId = raw.get("projectId");
            ProjectLock lock = readLock(raw.get("lock"));
            if (projectId == null || !projectId.isTextual() || lock == null) {
                repairs[0]++;
                continue;
            }
            state.locks.put(projectId.textValue(), lock);
        }
        for (Project project : new ArrayList<>(state.projects.values())) {
            state.projects.put(project.projectId(), project.withProjectLock(state.locks.get(project.projectId())));
        }

        long maxSeq = 0;
        for (JsonNode bucket : value.get("projectEvents")) {
            for (JsonNode raw : bucket.path("events")) {
                ProjectEvent event = readEvent(raw);
                if (event != null) {
                    maxSeq = Math.max(maxSeq, event.seq());
                }
            }
        }

        state.nextJobId = Math.max(normalizeCounter(value.get("nextJobId"), 1), maxJobCounter + 1);
        state.nextEntityNonce = normalizeCounter(value.get("nextEntityNonce"), 1);
        state.nextSeq = Math.max(normalizeCounter(value.get("nextSeq"), 1), maxSeq + 1);
        if (restoreEvents) {
            repairs[0] += restoreEvents(state, value.get("projectEvents"));
        } else {
            new EventLog(state).rebuild();
        }
        return new Decoded(state, repairs[0]);
    }

    /**
     * Loads stored events of known projects. Duplicate sequence numbers and events of unknown projects are dropped.
     */
    private static int restoreEvents(PipelineState state, JsonNode buckets) {
        int repairs = 0;
        Set<Long> seenSeqs = new HashSet<>();
        for (JsonNode bucket : buckets) {
            String projectId = optionalText(bucket.get("projectId"));
            if (projectId == null || !state.projects.containsKey(projectId)) {
                repairs++;
                continue;
            }
            List<ProjectEvent> events = new ArrayList<>();
            for (JsonNode raw : bucket.path("events")) {
                ProjectEvent event = readEvent(raw);
                if (event == null || !projectId.equals(event.data().projectId()) || !seenSeqs.add(event.seq())) {
                    repairs++;
                    continue;
                }
                events.add(event);
            }
            if (!events.isEmpty()) {
                events.sort(Comparator.comparingLong(ProjectEvent::seq));
                state.events.put(projectId, events);
            }
        }
        return repairs;
    }

    /**
     * Rebuilds the single-owner forest: unknown and duplicate references are dropped, orphans are re-attached to
     * their recorded parent (else the root), cycles unreachable from the root are cut, and every node's
     * {@code parentFolderId} is set to the container that actually lists it.
     */
    private static int repairForest(PipelineState state, JsonNode rawRootChildren) {
        int repairs = 0;
        Set<String> seen = new HashSet<>();
        for (JsonNode raw : rawRootChildren) {
            TreeChildRef ref = readChildRef(raw);
            if (ref == null || !exists(state, ref) || !seen.add(key(ref))) {
                repairs++;
                continue;
            }
            state.rootChildren.add(ref);
        }
        for (ProjectFolder folder : new ArrayList<>(state.folders.values())) {
            List<TreeChildRef> kept = new ArrayList<>();
            for (TreeChildRef ref : folder.children()) {
                if (!exists(state, ref) || ref.matches(TreeChildRef.Kind.FOLDER, folder.folderId()) || !seen.add(key(ref))) {
                    repairs++;
                    continue;
                }
                kept.add(ref);
            }
            state.folders.put(folder.folderId(), folder.withChildren(kept));
        }

        for (ProjectFolder folder : new ArrayList<>(state.folders.values())) {
            TreeChildRef ref = TreeChildRef.folder(folder.folderId());
            if (seen.add(key(ref))) {
                attachOrphan(state, ref, folder.parentFolderId());
                repairs++;
            }
        }
        for (Project project : state.projects.values()) {
            TreeChildRef ref = TreeChildRef.project(project.projectId());
            if (seen.add(key(ref))) {
                attachOrphan(state, ref, project.parentFolderId());
                repairs++;
            }
        }

        Map<String, String> containerOf = new LinkedHashMap<>();
        while (true) {
            containerOf.clear();
            Set<String> reachable = new HashSet<>();
            Deque<String> pendingFolders = new ArrayDeque<>();
            for (TreeChildRef ref : state.rootChildren) {
                containerOf.put(key(ref), null);
                if (ref.kind() == TreeChildRef.Kind.FOLDER) {
                    reachable.add(ref.id());
                    pendingFolders.add(ref.id());
                }
            }
            while (!pendingFolders.isEmpty()) {
                String folderId = pendingFolders.poll();
                for (TreeChildRef ref : state.folders.get(folderId).children()) {
                    containerOf.put(key(ref), folderId);
                    if (ref.kind() == TreeChildRef.Kind.FOLDER && reachable.add(ref.id())) {
                        pendingFolders.add(ref.id());
                    }
                }
            }
            String cut = null;
            for (String folderId : state.folders.keySet()) {
                if (!reachable.contains(folderId)) {
                    cut = folderId;
                    break;
                }
            }
            if (cut == null) {
                break;
            }
            TreeChildRef ref = TreeChildRef.folder(cut);
            for (ProjectFolder folder : new ArrayList<>(state.folders.values())) {
                List<TreeChildRef> children = new ArrayList<>(folder.children());
                if (children.removeIf(child -> child.matches(ref.kind(), ref.id()))) {
                    state.folders.put(folder.folderId(), folder.withChildren(children));
                }
            }
            state.rootChildren.add(ref);
            repairs++;
        }

        for (ProjectFolder folder : new ArrayList<>(state.folders.values())) {
            String parent = containerOf.get(key(TreeChildRef.folder(folder.folderId())));
            if (!Objects.equals(parent, folder.parentFolderId())) {
                state.folders.put(folder.folderId(), folder.withParentFolderId(parent));
                repairs++;
            }
        }
        for (Project project : new ArrayList<>(state.projects.values())) {
            String parent = containerOf.get(key(TreeChildRef.project(project.projectId())));
            if (!Objects.equals(parent, project.parentFolderId())) {
                state.projects.put(project.projectId(), project.withParentFolderId(parent));
                repairs++;
            }
        }
        return repairs;
    }

    private static void attachOrphan(PipelineState state, TreeChildRef ref, String recordedParentId) {
        ProjectFolder parent = recordedParentId == null ? null : state.folders.get(recordedParentId);
        if (parent == null || ref.matches(TreeChildRef.Kind.FOLDER, recordedParentId)) {
            state.rootChildren.add(ref);
            return;
        }
        List<TreeChildRef> children = new ArrayList<>(parent.children());
        children.add(ref);
        state.folders.put(parent.folderId(), parent.withChildren(children));
    }

    private static boolean exists(PipelineState state, TreeChildRef ref) {
        return ref.kind() == TreeChildRef.Kind.FOLDER
                ? state.folders.containsKey(ref.id())
                : state.projects.containsKey(ref.id());
    }

    private static String key(TreeChildRef ref) {
        return ref.kind().wireName() + ":" + ref.id();
    }

    private static long dueAt(Job job) {
        return job.nextRetryAtMs() != null ? job.nextRetryAtMs() : job.createdAtMs();
    }

    static long normalizeCounter(JsonNode value, long fallback) {
        if (!JobContracts.isFiniteNumber(value)) {
            return fallback;
        }
        long truncated = (long) value.asDouble();
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            truncated = value.longValue();
        }
        return truncated < 1 ? fallback : truncated;
    }

    static TreeChildRef readChildRef(JsonNode value) {
        if (value == null || !value.isObject()) {
            return null;
        }
        TreeChildRef.Kind kind = TreeChildRef.Kind.fromWireName(value.path("kind").asText(null));
        JsonNode id = value.get("id");
        if (kind == null || id == null || !id.isTextual()) {
            return null;
        }
        return new TreeChildRef(kind, id.textValue());
    }

    static ProjectFolder readFolder(JsonNode value) {
        if (value == null || !value.isObject()) {
            return null;
        }
        JsonNode folderId = value.get("folderId");
        JsonNode name = value.get("name");
        if (folderId == null || !folderId.isTextual() || name == null || !name.isTextual()) {
            return null;
        }
        List<TreeChildRef> children = new ArrayList<>();
        for (JsonNode raw : value.path("children")) {
            TreeChildRef ref = readChildRef(raw);
            if (ref != null) {
                children.add(ref);
            }
        }
        return new ProjectFolder(folderId.textValue(), name.textValue(), optionalText(value.get("parentFolderId")), children);
    }

    static Project readProject(JsonNode value) {
        if (value == null || !value.isObject()) {
            return null;
        }
        JsonNode projectId = value.get("projectId");
        JsonNode name = value.get("name");
        if (projectId == null || !projectId.isTextual() || name == null || !name.isTextual()) {
            return null;
        }
        JsonNode revision = value.get("revision");
        JsonNode hasGeometry = value.get("hasGeometry");
        JsonNode stats = value.get("stats");
        if (!JobContracts.isFiniteNumber(revision) || hasGeometry == null || !hasGeometry.isBoolean()
                || stats == null || !stats.isObject()
                || !JobContracts.isFiniteNumber(stats.get("bones"))
                || !JobContracts.isFiniteNumber(stats.get("cubes"))) {
            return null;
        }
        List<AnimationSummary> animations = new ArrayList<>();
        for (JsonNode raw : value.path("animations")) {
            AnimationSummary animation = readAnimation(raw);
            if (animation != null) {
                animations.add(animation);
            }
        }
        ArrayNode textures = Jsons.mapper().createArrayNode();
        for (JsonNode raw : value.path("textures")) {
            if (isTextureAtlas(raw)) {
                textures.add(raw.deepCopy());
            }
        }
        ActiveJob activeJob = null;
        JsonNode rawActive = value.get("activeJob");
        if (rawActive != null && rawActive.isObject() && rawActive.path("id").isTextual()) {
            JobStatus status = JobStatus.fromWireName(rawActive.path("status").asText(null));
            if (status != null) {
                activeJob = new ActiveJob(rawActive.get("id").textValue(), status);
            }
        }
        Project project = new Project(
                projectId.textValue(),
                name.textValue(),
                optionalText(value.get("parentFolderId")),
                Math.max(0L, (long) revision.asDouble()),
                hasGeometry.booleanValue(),
                null,
                readHierarchy(value.get("hierarchy")),
                animations,
                textures,
                activeJob,
                readLock(value.get("projectLock")),
                readFocusAnchor(value.get("focusAnchor"))
        );
        return ProjectSnapshots.synchronize(project);
    }

    /**
     * Reads a hierarchy array, dropping malformed nodes together with their subtrees.
     */
    public static List<HierarchyNode> readHierarchy(JsonNode value) {
        List<HierarchyNode> out = new ArrayList<>();
        if (value == null || !value.isArray()) {
            return out;
        }
        for (JsonNode raw : value) {
            HierarchyNode node = readHierarchyNode(raw);
            if (node != null) {
                out.add(node);
            }
        }
        return out;
    }

    private static HierarchyNode readHierarchyNode(JsonNode value) {
        if (value == null || !value.isObject() || !value.path("id").isTextual() || !value.path("name").isTextual()) {
            return null;
        }
        HierarchyNode.Kind kind = HierarchyNode.Kind.fromWireName(value.path("kind").asText(null));
        if (kind == null) {
            return null;
        }
        return new HierarchyNode(value.get("id").textValue(), value.get("name").textValue(), kind,
                readHierarchy(value.get("children")));
    }

    private static AnimationSummary readAnimation(JsonNode value) {
        if (value == null || !value.isObject() || !value.path("id").isTextual() || !value.path("name").isTextual()) {
            return null;
        }
        JsonNode length = value.get("length");
        JsonNode loop = value.get("loop");
        if (!JobContracts.isFiniteNumber(length) || loop == null || !loop.isBoolean()) {
            return null;
        }
        return new AnimationSummary(value.get("id").textValue(), value.get("name").textValue(),
                length.asDouble(), loop.booleanValue());
    }

    private static boolean isTextureAtlas(JsonNode value) {
        return value != null && value.isObject()
                && value.path("textureId").isTextual()
                && value.path("name").isTextual()
                && value.path("imageDataUrl").isTextual()
                && JobContracts.isFiniteNumber(value.get("width"))
                && JobContracts.isFiniteNumber(value.get("height"))
                && JobContracts.isFiniteNumber(value.get("faceCount"));
    }

    private static List<Double> readFocusAnchor(JsonNode value) {
        if (value == null || !value.isArray() || value.size() != 3) {
            return null;
        }
        List<Double> out = new ArrayList<>(3);
        for (JsonNode raw : value) {
            if (!JobContracts.isFiniteNumber(raw)) {
                return null;
            }
            out.add(raw.asDouble());
        }
        return out;
    }

    static ProjectLock readLock(JsonNode value) {
        if (value == null || !value.isObject()) {
            return null;
        }
        if (!value.path("ownerAgentId").isTextual() || !value.path("token").isTextual()) {
            return null;
        }
        if (!JobContracts.isFiniteNumber(value.get("acquiredAtMs"))
                || !JobContracts.isFiniteNumber(value.get("heartbeatAtMs"))
                || !JobContracts.isFiniteNumber(value.get("expiresAtMs"))) {
            return null;
        }
        if (!ProjectLock.MODE_MCP.equals(value.path("mode").asText(null))) {
            return null;
        }
        return new ProjectLock(
                value.get("ownerAgentId").textValue(),
                optionalText(value.get("ownerSessionId")),
                value.get("token").textValue(),
                value.get("acquiredAtMs").asLong(),
                value.get("heartbeatAtMs").asLong(),
                value.get("expiresAtMs").asLong(),
                ProjectLock.MODE_MCP
        );
    }

    static Job readJob(JsonNode value) {
        if (value == null || !value.isObject()) {
            return null;
        }
        if (!value.path("id").isTextual() || !value.path("projectId").isTextual() || !value.path("kind").isTextual()) {
            return null;
        }
        JobKind kind = JobKind.fromWireName(value.get("kind").textValue());
        JobStatus status = value.path("status").isTextual() ? JobStatus.fromWireName(value.get("status").textValue()) : null;
        if (kind == null || status == null) {
            return null;
        }
        if (!JobContracts.isFiniteNumber(value.get("attemptCount"))
                || !JobContracts.isFiniteNumber(value.get("maxAttempts"))
                || !JobContracts.isFiniteNumber(value.get("leaseMs"))
                || !JobContracts.isFiniteNumber(value.get("createdAtMs"))) {
            return null;
        }
        ObjectNode payload;
        ObjectNode result;
        try {
            payload = JobContracts.normalizePayload(kind, value.get("payload"));
            result = JobContracts.normalizeResult(kind, value.get("result"));
        } catch (JobContractException e) {
            return null;
        }
        return Job.builder()
                .id(value.get("id").textValue())
                .projectId(value.get("projectId").textValue())
                .kind(kind)
                .payload(payload)
                .status(status)
                .attemptCount((int) value.get("attemptCount").asDouble())
                .maxAttempts((int) value.get("maxAttempts").asDouble())
                .leaseMs((long) value.get("leaseMs").asDouble())
                .createdAtMs(value.get("createdAtMs").asLong())
                .startedAtMs(optionalLong(value.get("startedAtMs")))
                .leaseExpiresAtMs(optionalLong(value.get("leaseExpiresAtMs")))
                .nextRetryAtMs(optionalLong(value.get("nextRetryAtMs")))
                .completedAtMs(optionalLong(value.get("completedAtMs")))
                .workerId(optionalText(value.get("workerId")))
                .result(result)
                .error(optionalText(value.get("error")))
                .deadLetter(value.path("deadLetter").asBoolean(false) && value.get("deadLetter").isBoolean())
                .build();
    }

    static ProjectEvent readEvent(JsonNode value) {
        if (value == null || !value.isObject() || !JobContracts.isFiniteNumber(value.get("seq"))) {
            return null;
        }
        if (!ProjectEvent.PROJECT_SNAPSHOT.equals(value.path("event").asText(null))) {
            return null;
        }
        Project data = readProject(value.get("data"));
        if (data == null) {
            return null;
        }
        return new ProjectEvent((long) value.get("seq").asDouble(), ProjectEvent.PROJECT_SNAPSHOT, data);
    }

    private static String optionalText(JsonNode value) {
        return value != null && value.isTextual() ? value.textValue() : null;
    }

    private static Long optionalLong(JsonNode value) {
        return JobContracts.isFiniteNumber(value) ? value.asLong() : null;
    }

    /**
     * Decoded state plus the number of entries that were dropped or re-attached while decoding.
     */
    public record Decoded(PipelineState state, int repairs) {
    }
}
