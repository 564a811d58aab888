package io.modelpipe.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelpipe.model.Project;
import io.modelpipe.model.ProjectEvent;
import io.modelpipe.pipeline.PipelineStore;
import io.modelpipe.util.Jsons;

import java.util.ArrayList;
import java.util.List;

/**
 * Cursor over one project's event log, producing server-sent-event frames. The first call to {@link #resume()}
 * replays every stored event after the cursor or, when there is none, a synthesized snapshot; later
 * {@link #poll()} calls only return what was appended since.
 */
public final class ProjectEventStream {
    public static final long NO_EVENT_ID = -1L;
    public static final String STREAM_ERROR = "stream_error";

    private final PipelineStore store;
    private final String projectId;
    private long cursor;
    private boolean sentInitialSnapshot;

    public ProjectEventStream(PipelineStore store, String projectId, long lastEventId) {
        this.store = store;
        this.projectId = projectId;
        this.cursor = normalizeLastEventId(lastEventId);
    }

    /**
     * Parses a {@code Last-Event-ID} style value: leading integer digits, optionally signed.
     *
     * @return the parsed id, or {@code null} when the value does not start with an integer
     */
    public static Long parseLastEventId(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.strip();
        int end = 0;
        if (end < value.length() && (value.charAt(end) == '-' || value.charAt(end) == '+')) {
            end++;
        }
        int digitsStart = end;
        while (end < value.length() && Character.isDigit(value.charAt(end))) {
            end++;
        }
        if (end == digitsStart) {
            return null;
        }
        try {
            return Long.parseLong(value.substring(0, end));
        } catch (NumberFormatException e) {
            // Out of range for a long.
            return null;
        }
    }

    public static long normalizeLastEventId(Long value) {
        if (value == null || value < NO_EVENT_ID) {
            return NO_EVENT_ID;
        }
        return value;
    }

    public static String format(String event, long id, JsonNode data) {
        return "id: " + id + "\nevent: " + event + "\ndata: " + Jsons.toCompactJson(data) + "\n\n";
    }

    public long cursor() {
        return cursor;
    }

    /**
     * @return the catch-up frames, or {@code null} when the project does not exist
     */
    public synchronized List<Frame> resume() {
        Project project = store.getProject(projectId);
        if (project == null) {
            return null;
        }
        return next(project);
    }

    /**
     * Frames appended since the last call. A vanished project yields a single {@value #STREAM_ERROR} frame.
     */
    public synchronized List<Frame> poll() {
        Project project = store.getProject(projectId);
        if (project == null) {
            cursor += 1;
            ObjectNode error = Jsons.mapper().createObjectNode();
            error.put("code", "stream_unavailable");
            error.put("projectId", projectId);
            return List.of(new Frame(cursor, STREAM_ERROR, error));
        }
        return next(project);
    }

    private List<Frame> next(Project current) {
        List<ProjectEvent> events = store.getProjectEventsSince(projectId, cursor);
        List<Frame> frames = new ArrayList<>();
        if (events.isEmpty()) {
            if (!sentInitialSnapshot) {
                long nextId = cursor + 1;
                frames.add(new Frame(nextId, ProjectEvent.PROJECT_SNAPSHOT,
                        snapshotPayload(current, Math.max(current.revision(), nextId))));
                cursor = nextId;
            }
        } else {
            for (ProjectEvent event : events) {
                frames.add(new Frame(event.seq(), event.event(), snapshotPayload(event.data(), event.data().revision())));
                cursor = event.seq();
            }
        }
        sentInitialSnapshot = true;
        return frames;
    }

    static ObjectNode snapshotPayload(Project project, long revision) {
        ObjectNode payload = (ObjectNode) Jsons.toTree(project);
        payload.put("revision", revision);
        return payload;
    }

    public record Frame(long id, String event, JsonNode data) {
        public String format() {
            return ProjectEventStream.format(event, id, data);
        }
    }
}
