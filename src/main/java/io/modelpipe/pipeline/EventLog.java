package io.modelpipe.pipeline;

import io.modelpipe.model.Project;
import io.modelpipe.model.ProjectEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Per-project snapshot events numbered from one global sequence.
 */
public final class EventLog {
    private final PipelineState state;

    public EventLog(PipelineState state) {
        this.state = state;
    }

    public ProjectEvent append(Project project) {
        ProjectEvent event = ProjectEvent.snapshot(state.allocateSeq(), project);
        state.events.computeIfAbsent(project.projectId(), ignored -> new ArrayList<>()).add(event);
        return event;
    }

    public List<ProjectEvent> since(String projectId, long lastSeq) {
        List<ProjectEvent> events = state.events.get(projectId);
        if (events == null) {
            return List.of();
        }
        List<ProjectEvent> out = new ArrayList<>();
        for (ProjectEvent event : events) {
            if (event.seq() > lastSeq) {
                out.add(event);
            }
        }
        out.sort(Comparator.comparingLong(ProjectEvent::seq));
        return out;
    }

    public void remove(String projectId) {
        state.events.remove(projectId);
    }

    /**
     * Drops all history and synthesizes one snapshot per project, in project id order, with fresh sequence numbers.
     */
    public void rebuild() {
        state.events.clear();
        List<Project> projects = new ArrayList<>(state.projects.values());
        projects.sort(Comparator.comparing(Project::projectId));
        for (Project project : projects) {
            append(project);
        }
    }
}
