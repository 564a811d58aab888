package io.modelpipe.pipeline;

import io.modelpipe.model.HierarchyNode;
import io.modelpipe.model.Project;
import io.modelpipe.model.ProjectStats;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the derived {@code stats} and {@code hasGeometry} fields of a project consistent with its hierarchy.
 */
public final class ProjectSnapshots {
    private ProjectSnapshots() {
    }

    public static Project synchronize(Project project) {
        return project.withStats(deriveStats(project.hierarchy()));
    }

    public static ProjectStats deriveStats(List<HierarchyNode> hierarchy) {
        int bones = 0;
        int cubes = 0;
        Deque<HierarchyNode> stack = new ArrayDeque<>(hierarchy);
        while (!stack.isEmpty()) {
            HierarchyNode node = stack.pop();
            if (node.kind() == HierarchyNode.Kind.BONE) {
                bones++;
            } else {
                cubes++;
            }
            for (HierarchyNode child : node.children()) {
                stack.push(child);
            }
        }
        return new ProjectStats(bones, cubes);
    }
}
