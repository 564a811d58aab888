package io.modelpipe.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.modelpipe.util.Jsons;

import java.util.List;

/**
 * Immutable snapshot of a project. {@code stats} and {@code hasGeometry} are derived from the hierarchy
 * by {@code ProjectSnapshots.synchronize}; the {@code with*} helpers never recompute them.
 */
public record Project(
        String projectId,
        String name,
        String parentFolderId,
        long revision,
        boolean hasGeometry,
        ProjectStats stats,
        List<HierarchyNode> hierarchy,
        List<AnimationSummary> animations,
        ArrayNode textures,
        ActiveJob activeJob,
        ProjectLock projectLock,
        List<Double> focusAnchor
) {
    public static final List<Double> DEFAULT_FOCUS_ANCHOR = List.of(0.0, 24.0, 0.0);

    public Project {
        stats = stats == null ? ProjectStats.EMPTY : stats;
        hierarchy = hierarchy == null ? List.of() : List.copyOf(hierarchy);
        animations = animations == null ? List.of() : List.copyOf(animations);
        textures = textures == null ? Jsons.mapper().createArrayNode() : textures.deepCopy();
        focusAnchor = focusAnchor == null ? null : List.copyOf(focusAnchor);
    }

    public static Project createDefault(String projectId, String name, String parentFolderId) {
        return new Project(
                projectId,
                name,
                parentFolderId,
                1L,
                false,
                ProjectStats.EMPTY,
                List.of(),
                List.of(),
                null,
                null,
                null,
                DEFAULT_FOCUS_ANCHOR
        );
    }

    @Override
    public ArrayNode textures() {
        return textures.deepCopy();
    }

    public Project withName(String nextName) {
        return new Project(projectId, nextName, parentFolderId, revision, hasGeometry, stats, hierarchy,
                animations, textures, activeJob, projectLock, focusAnchor);
    }

    public Project withParentFolderId(String nextParentFolderId) {
        return new Project(projectId, name, nextParentFolderId, revision, hasGeometry, stats, hierarchy,
                animations, textures, activeJob, projectLock, focusAnchor);
    }

    public Project withRevision(long nextRevision) {
        return new Project(projectId, name, parentFolderId, nextRevision, hasGeometry, stats, hierarchy,
                animations, textures, activeJob, projectLock, focusAnchor);
    }

    public Project withActiveJob(ActiveJob nextActiveJob) {
        return new Project(projectId, name, parentFolderId, revision, hasGeometry, stats, hierarchy,
                animations, textures, nextActiveJob, projectLock, focusAnchor);
    }

    public Project withProjectLock(ProjectLock nextLock) {
        return new Project(projectId, name, parentFolderId, revision, hasGeometry, stats, hierarchy,
                animations, textures, activeJob, nextLock, focusAnchor);
    }

    public Project withHierarchy(List<HierarchyNode> nextHierarchy) {
        return new Project(projectId, name, parentFolderId, revision, hasGeometry, stats, nextHierarchy,
                animations, textures, activeJob, projectLock, focusAnchor);
    }

    public Project withAnimations(List<AnimationSummary> nextAnimations) {
        return new Project(projectId, name, parentFolderId, revision, hasGeometry, stats, hierarchy,
                nextAnimations, textures, activeJob, projectLock, focusAnchor);
    }

    public Project withTextures(JsonNode nextTextures) {
        ArrayNode copy = nextTextures instanceof ArrayNode array ? array : null;
        return new Project(projectId, name, parentFolderId, revision, hasGeometry, stats, hierarchy,
                animations, copy, activeJob, projectLock, focusAnchor);
    }

    public Project withStats(ProjectStats nextStats) {
        return new Project(projectId, name, parentFolderId, revision, nextStats.hasGeometry(), nextStats,
                hierarchy, animations, textures, activeJob, projectLock, focusAnchor);
    }
}
