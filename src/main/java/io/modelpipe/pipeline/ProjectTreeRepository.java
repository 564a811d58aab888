package io.modelpipe.pipeline;

import io.modelpipe.config.PipelineConfig;
import io.modelpipe.model.Job;
import io.modelpipe.model.Project;
import io.modelpipe.model.ProjectFolder;
import io.modelpipe.model.ProjectTree;
import io.modelpipe.model.TreeChildRef;
import io.modelpipe.util.Hashing;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Folder/project forest. Every folder and project id sits in exactly one children list or in the root list.
 */
public final class ProjectTreeRepository {
    public static final String DEFAULT_FOLDER_NAME = "New Folder";
    public static final String DEFAULT_PROJECT_NAME = "My Project";
    private static final String PROJECT_ID_PREFIX = "prj";
    private static final String FOLDER_ID_PREFIX = "fld";
    private static final int MAX_NAME_LENGTH = 96;
    private static final int MAX_LOOP_GUARD = 64;
    private static final int MAX_TRAVERSAL = 1024;

    private final PipelineState state;
    private final EventLog eventLog;

    public ProjectTreeRepository(PipelineState state, EventLog eventLog) {
        this.state = state;
        this.eventLog = eventLog;
    }

    public Project getProject(String projectId) {
        return state.projects.get(projectId);
    }

    public List<Project> listProjects(String query) {
        String normalized = normalizeQuery(query);
        List<Project> out = new ArrayList<>();
        for (Project project : state.projects.values()) {
            if (normalized.isEmpty()
                    || project.projectId().toLowerCase(Locale.ROOT).contains(normalized)
                    || project.name().toLowerCase(Locale.ROOT).contains(normalized)) {
                out.add(project);
            }
        }
        return out;
    }

    public ProjectTree getProjectTree(String query) {
        return new ProjectTree(PipelineConfig.MAX_FOLDER_DEPTH, buildNodes(state.rootChildren, 1, normalizeQuery(query)));
    }

    /**
     * Returns the project, creating it at the root (named after its id) when it does not exist yet.
     */
    public Project ensureProject(String projectId) {
        Project existing = state.projects.get(projectId);
        if (existing != null) {
            return existing;
        }
        Project created = ProjectSnapshots.synchronize(Project.createDefault(projectId, projectId, null));
        state.projects.put(projectId, created);
        state.rootChildren.add(TreeChildRef.project(projectId));
        eventLog.append(created);
        return created;
    }

    public ProjectFolder createFolder(String name, String parentFolderId, Integer index) {
        String parentId = normalizeParentFolderId(parentFolderId);
        ensureTargetFolderExists(parentId);
        ensureFolderDepthLimit(parentId, 1);
        String normalizedName = normalizeName(name, DEFAULT_FOLDER_NAME);
        String folderId = computeEntityId(FOLDER_ID_PREFIX, (parentId == null ? "root" : parentId) + ":" + normalizedName);
        ProjectFolder folder = new ProjectFolder(folderId, normalizedName, parentId, List.of());
        state.folders.put(folderId, folder);
        editChildren(parentId, children -> insertChildRef(children, TreeChildRef.folder(folderId), index));
        return folder;
    }

    public ProjectFolder renameFolder(String folderId, String nextName) {
        ProjectFolder folder = state.folders.get(folderId);
        if (folder == null) {
            return null;
        }
        ProjectFolder renamed = folder.withName(normalizeName(nextName, folder.name()));
        state.folders.put(folderId, renamed);
        return renamed;
    }

    public ProjectFolder moveFolder(String folderId, String parentFolderId, Integer index) {
        ProjectFolder folder = state.folders.get(folderId);
        if (folder == null) {
            return null;
        }
        String previousParentId = folder.parentFolderId();
        String parentId = normalizeParentFolderId(parentFolderId);
        if (folderId.equals(parentId)) {
            throw new ProjectTreeException("Cannot move a folder into itself.");
        }
        ensureTargetFolderExists(parentId);
        if (parentId != null && isFolderDescendant(folderId, parentId)) {
            throw new ProjectTreeException("Cannot move a folder into a descendant folder.");
        }
        ensureFolderDepthLimit(parentId, subtreeFolderHeight(folderId));

        Integer adjustedIndex = Objects.equals(previousParentId, parentId)
                ? resolveReorderIndex(containerChildren(previousParentId), TreeChildRef.Kind.FOLDER, folderId, index)
                : index;
        detach(TreeChildRef.Kind.FOLDER, folderId, previousParentId);
        editChildren(parentId, children -> insertChildRef(children, TreeChildRef.folder(folderId), adjustedIndex));
        ProjectFolder moved = state.folders.get(folderId).withParentFolderId(parentId);
        state.folders.put(folderId, moved);
        return moved;
    }

    /**
     * Deletes the folder with every descendant folder and project, including their jobs, locks and events.
     *
     * @return ids of the deleted projects, or {@code null} when the folder does not exist
     */
    public List<String> deleteFolder(String folderId) {
        ProjectFolder folder = state.folders.get(folderId);
        if (folder == null) {
            return null;
        }
        detach(TreeChildRef.Kind.FOLDER, folderId, folder.parentFolderId());
        List<String> subtreeFolderIds = collectFolderSubtree(folderId);
        Set<String> projectIds = new LinkedHashSet<>();
        for (String id : subtreeFolderIds) {
            ProjectFolder current = state.folders.get(id);
            if (current == null) {
                continue;
            }
            for (TreeChildRef child : current.children()) {
                if (child.kind() == TreeChildRef.Kind.PROJECT) {
                    projectIds.add(child.id());
                }
            }
        }
        for (String projectId : projectIds) {
            removeProjectInternal(projectId);
        }
        for (String id : subtreeFolderIds) {
            state.folders.remove(id);
        }
        return new ArrayList<>(projectIds);
    }

    public Project createProject(String name, String parentFolderId, Integer index) {
        String parentId = normalizeParentFolderId(parentFolderId);
        ensureTargetFolderExists(parentId);
        String normalizedName = normalizeName(name, DEFAULT_PROJECT_NAME);
        String projectId = computeEntityId(PROJECT_ID_PREFIX, "project:" + normalizedName);
        Project project = ProjectSnapshots.synchronize(Project.createDefault(projectId, normalizedName, parentId));
        state.projects.put(projectId, project);
        editChildren(parentId, children -> insertChildRef(children, TreeChildRef.project(projectId), index));
        eventLog.append(project);
        return project;
    }

    public Project renameProject(String projectId, String nextName) {
        Project project = state.projects.get(projectId);
        if (project == null) {
            return null;
        }
        Project renamed = ProjectSnapshots.synchronize(project.withName(normalizeName(nextName, project.name())));
        state.projects.put(projectId, renamed);
        eventLog.append(renamed);
        return renamed;
    }

    public Project moveProject(String projectId, String parentFolderId, Integer index) {
        Project project = state.projects.get(projectId);
        if (project == null) {
            return null;
        }
        String previousParentId = project.parentFolderId();
        String parentId = normalizeParentFolderId(parentFolderId);
        ensureTargetFolderExists(parentId);
        Integer adjustedIndex = Objects.equals(previousParentId, parentId)
                ? resolveReorderIndex(containerChildren(previousParentId), TreeChildRef.Kind.PROJECT, projectId, index)
                : index;
        detach(TreeChildRef.Kind.PROJECT, projectId, previousParentId);
        editChildren(parentId, children -> insertChildRef(children, TreeChildRef.project(projectId), adjustedIndex));
        Project moved = ProjectSnapshots.synchronize(project.withParentFolderId(parentId));
        state.projects.put(projectId, moved);
        eventLog.append(moved);
        return moved;
    }

    public boolean deleteProject(String projectId) {
        if (!state.projects.containsKey(projectId)) {
            return false;
        }
        removeProjectInternal(projectId);
        return true;
    }

    private void removeProjectInternal(String projectId) {
        Project project = state.projects.get(projectId);
        if (project == null) {
            return;
        }
        detach(TreeChildRef.Kind.PROJECT, projectId, project.parentFolderId());
        state.projects.remove(projectId);
        state.locks.remove(projectId);
        eventLog.remove(projectId);
        Iterator<Map.Entry<String, Job>> it = state.jobs.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Job> entry = it.next();
            if (entry.getValue().projectId().equals(projectId)) {
                state.pending.remove(entry.getKey());
                it.remove();
            }
        }
    }

    private List<ProjectTree.Node> buildNodes(List<TreeChildRef> children, int depth, String query) {
        List<ProjectTree.Node> nodes = new ArrayList<>();
        for (TreeChildRef child : children) {
            if (child.kind() == TreeChildRef.Kind.FOLDER) {
                ProjectFolder folder = state.folders.get(child.id());
                if (folder == null) {
                    continue;
                }
                List<ProjectTree.Node> childNodes = buildNodes(folder.children(), depth + 1, query);
                boolean matches = query.isEmpty()
                        || folder.name().toLowerCase(Locale.ROOT).contains(query)
                        || folder.folderId().toLowerCase(Locale.ROOT).contains(query);
                if (!matches && childNodes.isEmpty()) {
                    continue;
                }
                nodes.add(new ProjectTree.Node(
                        TreeChildRef.Kind.FOLDER,
                        folder.folderId(),
                        folder.name(),
                        folder.parentFolderId(),
                        depth,
                        null,
                        null,
                        null,
                        childNodes
                ));
                continue;
            }
            Project project = state.projects.get(child.id());
            if (project == null) {
                continue;
            }
            boolean matches = query.isEmpty()
                    || project.name().toLowerCase(Locale.ROOT).contains(query)
                    || project.projectId().toLowerCase(Locale.ROOT).contains(query);
            if (!matches) {
                continue;
            }
            nodes.add(new ProjectTree.Node(
                    TreeChildRef.Kind.PROJECT,
                    project.projectId(),
                    project.name(),
                    project.parentFolderId(),
                    depth,
                    project.activeJob() == null ? null : project.activeJob().status(),
                    project.projectLock() == null ? ProjectTree.LockState.UNLOCKED : ProjectTree.LockState.LOCKED,
                    project.projectLock() == null ? null : project.projectLock().ownerAgentId(),
                    List.of()
            ));
        }
        return nodes;
    }

    private String computeEntityId(String prefix, String seed) {
        while (true) {
            long nonce = state.allocateEntityNonce();
            String digest = Hashing.sha256Hex(prefix + ":" + nonce + ":" + seed).substring(0, 12);
            String candidate = prefix + "_" + digest;
            boolean taken = PROJECT_ID_PREFIX.equals(prefix)
                    ? state.projects.containsKey(candidate)
                    : state.folders.containsKey(candidate);
            if (!taken) {
                return candidate;
            }
        }
    }

    private List<TreeChildRef> containerChildren(String parentFolderId) {
        if (parentFolderId == null) {
            return state.rootChildren;
        }
        ProjectFolder folder = state.folders.get(parentFolderId);
        if (folder == null) {
            throw new ProjectTreeException("Folder not found: " + parentFolderId);
        }
        return folder.children();
    }

    private void editChildren(String parentFolderId, Consumer<List<TreeChildRef>> edit) {
        if (parentFolderId == null) {
            edit.accept(state.rootChildren);
            return;
        }
        ProjectFolder folder = state.folders.get(parentFolderId);
        if (folder == null) {
            throw new ProjectTreeException("Folder not found: " + parentFolderId);
        }
        List<TreeChildRef> children = new ArrayList<>(folder.children());
        edit.accept(children);
        state.folders.put(parentFolderId, folder.withChildren(children));
    }

    private void detach(TreeChildRef.Kind kind, String id, String parentFolderId) {
        boolean[] removed = new boolean[1];
        if (parentFolderId == null || state.folders.containsKey(parentFolderId)) {
            editChildren(parentFolderId, children -> removed[0] = children.removeIf(ref -> ref.matches(kind, id)));
        }
        if (removed[0]) {
            return;
        }
        for (ProjectFolder candidate : new ArrayList<>(state.folders.values())) {
            if (candidate.children().stream().anyMatch(ref -> ref.matches(kind, id))) {
                editChildren(candidate.folderId(), children -> children.removeIf(ref -> ref.matches(kind, id)));
                return;
            }
        }
        state.rootChildren.removeIf(ref -> ref.matches(kind, id));
    }

    private int folderDepth(String folderId) {
        int depth = 0;
        int guard = 0;
        String currentId = folderId;
        while (currentId != null) {
            ProjectFolder folder = state.folders.get(currentId);
            if (folder == null) {
                break;
            }
            depth++;
            currentId = folder.parentFolderId();
            guard++;
            if (guard > MAX_LOOP_GUARD) {
                throw new ProjectTreeException("Folder hierarchy cycle detected.");
            }
        }
        return depth;
    }

    private int subtreeFolderHeight(String folderId) {
        ProjectFolder folder = state.folders.get(folderId);
        if (folder == null) {
            return 1;
        }
        int maxChildHeight = 0;
        for (TreeChildRef child : folder.children()) {
            if (child.kind() == TreeChildRef.Kind.FOLDER) {
                maxChildHeight = Math.max(maxChildHeight, subtreeFolderHeight(child.id()));
            }
        }
        return maxChildHeight + 1;
    }

    private void ensureFolderDepthLimit(String parentFolderId, int subtreeHeight) {
        int parentDepth = parentFolderId == null ? 0 : folderDepth(parentFolderId);
        if (parentDepth + subtreeHeight > PipelineConfig.MAX_FOLDER_DEPTH) {
            throw new ProjectTreeException(
                    "Folder depth limit exceeded (max depth " + PipelineConfig.MAX_FOLDER_DEPTH + ")."
            );
        }
    }

    private void ensureTargetFolderExists(String parentFolderId) {
        if (parentFolderId != null && !state.folders.containsKey(parentFolderId)) {
            throw new ProjectTreeException("Folder not found: " + parentFolderId);
        }
    }

    private boolean isFolderDescendant(String folderId, String candidateId) {
        Deque<String> stack = new ArrayDeque<>();
        stack.push(folderId);
        int guard = 0;
        while (!stack.isEmpty()) {
            String currentId = stack.pop();
            if (currentId.equals(candidateId)) {
                return true;
            }
            ProjectFolder folder = state.folders.get(currentId);
            if (folder == null) {
                continue;
            }
            for (TreeChildRef child : folder.children()) {
                if (child.kind() == TreeChildRef.Kind.FOLDER) {
                    stack.push(child.id());
                }
            }
            guard++;
            if (guard > MAX_TRAVERSAL) {
                throw new ProjectTreeException("Folder hierarchy traversal overflow.");
            }
        }
        return false;
    }

    private List<String> collectFolderSubtree(String folderId) {
        List<String> collected = new ArrayList<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(folderId);
        while (!stack.isEmpty()) {
            String currentId = stack.pop();
            collected.add(currentId);
            ProjectFolder current = state.folders.get(currentId);
            if (current == null) {
                continue;
            }
            for (TreeChildRef child : current.children()) {
                if (child.kind() == TreeChildRef.Kind.FOLDER) {
                    stack.push(child.id());
                }
            }
        }
        return collected;
    }

    static String normalizeName(String value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String collapsed = value.trim().replaceAll("\\s+", " ");
        if (collapsed.isEmpty()) {
            return fallback;
        }
        return collapsed.length() > MAX_NAME_LENGTH ? collapsed.substring(0, MAX_NAME_LENGTH) : collapsed;
    }

    static String normalizeParentFolderId(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    static int normalizeIndex(Integer index, int maxLength) {
        if (index == null) {
            return maxLength;
        }
        return Math.max(0, Math.min(maxLength, index));
    }

    /**
     * Same-parent reorder: the source slot is removed before insertion, so targets after it shift left by one.
     */
    static Integer resolveReorderIndex(List<TreeChildRef> children, TreeChildRef.Kind kind, String id, Integer index) {
        if (index == null) {
            return null;
        }
        int sourceIndex = -1;
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).matches(kind, id)) {
                sourceIndex = i;
                break;
            }
        }
        int target = normalizeIndex(index, children.size());
        if (sourceIndex >= 0 && target > sourceIndex) {
            return target - 1;
        }
        return target;
    }

    private static void insertChildRef(List<TreeChildRef> children, TreeChildRef entry, Integer index) {
        children.add(normalizeIndex(index, children.size()), entry);
    }

    private static String normalizeQuery(String query) {
        return query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
    }
}
