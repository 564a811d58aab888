package io.modelpipe.model;

import java.util.List;

public record ProjectTree(int maxFolderDepth, List<Node> roots) {
    public ProjectTree {
        roots = List.copyOf(roots);
    }

    public record Node(
            TreeChildRef.Kind kind,
            String id,
            String name,
            String parentFolderId,
            int depth,
            JobStatus activeJobStatus,
            LockState lockState,
            String lockOwnerAgentId,
            List<Node> children
    ) {
        public Node {
            children = children == null ? List.of() : List.copyOf(children);
        }
    }

    public enum LockState {
        UNLOCKED,
        LOCKED
    }
}
