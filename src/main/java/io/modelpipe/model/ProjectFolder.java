package io.modelpipe.model;

import java.util.List;

public record ProjectFolder(String folderId, String name, String parentFolderId, List<TreeChildRef> children) {
    public ProjectFolder {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public ProjectFolder withName(String nextName) {
        return new ProjectFolder(folderId, nextName, parentFolderId, children);
    }

    public ProjectFolder withParentFolderId(String nextParentFolderId) {
        return new ProjectFolder(folderId, name, nextParentFolderId, children);
    }

    public ProjectFolder withChildren(List<TreeChildRef> nextChildren) {
        return new ProjectFolder(folderId, name, parentFolderId, nextChildren);
    }
}
