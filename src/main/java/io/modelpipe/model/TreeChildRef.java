package io.modelpipe.model;

import com.fasterxml.jackson.annotation.JsonValue;

public record TreeChildRef(Kind kind, String id) {

    public static TreeChildRef folder(String folderId) {
        return new TreeChildRef(Kind.FOLDER, folderId);
    }

    public static TreeChildRef project(String projectId) {
        return new TreeChildRef(Kind.PROJECT, projectId);
    }

    public boolean matches(Kind otherKind, String otherId) {
        return kind == otherKind && id.equals(otherId);
    }

    public enum Kind {
        FOLDER,
        PROJECT;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }

        public static Kind fromWireName(String raw) {
            if ("folder".equals(raw)) {
                return FOLDER;
            }
            if ("project".equals(raw)) {
                return PROJECT;
            }
            return null;
        }
    }
}
