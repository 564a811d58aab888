package io.modelpipe.model;

public record ProjectEvent(long seq, String event, Project data) {
    public static final String PROJECT_SNAPSHOT = "project_snapshot";

    public static ProjectEvent snapshot(long seq, Project data) {
        return new ProjectEvent(seq, PROJECT_SNAPSHOT, data);
    }
}
