package io.modelpipe.model;

public record ProjectStats(int bones, int cubes) {
    public static final ProjectStats EMPTY = new ProjectStats(0, 0);

    public boolean hasGeometry() {
        return bones > 0 || cubes > 0;
    }
}
