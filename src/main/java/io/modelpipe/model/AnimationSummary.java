package io.modelpipe.model;

public record AnimationSummary(String id, String name, double length, boolean loop) {
}
