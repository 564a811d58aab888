package io.modelpipe.model;

public record ActiveJob(String id, JobStatus status) {
}
