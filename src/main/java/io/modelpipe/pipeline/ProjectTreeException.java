package io.modelpipe.pipeline;

public final class ProjectTreeException extends RuntimeException {
    public ProjectTreeException(String message) {
        super(message);
    }
}
