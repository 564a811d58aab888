package io.modelpipe.storage;

/**
 * The state document kept changing underneath a mutation until the retry budget ran out.
 */
public final class StoreConflictException extends RuntimeException {
    private final String scope;
    private final int attempts;

    public StoreConflictException(String scope, int attempts) {
        super("State document for scope '" + scope + "' changed concurrently; gave up after " + attempts + " attempts");
        this.scope = scope;
        this.attempts = attempts;
    }

    public String scope() {
        return scope;
    }

    public int attempts() {
        return attempts;
    }
}
