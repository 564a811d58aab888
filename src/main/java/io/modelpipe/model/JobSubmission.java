package io.modelpipe.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw submission input. {@code kind} is an unchecked string and the numeric knobs accept any {@link Number}
 * so that non-integral or non-finite inputs can fall back to defaults.
 */
public record JobSubmission(
        String projectId,
        String kind,
        JsonNode payload,
        Number maxAttempts,
        Number leaseMs
) {
    public static JobSubmission of(String projectId, String kind, JsonNode payload) {
        return new JobSubmission(projectId, kind, payload, null, null);
    }
}
