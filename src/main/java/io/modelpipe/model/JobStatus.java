package io.modelpipe.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean terminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static JobStatus fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        for (JobStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        return null;
    }
}
