package io.modelpipe.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;

public enum JobKind {
    GLTF_CONVERT("gltf.convert"),
    TEXTURE_PREFLIGHT("texture.preflight");

    private final String wireName;

    JobKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static List<String> wireNames() {
        List<String> out = new ArrayList<>();
        for (JobKind kind : values()) {
            out.add(kind.wireName);
        }
        return out;
    }

    /**
     * Returns the kind with the given wire name, or {@code null} for anything outside the closed set.
     */
    public static JobKind fromWireName(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim();
        for (JobKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
