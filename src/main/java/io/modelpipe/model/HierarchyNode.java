package io.modelpipe.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

public record HierarchyNode(String id, String name, Kind kind, List<HierarchyNode> children) {
    public HierarchyNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public enum Kind {
        BONE,
        CUBE;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }

        public static Kind fromWireName(String raw) {
            if ("bone".equals(raw)) {
                return BONE;
            }
            if ("cube".equals(raw)) {
                return CUBE;
            }
            return null;
        }
    }
}
