package io.modelpipe.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelpipe.model.JobKind;
import io.modelpipe.util.Jsons;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Shape checks for job kinds, payloads and results. Normalizers return {@code null} for absent input
 * and throw {@link JobContractException} on any violation.
 */
public final class JobContracts {
    private static final Set<String> GLTF_PAYLOAD_KEYS = Set.of("codecId", "optimize");
    private static final Set<String> PREFLIGHT_PAYLOAD_KEYS = Set.of("textureIds", "maxDimension", "allowNonPowerOfTwo");
    private static final Set<String> FACE_DIRECTIONS = Set.of("north", "east", "south", "west", "up", "down");

    private JobContracts() {
    }

    public static JobKind normalizeKind(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new JobContractException("kind is required");
        }
        JobKind kind = JobKind.fromWireName(raw);
        if (kind == null) {
            throw new JobContractException("kind must be one of: " + String.join(", ", JobKind.wireNames()));
        }
        return kind;
    }

    public static ObjectNode normalizePayload(JobKind kind, JsonNode payload) {
        if (absent(payload)) {
            return null;
        }
        if (!payload.isObject()) {
            throw new JobContractException("payload must be an object");
        }
        ObjectNode normalized = Jsons.mapper().createObjectNode();
        if (kind == JobKind.GLTF_CONVERT) {
            assertKnownKeys(payload, GLTF_PAYLOAD_KEYS, kind);
            JsonNode codecId = payload.get("codecId");
            if (codecId != null) {
                if (!isNonEmptyString(codecId)) {
                    throw new JobContractException("payload.codecId must be a non-empty string");
                }
                normalized.put("codecId", codecId.textValue());
            }
            JsonNode optimize = payload.get("optimize");
            if (optimize != null) {
                if (!optimize.isBoolean()) {
                    throw new JobContractException("payload.optimize must be a boolean");
                }
                normalized.put("optimize", optimize.booleanValue());
            }
        } else {
            assertKnownKeys(payload, PREFLIGHT_PAYLOAD_KEYS, kind);
            JsonNode textureIds = payload.get("textureIds");
            if (textureIds != null) {
                if (!textureIds.isArray()) {
                    throw new JobContractException("payload.textureIds must be an array of non-empty strings");
                }
                ArrayNode ids = normalized.putArray("textureIds");
                for (JsonNode entry : textureIds) {
                    if (!isNonEmptyString(entry)) {
                        throw new JobContractException("payload.textureIds must be an array of non-empty strings");
                    }
                    ids.add(entry.textValue());
                }
            }
            JsonNode maxDimension = payload.get("maxDimension");
            if (maxDimension != null) {
                if (!isPositiveInteger(maxDimension)) {
                    throw new JobContractException("payload.maxDimension must be a positive integer");
                }
                normalized.put("maxDimension", maxDimension.asLong());
            }
            JsonNode allowNonPowerOfTwo = payload.get("allowNonPowerOfTwo");
            if (allowNonPowerOfTwo != null) {
                if (!allowNonPowerOfTwo.isBoolean()) {
                    throw new JobContractException("payload.allowNonPowerOfTwo must be a boolean");
                }
                normalized.put("allowNonPowerOfTwo", allowNonPowerOfTwo.booleanValue());
            }
        }
        return normalized.isEmpty() ? null : normalized;
    }

    /**
     * Validates a worker result against the job kind. Fields outside the contract are dropped.
     */
    public static ObjectNode normalizeResult(JobKind kind, JsonNode result) {
        if (absent(result)) {
            return null;
        }
        if (!result.isObject()) {
            throw new JobContractException("result must be an object");
        }
        String expected = kind.wireName();
        JsonNode rawKind = result.get("kind");
        if (rawKind == null || !rawKind.isTextual() || !expected.equals(rawKind.textValue())) {
            throw new JobContractException("result.kind must be '" + expected + "'");
        }
        ObjectNode normalized = Jsons.mapper().createObjectNode();
        normalized.put("kind", expected);
        copyNonEmptyString(result, normalized, "processedBy");
        JsonNode attemptCount = result.get("attemptCount");
        if (attemptCount != null) {
            if (!isPositiveInteger(attemptCount)) {
                throw new JobContractException("result.attemptCount must be a positive integer");
            }
            normalized.put("attemptCount", attemptCount.asLong());
        }
        copyNonEmptyString(result, normalized, "finishedAt");
        if (kind == JobKind.GLTF_CONVERT) {
            normalizeGltfResult(result, normalized);
        } else {
            normalizePreflightResult(result, normalized);
        }
        JsonNode diagnostics = result.get("diagnostics");
        if (diagnostics != null) {
            if (!diagnostics.isArray()) {
                throw new JobContractException("result.diagnostics must be an array of strings");
            }
            for (JsonNode entry : diagnostics) {
                if (!entry.isTextual()) {
                    throw new JobContractException("result.diagnostics must be an array of strings");
                }
            }
            normalized.set("diagnostics", diagnostics.deepCopy());
        }
        JsonNode output = result.get("output");
        if (output != null) {
            if (!output.isObject()) {
                throw new JobContractException("result.output must be an object");
            }
            normalized.set("output", output.deepCopy());
        }
        return normalized;
    }

    private static void normalizeGltfResult(JsonNode result, ObjectNode normalized) {
        JsonNode status = result.get("status");
        if (status != null) {
            String value = status.isTextual() ? status.textValue() : "";
            if (!value.equals("converted") && !value.equals("noop") && !value.equals("failed")) {
                throw new JobContractException("result.status must be one of: converted, noop, failed");
            }
            normalized.put("status", value);
        }
        JsonNode hasGeometry = result.get("hasGeometry");
        if (hasGeometry != null) {
            if (!hasGeometry.isBoolean()) {
                throw new JobContractException("result.hasGeometry must be a boolean");
            }
            normalized.put("hasGeometry", hasGeometry.booleanValue());
        }
        JsonNode geometryDelta = result.get("geometryDelta");
        if (geometryDelta != null) {
            if (!geometryDelta.isObject()) {
                throw new JobContractException("result.geometryDelta must be an object");
            }
            ObjectNode delta = normalized.putObject("geometryDelta");
            for (String field : List.of("bones", "cubes")) {
                JsonNode value = geometryDelta.get(field);
                if (value == null) {
                    continue;
                }
                if (!isInteger(value)) {
                    throw new JobContractException("result.geometryDelta." + field + " must be an integer");
                }
                delta.put(field, value.asLong());
            }
        }
        JsonNode hierarchy = result.get("hierarchy");
        if (hierarchy != null) {
            if (!hierarchy.isArray()) {
                throw new JobContractException("result.hierarchy must be an array");
            }
            ArrayNode nodes = normalized.putArray("hierarchy");
            for (JsonNode entry : hierarchy) {
                nodes.add(normalizeHierarchyNode(entry));
            }
        }
        JsonNode animations = result.get("animations");
        if (animations != null) {
            if (!animations.isArray()) {
                throw new JobContractException("result.animations must be an array");
            }
            ArrayNode out = normalized.putArray("animations");
            for (int i = 0; i < animations.size(); i++) {
                JsonNode entry = animations.get(i);
                String prefix = "result.animations[" + i + "]";
                if (!entry.isObject()) {
                    throw new JobContractException("result.animations entry must be an object");
                }
                ObjectNode animation = out.addObject();
                animation.put("id", requireNonEmptyString(entry, "id", prefix));
                animation.put("name", requireNonEmptyString(entry, "name", prefix));
                JsonNode length = entry.get("length");
                if (!isFiniteNumber(length) || length.asDouble() < 0) {
                    throw new JobContractException(prefix + ".length must be a non-negative number");
                }
                animation.put("length", length.asDouble());
                JsonNode loop = entry.get("loop");
                if (loop == null || !loop.isBoolean()) {
                    throw new JobContractException(prefix + ".loop must be a boolean");
                }
                animation.put("loop", loop.booleanValue());
            }
        }
        JsonNode textureSources = result.get("textureSources");
        if (textureSources != null) {
            if (!textureSources.isArray()) {
                throw new JobContractException("result.textureSources must be an array");
            }
            ArrayNode out = normalized.putArray("textureSources");
            for (int i = 0; i < textureSources.size(); i++) {
                JsonNode entry = textureSources.get(i);
                String prefix = "result.textureSources[" + i + "]";
                if (!entry.isObject()) {
                    throw new JobContractException("result.textureSources entry must be an object");
                }
                ObjectNode source = out.addObject();
                source.put("faceId", requireNonEmptyString(entry, "faceId", prefix));
                source.put("cubeId", requireNonEmptyString(entry, "cubeId", prefix));
                source.put("cubeName", requireNonEmptyString(entry, "cubeName", prefix));
                source.put("direction", requireDirection(entry, prefix));
                source.put("colorHex", requireNonEmptyString(entry, "colorHex", prefix));
                source.put("rotationQuarter", requireRotationQuarter(entry, prefix));
            }
        }
        JsonNode textures = result.get("textures");
        if (textures != null) {
            if (!textures.isArray()) {
                throw new JobContractException("result.textures must be an array");
            }
            ArrayNode out = normalized.putArray("textures");
            for (int i = 0; i < textures.size(); i++) {
                out.add(normalizeTextureAtlas(textures.get(i), "result.textures[" + i + "]"));
            }
        }
    }

    private static ObjectNode normalizeHierarchyNode(JsonNode value) {
        if (!value.isObject()) {
            throw new JobContractException("result.hierarchy node must be an object");
        }
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("id", requireNonEmptyString(value, "id", "result.hierarchy node"));
        node.put("name", requireNonEmptyString(value, "name", "result.hierarchy node"));
        JsonNode kind = value.get("kind");
        if (kind == null || !kind.isTextual() || (!"bone".equals(kind.textValue()) && !"cube".equals(kind.textValue()))) {
            throw new JobContractException("result.hierarchy node.kind must be 'bone' or 'cube'");
        }
        node.put("kind", kind.textValue());
        JsonNode children = value.get("children");
        if (children == null || !children.isArray()) {
            throw new JobContractException("result.hierarchy node.children must be an array");
        }
        ArrayNode outChildren = node.putArray("children");
        for (JsonNode child : children) {
            outChildren.add(normalizeHierarchyNode(child));
        }
        return node;
    }

    private static ObjectNode normalizeTextureAtlas(JsonNode entry, String prefix) {
        if (!entry.isObject()) {
            throw new JobContractException("result.textures entry must be an object");
        }
        ObjectNode atlas = Jsons.mapper().createObjectNode();
        atlas.put("textureId", requireNonEmptyString(entry, "textureId", prefix));
        atlas.put("name", requireNonEmptyString(entry, "name", prefix));
        for (String field : List.of("width", "height", "faceCount")) {
            JsonNode value = entry.get(field);
            if (!isFiniteNumber(value) || value.asDouble() < 0) {
                throw new JobContractException(prefix + "." + field + " must be a non-negative number");
            }
            atlas.set(field, value.deepCopy());
        }
        atlas.put("imageDataUrl", requireNonEmptyString(entry, "imageDataUrl", prefix));
        JsonNode faces = entry.get("faces");
        if (faces == null || !faces.isArray()) {
            throw new JobContractException(prefix + ".faces must be an array");
        }
        JsonNode uvEdges = entry.get("uvEdges");
        if (uvEdges == null || !uvEdges.isArray()) {
            throw new JobContractException(prefix + ".uvEdges must be an array");
        }
        ArrayNode outFaces = atlas.putArray("faces");
        for (int i = 0; i < faces.size(); i++) {
            JsonNode face = faces.get(i);
            String facePrefix = prefix + ".faces[" + i + "]";
            if (!face.isObject()) {
                throw new JobContractException(facePrefix + " must be an object");
            }
            ObjectNode outFace = outFaces.addObject();
            outFace.put("faceId", requireNonEmptyString(face, "faceId", facePrefix));
            outFace.put("cubeId", requireNonEmptyString(face, "cubeId", facePrefix));
            outFace.put("cubeName", requireNonEmptyString(face, "cubeName", facePrefix));
            outFace.put("direction", requireDirection(face, facePrefix));
            outFace.put("rotationQuarter", requireRotationQuarter(face, facePrefix));
            for (String field : List.of("uMin", "vMin", "uMax", "vMax")) {
                outFace.put(field, requireFiniteNumber(face, field, facePrefix));
            }
        }
        ArrayNode outEdges = atlas.putArray("uvEdges");
        for (int i = 0; i < uvEdges.size(); i++) {
            JsonNode edge = uvEdges.get(i);
            String edgePrefix = prefix + ".uvEdges[" + i + "]";
            if (!edge.isObject()) {
                throw new JobContractException(edgePrefix + " must be an object");
            }
            ObjectNode outEdge = outEdges.addObject();
            for (String field : List.of("x1", "y1", "x2", "y2")) {
                outEdge.put(field, requireFiniteNumber(edge, field, edgePrefix));
            }
        }
        return atlas;
    }

    private static void normalizePreflightResult(JsonNode result, ObjectNode normalized) {
        JsonNode status = result.get("status");
        if (status != null) {
            String value = status.isTextual() ? status.textValue() : "";
            if (!value.equals("passed") && !value.equals("failed")) {
                throw new JobContractException("result.status must be one of: passed, failed");
            }
            normalized.put("status", value);
        }
        JsonNode summary = result.get("summary");
        if (summary != null) {
            if (!summary.isObject()) {
                throw new JobContractException("result.summary must be an object");
            }
            ObjectNode out = normalized.putObject("summary");
            for (String field : List.of("checked", "oversized", "nonPowerOfTwo")) {
                JsonNode value = summary.get(field);
                if (!isInteger(value) || value.asLong() < 0) {
                    throw new JobContractException("result.summary." + field + " must be a non-negative integer");
                }
                out.put(field, value.asLong());
            }
        }
    }

    private static void assertKnownKeys(JsonNode payload, Set<String> allowed, JobKind kind) {
        List<String> unknown = new ArrayList<>();
        Iterator<String> names = payload.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            throw new JobContractException(
                    "payload has unsupported field(s) for " + kind.wireName() + ": " + String.join(", ", unknown)
            );
        }
    }

    private static void copyNonEmptyString(JsonNode source, ObjectNode target, String field) {
        JsonNode value = source.get(field);
        if (value == null) {
            return;
        }
        if (!isNonEmptyString(value)) {
            throw new JobContractException("result." + field + " must be a non-empty string");
        }
        target.put(field, value.textValue());
    }

    private static String requireNonEmptyString(JsonNode node, String field, String prefix) {
        JsonNode value = node.get(field);
        if (!isNonEmptyString(value)) {
            throw new JobContractException(prefix + "." + field + " must be a non-empty string");
        }
        return value.textValue();
    }

    private static double requireFiniteNumber(JsonNode node, String field, String prefix) {
        JsonNode value = node.get(field);
        if (!isFiniteNumber(value)) {
            throw new JobContractException(prefix + "." + field + " must be a finite number");
        }
        return value.asDouble();
    }

    private static String requireDirection(JsonNode node, String prefix) {
        JsonNode value = node.get("direction");
        if (value == null || !value.isTextual() || !FACE_DIRECTIONS.contains(value.textValue())) {
            throw new JobContractException(prefix + ".direction must be a valid cube face direction");
        }
        return value.textValue();
    }

    private static int requireRotationQuarter(JsonNode node, String prefix) {
        JsonNode value = node.get("rotationQuarter");
        if (!isInteger(value) || value.asLong() < 0 || value.asLong() > 3) {
            throw new JobContractException(prefix + ".rotationQuarter must be one of 0, 1, 2, 3");
        }
        return value.asInt();
    }

    static boolean absent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    static boolean isNonEmptyString(JsonNode node) {
        return node != null && node.isTextual() && !node.textValue().isBlank();
    }

    static boolean isFiniteNumber(JsonNode node) {
        return node != null && node.isNumber() && Double.isFinite(node.asDouble());
    }

    static boolean isInteger(JsonNode node) {
        if (!isFiniteNumber(node)) {
            return false;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong();
        }
        double value = node.asDouble();
        return value == Math.rint(value);
    }

    static boolean isPositiveInteger(JsonNode node) {
        return isInteger(node) && node.asDouble() > 0;
    }
}
