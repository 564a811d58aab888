package io.modelpipe.stream;

import com.fasterxml.jackson.databind.JsonNode;
import io.modelpipe.model.Job;
import io.modelpipe.model.JobKind;
import io.modelpipe.model.JobStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Blob keys for materialized conversion output, {@code {tenant}/{project}/{path}}.
 */
public final class ExportKeys {
    public static final String DEFAULT_EXPORT_FILE = "export.json";

    private ExportKeys() {
    }

    public static String sanitizeBlobPath(String value) {
        if (value == null) {
            return "";
        }
        String normalized = value.replace('\\', '/');
        List<String> kept = new ArrayList<>();
        for (String segment : normalized.split("/")) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                continue;
            }
            kept.add(segment);
        }
        return String.join("/", kept);
    }

    public static String buildExportKey(String tenantId, String projectId, String exportPath) {
        String path = sanitizeBlobPath(exportPath);
        return tenantId + "/" + projectId + "/" + (path.isEmpty() ? DEFAULT_EXPORT_FILE : path);
    }

    /**
     * @return {@code result.output.exportPath} of a completed conversion job, or {@code null}
     */
    public static String readExportPath(Job job) {
        if (job == null || job.kind() != JobKind.GLTF_CONVERT || job.status() != JobStatus.COMPLETED) {
            return null;
        }
        JsonNode result = job.result();
        JsonNode output = result == null ? null : result.get("output");
        if (output == null || !output.isObject()) {
            return null;
        }
        JsonNode exportPath = output.get("exportPath");
        if (exportPath == null || !exportPath.isTextual() || exportPath.asText().isBlank()) {
            return null;
        }
        return exportPath.asText();
    }
}
