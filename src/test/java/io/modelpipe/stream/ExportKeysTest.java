package io.modelpipe.stream;

import io.modelpipe.model.Job;
import io.modelpipe.model.JobKind;
import io.modelpipe.model.JobStatus;
import io.modelpipe.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ExportKeysTest {

    @Test
    void blobPathsAreSanitized() {
        Assertions.assertEquals("a/b/c.gltf", ExportKeys.sanitizeBlobPath("\\\\a\\b/./c.gltf"));
        Assertions.assertEquals("a/b", ExportKeys.sanitizeBlobPath("///a//../b/"));
        Assertions.assertEquals("", ExportKeys.sanitizeBlobPath("../.."));
        Assertions.assertEquals("", ExportKeys.sanitizeBlobPath(null));
    }

    @Test
    void exportKeysFallBackToDefaultFile() {
        Assertions.assertEquals("default/p1/out/model.gltf", ExportKeys.buildExportKey("default", "p1", "/out/model.gltf"));
        Assertions.assertEquals("tenant/p1/export.json", ExportKeys.buildExportKey("tenant", "p1", "./"));
    }

    @Test
    void exportPathIsReadFromCompletedConversionsOnly() {
        Job completed = job(JobKind.GLTF_CONVERT, JobStatus.COMPLETED,
                "{\"kind\":\"gltf.convert\",\"output\":{\"exportPath\":\"out/model.gltf\"}}");
        Assertions.assertEquals("out/model.gltf", ExportKeys.readExportPath(completed));

        Assertions.assertNull(ExportKeys.readExportPath(job(JobKind.GLTF_CONVERT, JobStatus.RUNNING,
                "{\"kind\":\"gltf.convert\",\"output\":{\"exportPath\":\"out/model.gltf\"}}")));
        Assertions.assertNull(ExportKeys.readExportPath(job(JobKind.TEXTURE_PREFLIGHT, JobStatus.COMPLETED,
                "{\"kind\":\"texture.preflight\",\"output\":{\"exportPath\":\"out/model.gltf\"}}")));
        Assertions.assertNull(ExportKeys.readExportPath(job(JobKind.GLTF_CONVERT, JobStatus.COMPLETED,
                "{\"kind\":\"gltf.convert\",\"output\":{\"exportPath\":\"  \"}}")));
        Assertions.assertNull(ExportKeys.readExportPath(job(JobKind.GLTF_CONVERT, JobStatus.COMPLETED, null)));
        Assertions.assertNull(ExportKeys.readExportPath(null));
    }

    private static Job job(JobKind kind, JobStatus status, String result) {
        return Job.builder()
                .id("job-1")
                .projectId("p1")
                .kind(kind)
                .status(status)
                .maxAttempts(3)
                .leaseMs(30_000L)
                .createdAtMs(0L)
                .result(result == null ? null : Jsons.parse(result))
                .build();
    }
}
