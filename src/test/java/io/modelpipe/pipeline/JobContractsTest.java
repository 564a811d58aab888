package io.modelpipe.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelpipe.model.JobKind;
import io.modelpipe.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class JobContractsTest {

    @Test
    void kindMustBeKnown() {
        Assertions.assertEquals(JobKind.GLTF_CONVERT, JobContracts.normalizeKind("gltf.convert"));
        Assertions.assertEquals(JobKind.TEXTURE_PREFLIGHT, JobContracts.normalizeKind("texture.preflight"));

        JobContractException missing = Assertions.assertThrows(JobContractException.class,
                () -> JobContracts.normalizeKind(" "));
        Assertions.assertEquals("kind is required", missing.getMessage());

        JobContractException unknown = Assertions.assertThrows(JobContractException.class,
                () -> JobContracts.normalizeKind("GLTF.CONVERT"));
        Assertions.assertEquals("kind must be one of: gltf.convert, texture.preflight", unknown.getMessage());
        Assertions.assertEquals(List.of("gltf.convert", "texture.preflight"), unknown.allowedKinds());
    }

    @Test
    void emptyPayloadNormalizesToNull() throws Exception {
        Assertions.assertNull(JobContracts.normalizePayload(JobKind.GLTF_CONVERT, null));
        Assertions.assertNull(JobContracts.normalizePayload(JobKind.GLTF_CONVERT, Jsons.parse("null")));
    }

    @Test
    void conversionPayloadIsValidated() {
        ObjectNode payload = JobContracts.normalizePayload(JobKind.GLTF_CONVERT,
                Jsons.parse("{\"codecId\":\"gltf\",\"optimize\":true}"));
        Assertions.assertEquals("gltf", payload.path("codecId").asText());
        Assertions.assertTrue(payload.path("optimize").asBoolean());

        assertRejected(JobKind.GLTF_CONVERT, "[]", "payload must be an object");
        assertRejected(JobKind.GLTF_CONVERT, "{\"codecId\":\"\"}", "payload.codecId must be a non-empty string");
        assertRejected(JobKind.GLTF_CONVERT, "{\"optimize\":\"yes\"}", "payload.optimize must be a boolean");
        JobContractException unknown = Assertions.assertThrows(JobContractException.class,
                () -> JobContracts.normalizePayload(JobKind.GLTF_CONVERT, Jsons.parse("{\"maxDimension\":64}")));
        Assertions.assertTrue(unknown.getMessage().contains("maxDimension"));
    }

    @Test
    void preflightPayloadIsValidated() {
        ObjectNode payload = JobContracts.normalizePayload(JobKind.TEXTURE_PREFLIGHT,
                Jsons.parse("{\"textureIds\":[\"a\",\"b\"],\"maxDimension\":512,\"allowNonPowerOfTwo\":false}"));
        Assertions.assertEquals(2, payload.path("textureIds").size());
        Assertions.assertEquals(512, payload.path("maxDimension").asInt());

        assertRejected(JobKind.TEXTURE_PREFLIGHT, "{\"textureIds\":[\"a\",\"\"]}",
                "payload.textureIds must be an array of non-empty strings");
        assertRejected(JobKind.TEXTURE_PREFLIGHT, "{\"maxDimension\":0}", "payload.maxDimension must be a positive integer");
        assertRejected(JobKind.TEXTURE_PREFLIGHT, "{\"maxDimension\":1.5}", "payload.maxDimension must be a positive integer");
        assertRejected(JobKind.TEXTURE_PREFLIGHT, "{\"allowNonPowerOfTwo\":1}", "payload.allowNonPowerOfTwo must be a boolean");
    }

    @Test
    void resultKindMustMatchJobKind() {
        JobContractException mismatch = Assertions.assertThrows(JobContractException.class,
                () -> JobContracts.normalizeResult(JobKind.GLTF_CONVERT, Jsons.parse("{\"kind\":\"texture.preflight\"}")));
        Assertions.assertEquals("result.kind must be 'gltf.convert'", mismatch.getMessage());
        Assertions.assertNull(JobContracts.normalizeResult(JobKind.GLTF_CONVERT, null));
    }

    @Test
    void conversionResultKeepsContractFieldsOnly() {
        JsonNode raw = Jsons.parse("""
                {
                  "kind": "gltf.convert",
                  "status": "converted",
                  "processedBy": "worker-a",
                  "attemptCount": 2,
                  "hasGeometry": true,
                  "geometryDelta": {"bones": 1, "cubes": -2},
                  "animations": [{"id": "walk", "name": "Walk", "length": 1.5, "loop": true}],
                  "diagnostics": ["ok"],
                  "output": {"exportPath": "out/model.gltf"},
                  "extra": {"nested": true}
                }
                """);
        ObjectNode result = JobContracts.normalizeResult(JobKind.GLTF_CONVERT, raw);
        Assertions.assertEquals("converted", result.path("status").asText());
        Assertions.assertEquals("worker-a", result.path("processedBy").asText());
        Assertions.assertEquals(-2, result.path("geometryDelta").path("cubes").asInt());
        Assertions.assertEquals(1.5, result.path("animations").get(0).path("length").asDouble());
        Assertions.assertEquals("out/model.gltf", result.path("output").path("exportPath").asText());
        Assertions.assertFalse(result.has("extra"));
    }

    @Test
    void conversionResultRejectsMalformedNestedValues() {
        assertResultRejected(JobKind.GLTF_CONVERT, "{\"kind\":\"gltf.convert\",\"status\":\"done\"}",
                "result.status must be one of: converted, noop, failed");
        assertResultRejected(JobKind.GLTF_CONVERT, "{\"kind\":\"gltf.convert\",\"attemptCount\":0}",
                "result.attemptCount must be a positive integer");
        assertResultRejected(JobKind.GLTF_CONVERT,
                "{\"kind\":\"gltf.convert\",\"hierarchy\":[{\"id\":\"a\",\"name\":\"a\",\"kind\":\"mesh\",\"children\":[]}]}",
                "result.hierarchy node.kind must be 'bone' or 'cube'");
        assertResultRejected(JobKind.GLTF_CONVERT,
                "{\"kind\":\"gltf.convert\",\"animations\":[{\"id\":\"a\",\"name\":\"a\",\"length\":-1,\"loop\":true}]}",
                "result.animations[0].length must be a non-negative number");
        assertResultRejected(JobKind.GLTF_CONVERT, "{\"kind\":\"gltf.convert\",\"diagnostics\":[1]}",
                "result.diagnostics must be an array of strings");
    }

    @Test
    void preflightResultValidatesSummary() {
        ObjectNode result = JobContracts.normalizeResult(JobKind.TEXTURE_PREFLIGHT, Jsons.parse(
                "{\"kind\":\"texture.preflight\",\"status\":\"failed\",\"summary\":{\"checked\":3,\"oversized\":1,\"nonPowerOfTwo\":0}}"));
        Assertions.assertEquals(3, result.path("summary").path("checked").asInt());

        assertResultRejected(JobKind.TEXTURE_PREFLIGHT,
                "{\"kind\":\"texture.preflight\",\"summary\":{\"checked\":3,\"oversized\":-1,\"nonPowerOfTwo\":0}}",
                "result.summary.oversized must be a non-negative integer");
        assertResultRejected(JobKind.TEXTURE_PREFLIGHT, "{\"kind\":\"texture.preflight\",\"status\":\"converted\"}",
                "result.status must be one of: passed, failed");
    }

    private static void assertRejected(JobKind kind, String json, String message) {
        JobContractException error = Assertions.assertThrows(JobContractException.class,
                () -> JobContracts.normalizePayload(kind, Jsons.parse(json)));
        Assertions.assertEquals(message, error.getMessage());
        Assertions.assertEquals(JobContractException.CODE, error.code());
    }

    private static void assertResultRejected(JobKind kind, String json, String message) {
        JobContractException error = Assertions.assertThrows(JobContractException.class,
                () -> JobContracts.normalizeResult(kind, Jsons.parse(json)));
        Assertions.assertEquals(message, error.getMessage());
    }
}
