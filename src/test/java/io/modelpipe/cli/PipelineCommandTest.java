package io.modelpipe.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.modelpipe.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class PipelineCommandTest {

    @Test
    void submitClaimCompleteThroughCli() throws Exception {
        Path root = Files.createTempDirectory("modelpipe-test-cli-");
        try {
            Assertions.assertEquals(0, run(root, "init").exitCode());
            Assertions.assertTrue(Files.exists(root.resolve("modelpipe.db")));

            Result submitted = run(root, "submit", "--project", "p1", "--kind", "gltf.convert",
                    "--payload", "{\"codecId\":\"gltf\"}", "--max-attempts", "2");
            Assertions.assertEquals(0, submitted.exitCode());
            JsonNode job = Jsons.parse(submitted.out());
            Assertions.assertEquals("job-1", job.path("id").asText());
            Assertions.assertEquals("queued", job.path("status").asText());
            Assertions.assertEquals(2, job.path("maxAttempts").asInt());

            Result claimed = run(root, "claim", "--worker", "worker-a");
            Assertions.assertEquals("running", Jsons.parse(claimed.out()).path("status").asText());

            Result completed = run(root, "complete", "job-1", "--result",
                    "{\"kind\":\"gltf.convert\",\"output\":{\"exportPath\":\"/out/model.gltf\"}}");
            Assertions.assertEquals(0, completed.exitCode());
            JsonNode completion = Jsons.parse(completed.out());
            Assertions.assertEquals("completed", completion.path("job").path("status").asText());
            Assertions.assertEquals("default/p1/out/model.gltf", completion.path("exportKey").asText());

            JsonNode projects = Jsons.parse(run(root, "projects").out());
            Assertions.assertEquals(1, projects.size());
            Assertions.assertEquals(2, projects.get(0).path("revision").asInt());

            Result events = run(root, "events", "p1", "--last-event-id", "1000");
            Assertions.assertTrue(events.out().startsWith("id: 1001\nevent: project_snapshot\ndata: "));

            JsonNode state = Jsons.parse(run(root, "export-state").out());
            Assertions.assertEquals(2, state.path("version").asInt());
            Assertions.assertEquals(1, state.path("jobs").size());

            Assertions.assertEquals(0, run(root, "audit-verify").exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void contractViolationsAndMissingJobsReturnNonZero() throws Exception {
        Path root = Files.createTempDirectory("modelpipe-test-cli-errors-");
        try {
            Result badKind = run(root, "submit", "--project", "p1", "--kind", "mesh.bake");
            Assertions.assertEquals(2, badKind.exitCode());
            Assertions.assertEquals("invalid_payload", Jsons.parse(badKind.out()).path("code").asText());

            Result badJson = run(root, "submit", "--project", "p1", "--kind", "gltf.convert", "--payload", "{oops");
            Assertions.assertEquals(2, badJson.exitCode());

            Assertions.assertEquals(1, run(root, "job", "job-9").exitCode());
            Assertions.assertEquals(1, run(root, "fail", "job-9", "--error", "boom").exitCode());
            Assertions.assertEquals(1, run(root, "events", "ghost").exitCode());
            Assertions.assertEquals("{\"claimed\":false}", run(root, "claim", "--worker", "w").out().trim());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            int code = new CommandLine(new PipelineCommand()).execute(full);
            return new Result(code, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
        }
    }

    private record Result(int exitCode, String out) {
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
