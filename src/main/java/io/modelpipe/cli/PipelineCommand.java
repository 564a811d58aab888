package io.modelpipe.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelpipe.config.PipelineConfig;
import io.modelpipe.model.Job;
import io.modelpipe.model.JobSubmission;
import io.modelpipe.model.Project;
import io.modelpipe.model.ProjectFolder;
import io.modelpipe.observability.AuditLogger;
import io.modelpipe.pipeline.JobContractException;
import io.modelpipe.pipeline.ProjectTreeException;
import io.modelpipe.storage.Database;
import io.modelpipe.storage.DurablePipelineStore;
import io.modelpipe.stream.ExportKeys;
import io.modelpipe.stream.ProjectEventStream;
import io.modelpipe.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "modelpipe",
        mixinStandardHelpOptions = true,
        description = "ModelPipe job queue and project event log CLI",
        subcommands = {
                PipelineCommand.InitCommand.class,
                PipelineCommand.SubmitCommand.class,
                PipelineCommand.ClaimCommand.class,
                PipelineCommand.CompleteCommand.class,
                PipelineCommand.FailCommand.class,
                PipelineCommand.JobCommand.class,
                PipelineCommand.JobsCommand.class,
                PipelineCommand.ProjectsCommand.class,
                PipelineCommand.CreateProjectCommand.class,
                PipelineCommand.CreateFolderCommand.class,
                PipelineCommand.TreeCommand.class,
                PipelineCommand.EventsCommand.class,
                PipelineCommand.ExportStateCommand.class,
                PipelineCommand.AuditVerifyCommand.class,
                PipelineCommand.SchemaMigrationsCommand.class
        }
)
public final class PipelineCommand implements Runnable {

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--scope"}, description = "State document scope", defaultValue = PipelineConfig.DEFAULT_SCOPE)
    String scope;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | submit | claim | complete | fail | job | jobs | projects | create-project | create-folder | tree | events | export-state | audit-verify | schema-migrations");
    }

    PipelineConfig config() {
        return PipelineConfig.fromRoot(root, scope);
    }

    DurablePipelineStore store() {
        return DurablePipelineStore.open(config());
    }

    static void printError(String code, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", message);
        error.put("code", code);
        System.out.println(Jsons.toJson(error));
    }

    static JsonNode parseJsonOption(String name, String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Jsons.parse(raw);
        } catch (RuntimeException e) {
            throw new JobContractException(name + " must be valid JSON");
        }
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        PipelineCommand parent;

        @Override
        public Integer call() {
            Database database = new Database(parent.config());
            database.init();
            System.out.println("Initialized ModelPipe at: " + parent.config().rootDir());
            return 0;
        }
    }

    @Command(name = "submit", description = "Submit a job for a project")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        PipelineCommand parent;

        @Option(names = {"--project"}, required = true, description = "Target project id")
        String projectId;

        @Option(names = {"--kind"}, required = true, description = "Job kind: gltf.convert|texture.preflight")
        String kind;

        @Option(names = {"--payload"}, description = "Optional JSON payload")
        String payload;

        @Option(names = {"--max-attempts"}, description = "Attempts before dead-lettering (1..10)")
        Integer maxAttempts;

        @Option(names = {"--lease-ms"}, description = "Lease duration in ms (5000..300000)")
        Long leaseMs;

        @Override
        public Integer call() {
            try {
                Job job = parent.store().submitJob(new JobSubmission(
                        projectId, kind, parseJsonOption("payload", payload), maxAttempts, leaseMs));
                System.out.println(Jsons.toJson(job));
                return 0;
            } catch (JobContractException e) {
                printError(e.code(), e.getMessage());
                return 2;
            }
        }
    }

    @Command(name = "claim", description = "Claim the next due job for a worker")
    static final class ClaimCommand implements Callable<Integer> {
        @ParentCommand
        PipelineCommand parent;

        @Option(names = {"--worker"}, required = true, description = "Worker id")
        String workerId;

        @Override
        public Integer call() {
            Job job = parent.store().claimNextJob(workerId);
            if (job == null) {
                System.out.println("{\"claimed\":false}");
                return 0;
            }
            System.out.println(Jsons.toJson(job));
            return 0;
        }
    }

    @Command(name = "complete", description = "Complete a job with an optional JSON result")
    static final class CompleteCommand implements Callable<Integer> {
        @ParentCommand
        PipelineCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Option(names = {"--result"}, description = "Optional JSON result")
        String result;

        @Override
        public Integer call() {
            Job job;
            try {
                job = parent.store().completeJob(jobId, parseJsonOption("result", result));
            } catch (JobContractException e) {
                printError(e.code(), e.getMessage());
                return 2;
            }
            if (job == null) {
                printError("not_found", "job not found");
                return 1;
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("job", job);
            String exportPath = ExportKeys.readExportPath(job);
            if (exportPath != null) {
                out.put("exportKey", ExportKeys.buildExportKey(PipelineConfig.DEFAULT_TENANT_ID, job.projectId(), exportPath));
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "fail", description = "Fail a job; it is retried with backoff until attempts run out")
    static final class FailCommand implements Callable<Integer> {
        @ParentCommand
        PipelineCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Option(names = {"--error"}, description = "Failure message")
        String error;

        @Override
        public Integer call() {
            Job job = parent.store().failJob(jobId, error);
            if (job == null) {
                printError("not_found", "job not found");
                return 1;
            }
            System.out.println(Jsons.toJson(job));
            return 0;
        }
    }

    @Command(name = "job", description = "Query a job by id")
    static final class JobCommand implements Callable<Integer> {
        @ParentCommand
        PipelineCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            Job job = parent.store().getJob(jobId);
            if (job == null) {
                printError("not_found", "job not found");
                return 1;
            }
            System.out.println(Jsons.toJson(job));
            return 0;
        }
    }

    @Command(name = "jobs", description = "List jobs of a project")
    static final class JobsCommand implements Callable<Integer> {
        @ParentCommand
        PipelineCommand parent;

        @Parameters(index = "0", description = "Project id")
        String projectId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.store().listProjectJobs(projectId)));
            return 0;
        }
    }

    @Command(name = "projects", description = "List projects, optionally filtered by id or name")
    static final class ProjectsCommand implements Callable<Integer> {
        @ParentCommand
        PipelineCommand parent;

        @Option(names = {"--query"}, description = "Case-insensitive id/name filter")
        String query;

        @Override
        public Integer call() {
            List<Project> projects = parent.store().listProjects(query);
            System.out.println(Jsons.toJson(projects));
            return 0;
        }
    }

    @Command(name = "create-project", description = "Create a project, optionally inside a folder")
    static final class CreateProjectCommand implements Callable<Integer> {
        @ParentCommand
        PipelineCommand parent;

        @Option(names = {"--name"}, description = "Project name")
        String name;

        @Option(names = {"--parent"}, description = "Parent folder id")
        String parentFolderId;

        @Option(names = {"--index"}, description = "Position among the parent's children")
        Integer index;

        @Override
        public Integer call() {
            try {
                Project project = parent.store().createProject(name, parentFolderId, index);
                System.out.println(Jsons.toJson(project));
                return 0;
            } catch (ProjectTreeException e) {
                printError("invalid_tree", e.getMessage());
                return 2;
            }
        }
    }

    @Command(name = "create-folder", description = "Create a folder, optionally inside another folder")
    static final class CreateFolderCommand implements Callable<Integer> {
        @ParentCommand
        PipelineCommand parent;

        @Option(names = {"--name"}, description = "Folder name")
        String name;

        @Option(names = {"--parent"}, description = "Parent folder id")
        String parentFolderId;

        @Option(names = {"--index"}, description = "Position among the parent's children")
        Integer index;

        @Override
        public Integer call() {
            try {
                ProjectFolder folder = parent.store().createFolder(name, parentFolderId, index);
                System.out.println(Jsons.toJson(folder));
                return 0;
            } catch (ProjectTreeException e) {
                printError("invalid_tree", e.getMessage());
                return 2;
            }
        }
    }

    @Command(name = "tree", description = "Show the folder/project tree")
    static final class TreeCommand implements Callable<Integer> {
        @ParentCommand
        PipelineCommand parent;

        @Option(names = {"--query"}, description = "Case-insensitive id/name filter")
        String query;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.store().getProjectTree(query)));
            return 0;
        }
    }

    @Command(name = "events", description = "Print stream frames for a project after a cursor")
    static final class EventsCommand implements Callable<Integer> {
        @ParentCommand
        PipelineCommand parent;

        @Parameters(index = "0", description = "Project id")
        String projectId;

        @Option(names = {"--last-event-id"}, description = "Last seen event id; omitted means none yet")
        String lastEventId;

        @Override
        public Integer call() {
            long cursor = ProjectEventStream.normalizeLastEventId(ProjectEventStream.parseLastEventId(lastEventId));
            ProjectEventStream stream = new ProjectEventStream(parent.store(), projectId, cursor);
            List<ProjectEventStream.Frame> frames = stream.resume();
            if (frames == null) {
                printError("project_load_failed", "Project not found: " + projectId);
                return 1;
            }
            for (ProjectEventStream.Frame frame : frames) {
                System.out.print(frame.format());
            }
            return 0;
        }
    }

    @Command(name = "export-state", description = "Print the persisted state document")
    static final class ExportStateCommand implements Callable<Integer> {
        @ParentCommand
        PipelineCommand parent;

        @Override
        public Integer call() {
            ObjectNode state = parent.store().exportState();
            System.out.println(Jsons.toJson(state));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        PipelineCommand parent;

        @Override
        public Integer call() {
            AuditLogger.ChainVerification out = new AuditLogger(parent.config().auditLogFile()).verify();
            System.out.println(Jsons.toJson(out));
            return out.valid() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema migration versions")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        PipelineCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            Database database = new Database(parent.config());
            database.init();
            System.out.println(Jsons.toJson(database.listSchemaMigrations(limit)));
            return 0;
        }
    }
}
