package io.modelpipe.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class PipelineConfig {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int MIN_MAX_ATTEMPTS = 1;
    public static final int MAX_MAX_ATTEMPTS = 10;
    public static final long DEFAULT_LEASE_MS = 30_000L;
    public static final long MIN_LEASE_MS = 5_000L;
    public static final long MAX_LEASE_MS = 300_000L;
    public static final long DEFAULT_BASE_BACKOFF_MS = 250L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 5_000L;
    public static final long DEFAULT_LOCK_TTL_MS = 30_000L;
    public static final long MIN_LOCK_TTL_MS = 5_000L;
    public static final long MAX_LOCK_TTL_MS = 300_000L;
    public static final int DEFAULT_CAS_RETRY_LIMIT = 32;
    public static final int MAX_FOLDER_DEPTH = 3;
    public static final String DEFAULT_SCOPE = "default";
    public static final String DEFAULT_TENANT_ID = "default";

    private final Path rootDir;
    private final String scope;
    private final int casRetryLimit;

    public PipelineConfig(Path rootDir, String scope, int casRetryLimit) {
        this.rootDir = rootDir;
        this.scope = scope == null || scope.isBlank() ? DEFAULT_SCOPE : scope.trim();
        this.casRetryLimit = Math.max(1, casRetryLimit);
    }

    public static PipelineConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_SCOPE);
    }

    public static PipelineConfig fromRoot(String root, String scope) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new PipelineConfig(resolved.toAbsolutePath().normalize(), scope, DEFAULT_CAS_RETRY_LIMIT);
    }

    public PipelineConfig withCasRetryLimit(int limit) {
        return new PipelineConfig(rootDir, scope, limit);
    }

    public Path rootDir() {
        return rootDir;
    }

    /**
     * Key of the state document row; stores sharing a database file and a scope share one state.
     */
    public String scope() {
        return scope;
    }

    public int casRetryLimit() {
        return casRetryLimit;
    }

    public Path dbFile() {
        return rootDir.resolve("modelpipe.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditLogFile() {
        return auditRoot().resolve("audit.log");
    }
}
