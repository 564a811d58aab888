package io.modelpipe.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Immutable view of a job. {@code payload} and {@code result} are deep-copied on the way in and out.
 */
public record Job(
        String id,
        String projectId,
        JobKind kind,
        JsonNode payload,
        JobStatus status,
        int attemptCount,
        int maxAttempts,
        long leaseMs,
        long createdAtMs,
        Long startedAtMs,
        Long leaseExpiresAtMs,
        Long nextRetryAtMs,
        Long completedAtMs,
        String workerId,
        JsonNode result,
        String error,
        boolean deadLetter
) {
    public Job {
        payload = payload == null ? null : payload.deepCopy();
        result = result == null ? null : result.deepCopy();
    }

    @Override
    public JsonNode payload() {
        return payload == null ? null : payload.deepCopy();
    }

    @Override
    public JsonNode result() {
        return result == null ? null : result.deepCopy();
    }

    public ActiveJob asActiveJob() {
        return new ActiveJob(id, status);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String projectId;
        private JobKind kind;
        private JsonNode payload;
        private JobStatus status = JobStatus.QUEUED;
        private int attemptCount;
        private int maxAttempts;
        private long leaseMs;
        private long createdAtMs;
        private Long startedAtMs;
        private Long leaseExpiresAtMs;
        private Long nextRetryAtMs;
        private Long completedAtMs;
        private String workerId;
        private JsonNode result;
        private String error;
        private boolean deadLetter;

        private Builder() {
        }

        private Builder(Job job) {
            this.id = job.id;
            this.projectId = job.projectId;
            this.kind = job.kind;
            this.payload = job.payload;
            this.status = job.status;
            this.attemptCount = job.attemptCount;
            this.maxAttempts = job.maxAttempts;
            this.leaseMs = job.leaseMs;
            this.createdAtMs = job.createdAtMs;
            this.startedAtMs = job.startedAtMs;
            this.leaseExpiresAtMs = job.leaseExpiresAtMs;
            this.nextRetryAtMs = job.nextRetryAtMs;
            this.completedAtMs = job.completedAtMs;
            this.workerId = job.workerId;
            this.result = job.result;
            this.error = job.error;
            this.deadLetter = job.deadLetter;
        }

        public Builder id(String value) {
            this.id = value;
            return this;
        }

        public Builder projectId(String value) {
            this.projectId = value;
            return this;
        }

        public Builder kind(JobKind value) {
            this.kind = value;
            return this;
        }

        public Builder payload(JsonNode value) {
            this.payload = value;
            return this;
        }

        public Builder status(JobStatus value) {
            this.status = value;
            return this;
        }

        public Builder attemptCount(int value) {
            this.attemptCount = value;
            return this;
        }

        public Builder maxAttempts(int value) {
            this.maxAttempts = value;
            return this;
        }

        public Builder leaseMs(long value) {
            this.leaseMs = value;
            return this;
        }

        public Builder createdAtMs(long value) {
            this.createdAtMs = value;
            return this;
        }

        public Builder startedAtMs(Long value) {
            this.startedAtMs = value;
            return this;
        }

        public Builder leaseExpiresAtMs(Long value) {
            this.leaseExpiresAtMs = value;
            return this;
        }

        public Builder nextRetryAtMs(Long value) {
            this.nextRetryAtMs = value;
            return this;
        }

        public Builder completedAtMs(Long value) {
            this.completedAtMs = value;
            return this;
        }

        public Builder workerId(String value) {
            this.workerId = value;
            return this;
        }

        public Builder result(JsonNode value) {
            this.result = value;
            return this;
        }

        public Builder error(String value) {
            this.error = value;
            return this;
        }

        public Builder deadLetter(boolean value) {
            this.deadLetter = value;
            return this;
        }

        public Job build() {
            return new Job(id, projectId, kind, payload, status, attemptCount, maxAttempts, leaseMs, createdAtMs,
                    startedAtMs, leaseExpiresAtMs, nextRetryAtMs, completedAtMs, workerId, result, error, deadLetter);
        }
    }
}
