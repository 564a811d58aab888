package io.modelpipe.pipeline;

import io.modelpipe.config.PipelineConfig;
import io.modelpipe.model.Project;
import io.modelpipe.model.ProjectLock;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Exclusive editor locks, one per project. A lock change visible to readers (owner, session, mode or token)
 * is mirrored onto the project snapshot and emits one event; heartbeat-only renewals do not.
 */
public final class ProjectLockRepository {
    private static final int MAX_OWNER_ID_LENGTH = 128;

    private final PipelineState state;
    private final EventLog eventLog;
    private final Clock clock;

    public ProjectLockRepository(PipelineState state, EventLog eventLog, Clock clock) {
        this.state = state;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    public boolean hasExpired() {
        long nowMs = clock.millis();
        for (ProjectLock lock : state.locks.values()) {
            if (lock.expired(nowMs)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return ids of the projects whose lock was released
     */
    public List<String> releaseExpired() {
        long nowMs = clock.millis();
        List<String> released = new ArrayList<>();
        Iterator<Map.Entry<String, ProjectLock>> it = state.locks.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, ProjectLock> entry = it.next();
            if (!entry.getValue().expired(nowMs)) {
                continue;
            }
            it.remove();
            released.add(entry.getKey());
        }
        for (String projectId : released) {
            syncProjectLock(projectId, null);
        }
        return released;
    }

    public ProjectLock get(String projectId) {
        ProjectLock lock = state.locks.get(projectId);
        if (lock == null || lock.expired(clock.millis())) {
            return null;
        }
        return lock;
    }

    public ProjectLock acquire(String projectId, String ownerAgentId, String ownerSessionId, Number ttlMs) {
        releaseExpired();
        String agentId = normalizeOwnerAgentId(ownerAgentId);
        String sessionId = normalizeOwnerSessionId(ownerSessionId);
        long ttl = clampTtl(ttlMs);

        ProjectLock existing = state.locks.get(projectId);
        ProjectLock next;
        if (existing != null) {
            if (!existing.ownedBy(agentId, sessionId)) {
                throw new ProjectLockConflictException(projectId, existing);
            }
            next = buildLock(agentId, sessionId, ttl, existing.acquiredAtMs(), existing.token());
        } else {
            next = buildLock(agentId, sessionId, ttl, null, null);
        }
        state.locks.put(projectId, next);
        syncProjectLock(projectId, next);
        return next;
    }

    public ProjectLock renew(String projectId, String ownerAgentId, String ownerSessionId, Number ttlMs) {
        releaseExpired();
        String agentId = normalizeOwnerAgentId(ownerAgentId);
        String sessionId = normalizeOwnerSessionId(ownerSessionId);
        long ttl = clampTtl(ttlMs);

        ProjectLock existing = state.locks.get(projectId);
        if (existing == null || !existing.ownedBy(agentId, sessionId)) {
            return null;
        }
        ProjectLock renewed = buildLock(agentId, sessionId, ttl, existing.acquiredAtMs(), existing.token());
        state.locks.put(projectId, renewed);
        syncProjectLock(projectId, renewed);
        return renewed;
    }

    public boolean release(String projectId, String ownerAgentId, String ownerSessionId) {
        releaseExpired();
        String agentId = normalizeOwnerAgentId(ownerAgentId);
        String sessionId = normalizeOwnerSessionId(ownerSessionId);

        ProjectLock existing = state.locks.get(projectId);
        if (existing == null || !existing.ownedBy(agentId, sessionId)) {
            return false;
        }
        state.locks.remove(projectId);
        syncProjectLock(projectId, null);
        return true;
    }

    /**
     * Releases every lock held by the agent; with {@code matchSession} only those held under {@code ownerSessionId}.
     */
    public int releaseByOwner(String ownerAgentId, String ownerSessionId, boolean matchSession) {
        releaseExpired();
        String agentId = normalizeOwnerAgentId(ownerAgentId);
        String sessionId = normalizeOwnerSessionId(ownerSessionId);

        List<String> released = new ArrayList<>();
        for (Map.Entry<String, ProjectLock> entry : state.locks.entrySet()) {
            ProjectLock lock = entry.getValue();
            if (!lock.ownerAgentId().equals(agentId)) {
                continue;
            }
            if (matchSession && !Objects.equals(lock.ownerSessionId(), sessionId)) {
                continue;
            }
            released.add(entry.getKey());
        }
        for (String projectId : released) {
            state.locks.remove(projectId);
            syncProjectLock(projectId, null);
        }
        return released.size();
    }

    private void syncProjectLock(String projectId, ProjectLock next) {
        Project project = state.projects.get(projectId);
        if (project == null || !hasVisibleDiff(project.projectLock(), next)) {
            return;
        }
        Project updated = project.withProjectLock(next);
        state.projects.put(projectId, updated);
        eventLog.append(updated);
    }

    private ProjectLock buildLock(String agentId, String sessionId, long ttlMs, Long acquiredAtMs, String token) {
        long nowMs = clock.millis();
        return new ProjectLock(
                agentId,
                sessionId,
                token == null ? UUID.randomUUID().toString() : token,
                acquiredAtMs == null ? nowMs : acquiredAtMs,
                nowMs,
                nowMs + ttlMs,
                ProjectLock.MODE_MCP
        );
    }

    private static boolean hasVisibleDiff(ProjectLock previous, ProjectLock next) {
        if (previous == null && next == null) {
            return false;
        }
        if (previous == null || next == null) {
            return true;
        }
        return !previous.ownerAgentId().equals(next.ownerAgentId())
                || !Objects.equals(previous.ownerSessionId(), next.ownerSessionId())
                || !previous.mode().equals(next.mode())
                || !previous.token().equals(next.token());
    }

    static long clampTtl(Number ttlMs) {
        return Clamp.integer(ttlMs, PipelineConfig.DEFAULT_LOCK_TTL_MS,
                PipelineConfig.MIN_LOCK_TTL_MS, PipelineConfig.MAX_LOCK_TTL_MS);
    }

    static String normalizeOwnerAgentId(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("ownerAgentId is required.");
        }
        return truncate(trimmed);
    }

    static String normalizeOwnerSessionId(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : truncate(trimmed);
    }

    private static String truncate(String value) {
        return value.length() > MAX_OWNER_ID_LENGTH ? value.substring(0, MAX_OWNER_ID_LENGTH) : value;
    }
}
