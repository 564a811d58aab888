package io.modelpipe.pipeline;

import io.modelpipe.MutableClock;
import io.modelpipe.model.ProjectLock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ProjectLockRepositoryTest {

    @Test
    void renewalWithoutVisibleChangeEmitsNoEvent() {
        MutableClock clock = new MutableClock(1_000);
        PipelineOperations ops = new PipelineOperations(new PipelineState(), clock);
        ops.tree().ensureProject("p1");
        ops.locks().acquire("p1", "agent", "s1", null);
        int events = ops.eventLog().since("p1", -1).size();

        clock.advance(10_000);
        ProjectLock renewed = ops.locks().renew("p1", "agent", "s1", 60_000);
        Assertions.assertEquals(clock.millis() + 60_000L, renewed.expiresAtMs());
        Assertions.assertEquals(clock.millis(), renewed.heartbeatAtMs());
        Assertions.assertEquals(events, ops.eventLog().since("p1", -1).size());
        Assertions.assertEquals(1L, ops.tree().getProject("p1").revision());
    }

    @Test
    void expiredLocksAreReleasedWithOneEventEach() {
        MutableClock clock = new MutableClock(0);
        PipelineOperations ops = new PipelineOperations(new PipelineState(), clock);
        ops.tree().ensureProject("p1");
        ops.locks().acquire("p1", "agent", null, 5_000);
        ops.locks().acquire("orphan", "agent", null, 5_000);
        int events = ops.eventLog().since("p1", -1).size();

        clock.advance(4_999);
        Assertions.assertFalse(ops.locks().hasExpired());
        clock.advance(1);
        Assertions.assertTrue(ops.locks().hasExpired());
        Assertions.assertNull(ops.locks().get("p1"));
        Assertions.assertEquals(List.of("p1", "orphan"), ops.locks().releaseExpired());
        Assertions.assertEquals(events + 1, ops.eventLog().since("p1", -1).size());
        Assertions.assertNull(ops.tree().getProject("p1").projectLock());
        Assertions.assertTrue(ops.locks().releaseExpired().isEmpty());
    }

    @Test
    void ownerIdsAreNormalized() {
        Assertions.assertEquals("agent", ProjectLockRepository.normalizeOwnerAgentId("  agent "));
        Assertions.assertEquals(128, ProjectLockRepository.normalizeOwnerAgentId("a".repeat(300)).length());
        Assertions.assertThrows(IllegalArgumentException.class, () -> ProjectLockRepository.normalizeOwnerAgentId(null));
        Assertions.assertNull(ProjectLockRepository.normalizeOwnerSessionId("   "));
        Assertions.assertEquals(5_000L, ProjectLockRepository.clampTtl(10));
        Assertions.assertEquals(300_000L, ProjectLockRepository.clampTtl(1_000_000));
        Assertions.assertEquals(30_000L, ProjectLockRepository.clampTtl(null));
    }
}
