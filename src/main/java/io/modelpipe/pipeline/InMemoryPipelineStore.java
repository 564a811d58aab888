package io.modelpipe.pipeline;

import io.modelpipe.observability.AuditLogger;

import java.time.Clock;
import java.util.function.Function;

/**
 * Process-local store. Every operation runs under the instance monitor, so the pending-queue pop, the status
 * check and the switch to running are never interleaved between callers.
 */
public final class InMemoryPipelineStore extends AbstractPipelineStore {
    private final PipelineOperations operations;

    public InMemoryPipelineStore() {
        this(Clock.systemUTC(), null);
    }

    public InMemoryPipelineStore(Clock clock, AuditLogger auditLogger) {
        super(auditLogger);
        this.operations = new PipelineOperations(new PipelineState(), clock);
    }

    @Override
    protected synchronized <T> T mutate(Function<PipelineOperations, T> mutation) {
        return mutation.apply(operations);
    }

    @Override
    protected synchronized <T> T read(Function<PipelineOperations, T> reader) {
        return reader.apply(operations);
    }
}
