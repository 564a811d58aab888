package io.modelpipe.pipeline;

import java.time.Clock;

/**
 * The repositories bound to one {@link PipelineState}. Stores hand an instance to each mutation or read
 * while holding their exclusion.
 */
public final class PipelineOperations {
    private final PipelineState state;
    private final EventLog eventLog;
    private final ProjectTreeRepository tree;
    private final JobQueue jobs;
    private final ProjectLockRepository locks;

    public PipelineOperations(PipelineState state, Clock clock) {
        this.state = state;
        this.eventLog = new EventLog(state);
        this.tree = new ProjectTreeRepository(state, eventLog);
        this.jobs = new JobQueue(state, eventLog, tree, clock);
        this.locks = new ProjectLockRepository(state, eventLog, clock);
    }

    public PipelineState state() {
        return state;
    }

    public EventLog eventLog() {
        return eventLog;
    }

    public ProjectTreeRepository tree() {
        return tree;
    }

    public JobQueue jobs() {
        return jobs;
    }

    public ProjectLockRepository locks() {
        return locks;
    }

    public void reset() {
        state.clear();
    }
}
