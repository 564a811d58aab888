package io.modelpipe.pipeline;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Index of job ids waiting for a claim attempt, ordered by the time each becomes due and then by enqueue order.
 * It is only an index: the job table stays the source of truth and stale entries are tolerated.
 */
public final class PendingJobQueue {
    private static final Comparator<Entry> ORDER = Comparator
            .comparingLong(Entry::dueAtMs)
            .thenComparingLong(Entry::enqueueOrder);

    private final TreeSet<Entry> ordered = new TreeSet<>(ORDER);
    private final Map<String, Entry> byJobId = new HashMap<>();
    private long enqueueCounter;

    /**
     * Adds the job id, or moves it to {@code dueAtMs} when it is already indexed.
     */
    public void offer(String jobId, long dueAtMs) {
        Entry previous = byJobId.remove(jobId);
        if (previous != null) {
            ordered.remove(previous);
        }
        Entry entry = new Entry(jobId, dueAtMs, enqueueCounter++);
        ordered.add(entry);
        byJobId.put(jobId, entry);
    }

    /**
     * Removes and returns the first id due at or before {@code nowMs}, or {@code null} when none is due.
     */
    public String pollDue(long nowMs) {
        if (ordered.isEmpty()) {
            return null;
        }
        Entry first = ordered.first();
        if (first.dueAtMs() > nowMs) {
            return null;
        }
        ordered.pollFirst();
        byJobId.remove(first.jobId());
        return first.jobId();
    }

    public boolean remove(String jobId) {
        Entry entry = byJobId.remove(jobId);
        if (entry == null) {
            return false;
        }
        ordered.remove(entry);
        return true;
    }

    public boolean contains(String jobId) {
        return byJobId.containsKey(jobId);
    }

    public List<String> orderedIds() {
        List<String> out = new ArrayList<>(ordered.size());
        for (Entry entry : ordered) {
            out.add(entry.jobId());
        }
        return out;
    }

    public int size() {
        return byJobId.size();
    }

    public void clear() {
        ordered.clear();
        byJobId.clear();
        enqueueCounter = 0;
    }

    private record Entry(String jobId, long dueAtMs, long enqueueOrder) {
    }
}
