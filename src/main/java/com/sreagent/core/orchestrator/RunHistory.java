package com.sreagent.core.orchestrator;

import com.sreagent.core.model.RunRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, thread-safe log of handled utterances. The oldest record is evicted once the
 * capacity is reached.
 */
public class RunHistory {

    private final int capacity;
    private final Deque<RunRecord> records = new ArrayDeque<>();

    public RunHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void append(RunRecord record) {
        records.addLast(record);
        while (records.size() > capacity) {
            records.removeFirst();
        }
    }

    /**
     * The last {@code limit} records, oldest first.
     */
    public synchronized List<RunRecord> recent(int limit) {
        List<RunRecord> all = new ArrayList<>(records);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    public synchronized int size() {
        return records.size();
    }

    public int capacity() {
        return capacity;
    }
}
