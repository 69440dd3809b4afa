package com.changesentinel.core.report;

import com.changesentinel.core.model.AnomalyReport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded, in-memory history of the most recent reports. Nothing survives a
 * restart.
 *
 * <p>
 * Thread-safe: the orchestrator writes while the HTTP surface reads.
 * </p>
 *
 * @since 1.0.0
 */
public class ReportHistory implements ReportQuery {

    public static final int DEFAULT_CAPACITY = 20;

    private final int capacity;
    private final Deque<AnomalyReport> reports = new ArrayDeque<>();

    public ReportHistory() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @throws IllegalArgumentException if {@code capacity < 1}
     */
    public ReportHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void add(AnomalyReport report) {
        Objects.requireNonNull(report, "AnomalyReport must not be null");
        if (reports.size() == capacity) {
            reports.removeLast();
        }
        reports.addFirst(report);
    }

    @Override
    public synchronized Optional<AnomalyReport> latest() {
        return Optional.ofNullable(reports.peekFirst());
    }

    @Override
    public synchronized List<AnomalyReport> recent(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
        List<AnomalyReport> result = new ArrayList<>(Math.min(limit, reports.size()));
        Iterator<AnomalyReport> it = reports.iterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    @Override
    public synchronized Optional<AnomalyReport> findByCycleId(String cycleId) {
        return reports.stream().filter(r -> r.getCycleId().equals(cycleId)).findFirst();
    }

    public synchronized int size() {
        return reports.size();
    }

    public int capacity() {
        return capacity;
    }
}
