package com.frauddetection.hypersearch.engine;

import com.frauddetection.hypersearch.domain.ExperimentRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, append-only log of one run's experiments.
 * Experiment ids are 1-based and equal to the record's position; the log never
 * grows past its capacity and is never reordered.
 */
public class ExperimentLog {

    private final int capacity;
    private final List<ExperimentRecord> records = new ArrayList<>();

    public ExperimentLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized int nextExperimentId() {
        return records.size() + 1;
    }

    public synchronized void append(ExperimentRecord record) {
        if (records.size() >= capacity) {
            throw new IllegalStateException("Experiment log is full (" + capacity + ")");
        }
        if (record.getExperimentId() != records.size() + 1) {
            throw new IllegalStateException("Out of order experiment id " + record.getExperimentId()
                    + ", expected " + (records.size() + 1));
        }
        records.add(record);
    }

    /**
     * Copy of the records in insertion order.
     */
    public synchronized List<ExperimentRecord> records() {
        return List.copyOf(records);
    }

    public synchronized int size() {
        return records.size();
    }

    public int capacity() {
        return capacity;
    }
}
