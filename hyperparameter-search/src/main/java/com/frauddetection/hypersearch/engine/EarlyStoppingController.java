package com.frauddetection.hypersearch.engine;

import com.frauddetection.hypersearch.domain.ExperimentRecord;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Rolling-window stagnation check, evaluated after every experiment.
 * Once at least {@code patience} experiments exist, the trailing window's score range
 * (max - min) below {@link #MIN_IMPROVEMENT} signals the search to halt.
 * <p>
 * Failed experiments take part in the window with their score of 0 unless
 * {@code excludeFailed} is set, in which case the window is drawn from completed
 * experiments only.
 */
public class EarlyStoppingController {

    public static final double MIN_IMPROVEMENT = 0.001;

    private final boolean excludeFailed;

    public EarlyStoppingController(boolean excludeFailed) {
        this.excludeFailed = excludeFailed;
    }

    public EarlyStoppingController() {
        this(false);
    }

    public boolean shouldStop(List<ExperimentRecord> experiments, int patience) {
        OptionalDouble range = trailingRange(experiments, patience);
        return range.isPresent() && range.getAsDouble() < MIN_IMPROVEMENT;
    }

    /**
     * Score range over the trailing window, empty until the window is full.
     */
    public OptionalDouble trailingRange(List<ExperimentRecord> experiments, int patience) {
        if (experiments == null || patience < 1) {
            return OptionalDouble.empty();
        }

        List<ExperimentRecord> eligible = excludeFailed
                ? experiments.stream().filter(ExperimentRecord::isCompleted).toList()
                : experiments;

        if (eligible.size() < patience) {
            return OptionalDouble.empty();
        }

        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (ExperimentRecord record : eligible.subList(eligible.size() - patience, eligible.size())) {
            max = Math.max(max, record.getScore());
            min = Math.min(min, record.getScore());
        }
        return OptionalDouble.of(max - min);
    }

    public boolean isExcludeFailed() {
        return excludeFailed;
    }
}
