package com.frauddetection.hypersearch.engine;

import com.frauddetection.hypersearch.domain.ExperimentRecord;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the single best completed experiment. Strictly greater wins, so ties keep
 * the earlier record; failed records are ignored.
 */
@Slf4j
public class BestResultTracker {

    private ExperimentRecord best;

    /**
     * @return true if the record became the new best
     */
    public boolean offer(ExperimentRecord record) {
        if (record == null || !record.isCompleted()) {
            return false;
        }
        if (best == null || record.getScore() > best.getScore()) {
            best = record;
            log.info("New best score {} from experiment {}",
                    String.format("%.4f", record.getScore()), record.getExperimentId());
            return true;
        }
        return false;
    }

    public ExperimentRecord getBest() {
        return best;
    }

    public void reset() {
        best = null;
    }
}
