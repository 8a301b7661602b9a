package com.frauddetection.hypersearch.engine;

import com.frauddetection.hypersearch.domain.SearchState;

/**
 * Receives a snapshot after every recorded experiment and once more when a run ends.
 */
@FunctionalInterface
public interface SearchStateListener {

    void onStateChanged(SearchState state);
}
