package com.frauddetection.hypersearch.exception;

import com.frauddetection.hypersearch.domain.SearchStatus;
import lombok.Getter;

/**
 * Thrown when a lifecycle operation is not permitted in the current search status.
 */
@Getter
public class SearchStateException extends RuntimeException {

    private final SearchStatus status;

    public SearchStateException(String message, SearchStatus status) {
        super(message);
        this.status = status;
    }
}
