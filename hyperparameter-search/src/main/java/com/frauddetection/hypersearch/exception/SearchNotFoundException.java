package com.frauddetection.hypersearch.exception;

public class SearchNotFoundException extends RuntimeException {

    public SearchNotFoundException(Long searchId) {
        super("Search not found: " + searchId);
    }
}
