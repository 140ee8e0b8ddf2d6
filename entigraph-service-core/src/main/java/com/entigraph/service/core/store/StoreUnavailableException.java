package com.entigraph.service.core.store;

/** The backing store could not be reached or refused a write; callers may retry. */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
