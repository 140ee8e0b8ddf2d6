package com.entigraph.entity.guid;

/** Raised when a token cannot be decoded into an entity identity. */
public class InvalidGuidException extends IllegalArgumentException {

    private final String guid;

    public InvalidGuidException(String guid, String message) {
        super(message);
        this.guid = guid;
    }

    public InvalidGuidException(String guid, String message, Throwable cause) {
        super(message, cause);
        this.guid = guid;
    }

    public String guid() {
        return guid;
    }
}
