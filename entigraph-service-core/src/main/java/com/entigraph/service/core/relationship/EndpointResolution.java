package com.entigraph.service.core.relationship;

/** A resolved endpoint GUID, or the reason it could not be resolved. */
public record EndpointResolution(String guid, Failure failure, String detail) {

    public enum Failure {
        ATTRIBUTE_MISSING,
        ACCOUNT_UNRESOLVED,
        INVALID_GUID,
        LOOKUP_NONE,
        LOOKUP_AMBIGUOUS,
        STORE_UNAVAILABLE
    }

    public static EndpointResolution resolved(String guid) {
        return new EndpointResolution(guid, null, null);
    }

    public static EndpointResolution failed(Failure failure, String detail) {
        return new EndpointResolution(null, failure, detail);
    }

    public boolean isResolved() {
        return guid != null;
    }
}
