package com.streamengine.dpa.api;

/** Raw data could not be retrieved from the store. */
public class FetchException extends DataProductException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
