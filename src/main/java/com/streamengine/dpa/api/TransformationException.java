package com.streamengine.dpa.api;

/** A transformation function failed or returned an unusable result. */
public class TransformationException extends DataProductException {
    private final String function;

    public TransformationException(String function, String message) {
        super(function + ": " + message);
        this.function = function;
    }

    public TransformationException(String function, String message, Throwable cause) {
        super(function + ": " + message, cause);
        this.function = function;
    }

    public String function() {
        return function;
    }
}
