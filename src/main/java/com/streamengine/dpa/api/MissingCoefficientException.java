package com.streamengine.dpa.api;

/** A function parameter declares a calibration coefficient the request did not supply. */
public class MissingCoefficientException extends DataProductException {
    private final int parameterId;
    private final String coefficient;

    public MissingCoefficientException(int parameterId, String coefficient) {
        super("Parameter " + parameterId + " requires missing calibration coefficient " + coefficient);
        this.parameterId = parameterId;
        this.coefficient = coefficient;
    }

    public int parameterId() {
        return parameterId;
    }

    public String coefficient() {
        return coefficient;
    }
}
