package com.streamengine.dpa.api;

/** A series whose time axis is unusable: wrong length, or no valid timestamp. */
public class MalformedSeriesException extends DataProductException {
    private final int parameterId;

    public MalformedSeriesException(int parameterId, int timeCount, int rowCount) {
        super("Parameter " + parameterId + " has " + timeCount + " timestamps but " + rowCount + " rows");
        this.parameterId = parameterId;
    }

    public MalformedSeriesException(int parameterId, String problem) {
        super("Parameter " + parameterId + " " + problem);
        this.parameterId = parameterId;
    }

    public int parameterId() {
        return parameterId;
    }
}
