package com.streamengine.dpa.api;

/**
 * Base class for failures raised while building a data product.
 *
 * Apart from {@link CatalogCycleException}, these are per-parameter: the
 * engine records them on the affected instance and keeps going.
 */
public class DataProductException extends RuntimeException {

    public DataProductException(String message) {
        super(message);
    }

    public DataProductException(String message, Throwable cause) {
        super(message, cause);
    }
}
