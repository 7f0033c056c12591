package com.streamengine.dpa.api;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Source of raw instrument samples.
 *
 * A fetch returns one row per sample in time order. Each row maps column
 * names to values; the {@code time} column holds the sample timestamp in
 * seconds, the remaining columns are named after data parameters.
 */
public interface RawDataStore {

    /** Name of the timestamp column every row carries. */
    String TIME_COLUMN = "time";

    /**
     * Starts an asynchronous fetch of all rows of a stream with
     * {@code start <= time <= end}.
     *
     * @return a future that completes with the rows, or exceptionally with a
     *         {@link FetchException}
     */
    CompletableFuture<List<Map<String, Object>>> fetch(StreamKey key, double start, double end);
}
