package com.streamengine.dpa.store;

import com.streamengine.dpa.api.FetchException;
import com.streamengine.dpa.api.RawDataStore;
import com.streamengine.dpa.api.StreamKey;
import com.streamengine.dpa.io.EngineConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.log4j.Log4j2;

/**
 * Heap-backed {@link RawDataStore}.
 *
 * Rows are kept per stream key and served by a small worker pool, so fetches
 * complete asynchronously just like they would against a remote store. A key
 * can be switched into failure mode to exercise the engine's error paths.
 *
 * Thread Safety:
 * Inserts and fetches may come from any thread.
 */
@Log4j2
public final class InMemoryRawDataStore implements RawDataStore, AutoCloseable {
    private final Map<StreamKey, List<Map<String, Object>>> rows = new ConcurrentHashMap<>();
    private final Map<StreamKey, String> failures = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    public InMemoryRawDataStore() {
        this(new EngineConfig());
    }

    public InMemoryRawDataStore(EngineConfig config) {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, config.getFetchThreads()), r -> {
            Thread t = new Thread(r, "raw-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Appends one sample row; it must carry a {@code time} value. */
    public InMemoryRawDataStore insert(StreamKey key, Map<String, Object> row) {
        if (!(row.get(TIME_COLUMN) instanceof Number))
            throw new IllegalArgumentException("Row for " + key + " has no numeric time: " + row);
        rows.computeIfAbsent(key, k -> Collections.synchronizedList(new ArrayList<>()))
                .add(new LinkedHashMap<>(row));
        return this;
    }

    /** Makes every later fetch for {@code key} fail with the given message. */
    public void failFetches(StreamKey key, String message) {
        failures.put(key, message);
    }

    public int rowCount(StreamKey key) {
        List<Map<String, Object>> stored = rows.get(key);
        return stored == null ? 0 : stored.size();
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> fetch(StreamKey key, double start, double end) {
        return CompletableFuture.supplyAsync(() -> {
            String failure = failures.get(key);
            if (failure != null)
                throw new FetchException("Fetch of " + key + " failed: " + failure);

            List<Map<String, Object>> stored = rows.getOrDefault(key, Collections.emptyList());
            List<Map<String, Object>> out = new ArrayList<>();
            synchronized (stored) {
                for (Map<String, Object> row : stored) {
                    double t = ((Number) row.get(TIME_COLUMN)).doubleValue();
                    if (t >= start && t <= end)
                        out.add(Collections.unmodifiableMap(row));
                }
            }
            out.sort(Comparator.comparingDouble(r -> ((Number) r.get(TIME_COLUMN)).doubleValue()));
            log.debug("Fetched {} rows of {} in [{}, {}]", out.size(), key, start, end);
            return out;
        }, executor);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
