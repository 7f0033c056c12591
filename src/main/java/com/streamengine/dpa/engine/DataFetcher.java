package com.streamengine.dpa.engine;

import com.streamengine.dpa.api.RawDataStore;
import com.streamengine.dpa.api.StreamKey;
import com.streamengine.dpa.array.DType;
import com.streamengine.dpa.array.NdArray;
import com.streamengine.dpa.instance.DataParameterInstance;
import com.streamengine.dpa.instance.InstanceState;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Populates the data instances of a request from a {@link RawDataStore}.
 *
 * Algorithm:
 * 1. Group the unpopulated data instances by stream key.
 * 2. Start one fetch per key; all of them run concurrently.
 * 3. Wait for all of them, bounded by the configured timeout.
 * 4. Pivot each key's rows into columns: {@code time} becomes the time axis,
 * every other instance takes the column with its parameter name.
 *
 * A failed or timed out fetch, or a column that is missing or cannot be
 * typed, fails only the instances concerned.
 */
public final class DataFetcher {
    private static final Logger log = LogManager.getLogger(DataFetcher.class);

    private final RawDataStore store;
    private final long timeoutMillis;

    public DataFetcher(RawDataStore store, long timeoutMillis) {
        this.store = store;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Fetches {@code [start, end]} for every data instance still unresolved.
     *
     * @return the number of instances populated
     */
    public int fetch(StreamRequest request, double start, double end) {
        Map<StreamKey, List<DataParameterInstance>> byKey = new LinkedHashMap<>();
        for (DataParameterInstance dp : request.dataInstances()) {
            if (dp.state() == InstanceState.UNRESOLVED)
                byKey.computeIfAbsent(dp.streamKey(), k -> new ArrayList<>()).add(dp);
        }
        if (byKey.isEmpty())
            return 0;

        Map<StreamKey, CompletableFuture<List<Map<String, Object>>>> futures = new LinkedHashMap<>();
        for (StreamKey key : byKey.keySet())
            futures.put(key, store.fetch(key, start, end));

        awaitAll(futures.values());

        int populated = 0;
        for (var entry : futures.entrySet()) {
            StreamKey key = entry.getKey();
            List<DataParameterInstance> targets = byKey.get(key);
            CompletableFuture<List<Map<String, Object>>> future = entry.getValue();

            if (!future.isDone()) {
                future.cancel(true);
                failAll(targets, "fetch of " + key + " timed out after " + timeoutMillis + " ms");
                continue;
            }
            List<Map<String, Object>> rows;
            try {
                rows = future.join();
            } catch (CompletionException | CancellationException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                failAll(targets, "fetch of " + key + " failed: " + cause.getMessage());
                continue;
            }
            populated += populate(key, rows, targets);
        }
        log.debug("Fetched {} of {} data instances for {}", populated,
                byKey.values().stream().mapToInt(List::size).sum(), request.key());
        return populated;
    }

    private void awaitAll(Iterable<CompletableFuture<List<Map<String, Object>>>> futures) {
        List<CompletableFuture<?>> all = new ArrayList<>();
        futures.forEach(all::add);
        try {
            CompletableFuture.allOf(all.toArray(new CompletableFuture<?>[0])).get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Raw fetch did not finish within {} ms", timeoutMillis);
        } catch (ExecutionException e) {
            // Failures are picked up per future.
            log.debug("At least one raw fetch failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for raw fetches");
        }
    }

    private static int populate(StreamKey key, List<Map<String, Object>> rows, List<DataParameterInstance> targets) {
        List<Map<String, Object>> timed = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            if (row.get(RawDataStore.TIME_COLUMN) != null)
                timed.add(row);
        }
        if (timed.size() < rows.size())
            log.debug("Skipped {} rows of {} without time", rows.size() - timed.size(), key);

        double[] times = new double[timed.size()];
        for (int i = 0; i < times.length; i++)
            times[i] = ((Number) timed.get(i).get(RawDataStore.TIME_COLUMN)).doubleValue();

        int populated = 0;
        for (DataParameterInstance dp : targets) {
            try {
                NdArray column = column(timed, dp.name());
                dp.populate(times.clone(), column);
                if (dp.hasData())
                    populated++;
            } catch (IllegalArgumentException e) {
                fail(dp, e.getMessage());
            }
        }
        return populated;
    }

    private static void failAll(List<DataParameterInstance> targets, String reason) {
        for (DataParameterInstance dp : targets)
            fail(dp, reason);
    }

    private static void fail(DataParameterInstance dp, String reason) {
        log.warn("Data parameter {} ({}) not populated: {}", dp.id(), dp.name(), reason);
        dp.markFailed(reason);
    }

    /**
     * Builds the array for one column. The dtype follows the Java types of
     * the values: Byte, Short and Integer give int32, Long int64, Float
     * float32, other numbers float64, strings text. A List or
     * {@code double[]} value makes a row, giving a 2-D array. Nulls become NaN
     * in floating point columns and are rejected elsewhere.
     *
     * @return the column, or null when there are no rows
     * @throws IllegalArgumentException if the column is missing or mixes
     *                                  incompatible types
     */
    static NdArray column(List<Map<String, Object>> rows, String name) {
        if (rows.isEmpty())
            return null;
        boolean present = false;
        for (Map<String, Object> row : rows) {
            if (row.containsKey(name)) {
                present = true;
                break;
            }
        }
        if (!present)
            throw new IllegalArgumentException("no column '" + name + "' in fetched rows");

        Object[] values = new Object[rows.size()];
        for (int i = 0; i < values.length; i++)
            values[i] = rows.get(i).get(name);

        DType dtype = inferDType(name, values);
        int width = rowWidth(values);
        if (width > 0)
            return rowsColumn(name, values, width);
        return switch (dtype.storage()) {
            case LONG -> {
                long[] out = new long[values.length];
                for (int i = 0; i < out.length; i++)
                    out[i] = requireValue(name, i, values[i]).longValue();
                yield NdArray.ofLongs(dtype, out);
            }
            case DOUBLE -> {
                double[] out = new double[values.length];
                for (int i = 0; i < out.length; i++)
                    out[i] = values[i] == null ? Double.NaN : ((Number) values[i]).doubleValue();
                yield NdArray.ofDoubles(dtype, out);
            }
            case TEXT -> {
                String[] out = new String[values.length];
                for (int i = 0; i < out.length; i++)
                    out[i] = values[i] == null ? null : values[i].toString();
                yield NdArray.ofText(dtype, out);
            }
        };
    }

    private static NdArray rowsColumn(String name, Object[] values, int width) {
        double[] flat = new double[values.length * width];
        for (int i = 0; i < values.length; i++) {
            double[] row = toRow(name, i, values[i]);
            if (row.length != width)
                throw new IllegalArgumentException(
                        "column '" + name + "' row " + i + " has width " + row.length + ", expected " + width);
            System.arraycopy(row, 0, flat, i * width, width);
        }
        return NdArray.ofDoubles(DType.FLOAT64, flat, values.length, width);
    }

    private static DType inferDType(String name, Object[] values) {
        DType dtype = null;
        for (Object v : values) {
            if (v == null)
                continue;
            DType next = dtypeOf(name, v);
            dtype = dtype == null ? next : widen(name, dtype, next);
        }
        if (dtype == null)
            throw new IllegalArgumentException("column '" + name + "' holds only nulls");
        return dtype;
    }

    private static DType dtypeOf(String name, Object v) {
        if (v instanceof Integer || v instanceof Short || v instanceof Byte)
            return DType.INT32;
        if (v instanceof Long)
            return DType.INT64;
        if (v instanceof Float)
            return DType.FLOAT32;
        if (v instanceof Number)
            return DType.FLOAT64;
        if (v instanceof CharSequence)
            return DType.STRING;
        if (v instanceof List<?> || v instanceof double[])
            return DType.FLOAT64;
        throw new IllegalArgumentException(
                "column '" + name + "' has unsupported value type " + v.getClass().getSimpleName());
    }

    private static DType widen(String name, DType a, DType b) {
        if (a == b)
            return a;
        if (a.storage() == DType.Storage.TEXT || b.storage() == DType.Storage.TEXT)
            throw new IllegalArgumentException("column '" + name + "' mixes text and numbers");
        if (a.isInteger() && b.isInteger())
            return DType.INT64;
        return DType.FLOAT64;
    }

    /** Width of the first list-valued row, or 0 for a scalar column. */
    private static int rowWidth(Object[] values) {
        for (Object v : values) {
            if (v instanceof List<?> list)
                return Math.max(1, list.size());
            if (v instanceof double[] arr)
                return Math.max(1, arr.length);
        }
        return 0;
    }

    private static double[] toRow(String name, int index, Object v) {
        if (v instanceof double[] arr)
            return arr;
        if (v instanceof List<?> list) {
            double[] row = new double[list.size()];
            for (int i = 0; i < row.length; i++) {
                Object e = list.get(i);
                row[i] = e == null ? Double.NaN : requireValue(name, index, e).doubleValue();
            }
            return row;
        }
        throw new IllegalArgumentException("column '" + name + "' row " + index + " is not a list");
    }

    private static Number requireValue(String name, int index, Object v) {
        if (v instanceof Number n)
            return n;
        throw new IllegalArgumentException("column '" + name + "' row " + index + " has value " + v);
    }
}
