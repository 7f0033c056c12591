package com.streamengine.dpa.engine;

import com.streamengine.dpa.api.MalformedSeriesException;
import com.streamengine.dpa.array.DType;
import com.streamengine.dpa.array.NdArray;
import com.streamengine.dpa.instance.DataParameterInstance;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Puts every populated data series of a request onto one common time grid.
 *
 * Grid selection:
 * The first populated, well-formed data instance in working-set order is the
 * reference clock; its (normalized) timestamps become the grid and every
 * other series is resampled onto it.
 *
 * Resampling rules, per series:
 * 1. One sample: broadcast to every grid time, whatever the element type.
 * 2. Numeric: linear interpolation along the time axis, each trailing
 * channel independently. Outside the original time range the boundary
 * sample is repeated; values are never extrapolated. At an original
 * timestamp the original value is returned exactly.
 * 3. Text/opaque: the nearest original sample, the earlier one on a tie.
 *
 * A series whose time count differs from its leading-axis length is
 * malformed: it is failed on its own and kept out of alignment. Series with
 * unsorted or repeated timestamps are sorted and de-duplicated (first sample
 * wins) before anything else happens; a series left with no timestamp at
 * all is failed as malformed.
 */
public final class TimeAligner {
    private static final Logger log = LogManager.getLogger(TimeAligner.class);

    /**
     * Aligns the request in place.
     *
     * @return the common grid, or null when no data instance is populated
     */
    public double[] align(StreamRequest request) {
        DataParameterInstance reference = null;

        for (DataParameterInstance dp : request.dataInstances()) {
            if (!dp.hasData())
                continue;
            try {
                checkWellFormed(dp);
                normalize(dp);
            } catch (MalformedSeriesException e) {
                log.warn("Excluding {} from alignment: {}", dp, e.getMessage());
                dp.markFailed(e.getMessage());
                continue;
            }
            if (reference == null)
                reference = dp;
        }

        if (reference == null) {
            log.debug("Nothing to align for {}", request.key());
            return null;
        }

        double[] grid = reference.times();
        int resampled = 0;
        for (DataParameterInstance dp : request.dataInstances()) {
            if (dp == reference || !dp.hasData())
                continue;
            if (Arrays.equals(dp.times(), grid))
                continue;
            dp.resampled(grid, interpolate(dp.times(), dp.data(), grid));
            resampled++;
        }
        log.debug("Aligned {} series onto grid of {} points from {} ({} resampled)",
                request.dataInstances().size(), grid.length, reference, resampled);
        return grid;
    }

    private static void checkWellFormed(DataParameterInstance dp) {
        double[] times = dp.times();
        int rows = dp.data().length();
        if (times == null || times.length != rows)
            throw new MalformedSeriesException(dp.id(), times == null ? 0 : times.length, rows);
    }

    private static void normalize(DataParameterInstance dp) {
        double[] times = dp.times();
        if (isStrictlyIncreasing(times))
            return;
        Integer[] order = IntStream.range(0, times.length)
                .boxed()
                .filter(i -> !Double.isNaN(times[i]))
                .sorted(Comparator.comparingDouble(i -> times[i]))
                .toArray(Integer[]::new);
        int[] keep = new int[order.length];
        int n = 0;
        for (Integer i : order) {
            if (n > 0 && times[keep[n - 1]] == times[i])
                continue;
            keep[n++] = i;
        }
        if (n == 0)
            throw new MalformedSeriesException(dp.id(), "has no valid timestamp among " + times.length);
        keep = Arrays.copyOf(keep, n);
        double[] sorted = new double[n];
        for (int i = 0; i < n; i++)
            sorted[i] = times[keep[i]];
        log.debug("Normalized time axis of {}: {} -> {} samples", dp, times.length, n);
        dp.resampled(sorted, dp.data().selectRows(keep));
    }

    static boolean isStrictlyIncreasing(double[] times) {
        for (int i = 0; i < times.length; i++) {
            if (Double.isNaN(times[i]))
                return false;
            if (i > 0 && times[i] <= times[i - 1])
                return false;
        }
        return true;
    }

    /**
     * Resamples a series with strictly increasing {@code times} onto
     * {@code target}.
     *
     * @param times  original timestamps, one per leading-axis row of data
     * @param data   original values, at least one row
     * @param target requested timestamps
     * @return values at the target times; float64 for interpolated numeric
     *         data, the original dtype otherwise
     */
    public static NdArray interpolate(double[] times, NdArray data, double[] target) {
        if (times.length != data.length())
            throw new IllegalArgumentException(
                    "times has " + times.length + " entries but data has " + data.length() + " rows");
        if (data.length() == 0)
            throw new IllegalArgumentException("Cannot interpolate an empty series");

        if (data.length() == 1)
            return data.selectRows(new int[target.length]);

        if (!data.isNumeric()) {
            int[] rows = new int[target.length];
            for (int i = 0; i < target.length; i++)
                rows[i] = nearest(times, target[i]);
            return data.selectRows(rows);
        }

        int width = data.rowWidth();
        int last = times.length - 1;
        double[] out = new double[target.length * width];
        for (int i = 0; i < target.length; i++) {
            double t = target[i];
            int j = floorIndex(times, t);
            int base = i * width;
            if (j < 0) {
                copyRow(data, 0, out, base, width);
            } else if (j >= last || times[j] == t) {
                copyRow(data, Math.min(j, last), out, base, width);
            } else {
                double t0 = times[j];
                double t1 = times[j + 1];
                for (int c = 0; c < width; c++) {
                    double v0 = data.getDouble(j, c);
                    double v1 = data.getDouble(j + 1, c);
                    out[base + c] = (v1 - v0) / (t1 - t0) * (t - t0) + v0;
                }
            }
        }
        int[] shape = data.shape();
        shape[0] = target.length;
        return NdArray.ofDoubles(DType.FLOAT64, out, shape);
    }

    private static void copyRow(NdArray data, int row, double[] out, int base, int width) {
        for (int c = 0; c < width; c++)
            out[base + c] = data.getDouble(row, c);
    }

    /** Index of the last time {@code <= t}, or -1 if t precedes the series. */
    static int floorIndex(double[] times, double t) {
        int lo = 0, hi = times.length - 1, ans = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (times[mid] <= t) {
                ans = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return ans;
    }

    /** Nearest original sample; ties go to the earlier one. */
    static int nearest(double[] times, double t) {
        int j = floorIndex(times, t);
        if (j < 0)
            return 0;
        if (j >= times.length - 1)
            return times.length - 1;
        return (t - times[j]) <= (times[j + 1] - t) ? j : j + 1;
    }
}
