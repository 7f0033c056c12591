package com.streamengine.dpa.engine;

import com.streamengine.dpa.TestCatalogs;
import com.streamengine.dpa.api.StreamKey;
import com.streamengine.dpa.array.DType;
import com.streamengine.dpa.array.NdArray;
import com.streamengine.dpa.catalog.Parameter;
import com.streamengine.dpa.catalog.ValueEncoding;
import com.streamengine.dpa.instance.DataParameterInstance;
import com.streamengine.dpa.instance.InstanceState;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class TimeAlignerTest {

    private static final double EPS = 1e-12;

    private TimeAligner aligner;
    private StreamKey key;

    @Before
    public void setUp() {
        aligner = new TimeAligner();
        key = TestCatalogs.key("STREAM");
    }

    private DataParameterInstance data(int id, double[] times, NdArray values) {
        DataParameterInstance dp = new DataParameterInstance(Parameter.data(id, "p" + id, ValueEncoding.FLOAT64), key);
        dp.populate(times, values);
        return dp;
    }

    @Test
    public void testLinearInterpolationFillsGap() {
        NdArray out = TimeAligner.interpolate(new double[] { 1, 2, 4, 5 }, NdArray.ofLongs(1, 2, 4, 5),
                new double[] { 1, 2, 3, 4, 5 });
        assertEquals(DType.FLOAT64, out.dtype());
        assertArrayEquals(new double[] { 1, 2, 3, 4, 5 }, out.toDoubleArray(), EPS);
    }

    @Test
    public void testTextTakesNearestEarlierOnTie() {
        NdArray out = TimeAligner.interpolate(new double[] { 1, 2, 4, 5 }, NdArray.ofStrings("a", "b", "d", "e"),
                new double[] { 1, 2, 3, 4, 5 });
        assertArrayEquals(new String[] { "a", "b", "b", "d", "e" }, out.toStringArray());
        assertEquals(DType.STRING, out.dtype());
    }

    @Test
    public void testSingleSampleIsBroadcast() {
        NdArray text = TimeAligner.interpolate(new double[] { 1.0 }, NdArray.ofStrings("a"),
                new double[] { 1, 2, 3, 4, 5 });
        assertArrayEquals(new String[] { "a", "a", "a", "a", "a" }, text.toStringArray());

        NdArray ints = TimeAligner.interpolate(new double[] { 7.0 }, NdArray.ofLongs(42),
                new double[] { 1, 2, 3 });
        assertEquals(DType.INT64, ints.dtype());
        assertArrayEquals(new long[] { 42, 42, 42 }, ints.toLongArray());
    }

    @Test
    public void testChannelsInterpolateIndependently() {
        NdArray rows = NdArray.ofRows(new double[][] { { 1, 2, 3, 4, 5 }, { 2, 3, 4, 5, 6 } });
        NdArray out = TimeAligner.interpolate(new double[] { 1.0, 3.0 }, rows, new double[] { 1, 2, 3 });

        assertArrayEquals(new int[] { 3, 5 }, out.shape());
        assertArrayEquals(new double[] { 1, 2, 3, 4, 5, 1.5, 2.5, 3.5, 4.5, 5.5, 2, 3, 4, 5, 6 },
                out.toDoubleArray(), EPS);
    }

    @Test
    public void testTwoChannelSeriesKeepsWidth() {
        NdArray rows = NdArray.ofRows(new double[][] { { 0, 10 }, { 10, 20 }, { 20, 30 } });
        NdArray out = TimeAligner.interpolate(new double[] { 0, 10, 20 }, rows, new double[] { 5, 15, 20, 25 });
        assertArrayEquals(new int[] { 4, 2 }, out.shape());
        assertArrayEquals(new double[] { 5, 15, 15, 25, 20, 30, 20, 30 }, out.toDoubleArray(), EPS);
    }

    @Test
    public void testValuesAreClampedOutsideRange() {
        NdArray out = TimeAligner.interpolate(new double[] { 1, 2 }, NdArray.of(1, 2), new double[] { 0, 5 });
        assertArrayEquals(new double[] { 1, 2 }, out.toDoubleArray(), EPS);
    }

    @Test
    public void testOriginalTimestampsReturnExactValues() {
        double[] times = { 0.0, 0.1, 0.7, 1.3, 2.9 };
        NdArray values = NdArray.of(0.1, 0.2, 0.30000000000000004, 1e-17, -3.3);
        NdArray out = TimeAligner.interpolate(times, values, times);
        assertEquals(values, out);
    }

    @Test
    public void testFirstPopulatedSeriesDefinesGrid() {
        StreamRequest request = new StreamRequest(key);
        DataParameterInstance first = data(1, new double[] { 1, 2, 3 }, NdArray.of(10, 20, 30));
        DataParameterInstance second = data(2, new double[] { 0, 4 }, NdArray.of(0, 40));
        request.register(first);
        request.register(second);

        double[] grid = aligner.align(request);

        assertArrayEquals(new double[] { 1, 2, 3 }, grid, EPS);
        assertArrayEquals(grid, second.times(), EPS);
        assertArrayEquals(new double[] { 10, 20, 30 }, second.data().toDoubleArray(), EPS);
        assertArrayEquals(grid, first.times(), 0.0);
    }

    @Test
    public void testSeriesWithoutValidTimesFailsAlone() {
        StreamRequest request = new StreamRequest(key);
        DataParameterInstance good = data(1, new double[] { 1, 2, 3 }, NdArray.of(10, 20, 30));
        DataParameterInstance noTimes = data(2, new double[] { Double.NaN, Double.NaN }, NdArray.of(1, 2));
        request.register(good);
        request.register(noTimes);

        double[] grid = aligner.align(request);

        assertArrayEquals(new double[] { 1, 2, 3 }, grid, EPS);
        assertEquals(InstanceState.POPULATED, good.state());
        assertEquals(InstanceState.FAILED, noTimes.state());
        assertNull(noTimes.data());
        assertTrue(noTimes.failureReason().contains("no valid timestamp"));
    }

    @Test
    public void testSeriesWithoutValidTimesNeverBecomesGrid() {
        StreamRequest request = new StreamRequest(key);
        DataParameterInstance noTimes = data(1, new double[] { Double.NaN }, NdArray.of(5));
        DataParameterInstance good = data(2, new double[] { 4, 5 }, NdArray.of(40, 50));
        request.register(noTimes);
        request.register(good);

        double[] grid = aligner.align(request);

        assertArrayEquals(new double[] { 4, 5 }, grid, EPS);
        assertEquals(InstanceState.FAILED, noTimes.state());
    }

    @Test
    public void testWritingIntoTimesLeavesGridIntact() {
        StreamRequest request = new StreamRequest(key);
        DataParameterInstance first = data(1, new double[] { 1, 2, 3 }, NdArray.of(10, 20, 30));
        DataParameterInstance second = data(2, new double[] { 0, 4 }, NdArray.of(0, 40));
        request.register(first);
        request.register(second);

        double[] grid = aligner.align(request);
        first.times()[0] = 99;
        grid[1] = 99;

        assertArrayEquals(new double[] { 1, 2, 3 }, first.times(), 0.0);
        assertArrayEquals(new double[] { 1, 2, 3 }, second.times(), 0.0);
    }

    @Test
    public void testUnpopulatedSeriesIsSkipped() {
        StreamRequest request = new StreamRequest(key);
        DataParameterInstance empty = data(1, new double[0], NdArray.of());
        DataParameterInstance real = data(2, new double[] { 5, 6 }, NdArray.of(1, 2));
        request.register(empty);
        request.register(real);

        double[] grid = aligner.align(request);

        assertArrayEquals(new double[] { 5, 6 }, grid, EPS);
        assertNull(empty.data());
        assertEquals(InstanceState.UNRESOLVED, empty.state());
    }

    @Test
    public void testSeriesOnGridKeepsItsDtype() {
        StreamRequest request = new StreamRequest(key);
        DataParameterInstance ref = data(1, new double[] { 1, 2, 3 }, NdArray.of(1, 2, 3));
        DataParameterInstance ints = data(2, new double[] { 1, 2, 3 }, NdArray.ofLongs(DType.INT32, new long[] { 4, 5, 6 }));
        request.register(ref);
        request.register(ints);

        aligner.align(request);

        assertEquals(DType.INT32, ints.data().dtype());
        assertArrayEquals(new long[] { 4, 5, 6 }, ints.data().toLongArray());
    }

    @Test
    public void testMalformedSeriesFailsAlone() {
        StreamRequest request = new StreamRequest(key);
        DataParameterInstance bad = data(1, new double[] { 1, 2, 3 }, NdArray.of(1, 2));
        DataParameterInstance good = data(2, new double[] { 1, 2 }, NdArray.of(7, 8));
        request.register(bad);
        request.register(good);

        double[] grid = aligner.align(request);

        assertEquals(InstanceState.FAILED, bad.state());
        assertNull(bad.data());
        assertNotNull(bad.failureReason());
        assertArrayEquals(new double[] { 1, 2 }, grid, EPS);
        assertEquals(InstanceState.POPULATED, good.state());
    }

    @Test
    public void testUnsortedTimesAreNormalized() {
        StreamRequest request = new StreamRequest(key);
        DataParameterInstance dp = data(1, new double[] { 3, 1, 2, 2 }, NdArray.of(30, 10, 20, 99));
        request.register(dp);

        double[] grid = aligner.align(request);

        assertArrayEquals(new double[] { 1, 2, 3 }, grid, EPS);
        assertArrayEquals(new double[] { 10, 20, 30 }, dp.data().toDoubleArray(), EPS);
    }

    @Test
    public void testAllSeriesShareGridAfterAlignment() {
        StreamRequest request = new StreamRequest(key);
        request.register(data(1, new double[] { 1, 2.5, 4, 5.5 }, NdArray.of(1, 2, 3, 4)));
        request.register(data(2, new double[] { 1, 2, 3, 4, 5, 6, 7 }, NdArray.of(1, 2, 3, 4, 5, 6, 7)));
        request.register(data(3, new double[] { 2 }, NdArray.ofStrings("x")));

        double[] grid = aligner.align(request);

        for (DataParameterInstance dp : request.dataInstances()) {
            assertArrayEquals(grid, dp.times(), 0.0);
            assertEquals(grid.length, dp.data().length());
        }
    }

    @Test
    public void testNothingToAlign() {
        StreamRequest request = new StreamRequest(key);
        request.register(new DataParameterInstance(Parameter.data(1, "a", ValueEncoding.INT32), key));
        assertNull(aligner.align(request));
    }
}
