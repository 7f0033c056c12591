package com.streamengine.dpa.array;

import org.junit.Test;

import static org.junit.Assert.*;

public class NdArrayTest {

    @Test
    public void testShapeAndRowWidth() {
        NdArray a = NdArray.ofDoubles(DType.FLOAT32, new double[12], 3, 2, 2);
        assertEquals(3, a.length());
        assertEquals(12, a.size());
        assertEquals(4, a.rowWidth());
        assertEquals(3, a.ndim());
        assertEquals("<f4", a.dtypeTag());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testShapeMustMatchBuffer() {
        NdArray.ofLongs(DType.INT32, new long[5], 2, 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStorageMustMatchDtype() {
        NdArray.ofDoubles(DType.INT32, new double[] { 1 });
    }

    @Test
    public void testSelectRowsRepeatsAndKeepsDtype() {
        NdArray a = NdArray.ofLongs(DType.UINT16, new long[] { 1, 2, 3, 4, 5, 6 }, 3, 2);
        NdArray picked = a.selectRows(new int[] { 2, 2, 0 });
        assertEquals(DType.UINT16, picked.dtype());
        assertArrayEquals(new int[] { 3, 2 }, picked.shape());
        assertArrayEquals(new long[] { 5, 6, 5, 6, 1, 2 }, picked.toLongArray());
    }

    @Test
    public void testEqualityIsBitwise() {
        assertEquals(NdArray.of(Double.NaN, 1), NdArray.of(Double.NaN, 1));
        assertNotEquals(NdArray.of(0.0), NdArray.of(-0.0));
        assertNotEquals(NdArray.of(1, 2), NdArray.ofLongs(1, 2));
        assertNotEquals(NdArray.ofRows(new double[][] { { 1, 2 } }), NdArray.of(1, 2));
    }

    @Test
    public void testTextTagReportsLongestElement() {
        assertEquals("<U5", NdArray.ofStrings("a", "hello", "").dtypeTag());
        assertEquals(DType.STRING, DType.fromTag("<U5"));
    }

    @Test
    public void testDtypeTags() {
        assertEquals(DType.INT8, DType.fromTag("|i1"));
        assertEquals(DType.INT8, DType.fromTag("<i1"));
        assertEquals(DType.FLOAT64, DType.fromTag("<f8"));
        assertEquals(DType.UINT8, DType.fromTag("|u1"));
    }
}
