package com.streamengine.dpa.fn.ctd;

import com.streamengine.dpa.api.FunctionArguments;
import com.streamengine.dpa.array.DType;
import com.streamengine.dpa.array.NdArray;
import org.junit.Test;

import static org.junit.Assert.*;

public class CtdFunctionsTest {

    @Test
    public void testSbe52mpConversions() {
        assertEquals(0.03, CtdFunctions.sbe52mpPressure(1003), 1e-12);
        assertEquals(20.4779, CtdFunctions.sbe52mpTemperature(254779), 1e-12);
        assertEquals(3.9, CtdFunctions.sbe52mpConductivity(440000), 1e-12);
    }

    @Test
    public void testSbe16plusTemperature() {
        double t = CtdFunctions.sbe16plusTemperature(418687, 0.001268802, 0.0002709596, -8.126484e-07,
                1.699432e-07);
        assertEquals(9.0414, t, 1e-4);
    }

    @Test
    public void testPracticalSalinityAtStandardConditions() {
        assertEquals(35.0, CtdFunctions.practicalSalinityFromRatio(1.0, 15.0, 0.0), 1e-4);
        assertEquals(35.0, CtdFunctions.practicalSalinity(CtdFunctions.C_35_15_0, 15.0, 0.0), 1e-4);
    }

    @Test
    public void testPracticalSalinityCheckValue() {
        // UNESCO 1983 check value
        assertEquals(40.0, CtdFunctions.practicalSalinityFromRatio(1.888091, 40.0, 10000.0), 1e-4);
    }

    @Test
    public void testNegativeConductivityGivesNaN() {
        assertTrue(Double.isNaN(CtdFunctions.practicalSalinity(-0.4, 20.0, 10.0)));
    }

    @Test
    public void testDensityCheckValues() {
        // UNESCO 1981 check values; pressure in dbar
        assertEquals(999.96675, CtdFunctions.density(0, 5, 0), 1e-5);
        assertEquals(1027.67547, CtdFunctions.density(35, 5, 0), 1e-5);
        assertEquals(1062.53817, CtdFunctions.density(35, 25, 10000), 1e-5);
    }

    @Test
    public void testDensityFunctionChecksPosition() {
        FunctionArguments.Builder args = FunctionArguments.builder()
                .positional(NdArray.of(35, 35))
                .positional(NdArray.of(5, 25))
                .positional(NdArray.of(0, 10000));

        NdArray rho = CtdFunctions.DENSITY.apply(args.coefficient("CC_lat", 45.0).coefficient("CC_lon", -125.0).build());
        assertEquals(DType.FLOAT64, rho.dtype());
        assertEquals(1027.67547, rho.getDouble(0), 1e-5);
        assertEquals(1062.53817, rho.getDouble(1), 1e-5);

        FunctionArguments bad = FunctionArguments.builder()
                .positional(NdArray.of(35))
                .positional(NdArray.of(5))
                .positional(NdArray.of(0))
                .coefficient("CC_lat", 91.0)
                .coefficient("CC_lon", 0.0)
                .build();
        try {
            CtdFunctions.DENSITY.apply(bad);
            fail("Expected latitude to be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("Latitude"));
        }
    }

    @Test
    public void testIntegerCountsAreWidened() {
        NdArray out = CtdFunctions.PRESWAT.apply(FunctionArguments.builder()
                .positional(NdArray.ofLongs(DType.INT32, new long[] { 1003, 2003 }))
                .build());
        assertEquals(DType.FLOAT64, out.dtype());
        assertArrayEquals(new double[] { 0.03, 10.03 }, out.toDoubleArray(), 1e-12);
    }
}
