package com.streamengine.dpa.fn.ctd;

import com.streamengine.dpa.api.DataProductFunction;
import com.streamengine.dpa.api.FunctionArguments;
import com.streamengine.dpa.array.NdArray;
import com.streamengine.dpa.fn.Elementwise;

/**
 * Conductivity-temperature-depth (CTD) data product algorithms.
 *
 * Unit conventions: pressure in dbar, temperature in degrees C, conductivity
 * in S/m, practical salinity unitless, density in kg/m^3.
 */
public final class CtdFunctions {
    private CtdFunctions() {
        // Utility class
    }

    // Conductivity of standard seawater (S = 35, T = 15 C, p = 0), S/m.
    static final double C_35_15_0 = 4.2914;

    // ── SBE 52-MP counts to engineering units ──────────────────────

    /** Seawater pressure (dbar) from SBE 52-MP pressure counts. */
    public static double sbe52mpPressure(double counts) {
        return counts / 100.0 - 10.0;
    }

    /** Seawater temperature (C) from SBE 52-MP temperature counts. */
    public static double sbe52mpTemperature(double counts) {
        return counts / 10000.0 - 5.0;
    }

    /** Seawater conductivity (S/m) from SBE 52-MP conductivity counts. */
    public static double sbe52mpConductivity(double counts) {
        return counts / 100000.0 - 0.5;
    }

    /**
     * Seawater temperature (C) from SBE 16plus thermistor counts, using the
     * instrument's four Steinhart-Hart calibration terms.
     */
    public static double sbe16plusTemperature(double counts, double a0, double a1, double a2, double a3) {
        double mv = (counts - 524288.0) / 1.6e7;
        double r = (mv * 2.900e9 + 1.024e8) / (2.048e4 - mv * 2.0e5);
        double lr = Math.log(r);
        return 1.0 / (a0 + lr * (a1 + lr * (a2 + lr * a3))) - 273.15;
    }

    // ── PSS-78 practical salinity ──────────────────────────────────

    private static final double[] A = { 0.0080, -0.1692, 25.3851, 14.0941, -7.0261, 2.7081 };
    private static final double[] B = { 0.0005, -0.0056, -0.0066, -0.0375, 0.0636, -0.0144 };
    private static final double K = 0.0162;
    private static final double[] C = { 0.6766097, 2.00564e-2, 1.104259e-4, -6.9698e-7, 1.0031e-9 };
    private static final double[] D = { 3.426e-2, 4.464e-4, 4.215e-1, -3.107e-3 };
    private static final double[] E = { 2.070e-5, -6.370e-10, 3.989e-15 };

    /**
     * Practical salinity (PSS-78) from conductivity ratio.
     *
     * @param r conductivity ratio C / C(35, 15, 0)
     * @param t temperature, C
     * @param p pressure, dbar
     */
    public static double practicalSalinityFromRatio(double r, double t, double p) {
        double rt = C[0] + t * (C[1] + t * (C[2] + t * (C[3] + t * C[4])));
        double rp = 1.0 + p * (E[0] + p * (E[1] + p * E[2]))
                / (1.0 + D[0] * t + D[1] * t * t + (D[2] + D[3] * t) * r);
        double rT = r / (rp * rt);
        if (rT < 0)
            return Double.NaN;
        double x = Math.sqrt(rT);
        double dt = t - 15.0;
        double ds = dt / (1.0 + K * dt)
                * (B[0] + x * (B[1] + x * (B[2] + x * (B[3] + x * (B[4] + x * B[5])))));
        return A[0] + x * (A[1] + x * (A[2] + x * (A[3] + x * (A[4] + x * A[5])))) + ds;
    }

    /** Practical salinity from conductivity (S/m), temperature (C), pressure (dbar). */
    public static double practicalSalinity(double conductivity, double t, double p) {
        return practicalSalinityFromRatio(conductivity / C_35_15_0, t, p);
    }

    // ── EOS-80 equation of state ───────────────────────────────────

    /** Density of seawater at atmospheric pressure (UNESCO 1981). */
    static double densityAtSurface(double s, double t) {
        double rhoW = 999.842594 + t * (6.793952e-2 + t * (-9.095290e-3
                + t * (1.001685e-4 + t * (-1.120083e-6 + t * 6.536332e-9))));
        double a = 0.824493 + t * (-4.0899e-3 + t * (7.6438e-5 + t * (-8.2467e-7 + t * 5.3875e-9)));
        double b = -5.72466e-3 + t * (1.0227e-4 - t * 1.6546e-6);
        return rhoW + s * a + s * Math.sqrt(s) * b + 4.8314e-4 * s * s;
    }

    /** Secant bulk modulus, pressure in bars. */
    static double secantBulkModulus(double s, double t, double pBar) {
        double s15 = s * Math.sqrt(s);
        double kw = 19652.21 + t * (148.4206 + t * (-2.327105 + t * (1.360477e-2 - t * 5.155288e-5)));
        double aw = 3.239908 + t * (1.43713e-3 + t * (1.16092e-4 - t * 5.77905e-7));
        double bw = 8.50935e-5 + t * (-6.12293e-6 + t * 5.2787e-8);
        double k0 = kw + s * (54.6746 + t * (-0.603459 + t * (1.09987e-2 - t * 6.1670e-5)))
                + s15 * (7.944e-2 + t * (1.6483e-2 - t * 5.3009e-4));
        double a = aw + s * (2.2838e-3 + t * (-1.0981e-5 - t * 1.6078e-6)) + 1.91075e-4 * s15;
        double b = bw + s * (-9.9348e-7 + t * (2.0816e-8 + t * 9.1697e-10));
        return k0 + pBar * (a + pBar * b);
    }

    /**
     * In-situ density (EOS-80).
     *
     * @param s practical salinity
     * @param t temperature, C
     * @param p pressure, dbar
     */
    public static double density(double s, double t, double p) {
        if (s < 0)
            return Double.NaN;
        double pBar = p / 10.0;
        return densityAtSurface(s, t) / (1.0 - pBar / secantBulkModulus(s, t, pBar));
    }

    // ── Array functions registered by name ─────────────────────────

    public static final DataProductFunction PRESWAT = Elementwise.unary(CtdFunctions::sbe52mpPressure);
    public static final DataProductFunction TEMPWAT = Elementwise.unary(CtdFunctions::sbe52mpTemperature);
    public static final DataProductFunction CONDWAT = Elementwise.unary(CtdFunctions::sbe52mpConductivity);

    /** {@code p0} raw counts; coefficients a0 to a3 in declared order. */
    public static final DataProductFunction SBE16PLUS_TEMPWAT = CtdFunctions::sbe16plusTempwat;

    /** {@code p0} conductivity, {@code p1} temperature, {@code p2} pressure. */
    public static final DataProductFunction PRACSAL = Elementwise.ternary(CtdFunctions::practicalSalinity);

    /**
     * {@code p0} salinity, {@code p1} temperature, {@code p2} pressure; first
     * two declared coefficients are latitude and longitude, which must be in
     * range but do not enter the EOS-80 formula.
     */
    public static final DataProductFunction DENSITY = CtdFunctions::densityOf;

    static NdArray sbe16plusTempwat(FunctionArguments args) {
        double a0 = args.coefficientAt(0)[0];
        double a1 = args.coefficientAt(1)[0];
        double a2 = args.coefficientAt(2)[0];
        double a3 = args.coefficientAt(3)[0];
        return Elementwise.map1(args.array(0), c -> sbe16plusTemperature(c, a0, a1, a2, a3));
    }

    static NdArray densityOf(FunctionArguments args) {
        double lat = args.coefficientAt(0)[0];
        double lon = args.coefficientAt(1)[0];
        if (lat < -90 || lat > 90)
            throw new IllegalArgumentException("Latitude out of range: " + lat);
        if (lon < -180 || lon > 360)
            throw new IllegalArgumentException("Longitude out of range: " + lon);
        return Elementwise.map3(args.array(0), args.array(1), args.array(2), CtdFunctions::density);
    }
}
