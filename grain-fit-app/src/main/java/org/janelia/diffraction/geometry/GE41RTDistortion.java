package org.janelia.diffraction.geometry;

import java.util.Arrays;

/**
 * Radial/azimuthal polynomial distortion of the GE 41RT flat panel.
 *
 * A measured position at radius rho and azimuth eta (about the panel center) is corrected to radius
 * <pre>
 *   rho * (1 + p0 * r^p3 * cos(2 eta) + p1 * r^p4 * cos(4 eta) + p2 * r^p5)    with r = rho / rhoMax
 * </pre>
 * keeping the azimuth. The inverse has no closed form and is found by fixed point iteration.
 */
public class GE41RTDistortion
        implements DistortionModel {

    public static final String FUNCTION_NAME = "GE_41RT";

    public static final int NUMBER_OF_PARAMETERS = 6;

    /** Maximum radius of the 2048 x 200 micron panel (mm). */
    public static final double DEFAULT_RHO_MAX = 204.8;

    private static final int MAX_INVERSE_ITERATIONS = 50;
    private static final double INVERSE_TOLERANCE = 1.0e-12;

    private final double[] parameters;
    private final double rhoMax;

    public GE41RTDistortion(final double[] parameters) {
        this(parameters, DEFAULT_RHO_MAX);
    }

    public GE41RTDistortion(final double[] parameters,
                            final double rhoMax)
            throws IllegalArgumentException {
        if ((parameters == null) || (parameters.length != NUMBER_OF_PARAMETERS)) {
            throw new IllegalArgumentException(FUNCTION_NAME + " distortion requires " + NUMBER_OF_PARAMETERS +
                                               " parameters but " +
                                               (parameters == null ? "none" : parameters.length) +
                                               " were specified");
        }
        this.parameters = parameters.clone();
        this.rhoMax = rhoMax;
    }

    public double[] getParameters() {
        return parameters.clone();
    }

    @Override
    public String getFunctionName() {
        return FUNCTION_NAME;
    }

    @Override
    public double[] correct(final double x,
                            final double y) {
        final double rho = Math.hypot(x, y);
        if (rho == 0.0) {
            return new double[] {x, y};
        }
        final double eta = Math.atan2(y, x);
        final double rhoOut = rho * radialScale(rho, eta);
        return new double[] {rhoOut * Math.cos(eta), rhoOut * Math.sin(eta)};
    }

    @Override
    public double[] distort(final double x,
                            final double y) {
        final double rhoIdeal = Math.hypot(x, y);
        if (rhoIdeal == 0.0) {
            return new double[] {x, y};
        }
        final double eta = Math.atan2(y, x);

        double rho = rhoIdeal;
        for (int i = 0; i < MAX_INVERSE_ITERATIONS; i++) {
            final double next = rhoIdeal / radialScale(rho, eta);
            final boolean converged = Math.abs(next - rho) < INVERSE_TOLERANCE * rhoIdeal;
            rho = next;
            if (converged) {
                break;
            }
        }

        return new double[] {rho * Math.cos(eta), rho * Math.sin(eta)};
    }

    @Override
    public DistortionModel copy() {
        return new GE41RTDistortion(parameters, rhoMax);
    }

    @Override
    public String toString() {
        return FUNCTION_NAME + Arrays.toString(parameters);
    }

    private double radialScale(final double rho,
                               final double eta) {
        final double r = rho / rhoMax;
        return 1.0 +
               parameters[0] * Math.pow(r, parameters[3]) * Math.cos(2.0 * eta) +
               parameters[1] * Math.pow(r, parameters[4]) * Math.cos(4.0 * eta) +
               parameters[2] * Math.pow(r, parameters[5]);
    }

}
