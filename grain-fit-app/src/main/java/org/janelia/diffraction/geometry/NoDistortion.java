package org.janelia.diffraction.geometry;

/**
 * Identity distortion for undistorted (or already corrected) detectors.
 */
public class NoDistortion
        implements DistortionModel {

    public static final String FUNCTION_NAME = "NONE";

    @Override
    public String getFunctionName() {
        return FUNCTION_NAME;
    }

    @Override
    public double[] correct(final double x,
                            final double y) {
        return new double[] {x, y};
    }

    @Override
    public double[] distort(final double x,
                            final double y) {
        return new double[] {x, y};
    }

    @Override
    public DistortionModel copy() {
        return new NoDistortion();
    }

}
