package org.janelia.diffraction.fit;

import java.util.Arrays;

import org.janelia.diffraction.geometry.Rotations;

/**
 * Immutable 12 value grain parameter vector:
 * <pre>
 *   [0..2]   orientation as an exponential map (rotation axis scaled by angle, radians)
 *   [3..5]   translation of the grain center in the sample frame (mm)
 *   [6..11]  inverse stretch of the sample frame in Mandel-Voigt order
 *            (V00, V11, V22, sqrt(2) V12, sqrt(2) V02, sqrt(2) V01)
 * </pre>
 */
public class GrainParameters {

    public static final int NUMBER_OF_PARAMETERS = 12;

    public static final double[] IDENTITY_STRETCH = {1.0, 1.0, 1.0, 0.0, 0.0, 0.0};

    private final double[] values;

    public GrainParameters(final double[] values)
            throws IllegalArgumentException {
        if ((values == null) || (values.length != NUMBER_OF_PARAMETERS)) {
            throw new IllegalArgumentException("grain parameters must have exactly " + NUMBER_OF_PARAMETERS +
                                               " values");
        }
        this.values = values.clone();
    }

    public GrainParameters(final double[] orientation,
                           final double[] translation,
                           final double[] stretch) {
        this(concat(orientation, translation, stretch));
    }

    /**
     * @return parameters for an unstrained grain at the sample origin with the specified orientation.
     */
    public static GrainParameters fromQuaternion(final double[] quaternion)
            throws IllegalArgumentException {
        return new GrainParameters(Rotations.expMapOfQuaternion(quaternion), new double[3], IDENTITY_STRETCH);
    }

    public double get(final int index) {
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    public double[] getOrientation() {
        return Arrays.copyOfRange(values, 0, 3);
    }

    public double[] getTranslation() {
        return Arrays.copyOfRange(values, 3, 6);
    }

    public double[] getStretch() {
        return Arrays.copyOfRange(values, 6, 12);
    }

    public double[][] getOrientationMatrix() {
        return Rotations.ofExpMap(getOrientation());
    }

    /**
     * @return the symmetric 3x3 tensor of the stretch components.
     */
    public double[][] getStretchTensor() {
        return Tensors.symmetricOfMandelVoigt(getStretch());
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        return Arrays.equals(values, ((GrainParameters) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }

    private static double[] concat(final double[] orientation,
                                   final double[] translation,
                                   final double[] stretch) {
        if ((orientation.length != 3) || (translation.length != 3) || (stretch.length != 6)) {
            throw new IllegalArgumentException("grain parameters require 3 orientation, 3 translation and " +
                                               "6 stretch values");
        }
        final double[] values = new double[NUMBER_OF_PARAMETERS];
        System.arraycopy(orientation, 0, values, 0, 3);
        System.arraycopy(translation, 0, values, 3, 3);
        System.arraycopy(stretch, 0, values, 6, 6);
        return values;
    }
}
