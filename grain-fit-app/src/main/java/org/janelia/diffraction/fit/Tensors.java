package org.janelia.diffraction.fit;

import Jama.EigenvalueDecomposition;
import Jama.Matrix;

/**
 * Symmetric tensor helpers for the stretch and strain of a grain.
 */
public class Tensors {

    public static final double SQRT_2 = Math.sqrt(2.0);

    /**
     * @param  mandelVoigt  (T00, T11, T22, sqrt(2) T12, sqrt(2) T02, sqrt(2) T01).
     *
     * @return the symmetric 3x3 tensor.
     */
    public static double[][] symmetricOfMandelVoigt(final double[] mandelVoigt) {
        final double t12 = mandelVoigt[3] / SQRT_2;
        final double t02 = mandelVoigt[4] / SQRT_2;
        final double t01 = mandelVoigt[5] / SQRT_2;
        return new double[][] {
                {mandelVoigt[0], t01,            t02},
                {t01,            mandelVoigt[1], t12},
                {t02,            t12,            mandelVoigt[2]}
        };
    }

    /**
     * Matrix logarithm of a symmetric positive definite tensor through its eigen decomposition.
     *
     * @throws IllegalArgumentException
     *   if the tensor is not positive definite.
     */
    public static double[][] logOfSymmetric(final double[][] tensor)
            throws IllegalArgumentException {

        final EigenvalueDecomposition eigen = new Matrix(tensor).eig();
        final double[] eigenvalues = eigen.getRealEigenvalues();
        final double[][] logOfEigenvalues = new double[3][3];
        for (int i = 0; i < 3; i++) {
            if (! (eigenvalues[i] > 0)) {
                throw new IllegalArgumentException("tensor is not positive definite, eigenvalue " + i + " is " +
                                                   eigenvalues[i]);
            }
            logOfEigenvalues[i][i] = Math.log(eigenvalues[i]);
        }

        final Matrix v = eigen.getV();
        final double[][] log = v.times(new Matrix(logOfEigenvalues)).times(v.transpose()).getArray();

        // remove round-off asymmetry
        for (int i = 0; i < 3; i++) {
            for (int j = i + 1; j < 3; j++) {
                final double mean = 0.5 * (log[i][j] + log[j][i]);
                log[i][j] = mean;
                log[j][i] = mean;
            }
        }

        return log;
    }

    /**
     * @param  stretch  Mandel-Voigt stretch components of a grain.
     *
     * @return strain tensor {@code logm(inv(S))} for the stretch tensor S.
     */
    public static double[][] strainOfStretch(final double[] stretch) {
        final Matrix stretchTensor = new Matrix(symmetricOfMandelVoigt(stretch));
        final double[][] inverse = stretchTensor.inverse().getArray();
        // symmetrize the inverse before the eigen decomposition so that Jama takes its symmetric path
        for (int i = 0; i < 3; i++) {
            for (int j = i + 1; j < 3; j++) {
                final double mean = 0.5 * (inverse[i][j] + inverse[j][i]);
                inverse[i][j] = mean;
                inverse[j][i] = mean;
            }
        }
        return logOfSymmetric(inverse);
    }

    private Tensors() {
    }
}
