package org.janelia.diffraction.fit;

import org.janelia.diffraction.geometry.Rotations;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link Tensors} class.
 */
public class TensorsTest {

    @Test
    public void testStrainOfDiagonalStretch() {
        final double[][] strain = Tensors.strainOfStretch(new double[] {1.01, 0.99, 1.0, 0.0, 0.0, 0.0});
        Assert.assertEquals("invalid [0][0]", -Math.log(1.01), strain[0][0], 1.0e-12);
        Assert.assertEquals("invalid [1][1]", -Math.log(0.99), strain[1][1], 1.0e-12);
        Assert.assertEquals("invalid [2][2]", 0.0, strain[2][2], 1.0e-12);
        Assert.assertEquals("invalid [0][1]", 0.0, strain[0][1], 1.0e-12);
    }

    @Test
    public void testStrainOfRotatedStretch() {

        // S = R diag(s) R^T so logm(inv(S)) = R diag(-ln s) R^T
        final double[] s = {1.002, 0.997, 1.0004};
        final double[][] r = Rotations.ofExpMap(new double[] {0.3, -0.2, 0.5});
        final double[][] stretch = Rotations.multiply(r, Rotations.multiply(diagonal(s), Rotations.transpose(r)));
        final double[] mandelVoigt = {
                stretch[0][0], stretch[1][1], stretch[2][2],
                Tensors.SQRT_2 * stretch[1][2], Tensors.SQRT_2 * stretch[0][2], Tensors.SQRT_2 * stretch[0][1]
        };

        final double[][] expected = Rotations.multiply(r, Rotations.multiply(diagonal(new double[] {
                -Math.log(s[0]), -Math.log(s[1]), -Math.log(s[2])
        }), Rotations.transpose(r)));
        final double[][] strain = Tensors.strainOfStretch(mandelVoigt);

        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                Assert.assertEquals("invalid entry [" + i + "][" + j + "]", expected[i][j], strain[i][j], 1.0e-12);
                Assert.assertEquals("strain should be symmetric", strain[i][j], strain[j][i], 0.0);
            }
        }
    }

    @Test
    public void testMandelVoigtRoundTrip() {
        final double[][] tensor = Tensors.symmetricOfMandelVoigt(new double[] {1.0, 2.0, 3.0,
                                                                              Tensors.SQRT_2 * 4.0,
                                                                              Tensors.SQRT_2 * 5.0,
                                                                              Tensors.SQRT_2 * 6.0});
        Assert.assertEquals("invalid [1][2]", 4.0, tensor[1][2], 1.0e-12);
        Assert.assertEquals("invalid [0][2]", 5.0, tensor[2][0], 1.0e-12);
        Assert.assertEquals("invalid [0][1]", 6.0, tensor[0][1], 1.0e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeStretch() {
        Tensors.strainOfStretch(new double[] {-1.0, 1.0, 1.0, 0.0, 0.0, 0.0});
    }

    private static double[][] diagonal(final double[] values) {
        return new double[][] {
                {values[0], 0.0, 0.0},
                {0.0, values[1], 0.0},
                {0.0, 0.0, values[2]}
        };
    }
}
