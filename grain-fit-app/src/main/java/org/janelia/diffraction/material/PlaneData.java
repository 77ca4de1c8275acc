package org.janelia.diffraction.material;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import Jama.Matrix;

/**
 * Lattice planes available for diffraction: the reciprocal lattice matrix, the wavelength
 * and the allowed hkl list in a deterministic order (increasing Bragg angle, then h, k, l).
 */
public class PlaneData {

    /**
     * An allowed hkl with its Bragg angle.
     */
    public static class Hkl {

        private final int h;
        private final int k;
        private final int l;
        private final double tth;

        public Hkl(final int h,
                   final int k,
                   final int l,
                   final double tth) {
            this.h = h;
            this.k = k;
            this.l = l;
            this.tth = tth;
        }

        public int getH() {
            return h;
        }

        public int getK() {
            return k;
        }

        public int getL() {
            return l;
        }

        public double[] toVector() {
            return new double[] {h, k, l};
        }

        /**
         * @return unstrained Bragg angle 2 theta (radians).
         */
        public double getTth() {
            return tth;
        }

        @Override
        public String toString() {
            return "(" + h + " " + k + " " + l + ")";
        }
    }

    private final double[][] bMatrix;
    private final double wavelength;
    private final List<Hkl> hklList;

    public PlaneData(final double[][] bMatrix,
                     final double wavelength,
                     final List<Hkl> hklList) {
        this.bMatrix = copy(bMatrix);
        this.wavelength = wavelength;
        this.hklList = Collections.unmodifiableList(new ArrayList<>(hklList));
    }

    /**
     * Builds plane data for all allowed hkls of the material.
     *
     * @param  material  source material.
     * @param  tthMax    largest Bragg angle (radians) to keep, null for no limit.
     */
    public static PlaneData build(final MaterialSpec material,
                                  final Double tthMax) {

        material.validate();

        final double[][] bMatrix = reciprocalLatticeMatrix(material.getLatticeParameters());
        final double wavelength = material.getWavelength();
        final MaterialSpec.Centering centering = material.getCentering();
        final int n = material.getMaxIndex();

        final List<Hkl> hklList = new ArrayList<>();
        for (int h = -n; h <= n; h++) {
            for (int k = -n; k <= n; k++) {
                for (int l = -n; l <= n; l++) {
                    if ((h == 0) && (k == 0) && (l == 0)) {
                        continue;
                    }
                    if (! centering.isAllowed(h, k, l)) {
                        continue;
                    }
                    final double sinTheta = 0.5 * wavelength * reciprocalLength(bMatrix, h, k, l);
                    if (sinTheta >= 1.0) {
                        continue;
                    }
                    final double tth = 2.0 * Math.asin(sinTheta);
                    if ((tthMax == null) || (tth <= tthMax)) {
                        hklList.add(new Hkl(h, k, l, tth));
                    }
                }
            }
        }

        hklList.sort(HKL_ORDER);

        return new PlaneData(bMatrix, wavelength, hklList);
    }

    /**
     * @param  latticeParameters  a, b, c and alpha, beta, gamma (degrees).
     *
     * @return matrix whose columns are the reciprocal lattice vectors (without the 2 pi factor)
     *         in a cartesian crystal frame with a along x and b in the xy plane.
     */
    public static double[][] reciprocalLatticeMatrix(final double[] latticeParameters) {

        final double a = latticeParameters[0];
        final double b = latticeParameters[1];
        final double c = latticeParameters[2];
        final double cosAlpha = Math.cos(Math.toRadians(latticeParameters[3]));
        final double cosBeta = Math.cos(Math.toRadians(latticeParameters[4]));
        final double gammaRadians = Math.toRadians(latticeParameters[5]);
        final double cosGamma = Math.cos(gammaRadians);
        final double sinGamma = Math.sin(gammaRadians);

        final double cy = (cosAlpha - cosBeta * cosGamma) / sinGamma;
        final double cz = Math.sqrt(1.0 - cosBeta * cosBeta - cy * cy);

        // direct lattice vectors as columns
        final Matrix direct = new Matrix(new double[][] {
                {a, b * cosGamma, c * cosBeta},
                {0, b * sinGamma, c * cy},
                {0,            0, c * cz}
        });

        return direct.inverse().transpose().getArray();
    }

    public double[][] getBMatrix() {
        return copy(bMatrix);
    }

    public double getWavelength() {
        return wavelength;
    }

    public List<Hkl> getHklList() {
        return hklList;
    }

    public int size() {
        return hklList.size();
    }

    public PlaneData copy() {
        return new PlaneData(bMatrix, wavelength, hklList);
    }

    private static double reciprocalLength(final double[][] bMatrix,
                                           final int h,
                                           final int k,
                                           final int l) {
        double sum = 0;
        for (int row = 0; row < 3; row++) {
            final double g = bMatrix[row][0] * h + bMatrix[row][1] * k + bMatrix[row][2] * l;
            sum += g * g;
        }
        return Math.sqrt(sum);
    }

    private static double[][] copy(final double[][] m) {
        final double[][] c = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            c[i] = m[i].clone();
        }
        return c;
    }

    private static final Comparator<Hkl> HKL_ORDER =
            Comparator.comparingDouble(Hkl::getTth)
                    .thenComparingInt(Hkl::getH)
                    .thenComparingInt(Hkl::getK)
                    .thenComparingInt(Hkl::getL);
}
