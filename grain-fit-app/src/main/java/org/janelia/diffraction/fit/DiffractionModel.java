package org.janelia.diffraction.fit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.diffraction.geometry.Rotations;
import org.janelia.diffraction.geometry.SharedGeometry;

/**
 * Rotation method forward model for one grain estimate.
 *
 * A reciprocal lattice vector {@code g = V * Rc * B * hkl} (inverse stretch V, orientation Rc) diffracts when
 * the oscillation stage rotates it onto the Bragg condition {@code beam . g_lab = -sin(theta)}.
 * For each of the (at most two) rotation angles the diffracted ray leaves the grain center and is
 * intersected with the detector plane.
 */
public class DiffractionModel {

    /**
     * One predicted diffraction event.
     */
    public static class Prediction {

        private final double tth;
        private final double eta;
        private final double omega;
        private final double x;
        private final double y;
        private final double rayLength;

        public Prediction(final double tth,
                          final double eta,
                          final double omega,
                          final double x,
                          final double y,
                          final double rayLength) {
            this.tth = tth;
            this.eta = eta;
            this.omega = omega;
            this.x = x;
            this.y = y;
            this.rayLength = rayLength;
        }

        public double getTth() {
            return tth;
        }

        public double getEta() {
            return eta;
        }

        public double getOmega() {
            return omega;
        }

        /**
         * @return ideal (undistorted) panel x (mm).
         */
        public double getX() {
            return x;
        }

        /**
         * @return ideal (undistorted) panel y (mm).
         */
        public double getY() {
            return y;
        }

        /**
         * @return distance (mm) from the grain center to the detector along the diffracted ray.
         */
        public double getRayLength() {
            return rayLength;
        }
    }

    private static final double EPSILON = 1.0e-12;

    private final SharedGeometry geometry;
    private final double[][] crystalToSample;
    private final double[] grainTranslation;
    private final double[][] bMatrix;
    private final double wavelength;
    private final double[][] detectorRotation;
    private final double[] detectorNormal;
    private final double[] detectorTranslation;
    private final double[] stageTranslation;

    public DiffractionModel(final SharedGeometry geometry,
                            final GrainParameters parameters) {
        this.geometry = geometry;
        this.crystalToSample = Rotations.multiply(parameters.getStretchTensor(), parameters.getOrientationMatrix());
        this.grainTranslation = parameters.getTranslation();
        this.bMatrix = geometry.getPlaneData().getBMatrix();
        this.wavelength = geometry.getWavelength();
        this.detectorRotation = geometry.getDetectorRotation();
        this.detectorNormal = geometry.getDetectorNormal();
        this.detectorTranslation = geometry.getDetectorTranslation();
        this.stageTranslation = geometry.getStageTranslation();
    }

    /**
     * @param  hkl  Miller indices.
     *
     * @return predictions that intersect the (infinite) detector plane, in increasing solution order.
     *         Reflections that cannot reach the Bragg condition return an empty list.
     */
    public List<Prediction> predict(final double[] hkl) {

        final double[] gSample = Rotations.apply(crystalToSample, Rotations.apply(bMatrix, hkl));
        final double length = Rotations.norm(gSample);
        final double sinTheta = 0.5 * wavelength * length;
        if ((length < EPSILON) || (sinTheta >= 1.0)) {
            return Collections.emptyList();
        }

        final double[] gHat = Rotations.scale(gSample, 1.0 / length);
        final double chi = geometry.getChi();
        final double cosChi = Math.cos(chi);
        final double sinChi = Math.sin(chi);

        // a cos(omega) + b sin(omega) = c
        final double a = cosChi * gHat[2];
        final double b = -cosChi * gHat[0];
        final double c = sinTheta - sinChi * gHat[1];
        final double r = Math.hypot(a, b);
        if ((r < EPSILON) || (Math.abs(c) > r)) {
            return Collections.emptyList();
        }

        final double phi = Math.atan2(b, a);
        final double delta = Math.acos(c / r);
        final double[] omegas = delta < EPSILON ? new double[] {phi} : new double[] {phi - delta, phi + delta};

        final double tth = 2.0 * Math.asin(sinTheta);
        final List<Prediction> predictions = new ArrayList<>(omegas.length);
        for (final double omega : omegas) {
            final double[][] sampleToLab = Rotations.oscillationRotation(chi, omega);
            final double[] gLab = Rotations.apply(sampleToLab, gHat);
            final double[] direction = Rotations.unit(Rotations.add(SharedGeometry.BEAM_DIRECTION,
                                                                    Rotations.scale(gLab, 2.0 * sinTheta)));
            final double[] origin = grainPosition(sampleToLab);
            final double[] hit = intersectDetector(origin, direction);
            if (hit != null) {
                predictions.add(new Prediction(tth, etaOf(direction), omega, hit[0], hit[1], hit[2]));
            }
        }

        return predictions;
    }

    /**
     * @return the prediction whose rotation angle is closest to {@code omega}, or null if there is none.
     */
    public Prediction predictNearest(final double[] hkl,
                                     final double omega) {
        Prediction nearest = null;
        double nearestDistance = Double.MAX_VALUE;
        for (final Prediction prediction : predict(hkl)) {
            final double distance = Math.abs(Rotations.angularDifference(prediction.getOmega(), omega));
            if (distance < nearestDistance) {
                nearest = prediction;
                nearestDistance = distance;
            }
        }
        return nearest;
    }

    /**
     * @return lab position of the grain center when the stage is at {@code omega}.
     */
    public double[] grainPosition(final double omega) {
        return grainPosition(Rotations.oscillationRotation(geometry.getChi(), omega));
    }

    /**
     * @param  x               ideal panel x (mm).
     * @param  y               ideal panel y (mm).
     * @param  grainPosition   lab position of the grain center.
     *
     * @return {tth, eta} of the ray from the grain center to the panel point.
     */
    public double[] anglesOfDetectorPoint(final double x,
                                          final double y,
                                          final double[] grainPosition) {
        final double[] lab = Rotations.add(detectorTranslation, Rotations.apply(detectorRotation,
                                                                                new double[] {x, y, 0.0}));
        final double[] direction = Rotations.unit(Rotations.subtract(lab, grainPosition));
        final double cosTth = Math.max(-1.0, Math.min(1.0, Rotations.dot(direction, SharedGeometry.BEAM_DIRECTION)));
        return new double[] {Math.acos(cosTth), etaOf(direction)};
    }

    private double[] grainPosition(final double[][] sampleToLab) {
        return Rotations.add(stageTranslation, Rotations.apply(sampleToLab, grainTranslation));
    }

    /**
     * @return {x, y, rayLength} in panel coordinates or null if the ray does not hit the detector plane.
     */
    private double[] intersectDetector(final double[] origin,
                                       final double[] direction) {
        final double denominator = Rotations.dot(detectorNormal, direction);
        if (Math.abs(denominator) < EPSILON) {
            return null;
        }
        final double t = Rotations.dot(detectorNormal, Rotations.subtract(detectorTranslation, origin)) / denominator;
        if (t <= 0) {
            return null;
        }
        final double[] hit = Rotations.add(origin, Rotations.scale(direction, t));
        final double[] local = Rotations.applyTranspose(detectorRotation, Rotations.subtract(hit, detectorTranslation));
        return new double[] {local[0], local[1], t};
    }

    /**
     * Azimuth about the beam, measured from {@link SharedGeometry#ETA_REFERENCE} (lab x) toward lab y.
     */
    private static double etaOf(final double[] direction) {
        return Math.atan2(direction[1], direction[0]);
    }

}
