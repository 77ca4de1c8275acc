package org.janelia.diffraction.fit;

import java.util.ArrayList;
import java.util.List;

import org.janelia.diffraction.frame.FrameSeries;
import org.janelia.diffraction.frame.SparseFrame;
import org.janelia.diffraction.geometry.DistortionModel;
import org.janelia.diffraction.geometry.Rotations;
import org.janelia.diffraction.geometry.SharedGeometry;
import org.janelia.diffraction.material.PlaneData;

/**
 * Associates predicted reflections of a grain estimate with measured frame intensity.
 *
 * Every plane data reflection is predicted for the estimate. Predictions that land on the panel inside the
 * scanned rotation range and inside an allowed eta range become table rows. Thresholded intensity whose pixel lies inside the (2 theta, eta)
 * window of the prediction in frames inside the omega window is integrated into an intensity weighted
 * centroid; rows with intensity are valid. Rotation angles in the table are mapped into the configured
 * omega period.
 */
public class ReflectionAssociator {

    /** Number of rotation steps at each end of the scan that are excluded from fitting. */
    public static final int EDGE_STEPS = 2;

    private final SharedGeometry geometry;
    private final FrameSeries frames;

    public ReflectionAssociator(final SharedGeometry geometry,
                                final FrameSeries frames)
            throws IllegalArgumentException {
        if ((geometry.getRows() != frames.getRows()) || (geometry.getColumns() != frames.getColumns())) {
            throw new IllegalArgumentException(
                    "detector has " + geometry.getRows() + " x " + geometry.getColumns() +
                    " pixels but frames have " + frames.getRows() + " x " + frames.getColumns());
        }
        this.geometry = geometry;
        this.frames = frames;
    }

    public ReflectionTable associate(final int grainId,
                                     final GrainParameters parameters,
                                     final Tolerance tolerance) {

        final DiffractionModel model = new DiffractionModel(geometry, parameters);
        final PlaneData planeData = geometry.getPlaneData();

        final double omegaMin = frames.getOmegaMin();
        final double omegaMax = frames.getOmegaMax();
        final double edge = EDGE_STEPS * Math.abs(frames.getOmegaStep());

        final List<Reflection> reflections = new ArrayList<>();
        int nextId = 0;

        for (final PlaneData.Hkl hkl : planeData.getHklList()) {
            for (final DiffractionModel.Prediction prediction : model.predict(hkl.toVector())) {

                if ((! geometry.isOnPanel(prediction.getX(), prediction.getY())) ||
                    (! geometry.isAllowedEta(prediction.getEta()))) {
                    continue;
                }

                final double omega = Rotations.mapAngle(prediction.getOmega(), omegaMin);
                if (omega > omegaMax) {
                    continue;
                }

                final boolean inScanWindow = (omega > omegaMin + edge) && (omega < omegaMax - edge);
                final Integration integration = integrate(model, prediction, omega, tolerance);
                final int[] indexes = {hkl.getH(), hkl.getK(), hkl.getL()};
                final double reportedOmega = geometry.mapOmegaToPeriod(omega, omegaMin);

                final Reflection reflection;
                if (integration.sum > 0) {
                    reflection = new Reflection(nextId++,
                                                indexes,
                                                integration.sum,
                                                integration.max,
                                                prediction.getTth(),
                                                prediction.getEta(),
                                                reportedOmega,
                                                prediction.getX(),
                                                prediction.getY(),
                                                integration.weightedX / integration.sum,
                                                integration.weightedY / integration.sum,
                                                geometry.mapOmegaToPeriod(integration.weightedOmega / integration.sum,
                                                                          omegaMin),
                                                inScanWindow);
                } else {
                    reflection = new Reflection(Reflection.INVALID_ID,
                                                indexes,
                                                0.0,
                                                0.0,
                                                prediction.getTth(),
                                                prediction.getEta(),
                                                reportedOmega,
                                                prediction.getX(),
                                                prediction.getY(),
                                                Double.NaN,
                                                Double.NaN,
                                                Double.NaN,
                                                inScanWindow);
                }
                reflections.add(reflection);
            }
        }

        return new ReflectionTable(grainId, reflections);
    }

    /**
     * @param  omega  predicted rotation angle mapped into the scan period.
     */
    private Integration integrate(final DiffractionModel model,
                                  final DiffractionModel.Prediction prediction,
                                  final double omega,
                                  final Tolerance tolerance) {

        final double halfTth = 0.5 * tolerance.getTthRadians();
        final double halfEta = 0.5 * tolerance.getEtaRadians();
        final double halfFrames = 0.5 * tolerance.getOmegaRadians() / Math.abs(frames.getOmegaStep());

        // frames whose center lies inside the omega window, at least the frame containing the prediction
        final double position = frames.getFramePosition(omega);
        int firstFrame = (int) Math.ceil(position - halfFrames - 0.5);
        int lastFrame = (int) Math.floor(position + halfFrames - 0.5);
        if (firstFrame > lastFrame) {
            firstFrame = (int) Math.floor(position);
            lastFrame = firstFrame;
        }
        firstFrame = Math.max(0, firstFrame);
        lastFrame = Math.min(frames.size() - 1, lastFrame);

        // pixel box large enough to hold the angular window
        final DistortionModel distortion = geometry.getDistortion();
        final double[] measuredCenter = distortion.distort(prediction.getX(), prediction.getY());
        final int centerRow = geometry.rowOf(measuredCenter[1]);
        final int centerColumn = geometry.columnOf(measuredCenter[0]);
        final int halfBox = (int) Math.ceil(2.0 * prediction.getRayLength() * Math.max(halfTth, halfEta) /
                                            geometry.getPixelSize()) + 1;

        final double[] grainPosition = model.grainPosition(prediction.getOmega());
        final Integration integration = new Integration();

        for (int frameIndex = firstFrame; frameIndex <= lastFrame; frameIndex++) {
            final SparseFrame frame = frames.getFrame(frameIndex);
            final double frameOmega = frames.getFrameCenterOmega(frameIndex);
            frame.visitBox(centerRow - halfBox, centerRow + halfBox,
                           centerColumn - halfBox, centerColumn + halfBox,
                           (row, column, intensity) -> {
                               final double x = geometry.xOfColumnCenter(column);
                               final double y = geometry.yOfRowCenter(row);
                               final double[] ideal = distortion.correct(x, y);
                               final double[] angles = model.anglesOfDetectorPoint(ideal[0], ideal[1], grainPosition);
                               if ((Math.abs(angles[0] - prediction.getTth()) <= halfTth) &&
                                   (Math.abs(Rotations.angularDifference(angles[1], prediction.getEta())) <= halfEta)) {
                                   integration.add(intensity, x, y, frameOmega);
                               }
                           });
        }

        return integration;
    }

    /**
     * Running intensity weighted sums for one reflection.
     */
    private static class Integration {

        private double sum = 0.0;
        private double max = 0.0;
        private double weightedX = 0.0;
        private double weightedY = 0.0;
        private double weightedOmega = 0.0;

        private void add(final double intensity,
                         final double x,
                         final double y,
                         final double omega) {
            sum += intensity;
            max = Math.max(max, intensity);
            weightedX += intensity * x;
            weightedY += intensity * y;
            weightedOmega += intensity * omega;
        }
    }

}
