package org.janelia.diffraction.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.diffraction.material.PlaneData;

/**
 * Read-only experiment geometry shared by every refinement job: detector placement and pixel layout,
 * distortion, oscillation stage, the plane data (which carries the wavelength) and the angular limits
 * applied during association (allowed eta ranges and the omega period).
 *
 * Instances are immutable. Each worker still receives its own {@link #copy()} when it is spawned
 * so that no two workers ever reference the same geometry instance.
 */
public class SharedGeometry {

    /** Incident beam direction in the lab frame. */
    public static final double[] BEAM_DIRECTION = {0.0, 0.0, -1.0};

    /** Lab direction of zero azimuth (eta). */
    public static final double[] ETA_REFERENCE = {1.0, 0.0, 0.0};

    /** Single eta range covering the full circle. */
    public static final List<double[]> FULL_ETA_RANGE =
            Collections.singletonList(new double[] {-Math.PI, Math.PI});

    private final double[][] detectorRotation;
    private final double[] detectorTranslation;
    private final int rows;
    private final int columns;
    private final double pixelSize;
    private final double panelBuffer;
    private final DistortionModel distortion;
    private final double chi;
    private final double[] stageTranslation;
    private final PlaneData planeData;
    private final List<double[]> etaRanges;
    private final Double omegaPeriodStart;

    public SharedGeometry(final double[] tiltAngles,
                          final double[] detectorTranslation,
                          final int rows,
                          final int columns,
                          final double pixelSize,
                          final double panelBuffer,
                          final DistortionModel distortion,
                          final double chi,
                          final double[] stageTranslation,
                          final PlaneData planeData) {
        this(Rotations.detectorRotation(tiltAngles),
             detectorTranslation,
             rows,
             columns,
             pixelSize,
             panelBuffer,
             distortion,
             chi,
             stageTranslation,
             planeData,
             FULL_ETA_RANGE,
             null);
    }

    private SharedGeometry(final double[][] detectorRotation,
                           final double[] detectorTranslation,
                           final int rows,
                           final int columns,
                           final double pixelSize,
                           final double panelBuffer,
                           final DistortionModel distortion,
                           final double chi,
                           final double[] stageTranslation,
                           final PlaneData planeData,
                           final List<double[]> etaRanges,
                           final Double omegaPeriodStart) {
        this.detectorRotation = Rotations.copy(detectorRotation);
        this.detectorTranslation = detectorTranslation.clone();
        this.rows = rows;
        this.columns = columns;
        this.pixelSize = pixelSize;
        this.panelBuffer = panelBuffer;
        this.distortion = distortion.copy();
        this.chi = chi;
        this.stageTranslation = stageTranslation.clone();
        this.planeData = planeData.copy();
        final List<double[]> rangeCopies = new ArrayList<>(etaRanges.size());
        for (final double[] range : etaRanges) {
            if ((range.length != 2) || (! (range[1] > range[0]))) {
                throw new IllegalArgumentException("eta ranges must be (min, max) pairs with max > min");
            }
            rangeCopies.add(range.clone());
        }
        this.etaRanges = Collections.unmodifiableList(rangeCopies);
        this.omegaPeriodStart = omegaPeriodStart;
    }

    /**
     * @param  instrument   structured instrument document.
     * @param  planeData    lattice planes and wavelength.
     * @param  panelBuffer  width (mm) of the panel border in which predictions are ignored.
     */
    public static SharedGeometry fromInstrument(final InstrumentSpec instrument,
                                                final PlaneData planeData,
                                                final double panelBuffer) {
        instrument.validate();
        final DetectorSpec detector = instrument.getDetector();
        final DetectorSpec.Pixels pixels = detector.getPixels();
        final DistortionModel distortion = detector.getDistortion() == null ?
                                           new NoDistortion() : detector.getDistortion().buildModel();
        return new SharedGeometry(detector.getTransform().getTiltAngles(),
                                  detector.getTransform().getTranslation(),
                                  pixels.getRows(),
                                  pixels.getColumns(),
                                  pixels.getSize(),
                                  panelBuffer,
                                  distortion,
                                  instrument.getOscillationStage().getChi(),
                                  instrument.getOscillationStage().getTranslation(),
                                  planeData);
    }

    /**
     * @return deep copy that shares no mutable state with this instance.
     */
    public SharedGeometry copy() {
        return new SharedGeometry(detectorRotation,
                                  detectorTranslation,
                                  rows,
                                  columns,
                                  pixelSize,
                                  panelBuffer,
                                  distortion,
                                  chi,
                                  stageTranslation,
                                  planeData,
                                  etaRanges,
                                  omegaPeriodStart);
    }

    /**
     * @param  etaRanges         allowed (min, max) azimuth ranges in radians; empty means the full circle.
     * @param  omegaPeriodStart  start (radians) of the 2 pi period rotation angles are reported in,
     *                           or null to use the start of the scan.
     *
     * @return copy of this geometry with the specified association limits.
     *
     * @throws IllegalArgumentException
     *   if a range is not a (min, max) pair with max > min.
     */
    public SharedGeometry withAngularLimits(final List<double[]> etaRanges,
                                            final Double omegaPeriodStart)
            throws IllegalArgumentException {
        return new SharedGeometry(detectorRotation,
                                  detectorTranslation,
                                  rows,
                                  columns,
                                  pixelSize,
                                  panelBuffer,
                                  distortion,
                                  chi,
                                  stageTranslation,
                                  planeData,
                                  ((etaRanges == null) || etaRanges.isEmpty()) ? FULL_ETA_RANGE : etaRanges,
                                  omegaPeriodStart);
    }

    public List<double[]> getEtaRanges() {
        return etaRanges;
    }

    /**
     * @return true if the azimuth lies inside one of the allowed eta ranges.
     */
    public boolean isAllowedEta(final double eta) {
        for (final double[] range : etaRanges) {
            if (Rotations.mapAngle(eta, range[0]) <= range[1]) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param  scanStart  start of the scanned rotation range (radians), used when no period start is configured.
     *
     * @return the rotation angle mapped into the configured 2 pi period.
     */
    public double mapOmegaToPeriod(final double omega,
                                   final double scanStart) {
        return Rotations.mapAngle(omega, omegaPeriodStart == null ? scanStart : omegaPeriodStart);
    }

    public Double getOmegaPeriodStart() {
        return omegaPeriodStart;
    }

    public double[][] getDetectorRotation() {
        return Rotations.copy(detectorRotation);
    }

    /**
     * @return lab frame normal of the detector plane.
     */
    public double[] getDetectorNormal() {
        return new double[] {detectorRotation[0][2], detectorRotation[1][2], detectorRotation[2][2]};
    }

    public double[] getDetectorTranslation() {
        return detectorTranslation.clone();
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public double getPixelSize() {
        return pixelSize;
    }

    public double getPanelBuffer() {
        return panelBuffer;
    }

    public DistortionModel getDistortion() {
        return distortion;
    }

    public double getChi() {
        return chi;
    }

    public double[] getStageTranslation() {
        return stageTranslation.clone();
    }

    public PlaneData getPlaneData() {
        return planeData;
    }

    public double getWavelength() {
        return planeData.getWavelength();
    }

    /**
     * @return true if the panel centered point (mm) lies on the panel outside of the border buffer.
     */
    public boolean isOnPanel(final double x,
                             final double y) {
        final double halfWidth = 0.5 * columns * pixelSize - panelBuffer;
        final double halfHeight = 0.5 * rows * pixelSize - panelBuffer;
        return (Math.abs(x) <= halfWidth) && (Math.abs(y) <= halfHeight);
    }

    /**
     * @return column containing the panel centered x coordinate (may be outside the panel).
     */
    public int columnOf(final double x) {
        return (int) Math.floor((x + 0.5 * columns * pixelSize) / pixelSize);
    }

    /**
     * @return row containing the panel centered y coordinate (rows grow downward, y upward).
     */
    public int rowOf(final double y) {
        return (int) Math.floor((0.5 * rows * pixelSize - y) / pixelSize);
    }

    public double xOfColumnCenter(final int column) {
        return (column + 0.5) * pixelSize - 0.5 * columns * pixelSize;
    }

    public double yOfRowCenter(final int row) {
        return 0.5 * rows * pixelSize - (row + 0.5) * pixelSize;
    }

}
