package org.janelia.diffraction.fit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.janelia.diffraction.frame.FrameSeries;
import org.janelia.diffraction.frame.SparseFrame;
import org.janelia.diffraction.geometry.NoDistortion;
import org.janelia.diffraction.geometry.Rotations;
import org.janelia.diffraction.geometry.SharedGeometry;
import org.janelia.diffraction.material.MaterialSpec;
import org.janelia.diffraction.material.PlaneData;

/**
 * Small simulated rotation series for refinement tests: an undistorted, untilted 2048 x 2048 panel 1 m
 * downstream of an FCC sample, scanned from -60 to 60 degrees in half degree steps.
 *
 * Spots are painted with bilinear weights over neighboring pixels and frames so that intensity weighted
 * centroids reproduce the predicted positions exactly.
 */
public class SyntheticExperiment {

    public static final int ROWS = 2048;
    public static final int COLUMNS = 2048;
    public static final double PIXEL_SIZE = 0.2;
    public static final double DISTANCE = 1000.0;
    public static final double PANEL_BUFFER = 5.0;
    public static final double OMEGA_START = Math.toRadians(-60.0);
    public static final double OMEGA_STEP = Math.toRadians(0.5);
    public static final int NUMBER_OF_FRAMES = 240;
    public static final float SPOT_INTENSITY = 1000.0f;

    /** Generous windows so that small parameter errors still associate every spot. */
    public static final ToleranceSchedule SCHEDULE = ToleranceSchedule.fromLists(
            Arrays.asList(0.3, 0.3),
            Arrays.asList(2.0, 2.0),
            Arrays.asList(2.0, 2.0));

    public static MaterialSpec buildMaterial() {
        return MaterialSpec.cubic("gold", 4.08, MaterialSpec.Centering.F, 4, 0.2);
    }

    public static PlaneData buildPlaneData() {
        return PlaneData.build(buildMaterial(), Math.toRadians(10.0));
    }

    public static SharedGeometry buildGeometry() {
        return new SharedGeometry(new double[3],
                                  new double[] {0.0, 0.0, -DISTANCE},
                                  ROWS,
                                  COLUMNS,
                                  PIXEL_SIZE,
                                  PANEL_BUFFER,
                                  new NoDistortion(),
                                  0.0,
                                  new double[3],
                                  buildPlaneData());
    }

    /**
     * @return frames containing one spot for every prediction of every grain that lands on the detector
     *         during the scan.
     */
    public static FrameSeries buildFrames(final SharedGeometry geometry,
                                          final List<GrainParameters> grains) {
        return buildFrames(geometry, grains, OMEGA_START);
    }

    /**
     * @param  omegaStart  rotation angle (radians) at the start of the first frame.
     */
    public static FrameSeries buildFrames(final SharedGeometry geometry,
                                          final List<GrainParameters> grains,
                                          final double omegaStart) {

        final List<Map<Integer, Float>> painted = new ArrayList<>(NUMBER_OF_FRAMES);
        for (int i = 0; i < NUMBER_OF_FRAMES; i++) {
            painted.add(new TreeMap<>());
        }

        final double omegaMin = omegaStart;
        final double omegaMax = omegaStart + NUMBER_OF_FRAMES * OMEGA_STEP;

        for (final GrainParameters grain : grains) {
            final DiffractionModel model = new DiffractionModel(geometry, grain);
            for (final PlaneData.Hkl hkl : geometry.getPlaneData().getHklList()) {
                for (final DiffractionModel.Prediction prediction : model.predict(hkl.toVector())) {
                    final double omega = Rotations.mapAngle(prediction.getOmega(), omegaMin);
                    if (omega <= omegaMax) {
                        paintSpot(painted, prediction.getX(), prediction.getY(), omega - omegaStart);
                    }
                }
            }
        }

        final List<SparseFrame> frames = new ArrayList<>(NUMBER_OF_FRAMES);
        for (final Map<Integer, Float> frame : painted) {
            final int[] indexes = new int[frame.size()];
            final float[] intensities = new float[frame.size()];
            int i = 0;
            for (final Map.Entry<Integer, Float> entry : frame.entrySet()) {
                indexes[i] = entry.getKey();
                intensities[i] = entry.getValue();
                i++;
            }
            frames.add(new SparseFrame(ROWS, COLUMNS, indexes, intensities));
        }

        return new FrameSeries(frames, ROWS, COLUMNS, omegaStart, OMEGA_STEP);
    }

    /**
     * @return parameters for an unstrained grain at the origin with the specified orientation.
     */
    public static GrainParameters grain(final double[] orientation) {
        return new GrainParameters(orientation, new double[3], GrainParameters.IDENTITY_STRETCH);
    }

    public static GrainParameters identityGrain() {
        return grain(new double[3]);
    }

    /**
     * @return completeness of the exact grain in the final iteration, which is below one only because
     *         of painted rows near the scan edges.
     */
    public static double exactCompleteness(final SharedGeometry geometry,
                                           final FrameSeries frames,
                                           final GrainParameters grain) {
        final Tolerance lastTolerance = SCHEDULE.get(SCHEDULE.getNumberOfIterations() - 1);
        return new ReflectionAssociator(geometry, frames).associate(0, grain, lastTolerance).getCompleteness();
    }

    /**
     * @param  omegaOffset  rotation angle relative to the start of the scan.
     */
    private static void paintSpot(final List<Map<Integer, Float>> painted,
                                  final double x,
                                  final double y,
                                  final double omegaOffset) {

        final double columnPosition = (x + 0.5 * COLUMNS * PIXEL_SIZE) / PIXEL_SIZE - 0.5;
        final double rowPosition = (0.5 * ROWS * PIXEL_SIZE - y) / PIXEL_SIZE - 0.5;
        final double framePosition = omegaOffset / OMEGA_STEP - 0.5;

        final int column = (int) Math.floor(columnPosition);
        final int row = (int) Math.floor(rowPosition);
        final int frame = (int) Math.floor(framePosition);

        final double wColumn = columnPosition - column;
        final double wRow = rowPosition - row;
        final double wFrame = framePosition - frame;

        for (int df = 0; df < 2; df++) {
            final int f = frame + df;
            if ((f < 0) || (f >= NUMBER_OF_FRAMES)) {
                continue;
            }
            final double frameWeight = df == 0 ? 1.0 - wFrame : wFrame;
            for (int dr = 0; dr < 2; dr++) {
                final int r = row + dr;
                final double rowWeight = dr == 0 ? 1.0 - wRow : wRow;
                for (int dc = 0; dc < 2; dc++) {
                    final int c = column + dc;
                    final double columnWeight = dc == 0 ? 1.0 - wColumn : wColumn;
                    final float value = (float) (SPOT_INTENSITY * frameWeight * rowWeight * columnWeight);
                    if ((r >= 0) && (r < ROWS) && (c >= 0) && (c < COLUMNS) && (value > 0)) {
                        painted.get(f).merge(r * COLUMNS + c, value, Float::sum);
                    }
                }
            }
        }
    }
}
