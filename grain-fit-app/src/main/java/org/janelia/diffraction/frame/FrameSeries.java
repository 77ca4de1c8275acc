package org.janelia.diffraction.frame;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.diffraction.util.ProgressTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rotation series of thresholded frames. Frame i covers rotation angles
 * [omegaStart + i * omegaStep, omegaStart + (i + 1) * omegaStep); the step may be negative.
 *
 * Instances are immutable and shared read-only by all workers.
 */
public class FrameSeries {

    private final List<SparseFrame> frames;
    private final int rows;
    private final int columns;
    private final double omegaStart;
    private final double omegaStep;

    /**
     * @param  omegaStart  rotation angle (radians) at the start of the first frame.
     * @param  omegaStep   signed rotation (radians) covered by each frame.
     */
    public FrameSeries(final List<SparseFrame> frames,
                       final int rows,
                       final int columns,
                       final double omegaStart,
                       final double omegaStep)
            throws IllegalArgumentException {
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("frame series must contain at least one frame");
        }
        if (omegaStep == 0.0) {
            throw new IllegalArgumentException("omega step must not be zero");
        }
        for (final SparseFrame frame : frames) {
            if ((frame.getRows() != rows) || (frame.getColumns() != columns)) {
                throw new IllegalArgumentException("all frames must have " + rows + " x " + columns + " pixels");
            }
        }
        this.frames = Collections.unmodifiableList(new ArrayList<>(frames));
        this.rows = rows;
        this.columns = columns;
        this.omegaStart = omegaStart;
        this.omegaStep = omegaStep;
    }

    /**
     * Reads and thresholds every frame of the reader.
     *
     * @param  threshold         intensities at or below this value are zeroed.
     * @param  omegaStartDegrees rotation angle at the start of the first frame.
     * @param  omegaStepDegrees  signed rotation covered by each frame.
     */
    public static FrameSeries load(final FrameReader reader,
                                   final double threshold,
                                   final double omegaStartDegrees,
                                   final double omegaStepDegrees)
            throws IOException {

        final int numberOfFrames = reader.getNumberOfFrames();
        LOG.info("load: reading {} frames of data", numberOfFrames);

        final ProgressTimer timer = new ProgressTimer(numberOfFrames);
        final List<SparseFrame> frames = new ArrayList<>(numberOfFrames);
        long keptPixels = 0;
        for (int i = 0; i < numberOfFrames; i++) {
            final SparseFrame frame = SparseFrame.fromDense(reader.readFrame(i),
                                                            reader.getRows(),
                                                            reader.getColumns(),
                                                            threshold);
            keptPixels += frame.getNumberOfPixels();
            frames.add(frame);
            if (timer.hasIntervalPassed()) {
                LOG.info("load: read {}", timer.getProgress(i + 1));
            }
        }

        LOG.info("load: read {} frames in {}, kept {} pixels above threshold {}",
                 numberOfFrames, timer, keptPixels, threshold);

        return new FrameSeries(frames,
                               reader.getRows(),
                               reader.getColumns(),
                               Math.toRadians(omegaStartDegrees),
                               Math.toRadians(omegaStepDegrees));
    }

    public int size() {
        return frames.size();
    }

    public SparseFrame getFrame(final int index) {
        return frames.get(index);
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public double getOmegaStart() {
        return omegaStart;
    }

    public double getOmegaStep() {
        return omegaStep;
    }

    /**
     * @return rotation angle at the end of the last frame.
     */
    public double getOmegaStop() {
        return omegaStart + frames.size() * omegaStep;
    }

    /**
     * @return smallest rotation angle covered by the series (start of the period used to map angles).
     */
    public double getOmegaMin() {
        return Math.min(omegaStart, getOmegaStop());
    }

    public double getOmegaMax() {
        return Math.max(omegaStart, getOmegaStop());
    }

    public double getFrameCenterOmega(final int index) {
        return omegaStart + (index + 0.5) * omegaStep;
    }

    /**
     * @return fractional frame position of an angle already mapped into the series period.
     */
    public double getFramePosition(final double omega) {
        return (omega - omegaStart) / omegaStep;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FrameSeries.class);
}
