package org.janelia.diffraction.fit;

import java.util.Arrays;

/**
 * Selects which of the 12 grain parameters are refined and how each is scaled for the optimizer
 * (the optimizer works on {@code value / scale}).
 */
public class RefinementMask {

    /** Refine everything, stretch off-diagonals scaled down by 100. */
    public static final RefinementMask DEFAULT = new RefinementMask(
            new boolean[] {true, true, true, true, true, true, true, true, true, true, true, true},
            new double[] {1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 0.01, 0.01, 0.01});

    private final boolean[] refine;
    private final double[] scale;

    public RefinementMask(final boolean[] refine,
                          final double[] scale)
            throws IllegalArgumentException {
        if ((refine.length != GrainParameters.NUMBER_OF_PARAMETERS) ||
            (scale.length != GrainParameters.NUMBER_OF_PARAMETERS)) {
            throw new IllegalArgumentException("refine mask and scale must each have " +
                                               GrainParameters.NUMBER_OF_PARAMETERS + " entries");
        }
        for (int i = 0; i < scale.length; i++) {
            if (refine[i] && (! (scale[i] > 0))) {
                throw new IllegalArgumentException("scale for refined parameter " + i + " must be positive");
            }
        }
        this.refine = refine.clone();
        this.scale = scale.clone();
    }

    /**
     * @return mask with the default scales that only refines the specified parameter indexes.
     */
    public static RefinementMask refining(final int... indexes) {
        final boolean[] refine = new boolean[GrainParameters.NUMBER_OF_PARAMETERS];
        for (final int index : indexes) {
            refine[index] = true;
        }
        return new RefinementMask(refine, DEFAULT.scale);
    }

    public boolean isRefined(final int index) {
        return refine[index];
    }

    public double getScale(final int index) {
        return scale[index];
    }

    public int getNumberOfRefinedParameters() {
        int count = 0;
        for (final boolean r : refine) {
            if (r) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return scaled values of the refined parameters (the optimizer's start point).
     */
    public double[] toScaledFree(final GrainParameters parameters) {
        final double[] free = new double[getNumberOfRefinedParameters()];
        int j = 0;
        for (int i = 0; i < GrainParameters.NUMBER_OF_PARAMETERS; i++) {
            if (refine[i]) {
                free[j++] = parameters.get(i) / scale[i];
            }
        }
        return free;
    }

    /**
     * @return copy of {@code fixedSource} with the refined entries replaced by the unscaled free values.
     */
    public GrainParameters fromScaledFree(final double[] free,
                                          final GrainParameters fixedSource) {
        final double[] values = fixedSource.toArray();
        int j = 0;
        for (int i = 0; i < GrainParameters.NUMBER_OF_PARAMETERS; i++) {
            if (refine[i]) {
                values[i] = free[j++] * scale[i];
            }
        }
        return new GrainParameters(values);
    }

    @Override
    public String toString() {
        return "{refine: " + Arrays.toString(refine) + ", scale: " + Arrays.toString(scale) + "}";
    }
}
