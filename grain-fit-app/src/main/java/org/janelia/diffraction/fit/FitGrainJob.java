package org.janelia.diffraction.fit;

/**
 * One unit of batch work: refine a single grain starting from its initial parameters.
 */
public class FitGrainJob {

    private final int grainId;
    private final GrainParameters initialParameters;

    public FitGrainJob(final int grainId,
                       final GrainParameters initialParameters) {
        this.grainId = grainId;
        this.initialParameters = initialParameters;
    }

    public int getGrainId() {
        return grainId;
    }

    public GrainParameters getInitialParameters() {
        return initialParameters;
    }

    @Override
    public String toString() {
        return "grain " + grainId;
    }
}
