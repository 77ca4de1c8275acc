package org.janelia.diffraction.fit;

/**
 * Immutable outcome of one grain refinement job.
 *
 * Completed results carry refined (or, after an early exit, unrefined) parameters.
 * Failed results carry the job's initial parameters, zero completeness, NaN strain and residual, and the reason
 * processing failed so that the batch can still account for every job.
 */
public class GrainFitResult {

    public enum Status {
        COMPLETED, FAILED
    }

    private final int grainId;
    private final Status status;
    private final GrainParameters parameters;
    private final double completeness;
    private final double[][] strain;
    private final double sumOfSquaredResiduals;
    private final int numberOfReflections;
    private final String failureReason;

    private GrainFitResult(final int grainId,
                           final Status status,
                           final GrainParameters parameters,
                           final double completeness,
                           final double[][] strain,
                           final double sumOfSquaredResiduals,
                           final int numberOfReflections,
                           final String failureReason)
            throws IllegalArgumentException {

        if (! ((completeness >= 0.0) && (completeness <= 1.0))) {
            throw new IllegalArgumentException("completeness " + completeness + " for grain " + grainId +
                                               " is outside [0, 1]");
        }

        this.grainId = grainId;
        this.status = status;
        this.parameters = parameters;
        this.completeness = completeness;
        this.strain = new double[3][];
        for (int i = 0; i < 3; i++) {
            this.strain[i] = strain[i].clone();
        }
        this.sumOfSquaredResiduals = sumOfSquaredResiduals;
        this.numberOfReflections = numberOfReflections;
        this.failureReason = failureReason;
    }

    public static GrainFitResult completed(final int grainId,
                                           final GrainParameters parameters,
                                           final double completeness,
                                           final double[][] strain,
                                           final double sumOfSquaredResiduals,
                                           final int numberOfReflections)
            throws IllegalArgumentException {
        return new GrainFitResult(grainId, Status.COMPLETED, parameters, completeness, strain,
                                  sumOfSquaredResiduals, numberOfReflections, null);
    }

    public static GrainFitResult failed(final int grainId,
                                        final GrainParameters initialParameters,
                                        final String reason) {
        final double[][] strain = {
                {Double.NaN, Double.NaN, Double.NaN},
                {Double.NaN, Double.NaN, Double.NaN},
                {Double.NaN, Double.NaN, Double.NaN}
        };
        return new GrainFitResult(grainId, Status.FAILED, initialParameters, 0.0, strain,
                                  Double.NaN, 0, reason);
    }

    public int getGrainId() {
        return grainId;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isCompleted() {
        return Status.COMPLETED.equals(status);
    }

    public GrainParameters getParameters() {
        return parameters;
    }

    public double getCompleteness() {
        return completeness;
    }

    /**
     * @return copy of the symmetric strain tensor.
     */
    public double[][] getStrain() {
        final double[][] copy = new double[3][];
        for (int i = 0; i < 3; i++) {
            copy[i] = strain[i].clone();
        }
        return copy;
    }

    public double getSumOfSquaredResiduals() {
        return sumOfSquaredResiduals;
    }

    public int getNumberOfReflections() {
        return numberOfReflections;
    }

    /**
     * @return sum of squared residuals divided by the number of reflections (0 when there are none).
     */
    public double getNormalizedResidual() {
        return numberOfReflections == 0 ? (isCompleted() ? 0.0 : Double.NaN) :
               sumOfSquaredResiduals / numberOfReflections;
    }

    public String getFailureReason() {
        return failureReason;
    }

    @Override
    public String toString() {
        return "{grainId: " + grainId + ", status: " + status + ", completeness: " + completeness +
               (failureReason == null ? "" : ", reason: '" + failureReason + "'") + '}';
    }
}
