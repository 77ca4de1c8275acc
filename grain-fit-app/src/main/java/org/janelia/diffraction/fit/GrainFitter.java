package org.janelia.diffraction.fit;

import java.util.List;

import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.janelia.diffraction.geometry.DistortionModel;
import org.janelia.diffraction.geometry.Rotations;
import org.janelia.diffraction.geometry.SharedGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Masked nonlinear least squares refinement of grain parameters against measured reflection centroids.
 *
 * The objective holds three entries per reflection: predicted minus measured panel x and y (mm, measured
 * positions corrected for distortion) and the signed rotation angle difference (radians) to the
 * prediction nearest the measured angle.
 */
public class GrainFitter {

    /** Residual used for each component of a reflection that can no longer be predicted. */
    public static final double UNPREDICTABLE_RESIDUAL = 1.0e3;

    private static final int MAX_EVALUATIONS = 10000;
    private static final int MAX_ITERATIONS = 1000;
    private static final double RELATIVE_STEP = 1.0e-7;

    private final SharedGeometry geometry;

    public GrainFitter(final SharedGeometry geometry) {
        this.geometry = geometry;
    }

    /**
     * @param  start        initial estimate (also the source of all fixed values).
     * @param  reflections  valid reflections to fit.
     * @param  mask         parameters to refine and their scales.
     *
     * @return refined parameters.
     *
     * @throws IllegalArgumentException
     *   if there are fewer residuals than refined parameters.
     *
     * @throws org.apache.commons.math3.exception.TooManyEvaluationsException
     *   if the optimizer does not converge within its evaluation budget.
     */
    public GrainParameters fit(final GrainParameters start,
                               final List<Reflection> reflections,
                               final RefinementMask mask)
            throws IllegalArgumentException {

        final int numberOfRefined = mask.getNumberOfRefinedParameters();
        if (numberOfRefined == 0) {
            return start;
        }

        final int numberOfResiduals = 3 * reflections.size();
        if (numberOfResiduals < numberOfRefined) {
            throw new IllegalArgumentException(reflections.size() + " reflections cannot constrain " +
                                               numberOfRefined + " parameters");
        }

        final Measurements measurements = new Measurements(reflections, geometry);

        final MultivariateJacobianFunction model = point -> {
            final double[] free = point.toArray();
            final double[] value = residuals(mask.fromScaledFree(free, start), measurements);
            final double[][] jacobian = new double[numberOfResiduals][numberOfRefined];
            for (int j = 0; j < numberOfRefined; j++) {
                final double original = free[j];
                final double step = RELATIVE_STEP * Math.max(1.0, Math.abs(original));
                free[j] = original + step;
                final double[] plus = residuals(mask.fromScaledFree(free, start), measurements);
                free[j] = original - step;
                final double[] minus = residuals(mask.fromScaledFree(free, start), measurements);
                free[j] = original;
                for (int i = 0; i < numberOfResiduals; i++) {
                    jacobian[i][j] = (plus[i] - minus[i]) / (2.0 * step);
                }
            }
            return new Pair<RealVector, RealMatrix>(new ArrayRealVector(value, false),
                                                    new Array2DRowRealMatrix(jacobian, false));
        };

        final LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(mask.toScaledFree(start))
                .model(model)
                .target(new double[numberOfResiduals])
                .maxEvaluations(MAX_EVALUATIONS)
                .maxIterations(MAX_ITERATIONS)
                .build();

        final LeastSquaresOptimizer.Optimum optimum = new LevenbergMarquardtOptimizer().optimize(problem);

        LOG.debug("fit: converged after {} iterations and {} evaluations, rms {}",
                  optimum.getIterations(), optimum.getEvaluations(), optimum.getRMS());

        return mask.fromScaledFree(optimum.getPoint().toArray(), start);
    }

    /**
     * @return full (unmasked) objective vector for the parameters against the measured reflections.
     */
    public double[] residuals(final GrainParameters parameters,
                              final List<Reflection> reflections) {
        return residuals(parameters, new Measurements(reflections, geometry));
    }

    /**
     * @return sum of squared objective entries.
     */
    public double sumOfSquaredResiduals(final GrainParameters parameters,
                                        final List<Reflection> reflections) {
        double sum = 0.0;
        for (final double r : residuals(parameters, reflections)) {
            sum += r * r;
        }
        return sum;
    }

    private double[] residuals(final GrainParameters parameters,
                               final Measurements measurements) {
        final DiffractionModel model = new DiffractionModel(geometry, parameters);
        final double[] residuals = new double[3 * measurements.size()];
        for (int i = 0; i < measurements.size(); i++) {
            final DiffractionModel.Prediction prediction = model.predictNearest(measurements.hkl[i],
                                                                                measurements.omega[i]);
            final int offset = 3 * i;
            if (prediction == null) {
                residuals[offset] = UNPREDICTABLE_RESIDUAL;
                residuals[offset + 1] = UNPREDICTABLE_RESIDUAL;
                residuals[offset + 2] = UNPREDICTABLE_RESIDUAL;
            } else {
                residuals[offset] = prediction.getX() - measurements.x[i];
                residuals[offset + 1] = prediction.getY() - measurements.y[i];
                residuals[offset + 2] = Rotations.angularDifference(prediction.getOmega(), measurements.omega[i]);
            }
        }
        return residuals;
    }

    /**
     * Distortion corrected measurements with rotation angles in the configured omega period, computed once per fit.
     */
    private static class Measurements {

        private final double[][] hkl;
        private final double[] x;
        private final double[] y;
        private final double[] omega;

        private Measurements(final List<Reflection> reflections,
                             final SharedGeometry geometry) {
            final DistortionModel distortion = geometry.getDistortion();
            final Double periodStart = geometry.getOmegaPeriodStart();
            final int n = reflections.size();
            this.hkl = new double[n][];
            this.x = new double[n];
            this.y = new double[n];
            this.omega = new double[n];
            for (int i = 0; i < n; i++) {
                final Reflection reflection = reflections.get(i);
                final double[] ideal = distortion.correct(reflection.getMeasuredX(), reflection.getMeasuredY());
                hkl[i] = reflection.getHklVector();
                x[i] = ideal[0];
                y[i] = ideal[1];
                omega[i] = periodStart == null ?
                           reflection.getMeasuredOmega() :
                           Rotations.mapAngle(reflection.getMeasuredOmega(), periodStart);
            }
        }

        private int size() {
            return x.length;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(GrainFitter.class);
}
