package org.janelia.diffraction.fit;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.janelia.diffraction.frame.FrameSeries;
import org.janelia.diffraction.geometry.SharedGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refines one grain at a time through the tolerance schedule: each iteration associates reflections with the
 * current estimate and then fits the estimate to them. After the last iteration (or an early exit) the strain
 * and the residual of the final estimate are derived.
 *
 * Engines hold no per-job state, but each worker should still own its own instance.
 */
public class RefinementEngine {

    /** Jobs with this many (or fewer) fit reflections in an iteration stop refining with zero completeness. */
    public static final int MINIMUM_REFLECTIONS = GrainParameters.NUMBER_OF_PARAMETERS;

    private final ToleranceSchedule schedule;
    private final RefinementMask mask;
    private final ReflectionAssociator associator;
    private final GrainFitter fitter;
    private final Path reflectionTableDirectory;

    /**
     * @param  reflectionTableDirectory  directory for per-grain reflection tables, or null to skip writing them.
     */
    public RefinementEngine(final SharedGeometry geometry,
                            final FrameSeries frames,
                            final ToleranceSchedule schedule,
                            final RefinementMask mask,
                            final Path reflectionTableDirectory) {
        this.schedule = schedule;
        this.mask = mask;
        this.associator = new ReflectionAssociator(geometry, frames);
        this.fitter = new GrainFitter(geometry);
        this.reflectionTableDirectory = reflectionTableDirectory;
    }

    /**
     * @return completed result for the job.
     *
     * @throws IOException
     *   if a reflection table cannot be written.
     *
     * @throws RuntimeException
     *   if the fit or the strain derivation fails numerically (callers convert this to a failed result).
     */
    public GrainFitResult refine(final FitGrainJob job)
            throws IOException {

        final int grainId = job.getGrainId();
        GrainParameters parameters = job.getInitialParameters();
        double completeness = 0.0;
        ReflectionTable table = null;

        for (int iteration = 0; iteration < schedule.getNumberOfIterations(); iteration++) {

            final Tolerance tolerance = schedule.get(iteration);
            table = associator.associate(grainId, parameters, tolerance);

            if (reflectionTableDirectory != null) {
                table.write(reflectionTableDirectory.resolve(ReflectionTable.getFileName(grainId)));
            }

            final List<Reflection> fitReflections = table.getFitReflections();

            LOG.debug("refine: grain {} iteration {} with tolerance {} found {} of {} candidate reflections",
                      grainId, iteration, tolerance, fitReflections.size(), table.getNumberOfCandidates());

            if (fitReflections.size() <= MINIMUM_REFLECTIONS) {
                LOG.info("refine: grain {} has only {} reflections in iteration {}, skipping remaining fits",
                         grainId, fitReflections.size(), iteration);
                completeness = 0.0;
                break;
            }

            parameters = fitter.fit(parameters, fitReflections, mask);
            completeness = table.getCompleteness();
        }

        final double[][] strain = Tensors.strainOfStretch(parameters.getStretch());

        // table is never null since schedules always have at least one iteration
        final List<Reflection> finalReflections = table.getFitReflections();
        final double sumOfSquaredResiduals = fitter.sumOfSquaredResiduals(parameters, finalReflections);

        return GrainFitResult.completed(grainId,
                                        parameters,
                                        completeness,
                                        strain,
                                        sumOfSquaredResiduals,
                                        finalReflections.size());
    }

    private static final Logger LOG = LoggerFactory.getLogger(RefinementEngine.class);
}
