package org.janelia.diffraction.batch;

import java.util.concurrent.Callable;

import org.janelia.diffraction.fit.FitGrainJob;
import org.janelia.diffraction.fit.GrainFitResult;
import org.janelia.diffraction.fit.RefinementEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls jobs from the queue until it is empty, refining each with the worker's own engine.
 * Every dequeued job produces exactly one result: a processing failure becomes a failed result.
 *
 * Returns the number of jobs this worker processed.
 */
public class FitGrainsWorker
        implements Callable<Integer> {

    private final int workerIndex;
    private final JobQueue jobQueue;
    private final ResultCollector resultCollector;
    private final RefinementEngine engine;

    public FitGrainsWorker(final int workerIndex,
                           final JobQueue jobQueue,
                           final ResultCollector resultCollector,
                           final RefinementEngine engine) {
        this.workerIndex = workerIndex;
        this.jobQueue = jobQueue;
        this.resultCollector = resultCollector;
        this.engine = engine;
    }

    @Override
    public Integer call() {

        LOG.debug("call: entry, worker {}", workerIndex);

        int processedCount = 0;
        FitGrainJob job;
        while ((job = jobQueue.tryGet()) != null) {
            try {
                resultCollector.append(process(job));
            } finally {
                jobQueue.taskDone();
            }
            processedCount++;
        }

        LOG.debug("call: exit, worker {} processed {} jobs", workerIndex, processedCount);

        return processedCount;
    }

    private GrainFitResult process(final FitGrainJob job) {
        GrainFitResult result;
        try {
            result = engine.refine(job);
        } catch (final Throwable t) {
            LOG.warn("process: worker " + workerIndex + " failed to refine " + job, t);
            final String reason = t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
            result = GrainFitResult.failed(job.getGrainId(), job.getInitialParameters(), reason);
        }
        return result;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FitGrainsWorker.class);
}
