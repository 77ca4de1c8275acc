package org.janelia.diffraction.batch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.janelia.diffraction.fit.FitGrainJob;
import org.janelia.diffraction.fit.GrainFitResult;
import org.janelia.diffraction.fit.RefinementEngine;
import org.janelia.diffraction.fit.RefinementMask;
import org.janelia.diffraction.fit.ToleranceSchedule;
import org.janelia.diffraction.frame.FrameSeries;
import org.janelia.diffraction.geometry.SharedGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a batch of grain jobs on a fixed pool of workers and returns their results sorted by grain id.
 *
 * Each worker gets its own copy of the geometry and its own {@link RefinementEngine}.
 * The frame series is shared read-only.
 */
public class FitGrainsOrchestrator {

    private final SharedGeometry geometry;
    private final FrameSeries frames;
    private final ToleranceSchedule schedule;
    private final RefinementMask mask;
    private final int numberOfWorkers;
    private final Path reflectionTableDirectory;

    /**
     * @param  reflectionTableDirectory  directory for per-grain reflection tables, or null to skip writing them.
     */
    public FitGrainsOrchestrator(final SharedGeometry geometry,
                                 final FrameSeries frames,
                                 final ToleranceSchedule schedule,
                                 final RefinementMask mask,
                                 final int numberOfWorkers,
                                 final Path reflectionTableDirectory)
            throws IllegalArgumentException {
        if (numberOfWorkers < 1) {
            throw new IllegalArgumentException("at least one worker is required");
        }
        this.geometry = geometry;
        this.frames = frames;
        this.schedule = schedule;
        this.mask = mask;
        this.numberOfWorkers = numberOfWorkers;
        this.reflectionTableDirectory = reflectionTableDirectory;
    }

    /**
     * @return one result per job, sorted by grain id.
     *
     * @throws IllegalStateException
     *   if a worker dies (the cause is the worker's exception) or if results are missing
     *   or do not match the submitted jobs.
     */
    public List<GrainFitResult> fitGrains(final List<FitGrainJob> jobs)
            throws InterruptedException, IllegalStateException {

        LOG.info("fitGrains: entry, fitting {} grains with {} workers and schedule {}",
                 jobs.size(), numberOfWorkers, schedule);

        final JobQueue jobQueue = new JobQueue();
        jobs.forEach(jobQueue::put);

        final ResultCollector resultCollector = new ResultCollector();

        final ExecutorService executorService = Executors.newFixedThreadPool(numberOfWorkers);
        final List<Future<Integer>> futures = new ArrayList<>(numberOfWorkers);
        final List<GrainFitResult> results;
        try {
            for (int i = 0; i < numberOfWorkers; i++) {
                final FitGrainsWorker worker = new FitGrainsWorker(i,
                                                                   jobQueue,
                                                                   resultCollector,
                                                                   buildEngine(geometry.copy()));
                futures.add(executorService.submit(worker));
            }

            try {
                results = resultCollector.awaitResults(jobs.size(),
                                                       () -> futures.stream().anyMatch(f -> ! f.isDone()));
            } catch (final IllegalStateException e) {
                // report the worker that died rather than the missing results it caused
                for (final Future<Integer> future : futures) {
                    if (future.isDone()) {
                        getProcessedCount(future);
                    }
                }
                throw e;
            }
            jobQueue.awaitCompletion();

        } finally {
            executorService.shutdown();
        }

        int processedCount = 0;
        for (final Future<Integer> future : futures) {
            processedCount += getProcessedCount(future);
        }

        results.sort(Comparator.comparingInt(GrainFitResult::getGrainId));
        validateResults(jobs, results);

        final long failedCount = results.stream().filter(r -> ! r.isCompleted()).count();
        if (failedCount > 0) {
            LOG.warn("fitGrains: {} of {} grains failed", failedCount, results.size());
        }

        LOG.info("fitGrains: exit, workers processed {} jobs", processedCount);

        return results;
    }

    /**
     * @return engine for one worker.
     */
    protected RefinementEngine buildEngine(final SharedGeometry workerGeometry) {
        return new RefinementEngine(workerGeometry, frames, schedule, mask, reflectionTableDirectory);
    }

    private static int getProcessedCount(final Future<Integer> future)
            throws InterruptedException, IllegalStateException {
        try {
            return future.get();
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.error("getProcessedCount: worker failed", cause);
            throw new IllegalStateException("fit grains worker failed: " + cause.getMessage(), cause);
        }
    }

    private static void validateResults(final List<FitGrainJob> jobs,
                                        final List<GrainFitResult> sortedResults)
            throws IllegalStateException {

        final List<Integer> expectedIds = new ArrayList<>(jobs.size());
        jobs.forEach(job -> expectedIds.add(job.getGrainId()));
        expectedIds.sort(Integer::compareTo);

        if (expectedIds.size() != sortedResults.size()) {
            throw new IllegalStateException("expected " + expectedIds.size() + " results but received " +
                                            sortedResults.size());
        }
        for (int i = 0; i < expectedIds.size(); i++) {
            final int resultId = sortedResults.get(i).getGrainId();
            if (expectedIds.get(i) != resultId) {
                throw new IllegalStateException("result for grain " + resultId + " does not match job for grain " +
                                                expectedIds.get(i));
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(FitGrainsOrchestrator.class);
}
