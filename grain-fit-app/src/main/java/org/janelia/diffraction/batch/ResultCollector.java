package org.janelia.diffraction.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import org.janelia.diffraction.fit.GrainFitResult;
import org.janelia.diffraction.util.ProgressTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Channel through which workers send exactly one result per job to the orchestrator.
 */
public class ResultCollector {

    private static final long POLL_MILLISECONDS = 500;

    private final BlockingQueue<GrainFitResult> channel;
    private final Set<Integer> appendedGrainIds;
    private final long progressInterval;

    public ResultCollector() {
        this(ProgressTimer.DEFAULT_INTERVAL);
    }

    /**
     * @param  progressInterval  milliseconds between progress log statements while waiting.
     */
    public ResultCollector(final long progressInterval) {
        this.channel = new LinkedBlockingQueue<>();
        this.appendedGrainIds = ConcurrentHashMap.newKeySet();
        this.progressInterval = progressInterval;
    }

    /**
     * Thread safe, never blocks.
     *
     * @throws IllegalStateException
     *   if a result for the same grain has already been appended.
     */
    public void append(final GrainFitResult result)
            throws IllegalStateException {
        if (! appendedGrainIds.add(result.getGrainId())) {
            throw new IllegalStateException("result for grain " + result.getGrainId() + " was already appended");
        }
        channel.add(result);
    }

    /**
     * @return number of results appended so far.
     */
    public int getAppendedCount() {
        return appendedGrainIds.size();
    }

    /**
     * Drains the channel until the expected number of results has been received.
     *
     * @param  expectedCount   number of results to wait for.
     * @param  workersRunning  reports whether any worker is still running.
     *
     * @return received results in arrival order.
     *
     * @throws IllegalStateException
     *   if every worker has stopped while results are still missing.
     */
    public List<GrainFitResult> awaitResults(final int expectedCount,
                                             final BooleanSupplier workersRunning)
            throws InterruptedException, IllegalStateException {

        final List<GrainFitResult> results = new ArrayList<>(expectedCount);
        final ProgressTimer timer = new ProgressTimer(expectedCount, progressInterval);

        while (results.size() < expectedCount) {

            final GrainFitResult result = channel.poll(POLL_MILLISECONDS, TimeUnit.MILLISECONDS);

            if (result == null) {
                // results sent just before the last worker stopped are still in the channel
                if ((! workersRunning.getAsBoolean()) && channel.isEmpty()) {
                    throw new IllegalStateException("all workers stopped after sending " + results.size() +
                                                    " of " + expectedCount + " results");
                }
            } else {
                results.add(result);
                if (timer.hasIntervalPassed()) {
                    LOG.info("awaitResults: received {}", timer.getProgress(results.size()));
                }
            }
        }

        LOG.info("awaitResults: received all {} results after {}", expectedCount, timer);

        return results;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ResultCollector.class);
}
