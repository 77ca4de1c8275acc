package org.janelia.diffraction.batch;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.janelia.diffraction.fit.GrainFitResult;
import org.janelia.diffraction.fit.SyntheticExperiment;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ResultCollector} class.
 */
public class ResultCollectorTest {

    @Test
    public void testConcurrentAppend() throws Exception {

        final ResultCollector collector = new ResultCollector();
        final int threadCount = 8;
        final int perThread = 25;

        final ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        final List<Future<Integer>> futures = new ArrayList<>();
        for (int t = 0; t < threadCount; t++) {
            final int offset = t * perThread;
            final Callable<Integer> appender = () -> {
                for (int i = 0; i < perThread; i++) {
                    collector.append(failedResult(offset + i));
                }
                return perThread;
            };
            futures.add(executorService.submit(appender));
        }

        final List<GrainFitResult> results =
                collector.awaitResults(threadCount * perThread, () -> futures.stream().anyMatch(f -> ! f.isDone()));
        executorService.shutdown();

        final Set<Integer> ids = new HashSet<>();
        results.forEach(r -> ids.add(r.getGrainId()));
        Assert.assertEquals("results lost or duplicated", threadCount * perThread, ids.size());
        Assert.assertEquals("invalid appended count", threadCount * perThread, collector.getAppendedCount());
    }

    @Test(expected = IllegalStateException.class)
    public void testDuplicateGrainIdIsRejected() {
        final ResultCollector collector = new ResultCollector();
        collector.append(failedResult(5));
        collector.append(failedResult(5));
    }

    @Test(expected = IllegalStateException.class)
    public void testMissingResultsFailWhenWorkersStop() throws Exception {
        final ResultCollector collector = new ResultCollector();
        collector.append(failedResult(0));
        collector.awaitResults(2, () -> false);
    }

    private static GrainFitResult failedResult(final int grainId) {
        return GrainFitResult.failed(grainId, SyntheticExperiment.identityGrain(), "test");
    }
}
