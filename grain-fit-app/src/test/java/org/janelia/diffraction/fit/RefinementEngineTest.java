package org.janelia.diffraction.fit;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import org.janelia.diffraction.frame.FrameSeries;
import org.janelia.diffraction.geometry.Rotations;
import org.janelia.diffraction.geometry.SharedGeometry;
import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link RefinementEngine} class.
 */
public class RefinementEngineTest {

    private static SharedGeometry geometry;
    private static FrameSeries frames;

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @BeforeClass
    public static void setUp() {
        geometry = SyntheticExperiment.buildGeometry();
        frames = SyntheticExperiment.buildFrames(geometry,
                                                 Collections.singletonList(SyntheticExperiment.identityGrain()));
    }

    @Test
    public void testRefineExactGrain() throws Exception {

        final RefinementEngine engine = buildEngine(null);
        final GrainFitResult result = engine.refine(new FitGrainJob(7, SyntheticExperiment.identityGrain()));

        Assert.assertTrue("result should be completed", result.isCompleted());
        Assert.assertEquals("invalid grain id", 7, result.getGrainId());
        Assert.assertTrue("too few reflections used: " + result.getNumberOfReflections(),
                          result.getNumberOfReflections() > RefinementEngine.MINIMUM_REFLECTIONS);
        Assert.assertEquals("invalid completeness",
                            SyntheticExperiment.exactCompleteness(geometry, frames, SyntheticExperiment.identityGrain()),
                            result.getCompleteness(), 0.0);
        Assert.assertTrue("completeness " + result.getCompleteness() + " should only miss scan edge rows",
                          result.getCompleteness() > 0.9);
        Assert.assertEquals("residual should be near zero", 0.0, result.getNormalizedResidual(), 1.0e-6);

        final double[] refined = result.getParameters().toArray();
        final double[] expected = SyntheticExperiment.identityGrain().toArray();
        for (int i = 0; i < refined.length; i++) {
            Assert.assertEquals("parameter " + i + " moved", expected[i], refined[i], 1.0e-5);
        }

        final double[][] strain = result.getStrain();
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                Assert.assertEquals("strain [" + i + "][" + j + "] should be near zero", 0.0, strain[i][j], 1.0e-5);
            }
        }
    }

    @Test
    public void testRefinePerturbedOrientation() throws Exception {

        final GrainParameters start = SyntheticExperiment.grain(new double[] {0.0005, -0.0004, 0.0003});
        final RefinementEngine engine = buildEngine(null);
        final GrainFitResult result = engine.refine(new FitGrainJob(0, start));

        Assert.assertTrue("result should be completed", result.isCompleted());

        final double startError = Rotations.norm(start.getOrientation());
        final double refinedError = Rotations.misorientation(Rotations.identity(),
                                                             result.getParameters().getOrientationMatrix());

        Assert.assertTrue("orientation error " + refinedError + " should be smaller than " + startError,
                          refinedError < startError);
        Assert.assertEquals("orientation should be recovered", 0.0, refinedError, 1.0e-5);
        Assert.assertEquals("invalid completeness",
                            SyntheticExperiment.exactCompleteness(geometry, frames, SyntheticExperiment.identityGrain()),
                            result.getCompleteness(), 0.05);
    }

    @Test
    public void testEarlyExitKeepsParameters() throws Exception {

        // an orientation whose spots are nowhere near the painted ones
        final GrainParameters start = SyntheticExperiment.grain(new double[] {0.3, 0.5, -0.2});
        final RefinementEngine engine = buildEngine(null);
        final GrainFitResult result = engine.refine(new FitGrainJob(3, start));

        Assert.assertTrue("degraded job should still be completed", result.isCompleted());
        Assert.assertEquals("completeness should be zero", 0.0, result.getCompleteness(), 0.0);
        Assert.assertEquals("parameters should not be refined", start, result.getParameters());
        Assert.assertTrue("too many reflections for early exit: " + result.getNumberOfReflections(),
                          result.getNumberOfReflections() <= RefinementEngine.MINIMUM_REFLECTIONS);
    }

    @Test
    public void testMaskedRefinementKeepsFixedParameters() throws Exception {

        final GrainParameters start = SyntheticExperiment.grain(new double[] {0.0005, 0.0, 0.0});
        final RefinementEngine engine = new RefinementEngine(geometry,
                                                             frames,
                                                             SyntheticExperiment.SCHEDULE,
                                                             RefinementMask.refining(0, 1, 2),
                                                             null);
        final GrainFitResult result = engine.refine(new FitGrainJob(0, start));

        final double[] refined = result.getParameters().toArray();
        final double[] initial = start.toArray();
        for (int i = 3; i < GrainParameters.NUMBER_OF_PARAMETERS; i++) {
            Assert.assertEquals("fixed parameter " + i + " changed", initial[i], refined[i], 0.0);
        }
        Assert.assertEquals("orientation should be recovered", 0.0, refined[0], 1.0e-5);
    }

    @Test
    public void testReflectionTablesAreWritten() throws Exception {

        final Path directory = temporaryFolder.getRoot().toPath();
        final RefinementEngine engine = buildEngine(directory);
        engine.refine(new FitGrainJob(12, SyntheticExperiment.identityGrain()));

        final Path tablePath = directory.resolve(ReflectionTable.getFileName(12));
        Assert.assertTrue("missing " + tablePath, Files.exists(tablePath));

        final ReflectionTable table = ReflectionTable.read(tablePath, 12);
        final long inScanWindow = table.getReflections().stream().filter(Reflection::isInScanWindow).count();
        Assert.assertEquals("every row inside the scan window should be measured",
                            inScanWindow, table.getFitReflections().size());
        Assert.assertEquals("invalid completeness for table read back",
                            table.getFitReflections().size() / (double) table.getReflections().size(),
                            table.getCompleteness(), 0.0);
        Assert.assertTrue("table should have fit reflections",
                          table.getFitReflections().size() > RefinementEngine.MINIMUM_REFLECTIONS);
    }

    @Test
    public void testOmegaPeriodDoesNotChangeFit() throws Exception {

        // report rotation angles in [0, 2 pi) although the scan runs from -60 to 60 degrees
        final SharedGeometry periodGeometry = geometry.withAngularLimits(null, 0.0);
        final Path directory = temporaryFolder.getRoot().toPath();
        final RefinementEngine engine = new RefinementEngine(periodGeometry,
                                                             frames,
                                                             SyntheticExperiment.SCHEDULE,
                                                             RefinementMask.DEFAULT,
                                                             directory);
        final GrainParameters start = SyntheticExperiment.grain(new double[] {0.0005, -0.0004, 0.0003});
        final GrainFitResult result = engine.refine(new FitGrainJob(5, start));

        Assert.assertEquals("orientation should be recovered", 0.0,
                            Rotations.misorientation(Rotations.identity(),
                                                     result.getParameters().getOrientationMatrix()),
                            1.0e-5);

        boolean hasNegativeScanAngle = false;
        for (final Reflection reflection : ReflectionTable.read(directory.resolve(ReflectionTable.getFileName(5)), 5)
                .getFitReflections()) {
            Assert.assertTrue("predicted omega " + reflection.getPredictedOmega() + " outside period",
                              (reflection.getPredictedOmega() >= 0.0) && (reflection.getPredictedOmega() < 2 * Math.PI));
            Assert.assertTrue("measured omega " + reflection.getMeasuredOmega() + " outside period",
                              (reflection.getMeasuredOmega() >= 0.0) && (reflection.getMeasuredOmega() < 2 * Math.PI));
            hasNegativeScanAngle = hasNegativeScanAngle || (reflection.getPredictedOmega() > Math.PI);
        }
        Assert.assertTrue("some reflections should come from the negative half of the scan", hasNegativeScanAngle);
    }

    private RefinementEngine buildEngine(final Path reflectionTableDirectory) {
        return new RefinementEngine(geometry,
                                    frames,
                                    SyntheticExperiment.SCHEDULE,
                                    RefinementMask.DEFAULT,
                                    reflectionTableDirectory);
    }
}
