package org.janelia.grainfit.client;

import ij.IJ;
import ij.ImagePlus;
import ij.ImageStack;
import ij.process.FloatProcessor;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.janelia.diffraction.batch.GrainsReport;
import org.janelia.diffraction.fit.GrainFitResult;
import org.janelia.diffraction.geometry.InstrumentSpec;
import org.janelia.diffraction.material.MaterialSpec;
import org.janelia.grainfit.client.parameter.CommandLineParameters;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link FitGrainsClient} class.
 */
public class FitGrainsClientTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private Path root;

    @Before
    public void setUp() throws Exception {

        root = temporaryFolder.getRoot().toPath();

        final StringBuilder legacy = new StringBuilder();
        for (final double value : new double[] {6.4, 6.4, 1000.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 2.0, 2.0, 2.0}) {
            legacy.append(value).append(" 0\n");
        }
        write("detector.par", legacy.toString());

        write("material.json", MaterialSpec.cubic("gold", 4.08, MaterialSpec.Centering.F, 3, 0.2).toJson());

        write("quats.out",
              "1.0 0.0 0.0 0.0\n" +
              "0.9 0.1 0.3 0.2\n");

        final ImageStack stack = new ImageStack(64, 64);
        for (int i = 0; i < 20; i++) {
            stack.addSlice(new FloatProcessor(64, 64));
        }
        IJ.saveAsTiff(new ImagePlus("frames", stack), root.resolve("frames.tif").toString());
    }

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new FitGrainsClient.Parameters());
    }

    @Test
    public void testToleranceParsing() {

        final FitGrainsClient.Parameters parameters = parse();
        Assert.assertEquals("invalid number of iterations", 2,
                            parameters.tolerance.getSchedule().getNumberOfIterations());
        Assert.assertEquals("invalid default eta tolerance", 1.0,
                            parameters.tolerance.getSchedule().get(0).getEta(), 0.0);

        final FitGrainsClient.Parameters custom = parse("--tthTolerance", "0.4", "0.3", "0.2",
                                                        "--etaTolerance", "2.0", "1.0", "0.5",
                                                        "--omegaTolerance", "2.0", "1.0", "0.5");
        Assert.assertEquals("invalid number of iterations", 3,
                            custom.tolerance.getSchedule().getNumberOfIterations());
        Assert.assertEquals("invalid last tth tolerance", 0.2,
                            custom.tolerance.getSchedule().get(2).getTth(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMismatchedToleranceLists() {
        parse("--tthTolerance", "0.4", "0.3", "0.2").validate();
    }

    @Test
    public void testAngularLimitParsing() {

        final FitGrainsClient.Parameters defaults = parse();
        Assert.assertTrue("default eta ranges should be empty", defaults.getEtaRangesInRadians().isEmpty());
        Assert.assertNull("default omega period start should be null", defaults.getOmegaPeriodStartInRadians());

        final FitGrainsClient.Parameters parameters = parse("--etaRange", "5", "175", "185", "355",
                                                            "--omegaPeriodStart", "0");
        parameters.validate();

        final List<double[]> ranges = parameters.getEtaRangesInRadians();
        Assert.assertEquals("invalid number of eta ranges", 2, ranges.size());
        Assert.assertArrayEquals("invalid second eta range",
                                 new double[] {Math.toRadians(185), Math.toRadians(355)}, ranges.get(1), 1.0e-12);
        Assert.assertEquals("invalid omega period start", 0.0, parameters.getOmegaPeriodStartInRadians(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnpairedEtaRange() {
        parse("--etaRange", "5", "175", "185").validate();
    }

    @Test
    public void testFitGrains() throws Exception {

        final List<GrainFitResult> results = new FitGrainsClient(parse()).fitGrains();

        Assert.assertEquals("invalid number of results", 2, results.size());
        for (final GrainFitResult result : results) {
            Assert.assertTrue("grain " + result.getGrainId() + " should complete", result.isCompleted());
            Assert.assertEquals("blank frames should give zero completeness",
                                0.0, result.getCompleteness(), 0.0);
        }

        final Path instrumentPath = root.resolve("instrument.json");
        Assert.assertTrue("legacy detector file should be migrated", Files.exists(instrumentPath));
        Assert.assertArrayEquals("invalid migrated translation",
                                 new double[] {0.0, 0.0, -1000.0},
                                 InstrumentSpec.load(instrumentPath).getDetector().getTransform().getTranslation(),
                                 1.0e-12);

        final Path analysisPath = root.resolve("analysis");
        final List<String> lines = Files.readAllLines(analysisPath.resolve(GrainsReport.DEFAULT_FILE_NAME),
                                                      StandardCharsets.UTF_8);
        Assert.assertEquals("invalid number of report lines", 3, lines.size());
        Assert.assertTrue("log file should be written",
                          Files.exists(analysisPath.resolve(FitGrainsClient.LOG_FILE_NAME)));
    }

    @Test
    public void testExistingReportRequiresForce() throws Exception {

        new FitGrainsClient(parse()).fitGrains();

        try {
            new FitGrainsClient(parse()).fitGrains();
            Assert.fail("existing report should not be overwritten without --force");
        } catch (final IllegalStateException e) {
            Assert.assertTrue("unexpected message: " + e.getMessage(), e.getMessage().contains("--force"));
        }

        final List<GrainFitResult> results = new FitGrainsClient(parse("--force")).fitGrains();
        Assert.assertEquals("invalid number of results", 2, results.size());
    }

    private FitGrainsClient.Parameters parse(final String... extraArgs) {

        final String[] baseArgs = {
                "--instrumentFile", root.resolve("instrument.json").toString(),
                "--legacyDetectorFile", root.resolve("detector.par").toString(),
                "--detectorRows", "64",
                "--detectorColumns", "64",
                "--pixelSize", "0.2",
                "--materialFile", root.resolve("material.json").toString(),
                "--orientationsFile", root.resolve("quats.out").toString(),
                "--imageStack", root.resolve("frames.tif").toString(),
                "--omegaStart", "-5.0",
                "--omegaStep", "0.5",
                "--panelBuffer", "0.0",
                "--numberOfWorkers", "2",
                "--analysisDirectory", root.resolve("analysis").toString()
        };

        final String[] args = new String[baseArgs.length + extraArgs.length];
        System.arraycopy(baseArgs, 0, args, 0, baseArgs.length);
        System.arraycopy(extraArgs, 0, args, baseArgs.length, extraArgs.length);

        final FitGrainsClient.Parameters parameters = new FitGrainsClient.Parameters();
        Assert.assertTrue("failed to parse arguments", parameters.parse(args, FitGrainsClient.class, false));
        return parameters;
    }

    private void write(final String name,
                       final String content) throws Exception {
        Files.write(root.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }
}
