package org.janelia.grainfit.client;

import ch.qos.logback.classic.Level;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.janelia.diffraction.batch.FitGrainsOrchestrator;
import org.janelia.diffraction.batch.GrainsReport;
import org.janelia.diffraction.batch.OrientationTable;
import org.janelia.diffraction.fit.FitGrainJob;
import org.janelia.diffraction.fit.GrainFitResult;
import org.janelia.diffraction.fit.RefinementMask;
import org.janelia.diffraction.fit.ToleranceSchedule;
import org.janelia.diffraction.frame.FrameSeries;
import org.janelia.diffraction.frame.ImageStackFrameReader;
import org.janelia.diffraction.geometry.InstrumentSpec;
import org.janelia.diffraction.geometry.SharedGeometry;
import org.janelia.diffraction.material.MaterialSpec;
import org.janelia.diffraction.material.PlaneData;
import org.janelia.diffraction.util.FileUtil;
import org.janelia.diffraction.util.LogbackUtil;
import org.janelia.grainfit.client.parameter.CommandLineParameters;
import org.janelia.grainfit.client.parameter.ImageSeriesParameters;
import org.janelia.grainfit.client.parameter.LegacyDetectorParameters;
import org.janelia.grainfit.client.parameter.ToleranceParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client that refines every grain of an orientation table against a rotation series of frames
 * and writes the grains report into the analysis directory.
 *
 * All batch level inputs are loaded (and a legacy detector file migrated if necessary)
 * before any worker is started.
 */
public class FitGrainsClient {

    public static final String LOG_FILE_NAME = "fit-grains.log";

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--instrumentFile",
                description = "Structured instrument (detector and oscillation stage) JSON file",
                required = true)
        public String instrumentFile;

        @ParametersDelegate
        public LegacyDetectorParameters legacyDetector = new LegacyDetectorParameters();

        @Parameter(
                names = "--materialFile",
                description = "Material JSON file (lattice, centering, max Miller index, wavelength)",
                required = true)
        public String materialFile;

        @Parameter(
                names = "--orientationsFile",
                description = "Orientation table with one quaternion (w x y z) per grain, " +
                              "default is " + OrientationTable.DEFAULT_FILE_NAME + " in the analysis directory")
        public String orientationsFile;

        @ParametersDelegate
        public ImageSeriesParameters imageSeries = new ImageSeriesParameters();

        @ParametersDelegate
        public ToleranceParameters tolerance = new ToleranceParameters();

        @Parameter(
                names = "--tthMax",
                description = "Largest two theta (degrees) of reflections to use (default is no limit)")
        public Double tthMax;

        @Parameter(
                names = "--etaRange",
                description = "Allowed azimuth ranges as (min max) pairs in degrees, " +
                              "for example '5 175 185 355' to exclude gaps at 0 and 180 (default is the full circle)",
                variableArity = true)
        public List<Double> etaRange = new ArrayList<>();

        @Parameter(
                names = "--omegaPeriodStart",
                description = "Start (degrees) of the 360 degree period rotation angles are reported in " +
                              "(default is the start of the scan)")
        public Double omegaPeriodStart;

        @Parameter(
                names = "--panelBuffer",
                description = "Width (mm) of the panel border in which predicted reflections are ignored")
        public Double panelBuffer = 10.0;

        @Parameter(
                names = "--numberOfWorkers",
                description = "Number of grains refined in parallel")
        public Integer numberOfWorkers = Runtime.getRuntime().availableProcessors();

        @Parameter(
                names = "--analysisDirectory",
                description = "Directory for the grains report, log file and reflection tables",
                required = true)
        public String analysisDirectory;

        @Parameter(
                names = "--writeReflectionTables",
                description = "Write the reflection table of each grain into the analysis directory",
                arity = 0)
        public boolean writeReflectionTables = false;

        @Parameter(
                names = "--force",
                description = "Overwrite an existing grains report",
                arity = 0)
        public boolean force = false;

        @Parameter(
                names = "--quiet",
                description = "Only log errors",
                arity = 0)
        public boolean quiet = false;

        public Path getAnalysisPath() {
            return Paths.get(analysisDirectory).toAbsolutePath();
        }

        public Path getReportPath() {
            return getAnalysisPath().resolve(GrainsReport.DEFAULT_FILE_NAME);
        }

        public Path getOrientationsPath() {
            return orientationsFile == null ?
                   getAnalysisPath().resolve(OrientationTable.DEFAULT_FILE_NAME) : Paths.get(orientationsFile);
        }

        /**
         * @return allowed eta ranges in radians (empty for the full circle).
         */
        public List<double[]> getEtaRangesInRadians() {
            final List<double[]> ranges = new ArrayList<>();
            for (int i = 0; i + 1 < etaRange.size(); i += 2) {
                ranges.add(new double[] {Math.toRadians(etaRange.get(i)), Math.toRadians(etaRange.get(i + 1))});
            }
            return ranges;
        }

        public Double getOmegaPeriodStartInRadians() {
            return omegaPeriodStart == null ? null : Math.toRadians(omegaPeriodStart);
        }

        public Path getLegacyDetectorPath() {
            return legacyDetector.legacyDetectorFile == null ? null : Paths.get(legacyDetector.legacyDetectorFile);
        }

        public void validate()
                throws IllegalArgumentException {
            if ((numberOfWorkers == null) || (numberOfWorkers < 1)) {
                throw new IllegalArgumentException("--numberOfWorkers must be at least 1");
            }
            if ((panelBuffer == null) || (panelBuffer < 0)) {
                throw new IllegalArgumentException("--panelBuffer must not be negative");
            }
            if ((etaRange.size() % 2) != 0) {
                throw new IllegalArgumentException("--etaRange needs (min max) pairs but has " +
                                                   etaRange.size() + " values");
            }
            for (final double[] range : getEtaRangesInRadians()) {
                if (! (range[1] > range[0])) {
                    throw new IllegalArgumentException("--etaRange maximum must exceed its minimum");
                }
            }
            imageSeries.validate();
            tolerance.getSchedule();
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);
                parameters.validate();

                final FitGrainsClient client = new FitGrainsClient(parameters);
                client.fitGrains();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public FitGrainsClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    /**
     * Runs the whole batch and writes the grains report.
     *
     * @return sorted results.
     *
     * @throws IOException
     *   if any batch input is missing or unreadable or the report cannot be written.
     *
     * @throws IllegalStateException
     *   if the report exists and --force was not specified.
     */
    public List<GrainFitResult> fitGrains()
            throws IOException, InterruptedException, IllegalStateException {

        final Path analysisPath = parameters.getAnalysisPath();
        final Path reportPath = parameters.getReportPath();

        if (Files.exists(reportPath) && (! parameters.force)) {
            throw new IllegalStateException("grains report " + reportPath +
                                            " already exists, specify --force to overwrite it");
        }

        FileUtil.ensureWritableDirectory(analysisPath.toFile());

        if (parameters.quiet) {
            LogbackUtil.setRootLogLevel(Level.ERROR);
        }
        LogbackUtil.setRootFileAppender(new File(analysisPath.toFile(), LOG_FILE_NAME));

        try {
            LOG.info("fitGrains: entry, parameters={}", parameters);
            return runBatch(analysisPath, reportPath);
        } finally {
            LogbackUtil.removeRootFileAppender();
        }
    }

    private List<GrainFitResult> runBatch(final Path analysisPath,
                                          final Path reportPath)
            throws IOException, InterruptedException {

        final InstrumentSpec instrument =
                parameters.legacyDetector.buildMigration().loadOrMigrate(Paths.get(parameters.instrumentFile),
                                                                         parameters.getLegacyDetectorPath());

        final MaterialSpec material = MaterialSpec.load(Paths.get(parameters.materialFile));
        final Double tthMaxRadians = parameters.tthMax == null ? null : Math.toRadians(parameters.tthMax);
        final PlaneData planeData = PlaneData.build(material, tthMaxRadians);

        LOG.info("runBatch: material {} has {} reflections", material.getName(), planeData.size());

        final SharedGeometry geometry =
                SharedGeometry.fromInstrument(instrument, planeData, parameters.panelBuffer)
                        .withAngularLimits(parameters.getEtaRangesInRadians(),
                                           parameters.getOmegaPeriodStartInRadians());

        final OrientationTable orientationTable = OrientationTable.load(parameters.getOrientationsPath());
        final List<FitGrainJob> jobs = orientationTable.buildJobs();

        final ImageSeriesParameters imageSeries = parameters.imageSeries;
        final FrameSeries frames = FrameSeries.load(new ImageStackFrameReader(Paths.get(imageSeries.imageStack)),
                                                    imageSeries.threshold,
                                                    imageSeries.omegaStart,
                                                    imageSeries.omegaStep);

        final ToleranceSchedule schedule = parameters.tolerance.getSchedule();
        final FitGrainsOrchestrator orchestrator =
                new FitGrainsOrchestrator(geometry,
                                          frames,
                                          schedule,
                                          RefinementMask.DEFAULT,
                                          parameters.numberOfWorkers,
                                          parameters.writeReflectionTables ? analysisPath : null);

        final List<GrainFitResult> results = orchestrator.fitGrains(jobs);

        new GrainsReport(results).write(reportPath);

        return results;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FitGrainsClient.class);
}
