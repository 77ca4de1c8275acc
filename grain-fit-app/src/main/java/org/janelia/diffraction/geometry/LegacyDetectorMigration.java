package org.janelia.diffraction.geometry;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.janelia.diffraction.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a legacy flat detector parameter file into a structured {@link InstrumentSpec} document.
 *
 * The legacy file holds one value per row (an optional second column of refinement flags is ignored):
 * <pre>
 *   xc yc D xTilt yTilt zTilt p0 p1 p2 p3 p4 p5
 * </pre>
 * where (xc, yc) is the beam center in mm measured from the panel corner, D the sample to detector distance,
 * the tilts are in radians and p0 ... p5 are {@link GE41RTDistortion} coefficients.
 * Everything the legacy file does not know (pixel layout, detector id, chi, stage translation) is supplied
 * by the caller.
 */
public class LegacyDetectorMigration {

    public static final int NUMBER_OF_LEGACY_VALUES = 6 + GE41RTDistortion.NUMBER_OF_PARAMETERS;

    private final int rows;
    private final int columns;
    private final double pixelSize;
    private final String detectorId;
    private final double chi;
    private final double[] stageTranslation;

    public LegacyDetectorMigration(final int rows,
                                   final int columns,
                                   final double pixelSize,
                                   final String detectorId) {
        this(rows, columns, pixelSize, detectorId, 0.0, new double[3]);
    }

    public LegacyDetectorMigration(final int rows,
                                   final int columns,
                                   final double pixelSize,
                                   final String detectorId,
                                   final double chi,
                                   final double[] stageTranslation) {
        this.rows = rows;
        this.columns = columns;
        this.pixelSize = pixelSize;
        this.detectorId = detectorId;
        this.chi = chi;
        this.stageTranslation = stageTranslation.clone();
    }

    /**
     * Loads the structured instrument document, migrating the legacy file first if the structured one
     * does not exist yet. Running this more than once is a no-op after the first migration.
     *
     * @param  instrumentPath  path of the structured document.
     * @param  legacyPath      path of the legacy parameter file (only read when migration is needed).
     *
     * @return the structured instrument.
     *
     * @throws FileNotFoundException
     *   if neither file exists.
     *
     * @throws IOException
     *   if either file cannot be read or the structured document cannot be written.
     */
    public InstrumentSpec loadOrMigrate(final Path instrumentPath,
                                        final Path legacyPath)
            throws IOException {

        if (Files.exists(instrumentPath)) {
            LOG.info("loadOrMigrate: loading existing instrument {}", instrumentPath);
        } else {
            if ((legacyPath == null) || (! Files.exists(legacyPath))) {
                throw new FileNotFoundException(
                        "instrument file " + instrumentPath + " does not exist and legacy detector file " +
                        legacyPath + " is not available for migration");
            }
            migrate(legacyPath, instrumentPath);
        }

        return InstrumentSpec.load(instrumentPath);
    }

    /**
     * Converts the legacy file and saves the result.
     *
     * @return the migrated instrument.
     */
    public InstrumentSpec migrate(final Path legacyPath,
                                  final Path instrumentPath)
            throws IOException {

        LOG.info("migrate: converting legacy detector parameters {} to {}", legacyPath, instrumentPath);

        final InstrumentSpec instrument = convert(FileUtil.loadNumericTable(legacyPath));
        instrument.save(instrumentPath);

        return instrument;
    }

    /**
     * @param  legacyRows  rows of the legacy file.
     *
     * @return instrument for the legacy values.
     *
     * @throws IOException
     *   if the legacy rows do not hold the expected number of values.
     */
    public InstrumentSpec convert(final List<double[]> legacyRows)
            throws IOException {

        if (legacyRows.size() < NUMBER_OF_LEGACY_VALUES) {
            throw new IOException("legacy detector parameters must have at least " + NUMBER_OF_LEGACY_VALUES +
                                  " rows but only " + legacyRows.size() + " were found");
        }

        final double[] values = new double[legacyRows.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = legacyRows.get(i)[0];
        }

        final double[] detectorTranslation = {
                values[0] - 0.5 * columns * pixelSize,
                values[1] - 0.5 * rows * pixelSize,
                -values[2]
        };
        final double[] tiltAngles = Arrays.copyOfRange(values, 3, 6);

        // distortion coefficients are always the trailing values
        final double[] distortionParameters =
                Arrays.copyOfRange(values, values.length - GE41RTDistortion.NUMBER_OF_PARAMETERS, values.length);

        final DetectorSpec detector =
                new DetectorSpec(detectorId,
                                 new DetectorSpec.Pixels(rows, columns, pixelSize),
                                 new DetectorSpec.Transform(tiltAngles, detectorTranslation),
                                 new DistortionSpec(GE41RTDistortion.FUNCTION_NAME, distortionParameters));

        return new InstrumentSpec(detector, new InstrumentSpec.OscillationStage(chi, stageTranslation));
    }

    private static final Logger LOG = LoggerFactory.getLogger(LegacyDetectorMigration.class);
}
