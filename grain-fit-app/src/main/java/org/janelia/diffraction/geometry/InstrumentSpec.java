package org.janelia.diffraction.geometry;

import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Path;

import org.janelia.diffraction.json.JsonUtils;
import org.janelia.diffraction.util.FileUtil;

/**
 * Structured instrument geometry document: one detector panel and the oscillation stage.
 */
public class InstrumentSpec
        implements Serializable {

    /**
     * Oscillation (rotation) stage section of an instrument document.
     */
    public static class OscillationStage
            implements Serializable {

        private final double chi;
        private final double[] translation;

        @SuppressWarnings("unused")
        private OscillationStage() {
            this(0.0, new double[3]);
        }

        public OscillationStage(final double chi,
                                final double[] translation) {
            this.chi = chi;
            this.translation = translation.clone();
        }

        /**
         * @return inclination of the rotation axis about lab x in radians.
         */
        public double getChi() {
            return chi;
        }

        /**
         * @return lab frame position (mm) of the sample origin.
         */
        public double[] getTranslation() {
            return translation.clone();
        }
    }

    private final DetectorSpec detector;
    private final OscillationStage oscillationStage;

    @SuppressWarnings("unused")
    private InstrumentSpec() {
        this(null, null);
    }

    public InstrumentSpec(final DetectorSpec detector,
                          final OscillationStage oscillationStage) {
        this.detector = detector;
        this.oscillationStage = oscillationStage;
    }

    public DetectorSpec getDetector() {
        return detector;
    }

    public OscillationStage getOscillationStage() {
        return oscillationStage;
    }

    /**
     * @throws IllegalArgumentException
     *   if any required section is missing or malformed.
     */
    public void validate()
            throws IllegalArgumentException {
        if (detector == null) {
            throw new IllegalArgumentException("instrument is missing detector section");
        }
        if (oscillationStage == null) {
            throw new IllegalArgumentException("instrument is missing oscillationStage section");
        }
        final DetectorSpec.Pixels pixels = detector.getPixels();
        if ((pixels == null) || (pixels.getRows() < 1) || (pixels.getColumns() < 1) || (pixels.getSize() <= 0)) {
            throw new IllegalArgumentException("instrument detector must specify positive pixel rows, columns and size");
        }
        final DetectorSpec.Transform transform = detector.getTransform();
        if ((transform == null) ||
            (transform.getTiltAngles().length != 3) || (transform.getTranslation().length != 3)) {
            throw new IllegalArgumentException("instrument detector transform must specify 3 tilt angles and a 3D translation");
        }
        if (oscillationStage.getTranslation().length != 3) {
            throw new IllegalArgumentException("instrument oscillationStage must specify a 3D translation");
        }
        if (detector.getDistortion() != null) {
            detector.getDistortion().buildModel();
        }
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static InstrumentSpec fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    public static InstrumentSpec load(final Path path)
            throws IOException, IllegalArgumentException {
        final InstrumentSpec spec = JSON_HELPER.fromJsonFile(path);
        spec.validate();
        return spec;
    }

    public void save(final Path path)
            throws IOException {
        FileUtil.saveJsonFile(path, this);
    }

    private static final JsonUtils.Helper<InstrumentSpec> JSON_HELPER =
            new JsonUtils.Helper<>(InstrumentSpec.class);
}
