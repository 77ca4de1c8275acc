package org.janelia.diffraction.batch;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import org.janelia.diffraction.fit.GrainFitResult;
import org.janelia.diffraction.fit.Tensors;
import org.janelia.diffraction.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed width grain report: one header line and one row per grain sorted by grain id.
 * Numbers are written with 7 significant digits in columns at least 14 characters wide.
 */
public class GrainsReport {

    public static final String DEFAULT_FILE_NAME = "grains.out";

    public static final List<String> HEADER_ITEMS = Arrays.asList(
            "grain ID", "completeness", "sum(resd**2)/nrefl",
            "xi[0]", "xi[1]", "xi[2]",
            "tVec_c[0]", "tVec_c[1]", "tVec_c[2]",
            "vInv_s[0]", "vInv_s[1]", "vInv_s[2]",
            "vInv_s[3]*sqrt(2)", "vInv_s[4]*sqrt(2)", "vInv_s[5]*sqrt(2)",
            "ln(V[0,0])", "ln(V[1,1])", "ln(V[2,2])",
            "ln(V[1,2])*sqrt(2)", "ln(V[0,2])*sqrt(2)", "ln(V[0,1])*sqrt(2)");

    private static final int MINIMUM_WIDTH = 14;

    private final List<GrainFitResult> results;
    private final String headerFormat;
    private final String rowFormat;

    public GrainsReport(final List<GrainFitResult> results) {
        this.results = new ArrayList<>(results);
        this.results.sort(Comparator.comparingInt(GrainFitResult::getGrainId));

        final StringBuilder header = new StringBuilder("#%8s");
        final StringBuilder row = new StringBuilder("%9d");
        for (final String item : HEADER_ITEMS.subList(1, HEADER_ITEMS.size())) {
            final int width = Math.max(MINIMUM_WIDTH, item.length());
            header.append("  %").append(width).append('s');
            row.append("  %").append(width).append(".7g");
        }
        this.headerFormat = header.append("%n").toString();
        this.rowFormat = row.append("%n").toString();
    }

    public String getHeaderLine() {
        return String.format(Locale.US, headerFormat, HEADER_ITEMS.toArray());
    }

    public String getRow(final GrainFitResult result) {
        final double[] parameters = result.getParameters().toArray();
        final double[][] strain = result.getStrain();
        final Object[] items = new Object[HEADER_ITEMS.size()];
        int i = 0;
        items[i++] = result.getGrainId();
        items[i++] = result.getCompleteness();
        items[i++] = result.getNormalizedResidual();
        for (final double value : parameters) {
            items[i++] = value;
        }
        items[i++] = strain[0][0];
        items[i++] = strain[1][1];
        items[i++] = strain[2][2];
        items[i++] = Tensors.SQRT_2 * strain[1][2];
        items[i++] = Tensors.SQRT_2 * strain[0][2];
        items[i] = Tensors.SQRT_2 * strain[0][1];
        return String.format(Locale.US, rowFormat, items);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(getHeaderLine());
        for (final GrainFitResult result : results) {
            sb.append(getRow(result));
        }
        return sb.toString();
    }

    public void write(final Path path)
            throws IOException {

        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            FileUtil.ensureWritableDirectory(parent.toFile());
        }

        try (final Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(toString());
        }

        for (final GrainFitResult result : results) {
            if (! result.isCompleted()) {
                LOG.warn("write: grain {} failed ({}), wrote its initial parameters",
                         result.getGrainId(), result.getFailureReason());
            }
        }

        LOG.info("write: saved {} grains to {}", results.size(), path);
    }

    private static final Logger LOG = LoggerFactory.getLogger(GrainsReport.class);
}
