package org.janelia.diffraction.fit;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.janelia.diffraction.util.FileUtil;

/**
 * Reflections associated with one grain during one refinement iteration.
 * Tables are private to the worker that builds them; the file form exists for inspection and resumption.
 */
public class ReflectionTable {

    public static final String HEADER =
            "#     ID     H     K     L             sum(int)             max(int)" +
            "             pred tth             pred eta             pred ome" +
            "               pred x               pred y               meas x" +
            "               meas y             meas ome  window";

    private static final String ROW_FORMAT =
            "%8d %5d %5d %5d %20.12e %20.12e %20.12e %20.12e %20.12e %20.12e %20.12e %20.12e %20.12e %20.12e %7d%n";

    private static final int NUMBER_OF_COLUMNS = 15;

    private final int grainId;
    private final List<Reflection> reflections;

    public ReflectionTable(final int grainId,
                           final List<Reflection> reflections) {
        this.grainId = grainId;
        this.reflections = Collections.unmodifiableList(new ArrayList<>(reflections));
    }

    public int getGrainId() {
        return grainId;
    }

    public List<Reflection> getReflections() {
        return reflections;
    }

    /**
     * @return number of predicted rows, including rows near the scan edges (the completeness denominator).
     */
    public int getNumberOfCandidates() {
        return reflections.size();
    }

    /**
     * @return valid rows inside the scan window.
     */
    public List<Reflection> getFitReflections() {
        return reflections.stream().filter(Reflection::isFitCandidate).collect(Collectors.toList());
    }

    /**
     * @return fraction of all candidates that are valid and inside the scan window, zero when there are no candidates.
     */
    public double getCompleteness() {
        final int candidates = getNumberOfCandidates();
        return candidates == 0 ? 0.0 : getFitReflections().size() / (double) candidates;
    }

    public void write(final Path path)
            throws IOException {

        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            FileUtil.ensureWritableDirectory(parent.toFile());
        }

        try (final Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             final PrintWriter printWriter = new PrintWriter(writer)) {
            printWriter.println(HEADER);
            for (final Reflection r : reflections) {
                final int[] hkl = r.getHkl();
                printWriter.format(Locale.US, ROW_FORMAT,
                                   r.getId(), hkl[0], hkl[1], hkl[2],
                                   r.getSumIntensity(), r.getMaxIntensity(),
                                   r.getPredictedTth(), r.getPredictedEta(), r.getPredictedOmega(),
                                   r.getPredictedX(), r.getPredictedY(),
                                   r.getMeasuredX(), r.getMeasuredY(), r.getMeasuredOmega(),
                                   r.isInScanWindow() ? 1 : 0);
            }
            if (printWriter.checkError()) {
                throw new IOException("failed to write reflection table " + path);
            }
        }
    }

    /**
     * @throws IOException
     *   if the file cannot be read or has rows with an unexpected number of columns.
     */
    public static ReflectionTable read(final Path path,
                                       final int grainId)
            throws IOException {

        final List<Reflection> reflections = new ArrayList<>();
        for (final double[] row : FileUtil.loadNumericTable(path)) {
            if (row.length != NUMBER_OF_COLUMNS) {
                throw new IOException("reflection table " + path + " has a row with " + row.length +
                                      " columns, " + NUMBER_OF_COLUMNS + " expected");
            }
            reflections.add(new Reflection((int) row[0],
                                           new int[] {(int) row[1], (int) row[2], (int) row[3]},
                                           row[4], row[5],
                                           row[6], row[7], row[8],
                                           row[9], row[10],
                                           row[11], row[12], row[13],
                                           row[14] != 0));
        }
        return new ReflectionTable(grainId, reflections);
    }

    /**
     * @return standard file name for a grain's table.
     */
    public static String getFileName(final int grainId) {
        return String.format(Locale.US, "spots_%05d.out", grainId);
    }

}
