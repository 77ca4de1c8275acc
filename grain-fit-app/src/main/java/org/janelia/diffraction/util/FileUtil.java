package org.janelia.diffraction.util;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import org.janelia.diffraction.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared file management utilities.
 *
 * @author Eric Trautman
 */
public class FileUtil {

    /**
     * Writes the specified data as JSON to a temporary sibling file and then moves it into place
     * so that readers never see a partially written document.
     */
    public static void saveJsonFile(final Path path,
                                    final Object data)
            throws IOException {
        saveJsonFile(path, data, JsonUtils.MAPPER);
    }

    public static void saveJsonFile(final Path path,
                                    final Object data,
                                    final ObjectMapper mapper)
            throws IOException {

        final Path toPath = path.toAbsolutePath();
        final Path parent = toPath.getParent();
        if (parent != null) {
            ensureWritableDirectory(parent.toFile());
        }

        final Path tmpPath = toPath.resolveSibling(toPath.getFileName() + ".tmp");
        try (final Writer writer = Files.newBufferedWriter(tmpPath, StandardCharsets.UTF_8)) {
            mapper.writeValue(writer, data);
        } catch (final Throwable t) {
            throw new IOException("failed to write " + tmpPath, t);
        }

        Files.move(tmpPath, toPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        LOG.info("saveJsonFile: exit, wrote data to {}", toPath);
    }

    /**
     * Loads a whitespace delimited numeric table (numpy loadtxt style).
     * Blank lines and anything following a '#' are ignored.
     *
     * @return list of rows, rows may have different lengths.
     *
     * @throws FileNotFoundException
     *   if the file does not exist.
     *
     * @throws IOException
     *   if the file cannot be read or contains non-numeric values.
     */
    public static List<double[]> loadNumericTable(final Path path)
            throws IOException {

        if (! Files.exists(path)) {
            throw new FileNotFoundException(path.toAbsolutePath() + " does not exist");
        }

        final List<double[]> rows = new ArrayList<>();
        try (final BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                final int commentStart = line.indexOf('#');
                final String content = (commentStart < 0 ? line : line.substring(0, commentStart)).trim();
                if (content.isEmpty()) {
                    continue;
                }
                final String[] tokens = content.split("\\s+");
                final double[] values = new double[tokens.length];
                for (int i = 0; i < tokens.length; i++) {
                    try {
                        values[i] = Double.parseDouble(tokens[i]);
                    } catch (final NumberFormatException e) {
                        throw new IOException("invalid value '" + tokens[i] + "' on line " + lineNumber +
                                              " of " + path, e);
                    }
                }
                rows.add(values);
            }
        }

        LOG.debug("loadNumericTable: loaded {} rows from {}", rows.size(), path);

        return rows;
    }

    public static void ensureWritableDirectory(final File directory) {
        // try twice to work around concurrent access issues
        if (! directory.exists()) {
            if (! directory.mkdirs()) {
                if (! directory.exists()) {
                    // last try
                    if (! directory.mkdirs()) {
                        if (! directory.exists()) {
                            throw new IllegalArgumentException("failed to create " + directory);
                        }
                    }
                }
            }
        }
        if (! directory.canWrite()) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);

}
