package org.janelia.diffraction.batch;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.janelia.diffraction.fit.FitGrainJob;
import org.janelia.diffraction.fit.GrainParameters;
import org.janelia.diffraction.util.FileUtil;

/**
 * Ordered table of grain orientations, one unit quaternion (w, x, y, z) per row.
 * A row's position is the id of its grain.
 */
public class OrientationTable {

    public static final String DEFAULT_FILE_NAME = "quats.out";

    private final List<double[]> quaternions;

    public OrientationTable(final List<double[]> quaternions)
            throws IllegalArgumentException {
        for (int i = 0; i < quaternions.size(); i++) {
            if (quaternions.get(i).length != 4) {
                throw new IllegalArgumentException("orientation " + i + " has " + quaternions.get(i).length +
                                                   " values instead of 4");
            }
        }
        this.quaternions = new ArrayList<>(quaternions);
    }

    /**
     * @throws IOException
     *   if the file cannot be read or a row does not hold exactly four values.
     */
    public static OrientationTable load(final Path path)
            throws IOException {
        final List<double[]> rows = FileUtil.loadNumericTable(path);
        try {
            return new OrientationTable(rows);
        } catch (final IllegalArgumentException e) {
            throw new IOException("invalid orientation table " + path, e);
        }
    }

    public int size() {
        return quaternions.size();
    }

    public double[] getQuaternion(final int grainId) {
        return quaternions.get(grainId).clone();
    }

    /**
     * @return one job per orientation with zero translation and identity stretch.
     *
     * @throws IllegalArgumentException
     *   if any quaternion cannot be normalized.
     */
    public List<FitGrainJob> buildJobs()
            throws IllegalArgumentException {
        final List<FitGrainJob> jobs = new ArrayList<>(quaternions.size());
        for (int grainId = 0; grainId < quaternions.size(); grainId++) {
            jobs.add(new FitGrainJob(grainId, GrainParameters.fromQuaternion(quaternions.get(grainId))));
        }
        return jobs;
    }
}
