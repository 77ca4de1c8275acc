package org.janelia.diffraction.fit;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link ReflectionTable} class.
 */
public class ReflectionTableTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testCompletenessCountsEveryCandidate() {

        final List<Reflection> reflections = new ArrayList<>();
        for (int id = 0; id < 13; id++) {
            reflections.add(valid(id, true));
        }
        reflections.add(valid(13, false));
        reflections.add(invalid(false));

        final ReflectionTable table = new ReflectionTable(4, reflections);

        Assert.assertEquals("invalid number of candidates", 15, table.getNumberOfCandidates());
        Assert.assertEquals("measured row near scan edge should not be fit", 13, table.getFitReflections().size());
        Assert.assertEquals("invalid completeness", 13.0 / 15.0, table.getCompleteness(), 1.0e-15);

        final ReflectionTable mixed = new ReflectionTable(5, Arrays.asList(valid(0, true),
                                                                           valid(1, true),
                                                                           invalid(true),
                                                                           valid(2, false),
                                                                           invalid(false)));
        Assert.assertEquals("invalid completeness for mixed table", 2.0 / 5.0, mixed.getCompleteness(), 1.0e-15);

        Assert.assertEquals("table without fit reflections should have zero completeness",
                            0.0, new ReflectionTable(0, Arrays.asList(invalid(false))).getCompleteness(), 0.0);
        Assert.assertEquals("empty table should have zero completeness",
                            0.0, new ReflectionTable(0, new ArrayList<>()).getCompleteness(), 0.0);
    }

    @Test
    public void testWriteAndRead() throws Exception {

        final ReflectionTable table = new ReflectionTable(4, Arrays.asList(valid(0, true), invalid(false)));
        final Path path = temporaryFolder.getRoot().toPath().resolve(ReflectionTable.getFileName(4));
        table.write(path);

        Assert.assertEquals("invalid file name", "spots_00004.out", path.getFileName().toString());

        final List<Reflection> read = ReflectionTable.read(path, 4).getReflections();
        Assert.assertEquals("invalid number of rows", 2, read.size());

        final Reflection first = read.get(0);
        Assert.assertEquals("invalid id", 0, first.getId());
        Assert.assertArrayEquals("invalid hkl", new int[] {1, -1, 1}, first.getHkl());
        Assert.assertEquals("invalid measured x", 12.5, first.getMeasuredX(), 1.0e-10);
        Assert.assertTrue("window flag lost", first.isInScanWindow());

        final Reflection second = read.get(1);
        Assert.assertEquals("invalid id for row without intensity", Reflection.INVALID_ID, second.getId());
        Assert.assertFalse("row without intensity should be invalid", second.isValid());
        Assert.assertTrue("missing measurement should be NaN", Double.isNaN(second.getMeasuredOmega()));
    }

    private static Reflection valid(final int id,
                                    final boolean inScanWindow) {
        return new Reflection(id, new int[] {1, -1, 1}, 100.0, 40.0,
                              0.085, 0.3, 0.1, 12.4, -30.1,
                              12.5, -30.0, 0.101, inScanWindow);
    }

    private static Reflection invalid(final boolean inScanWindow) {
        return new Reflection(Reflection.INVALID_ID, new int[] {2, 0, 0}, 0.0, 0.0,
                              0.098, -1.2, 0.4, 50.0, 60.0,
                              Double.NaN, Double.NaN, Double.NaN, inScanWindow);
    }
}
