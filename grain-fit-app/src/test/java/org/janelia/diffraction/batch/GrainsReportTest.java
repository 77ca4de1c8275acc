package org.janelia.diffraction.batch;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.janelia.diffraction.fit.GrainFitResult;
import org.janelia.diffraction.fit.GrainParameters;
import org.janelia.diffraction.fit.Tensors;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link GrainsReport} class.
 */
public class GrainsReportTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testFormat() {

        final double[] stretch = {1.001, 0.999, 1.0005, 0.0002, -0.0001, 0.0003};
        final GrainParameters parameters = new GrainParameters(new double[] {0.1, -0.2, 0.3},
                                                               new double[] {0.01, 0.02, -0.03},
                                                               stretch);
        final double[][] strain = Tensors.strainOfStretch(stretch);

        final GrainFitResult second = GrainFitResult.completed(1, parameters, 0.875, strain, 2.5, 40);
        final GrainFitResult first = GrainFitResult.completed(0, parameters, 1.0, strain, 0.0, 0);

        final GrainsReport report = new GrainsReport(Arrays.asList(second, first));
        final String[] lines = report.toString().split("\n");

        Assert.assertEquals("invalid number of lines", 3, lines.length);
        Assert.assertTrue("header should start with #", lines[0].startsWith("#"));
        Assert.assertEquals("rows should line up with header", lines[0].length(), lines[1].length());
        Assert.assertEquals("rows should line up with header", lines[0].length(), lines[2].length());

        final String[] firstRow = lines[1].trim().split("\\s+");
        final String[] secondRow = lines[2].trim().split("\\s+");
        Assert.assertEquals("invalid number of columns", GrainsReport.HEADER_ITEMS.size(), secondRow.length);
        Assert.assertEquals("rows should be sorted by grain id", "0", firstRow[0]);
        Assert.assertEquals("rows should be sorted by grain id", "1", secondRow[0]);

        Assert.assertEquals("invalid completeness", 0.875, Double.parseDouble(secondRow[1]), 1.0e-7);
        Assert.assertEquals("invalid normalized residual", 2.5 / 40, Double.parseDouble(secondRow[2]), 1.0e-7);
        Assert.assertEquals("invalid normalized residual without reflections",
                            0.0, Double.parseDouble(firstRow[2]), 0.0);

        for (int i = 0; i < GrainParameters.NUMBER_OF_PARAMETERS; i++) {
            Assert.assertEquals("invalid parameter " + i,
                                parameters.get(i), Double.parseDouble(secondRow[3 + i]),
                                1.0e-6 * Math.max(1.0, Math.abs(parameters.get(i))));
        }

        final double[] expectedStrain = {
                strain[0][0], strain[1][1], strain[2][2],
                Math.sqrt(2.0) * strain[1][2], Math.sqrt(2.0) * strain[0][2], Math.sqrt(2.0) * strain[0][1]
        };
        for (int i = 0; i < expectedStrain.length; i++) {
            final double parsed = Double.parseDouble(secondRow[15 + i]);
            Assert.assertEquals("invalid strain column " + i, expectedStrain[i], parsed,
                                1.0e-6 * Math.abs(expectedStrain[i]));
        }
    }

    @Test
    public void testWrite() throws Exception {

        final GrainFitResult failed = GrainFitResult.failed(0,
                                                            new GrainParameters(new double[3],
                                                                                new double[3],
                                                                                GrainParameters.IDENTITY_STRETCH),
                                                            "test failure");
        final Path path = temporaryFolder.getRoot().toPath().resolve(GrainsReport.DEFAULT_FILE_NAME);
        new GrainsReport(Arrays.asList(failed)).write(path);

        final List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        Assert.assertEquals("invalid number of lines", 2, lines.size());
        Assert.assertTrue("failed grain should report NaN residual", lines.get(1).contains("NaN"));
    }
}
