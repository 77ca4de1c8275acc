package org.janelia.grainfit.client;

import java.io.FileNotFoundException;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ClientRunner} class.
 */
public class ClientRunnerTest {

    @Test
    public void testExitCodes() {

        Assert.assertEquals("invalid exit code for success",
                            ClientRunner.EXIT_SUCCESS,
                            new ClientRunner(new String[0]) {
                                @Override
                                public void runClient(final String[] args) {
                                }
                            }.runForExitCode());

        Assert.assertEquals("invalid exit code for missing input",
                            ClientRunner.EXIT_INVALID_INPUT,
                            new ClientRunner(new String[0]) {
                                @Override
                                public void runClient(final String[] args) throws Exception {
                                    throw new FileNotFoundException("quats.out");
                                }
                            }.runForExitCode());

        Assert.assertEquals("invalid exit code for existing report",
                            ClientRunner.EXIT_FAILURE,
                            new ClientRunner(new String[0]) {
                                @Override
                                public void runClient(final String[] args) {
                                    throw new IllegalStateException("grains report already exists");
                                }
                            }.runForExitCode());
    }
}
