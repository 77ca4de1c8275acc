package org.janelia.grainfit.client;

import java.io.IOException;

import org.janelia.diffraction.util.ProgressTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a command line client so that every run ends with a logged outcome and a process exit code:
 * {@link #EXIT_SUCCESS}, {@link #EXIT_INVALID_INPUT} for bad arguments or unreadable batch inputs,
 * and {@link #EXIT_FAILURE} for anything else.
 *
 * A run that ends without the "run: exit" message was killed externally.
 *
 * @author Eric Trautman
 */
public abstract class ClientRunner {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_INVALID_INPUT = 2;

    private final String[] args;

    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Runs the client and terminates the JVM with the resulting exit code.
     */
    public void run() {
        System.exit(runForExitCode());
    }

    /**
     * @return exit code for the wrapped client run.
     */
    public int runForExitCode() {

        final String clientName = getClass().getEnclosingClass() == null ?
                                  getClass().getName() : getClass().getEnclosingClass().getSimpleName();

        LOG.info("runForExitCode: entry, running {}", clientName);

        final ProgressTimer timer = new ProgressTimer();
        int exitCode;
        try {
            runClient(args);
            exitCode = EXIT_SUCCESS;
        } catch (final IllegalArgumentException | IOException e) {
            LOG.error("runForExitCode: invalid input for " + clientName, e);
            exitCode = EXIT_INVALID_INPUT;
        } catch (final Throwable t) {
            LOG.error("runForExitCode: " + clientName + " failed", t);
            exitCode = EXIT_FAILURE;
        }

        LOG.info("runForExitCode: exit, {} returned {} after {}", clientName, exitCode, timer);

        return exitCode;
    }

    /**
     * @param  args  command line arguments for the client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
