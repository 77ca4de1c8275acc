package org.janelia.grainfit.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.diffraction.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common base for client parameter classes: adds --help, usage output and a JSON form used in logs.
 * Subclasses are normally nested inside the client class they configure.
 *
 * @author Eric Trautman
 */
public class CommandLineParameters
        implements Serializable {

    public static final String STANDALONE_JAR = "grain-fit-client-standalone.jar";

    @Parameter(
            names = "--help",
            description = "Display usage for this client",
            help = true)
    public transient boolean help = false;

    /**
     * Parses arguments for the enclosing client class and exits the JVM when help is requested
     * or the arguments are invalid.
     */
    public void parse(final String[] args) {
        parse(args, getClass().getEnclosingClass(), true);
    }

    /**
     * @param  args                 command line arguments.
     * @param  clientClass          class whose name is shown in the usage output.
     * @param  exitOnHelpOrFailure  if true, exit the JVM after printing usage.
     *
     * @return true if the arguments were parsed and help was not requested.
     */
    public boolean parse(final String[] args,
                         final Class<?> clientClass,
                         final boolean exitOnHelpOrFailure) {

        final String clientName = clientClass == null ? getClass().getName() : clientClass.getName();
        final JCommander jCommander = JCommander.newBuilder()
                .addObject(this)
                .programName("java -cp " + STANDALONE_JAR + " " + clientName)
                .build();

        String failure = null;
        try {
            jCommander.parse(args);
        } catch (final ParameterException e) {
            failure = e.getMessage();
        }

        final boolean parsed = (failure == null) && (! help);
        if (! parsed) {
            final StringBuilder usage = new StringBuilder();
            if (failure != null) {
                usage.append("\nERROR: invalid arguments for ").append(clientName).append("\n\n")
                        .append(failure).append("\n");
                LOG.warn("parse: {}", failure);
            }
            jCommander.getUsageFormatter().usage(usage);
            jCommander.getConsole().println(usage.toString());
            if (exitOnHelpOrFailure) {
                System.exit(failure == null ? 0 : 2);
            }
        }

        return parsed;
    }

    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize " + getClass().getName(), e);
        }
    }

    /**
     * Prints usage for the specified parameters without exiting, so parameter annotations can be checked in tests.
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        parameters.parse(new String[] { "--help" }, parameters.getClass().getEnclosingClass(), false);
    }

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineParameters.class);
}
