package org.janelia.grainfit.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.diffraction.fit.ToleranceSchedule;

/**
 * Parameters for the per-iteration association tolerances (full widths in degrees).
 * The lists must have the same size, one entry per refinement iteration.
 *
 * @author Eric Trautman
 */
public class ToleranceParameters
        implements Serializable {

    @Parameter(
            names = "--tthTolerance",
            description = "Two theta window (degrees) for each refinement iteration",
            variableArity = true)
    public List<Double> tth = new ArrayList<>(Arrays.asList(0.25, 0.20));

    @Parameter(
            names = "--etaTolerance",
            description = "Eta window (degrees) for each refinement iteration",
            variableArity = true)
    public List<Double> eta = new ArrayList<>(Arrays.asList(1.0, 0.5));

    @Parameter(
            names = "--omegaTolerance",
            description = "Omega window (degrees) for each refinement iteration",
            variableArity = true)
    public List<Double> omega = new ArrayList<>(Arrays.asList(1.0, 0.5));

    /**
     * @throws IllegalArgumentException
     *   if the lists differ in size or are empty.
     */
    public ToleranceSchedule getSchedule()
            throws IllegalArgumentException {
        return ToleranceSchedule.fromLists(tth, eta, omega);
    }
}
