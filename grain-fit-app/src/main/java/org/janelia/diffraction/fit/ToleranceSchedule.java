package org.janelia.diffraction.fit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered association tolerances, one per refinement iteration (typically coarse then fine).
 */
public class ToleranceSchedule {

    public static final ToleranceSchedule DEFAULT = new ToleranceSchedule(Arrays.asList(
            new Tolerance(0.25, 1.0, 1.0),
            new Tolerance(0.20, 0.5, 0.5)));

    private final List<Tolerance> tolerances;

    public ToleranceSchedule(final List<Tolerance> tolerances)
            throws IllegalArgumentException {
        if ((tolerances == null) || tolerances.isEmpty()) {
            throw new IllegalArgumentException("tolerance schedule must have at least one iteration");
        }
        this.tolerances = Collections.unmodifiableList(new ArrayList<>(tolerances));
    }

    /**
     * @throws IllegalArgumentException
     *   if the lists differ in size.
     */
    public static ToleranceSchedule fromLists(final List<Double> tth,
                                              final List<Double> eta,
                                              final List<Double> omega)
            throws IllegalArgumentException {
        if ((tth.size() != eta.size()) || (tth.size() != omega.size())) {
            throw new IllegalArgumentException("tth (" + tth.size() + "), eta (" + eta.size() +
                                               ") and omega (" + omega.size() +
                                               ") tolerance lists must have the same size");
        }
        final List<Tolerance> list = new ArrayList<>();
        for (int i = 0; i < tth.size(); i++) {
            list.add(new Tolerance(tth.get(i), eta.get(i), omega.get(i)));
        }
        return new ToleranceSchedule(list);
    }

    public int getNumberOfIterations() {
        return tolerances.size();
    }

    public Tolerance get(final int iteration) {
        return tolerances.get(iteration);
    }

    public List<Tolerance> getTolerances() {
        return tolerances;
    }

    @Override
    public String toString() {
        return tolerances.toString();
    }
}
