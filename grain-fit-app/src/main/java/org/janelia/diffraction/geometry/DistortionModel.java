package org.janelia.diffraction.geometry;

/**
 * Maps between measured (distorted) and ideal detector coordinates (mm, panel centered).
 */
public interface DistortionModel {

    /**
     * @return name used in instrument documents to select this model.
     */
    String getFunctionName();

    /**
     * @return ideal {x, y} for a measured position.
     */
    double[] correct(double x,
                     double y);

    /**
     * @return measured {x, y} for an ideal position (inverse of {@link #correct}).
     */
    double[] distort(double x,
                     double y);

    /**
     * @return independent copy of this model.
     */
    DistortionModel copy();

}
