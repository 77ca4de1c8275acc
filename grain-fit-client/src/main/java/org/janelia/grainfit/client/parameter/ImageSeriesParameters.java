package org.janelia.grainfit.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters describing the rotation series of detector frames.
 *
 * @author Eric Trautman
 */
public class ImageSeriesParameters
        implements Serializable {

    @Parameter(
            names = "--imageStack",
            description = "Image stack (e.g. multi-page TIFF) holding one frame per rotation step",
            required = true)
    public String imageStack;

    @Parameter(
            names = "--omegaStart",
            description = "Rotation angle (degrees) at the start of the first frame")
    public Double omegaStart = 0.0;

    @Parameter(
            names = "--omegaStep",
            description = "Signed rotation (degrees) covered by each frame")
    public Double omegaStep = 0.25;

    @Parameter(
            names = "--threshold",
            description = "Frame intensities at or below this value are ignored")
    public Double threshold = 0.0;

    public void validate()
            throws IllegalArgumentException {
        if (omegaStep == 0.0) {
            throw new IllegalArgumentException("--omegaStep must not be zero");
        }
    }
}
