package org.janelia.grainfit.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.diffraction.geometry.LegacyDetectorMigration;

/**
 * Parameters for migrating a legacy flat detector parameter file when no instrument file exists yet.
 *
 * @author Eric Trautman
 */
public class LegacyDetectorParameters
        implements Serializable {

    @Parameter(
            names = "--legacyDetectorFile",
            description = "Legacy detector parameter file converted into the instrument file if that file does not exist")
    public String legacyDetectorFile;

    @Parameter(
            names = "--detectorRows",
            description = "Number of detector pixel rows (for legacy migration)")
    public Integer rows = 2048;

    @Parameter(
            names = "--detectorColumns",
            description = "Number of detector pixel columns (for legacy migration)")
    public Integer columns = 2048;

    @Parameter(
            names = "--pixelSize",
            description = "Detector pixel size in mm (for legacy migration)")
    public Double pixelSize = 0.2;

    @Parameter(
            names = "--detectorId",
            description = "Identifier of the detector (for legacy migration)")
    public String detectorId = "GE";

    public LegacyDetectorMigration buildMigration() {
        return new LegacyDetectorMigration(rows, columns, pixelSize, detectorId);
    }
}
