package org.janelia.diffraction.frame;

import java.io.IOException;

/**
 * Source of dense detector frames, one per rotation step.
 */
public interface FrameReader {

    int getNumberOfFrames();

    int getRows();

    int getColumns();

    /**
     * @param  index  zero based frame index.
     *
     * @return row-major intensities ({@code rows * columns} values).
     *
     * @throws IOException
     *   if the frame cannot be read.
     */
    float[] readFrame(int index)
            throws IOException;

}
