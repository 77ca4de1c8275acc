package org.janelia.diffraction.frame;

import ij.IJ;
import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ImageProcessor;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads frames from an image stack (e.g. a multi-page TIFF) that ImageJ can open.
 * Slice n of the stack holds frame n - 1.
 */
public class ImageStackFrameReader
        implements FrameReader {

    private final Path path;
    private final ImageStack stack;

    /**
     * @throws FileNotFoundException
     *   if the stack does not exist.
     *
     * @throws IOException
     *   if ImageJ cannot open the stack.
     */
    public ImageStackFrameReader(final Path path)
            throws IOException {

        if (! Files.exists(path)) {
            throw new FileNotFoundException("image stack " + path + " does not exist");
        }

        final ImagePlus imagePlus = IJ.openImage(path.toAbsolutePath().toString());
        if (imagePlus == null) {
            throw new IOException("failed to open image stack " + path);
        }

        this.path = path;
        this.stack = imagePlus.getStack();

        LOG.info("ImageStackFrameReader: opened {} with {} frames of {} x {} pixels",
                 path, stack.getSize(), stack.getWidth(), stack.getHeight());
    }

    @Override
    public int getNumberOfFrames() {
        return stack.getSize();
    }

    @Override
    public int getRows() {
        return stack.getHeight();
    }

    @Override
    public int getColumns() {
        return stack.getWidth();
    }

    @Override
    public float[] readFrame(final int index)
            throws IOException {
        if ((index < 0) || (index >= stack.getSize())) {
            throw new IOException("frame " + index + " is not in " + path + " (" + stack.getSize() + " frames)");
        }
        final ImageProcessor processor = stack.getProcessor(index + 1);
        return (float[]) processor.convertToFloat().getPixels();
    }

    private static final Logger LOG = LoggerFactory.getLogger(ImageStackFrameReader.class);
}
