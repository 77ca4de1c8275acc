package org.janelia.diffraction.frame;

import java.util.Arrays;

/**
 * Thresholded detector frame that only keeps pixels above the threshold,
 * stored as sorted row-major pixel indexes with their intensities.
 */
public class SparseFrame {

    /**
     * Receives pixels found by a box query.
     */
    public interface PixelVisitor {
        void visit(int row,
                   int column,
                   float intensity);
    }

    private final int rows;
    private final int columns;
    private final int[] indexes;
    private final float[] intensities;

    /**
     * @param  indexes      strictly increasing row-major pixel indexes.
     * @param  intensities  intensity of each indexed pixel.
     */
    public SparseFrame(final int rows,
                       final int columns,
                       final int[] indexes,
                       final float[] intensities)
            throws IllegalArgumentException {
        if (indexes.length != intensities.length) {
            throw new IllegalArgumentException("indexes and intensities must have the same length");
        }
        for (int i = 1; i < indexes.length; i++) {
            if (indexes[i] <= indexes[i - 1]) {
                throw new IllegalArgumentException("pixel indexes must be strictly increasing");
            }
        }
        this.rows = rows;
        this.columns = columns;
        this.indexes = indexes.clone();
        this.intensities = intensities.clone();
    }

    /**
     * Builds a sparse frame from dense row-major pixels, zeroing (dropping) values at or below the threshold.
     */
    public static SparseFrame fromDense(final float[] pixels,
                                        final int rows,
                                        final int columns,
                                        final double threshold)
            throws IllegalArgumentException {

        if (pixels.length != rows * columns) {
            throw new IllegalArgumentException("frame has " + pixels.length + " pixels but " + rows + " x " +
                                               columns + " were expected");
        }

        int count = 0;
        for (final float value : pixels) {
            if (value > threshold) {
                count++;
            }
        }

        final int[] indexes = new int[count];
        final float[] intensities = new float[count];
        int j = 0;
        for (int i = 0; i < pixels.length; i++) {
            if (pixels[i] > threshold) {
                indexes[j] = i;
                intensities[j] = pixels[i];
                j++;
            }
        }

        return new SparseFrame(rows, columns, indexes, intensities);
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public int getNumberOfPixels() {
        return indexes.length;
    }

    /**
     * @return intensity at the pixel, zero for pixels that were thresholded away.
     */
    public float get(final int row,
                     final int column) {
        final int i = Arrays.binarySearch(indexes, row * columns + column);
        return i < 0 ? 0.0f : intensities[i];
    }

    /**
     * Visits all kept pixels inside the inclusive box (clipped to the frame) in row-major order.
     */
    public void visitBox(final int minRow,
                         final int maxRow,
                         final int minColumn,
                         final int maxColumn,
                         final PixelVisitor visitor) {

        final int fromRow = Math.max(0, minRow);
        final int toRow = Math.min(rows - 1, maxRow);
        final int fromColumn = Math.max(0, minColumn);
        final int toColumn = Math.min(columns - 1, maxColumn);
        if ((fromRow > toRow) || (fromColumn > toColumn)) {
            return;
        }

        for (int row = fromRow; row <= toRow; row++) {
            final int rowOffset = row * columns;
            int i = Arrays.binarySearch(indexes, rowOffset + fromColumn);
            if (i < 0) {
                i = -(i + 1);
            }
            final int lastIndex = rowOffset + toColumn;
            for (; (i < indexes.length) && (indexes[i] <= lastIndex); i++) {
                visitor.visit(row, indexes[i] - rowOffset, intensities[i]);
            }
        }
    }

}
