package org.janelia.diffraction.geometry;

import java.io.Serializable;

/**
 * Detector section of an instrument document.
 */
public class DetectorSpec
        implements Serializable {

    /**
     * Pixel layout of the panel.
     */
    public static class Pixels
            implements Serializable {

        private final int rows;
        private final int columns;
        private final double size;

        @SuppressWarnings("unused")
        private Pixels() {
            this(0, 0, 0.0);
        }

        public Pixels(final int rows,
                      final int columns,
                      final double size) {
            this.rows = rows;
            this.columns = columns;
            this.size = size;
        }

        public int getRows() {
            return rows;
        }

        public int getColumns() {
            return columns;
        }

        /**
         * @return edge length of a (square) pixel in mm.
         */
        public double getSize() {
            return size;
        }
    }

    /**
     * Placement of the panel in the lab frame.
     */
    public static class Transform
            implements Serializable {

        private final double[] tiltAngles;
        private final double[] translation;

        @SuppressWarnings("unused")
        private Transform() {
            this(new double[3], new double[3]);
        }

        public Transform(final double[] tiltAngles,
                         final double[] translation) {
            this.tiltAngles = tiltAngles.clone();
            this.translation = translation.clone();
        }

        /**
         * @return tilts about lab x, y and z in radians.
         */
        public double[] getTiltAngles() {
            return tiltAngles.clone();
        }

        /**
         * @return lab frame position (mm) of the panel center.
         */
        public double[] getTranslation() {
            return translation.clone();
        }
    }

    private final String id;
    private final Pixels pixels;
    private final Transform transform;
    private final DistortionSpec distortion;

    @SuppressWarnings("unused")
    private DetectorSpec() {
        this(null, null, null, null);
    }

    public DetectorSpec(final String id,
                        final Pixels pixels,
                        final Transform transform,
                        final DistortionSpec distortion) {
        this.id = id;
        this.pixels = pixels;
        this.transform = transform;
        this.distortion = distortion;
    }

    public String getId() {
        return id;
    }

    public Pixels getPixels() {
        return pixels;
    }

    public Transform getTransform() {
        return transform;
    }

    public DistortionSpec getDistortion() {
        return distortion;
    }

}
