package org.janelia.diffraction.fit;

/**
 * One row of a {@link ReflectionTable}: a predicted reflection and, when intensity was found inside
 * the tolerance window, its measured centroid.
 */
public class Reflection {

    public static final int INVALID_ID = -999;

    private final int id;
    private final int[] hkl;
    private final double sumIntensity;
    private final double maxIntensity;
    private final double predictedTth;
    private final double predictedEta;
    private final double predictedOmega;
    private final double predictedX;
    private final double predictedY;
    private final double measuredX;
    private final double measuredY;
    private final double measuredOmega;
    private final boolean inScanWindow;

    /**
     * @param  id              non-negative peak id for valid rows, {@link #INVALID_ID} otherwise.
     * @param  measuredX       intensity weighted panel x (mm, distorted), NaN for invalid rows.
     * @param  measuredY       intensity weighted panel y (mm, distorted), NaN for invalid rows.
     * @param  measuredOmega   intensity weighted rotation angle (radians), NaN for invalid rows.
     * @param  inScanWindow    true if the predicted rotation angle is away from the scan edges.
     */
    public Reflection(final int id,
                      final int[] hkl,
                      final double sumIntensity,
                      final double maxIntensity,
                      final double predictedTth,
                      final double predictedEta,
                      final double predictedOmega,
                      final double predictedX,
                      final double predictedY,
                      final double measuredX,
                      final double measuredY,
                      final double measuredOmega,
                      final boolean inScanWindow) {
        this.id = id;
        this.hkl = hkl.clone();
        this.sumIntensity = sumIntensity;
        this.maxIntensity = maxIntensity;
        this.predictedTth = predictedTth;
        this.predictedEta = predictedEta;
        this.predictedOmega = predictedOmega;
        this.predictedX = predictedX;
        this.predictedY = predictedY;
        this.measuredX = measuredX;
        this.measuredY = measuredY;
        this.measuredOmega = measuredOmega;
        this.inScanWindow = inScanWindow;
    }

    public int getId() {
        return id;
    }

    public boolean isValid() {
        return id >= 0;
    }

    /**
     * @return true if this row takes part in the fit (valid and inside the scan window).
     */
    public boolean isFitCandidate() {
        return isValid() && inScanWindow;
    }

    public int[] getHkl() {
        return hkl.clone();
    }

    public double[] getHklVector() {
        return new double[] {hkl[0], hkl[1], hkl[2]};
    }

    public double getSumIntensity() {
        return sumIntensity;
    }

    public double getMaxIntensity() {
        return maxIntensity;
    }

    public double getPredictedTth() {
        return predictedTth;
    }

    public double getPredictedEta() {
        return predictedEta;
    }

    public double getPredictedOmega() {
        return predictedOmega;
    }

    public double getPredictedX() {
        return predictedX;
    }

    public double getPredictedY() {
        return predictedY;
    }

    public double getMeasuredX() {
        return measuredX;
    }

    public double getMeasuredY() {
        return measuredY;
    }

    public double getMeasuredOmega() {
        return measuredOmega;
    }

    public boolean isInScanWindow() {
        return inScanWindow;
    }

}
