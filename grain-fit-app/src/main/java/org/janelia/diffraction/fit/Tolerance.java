package org.janelia.diffraction.fit;

/**
 * Full widths (degrees) of the Bragg angle (2 theta), azimuth (eta) and rotation (omega) windows
 * used to associate measured intensity with a predicted reflection.
 */
public class Tolerance {

    private final double tth;
    private final double eta;
    private final double omega;

    public Tolerance(final double tth,
                     final double eta,
                     final double omega) {
        this.tth = tth;
        this.eta = eta;
        this.omega = omega;
    }

    public double getTth() {
        return tth;
    }

    public double getEta() {
        return eta;
    }

    public double getOmega() {
        return omega;
    }

    public double getTthRadians() {
        return Math.toRadians(tth);
    }

    public double getEtaRadians() {
        return Math.toRadians(eta);
    }

    public double getOmegaRadians() {
        return Math.toRadians(omega);
    }

    @Override
    public String toString() {
        return "{tth: " + tth + ", eta: " + eta + ", omega: " + omega + "}";
    }
}
