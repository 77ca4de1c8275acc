package org.janelia.diffraction.material;

import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Path;

import org.janelia.diffraction.json.JsonUtils;

/**
 * Material document: lattice, centering and the beam wavelength used to build {@link PlaneData}.
 */
public class MaterialSpec
        implements Serializable {

    /**
     * Lattice centering types and their reflection conditions.
     */
    public enum Centering {
        /** primitive, every hkl allowed */
        P,
        /** body centered, h + k + l even */
        I,
        /** face centered, h, k, l all even or all odd */
        F;

        public boolean isAllowed(final int h,
                                 final int k,
                                 final int l) {
            final boolean allowed;
            switch (this) {
                case I:
                    allowed = ((h + k + l) % 2) == 0;
                    break;
                case F:
                    final int evenCount = (h % 2 == 0 ? 1 : 0) + (k % 2 == 0 ? 1 : 0) + (l % 2 == 0 ? 1 : 0);
                    allowed = (evenCount == 0) || (evenCount == 3);
                    break;
                default:
                    allowed = true;
            }
            return allowed;
        }
    }

    private final String name;
    private final double[] latticeParameters;
    private final Centering centering;
    private final int maxIndex;
    private final double wavelength;

    @SuppressWarnings("unused")
    private MaterialSpec() {
        this(null, null, Centering.P, 0, 0.0);
    }

    /**
     * @param  name               material name (informational).
     * @param  latticeParameters  a, b, c (angstrom) and alpha, beta, gamma (degrees).
     * @param  centering          lattice centering.
     * @param  maxIndex           largest absolute Miller index to enumerate.
     * @param  wavelength         beam wavelength (angstrom).
     */
    public MaterialSpec(final String name,
                        final double[] latticeParameters,
                        final Centering centering,
                        final int maxIndex,
                        final double wavelength) {
        this.name = name;
        this.latticeParameters = latticeParameters == null ? null : latticeParameters.clone();
        this.centering = centering;
        this.maxIndex = maxIndex;
        this.wavelength = wavelength;
    }

    public static MaterialSpec cubic(final String name,
                                     final double a,
                                     final Centering centering,
                                     final int maxIndex,
                                     final double wavelength) {
        return new MaterialSpec(name, new double[] {a, a, a, 90.0, 90.0, 90.0}, centering, maxIndex, wavelength);
    }

    public String getName() {
        return name;
    }

    public double[] getLatticeParameters() {
        return latticeParameters == null ? null : latticeParameters.clone();
    }

    public Centering getCentering() {
        return centering == null ? Centering.P : centering;
    }

    public int getMaxIndex() {
        return maxIndex;
    }

    public double getWavelength() {
        return wavelength;
    }

    /**
     * @throws IllegalArgumentException
     *   if the lattice, index range or wavelength are not usable.
     */
    public void validate()
            throws IllegalArgumentException {
        if ((latticeParameters == null) || (latticeParameters.length != 6)) {
            throw new IllegalArgumentException("material " + name + " must specify 6 lattice parameters");
        }
        for (int i = 0; i < 6; i++) {
            if (! (latticeParameters[i] > 0)) {
                throw new IllegalArgumentException("material " + name + " lattice parameters must be positive");
            }
        }
        if (maxIndex < 1) {
            throw new IllegalArgumentException("material " + name + " maxIndex must be positive");
        }
        if (! (wavelength > 0)) {
            throw new IllegalArgumentException("material " + name + " wavelength must be positive");
        }
    }

    public static MaterialSpec load(final Path path)
            throws IOException, IllegalArgumentException {
        final MaterialSpec spec = JSON_HELPER.fromJsonFile(path);
        spec.validate();
        return spec;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    private static final JsonUtils.Helper<MaterialSpec> JSON_HELPER =
            new JsonUtils.Helper<>(MaterialSpec.class);
}
