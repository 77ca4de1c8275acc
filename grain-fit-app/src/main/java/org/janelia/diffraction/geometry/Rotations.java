package org.janelia.diffraction.geometry;

/**
 * Small dense 3D vector and rotation helpers.
 *
 * Matrices are row-major {@code double[3][3]} arrays and all rotations are active
 * (a matrix maps crystal frame vectors into the sample frame, sample into lab, ...).
 * These run inside the per-pixel association loop, so they work on plain arrays
 * instead of allocating Jama matrices.
 */
public class Rotations {

    public static final double TWO_PI = 2.0 * Math.PI;

    /** Rotations with an angle below this are treated as the identity. */
    public static final double ANGLE_EPSILON = 1.0e-12;

    public static double[][] identity() {
        return new double[][] {
                {1.0, 0.0, 0.0},
                {0.0, 1.0, 0.0},
                {0.0, 0.0, 1.0}
        };
    }

    public static double[][] aboutX(final double angle) {
        final double c = Math.cos(angle);
        final double s = Math.sin(angle);
        return new double[][] {
                {1.0, 0.0, 0.0},
                {0.0,   c,  -s},
                {0.0,   s,   c}
        };
    }

    public static double[][] aboutY(final double angle) {
        final double c = Math.cos(angle);
        final double s = Math.sin(angle);
        return new double[][] {
                {  c, 0.0,   s},
                {0.0, 1.0, 0.0},
                { -s, 0.0,   c}
        };
    }

    public static double[][] aboutZ(final double angle) {
        final double c = Math.cos(angle);
        final double s = Math.sin(angle);
        return new double[][] {
                {  c,  -s, 0.0},
                {  s,   c, 0.0},
                {0.0, 0.0, 1.0}
        };
    }

    /**
     * @param  tiltAngles  detector tilts about lab x, y and z (radians).
     *
     * @return detector to lab rotation {@code Rz * Ry * Rx}.
     */
    public static double[][] detectorRotation(final double[] tiltAngles) {
        return multiply(aboutZ(tiltAngles[2]), multiply(aboutY(tiltAngles[1]), aboutX(tiltAngles[0])));
    }

    /**
     * @return sample to lab rotation of the oscillation stage {@code Rx(chi) * Ry(omega)}.
     */
    public static double[][] oscillationRotation(final double chi,
                                                 final double omega) {
        return multiply(aboutX(chi), aboutY(omega));
    }

    /**
     * Rodrigues formula for an exponential map (axis scaled by angle) vector.
     */
    public static double[][] ofExpMap(final double[] expMap) {
        final double angle = norm(expMap);
        if (angle < ANGLE_EPSILON) {
            return identity();
        }
        final double x = expMap[0] / angle;
        final double y = expMap[1] / angle;
        final double z = expMap[2] / angle;
        final double c = Math.cos(angle);
        final double s = Math.sin(angle);
        final double t = 1.0 - c;
        return new double[][] {
                {c + x * x * t,     x * y * t - z * s, x * z * t + y * s},
                {y * x * t + z * s, c + y * y * t,     y * z * t - x * s},
                {z * x * t - y * s, z * y * t + x * s, c + z * z * t}
        };
    }

    /**
     * @param  quaternion  (w, x, y, z), need not be normalized.
     *
     * @return exponential map with rotation angle in [0, pi].
     *
     * @throws IllegalArgumentException
     *   if the quaternion does not have 4 finite components or has zero length.
     */
    public static double[] expMapOfQuaternion(final double[] quaternion)
            throws IllegalArgumentException {

        if ((quaternion == null) || (quaternion.length != 4)) {
            throw new IllegalArgumentException("quaternion must have 4 components");
        }

        final double length = Math.sqrt(quaternion[0] * quaternion[0] + quaternion[1] * quaternion[1] +
                                         quaternion[2] * quaternion[2] + quaternion[3] * quaternion[3]);
        if (! (length > 0.0) || Double.isInfinite(length)) {
            throw new IllegalArgumentException("quaternion must have finite non-zero length");
        }

        // q and -q describe the same rotation, pick the one with w >= 0 to keep the angle in [0, pi]
        final double sign = quaternion[0] < 0 ? -1.0 : 1.0;
        final double w = sign * quaternion[0] / length;
        final double[] v = {
                sign * quaternion[1] / length,
                sign * quaternion[2] / length,
                sign * quaternion[3] / length
        };

        final double sinHalfAngle = norm(v);
        if (sinHalfAngle < ANGLE_EPSILON) {
            return new double[3];
        }

        final double angle = 2.0 * Math.atan2(sinHalfAngle, w);
        return scale(v, angle / sinHalfAngle);
    }

    /**
     * @return unit quaternion (w, x, y, z) with w >= 0 for the specified exponential map.
     */
    public static double[] quaternionOfExpMap(final double[] expMap) {
        final double angle = norm(expMap);
        if (angle < ANGLE_EPSILON) {
            return new double[] {1.0, 0.0, 0.0, 0.0};
        }
        final double s = Math.sin(angle / 2.0) / angle;
        return new double[] {Math.cos(angle / 2.0), expMap[0] * s, expMap[1] * s, expMap[2] * s};
    }

    public static double[][] ofQuaternion(final double[] quaternion) {
        return ofExpMap(expMapOfQuaternion(quaternion));
    }

    /**
     * @return angle (radians) of the rotation that takes {@code a} to {@code b}.
     */
    public static double misorientation(final double[][] a,
                                        final double[][] b) {
        final double[][] delta = multiply(transpose(a), b);
        final double trace = delta[0][0] + delta[1][1] + delta[2][2];
        final double cosAngle = Math.max(-1.0, Math.min(1.0, (trace - 1.0) / 2.0));
        return Math.acos(cosAngle);
    }

    public static double[][] multiply(final double[][] a,
                                      final double[][] b) {
        final double[][] c = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                c[i][j] = a[i][0] * b[0][j] + a[i][1] * b[1][j] + a[i][2] * b[2][j];
            }
        }
        return c;
    }

    public static double[][] transpose(final double[][] a) {
        final double[][] t = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                t[i][j] = a[j][i];
            }
        }
        return t;
    }

    public static double[] apply(final double[][] m,
                                 final double[] v) {
        return new double[] {
                m[0][0] * v[0] + m[0][1] * v[1] + m[0][2] * v[2],
                m[1][0] * v[0] + m[1][1] * v[1] + m[1][2] * v[2],
                m[2][0] * v[0] + m[2][1] * v[1] + m[2][2] * v[2]
        };
    }

    /**
     * @return {@code transpose(m) * v} without building the transpose.
     */
    public static double[] applyTranspose(final double[][] m,
                                          final double[] v) {
        return new double[] {
                m[0][0] * v[0] + m[1][0] * v[1] + m[2][0] * v[2],
                m[0][1] * v[0] + m[1][1] * v[1] + m[2][1] * v[2],
                m[0][2] * v[0] + m[1][2] * v[1] + m[2][2] * v[2]
        };
    }

    public static double dot(final double[] a,
                             final double[] b) {
        return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
    }

    public static double norm(final double[] v) {
        return Math.sqrt(dot(v, v));
    }

    public static double[] scale(final double[] v,
                                 final double factor) {
        return new double[] {v[0] * factor, v[1] * factor, v[2] * factor};
    }

    public static double[] add(final double[] a,
                               final double[] b) {
        return new double[] {a[0] + b[0], a[1] + b[1], a[2] + b[2]};
    }

    public static double[] subtract(final double[] a,
                                    final double[] b) {
        return new double[] {a[0] - b[0], a[1] - b[1], a[2] - b[2]};
    }

    public static double[] unit(final double[] v) {
        final double length = norm(v);
        return scale(v, 1.0 / length);
    }

    /**
     * @return angle equivalent to {@code angle} in the period [periodStart, periodStart + 2 pi).
     */
    public static double mapAngle(final double angle,
                                  final double periodStart) {
        double mapped = (angle - periodStart) % TWO_PI;
        if (mapped < 0) {
            mapped += TWO_PI;
        }
        return periodStart + mapped;
    }

    /**
     * @return signed smallest difference {@code a - b} in (-pi, pi].
     */
    public static double angularDifference(final double a,
                                           final double b) {
        double difference = (a - b) % TWO_PI;
        if (difference > Math.PI) {
            difference -= TWO_PI;
        } else if (difference <= -Math.PI) {
            difference += TWO_PI;
        }
        return difference;
    }

    public static double[][] copy(final double[][] m) {
        final double[][] c = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            c[i] = m[i].clone();
        }
        return c;
    }

    private Rotations() {
    }

}
