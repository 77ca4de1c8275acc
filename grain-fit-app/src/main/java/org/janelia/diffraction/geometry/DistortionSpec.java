package org.janelia.diffraction.geometry;

import java.io.Serializable;

/**
 * Distortion section of an instrument document: a function name and its coefficients.
 */
public class DistortionSpec
        implements Serializable {

    private final String functionName;
    private final double[] parameters;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private DistortionSpec() {
        this(NoDistortion.FUNCTION_NAME, null);
    }

    public DistortionSpec(final String functionName,
                          final double[] parameters) {
        this.functionName = functionName;
        this.parameters = parameters == null ? null : parameters.clone();
    }

    public String getFunctionName() {
        return functionName;
    }

    public double[] getParameters() {
        return parameters == null ? null : parameters.clone();
    }

    /**
     * @return model for this spec.
     *
     * @throws IllegalArgumentException
     *   if the function name is unknown or the parameters do not fit the function.
     */
    public DistortionModel buildModel()
            throws IllegalArgumentException {

        final DistortionModel model;
        if ((functionName == null) || NoDistortion.FUNCTION_NAME.equalsIgnoreCase(functionName)) {
            model = new NoDistortion();
        } else if (GE41RTDistortion.FUNCTION_NAME.equalsIgnoreCase(functionName)) {
            model = new GE41RTDistortion(parameters);
        } else {
            throw new IllegalArgumentException("unknown distortion function '" + functionName + "'");
        }

        return model;
    }

}
