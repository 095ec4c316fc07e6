package org.broadinstitute.scbfa.conf;

import org.apache.commons.configuration.Configuration;
import org.broadinstitute.scbfa.utils.Utils;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Configuration for the scBFA model fitters. Properties are prefixed by {@link #SCBFA_PROPERTY_PREFIX}.
 * <p>
 * - {@link #MAX_ITERATIONS_KEY}: cap on the number of block coordinate ascent sweeps.
 * - {@link #TOLERANCE_KEY}: relative log-likelihood change below which a fit is converged.
 * - {@link #EPSILON_KEY}: floor added to the IRLS working weights.
 * - {@link #RIDGE_KEY} and {@link #MAX_RIDGE_KEY}: initial and hard-cap ridge for ill-conditioned solves.
 * - {@link #L2_PENALTY_KEY}: Gaussian prior precision on all model parameters.
 * - {@link #PCA_TRANSFORM_KEY}: detection transform applied by Binary PCA.
 * <p>
 * See {@code scbfa.properties} for the full key list and defaults.
 */
public final class ScBfaConf {

    public static final String SCBFA_PROPERTY_PREFIX = "scbfa.";

    public static final String MAX_ITERATIONS_KEY = "maxIterations";
    public static final String TOLERANCE_KEY = "tolerance";
    public static final String EPSILON_KEY = "epsilon";
    public static final String RIDGE_KEY = "ridge";
    public static final String MAX_RIDGE_KEY = "maxRidge";
    public static final String CONDITION_THRESHOLD_KEY = "conditionThreshold";
    public static final String L2_PENALTY_KEY = "l2Penalty";
    public static final String CLIP_DELTA_KEY = "clipDelta";
    public static final String INIT_METHOD_KEY = "initMethod";
    public static final String RANDOM_INIT_SCALE_KEY = "randomInitScale";
    public static final String SEED_KEY = "seed";
    public static final String NOISE_TOLERANCE_KEY = "noiseTolerance";
    public static final String MAX_STEP_HALVINGS_KEY = "maxStepHalvings";
    public static final String PARALLEL_SWEEPS_KEY = "parallelSweeps";
    public static final String VERBOSE_INTERVAL_KEY = "verboseInterval";
    public static final String PCA_TRANSFORM_KEY = "pca.transform";
    public static final String PCA_MIN_DETECTION_VARIANCE_KEY = "pca.minDetectionVariance";

    final Configuration configuration;

    ScBfaConf(final Configuration configuration) {
        Utils.nonNull(configuration);
        this.configuration = configuration;
    }

    public boolean containsKey(final String propertyKey) {
        return configuration.containsKey(SCBFA_PROPERTY_PREFIX + propertyKey);
    }

    public int getInt(final String propertyKey) {
        return configuration.getInt(requireKey(propertyKey));
    }

    public long getLong(final String propertyKey) {
        return configuration.getLong(requireKey(propertyKey));
    }

    public double getDouble(final String propertyKey) {
        return configuration.getDouble(requireKey(propertyKey));
    }

    public boolean getBoolean(final String propertyKey) {
        return configuration.getBoolean(requireKey(propertyKey));
    }

    public String getString(final String propertyKey) {
        return configuration.getString(requireKey(propertyKey));
    }

    /**
     * Reads an enum-valued property by constant name, ignoring case.
     */
    public <E extends Enum<E>> E getEnum(final String propertyKey, final Class<E> enumType) {
        final String value = getString(propertyKey).trim();
        for (final E constant : enumType.getEnumConstants()) {
            if (constant.name().equalsIgnoreCase(value)) {
                return constant;
            }
        }
        throw new IllegalArgumentException(String.format("Invalid value \"%s\" for property %s%s; expected one of %s",
                value, SCBFA_PROPERTY_PREFIX, propertyKey, Arrays.toString(enumType.getEnumConstants())));
    }

    private String requireKey(final String propertyKey) {
        final String fullKey = SCBFA_PROPERTY_PREFIX + Utils.nonNull(propertyKey, "the property key cannot be null");
        if (!configuration.containsKey(fullKey)) {
            throw new NoSuchElementException("No value configured for " + fullKey);
        }
        return fullKey;
    }
}
