package com.nullduck.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Configuration for {@link ExpressionEvaluator}.
 *
 * <p>The only setting is the evaluation parallelism: how many worker threads may
 * evaluate independent expressions of one batch at the same time. A parallelism of 1
 * evaluates on the caller's thread.
 *
 * <p>The default is the detected core count, overridable with the
 * {@value #PARALLELISM_PROPERTY} system property.
 */
public final class EvaluationConfig {

    private static final Logger logger = LoggerFactory.getLogger(EvaluationConfig.class);

    /** System property overriding the default parallelism. */
    public static final String PARALLELISM_PROPERTY = "nullduck.evaluation.parallelism";

    /** Upper bound on worker threads. */
    public static final int MAX_PARALLELISM = 64;

    private final int parallelism;

    private EvaluationConfig(int parallelism) {
        this.parallelism = parallelism;
    }

    /**
     * Reads the configuration from the system properties.
     *
     * @return the configuration
     */
    public static EvaluationConfig defaults() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads the configuration from a property set.
     *
     * <p>Missing or unparsable values fall back to {@link HardwareProfile#recommendedParallelism()}.
     *
     * @param properties the properties
     * @return the configuration
     */
    public static EvaluationConfig fromProperties(Properties properties) {
        HardwareProfile profile = HardwareProfile.detect();
        logger.debug("Detected {}", profile);
        int fallback = profile.recommendedParallelism();
        String value = properties.getProperty(PARALLELISM_PROPERTY);
        if (value == null || value.isBlank()) {
            return new EvaluationConfig(fallback);
        }
        try {
            return withParallelism(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid {}='{}', using {}", PARALLELISM_PROPERTY, value, fallback);
            return new EvaluationConfig(fallback);
        }
    }

    /**
     * Creates a configuration with an explicit parallelism.
     *
     * @param parallelism the requested worker count
     * @return the configuration, with the parallelism normalized to [1, MAX_PARALLELISM]
     */
    public static EvaluationConfig withParallelism(int parallelism) {
        int normalized = normalizeParallelism(parallelism);
        if (normalized != parallelism) {
            logger.warn("Parallelism {} out of range, using {}", parallelism, normalized);
        }
        return new EvaluationConfig(normalized);
    }

    /**
     * Configuration that evaluates everything on the caller's thread.
     *
     * @return the sequential configuration
     */
    public static EvaluationConfig sequential() {
        return new EvaluationConfig(1);
    }

    /**
     * Clamps a requested parallelism to [1, MAX_PARALLELISM].
     *
     * @param requested the requested worker count
     * @return the normalized worker count
     */
    public static int normalizeParallelism(int requested) {
        if (requested < 1) return 1;
        if (requested > MAX_PARALLELISM) return MAX_PARALLELISM;
        return requested;
    }

    public int parallelism() {
        return parallelism;
    }

    public boolean isSequential() {
        return parallelism == 1;
    }

    @Override
    public String toString() {
        return "EvaluationConfig(parallelism=" + parallelism + ")";
    }
}
