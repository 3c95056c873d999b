package com.nullduck.runtime;

import java.util.Locale;
import java.util.Objects;

/**
 * Detects the hardware the evaluator runs on.
 *
 * <p>Only the CPU core count feeds into configuration: it is the default number of
 * worker threads used to evaluate independent expressions of one batch.
 *
 * <p>Example usage:
 * <pre>
 *   HardwareProfile profile = HardwareProfile.detect();
 *   int workers = profile.recommendedParallelism();
 * </pre>
 *
 * @see EvaluationConfig
 */
public final class HardwareProfile {

    private final int cpuCores;
    private final String architecture;

    /**
     * Creates a hardware profile.
     *
     * @param cpuCores the number of CPU cores
     * @param arch the CPU architecture string
     */
    HardwareProfile(int cpuCores, String arch) {
        if (cpuCores < 1) {
            throw new IllegalArgumentException("cpuCores must be positive, got: " + cpuCores);
        }
        this.cpuCores = cpuCores;
        this.architecture = Objects.requireNonNull(arch, "arch must not be null");
    }

    /**
     * Detects the hardware profile of the current system.
     *
     * @return the detected hardware profile
     */
    public static HardwareProfile detect() {
        int cores = Runtime.getRuntime().availableProcessors();
        String arch = System.getProperty("os.arch", "unknown").toLowerCase(Locale.ROOT);
        return new HardwareProfile(cores, arch);
    }

    /**
     * Returns the recommended number of evaluation workers.
     *
     * <p>Uses every core, capped at {@link EvaluationConfig#MAX_PARALLELISM}.
     *
     * @return the recommended worker count
     */
    public int recommendedParallelism() {
        return Math.min(cpuCores, EvaluationConfig.MAX_PARALLELISM);
    }

    public int cpuCores() {
        return cpuCores;
    }

    public String architecture() {
        return architecture;
    }

    @Override
    public String toString() {
        return String.format("HardwareProfile(cores=%d, arch=%s)", cpuCores, architecture);
    }
}
