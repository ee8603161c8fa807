package solidrail.config;

import java.util.Properties;

/**
 * Immutable compiler settings. Every compile run works against one snapshot.
 *
 * @param targetVersion version constraint written into the {@code pragma solidity} directive
 */
public record CompilerConfig(
        String targetVersion,
        boolean optimizationEnabled,
        boolean gasOptimizationEnabled,
        boolean securityChecksEnabled
) {
    public static final String DEFAULT_TARGET_VERSION = "^0.8.30";

    public static final String TARGET_VERSION_KEY = "solidrail.target-version";
    public static final String OPTIMIZATION_KEY = "solidrail.optimization";
    public static final String GAS_OPTIMIZATION_KEY = "solidrail.gas-optimization";
    public static final String SECURITY_CHECKS_KEY = "solidrail.security-checks";

    public CompilerConfig {
        if (targetVersion == null || targetVersion.isBlank()) {
            throw new IllegalArgumentException("Target version must not be blank");
        }
        targetVersion = targetVersion.trim();
    }

    public static CompilerConfig defaults() {
        return new CompilerConfig(DEFAULT_TARGET_VERSION, true, true, true);
    }

    /**
     * Settings from {@code props}; missing keys keep their default.
     */
    public static CompilerConfig fromProperties(Properties props) {
        CompilerConfig d = defaults();
        return new CompilerConfig(
                props.getProperty(TARGET_VERSION_KEY, d.targetVersion()),
                flag(props, OPTIMIZATION_KEY, d.optimizationEnabled()),
                flag(props, GAS_OPTIMIZATION_KEY, d.gasOptimizationEnabled()),
                flag(props, SECURITY_CHECKS_KEY, d.securityChecksEnabled()));
    }

    private static boolean flag(Properties props, String key, boolean fallback) {
        String v = props.getProperty(key);
        if (v == null) return fallback;
        return switch (v.trim().toLowerCase()) {
            case "true", "yes", "on", "1" -> true;
            case "false", "no", "off", "0" -> false;
            default -> throw new IllegalArgumentException("Invalid boolean for " + key + ": " + v);
        };
    }

    public CompilerConfig withTargetVersion(String version) {
        return new CompilerConfig(version, optimizationEnabled, gasOptimizationEnabled, securityChecksEnabled);
    }

    public CompilerConfig withOptimization(boolean enabled) {
        return new CompilerConfig(targetVersion, enabled, gasOptimizationEnabled, securityChecksEnabled);
    }

    public CompilerConfig withGasOptimization(boolean enabled) {
        return new CompilerConfig(targetVersion, optimizationEnabled, enabled, securityChecksEnabled);
    }

    public CompilerConfig withSecurityChecks(boolean enabled) {
        return new CompilerConfig(targetVersion, optimizationEnabled, gasOptimizationEnabled, enabled);
    }
}
