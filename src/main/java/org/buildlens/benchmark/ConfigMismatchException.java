package org.buildlens.benchmark;

/**
 * Raised when two benchmark results produced by different configs are compared.
 */
public final class ConfigMismatchException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String baselineConfig;
    private final String currentConfig;

    public ConfigMismatchException(String baselineConfig, String currentConfig) {
        super("cannot compare benchmark results of config '" + baselineConfig + "' with '" + currentConfig + "'");
        this.baselineConfig = baselineConfig;
        this.currentConfig = currentConfig;
    }

    public String baselineConfig() {
        return baselineConfig;
    }

    public String currentConfig() {
        return currentConfig;
    }
}
