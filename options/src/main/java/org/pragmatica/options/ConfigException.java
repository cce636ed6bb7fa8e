package org.pragmatica.options;

/**
 * Unchecked carrier for a {@link ConfigError}.
 */
public final class ConfigException extends RuntimeException {
    private final transient ConfigError error;

    public ConfigException(ConfigError error) {
        super(error.message());
        this.error = error;
    }

    public ConfigError error() {
        return error;
    }
}
