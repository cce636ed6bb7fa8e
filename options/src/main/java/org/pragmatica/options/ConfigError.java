package org.pragmatica.options;

/**
 * Errors raised by option scopes, the scope grammar parser and the usage check.
 */
public sealed interface ConfigError {
    String message();

    default ConfigException exception() {
        return new ConfigException(this);
    }

    /**
     * Key is absent in the whole parent chain.
     */
    record KeyNotFound(OptionType<?> type, String key) implements ConfigError {
        @Override
        public String message() {
            return "Key [" + key + "] was not set in options (" + type + ")";
        }
    }

    /**
     * Requested sub-scope does not exist.
     */
    record SubscopeNotFound(String name) implements ConfigError {
        @Override
        public String message() {
            return "Subscope not found: " + name;
        }
    }

    /**
     * Sub-scope with the same name is already present.
     */
    record DuplicateSubscope(String name) implements ConfigError {
        @Override
        public String message() {
            return "Subscope already exists: " + name;
        }
    }

    /**
     * Malformed scope grammar text.
     */
    record SyntaxError(int offset, String input, String reason) implements ConfigError {
        @Override
        public String message() {
            return "Unable to parse config at offset " + offset + ": " + input + " (" + reason + ")";
        }
    }

    /**
     * Option stored but never read; usually a typo in user supplied configuration.
     */
    record UnrecognizedOption(OptionType<?> type, String path) implements ConfigError {
        @Override
        public String message() {
            return "Unknown " + type + " option: " + path;
        }
    }

    static ConfigError keyNotFound(OptionType<?> type, String key) {
        return new KeyNotFound(type, key);
    }

    static ConfigError subscopeNotFound(String name) {
        return new SubscopeNotFound(name);
    }

    static ConfigError duplicateSubscope(String name) {
        return new DuplicateSubscope(name);
    }

    static ConfigError syntaxError(int offset, String input, String reason) {
        return new SyntaxError(offset, input, reason);
    }

    static ConfigError unrecognizedOption(OptionType<?> type, String path) {
        return new UnrecognizedOption(type, path);
    }
}
