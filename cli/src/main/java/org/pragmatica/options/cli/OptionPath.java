package org.pragmatica.options.cli;

import org.pragmatica.options.ReadableScope;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Dotted option address, e.g. {@code search.cpuct}: leading segments name sub-scopes, the last one is the key.
 * Keys and sub-scope names containing dots cannot be addressed this way.
 */
record OptionPath(List<String> scopes, String key) {
    static OptionPath parse(String dotted) {
        if (dotted == null || dotted.isBlank()) {
            throw new IllegalArgumentException("Option path must not be empty");
        }
        var segments = Arrays.asList(dotted.trim()
                                           .split("\\.", -1));
        if (segments.stream()
                    .anyMatch(String::isEmpty)) {
            throw new IllegalArgumentException("Empty segment in option path: " + dotted);
        }
        return new OptionPath(List.copyOf(segments.subList(0, segments.size() - 1)),
                              segments.get(segments.size() - 1));
    }

    /**
     * Scope addressed by the leading segments.
     *
     * @throws org.pragmatica.options.ConfigException if a segment does not exist
     */
    ReadableScope resolveScope(ReadableScope root) {
        var scope = root;
        for (var name : scopes) {
            scope = scope.getSubscope(name);
        }
        return scope;
    }

    Optional<ReadableScope> findScope(ReadableScope root) {
        var scope = root;
        for (var name : scopes) {
            if (!scope.hasSubscope(name)) {
                return Optional.empty();
            }
            scope = scope.getSubscope(name);
        }
        return Optional.of(scope);
    }

    @Override
    public String toString() {
        return scopes.isEmpty()
               ? key
               : String.join(".", scopes) + "." + key;
    }

    static final class Converter implements ITypeConverter<OptionPath> {
        @Override
        public OptionPath convert(String value) {
            try{
                return parse(value);
            } catch (IllegalArgumentException e) {
                throw new TypeConversionException(e.getMessage());
            }
        }
    }
}
