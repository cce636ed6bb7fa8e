package org.pragmatica.options;

import java.util.List;
import java.util.Optional;

/**
 * Supported option value types.
 *
 * <p>The set is closed: every {@link ConfigScope} holds exactly one store per type listed in {@link #values()}.
 * Values are checked against {@link #valueClass()} on write.
 *
 * @param <T> Java type of the values stored under this tag
 */
public final class OptionType<T> {
    public static final OptionType<Boolean> BOOLEAN = new OptionType<>("boolean", Boolean.class, false);
    public static final OptionType<Integer> INTEGER = new OptionType<>("integer", Integer.class, 0);
    public static final OptionType<String> STRING = new OptionType<>("string", String.class, "");
    public static final OptionType<Double> DOUBLE = new OptionType<>("double", Double.class, 0.0);

    private static final List<OptionType<?>> VALUES = List.of(BOOLEAN, INTEGER, STRING, DOUBLE);

    private final String name;
    private final Class<T> valueClass;
    private final T zeroValue;

    private OptionType(String name, Class<T> valueClass, T zeroValue) {
        this.name = name;
        this.valueClass = valueClass;
        this.zeroValue = zeroValue;
    }

    /**
     * All supported types, in the order scopes report unread options.
     */
    public static List<OptionType<?>> values() {
        return VALUES;
    }

    /**
     * Resolve type by its display name, case-insensitive.
     */
    public static Optional<OptionType<?>> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        var normalized = name.trim()
                             .toLowerCase();
        return VALUES.stream()
                     .filter(type -> type.name.equals(normalized))
                     .findFirst();
    }

    public String displayName() {
        return name;
    }

    public Class<T> valueClass() {
        return valueClass;
    }

    /**
     * Value assigned to slots created through {@link ConfigScope#getMutableRef(OptionType, String)}.
     */
    public T zeroValue() {
        return zeroValue;
    }

    T cast(Object value) {
        return valueClass.cast(value);
    }

    @Override
    public String toString() {
        return name;
    }
}
