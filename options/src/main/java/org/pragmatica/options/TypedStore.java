package org.pragmatica.options;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Options of a single type held by one scope, each with a "was read" flag.
 *
 * <p>Knows nothing about parents: absence handling belongs to {@link ConfigScope}.
 * Entries iterate in insertion order.
 */
final class TypedStore<T> {
    private final OptionType<T> type;
    private final Map<String, Entry<T>> entries = new LinkedHashMap<>();

    TypedStore(OptionType<T> type) {
        this.type = type;
    }

    /**
     * Returns value and marks entry as read. Key must be present.
     */
    T get(String key) {
        var entry = entries.get(key);
        if (entry == null) {
            throw new IllegalStateException("No " + type + " entry for key " + key);
        }
        return entry.read();
    }

    Optional<T> find(String key) {
        return Optional.ofNullable(entries.get(key))
                       .map(Entry::read);
    }

    /**
     * Value without touching the read flag.
     */
    Optional<T> peek(String key) {
        return Optional.ofNullable(entries.get(key))
                       .map(Entry::value);
    }

    void set(String key, T value) {
        var checked = type.cast(Objects.requireNonNull(value, "value"));
        entries.computeIfAbsent(key, k -> new Entry<>(type.zeroValue()))
               .write(checked);
    }

    boolean contains(String key) {
        return entries.containsKey(key);
    }

    boolean isRead(String key) {
        var entry = entries.get(key);
        return entry != null && entry.isRead();
    }

    /**
     * Slot for in-place updates; created with the zero value when absent. Marks entry as read.
     */
    OptionRef<T> slot(String key) {
        var entry = entries.computeIfAbsent(key, k -> new Entry<>(type.zeroValue()));
        entry.read();
        return new OptionRef<>(key, entry);
    }

    Optional<String> findUnread() {
        return entries.entrySet()
                      .stream()
                      .filter(e -> !e.getValue()
                                     .isRead())
                      .map(Map.Entry::getKey)
                      .findFirst();
    }

    List<String> unreadKeys() {
        var result = new ArrayList<String>();
        entries.forEach((key, entry) -> {
            if (!entry.isRead()) {
                result.add(key);
            }
        });
        return result;
    }

    List<String> keys() {
        return List.copyOf(entries.keySet());
    }

    static final class Entry<T> {
        private T value;
        private boolean read;

        Entry(T value) {
            this.value = value;
        }

        T read() {
            read = true;
            return value;
        }

        T value() {
            return value;
        }

        void write(T newValue) {
            value = newValue;
            read = false;
        }

        void update(T newValue) {
            value = newValue;
        }

        boolean isRead() {
            return read;
        }
    }
}
