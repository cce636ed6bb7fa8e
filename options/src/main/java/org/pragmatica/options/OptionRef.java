package org.pragmatica.options;

import java.util.Objects;

/**
 * Live handle to an option slot in a single scope's own store.
 *
 * <p>Used when a setting is populated incrementally. Writes through the handle keep the slot
 * marked as read, unlike {@link ConfigScope#set(OptionType, String, Object)}.
 */
public final class OptionRef<T> {
    private final String key;
    private final TypedStore.Entry<T> entry;

    OptionRef(String key, TypedStore.Entry<T> entry) {
        this.key = key;
        this.entry = entry;
    }

    public String key() {
        return key;
    }

    public T get() {
        return entry.read();
    }

    public void set(T value) {
        entry.update(Objects.requireNonNull(value, "value"));
    }

    @Override
    public String toString() {
        return key + "=" + entry.value();
    }
}
