package org.pragmatica.options;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Node of the option tree.
 *
 * <p>Holds one store per {@link OptionType}, owns named sub-scopes and keeps a read-only reference to its parent.
 * Lookups fall back to the parent chain; writes always go to the scope they are called on.
 * Sub-scopes are created through {@link #addSubscope(String)} and share the lifetime of their parent.
 *
 * <p>Not thread-safe. Build the tree first, then share it read-mostly.
 */
public final class ConfigScope implements ReadableScope {
    private static final Logger log = LoggerFactory.getLogger(ConfigScope.class);

    private final ReadableScope parent;
    private final Map<OptionType<?>, TypedStore<?>> stores = new LinkedHashMap<>();
    private final Map<String, ConfigScope> subscopes = new TreeMap<>();

    private ConfigScope(ReadableScope parent) {
        this.parent = parent;
        for (var type : OptionType.values()) {
            addStore(type);
        }
    }

    /**
     * Root scope without parent.
     */
    public static ConfigScope configScope() {
        return new ConfigScope(null);
    }

    /**
     * Detached scope whose lookups fall back to {@code parent}. The new scope is not registered as a
     * sub-scope of the parent.
     */
    public static ConfigScope configScope(ReadableScope parent) {
        if (parent == null) {
            throw new IllegalArgumentException("Parent scope must be provided, use configScope() for root");
        }
        return new ConfigScope(parent);
    }

    @Override
    public <T> T get(OptionType<T> type, String key) {
        var own = store(type).find(key);
        if (own.isPresent()) {
            return own.get();
        }
        if (parent != null) {
            return parent.get(type, key);
        }
        throw ConfigError.keyNotFound(type, key)
                         .exception();
    }

    @Override
    public <T> boolean exists(OptionType<T> type, String key) {
        if (store(type).contains(key)) {
            return true;
        }
        return parent != null && parent.exists(type, key);
    }

    @Override
    public <T> T getOrDefault(OptionType<T> type, String key, T defaultValue) {
        var own = store(type).find(key);
        if (own.isPresent()) {
            return own.get();
        }
        if (parent != null) {
            return parent.getOrDefault(type, key, defaultValue);
        }
        return defaultValue;
    }

    @Override
    public <T> boolean isDefault(OptionType<T> type, String key) {
        if (parent == null) {
            return true;
        }
        if (store(type).contains(key)) {
            return false;
        }
        return parent.isDefault(type, key);
    }

    @Override
    public <T> Optional<T> peek(OptionType<T> type, String key) {
        return store(type).peek(key);
    }

    @Override
    public <T> List<String> ownKeys(OptionType<T> type) {
        return store(type).keys();
    }

    @Override
    public <T> List<String> unreadKeys(OptionType<T> type) {
        return store(type).unreadKeys();
    }

    /**
     * Write value into this scope's own store. The entry is considered unread until the next read.
     */
    public <T> void set(OptionType<T> type, String key, T value) {
        store(type).set(key, value);
    }

    public <T> void set(OptionType<T> type, OptionKey key, T value) {
        set(type, key.storageKey(), value);
    }

    /**
     * Handle to the slot in this scope's own store, created with the type's zero value when absent.
     * Parents are not consulted. The slot is marked read.
     */
    public <T> OptionRef<T> getMutableRef(OptionType<T> type, String key) {
        return store(type).slot(key);
    }

    public <T> OptionRef<T> getMutableRef(OptionType<T> type, OptionKey key) {
        return getMutableRef(type, key.storageKey());
    }

    /**
     * Create a sub-scope whose parent is this scope.
     *
     * @throws ConfigException with {@link ConfigError.DuplicateSubscope} if the name is taken
     */
    public ConfigScope addSubscope(String name) {
        if (subscopes.containsKey(name)) {
            throw ConfigError.duplicateSubscope(name)
                             .exception();
        }
        var subscope = new ConfigScope(this);
        subscopes.put(name, subscope);
        log.debug("Added subscope [{}]", name);
        return subscope;
    }

    @Override
    public ReadableScope getSubscope(String name) {
        return getMutableSubscope(name);
    }

    /**
     * @throws ConfigException with {@link ConfigError.SubscopeNotFound} if absent
     */
    public ConfigScope getMutableSubscope(String name) {
        var subscope = subscopes.get(name);
        if (subscope == null) {
            throw ConfigError.subscopeNotFound(name)
                             .exception();
        }
        return subscope;
    }

    @Override
    public boolean hasSubscope(String name) {
        return subscopes.containsKey(name);
    }

    @Override
    public List<String> listSubscopes() {
        return List.copyOf(subscopes.keySet());
    }

    @Override
    public Optional<ReadableScope> parent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public void checkAllRead(String pathLabel) {
        for (var type : OptionType.values()) {
            var unread = store(type).findUnread();
            if (unread.isPresent()) {
                throw ConfigError.unrecognizedOption(type, pathLabel + unread.get())
                                 .exception();
            }
        }
    }

    /**
     * Parse scope grammar text into this scope, e.g. {@code threads=4, search(cpuct=3.1)}.
     *
     * @throws ConfigException with {@link ConfigError.SyntaxError} on malformed text
     * @see ScopeTextParser
     */
    public ConfigScope addFromString(String text) {
        ScopeTextParser.parseInto(this, text);
        return this;
    }

    private <T> void addStore(OptionType<T> type) {
        stores.put(type, new TypedStore<>(type));
    }

    @SuppressWarnings("unchecked")
    private <T> TypedStore<T> store(OptionType<T> type) {
        return (TypedStore<T>) stores.get(type);
    }
}
