package org.pragmatica.options;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of an option scope.
 *
 * <p>Lookups resolve in this scope first and then walk the parent chain up to the root. Reads still
 * mark the entry that satisfied them as read, so the usage check sees them.
 * Parents and sub-scopes obtained through this view are read-only as well.
 */
public interface ReadableScope {
    /**
     * Value of given type, from this scope or the nearest ancestor that defines it.
     *
     * @throws ConfigException with {@link ConfigError.KeyNotFound} if no scope in the chain has the key
     */
    <T> T get(OptionType<T> type, String key);

    <T> boolean exists(OptionType<T> type, String key);

    <T> T getOrDefault(OptionType<T> type, String key, T defaultValue);

    /**
     * True at the root, false if this scope's own store has the key, otherwise the parent's answer.
     */
    <T> boolean isDefault(OptionType<T> type, String key);

    /**
     * Value from this scope's own store, without marking it read and without consulting parents.
     */
    <T> Optional<T> peek(OptionType<T> type, String key);

    /**
     * Keys defined in this scope's own store for given type, in insertion order.
     */
    <T> List<String> ownKeys(OptionType<T> type);

    /**
     * Keys in this scope's own store for given type that were never read.
     */
    <T> List<String> unreadKeys(OptionType<T> type);

    /**
     * @throws ConfigException with {@link ConfigError.SubscopeNotFound} if absent
     */
    ReadableScope getSubscope(String name);

    boolean hasSubscope(String name);

    /**
     * Sub-scope names, sorted.
     */
    List<String> listSubscopes();

    Optional<ReadableScope> parent();

    /**
     * Fails on the first own option (all types, parents and sub-scopes excluded) that was never read.
     *
     * @param pathLabel prefix prepended to the key in the error message, e.g. {@code "search."}
     * @throws ConfigException with {@link ConfigError.UnrecognizedOption}
     */
    void checkAllRead(String pathLabel);

    default <T> T get(OptionType<T> type, OptionKey key) {
        return get(type, key.storageKey());
    }

    default <T> boolean exists(OptionType<T> type, OptionKey key) {
        return exists(type, key.storageKey());
    }

    default <T> T getOrDefault(OptionType<T> type, OptionKey key, T defaultValue) {
        return getOrDefault(type, key.storageKey(), defaultValue);
    }

    default <T> boolean isDefault(OptionType<T> type, OptionKey key) {
        return isDefault(type, key.storageKey());
    }
}
