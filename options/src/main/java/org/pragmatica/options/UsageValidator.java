package org.pragmatica.options;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects options that were stored but never read.
 *
 * <p>Meant to run after all consumers have read their settings: anything left unread is most likely
 * a misspelled or stray option in user supplied text. Paths are dotted, e.g. {@code search.cpuct}.
 */
public final class UsageValidator {
    private static final Logger log = LoggerFactory.getLogger(UsageValidator.class);

    private UsageValidator() {}

    /**
     * Check own options of a single scope. Parents and sub-scopes are not inspected.
     *
     * @throws ConfigException with {@link ConfigError.UnrecognizedOption} for the first unread option
     */
    public static void check(ReadableScope scope, String pathLabel) {
        scope.checkAllRead(pathLabel);
    }

    /**
     * Check a whole tree, depth first, sub-scopes in name order.
     *
     * @throws ConfigException with {@link ConfigError.UnrecognizedOption} for the first unread option
     */
    public static void checkTree(ReadableScope root) {
        checkTree(root, "");
        log.debug("All options read");
    }

    /**
     * Fully qualified paths of all unread options in the tree. Read flags are not changed.
     */
    public static List<String> unreadOptions(ReadableScope root) {
        var result = new ArrayList<String>();
        collectUnread(root, "", result);
        return result;
    }

    private static void checkTree(ReadableScope scope, String pathLabel) {
        scope.checkAllRead(pathLabel);
        for (var name : scope.listSubscopes()) {
            checkTree(scope.getSubscope(name), pathLabel + name + ".");
        }
    }

    private static void collectUnread(ReadableScope scope, String pathLabel, List<String> result) {
        for (var type : OptionType.values()) {
            scope.unreadKeys(type)
                 .forEach(key -> result.add(pathLabel + key));
        }
        for (var name : scope.listSubscopes()) {
            collectUnread(scope.getSubscope(name), pathLabel + name + ".", result);
        }
    }
}
