package org.pragmatica.options;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity-compared option key.
 *
 * <p>Intended to be declared once as a {@code static final} constant and used instead of ad hoc string keys:
 * <pre>
 * static final OptionKey THREADS = OptionKey.optionKey("threads", "Threads", "Number of worker threads", 't');
 * ...
 * int threads = scope.get(INTEGER, THREADS);
 * </pre>
 * Two keys are equal only if they are the same object, so unrelated components may reuse display names
 * without sharing storage. {@code equals} and {@code hashCode} are intentionally inherited from {@link Object}.
 */
public final class OptionKey {
    private static final char NO_SHORT_FLAG = '\0';
    private static final AtomicLong NEXT_ID = new AtomicLong();

    private final long id;
    private final String longFlag;
    private final String displayName;
    private final String helpText;
    private final char shortFlag;
    private final String storageKey;

    private OptionKey(String longFlag, String displayName, String helpText, char shortFlag) {
        this.id = NEXT_ID.getAndIncrement();
        this.longFlag = Objects.requireNonNull(longFlag, "longFlag");
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        this.helpText = Objects.requireNonNull(helpText, "helpText");
        this.shortFlag = shortFlag;
        this.storageKey = longFlag + "#" + id;
    }

    public static OptionKey optionKey(String longFlag, String displayName, String helpText) {
        return new OptionKey(longFlag, displayName, helpText, NO_SHORT_FLAG);
    }

    public static OptionKey optionKey(String longFlag, String displayName, String helpText, char shortFlag) {
        if (shortFlag == NO_SHORT_FLAG) {
            throw new IllegalArgumentException("Short flag must be a printable character");
        }
        return new OptionKey(longFlag, displayName, helpText, shortFlag);
    }

    public String longFlag() {
        return longFlag;
    }

    public String displayName() {
        return displayName;
    }

    public String helpText() {
        return helpText;
    }

    public Optional<Character> shortFlag() {
        return shortFlag == NO_SHORT_FLAG
               ? Optional.empty()
               : Optional.of(shortFlag);
    }

    /**
     * Key under which values for this option are stored. Unique per instance within the process.
     */
    public String storageKey() {
        return storageKey;
    }

    @Override
    public String toString() {
        return "--" + longFlag;
    }
}
