package org.pragmatica.options.cli;

import org.pragmatica.options.OptionType;
import org.pragmatica.options.ReadableScope;

import java.io.PrintWriter;

/**
 * Renders a scope tree as indented text without marking any option as read.
 *
 * <pre>
 * threads = 4 (integer)
 * search:
 *   cpuct = 3.1 (double)
 *   name = "test run" (string)
 * </pre>
 */
final class ScopePrinter {
    private static final String INDENT = "  ";

    private ScopePrinter() {}

    static void print(ReadableScope scope, PrintWriter out) {
        print(scope, out, "");
    }

    private static void print(ReadableScope scope, PrintWriter out, String indent) {
        for (var type : OptionType.values()) {
            printValues(scope, type, out, indent);
        }
        for (var name : scope.listSubscopes()) {
            out.println(indent + name + ":");
            print(scope.getSubscope(name), out, indent + INDENT);
        }
    }

    private static <T> void printValues(ReadableScope scope, OptionType<T> type, PrintWriter out, String indent) {
        for (var key : scope.ownKeys(type)) {
            scope.peek(type, key)
                 .ifPresent(value -> out.println(indent + key + " = " + render(value) + " (" + type + ")"));
        }
    }

    static String render(Object value) {
        if (value instanceof String text) {
            return "\"" + text.replace("\\", "\\\\")
                              .replace("\"", "\\\"") + "\"";
        }
        return String.valueOf(value);
    }
}
