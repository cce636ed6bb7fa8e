package org.pragmatica.options.cli;

import org.pragmatica.options.ConfigException;
import org.pragmatica.options.ConfigScope;
import org.pragmatica.options.OptionType;
import org.pragmatica.options.ReadableScope;
import org.pragmatica.options.UsageValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line tool for option trees written in the scope grammar.
 *
 * <p>Usage examples:
 * <pre>
 * options -c 'threads=4, search(cpuct=3.1)' dump
 * options -f engine.opts get search.cpuct
 * options -f engine.opts get search.threads -o 'threads=8'
 * options -f engine.opts check --known threads,search.cpuct
 * </pre>
 */
@Command(name = "options",
         mixinStandardHelpOptions = true,
         version = "Scoped Options 0.1.0",
         description = "Inspect and validate option trees",
         subcommands = {
                 OptionsCli.DumpCommand.class,
                 OptionsCli.GetCommand.class,
                 OptionsCli.CheckCommand.class
         })
public class OptionsCli implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(OptionsCli.class);

    @Option(names = {"-c", "--config"},
            description = "Option text in scope grammar; may be repeated, applied after --file in given order")
    private List<String> configs = new ArrayList<>();

    @Option(names = {"-f", "--file"},
            description = "File with option text in scope grammar; line breaks count as whitespace")
    private Path file;

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new OptionsCli())
               .setExecutionExceptionHandler(OptionsCli::reportFailure);
    }

    @Override
    public void run() {
        // No subcommand given
        spec.commandLine()
            .usage(spec.commandLine()
                       .getOut());
    }

    ConfigScope load() throws IOException {
        var root = ConfigScope.configScope();
        if (file != null) {
            log.debug("Loading options from {}", file);
            root.addFromString(Files.readString(file));
        }
        for (var text : configs) {
            root.addFromString(text);
        }
        return root;
    }

    private static int reportFailure(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult) throws Exception {
        if (e instanceof ConfigException) {
            log.debug("Command failed", e);
            commandLine.getErr()
                       .println(e.getMessage());
            return 1;
        }
        if (e instanceof IOException) {
            log.debug("Command failed", e);
            commandLine.getErr()
                       .println("Cannot read options: " + e.getMessage());
            return 1;
        }
        throw e;
    }

    // ===== Subcommands =====

    @Command(name = "dump", description = "Print the option tree")
    static class DumpCommand implements Callable<Integer> {
        @ParentCommand
        private OptionsCli parent;

        @Spec
        private CommandSpec spec;

        @Override
        public Integer call() throws IOException {
            var out = spec.commandLine()
                          .getOut();
            ScopePrinter.print(parent.load(), out);
            out.flush();
            return 0;
        }
    }

    @Command(name = "get", description = "Resolve one option, falling back to enclosing scopes")
    static class GetCommand implements Callable<Integer> {
        @ParentCommand
        private OptionsCli parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0",
                    converter = OptionPath.Converter.class,
                    description = "Dotted option path, e.g. search.cpuct")
        private OptionPath path;

        @Option(names = {"-t", "--type"},
                description = "Value type: boolean, integer, double or string. Default: first type defining the key")
        private String typeName;

        @Option(names = {"-o", "--override"},
                description = "Option text applied in a scope layered over the selected one")
        private String override;

        @Override
        public Integer call() throws IOException {
            ReadableScope scope = path.resolveScope(parent.load());
            if (override != null) {
                scope = ConfigScope.configScope(scope)
                                   .addFromString(override);
            }
            var type = resolveType(scope);
            var out = spec.commandLine()
                          .getOut();
            out.println(describe(scope, type));
            out.flush();
            return 0;
        }

        private OptionType<?> resolveType(ReadableScope scope) {
            if (typeName != null) {
                return OptionType.fromName(typeName)
                                 .orElseThrow(() -> new ParameterException(spec.commandLine(),
                                                                           "Unknown type: " + typeName));
            }
            return OptionType.values()
                             .stream()
                             .filter(type -> scope.exists(type, path.key()))
                             .findFirst()
                             .orElse(OptionType.STRING);
        }

        private <T> String describe(ReadableScope scope, OptionType<T> type) {
            var value = ScopePrinter.render(scope.get(type, path.key()));
            return scope.isDefault(type, path.key())
                   ? value + " (default)"
                   : value;
        }
    }

    @Command(name = "check", description = "Fail if the tree holds options outside the known set")
    static class CheckCommand implements Callable<Integer> {
        @ParentCommand
        private OptionsCli parent;

        @Spec
        private CommandSpec spec;

        @Option(names = {"-k", "--known"},
                split = ",",
                converter = OptionPath.Converter.class,
                description = "Known option paths, e.g. threads,search.cpuct")
        private List<OptionPath> known = new ArrayList<>();

        @Option(names = {"-a", "--all"}, description = "List every unrecognized option instead of the first one")
        private boolean all;

        @Override
        public Integer call() throws IOException {
            var root = parent.load();
            known.forEach(path -> markRead(root, path));
            if (all) {
                return reportAll(root);
            }
            UsageValidator.checkTree(root);
            printOk();
            return 0;
        }

        private int reportAll(ReadableScope root) {
            var unread = UsageValidator.unreadOptions(root);
            if (unread.isEmpty()) {
                printOk();
                return 0;
            }
            var err = spec.commandLine()
                          .getErr();
            unread.forEach(path -> err.println("Unknown option: " + path));
            err.flush();
            return 1;
        }

        private void printOk() {
            var out = spec.commandLine()
                          .getOut();
            out.println("OK");
            out.flush();
        }

        private static void markRead(ReadableScope root, OptionPath path) {
            path.findScope(root)
                .ifPresent(scope -> OptionType.values()
                                              .forEach(type -> readIfPresent(scope, type, path.key())));
        }

        private static <T> void readIfPresent(ReadableScope scope, OptionType<T> type, String key) {
            if (scope.exists(type, key)) {
                scope.get(type, key);
            }
        }
    }
}
