package org.pragmatica.options;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.regex.Pattern;

import static org.pragmatica.options.OptionType.BOOLEAN;
import static org.pragmatica.options.OptionType.DOUBLE;
import static org.pragmatica.options.OptionType.INTEGER;
import static org.pragmatica.options.OptionType.STRING;

/**
 * Parser for the compact scope grammar.
 *
 * <p>Example:
 * <pre>
 * threads=4, net("weights.pb", scale=1.0), search(cpuct=3.1, "name"="test run")
 * </pre>
 *
 * <p>Grammar:
 * <pre>
 * scope   := [ element ("," element)* ]
 * element := name "=" value | name "(" scope ")" | name
 * name    := bare | quoted
 * value   := bare | quoted
 * quoted  := '"' ( '\' any | any except '"' and '\' )* '"'
 * bare    := run of characters other than whitespace and , ( ) = "
 * </pre>
 *
 * <p>{@code name=value} stores the value in the current scope. Quoted values are strings; bare values are
 * booleans ({@code true}/{@code false}), integers, doubles (decimal point or exponent) or, failing those,
 * strings. {@code name(...)} creates a sub-scope and parses its content there. A lone {@code name} creates
 * an empty sub-scope. Whitespace between tokens is ignored.
 */
public final class ScopeTextParser {
    private static final Logger log = LoggerFactory.getLogger(ScopeTextParser.class);

    private static final Pattern INTEGER_LITERAL = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL_LITERAL = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    static final int MAX_DEPTH = 256;

    private final Lexer lexer;
    private int values;
    private int subscopes;
    private int depth;

    private ScopeTextParser(String input) {
        this.lexer = new Lexer(input);
    }

    /**
     * Parse text into a new root scope.
     *
     * @throws ConfigException with {@link ConfigError.SyntaxError} on malformed text
     */
    public static ConfigScope parse(String text) {
        var root = ConfigScope.configScope();
        parseInto(root, text);
        return root;
    }

    /**
     * Parse text into an existing scope. New sub-scopes are added under {@code scope}.
     *
     * <p>Text is checked against a scratch scope first, so {@code scope} is left untouched when parsing fails.
     *
     * @throws ConfigException with {@link ConfigError.SyntaxError} on malformed text, or
     *                         {@link ConfigError.DuplicateSubscope} if text declares an existing sub-scope
     */
    public static void parseInto(ConfigScope scope, String text) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(text, "text");
        var staged = ConfigScope.configScope();
        run(staged, text);
        for (var name : staged.listSubscopes()) {
            if (scope.hasSubscope(name)) {
                throw ConfigError.duplicateSubscope(name)
                                 .exception();
            }
        }
        var parser = run(scope, text);
        log.debug("Parsed {} value(s) and {} subscope(s) from [{}]", parser.values, parser.subscopes, text);
    }

    private static ScopeTextParser run(ConfigScope scope, String text) {
        var parser = new ScopeTextParser(text);
        parser.parseScope(scope);
        parser.expectEnd();
        return parser;
    }

    private void parseScope(ConfigScope scope) {
        if (lexer.kind() == TokenKind.END || lexer.kind() == TokenKind.RIGHT_PAREN) {
            return;
        }
        while (true) {
            parseElement(scope);
            if (lexer.kind() != TokenKind.COMMA) {
                return;
            }
            lexer.next();
        }
    }

    private void parseElement(ConfigScope scope) {
        var name = lexer.current();
        if (!name.isText()) {
            throw lexer.error(name.offset(), "Expected option name");
        }
        lexer.next();
        switch (lexer.kind()) {
            case EQUALS -> {
                lexer.next();
                assign(scope, name.text(), lexer.current());
                lexer.next();
            }
            case LEFT_PAREN -> {
                var open = lexer.current();
                if (depth == MAX_DEPTH) {
                    throw lexer.error(open.offset(), "Subscopes nested too deeply");
                }
                lexer.next();
                var subscope = addSubscope(scope, name.text());
                depth++;
                parseScope(subscope);
                depth--;
                closeSubscope(open);
            }
            case COMMA, RIGHT_PAREN, END -> addSubscope(scope, name.text());
            default -> throw lexer.error(lexer.current()
                                              .offset(),
                                         "Expected '=' or '(' after " + name.text());
        }
    }

    private ConfigScope addSubscope(ConfigScope scope, String name) {
        subscopes++;
        return scope.addSubscope(name);
    }

    private void closeSubscope(Token open) {
        switch (lexer.kind()) {
            case RIGHT_PAREN -> lexer.next();
            case END -> throw lexer.error(open.offset(), "Unmatched '('");
            default -> throw lexer.error(lexer.current()
                                              .offset(),
                                         "Expected ',' or ')'");
        }
    }

    private void expectEnd() {
        switch (lexer.kind()) {
            case END -> {}
            case RIGHT_PAREN -> throw lexer.error(lexer.current()
                                                       .offset(),
                                                  "Unmatched ')'");
            default -> throw lexer.error(lexer.current()
                                              .offset(),
                                         "Unexpected trailing input");
        }
    }

    private void assign(ConfigScope scope, String key, Token value) {
        if (!value.isText()) {
            throw lexer.error(value.offset(), "Expected value for " + key);
        }
        values++;
        if (value.kind() == TokenKind.QUOTED) {
            scope.set(STRING, key, value.text());
            return;
        }
        var text = value.text();
        if ("true".equals(text) || "false".equals(text)) {
            scope.set(BOOLEAN, key, Boolean.parseBoolean(text));
        } else if (INTEGER_LITERAL.matcher(text)
                                  .matches()) {
            scope.set(INTEGER, key, parseInteger(value));
        } else if (DECIMAL_LITERAL.matcher(text)
                                  .matches()) {
            scope.set(DOUBLE, key, Double.parseDouble(text));
        } else {
            scope.set(STRING, key, text);
        }
    }

    private int parseInteger(Token value) {
        try{
            return Integer.parseInt(value.text());
        } catch (NumberFormatException e) {
            throw lexer.error(value.offset(), "Integer out of range: " + value.text());
        }
    }

    private enum TokenKind {
        BARE,
        QUOTED,
        EQUALS,
        COMMA,
        LEFT_PAREN,
        RIGHT_PAREN,
        END
    }

    private record Token(TokenKind kind, String text, int offset) {
        boolean isText() {
            return kind == TokenKind.BARE || kind == TokenKind.QUOTED;
        }
    }

    /**
     * Splits input into tokens on demand, keeping exactly one token of lookahead.
     */
    private static final class Lexer {
        private static final String DELIMITERS = ",()=\"";

        private final String input;
        private int position;
        private Token current;

        Lexer(String input) {
            this.input = input;
            this.current = scan();
        }

        Token current() {
            return current;
        }

        TokenKind kind() {
            return current.kind();
        }

        void next() {
            current = scan();
        }

        ConfigException error(int offset, String reason) {
            return ConfigError.syntaxError(offset, input, reason)
                              .exception();
        }

        private Token scan() {
            while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
                position++;
            }
            if (position == input.length()) {
                return new Token(TokenKind.END, "", position);
            }
            var start = position;
            return switch (input.charAt(position)) {
                case ',' -> single(TokenKind.COMMA, start);
                case '=' -> single(TokenKind.EQUALS, start);
                case '(' -> single(TokenKind.LEFT_PAREN, start);
                case ')' -> single(TokenKind.RIGHT_PAREN, start);
                case '"' -> quoted(start);
                default -> bare(start);
            };
        }

        private Token single(TokenKind kind, int start) {
            position++;
            return new Token(kind, input.substring(start, position), start);
        }

        private Token quoted(int start) {
            var text = new StringBuilder();
            position++;
            while (position < input.length()) {
                var ch = input.charAt(position);
                if (ch == '\\' && position + 1 < input.length()) {
                    text.append(input.charAt(position + 1));
                    position += 2;
                } else if (ch == '"') {
                    position++;
                    return new Token(TokenKind.QUOTED, text.toString(), start);
                } else {
                    text.append(ch);
                    position++;
                }
            }
            throw error(start, "Quoted string is not closed");
        }

        private Token bare(int start) {
            while (position < input.length()) {
                var ch = input.charAt(position);
                if (Character.isWhitespace(ch) || DELIMITERS.indexOf(ch) >= 0) {
                    break;
                }
                position++;
            }
            return new Token(TokenKind.BARE, input.substring(start, position), start);
        }
    }
}
