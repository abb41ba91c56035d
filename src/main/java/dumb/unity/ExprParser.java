package dumb.unity;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads the prefix form written by {@link Expr#toKif()}:
 * {@code (+ a b ...)}, {@code (* a b ...)}, {@code (^ b e)}, {@code (sin a)} and the other
 * functions, {@code (d f x n)}, {@code (int f x)}, {@code (int f x lo hi)}, {@code (lim f x p)}.
 * Integers and {@code p/q} rationals are constants, any other symbol is a variable.
 */
public class ExprParser {
    private static final int CONTEXT_BUFFER_SIZE = 50;
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(/\\d+)?");
    private final Reader reader;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private int currentChar = -2;
    private int line = 1;
    private int col = 0;

    private ExprParser(Reader reader) {
        this.reader = reader;
    }

    public static Expr parse(String text) throws ParseException {
        var all = parseAll(text);
        if (all.size() != 1)
            throw new ParseException("Expected exactly one expression, found " + all.size());
        return all.get(0);
    }

    public static List<Expr> parseAll(String text) throws ParseException {
        try (var reader = new StringReader(text)) {
            var parser = new ExprParser(reader);
            var exprs = new ArrayList<Expr>();
            parser.skipWhitespaceAndComments();
            while (parser.peek() != -1) {
                exprs.add(parser.parseExpr());
                parser.skipWhitespaceAndComments();
            }
            return exprs;
        } catch (IOException e) {
            throw new ParseException("IO Error: " + e.getMessage());
        }
    }

    private int peek() throws IOException {
        if (currentChar == -2) {
            currentChar = reader.read();
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE) {
                contextBuffer.deleteCharAt(0);
            }
            if (currentChar != -1) {
                contextBuffer.append((char) currentChar);
            }
        }
        return currentChar;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) {
            currentChar = -2;
            if (c == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        return c;
    }

    private void consumeChar(char expected) throws IOException, ParseException {
        var actual = consumeChar();
        if (actual != expected) {
            throw createParseException("Expected '" + expected + "'", ((actual == -1) ? "EOF" : "'" + (char) actual + "'"));
        }
    }

    private void skipWhitespaceAndComments() throws IOException {
        while (true) {
            var c = peek();
            if (c == -1) return;
            if (Character.isWhitespace(c)) {
                consumeChar();
            } else if (c == ';') {
                consumeChar();
                while (peek() != '\n' && peek() != -1) {
                    consumeChar();
                }
            } else {
                return;
            }
        }
    }

    private Expr parseExpr() throws IOException, ParseException {
        skipWhitespaceAndComments();
        var c = peek();
        if (c == -1) throw createParseException("Unexpected EOF while parsing expression");
        if (c == ')') throw createParseException("Unexpected ')'");
        return c == '(' ? parseList() : atom(parseSymbol());
    }

    private Expr parseList() throws IOException, ParseException {
        consumeChar('(');
        skipWhitespaceAndComments();
        if (peek() == ')') throw createParseException("Empty list");
        var op = parseSymbol();
        var args = new ArrayList<Expr>();
        skipWhitespaceAndComments();
        while (peek() != ')') {
            if (peek() == -1) throw createParseException("Unexpected EOF inside list");
            args.add(parseExpr());
            skipWhitespaceAndComments();
        }
        consumeChar(')');
        return compound(op, args);
    }

    private Expr compound(String op, List<Expr> args) throws ParseException {
        switch (op) {
            case "+", "*" -> {
                if (args.isEmpty()) throw createParseException("'" + op + "' needs at least one operand");
                return new Expr.Nary(op.equals("+") ? Expr.Nary.Kind.ADD : Expr.Nary.Kind.MUL, args);
            }
            case "^" -> {
                arity(op, args, 2);
                return new Expr.Pow(args.get(0), args.get(1));
            }
            case "d" -> {
                if (args.size() != 2 && args.size() != 3) throw createParseException("'d' takes (d body var [order])");
                var order = args.size() == 3 ? order(args.get(2)) : 1;
                return new Expr.Derivative(args.get(0), var(args.get(1)), order);
            }
            case "int" -> {
                if (args.size() == 2) return new Expr.Integral(args.get(0), var(args.get(1)));
                arity(op, args, 4);
                return new Expr.Integral(args.get(0), var(args.get(1)), args.get(2), args.get(3));
            }
            case "lim" -> {
                arity(op, args, 3);
                return new Expr.Limit(args.get(0), var(args.get(1)), args.get(2));
            }
            default -> {
                var func = Expr.Fn.Func.of(op);
                if (func == null) throw createParseException("Unknown operator '" + op + "'");
                arity(op, args, func.arity);
                return new Expr.Fn(func, args);
            }
        }
    }

    private void arity(String op, List<Expr> args, int n) throws ParseException {
        if (args.size() != n)
            throw createParseException("'" + op + "' takes " + n + " argument(s), got " + args.size());
    }

    private Expr.Var var(Expr e) throws ParseException {
        if (e instanceof Expr.Var v) return v;
        throw createParseException("Expected a variable, found " + e.toKif());
    }

    private int order(Expr e) throws ParseException {
        if (e instanceof Expr.Const c && c.isInteger() && c.signum() > 0) return c.intValueExact();
        throw createParseException("Derivative order must be a positive integer, found " + e.toKif());
    }

    private Expr atom(String symbol) throws ParseException {
        if (NUMBER.matcher(symbol).matches()) {
            var slash = symbol.indexOf('/');
            if (slash < 0) return new Expr.Const(new BigInteger(symbol), BigInteger.ONE);
            var den = new BigInteger(symbol.substring(slash + 1));
            if (den.signum() == 0) throw createParseException("Zero denominator in '" + symbol + "'");
            return new Expr.Const(new BigInteger(symbol.substring(0, slash)), den);
        }
        if (!Character.isLetter(symbol.charAt(0)))
            throw createParseException("Invalid symbol '" + symbol + "'");
        return Expr.Var.of(symbol);
    }

    private String parseSymbol() throws IOException, ParseException {
        var sb = new StringBuilder();
        var c = peek();
        if (c == -1 || Character.isWhitespace(c) || c == '(' || c == ')' || c == ';')
            throw createParseException("Unexpected character while parsing symbol: '" + (char) c + "'");
        while (peek() != -1 && !Character.isWhitespace(peek()) && peek() != '(' && peek() != ')' && peek() != ';') {
            sb.append((char) consumeChar());
        }
        return sb.toString();
    }

    private ParseException createParseException(String message) {
        return new ParseException(message, line, col, contextBuffer.toString());
    }

    private ParseException createParseException(String message, @Nullable String foundToken) {
        var foundInfo = foundToken != null ? " found " + foundToken : "";
        return new ParseException(message + foundInfo, line, col, contextBuffer.toString());
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message) {
            this(message, -1, -1, "");
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }
}
