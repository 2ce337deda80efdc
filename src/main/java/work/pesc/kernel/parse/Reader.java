package work.pesc.kernel.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;
import work.pesc.kernel.runtime.ErrorKind;
import work.pesc.kernel.runtime.Registry;
import work.pesc.kernel.runtime.Value;

/**
 * Single-pass reader turning source text into tokens.
 *
 * <p>Nested {@code {...}} blocks are read recursively; an unmatched closing brace ends the current level, which at the
 * top level means the rest of the text is ignored. Whether a character is an operator depends on the aliases
 * registered when reading, so new operators can be defined before they are used.
 *
 * <p>Offsets are counted in code points.
 */
public final class Reader {
    private static final Pattern NUMBER = Pattern.compile(
        "[+-]?(?:\\d+\\.?\\d*(?:[eE][+-]?\\d+)?|\\.\\d+(?:[eE][+-]?\\d+)?|(?i:inf|infinity|nan))"
    );

    private final Registry registry;

    public Reader(Registry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ParseResult parse(String source) throws ParseException {
        int[] chars = source.codePoints().toArray();
        List<Value> tokens = new ArrayList<>();
        int cursor = read(chars, 0, tokens);
        return new ParseResult(Math.min(cursor, chars.length), tokens);
    }

    /**
     * Numeric literal rule shared by plain and parenthesized numbers: underscores are dropped before parsing.
     */
    public static OptionalDouble parseNumber(String raw) {
        String digits = raw.replace("_", "");
        if (!NUMBER.matcher(digits).matches()) {
            return OptionalDouble.empty();
        }
        String lower = digits.toLowerCase(Locale.ROOT);
        if (lower.endsWith("inf") || lower.endsWith("infinity")) {
            return OptionalDouble.of(lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
        }
        if (lower.endsWith("nan")) {
            return OptionalDouble.of(Double.NaN);
        }
        return OptionalDouble.of(Double.parseDouble(digits));
    }

    private int read(int[] chars, int start, List<Value> tokens) throws ParseException {
        int i = start;
        while (i < chars.length) {
            int ch = chars[i];
            if (isDigit(ch) || ch == '.' || ch == '_') {
                int end = scan(chars, i, c -> !isDigit(c) && c != '_' && c != '.');
                String raw = text(chars, i, end);
                i = end;
                tokens.add(Value.number(number(raw, i)));
            } else if (ch == '(') {
                int end = scan(chars, i + 1, c -> c == ')');
                String raw = text(chars, i + 1, end);
                i = end + 1;
                tokens.add(Value.number(number(raw, i)));
            } else if (ch == '"') {
                int end = scan(chars, i + 1, c -> c == '"');
                tokens.add(Value.text(text(chars, i + 1, end)));
                i = end + 1;
            } else if (ch == '[') {
                int end = scan(chars, i + 1, c -> c == ']');
                tokens.add(Value.function(text(chars, i + 1, end)));
                i = end + 1;
            } else if (ch == '{') {
                List<Value> inner = new ArrayList<>();
                int close = read(chars, i + 1, inner);
                tokens.add(Value.block(inner));
                i = close + 1;
            } else if (ch == '}') {
                return i;
            } else if (ch == ' ' || ch == '\t' || ch == '\n') {
                i++;
            } else if (ch == '\\') {
                i = scan(chars, i + 1, c -> c == '\n' || c == '\\') + 1;
            } else if (ch == 'T' || ch == 'F') {
                tokens.add(Value.bool(ch == 'T'));
                i++;
            } else {
                if (Character.isSupplementaryCodePoint(ch) || !registry.isOperator((char) ch)) {
                    throw new ParseException(i, new ErrorKind.UnknownFunction("'" + Character.toString(ch) + "'"));
                }
                tokens.add(Value.operator((char) ch));
                i++;
            }
        }
        return i;
    }

    private static double number(String raw, int position) throws ParseException {
        OptionalDouble parsed = parseNumber(raw);
        if (parsed.isEmpty()) {
            throw new ParseException(position, new ErrorKind.InvalidNumberLit(raw));
        }
        return parsed.getAsDouble();
    }

    private static int scan(int[] chars, int from, IntPredicate stop) {
        int c = from;
        while (c < chars.length && !stop.test(chars[c])) {
            c++;
        }
        return c;
    }

    private static String text(int[] chars, int from, int to) {
        int end = Math.min(to, chars.length);
        if (from >= end) {
            return "";
        }
        return new String(chars, from, end - from);
    }

    private static boolean isDigit(int ch) {
        return ch >= '0' && ch <= '9';
    }
}
