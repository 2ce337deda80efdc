package work.pesc.kernel.runtime;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single token or stack value. Literals read from source and values produced by primitives share this type.
 */
public interface Value {
    String typeName();

    /**
     * Renders the value back into source text that reads as an equal value.
     */
    String toSource();

    static Value text(String text) {
        return new Text(text);
    }

    static Value number(double value) {
        return new Num(value);
    }

    static Value function(String name) {
        return new FunctionRef(name);
    }

    static Value block(List<Value> tokens) {
        return new Block(tokens);
    }

    static Value operator(char symbol) {
        return new Operator(symbol);
    }

    static Value bool(boolean value) {
        return new Bool(value);
    }

    record Text(String text) implements Value {
        public Text {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String typeName() {
            return "string";
        }

        @Override
        public String toSource() {
            return "\"" + text + "\"";
        }

        @Override
        public String toString() {
            return toSource();
        }
    }

    record Num(double value) implements Value {
        @Override
        public String typeName() {
            return "number";
        }

        @Override
        public String toSource() {
            // a leading '-' would read as an operator, and "inf"/"NaN" as letters
            if (Double.isNaN(value) || Double.isInfinite(value) || Double.doubleToRawLongBits(value) < 0) {
                return "(" + formatNumber(value) + ")";
            }
            return formatNumber(value);
        }

        @Override
        public String toString() {
            return formatNumber(value);
        }
    }

    record FunctionRef(String name) implements Value {
        public FunctionRef {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String typeName() {
            return "function";
        }

        @Override
        public String toSource() {
            return "[" + name + "]";
        }

        @Override
        public String toString() {
            return "<fn " + name + ">";
        }
    }

    record Block(List<Value> tokens) implements Value {
        public Block {
            tokens = List.copyOf(tokens);
        }

        @Override
        public String typeName() {
            return "macro";
        }

        @Override
        public String toSource() {
            return tokens.stream()
                .map(Value::toSource)
                .collect(Collectors.joining(" ", "{", "}"));
        }

        @Override
        public String toString() {
            return "<mac " + toSource() + ">";
        }
    }

    record Operator(char symbol) implements Value {
        @Override
        public String typeName() {
            return "symbol";
        }

        @Override
        public String toSource() {
            return String.valueOf(symbol);
        }

        @Override
        public String toString() {
            return "<sym '" + symbol + "'>";
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public String typeName() {
            return "boolean";
        }

        @Override
        public String toSource() {
            return value ? "T" : "F";
        }

        @Override
        public String toString() {
            return "(" + value + ")";
        }
    }

    /**
     * Shortest plain decimal spelling of a double: {@code 3}, {@code 1000.5}, {@code -0}, {@code inf}.
     */
    static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
        }
        return new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
    }
}
