package work.pesc.kernel.runtime;

/**
 * Closed set of failures the reader, the engine and the primitives report.
 */
public interface ErrorKind {
    String describe();

    record UnknownFunction(String name) implements ErrorKind {
        @Override
        public String describe() {
            return "unknown function: " + name;
        }
    }

    record InvalidArgumentType(String expected, String actual) implements ErrorKind {
        @Override
        public String describe() {
            return "expected " + expected + ", got " + actual;
        }
    }

    record InvalidNumberLit(String raw) implements ErrorKind {
        @Override
        public String describe() {
            return "invalid number literal: '" + raw + "'";
        }
    }

    record OutOfBounds(int index, int length) implements ErrorKind {
        @Override
        public String describe() {
            return "index " + index + " is out of bounds (stack length " + length + ")";
        }
    }

    record NotEnoughArguments() implements ErrorKind {
        @Override
        public String describe() {
            return "not enough arguments on the stack";
        }
    }

    record InvalidBoolean(Value value) implements ErrorKind {
        @Override
        public String describe() {
            return value + " cannot be used as a boolean";
        }
    }
}
