package work.pesc.kernel.runtime;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import work.pesc.kernel.parse.ParseException;
import work.pesc.kernel.parse.ParseResult;
import work.pesc.kernel.parse.Reader;

/**
 * Operand stack plus registry. Functions receive the engine itself and work the stack through the typed accessors.
 * The stack is kept bottom-first; index 0 of the relative accessors is the top.
 */
public final class Engine {
    private final Registry registry;
    private final PrintStream out;
    private final List<Value> stack = new ArrayList<>();

    public Engine() {
        this(new Registry());
    }

    public Engine(Registry registry) {
        this(registry, System.out);
    }

    public Engine(Registry registry, PrintStream out) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.out = Objects.requireNonNull(out, "out");
    }

    public Registry registry() {
        return registry;
    }

    public PrintStream out() {
        return out;
    }

    /**
     * Read-only view, bottom first.
     */
    public List<Value> stack() {
        return Collections.unmodifiableList(stack);
    }

    public Engine register(Character alias, String name, PescFunction fn) {
        registry.register(alias, name, fn);
        return this;
    }

    public ParseResult parse(String source) throws ParseException {
        return new Reader(registry).parse(source);
    }

    /**
     * Pushes literals and runs operators in order. Effects of tokens that completed before a failure are kept.
     */
    public void evaluate(List<Value> tokens) throws EvalException {
        for (Value token : tokens) {
            if (token instanceof Value.Operator op) {
                try {
                    execute(resolve(op));
                } catch (EvalException ex) {
                    throw ex.withToken(token);
                }
            } else {
                stack.add(token);
            }
        }
    }

    /**
     * Runs a function reference or a block; used by primitives that take code as an argument.
     */
    public void invoke(Value callable) throws PescException {
        try {
            execute(callable);
        } catch (EvalException ex) {
            throw new PescException(ex.kind());
        }
    }

    private Value resolve(Value.Operator op) throws EvalException {
        var name = registry.resolveOperator(op.symbol());
        if (name.isEmpty()) {
            throw new EvalException(stack, new ErrorKind.UnknownFunction("'" + op.symbol() + "'"));
        }
        return Value.function(name.get());
    }

    private void execute(Value callable) throws EvalException {
        if (callable instanceof Value.FunctionRef ref) {
            PescFunction fn = registry.get(ref.name());
            if (fn == null) {
                throw new EvalException(stack, new ErrorKind.UnknownFunction(ref.name()));
            }
            var backup = new ArrayList<>(stack);
            try {
                fn.invoke(this);
            } catch (PescException ex) {
                var broken = new ArrayList<>(stack);
                restore(backup);
                throw new EvalException(broken, ex.kind());
            } catch (RuntimeException | Error ex) {
                restore(backup);
                throw ex;
            }
            return;
        }
        if (callable instanceof Value.Block block) {
            try {
                evaluate(block.tokens());
            } catch (EvalException ex) {
                throw ex.withoutToken();
            }
            return;
        }
        throw new EvalException(stack, new ErrorKind.InvalidArgumentType("macro/function", String.valueOf(callable)));
    }

    private void restore(List<Value> backup) {
        stack.clear();
        stack.addAll(backup);
    }

    public void push(Value value) {
        stack.add(Objects.requireNonNull(value, "value"));
    }

    public Value pop() throws PescException {
        if (stack.isEmpty()) {
            throw new PescException(new ErrorKind.NotEnoughArguments());
        }
        return stack.remove(stack.size() - 1);
    }

    public double popNumber() throws PescException {
        Value value = pop();
        if (value instanceof Value.Num num) {
            return num.value();
        }
        throw new PescException(new ErrorKind.InvalidArgumentType("number", value.toString()));
    }

    /**
     * Pops a number that must be a whole value fitting an {@code int}; used for indices and counts.
     */
    public int popIndex() throws PescException {
        double value = popNumber();
        if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new PescException(new ErrorKind.InvalidArgumentType("index", Value.number(value).toString()));
        }
        return (int) value;
    }

    public String popString() throws PescException {
        Value value = pop();
        if (value instanceof Value.Text text) {
            return text.text();
        }
        throw new PescException(new ErrorKind.InvalidArgumentType("string", value.toString()));
    }

    public List<Value> popMacro() throws PescException {
        Value value = pop();
        if (value instanceof Value.Block block) {
            return block.tokens();
        }
        throw new PescException(new ErrorKind.InvalidArgumentType("macro", value.toString()));
    }

    /**
     * Pops and coerces: empty string and zero are false, other strings and numbers are true.
     */
    public boolean popBoolean() throws PescException {
        Value value = pop();
        if (value instanceof Value.Text text) {
            return !text.text().isEmpty();
        }
        if (value instanceof Value.Num num) {
            return num.value() != 0.0;
        }
        if (value instanceof Value.Bool bool) {
            return bool.value();
        }
        throw new PescException(new ErrorKind.InvalidBoolean(value));
    }

    public Value peekAt(int index) throws PescException {
        return stack.get(position(index));
    }

    public void setAt(int index, Value value) throws PescException {
        stack.set(position(index), Objects.requireNonNull(value, "value"));
    }

    public int depth() {
        return stack.size();
    }

    public void clear() {
        stack.clear();
    }

    private int position(int index) throws PescException {
        int length = stack.size();
        if (index < 0 || index >= length) {
            throw new PescException(new ErrorKind.OutOfBounds(index, length));
        }
        return length - 1 - index;
    }
}
