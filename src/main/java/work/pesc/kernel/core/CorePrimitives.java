package work.pesc.kernel.core;

import java.util.function.DoubleBinaryOperator;
import work.pesc.kernel.parse.Reader;
import work.pesc.kernel.runtime.Engine;
import work.pesc.kernel.runtime.ErrorKind;
import work.pesc.kernel.runtime.PescException;
import work.pesc.kernel.runtime.PescFunction;
import work.pesc.kernel.runtime.Registry;
import work.pesc.kernel.runtime.Value;

/**
 * Arithmetic, comparison, logic and string helpers. The deeper operand is always the left-hand side.
 */
public final class CorePrimitives {
    private CorePrimitives() {}

    public static Registry register(Registry registry) {
        registry.register('+', "add", arithmetic(Double::sum));
        registry.register('-', "sub", arithmetic((a, b) -> a - b));
        registry.register('*', "mul", arithmetic((a, b) -> a * b));
        registry.register('/', "div", arithmetic((a, b) -> a / b));
        registry.register('%', "mod", arithmetic((a, b) -> a % b));
        registry.register('^', "pow", arithmetic(Math::pow));

        registry.register('=', "eq", CorePrimitives::equal);
        registry.register('<', "lt", engine -> {
            double b = engine.popNumber();
            double a = engine.popNumber();
            engine.push(Value.bool(a < b));
        });
        registry.register('>', "gt", engine -> {
            double b = engine.popNumber();
            double a = engine.popNumber();
            engine.push(Value.bool(a > b));
        });

        registry.register('\'', "not", engine -> engine.push(Value.bool(!engine.popBoolean())));
        registry.register('&', "and", engine -> {
            boolean b = engine.popBoolean();
            boolean a = engine.popBoolean();
            engine.push(Value.bool(a && b));
        });
        registry.register('|', "or", engine -> {
            boolean b = engine.popBoolean();
            boolean a = engine.popBoolean();
            engine.push(Value.bool(a || b));
        });

        registry.register("concat", engine -> {
            String b = engine.popString();
            String a = engine.popString();
            engine.push(Value.text(a + b));
        });
        registry.register("len", CorePrimitives::length);
        registry.register("str", engine -> engine.push(Value.text(display(engine.pop()))));
        registry.register("num", CorePrimitives::toNumber);
        registry.register("type", engine -> engine.push(Value.text(engine.pop().typeName())));
        return registry;
    }

    /**
     * Display form used by {@code str} and the printing primitives: strings without quotes, everything else as shown
     * on the stack.
     */
    public static String display(Value value) {
        if (value instanceof Value.Text text) {
            return text.text();
        }
        return value.toString();
    }

    private static PescFunction arithmetic(DoubleBinaryOperator op) {
        return engine -> {
            double b = engine.popNumber();
            double a = engine.popNumber();
            engine.push(Value.number(op.applyAsDouble(a, b)));
        };
    }

    private static void equal(Engine engine) throws PescException {
        Value b = engine.pop();
        Value a = engine.pop();
        if (a instanceof Value.Num left && b instanceof Value.Num right) {
            engine.push(Value.bool(left.value() == right.value()));
            return;
        }
        engine.push(Value.bool(a.equals(b)));
    }

    private static void length(Engine engine) throws PescException {
        String text = engine.popString();
        engine.push(Value.number(text.codePointCount(0, text.length())));
    }

    private static void toNumber(Engine engine) throws PescException {
        String raw = engine.popString();
        var parsed = Reader.parseNumber(raw.trim());
        if (parsed.isEmpty()) {
            throw new PescException(new ErrorKind.InvalidNumberLit(raw));
        }
        engine.push(Value.number(parsed.getAsDouble()));
    }
}
