package work.pesc.kernel.flow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import work.pesc.kernel.runtime.Engine;
import work.pesc.kernel.runtime.ErrorKind;
import work.pesc.kernel.runtime.PescException;
import work.pesc.kernel.runtime.Registry;
import work.pesc.kernel.runtime.Value;

/**
 * Control-flow and higher-order primitives. Everything here runs code through {@link Engine#invoke(Value)}, so
 * blocks and function references are interchangeable wherever code is expected.
 */
public final class FlowPrimitives {
    private FlowPrimitives() {}

    public static Registry register(Registry registry) {
        registry.register('!', "exec", engine -> engine.invoke(engine.pop()));
        registry.register('?', "if", FlowPrimitives::ifElse);
        registry.register("when", FlowPrimitives::when);
        registry.register("while", FlowPrimitives::whileLoop);
        registry.register("times", FlowPrimitives::times);
        registry.register("map", FlowPrimitives::map);
        registry.register("try", FlowPrimitives::tryCatch);
        return registry;
    }

    private static void ifElse(Engine engine) throws PescException {
        Value otherwise = engine.pop();
        Value then = engine.pop();
        boolean condition = engine.popBoolean();
        engine.invoke(condition ? then : otherwise);
    }

    private static void when(Engine engine) throws PescException {
        Value then = engine.pop();
        if (engine.popBoolean()) {
            engine.invoke(then);
        }
    }

    private static void whileLoop(Engine engine) throws PescException {
        Value body = callable(engine.pop());
        Value condition = callable(engine.pop());
        while (true) {
            engine.invoke(condition);
            if (!engine.popBoolean()) {
                return;
            }
            engine.invoke(body);
        }
    }

    private static void times(Engine engine) throws PescException {
        Value body = callable(engine.pop());
        long count = (long) engine.popNumber();
        for (long i = 0; i < count; i++) {
            engine.invoke(body);
        }
    }

    /**
     * {@code {body} n map}: replaces each of the top n values with what the body leaves on top when run on it.
     */
    private static void map(Engine engine) throws PescException {
        int count = engine.popIndex();
        Value body = callable(engine.pop());
        if (count < 0) {
            throw new PescException(new ErrorKind.OutOfBounds(count, engine.depth()));
        }
        if (count > engine.depth()) {
            throw new PescException(new ErrorKind.NotEnoughArguments());
        }
        List<Value> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            items.add(engine.pop());
        }
        Collections.reverse(items);
        List<Value> results = new ArrayList<>(count);
        for (Value item : items) {
            engine.push(item);
            engine.invoke(body);
            results.add(engine.pop());
        }
        results.forEach(engine::push);
    }

    /**
     * {@code {body} {handler} try}: when the body fails, the stack is put back as it was before the body ran, the
     * error description is pushed and the handler runs.
     */
    private static void tryCatch(Engine engine) throws PescException {
        Value handler = callable(engine.pop());
        Value body = callable(engine.pop());
        List<Value> snapshot = new ArrayList<>(engine.stack());
        try {
            engine.invoke(body);
        } catch (PescException ex) {
            engine.clear();
            snapshot.forEach(engine::push);
            engine.push(Value.text(ex.kind().describe()));
            engine.invoke(handler);
        }
    }

    static Value callable(Value value) throws PescException {
        if (value instanceof Value.Block || value instanceof Value.FunctionRef) {
            return value;
        }
        throw new PescException(new ErrorKind.InvalidArgumentType("macro/function", value.toString()));
    }
}
