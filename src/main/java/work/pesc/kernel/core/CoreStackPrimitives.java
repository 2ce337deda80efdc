package work.pesc.kernel.core;

import work.pesc.kernel.runtime.Engine;
import work.pesc.kernel.runtime.Registry;
import work.pesc.kernel.runtime.Value;

/**
 * Stack shuffling primitives.
 */
public final class CoreStackPrimitives {
    private CoreStackPrimitives() {}

    public static Registry register(Registry registry) {
        registry.register('$', "dup", engine -> engine.push(engine.peekAt(0)));
        registry.register(',', "drop", Engine::pop);
        registry.register('~', "swap", engine -> {
            Value b = engine.pop();
            Value a = engine.pop();
            engine.push(b);
            engine.push(a);
        });
        registry.register("over", engine -> engine.push(engine.peekAt(1)));
        registry.register("rot", engine -> {
            Value c = engine.pop();
            Value b = engine.pop();
            Value a = engine.pop();
            engine.push(b);
            engine.push(c);
            engine.push(a);
        });
        registry.register('@', "pick", engine -> engine.push(engine.peekAt(engine.popIndex())));
        registry.register("put", engine -> {
            int index = engine.popIndex();
            Value value = engine.pop();
            engine.setAt(index, value);
        });
        registry.register('#', "depth", engine -> engine.push(Value.number(engine.depth())));
        registry.register("clear", Engine::clear);
        return registry;
    }
}
