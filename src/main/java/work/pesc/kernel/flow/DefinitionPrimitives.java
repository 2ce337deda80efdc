package work.pesc.kernel.flow;

import work.pesc.kernel.runtime.Engine;
import work.pesc.kernel.runtime.ErrorKind;
import work.pesc.kernel.runtime.PescException;
import work.pesc.kernel.runtime.Registry;
import work.pesc.kernel.runtime.Value;

/**
 * Lets scripts extend the registry they run against: define functions, bind operator characters, drop definitions.
 */
public final class DefinitionPrimitives {
    private DefinitionPrimitives() {}

    public static Registry register(Registry registry) {
        registry.register("def", DefinitionPrimitives::define);
        registry.register("alias", DefinitionPrimitives::alias);
        registry.register("forget", engine -> engine.registry().unregister(functionName(engine)));
        registry.register("defined", engine -> engine.push(Value.bool(engine.registry().contains(functionName(engine)))));
        return registry;
    }

    private static void define(Engine engine) throws PescException {
        String name = functionName(engine);
        Value body = FlowPrimitives.callable(engine.pop());
        engine.registry().register(name, target -> target.invoke(body));
    }

    private static void alias(Engine engine) throws PescException {
        String name = functionName(engine);
        String symbol = engine.popString();
        if (symbol.isEmpty()) {
            throw new PescException(new ErrorKind.InvalidArgumentType("character", Value.text(symbol).toString()));
        }
        engine.registry().alias(symbol.charAt(0), name);
    }

    private static String functionName(Engine engine) throws PescException {
        Value value = engine.pop();
        if (value instanceof Value.FunctionRef ref) {
            return ref.name();
        }
        throw new PescException(new ErrorKind.InvalidArgumentType("function", value.toString()));
    }
}
