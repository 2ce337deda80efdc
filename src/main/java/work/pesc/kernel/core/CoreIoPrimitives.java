package work.pesc.kernel.core;

import java.util.stream.Collectors;
import work.pesc.kernel.runtime.Engine;
import work.pesc.kernel.runtime.ErrorKind;
import work.pesc.kernel.runtime.PescException;
import work.pesc.kernel.runtime.Registry;
import work.pesc.kernel.runtime.Value;

/**
 * Output helpers writing to the engine's print stream.
 */
public final class CoreIoPrimitives {
    private CoreIoPrimitives() {}

    public static Registry register(Registry registry) {
        registry.register(';', "print", engine -> {
            engine.out().println(CorePrimitives.display(engine.pop()));
            engine.out().flush();
        });
        registry.register("write", engine -> {
            engine.out().print(CorePrimitives.display(engine.pop()));
            engine.out().flush();
        });
        registry.register("emit", CoreIoPrimitives::emit);
        registry.register("stack", engine -> {
            engine.out().println(engine.stack().stream()
                .map(Value::toString)
                .collect(Collectors.joining(" ")));
            engine.out().flush();
        });
        return registry;
    }

    private static void emit(Engine engine) throws PescException {
        double code = engine.popNumber();
        if (code < 0 || code > Character.MAX_CODE_POINT || code != Math.rint(code)) {
            throw new PescException(new ErrorKind.InvalidArgumentType("code point", Value.formatNumber(code)));
        }
        engine.out().print(Character.toString((int) code));
        engine.out().flush();
    }
}
