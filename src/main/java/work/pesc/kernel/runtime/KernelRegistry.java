package work.pesc.kernel.runtime;

import java.io.PrintStream;
import work.pesc.kernel.core.CoreIoPrimitives;
import work.pesc.kernel.core.CorePrimitives;
import work.pesc.kernel.core.CoreStackPrimitives;
import work.pesc.kernel.flow.DefinitionPrimitives;
import work.pesc.kernel.flow.FlowPrimitives;

/**
 * Shared registry bootstrap so the CLI, the REPL and tests use the same standard library.
 */
public final class KernelRegistry {
    private KernelRegistry() {}

    public static Registry create() {
        var registry = new Registry();
        CorePrimitives.register(registry);
        CoreStackPrimitives.register(registry);
        CoreIoPrimitives.register(registry);
        FlowPrimitives.register(registry);
        DefinitionPrimitives.register(registry);
        return registry;
    }

    public static Engine createEngine(PrintStream out) {
        return new Engine(create(), out);
    }
}
