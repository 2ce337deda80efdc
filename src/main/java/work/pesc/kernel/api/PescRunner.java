package work.pesc.kernel.api;

import java.time.Instant;
import java.util.Objects;
import work.pesc.kernel.parse.ParseException;
import work.pesc.kernel.parse.ParseResult;
import work.pesc.kernel.runtime.Engine;
import work.pesc.kernel.runtime.EvalException;
import work.pesc.kernel.runtime.KernelRegistry;

/**
 * Public entry point for embedding the interpreter: reads and evaluates source text against one long-lived engine.
 * Language errors are reported through {@link RunResult}, never thrown.
 */
public final class PescRunner {
    private final Engine engine;

    public PescRunner() {
        this(KernelRegistry.createEngine(System.out));
    }

    public PescRunner(Engine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public Engine engine() {
        return engine;
    }

    public RunResult run(String source) {
        var started = Instant.now();
        ParseResult parsed;
        try {
            parsed = engine.parse(source);
        } catch (ParseException ex) {
            Integer position = ex.position().isPresent() ? ex.position().getAsInt() : null;
            return RunResult.parseFailure(ex.getMessage(), position, engine.stack(), started);
        }
        try {
            engine.evaluate(parsed.tokens());
            return RunResult.success(engine.stack(), started);
        } catch (EvalException ex) {
            if (Boolean.getBoolean("pesc.debug")) {
                ex.printStackTrace();
            }
            return RunResult.evalFailure(ex.getMessage(), engine.stack(), ex.stackSnapshot(), started);
        } catch (RuntimeException ex) {
            // a misbehaving host function; the engine has already restored the stack
            if (Boolean.getBoolean("pesc.debug")) {
                ex.printStackTrace();
            }
            return RunResult.evalFailure(describe(ex), engine.stack(), engine.stack(), started);
        }
    }

    private static String describe(RuntimeException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return ex.getClass().getSimpleName() + ": " + message;
    }
}
