package work.pesc.kernel.runtime;

/**
 * Represents an executable function registered in the engine registry.
 */
@FunctionalInterface
public interface PescFunction {
    void invoke(Engine engine) throws PescException;
}
