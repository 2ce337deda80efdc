package work.pesc.kernel.runtime;

import java.util.List;
import java.util.Optional;

/**
 * Evaluation failure carrying the stack as it looked when the call broke and, once known, the token that triggered it.
 * The live stack has already been restored when this is thrown.
 */
public final class EvalException extends PescException {
    private final List<Value> stackSnapshot;
    private final Value token;

    public EvalException(List<Value> stackSnapshot, ErrorKind kind) {
        this(stackSnapshot, kind, null);
    }

    public EvalException(List<Value> stackSnapshot, ErrorKind kind, Value token) {
        super(kind, render(kind, token), null);
        this.stackSnapshot = List.copyOf(stackSnapshot);
        this.token = token;
    }

    public List<Value> stackSnapshot() {
        return stackSnapshot;
    }

    public Optional<Value> token() {
        return Optional.ofNullable(token);
    }

    EvalException withToken(Value offending) {
        return new EvalException(stackSnapshot, kind(), offending);
    }

    EvalException withoutToken() {
        return token == null ? this : new EvalException(stackSnapshot, kind(), null);
    }

    private static String render(ErrorKind kind, Value token) {
        if (token == null) {
            return kind.describe();
        }
        return token + ": " + kind.describe();
    }
}
