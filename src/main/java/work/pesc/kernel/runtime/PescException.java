package work.pesc.kernel.runtime;

import java.util.Objects;

/**
 * Checked failure raised by the reader, the engine and registered functions.
 */
public class PescException extends Exception {
    private final ErrorKind kind;

    public PescException(ErrorKind kind) {
        this(kind, kind.describe(), null);
    }

    protected PescException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
