package work.pesc.kernel.parse;

import java.util.OptionalInt;
import work.pesc.kernel.runtime.ErrorKind;
import work.pesc.kernel.runtime.PescException;

/**
 * Raised when source text cannot be read; the position is a character offset into the text.
 */
public final class ParseException extends PescException {
    private final Integer position;

    public ParseException(Integer position, ErrorKind kind) {
        super(kind, position == null ? kind.describe() : "at " + position + ": " + kind.describe(), null);
        this.position = position;
    }

    public OptionalInt position() {
        return position == null ? OptionalInt.empty() : OptionalInt.of(position);
    }
}
