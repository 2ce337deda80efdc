package work.pesc.kernel.parse;

import java.util.List;
import work.pesc.kernel.runtime.Value;

/**
 * Tokens read from a source text and the character position where reading stopped.
 */
public record ParseResult(int cursor, List<Value> tokens) {
    public ParseResult {
        tokens = List.copyOf(tokens);
    }
}
