package work.pesc.kernel.cli;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;
import work.pesc.kernel.runtime.Registry;

/**
 * Completes {@code [name} against the functions registered at the time TAB is pressed.
 */
final class FunctionNameCompleter implements Completer {
    private final Registry registry;

    FunctionNameCompleter(Registry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
        candidates.addAll(candidatesFor(line.word().substring(0, line.wordCursor())));
    }

    List<Candidate> candidatesFor(String word) {
        int open = word.lastIndexOf('[');
        if (open < 0 || word.indexOf(']', open) >= 0) {
            return List.of();
        }
        String head = word.substring(0, open + 1);
        String prefix = word.substring(open + 1);
        return new TreeSet<>(registry.functions().keySet()).stream()
            .filter(name -> name.startsWith(prefix))
            .map(name -> new Candidate(head + name + "]", name, null, null, null, null, true))
            .toList();
    }
}
