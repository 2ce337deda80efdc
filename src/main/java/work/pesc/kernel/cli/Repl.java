package work.pesc.kernel.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import work.pesc.kernel.api.PescConfiguration;
import work.pesc.kernel.api.PescRunner;
import work.pesc.kernel.api.RunResult;

/**
 * Interactive loop: read a line, evaluate it, show the stack. The stack survives errors.
 */
final class Repl {
    static final String CONTINUATION_PROMPT = "... ";

    private final PescRunner runner;
    private final PescConfiguration config;
    private final PrintStream out;

    Repl(PescRunner runner, PescConfiguration config, PrintStream out) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.config = Objects.requireNonNull(config, "config");
        this.out = Objects.requireNonNull(out, "out");
    }

    void run() {
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            // quotes, backslashes and '!' are language syntax here
            var parser = new DefaultParser();
            parser.setQuoteChars(new char[0]);
            parser.setEscapeChars(new char[0]);
            var builder = LineReaderBuilder.builder()
                .terminal(terminal)
                .parser(parser)
                .completer(new FunctionNameCompleter(runner.engine().registry()))
                .option(LineReader.Option.HISTORY_IGNORE_SPACE, true)
                .option(LineReader.Option.DISABLE_EVENT_EXPANSION, true)
                .variable(LineReader.SECONDARY_PROMPT_PATTERN, CONTINUATION_PROMPT);
            config.historyFile().ifPresent(path -> builder.variable(LineReader.HISTORY_FILE, path));
            LineReader reader = builder.build();
            reader.setKeyMap(config.editMode() == PescConfiguration.EditMode.VI ? LineReader.VIINS : LineReader.EMACS);
            runLoop(reader, terminal);
        } catch (IOException ex) {
            System.err.println("terminal unavailable (" + ex.getMessage() + "), falling back to plain input");
            runFallbackLoop();
        }
    }

    private void runLoop(LineReader reader, Terminal terminal) {
        var pending = new StringBuilder();
        while (true) {
            try {
                String line = reader.readLine(pending.length() == 0 ? config.prompt() : CONTINUATION_PROMPT);
                if (line == null) {
                    break;
                }
                pending.append(line);
                if (openBlocks(pending) > 0) {
                    pending.append('\n');
                    continue;
                }
                String source = pending.toString();
                pending.setLength(0);
                evaluateAndPrint(source, terminal.getWidth());
            } catch (UserInterruptException ex) {
                pending.setLength(0);
                out.println("Use Ctrl-D to quit.");
            } catch (EndOfFileException ex) {
                break;
            }
        }
    }

    private void runFallbackLoop() {
        var reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        var pending = new StringBuilder();
        while (true) {
            out.print(pending.length() == 0 ? config.prompt() : CONTINUATION_PROMPT);
            out.flush();
            String line;
            try {
                line = reader.readLine();
            } catch (IOException ex) {
                System.err.println("error reading input: " + ex.getMessage());
                break;
            }
            if (line == null) {
                break;
            }
            pending.append(line);
            if (openBlocks(pending) > 0) {
                pending.append('\n');
                continue;
            }
            String source = pending.toString();
            pending.setLength(0);
            evaluateAndPrint(source, 80);
        }
    }

    /**
     * Runs one input; parse errors skip the stack display, evaluation errors show the rolled-back stack.
     */
    void evaluateAndPrint(String source, int width) {
        RunResult result = runner.run(source);
        if (result.status() == RunResult.Status.PARSE_ERROR) {
            out.println("error: " + result.error());
            return;
        }
        if (!result.succeeded()) {
            out.println("error: " + result.error());
        }
        new StackPrinter(config.outputMode(), config.color(), width, out)
            .print(runner.engine().stack(), runner.engine().registry());
    }

    /**
     * Number of blocks still open at the end of the text, ignoring strings, names and comments.
     */
    static int openBlocks(CharSequence text) {
        int depth = 0;
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '"' || ch == '[' || ch == '(') {
                char close = ch == '"' ? '"' : ch == '[' ? ']' : ')';
                int end = indexOf(text, i + 1, close);
                if (end < 0) {
                    return depth;
                }
                i = end + 1;
                continue;
            }
            if (ch == '\\') {
                int end = i + 1;
                while (end < text.length() && text.charAt(end) != '\\' && text.charAt(end) != '\n') {
                    end++;
                }
                i = end + 1;
                continue;
            }
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                if (depth == 0) {
                    return 0;
                }
                depth--;
            }
            i++;
        }
        return depth;
    }

    private static int indexOf(CharSequence text, int from, char target) {
        for (int i = from; i < text.length(); i++) {
            if (text.charAt(i) == target) {
                return i;
            }
        }
        return -1;
    }
}
