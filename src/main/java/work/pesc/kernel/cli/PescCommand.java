package work.pesc.kernel.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.pesc.kernel.api.OutputMode;
import work.pesc.kernel.api.PescConfiguration;
import work.pesc.kernel.api.PescRunner;
import work.pesc.kernel.api.RunResult;
import work.pesc.kernel.runtime.KernelRegistry;

@CommandLine.Command(
    name = "pesc",
    description = "Evaluate pesc code, or start an interactive session when no code is given.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class PescCommand implements Callable<Integer> {
    private static final int DEFAULT_WIDTH = 80;

    @CommandLine.Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "CODE",
        description = "Code to evaluate; the final stack is printed."
    )
    private String code;

    @CommandLine.Option(
        names = {"-f", "--file"},
        paramLabel = "PATH",
        description = "Evaluate a script file."
    )
    private Path file;

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "MODE",
        description = "Stack display (auto|human|simple|machine|quiet); overrides the config file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String output;

    @CommandLine.Option(
        names = {"-c", "--config"},
        paramLabel = "PATH",
        description = "Config file (default: $PESC_CONFIG or ~/.config/pesc/pesc.toml)."
    )
    private Path configPath;

    @CommandLine.Option(
        names = "--no-color",
        description = "Disable ANSI colors in human output."
    )
    private boolean noColor;

    private final PrintStream out;

    PescCommand() {
        this(System.out);
    }

    PescCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() throws Exception {
        if (code != null && file != null) {
            throw new CommandLine.ParameterException(new CommandLine(this), "CODE and --file cannot be combined.");
        }
        PescConfiguration config = resolveConfiguration();
        var runner = new PescRunner(KernelRegistry.createEngine(out));

        if (code == null && file == null) {
            new Repl(runner, config, out).run();
            return 0;
        }

        RunResult result = runner.run(code != null ? code : readScript(file));
        if (!result.succeeded()) {
            System.err.println("error: " + result.error());
            return result.status().exitCode();
        }
        new StackPrinter(config.outputMode(), config.color(), terminalWidth(), out)
            .print(runner.engine().stack(), runner.engine().registry());
        return result.status().exitCode();
    }

    PescConfiguration resolveConfiguration() {
        PescConfiguration config = ConfigLoader.load(configPath);
        var builder = config.toBuilder();
        if (output != null && !output.isBlank()) {
            builder.outputMode(OutputMode.from(output));
        }
        if (noColor) {
            builder.color(false);
        }
        return builder.build();
    }

    private static String readScript(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read script " + path + ": " + ex.getMessage(), ex);
        }
    }

    private static int terminalWidth() {
        String columns = System.getenv("COLUMNS");
        if (columns != null && !columns.isBlank()) {
            try {
                return Integer.parseInt(columns.trim());
            } catch (NumberFormatException ignored) {
                return DEFAULT_WIDTH;
            }
        }
        return DEFAULT_WIDTH;
    }
}
