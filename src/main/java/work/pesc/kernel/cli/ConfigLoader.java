package work.pesc.kernel.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import work.pesc.kernel.api.OutputMode;
import work.pesc.kernel.api.PescConfiguration;

/**
 * Reads {@code pesc.toml}. Lookup order: explicit path, {@code $PESC_CONFIG}, {@code ~/.config/pesc/pesc.toml}.
 */
final class ConfigLoader {
    static final String ENV_VAR = "PESC_CONFIG";

    private ConfigLoader() {}

    static PescConfiguration load(Path explicit) {
        return locate(explicit)
            .map(ConfigLoader::loadFile)
            .orElseGet(PescConfiguration::defaults);
    }

    static Optional<Path> locate(Path explicit) {
        if (explicit != null) {
            return Optional.of(explicit);
        }
        String fromEnv = System.getenv(ENV_VAR);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Optional.of(Paths.get(fromEnv));
        }
        Path home = Paths.get(System.getProperty("user.home"));
        Path candidate = home.resolve(".config").resolve("pesc").resolve("pesc.toml");
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    static PescConfiguration loadFile(Path path) {
        String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read config " + path + ": " + ex.getMessage(), ex);
        }
        return parse(raw, path.toString());
    }

    static PescConfiguration parse(String raw, String source) {
        TomlParseResult toml = Toml.parse(raw);
        if (toml.hasErrors()) {
            String problems = toml.errors().stream()
                .map(Throwable::getMessage)
                .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid config " + source + ": " + problems);
        }
        try {
            var builder = PescConfiguration.builder();
            String prompt = toml.getString("repl.prompt");
            if (prompt != null) {
                builder.prompt(prompt);
            }
            String editMode = toml.getString("repl.edit-mode");
            if (editMode != null) {
                builder.editMode(PescConfiguration.EditMode.from(editMode));
            }
            String history = toml.getString("repl.history-file");
            if (history != null && !history.isBlank()) {
                builder.historyFile(expandHome(history));
            }
            String mode = toml.getString("output.mode");
            if (mode != null) {
                builder.outputMode(OutputMode.from(mode));
            }
            Boolean color = toml.getBoolean("output.color");
            if (color != null) {
                builder.color(color);
            }
            return builder.build();
        } catch (TomlInvalidTypeException | IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid config " + source + ": " + ex.getMessage(), ex);
        }
    }

    static Path expandHome(String raw) {
        String trimmed = raw.trim();
        if (trimmed.equals("~") || trimmed.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home") + trimmed.substring(1)).normalize();
        }
        return Paths.get(trimmed).toAbsolutePath().normalize();
    }
}
