package work.pesc.kernel.api;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable REPL and output settings, usually read from {@code pesc.toml}.
 */
public record PescConfiguration(
    String prompt,
    EditMode editMode,
    Optional<Path> historyFile,
    OutputMode outputMode,
    boolean color
) {
    public PescConfiguration {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(editMode, "editMode");
        Objects.requireNonNull(historyFile, "historyFile");
        Objects.requireNonNull(outputMode, "outputMode");
    }

    public static PescConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .prompt(prompt)
            .editMode(editMode)
            .historyFile(historyFile.orElse(null))
            .outputMode(outputMode)
            .color(color);
    }

    public enum EditMode {
        VI,
        EMACS;

        public static EditMode from(String value) {
            if (value == null || value.isBlank()) {
                return VI;
            }
            try {
                return EditMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported edit mode: " + value);
            }
        }
    }

    public static final class Builder {
        private String prompt = "pesc> ";
        private EditMode editMode = EditMode.VI;
        private Path historyFile;
        private OutputMode outputMode = OutputMode.auto();
        private boolean color = true;

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder editMode(EditMode editMode) {
            this.editMode = editMode;
            return this;
        }

        public Builder historyFile(Path historyFile) {
            this.historyFile = historyFile;
            return this;
        }

        public Builder outputMode(OutputMode outputMode) {
            this.outputMode = outputMode;
            return this;
        }

        public Builder color(boolean color) {
            this.color = color;
            return this;
        }

        public PescConfiguration build() {
            return new PescConfiguration(prompt, editMode, Optional.ofNullable(historyFile), outputMode, color);
        }
    }
}
