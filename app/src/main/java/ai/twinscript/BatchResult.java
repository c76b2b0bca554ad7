package ai.twinscript;

import ai.twinscript.frontend.SourceFile;
import java.util.List;

/** Outcome of one batch pass. A failed file never stops the others. */
public record BatchResult(List<SourceFile> translated, List<Failure> failures) {

    public enum Stage {
        /** the file could not be parsed cleanly */
        FRONT_END,
        /** reading the input or writing the output failed */
        IO,
        /** the translator itself failed on the file */
        INTERNAL
    }

    public record Failure(SourceFile file, Stage stage, String message) {
        @Override
        public String toString() {
            return "%s [%s] %s".formatted(file, stage, message);
        }
    }

    public BatchResult {
        translated = List.copyOf(translated);
        failures = List.copyOf(failures);
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    public boolean hasFrontEndFailures() {
        return failures.stream().anyMatch(f -> f.stage() == Stage.FRONT_END);
    }
}
