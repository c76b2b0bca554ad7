package ai.twinscript.frontend;

/** Malformed input reported by the front end. Fatal for the file it names, never for the batch. */
public class FrontEndException extends Exception {
    private final SourceFile file;
    private final int line;
    private final int column;

    public FrontEndException(SourceFile file, int line, int column, String message) {
        super("%s:%d:%d: %s".formatted(file, line, column, message));
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public SourceFile file() {
        return file;
    }

    /** 1-based */
    public int line() {
        return line;
    }

    /** 1-based */
    public int column() {
        return column;
    }
}
