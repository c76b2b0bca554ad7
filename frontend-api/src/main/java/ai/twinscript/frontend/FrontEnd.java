package ai.twinscript.frontend;

/** Produces syntax trees for source files. */
public interface FrontEnd {

    /**
     * Parses one file.
     *
     * @throws FrontEndException if the file cannot be parsed cleanly; translation of that file must be skipped
     */
    ParsedSource parse(SourceFile file, String source) throws FrontEndException;
}
