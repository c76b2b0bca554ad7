package ai.twinscript.frontend;

import org.treesitter.TSNode;

/**
 * A parsed source file plus the symbol-binding view used to tell implicit-receiver member references apart from
 * free-standing names. Read-only for the duration of one translation pass.
 */
public record TranslationUnit(ParsedSource parsed, SymbolResolver symbols) {

    public SourceFile file() {
        return parsed.file();
    }

    public TSNode root() {
        return parsed.root();
    }

    public String text(TSNode node) {
        return parsed.text(node);
    }
}
