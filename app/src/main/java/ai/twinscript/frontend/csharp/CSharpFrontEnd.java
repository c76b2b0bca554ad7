package ai.twinscript.frontend.csharp;

import ai.twinscript.frontend.FrontEnd;
import ai.twinscript.frontend.FrontEndException;
import ai.twinscript.frontend.ParsedSource;
import ai.twinscript.frontend.SourceFile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterCSharp;

/** Tree-sitter backed C# front end. Any syntax error makes the whole file fail. */
public final class CSharpFrontEnd implements FrontEnd {
    private static final Logger logger = LogManager.getLogger(CSharpFrontEnd.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    // TSParser is not thread-safe
    private final ThreadLocal<TSParser> threadLocalParser = ThreadLocal.withInitial(() -> {
        var parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterCSharp())) {
            logger.error("Failed to set C# language on TSParser");
        }
        return parser;
    });

    @Override
    public ParsedSource parse(SourceFile file, String source) throws FrontEndException {
        var text = !source.isEmpty() && source.charAt(0) == BYTE_ORDER_MARK ? source.substring(1) : source;

        var tree = threadLocalParser.get().parseString(null, text);
        if (tree == null) {
            throw new FrontEndException(file, 1, 1, "parser produced no tree");
        }
        var parsed = new ParsedSource(file, text, tree);
        var root = parsed.root();
        if (root.hasError()) {
            var bad = firstErrorNode(root);
            int line = bad == null ? 1 : bad.getStartPoint().getRow() + 1;
            int column = bad == null ? 1 : bad.getStartPoint().getColumn() + 1;
            var what = bad == null
                    ? "syntax error"
                    : bad.isMissing() ? "missing " + bad.getType() : "unexpected input '" + snippet(parsed, bad) + "'";
            throw new FrontEndException(file, line, column, what);
        }
        logger.debug("Parsed {} ({} bytes)", file, root.getEndByte());
        return parsed;
    }

    private static @Nullable TSNode firstErrorNode(TSNode root) {
        return SyntaxTrees.findNodeRecursive(
                root, node -> CSharpTreeSitterNodeTypes.ERROR.equals(node.getType()) || node.isMissing());
    }

    private static String snippet(ParsedSource parsed, TSNode node) {
        var text = parsed.text(node).strip();
        int newline = text.indexOf('\n');
        if (newline >= 0) {
            text = text.substring(0, newline).strip();
        }
        return text.length() > 40 ? text.substring(0, 40) + "..." : text;
    }
}
