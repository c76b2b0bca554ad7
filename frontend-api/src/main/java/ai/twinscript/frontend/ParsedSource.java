package ai.twinscript.frontend;

import java.nio.charset.StandardCharsets;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * One source file's immutable syntax tree together with the text it was parsed from.
 *
 * <p>Tree-sitter reports UTF-8 byte offsets, so text is always sliced from the encoded bytes rather than from the
 * Java string.
 */
public final class ParsedSource {
    private final SourceFile file;
    private final String source;
    private final byte[] bytes;
    private final TSTree tree;

    public ParsedSource(SourceFile file, String source, TSTree tree) {
        this.file = file;
        this.source = source;
        this.bytes = source.getBytes(StandardCharsets.UTF_8);
        this.tree = tree;
    }

    public SourceFile file() {
        return file;
    }

    public String source() {
        return source;
    }

    public TSTree tree() {
        return tree;
    }

    public TSNode root() {
        return tree.getRootNode();
    }

    /** Extracts the source text covered by a node. Null nodes yield the empty string. */
    public String text(TSNode node) {
        if (node.isNull()) return "";
        return text(node.getStartByte(), node.getEndByte());
    }

    /** Extracts the source text between two UTF-8 byte offsets, clamped to the file. */
    public String text(int startByte, int endByte) {
        int start = Math.max(0, Math.min(startByte, bytes.length));
        int end = Math.max(start, Math.min(endByte, bytes.length));
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    /** 1-based line of the node's first byte. */
    public int line(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    @Override
    public String toString() {
        return "ParsedSource{" + file + '}';
    }
}
