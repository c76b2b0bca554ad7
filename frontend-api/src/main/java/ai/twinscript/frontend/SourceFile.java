package ai.twinscript.frontend;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A source filename relative to the input root. This exists so that different filename objects can be meaningfully
 * compared, unlike bare Paths which may or may not be absolute.
 */
public final class SourceFile implements Comparable<SourceFile> {
    private final Path root;
    private final Path relPath;

    /** root must be absolute and normalized; relPath is normalized if it is not already */
    public SourceFile(Path root, Path relPath) {
        if (!root.isAbsolute()) {
            throw new IllegalArgumentException("Root must be absolute, got " + root);
        }
        if (!root.equals(root.normalize())) {
            throw new IllegalArgumentException("Root must be normalized, got " + root);
        }
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("RelPath must be relative, got " + relPath);
        }
        this.root = root;
        this.relPath = relPath.normalize();
    }

    public SourceFile(Path root, String relName) {
        this(root, Path.of(relName));
    }

    public Path getRelPath() {
        return relPath;
    }

    public Path absPath() {
        return root.resolve(relPath);
    }

    public String read() throws IOException {
        return Files.readString(absPath(), StandardCharsets.UTF_8);
    }

    /** Just the filename, no path at all */
    public String getFileName() {
        return relPath.getFileName().toString();
    }

    /** Also relative (but unlike raw Path.getParent, ours returns empty path instead of null) */
    public Path getParent() {
        var p = relPath.getParent();
        return p == null ? Path.of("") : p;
    }

    @Override
    public int compareTo(SourceFile o) {
        return absPath().compareTo(o.absPath());
    }

    @Override
    public String toString() {
        return relPath.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceFile sourceFile)) return false;
        return Objects.equals(root, sourceFile.root) && Objects.equals(relPath, sourceFile.relPath);
    }

    @Override
    public int hashCode() {
        return relPath.hashCode();
    }
}
