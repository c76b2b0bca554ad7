package ai.twinscript.transpiler;

import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

/**
 * Mutable state of one file's translation: the indentation level and the active key/value aliases of enclosing
 * dictionary loops. Alias scopes are persistent maps, so leaving a loop restores the outer scope exactly, including
 * the absence of any scope.
 */
public final class GeneratorContext {

    /** Destructured names that stand in for {@code variable.Key} and {@code variable.Value}. */
    public record PairAlias(String keyName, String valueName) {}

    private final int indentWidth;
    private int indentLevel;
    private @Nullable PMap<String, PairAlias> pairAliases;

    public GeneratorContext(int indentWidth) {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indentWidth must be non-negative, got " + indentWidth);
        }
        this.indentWidth = indentWidth;
    }

    public int indentLevel() {
        return indentLevel;
    }

    public void indent() {
        indentLevel++;
    }

    public void outdent() {
        if (indentLevel == 0) {
            throw new IllegalStateException("outdent below level 0");
        }
        indentLevel--;
    }

    public String indentation() {
        return " ".repeat(indentLevel * indentWidth);
    }

    public @Nullable PMap<String, PairAlias> pairAliases() {
        return pairAliases;
    }

    public @Nullable PairAlias pairAlias(String variable) {
        return pairAliases == null ? null : pairAliases.get(variable);
    }

    /**
     * Layers an alias over the current scope.
     *
     * @return the scope to hand back to {@link #exitPairScope} when the loop ends
     */
    public @Nullable PMap<String, PairAlias> enterPairScope(String variable, PairAlias alias) {
        var previous = pairAliases;
        var base = previous == null ? HashTreePMap.<String, PairAlias>empty() : previous;
        pairAliases = base.plus(variable, alias);
        return previous;
    }

    public void exitPairScope(@Nullable PMap<String, PairAlias> previous) {
        pairAliases = previous;
    }
}
