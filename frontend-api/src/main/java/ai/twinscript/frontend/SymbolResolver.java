package ai.twinscript.frontend;

import java.util.Optional;
import org.treesitter.TSNode;

/** Symbol-binding view over one translation unit, backed by declarations from every file in the batch. */
public interface SymbolResolver {

    /** Resolves an identifier node in expression position. Never throws; unknown names are {@code UNRESOLVED}. */
    SymbolBinding resolve(TSNode identifier);

    /** The declared type text of an expression when it can be read off a declaration (locals, members, chains). */
    Optional<String> declaredTypeOf(TSNode expression);

    /** True when a type with this simple name is declared in the translated sources. */
    boolean isKnownType(String simpleName);

    /** True when the known type with this simple name is an interface. */
    boolean isInterface(String simpleName);

    /** True when the known type with this simple name is an enum. */
    boolean isEnum(String simpleName);

    /** A resolver that knows nothing; every identifier is unresolved. */
    static SymbolResolver empty() {
        return new SymbolResolver() {
            @Override
            public SymbolBinding resolve(TSNode identifier) {
                return SymbolBinding.unresolved("");
            }

            @Override
            public Optional<String> declaredTypeOf(TSNode expression) {
                return Optional.empty();
            }

            @Override
            public boolean isKnownType(String simpleName) {
                return false;
            }

            @Override
            public boolean isInterface(String simpleName) {
                return false;
            }

            @Override
            public boolean isEnum(String simpleName) {
                return false;
            }
        };
    }
}
