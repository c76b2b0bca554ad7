package ai.twinscript.frontend;

import org.jetbrains.annotations.Nullable;

/**
 * What an identifier resolves to.
 *
 * @param kind the category of the declaration the identifier binds to
 * @param name the identifier as written
 * @param declaringType simple name of the type declaring the member, for member bindings
 * @param declaredType the declared type text of the local, parameter, field or property, when one was written
 */
public record SymbolBinding(Kind kind, String name, @Nullable String declaringType, @Nullable String declaredType) {

    public enum Kind {
        /** a local variable, parameter, loop variable or local function */
        LOCAL,
        /** a non-static field, property, event or method of the enclosing type or one of its bases */
        INSTANCE_MEMBER,
        /** a static (or const) member of the enclosing type or one of its bases */
        STATIC_MEMBER,
        /** a type declared somewhere in the translated sources */
        TYPE,
        UNRESOLVED
    }

    public static SymbolBinding unresolved(String name) {
        return new SymbolBinding(Kind.UNRESOLVED, name, null, null);
    }

    public static SymbolBinding local(String name, @Nullable String declaredType) {
        return new SymbolBinding(Kind.LOCAL, name, null, declaredType);
    }

    public boolean isInstanceMember() {
        return kind == Kind.INSTANCE_MEMBER;
    }

    public boolean isStaticMember() {
        return kind == Kind.STATIC_MEMBER;
    }
}
