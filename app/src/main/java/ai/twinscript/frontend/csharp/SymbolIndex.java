package ai.twinscript.frontend.csharp;

import static ai.twinscript.frontend.csharp.CSharpTreeSitterNodeTypes.*;

import ai.twinscript.frontend.ParsedSource;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Declarations of every type in a batch of parsed files, keyed by simple name. Partial declarations of the same type
 * are merged. Built once per batch and read-only afterwards.
 */
public final class SymbolIndex {
    private static final Logger logger = LogManager.getLogger(SymbolIndex.class);

    public enum TypeKind {
        CLASS,
        STRUCT,
        RECORD,
        INTERFACE,
        ENUM
    }

    public enum MemberKind {
        FIELD,
        CONSTANT,
        PROPERTY,
        METHOD,
        EVENT,
        ENUM_MEMBER,
        NESTED_TYPE
    }

    /**
     * @param declaredType field or property type, or a method's return type; null where none is written
     */
    public record MemberSymbol(String name, MemberKind kind, boolean isStatic, @Nullable String declaredType) {}

    /** A member together with the type that declares it, which may be a base of the type that was asked about. */
    public record MemberLookup(TypeSymbol owner, MemberSymbol member) {}

    public static final class TypeSymbol {
        private final String name;
        private final TypeKind kind;
        private final List<String> baseTypes = new ArrayList<>();
        private final Map<String, MemberSymbol> members = new LinkedHashMap<>();

        TypeSymbol(String name, TypeKind kind) {
            this.name = name;
            this.kind = kind;
        }

        public String name() {
            return name;
        }

        public TypeKind kind() {
            return kind;
        }

        /** Simple names of base classes and interfaces, in declaration order. */
        public List<String> baseTypes() {
            return List.copyOf(baseTypes);
        }

        public Optional<MemberSymbol> member(String memberName) {
            return Optional.ofNullable(members.get(memberName));
        }

        public Collection<MemberSymbol> members() {
            return List.copyOf(members.values());
        }

        void addMember(MemberSymbol member) {
            // overloads: a name counts as static only if every declaration of it is static
            members.merge(
                    member.name(),
                    member,
                    (existing, added) -> new MemberSymbol(
                            existing.name(),
                            existing.kind(),
                            existing.isStatic() && added.isStatic(),
                            existing.declaredType() != null ? existing.declaredType() : added.declaredType()));
        }

        void addBaseType(String baseType) {
            if (!baseTypes.contains(baseType)) {
                baseTypes.add(baseType);
            }
        }

        @Override
        public String toString() {
            return "TypeSymbol{" + kind + " " + name + ", " + members.size() + " members}";
        }
    }

    private final Map<String, TypeSymbol> typesByName;

    private SymbolIndex(Map<String, TypeSymbol> typesByName) {
        this.typesByName = typesByName;
    }

    public static SymbolIndex empty() {
        return new SymbolIndex(Map.of());
    }

    public static SymbolIndex build(Collection<ParsedSource> sources) {
        var types = new LinkedHashMap<String, TypeSymbol>();
        for (var source : sources) {
            for (var declaration : SyntaxTrees.findAllNodesRecursive(
                    source.root(), node -> TYPE_DECLARATIONS.contains(node.getType()))) {
                indexType(source, declaration, types);
            }
        }
        logger.debug("Indexed {} types from {} files", types.size(), sources.size());
        return new SymbolIndex(types);
    }

    private static void indexType(ParsedSource source, TSNode declaration, Map<String, TypeSymbol> types) {
        var nameNode = SyntaxTrees.field(declaration, "name");
        if (nameNode == null) {
            return;
        }
        var name = source.text(nameNode);
        var kind = typeKind(declaration.getType());
        var type = types.computeIfAbsent(name, n -> new TypeSymbol(n, kind));
        if (type.kind() != kind) {
            logger.warn("Type {} declared as both {} and {}; keeping {}", name, type.kind(), kind, type.kind());
        }

        var baseList = SyntaxTrees.firstChildOfType(declaration, BASE_LIST);
        if (baseList != null) {
            for (var base : SyntaxTrees.namedChildren(baseList)) {
                if (ARGUMENT_LIST.equals(base.getType())) {
                    continue;
                }
                type.addBaseType(SyntaxTrees.simpleTypeName(source.text(base)));
            }
        }

        var body = SyntaxTrees.field(declaration, "body");
        if (body == null) {
            body = SyntaxTrees.firstChildOfType(declaration, DECLARATION_LIST, ENUM_MEMBER_DECLARATION_LIST);
        }
        if (body != null) {
            for (var member : SyntaxTrees.namedChildren(body)) {
                indexMember(source, member, type);
            }
        }

        // record primary constructor parameters become properties
        var primary = SyntaxTrees.firstChildOfType(declaration, PARAMETER_LIST);
        if (primary != null) {
            for (var parameter : SyntaxTrees.childrenOfType(primary, PARAMETER)) {
                var parameterName = SyntaxTrees.nameNode(parameter);
                if (parameterName != null) {
                    var parameterType = SyntaxTrees.field(parameter, "type");
                    type.addMember(new MemberSymbol(
                            source.text(parameterName),
                            MemberKind.PROPERTY,
                            false,
                            parameterType == null ? null : source.text(parameterType)));
                }
            }
        }
    }

    private static void indexMember(ParsedSource source, TSNode member, TypeSymbol type) {
        var modifiers = SyntaxTrees.modifiers(member, source);
        boolean isStatic = modifiers.contains("static") || modifiers.contains("const");
        switch (member.getType()) {
            case FIELD_DECLARATION, EVENT_FIELD_DECLARATION -> {
                var declaration = SyntaxTrees.firstChildOfType(member, VARIABLE_DECLARATION);
                if (declaration == null) {
                    return;
                }
                var typeNode = SyntaxTrees.field(declaration, "type");
                var declaredType = typeNode == null ? null : source.text(typeNode);
                var memberKind = EVENT_FIELD_DECLARATION.equals(member.getType())
                        ? MemberKind.EVENT
                        : modifiers.contains("const") ? MemberKind.CONSTANT : MemberKind.FIELD;
                for (var declarator : SyntaxTrees.childrenOfType(declaration, VARIABLE_DECLARATOR)) {
                    var nameNode = SyntaxTrees.nameNode(declarator);
                    if (nameNode != null) {
                        type.addMember(new MemberSymbol(source.text(nameNode), memberKind, isStatic, declaredType));
                    }
                }
            }
            case PROPERTY_DECLARATION -> addNamed(source, member, type, MemberKind.PROPERTY, isStatic, "type");
            case METHOD_DECLARATION -> addNamed(source, member, type, MemberKind.METHOD, isStatic, "returns");
            case ENUM_MEMBER_DECLARATION -> addNamed(source, member, type, MemberKind.ENUM_MEMBER, true, "type");
            default -> {
                if (TYPE_DECLARATIONS.contains(member.getType()) || DELEGATE_DECLARATION.equals(member.getType())) {
                    addNamed(source, member, type, MemberKind.NESTED_TYPE, true, "type");
                }
            }
        }
    }

    private static void addNamed(
            ParsedSource source,
            TSNode member,
            TypeSymbol type,
            MemberKind kind,
            boolean isStatic,
            String typeField) {
        var nameNode = SyntaxTrees.field(member, "name");
        if (nameNode == null) {
            return;
        }
        var typeNode = SyntaxTrees.field(member, typeField, "type");
        var declaredType = kind == MemberKind.NESTED_TYPE || typeNode == null ? null : source.text(typeNode);
        type.addMember(new MemberSymbol(source.text(nameNode), kind, isStatic, declaredType));
    }

    private static TypeKind typeKind(String nodeType) {
        return switch (nodeType) {
            case STRUCT_DECLARATION -> TypeKind.STRUCT;
            case RECORD_DECLARATION, RECORD_STRUCT_DECLARATION -> TypeKind.RECORD;
            case INTERFACE_DECLARATION -> TypeKind.INTERFACE;
            case ENUM_DECLARATION -> TypeKind.ENUM;
            default -> TypeKind.CLASS;
        };
    }

    public Optional<TypeSymbol> type(String simpleName) {
        return Optional.ofNullable(typesByName.get(simpleName));
    }

    public boolean contains(String simpleName) {
        return typesByName.containsKey(simpleName);
    }

    public Set<String> typeNames() {
        return Set.copyOf(typesByName.keySet());
    }

    /** Looks a member up on a type and, failing that, on its bases (breadth-first, cycle-safe). */
    public Optional<MemberLookup> findMember(String typeName, String memberName) {
        var seen = new HashSet<String>();
        var queue = new ArrayList<String>();
        queue.add(typeName);
        for (int i = 0; i < queue.size(); i++) {
            var current = queue.get(i);
            if (!seen.add(current)) {
                continue;
            }
            var type = typesByName.get(current);
            if (type == null) {
                continue;
            }
            var member = type.member(memberName);
            if (member.isPresent()) {
                return Optional.of(new MemberLookup(type, member.get()));
            }
            queue.addAll(type.baseTypes);
        }
        return Optional.empty();
    }
}
