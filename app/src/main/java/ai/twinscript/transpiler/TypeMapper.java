package ai.twinscript.transpiler;

import static ai.twinscript.frontend.csharp.CSharpTreeSitterNodeTypes.*;

import ai.twinscript.frontend.ParsedSource;
import ai.twinscript.frontend.csharp.SyntaxTrees;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Maps C# type syntax to TypeScript type expressions. Stateless apart from the source text it reads names from.
 *
 * <p>Host container types and their standard-library equivalents map to the same target type, so code written against
 * either translates identically.
 */
public final class TypeMapper {

    public static final String ANY = "any";

    private static final Map<String, String> PREDEFINED = Map.ofEntries(
            Map.entry("double", "number"),
            Map.entry("float", "number"),
            Map.entry("decimal", "number"),
            Map.entry("int", "number"),
            Map.entry("uint", "number"),
            Map.entry("long", "number"),
            Map.entry("ulong", "number"),
            Map.entry("short", "number"),
            Map.entry("ushort", "number"),
            Map.entry("byte", "number"),
            Map.entry("sbyte", "number"),
            Map.entry("bool", "boolean"),
            Map.entry("string", "string"),
            Map.entry("char", "string"),
            Map.entry("object", ANY),
            Map.entry("dynamic", ANY),
            Map.entry("void", "void"));

    /** Framework type names that have a direct target equivalent. */
    private static final Map<String, String> NAMED = Map.ofEntries(
            Map.entry("Double", "number"),
            Map.entry("Single", "number"),
            Map.entry("Int32", "number"),
            Map.entry("Int64", "number"),
            Map.entry("Boolean", "boolean"),
            Map.entry("String", "string"),
            Map.entry("Object", ANY));

    static final Set<String> MAP_FAMILY = Set.of("JsMap", "Dictionary", "IDictionary", "IReadOnlyDictionary");
    static final Set<String> LIST_FAMILY =
            Set.of("JsArray", "List", "IList", "IEnumerable", "IReadOnlyList", "ICollection", "Array");
    static final Set<String> SET_FAMILY = Set.of("JsSet", "HashSet", "ISet");

    private final ParsedSource source;

    public TypeMapper(ParsedSource source) {
        this.source = source;
    }

    /** Maps a type node; an absent node maps to {@code any}. */
    public String map(@Nullable TSNode type) {
        if (!SyntaxTrees.isPresent(type)) {
            return ANY;
        }
        return switch (type.getType()) {
            case PREDEFINED_TYPE -> mapPredefined(source.text(type));
            case IDENTIFIER -> mapName(source.text(type));
            case GENERIC_NAME -> mapGeneric(type);
            case QUALIFIED_NAME -> {
                var name = SyntaxTrees.field(type, "name");
                yield name != null ? map(name) : mapName(SyntaxTrees.simpleTypeName(source.text(type)));
            }
            case ARRAY_TYPE -> mapArray(type);
            case NULLABLE_TYPE -> {
                var inner = SyntaxTrees.field(type, "type");
                yield map(inner != null ? inner : SyntaxTrees.firstNamedChild(type)) + " | null";
            }
            default -> ANY;
        };
    }

    public static String mapPredefined(String keyword) {
        return PREDEFINED.getOrDefault(keyword.strip(), ANY);
    }

    private static String mapName(String name) {
        var bare = name.startsWith("@") ? name.substring(1) : name;
        if ("var".equals(bare)) {
            return ANY;
        }
        return NAMED.getOrDefault(bare, bare);
    }

    private String mapGeneric(TSNode generic) {
        var nameNode = SyntaxTrees.field(generic, "name");
        if (nameNode == null) {
            nameNode = SyntaxTrees.firstChildOfType(generic, IDENTIFIER);
        }
        var name = nameNode == null ? SyntaxTrees.simpleTypeName(source.text(generic)) : source.text(nameNode);
        var argumentList = SyntaxTrees.firstChildOfType(generic, TYPE_ARGUMENT_LIST);
        var arguments = argumentList == null
                ? ""
                : SyntaxTrees.namedChildren(argumentList).stream()
                        .map(this::map)
                        .collect(Collectors.joining(", "));

        if ("Nullable".equals(name)) {
            return arguments + " | null";
        }
        return container(name) + "<" + arguments + ">";
    }

    private String mapArray(TSNode arrayType) {
        var element = SyntaxTrees.field(arrayType, "type");
        var mapped = map(element != null ? element : SyntaxTrees.firstNamedChild(arrayType));
        if (mapped.contains(" | ")) {
            mapped = "(" + mapped + ")";
        }
        var rank = SyntaxTrees.field(arrayType, "rank");
        if (rank == null) {
            rank = SyntaxTrees.firstChildOfType(arrayType, ARRAY_RANK_SPECIFIER);
        }
        int dimensions = 1;
        if (rank != null) {
            dimensions += (int) source.text(rank).chars().filter(c -> c == ',').count();
        }
        return mapped + "[]".repeat(dimensions);
    }

    /** Target container name for a generic type name, or the name itself when it is not a known container. */
    public static String container(String genericName) {
        if (MAP_FAMILY.contains(genericName)) {
            return "Map";
        }
        if (LIST_FAMILY.contains(genericName)) {
            return "Array";
        }
        if (SET_FAMILY.contains(genericName)) {
            return "Set";
        }
        return genericName;
    }

    /** Container family of a declared type's source text. */
    public static MemberNameMapper.ContainerFamily family(@Nullable String declaredType) {
        if (declaredType == null) {
            return MemberNameMapper.ContainerFamily.UNKNOWN;
        }
        var text = declaredType.strip();
        if (text.endsWith("[]") || text.endsWith("[]?")) {
            return MemberNameMapper.ContainerFamily.LIST;
        }
        var simple = SyntaxTrees.simpleTypeName(text);
        if (MAP_FAMILY.contains(simple)) {
            return MemberNameMapper.ContainerFamily.MAP;
        }
        if (LIST_FAMILY.contains(simple) && text.contains("<")) {
            return MemberNameMapper.ContainerFamily.LIST;
        }
        if (SET_FAMILY.contains(simple)) {
            return MemberNameMapper.ContainerFamily.SET;
        }
        return MemberNameMapper.ContainerFamily.UNKNOWN;
    }
}
