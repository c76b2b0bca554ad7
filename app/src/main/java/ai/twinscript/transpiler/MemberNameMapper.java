package ai.twinscript.transpiler;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Identifier and member renaming between the C# runtime surface and its TypeScript counterpart. */
public final class MemberNameMapper {

    /** Renames for collection and container members, applied when the receiver's container family is unknown. */
    static final Map<String, String> COLLECTION_RENAMES = Map.ofEntries(
            Map.entry("Push", "push"),
            Map.entry("GetLast", "getLast"),
            Map.entry("GetAll", "getAll"),
            Map.entry("Clear", "clear"),
            Map.entry("Length", "length"),
            Map.entry("Count", "length"),
            Map.entry("Slice_Array", "slice"),
            Map.entry("ContainsKey", "has"),
            Map.entry("ContainsValue", "hasValue"),
            Map.entry("Add", "set"),
            Map.entry("Remove", "delete"),
            Map.entry("TryGetValue", "get"));

    private static final Map<String, String> MAP_RENAMES = Map.of(
            "Count", "size",
            "Add", "set",
            "Remove", "delete",
            "ContainsKey", "has",
            "TryGetValue", "get",
            "Keys", "keys()",
            "Values", "values()");

    private static final Map<String, String> SET_RENAMES = Map.of(
            "Count", "size",
            "Add", "add",
            "Remove", "delete",
            "Contains", "has");

    private static final Map<String, String> LIST_RENAMES = Map.of(
            "Count", "length",
            "Add", "push",
            "Contains", "includes",
            "IndexOf", "indexOf");

    /** {@code System.Math} members with a direct {@code Math} counterpart; anything else has none. */
    static final Map<String, String> MATH_MEMBERS = Map.ofEntries(
            Map.entry("Abs", "abs"),
            Map.entry("Acos", "acos"),
            Map.entry("Acosh", "acosh"),
            Map.entry("Asin", "asin"),
            Map.entry("Asinh", "asinh"),
            Map.entry("Atan", "atan"),
            Map.entry("Atan2", "atan2"),
            Map.entry("Atanh", "atanh"),
            Map.entry("Cbrt", "cbrt"),
            Map.entry("Ceiling", "ceil"),
            Map.entry("Cos", "cos"),
            Map.entry("Cosh", "cosh"),
            Map.entry("Exp", "exp"),
            Map.entry("Floor", "floor"),
            Map.entry("Log", "log"),
            Map.entry("Log10", "log10"),
            Map.entry("Log2", "log2"),
            Map.entry("Max", "max"),
            Map.entry("Min", "min"),
            Map.entry("Pow", "pow"),
            Map.entry("Round", "round"),
            Map.entry("Sign", "sign"),
            Map.entry("Sin", "sin"),
            Map.entry("Sinh", "sinh"),
            Map.entry("Sqrt", "sqrt"),
            Map.entry("Tan", "tan"),
            Map.entry("Tanh", "tanh"),
            Map.entry("Truncate", "trunc"),
            Map.entry("PI", "PI"),
            Map.entry("E", "E"));

    /** Constants on floating-point types. */
    static final Map<String, String> FLOATING_CONSTANTS = Map.of(
            "PositiveInfinity", "Number.POSITIVE_INFINITY",
            "NegativeInfinity", "Number.NEGATIVE_INFINITY",
            "NaN", "Number.NaN",
            "PI", "Math.PI",
            "MaxValue", "Number.MAX_VALUE",
            "MinValue", "-Number.MAX_VALUE",
            "Epsilon", "Number.MIN_VALUE");

    /** Single-precision limits that differ from the double ones. */
    static final Map<String, String> FLOAT_CONSTANTS = Map.of(
            "MaxValue", "3.4028234663852886e38",
            "MinValue", "-3.4028234663852886e38",
            "Epsilon", "1.401298464324817e-45");

    static final Map<String, String> INT_CONSTANTS = Map.of("MaxValue", "2147483647", "MinValue", "-2147483648");

    private static final Set<String> FLOATING_TYPES = Set.of("double", "Double", "float", "Single", "number");
    private static final Set<String> FLOAT_TYPES = Set.of("float", "Single");
    private static final Set<String> INT_TYPES = Set.of("int", "Int32");

    /** Names that stand for a runtime object of the same role. */
    private static final Map<String, String> SPECIAL_IDENTIFIERS =
            Map.of("Math", "Math", "Array", "Array", "String", "String", "Console", "console");

    /** Rewrites of whole callee paths after member renaming. */
    private static final Map<String, String> CALLEE_REWRITES = Map.of(
            "console.writeLine", "console.log",
            "console.write", "console.log",
            "global.performance.now", "performance.now");

    /** Receiver container family, when the receiver's declared type is known. */
    public enum ContainerFamily {
        UNKNOWN,
        LIST,
        MAP,
        SET
    }

    private MemberNameMapper() {}

    /** Lower-cases the first character; {@code @name} loses its verbatim marker. */
    public static String toCamelCase(String name) {
        var bare = name.startsWith("@") ? name.substring(1) : name;
        if (bare.isEmpty() || Character.isLowerCase(bare.charAt(0))) {
            return bare;
        }
        return Character.toLowerCase(bare.charAt(0)) + bare.substring(1);
    }

    /** Drops the {@code _const} / {@code _let} binding-keyword suffix, if present. */
    public static String stripBindingSuffix(String name) {
        if (name.endsWith("_const")) {
            return name.substring(0, name.length() - "_const".length());
        }
        if (name.endsWith("_let")) {
            return name.substring(0, name.length() - "_let".length());
        }
        return name;
    }

    /** Name of a local binding as it appears in the output. */
    public static String localName(String name) {
        return toCamelCase(stripBindingSuffix(name));
    }

    public static Optional<String> specialIdentifier(String name) {
        return Optional.ofNullable(SPECIAL_IDENTIFIERS.get(name));
    }

    public static String renameMember(String name) {
        return renameMember(name, ContainerFamily.UNKNOWN);
    }

    /** Renames a member accessed on a receiver of the given family; unknown names are camel-cased. */
    public static String renameMember(String name, ContainerFamily family) {
        var table = switch (family) {
            case LIST -> LIST_RENAMES;
            case MAP -> MAP_RENAMES;
            case SET -> SET_RENAMES;
            case UNKNOWN -> Map.<String, String>of();
        };
        var typed = table.get(name);
        if (typed != null) {
            return typed;
        }
        var renamed = COLLECTION_RENAMES.get(name);
        return renamed != null ? renamed : toCamelCase(name);
    }

    public static Optional<String> mathMember(String name) {
        return Optional.ofNullable(MATH_MEMBERS.get(name));
    }

    /** Runtime constant for {@code type.member} on a numeric type, e.g. {@code double.NaN}. */
    public static Optional<String> numericConstant(String typeName, String member) {
        if (FLOAT_TYPES.contains(typeName) && FLOAT_CONSTANTS.containsKey(member)) {
            return Optional.of(FLOAT_CONSTANTS.get(member));
        }
        if (FLOATING_TYPES.contains(typeName)) {
            return Optional.ofNullable(FLOATING_CONSTANTS.get(member));
        }
        if (INT_TYPES.contains(typeName)) {
            return Optional.ofNullable(INT_CONSTANTS.get(member));
        }
        return Optional.empty();
    }

    public static String rewriteCallee(String callee) {
        return CALLEE_REWRITES.getOrDefault(callee, callee);
    }

    /** Member-access rewrites that are not calls, e.g. {@code Global.Performance.Now} read as a value. */
    public static Optional<String> rewriteMemberPath(String path) {
        if ("global.performance.now".equals(path)) {
            return Optional.of("performance.now()");
        }
        return Optional.empty();
    }
}
