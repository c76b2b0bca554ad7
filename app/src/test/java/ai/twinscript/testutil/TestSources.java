package ai.twinscript.testutil;

import ai.twinscript.TranspilerConfig;
import ai.twinscript.frontend.FrontEndException;
import ai.twinscript.frontend.ParsedSource;
import ai.twinscript.frontend.SourceFile;
import ai.twinscript.frontend.TranslationUnit;
import ai.twinscript.frontend.csharp.CSharpFrontEnd;
import ai.twinscript.frontend.csharp.CSharpSymbolResolver;
import ai.twinscript.frontend.csharp.SymbolIndex;
import ai.twinscript.frontend.csharp.SyntaxTrees;
import ai.twinscript.transpiler.TypeScriptGenerator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.treesitter.TSNode;

/** Parses inline C# snippets into translation units for tests. */
public final class TestSources {

    public static final Path ROOT = Path.of("").toAbsolutePath().normalize();

    /** Fixture tree under src/test/resources, the way the module's tests are run from its directory. */
    public static final Path FIXTURES = ROOT.resolve("src/test/resources/testcode-cs");

    private static final CSharpFrontEnd FRONT_END = new CSharpFrontEnd();

    private TestSources() {}

    public static ParsedSource parse(String fileName, String source) {
        try {
            return FRONT_END.parse(new SourceFile(ROOT, fileName), source);
        } catch (FrontEndException e) {
            throw new AssertionError("Test source does not parse: " + e.getMessage(), e);
        }
    }

    public static ParsedSource parse(String source) {
        return parse("Test.cs", source);
    }

    /** The first source is the unit under test; the others only contribute declarations to the symbol index. */
    public static TranslationUnit unit(String source, String... otherSources) {
        var parsed = parse(source);
        var all = new ArrayList<ParsedSource>(List.of(parsed));
        for (int i = 0; i < otherSources.length; i++) {
            all.add(parse("Other" + i + ".cs", otherSources[i]));
        }
        var index = SymbolIndex.build(all);
        return new TranslationUnit(parsed, new CSharpSymbolResolver(index, parsed));
    }

    public static String translate(String source, String... otherSources) {
        return new TypeScriptGenerator(unit(source, otherSources), TranspilerConfig.defaults()).generate();
    }

    /** Wraps statements in a method body, so expression and statement tests stay short. */
    public static String inMethod(String members, String statements) {
        return """
                public class Harness
                {
                %s
                    public void Run()
                    {
                %s
                    }
                }
                """
                .formatted(members, statements);
    }

    /** First node of the given type whose text is exactly {@code text}. */
    public static TSNode find(ParsedSource parsed, String type, String text) {
        var node = SyntaxTrees.findNodeRecursive(
                parsed.root(), n -> type.equals(n.getType()) && text.equals(parsed.text(n)));
        if (node == null) {
            throw new AssertionError("No " + type + " node with text '" + text + "'");
        }
        return node;
    }

    /** First node of the given type. */
    public static TSNode first(ParsedSource parsed, String type) {
        var node = SyntaxTrees.findNodeRecursive(parsed.root(), n -> type.equals(n.getType()));
        if (node == null) {
            throw new AssertionError("No " + type + " node");
        }
        return node;
    }

    /** Copies the fixture tree into {@code target}, so tests can add, break or delete files freely. */
    public static Path copyFixtures(Path target) throws IOException {
        try (Stream<Path> walk = Files.walk(FIXTURES)) {
            for (var path : walk.toList()) {
                var destination = target.resolve(FIXTURES.relativize(path).toString());
                if (Files.isDirectory(path)) {
                    Files.createDirectories(destination);
                } else {
                    Files.copy(path, destination);
                }
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return target;
    }
}
