package ai.twinscript.transpiler;

import static ai.twinscript.testutil.AssertionHelperUtil.assertCodeContains;
import static ai.twinscript.testutil.AssertionHelperUtil.assertCodeDoesNotContain;
import static ai.twinscript.testutil.TestSources.inMethod;
import static ai.twinscript.testutil.TestSources.translate;
import static org.junit.jupiter.api.Assertions.*;

import ai.twinscript.TranspilerConfig;
import ai.twinscript.frontend.csharp.SyntaxTrees;
import ai.twinscript.testutil.TestSources;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ExpressionGeneratorTest {

    private static String run(String members, String statements) {
        return translate(inMethod(members, statements));
    }

    @Test
    void equalityBecomesStrictEquality() {
        var output = run("", "var a = 1; var b = 2; var same = a == b; var different = a != b;");
        assertCodeContains(output, "const same = a === b;");
        assertCodeContains(output, "const different = a !== b;");
    }

    @Test
    void blockCopyExpandsToSliceAndAssign() {
        var output = run("", "var src = new double[4]; var dst = new double[8]; Array.Copy(src, 0, dst, 2, 3);");
        assertCodeContains(output, "src.slice(0, 0 + 3).forEach((__v, __i) => dst[2 + __i] = __v);");
    }

    @Test
    void fixedFormatInterpolationRoundsToTwoDecimals() {
        var output = run("", "double x = 1.0 / 3; var label = $\"{x:F2}\";");
        assertCodeContains(output, "const label = `${x.toFixed(2)}`;");
    }

    @Test
    void interpolationFormatsAndEscapes() {
        var output = run("", "double x = 2; int n = 3; var a = $\"{x + 1:F1} {n:0} {{n}} `tick`\";");
        assertCodeContains(output, "const a = `${(x + 1).toFixed(1)} ${n.toFixed(0)} {n} \\`tick\\``;");
    }

    @Test
    void unsupportedExpressionBecomesPlaceholderAndTranslationContinues() {
        var output = run("", "int kind = 1; var r = kind switch { 0 => 1, _ => 2 }; var after = kind + 1;");
        assertCodeContains(output, "const r = /* UNSUPPORTED: switch_expression */;");
        assertCodeContains(output, "const after = kind + 1;");
    }

    @Test
    void implicitReceiversForInstanceAndStaticMembers() {
        var members = """
                private int count;
                private static int created;
                private void Touch() { }
                """;
        var output = run(members, "count = count + 1; created++; Touch();");
        assertCodeContains(output, "this.count = this.count + 1;");
        assertCodeContains(output, "Harness.created++;");
        assertCodeContains(output, "this.touch();");
    }

    @Test
    void localsShadowMembers() {
        var output = run("private int count;", "var count = 3; var twice = count * 2;");
        assertCodeContains(output, "const twice = count * 2;");
        assertCodeDoesNotContain(output, "this.count * 2");
    }

    @Test
    void crossFileMembersResolveThroughTheSharedIndex() {
        var other = """
                public class Base
                {
                    protected double weight;
                    public static double Scale(double v) { return v * 2; }
                }
                """;
        var source = """
                public class Derived : Base
                {
                    public double Weighted() { return Base.Scale(weight); }
                }
                """;
        var output = translate(source, other);
        assertCodeContains(output, "export class Derived extends Base {");
        assertCodeContains(output, "return Base.scale(this.weight);");
    }

    @Test
    void numericConstantsAndMath() {
        var output = run(
                "",
                """
                var a = double.PositiveInfinity;
                var b = double.MaxValue;
                var c = int.MaxValue;
                var d = Math.Sqrt(Math.Abs(-4.0));
                var e = Math.Ceiling(1.2);
                var f = Math.PI;
                """);
        assertCodeContains(output, "const a = Number.POSITIVE_INFINITY;");
        assertCodeContains(output, "const b = Number.MAX_VALUE;");
        assertCodeContains(output, "const c = 2147483647;");
        assertCodeContains(output, "const d = Math.sqrt(Math.abs(-4.0));");
        assertCodeContains(output, "const e = Math.ceil(1.2);");
        assertCodeContains(output, "const f = Math.PI;");
    }

    @Test
    void hostRuntimeCalls() {
        var output = run(
                "",
                """
                Console.WriteLine("hi");
                var t = Global.Performance.Now();
                Script.Call("postMessage", 1, 2);
                var parts = new List<string>();
                var joined = String.Join(",", parts);
                var at = Array.IndexOf(parts, "x");
                """);
        assertCodeContains(output, "console.log(\"hi\");");
        assertCodeContains(output, "const t = performance.now();");
        assertCodeContains(output, "postMessage(1, 2);");
        assertCodeContains(output, "const joined = parts.join(\",\");");
        assertCodeContains(output, "const at = parts.indexOf(\"x\");");
    }

    @Test
    void containerMembersAreRenamedByDeclaredFamily() {
        var members = """
                private List<double> samples = new List<double>();
                private Dictionary<string, int> counts = new Dictionary<string, int>();
                private HashSet<string> seen = new HashSet<string>();
                """;
        var output = run(
                members,
                """
                samples.Add(1.0);
                var n = samples.Count;
                counts.Add("a", 1);
                var m = counts.Count;
                var has = counts.ContainsKey("a");
                seen.Add("a");
                var hit = seen.Contains("a");
                """);
        assertCodeContains(output, "this.samples.push(1.0);");
        assertCodeContains(output, "const n = this.samples.length;");
        assertCodeContains(output, "this.counts.set(\"a\", 1);");
        assertCodeContains(output, "const m = this.counts.size;");
        assertCodeContains(output, "const has = this.counts.has(\"a\");");
        assertCodeContains(output, "this.seen.add(\"a\");");
        assertCodeContains(output, "const hit = this.seen.has(\"a\");");
    }

    @Test
    void untypedReceiversUseTheCollectionRenameTable() {
        assertEquals("push", MemberNameMapper.renameMember("Push"));
        assertEquals("getLast", MemberNameMapper.renameMember("GetLast"));
        assertEquals("getAll", MemberNameMapper.renameMember("GetAll"));
        assertEquals("clear", MemberNameMapper.renameMember("Clear"));
        assertEquals("length", MemberNameMapper.renameMember("Length"));
        assertEquals("length", MemberNameMapper.renameMember("Count"));
        assertEquals("slice", MemberNameMapper.renameMember("Slice_Array"));
        assertEquals("has", MemberNameMapper.renameMember("ContainsKey"));
        assertEquals("hasValue", MemberNameMapper.renameMember("ContainsValue"));
        assertEquals("set", MemberNameMapper.renameMember("Add"));
        assertEquals("delete", MemberNameMapper.renameMember("Remove"));
        assertEquals("get", MemberNameMapper.renameMember("TryGetValue"));
        assertEquals("computeScore", MemberNameMapper.renameMember("ComputeScore"));
    }

    @Test
    void objectCreation() {
        var members = """
                public class Options { public int Depth; public Options(int seed) { } }
                """;
        var output = run(
                members,
                """
                var point = new TrajectoryPoint { X = 1, Y = 2 };
                var options = new Options(7) { Depth = 3 };
                var values = new List<int> { 1, 2 };
                var lookup = new HashSet<string> { "a" };
                var error = new InvalidOperationException("bad");
                """);
        assertCodeContains(output, "const point = { x: 1, y: 2 };");
        assertCodeContains(output, "const options = Object.assign(new Options(7), { depth: 3 });");
        assertCodeContains(output, "const values = [1, 2];");
        assertCodeContains(output, "const lookup = new Set<string>([\"a\"]);");
        assertCodeContains(output, "const error = new Error(\"bad\");");
    }

    @Test
    void initializerShorthandWhenNameMatchesValue() {
        var output = run("", "var x = 1; var point = new TrajectoryPoint { X = x, Y = 2 };");
        assertCodeContains(output, "const point = { x, y: 2 };");
    }

    @Test
    void arraysAreZeroFilled() {
        var output = run("", "var a = new double[3]; var b = new bool[2]; var c = new string[2]; var d = new[] { 1, 2 };");
        assertCodeContains(output, "const a = new Array<number>(3).fill(0);");
        assertCodeContains(output, "const b = new Array<boolean>(2).fill(false);");
        assertCodeContains(output, "const c = new Array<string>(2);");
        assertCodeContains(output, "const d = [1, 2];");
    }

    @Test
    void literals() {
        var output = run(
                "",
                """
                var f = 1.5f;
                var m = 10m;
                var h = 0xFFu;
                var c = 'q';
                var v = @"C:\\dir ""quoted\""";
                string s = null;
                """);
        assertCodeContains(output, "const f = 1.5;");
        assertCodeContains(output, "const m = 10;");
        assertCodeContains(output, "const h = 0xFF;");
        assertCodeContains(output, "const c = \"q\";");
        assertCodeContains(output, "const v = \"C:\\\\dir \\\"quoted\\\"\";");
        assertCodeContains(output, "const s: string = null;");
    }

    @Test
    void csharpEscapesAreDecodedForTypeScript() {
        var output = run(
                "",
                """
                var bell = "\\a";
                var hex = "\\x41BC";
                var tab = '\\t';
                var wide = "\\U0001F600";
                var quote = '\\'';
                var t = $"tab\\there";
                """);
        assertCodeContains(output, "const bell = \"\\u0007\";");
        assertCodeContains(output, "const hex = \"\u41BC\";");
        assertCodeContains(output, "const tab = \"\\t\";");
        assertCodeContains(output, "const wide = \"\uD83D\uDE00\";");
        assertCodeContains(output, "const quote = \"'\";");
        assertCodeContains(output, "const t = `tab\\there`;");
    }

    @Test
    void unescapeHandlesVariableLengthHex() {
        assertEquals("A\u0007", ExpressionGenerator.unescape("\\x41\\a"));
        assertEquals("\u0041g", ExpressionGenerator.unescape("\\x0041g"));
        assertEquals("\0 \"", ExpressionGenerator.unescape("\\0 \\\""));
        assertThrows(IllegalArgumentException.class, () -> ExpressionGenerator.unescape("\\q"));
    }

    @Test
    void negationOfNegativeOperandsKeepsASpace() {
        var output = run(
                "",
                """
                var a = -double.MinValue;
                var b = -int.MinValue;
                var c = 1;
                var d = - -c;
                var e = -(-c);
                var f = -c;
                """);
        assertCodeContains(output, "const a = - -Number.MAX_VALUE;");
        assertCodeContains(output, "const b = - -2147483648;");
        assertCodeContains(output, "const d = - -c;");
        assertCodeContains(output, "const e = -(-c);");
        assertCodeContains(output, "const f = -c;");
        assertEquals("+ +x", ExpressionGenerator.joinPrefix("+", "+x"));
        assertEquals("- --x", ExpressionGenerator.joinPrefix("-", "--x"));
        assertEquals("!-x", ExpressionGenerator.joinPrefix("!", "-x"));
    }

    @Test
    void mathCallsWithoutDirectCounterpart() {
        var output = run(
                "",
                """
                double x = 2.5;
                var t = (int)Math.Truncate(x);
                var c = Math.Clamp(x, 0.0, 1.0);
                var l = Math.Log(x, 2);
                var n = Math.Log(x);
                var r = Math.IEEERemainder(x, 2);
                """);
        assertCodeContains(output, "const t = Math.trunc(x);");
        assertCodeContains(output, "const c = Math.min(Math.max(x, 0.0), 1.0);");
        assertCodeContains(output, "const l = (Math.log(x) / Math.log(2));");
        assertCodeContains(output, "const n = Math.log(x);");
        assertCodeContains(output, "const r = /* UNSUPPORTED: invocation_expression */;");
        assertCodeDoesNotContain(output, "Math.truncate");
    }

    @Test
    void castsAndLambdas() {
        var output = run(
                "",
                """
                double x = 2.7;
                var i = (int)Math.Floor(x);
                var o = (object)x;
                Func<double, double> twice = v => v * 2;
                """);
        assertCodeContains(output, "const i = Math.floor(x);");
        assertCodeContains(output, "const o = (x as any);");
        assertCodeContains(output, "const twice: Func<number, number> = (v) => v * 2;");
    }

    @Test
    void blockLambdaIsRenderedAtCurrentIndentation() {
        var output = run("", "Action<int> log = n => { Console.WriteLine(n); };");
        assertCodeContains(
                output,
                """
                        const log: Action<number> = (n) => {
                            console.log(n);
                        };
                """);
    }

    @Test
    void enumMembersKeepTheirNames() {
        var output = translate(
                """
                public enum Phase { Idle, Active = 2 }
                public class Machine
                {
                    private Phase phase = Phase.Idle;
                }
                """);
        assertCodeContains(output, "private phase: Phase = Phase.Idle;");
    }

    /** generate never returns blank text and never throws, for every expression in a realistic worker file. */
    @Test
    void everyExpressionInFixtureGeneratesText() throws IOException {
        var source = Files.readString(TestSources.FIXTURES.resolve("Worker/PredictionEngine.cs"));
        var unit = TestSources.unit(source, Files.readString(TestSources.FIXTURES.resolve("Worker/GeometryMath.cs")));
        var generator = new ExpressionGenerator(
                unit, new GeneratorContext(4), TranspilerConfig.defaults(), Set.of("Observation"));
        var expressions = SyntaxTrees.findAllNodesRecursive(
                unit.root(), n -> SyntaxKind.of(n).category() == SyntaxKind.Category.EXPRESSION);
        assertFalse(expressions.isEmpty());
        for (var node : expressions) {
            var text = assertDoesNotThrow(() -> generator.generate(node));
            assertFalse(text.isBlank(), "blank translation of " + node.getType() + ": " + unit.text(node));
        }
    }

    @Test
    void absentExpressionIsPlaceholder() {
        var unit = TestSources.unit("class C { }");
        var generator = new ExpressionGenerator(unit, new GeneratorContext(4), TranspilerConfig.defaults(), Set.of());
        assertEquals("/* UNSUPPORTED: missing_expression */", generator.generate(null));
    }
}
