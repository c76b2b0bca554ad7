package ai.twinscript.frontend.csharp;

import static org.junit.jupiter.api.Assertions.*;

import ai.twinscript.frontend.ParsedSource;
import ai.twinscript.testutil.TestSources;
import java.util.List;
import org.junit.jupiter.api.Test;

class SymbolIndexTest {

    private static final String SHAPES = """
            namespace Demo
            {
                public interface IShape { double Area(); }
                public abstract class Shape : IShape
                {
                    protected double scale = 1;
                    public const int Sides = 0;
                    public static Shape Unit;
                    public abstract double Area();
                    public string Name { get; set; }
                    public class Builder { }
                }
                public partial class Square : Shape
                {
                    public double Side;
                    public override double Area() => Side * Side;
                }
                public enum Fill { Solid, Hatched }
            }
            """;

    private static final String PARTIAL = """
            public partial class Square
            {
                public static double Perimeter(double side) => 4 * side;
                public double Perimeter() => 4 * Side;
            }
            """;

    private final SymbolIndex index = SymbolIndex.build(
            List.<ParsedSource>of(TestSources.parse("Shapes.cs", SHAPES), TestSources.parse("Square.cs", PARTIAL)));

    @Test
    void indexesTypesByKind() {
        assertEquals(SymbolIndex.TypeKind.INTERFACE, index.type("IShape").orElseThrow().kind());
        assertEquals(SymbolIndex.TypeKind.CLASS, index.type("Shape").orElseThrow().kind());
        assertEquals(SymbolIndex.TypeKind.ENUM, index.type("Fill").orElseThrow().kind());
        assertTrue(index.contains("Builder"));
        assertFalse(index.contains("Circle"));
    }

    @Test
    void recordsMembersWithStaticnessAndTypes() {
        var shape = index.type("Shape").orElseThrow();
        var scale = shape.member("scale").orElseThrow();
        assertEquals(SymbolIndex.MemberKind.FIELD, scale.kind());
        assertFalse(scale.isStatic());
        assertEquals("double", scale.declaredType());

        var sides = shape.member("Sides").orElseThrow();
        assertEquals(SymbolIndex.MemberKind.CONSTANT, sides.kind());
        assertTrue(sides.isStatic());

        assertTrue(shape.member("Unit").orElseThrow().isStatic());
        assertEquals("string", shape.member("Name").orElseThrow().declaredType());
        assertEquals(SymbolIndex.MemberKind.NESTED_TYPE, shape.member("Builder").orElseThrow().kind());
        assertEquals(SymbolIndex.MemberKind.ENUM_MEMBER,
                index.type("Fill").orElseThrow().member("Hatched").orElseThrow().kind());
    }

    @Test
    void partialDeclarationsAreMerged() {
        var square = index.type("Square").orElseThrow();
        assertTrue(square.member("Side").isPresent());
        // one static and one instance overload: not static
        assertFalse(square.member("Perimeter").orElseThrow().isStatic());
        assertEquals(List.of("Shape"), square.baseTypes());
    }

    @Test
    void findMemberWalksBaseTypes() {
        var lookup = index.findMember("Square", "scale").orElseThrow();
        assertEquals("Shape", lookup.owner().name());
        assertTrue(index.findMember("Square", "Missing").isEmpty());
        assertTrue(index.findMember("Unknown", "scale").isEmpty());
    }

    @Test
    void emptyIndexKnowsNothing() {
        assertTrue(SymbolIndex.empty().typeNames().isEmpty());
        assertTrue(SymbolIndex.empty().findMember("Shape", "scale").isEmpty());
    }
}
