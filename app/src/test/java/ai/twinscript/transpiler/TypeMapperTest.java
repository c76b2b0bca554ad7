package ai.twinscript.transpiler;

import static org.junit.jupiter.api.Assertions.*;

import ai.twinscript.frontend.ParsedSource;
import ai.twinscript.frontend.csharp.SyntaxTrees;
import ai.twinscript.testutil.TestSources;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TypeMapperTest {

    /** Declares one field of the given type and maps it. */
    private static String mapField(String csharpType) {
        ParsedSource parsed = TestSources.parse("class Holder { " + csharpType + " field; }");
        var declaration = TestSources.first(parsed, "variable_declaration");
        return new TypeMapper(parsed).map(SyntaxTrees.field(declaration, "type"));
    }

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            value = {
                "double | number",
                "int | number",
                "long | number",
                "float | number",
                "bool | boolean",
                "string | string",
                "char | string",
                "object | any",
                "Double | number",
                "Int32 | number",
                "String | string",
                "Boolean | boolean",
                "Object | any",
                "Vector3 | Vector3",
            })
    void mapsScalarTypes(String source, String expected) {
        assertEquals(expected, mapField(source));
    }

    @Test
    void mapsOrderedListOfNumbersToArrayOfNumber() {
        assertEquals("Array<number>", mapField("List<double>"));
    }

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            value = {
                "JsArray<double> | List<double>",
                "JsMap<string, int> | Dictionary<string, int>",
                "JsSet<string> | HashSet<string>",
                "JsArray<JsArray<int>> | List<List<int>>",
                "JsMap<string, JsArray<double>> | Dictionary<string, List<double>>",
            })
    void canonicalAndLegacyContainerSpellingsMapIdentically(String canonical, String legacy) {
        assertEquals(mapField(canonical), mapField(legacy));
    }

    @Test
    void mapsContainersByFamily() {
        assertEquals("Map<string, number>", mapField("Dictionary<string, int>"));
        assertEquals("Set<string>", mapField("HashSet<string>"));
        assertEquals("Array<Array<number>>", mapField("List<List<int>>"));
    }

    @Test
    void mapsArraysAndNullables() {
        assertEquals("number[]", mapField("double[]"));
        assertEquals("number[][]", mapField("int[,]"));
        assertEquals("number | null", mapField("double?"));
        assertEquals("(number | null)[]", mapField("double?[]"));
        assertEquals("number | null", mapField("Nullable<int>"));
    }

    @Test
    void qualifiedNamesMapByLastSegment() {
        assertEquals("Array<number>", mapField("System.Collections.Generic.List<int>"));
        assertEquals("string", mapField("System.String"));
    }

    @Test
    void absentTypeIsAny() {
        var parsed = TestSources.parse("class Holder { }");
        assertEquals("any", new TypeMapper(parsed).map(null));
    }

    @Test
    void familyOfDeclaredTypeText() {
        assertEquals(MemberNameMapper.ContainerFamily.MAP, TypeMapper.family("Dictionary<string, int>"));
        assertEquals(MemberNameMapper.ContainerFamily.LIST, TypeMapper.family("JsArray<double>"));
        assertEquals(MemberNameMapper.ContainerFamily.LIST, TypeMapper.family("double[]"));
        assertEquals(MemberNameMapper.ContainerFamily.SET, TypeMapper.family("HashSet<int>"));
        assertEquals(MemberNameMapper.ContainerFamily.UNKNOWN, TypeMapper.family("Observation"));
        assertEquals(MemberNameMapper.ContainerFamily.UNKNOWN, TypeMapper.family(null));
    }
}
