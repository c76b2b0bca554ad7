package ai.twinscript.frontend.csharp;

import static org.junit.jupiter.api.Assertions.*;

import ai.twinscript.frontend.FrontEndException;
import ai.twinscript.frontend.SourceFile;
import ai.twinscript.testutil.TestSources;
import java.io.IOException;
import java.nio.file.Files;
import org.junit.jupiter.api.Test;

class CSharpFrontEndTest {

    private final CSharpFrontEnd frontEnd = new CSharpFrontEnd();

    @Test
    void parsesValidSource() throws FrontEndException {
        var file = new SourceFile(TestSources.ROOT, "Ok.cs");
        var parsed = frontEnd.parse(file, "public class Ok { public int X; }");
        assertEquals(file, parsed.file());
        assertEquals("compilation_unit", parsed.root().getType());
        assertFalse(parsed.root().hasError());
    }

    @Test
    void syntaxErrorReportsFileAndPosition() throws IOException {
        var file = new SourceFile(TestSources.FIXTURES, "Broken/Broken.cs");
        var source = Files.readString(file.absPath());
        var e = assertThrows(FrontEndException.class, () -> frontEnd.parse(file, source));
        assertEquals(file, e.file());
        assertTrue(e.line() >= 5, "error line " + e.line());
        assertTrue(e.column() >= 1);
        assertTrue(e.getMessage().startsWith("Broken/Broken.cs:" + e.line() + ":" + e.column() + ": "),
                e.getMessage());
    }

    @Test
    void missingTokenIsAnError() {
        var file = new SourceFile(TestSources.ROOT, "Missing.cs");
        assertThrows(FrontEndException.class, () -> frontEnd.parse(file, "public class A { int x = 1 }"));
    }

    @Test
    void byteOrderMarkIsStripped() throws FrontEndException {
        var file = new SourceFile(TestSources.ROOT, "Bom.cs");
        var parsed = frontEnd.parse(file, "\uFEFFpublic class Bom { }");
        assertTrue(parsed.source().startsWith("public"));
        var name = TestSources.first(parsed, CSharpTreeSitterNodeTypes.CLASS_DECLARATION).getChildByFieldName("name");
        assertEquals("Bom", parsed.text(name));
    }

    @Test
    void textIsSlicedByUtf8Bytes() throws FrontEndException {
        var file = new SourceFile(TestSources.ROOT, "Wide.cs");
        var parsed = frontEnd.parse(file, "public class Wide { string s = \"héllo ✓\"; int after = 1; }");
        var literal = TestSources.first(parsed, CSharpTreeSitterNodeTypes.STRING_LITERAL);
        assertEquals("\"héllo ✓\"", parsed.text(literal));
        TestSources.find(parsed, CSharpTreeSitterNodeTypes.IDENTIFIER, "after");
    }
}
