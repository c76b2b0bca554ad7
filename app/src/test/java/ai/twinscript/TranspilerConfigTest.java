package ai.twinscript;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranspilerConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsComeFromTheBundledResource() {
        var config = TranspilerConfig.defaults();
        assertEquals(".cs", config.sourceExtension());
        assertEquals(".ts", config.outputExtension());
        assertEquals("./confidence-types", config.companionModule());
        assertTrue(config.companionTypes().contains("MouseTrajectory"));
        assertTrue(config.plainDataTypes().contains("TrajectoryPoint"));
        assertTrue(config.dictionaryTypes().contains("Dictionary"));
        assertTrue(config.excludedDirectories().containsAll(java.util.List.of("bin", "obj")));
        assertEquals(300, config.debounceMillis());
        assertEquals(4, config.indentWidth());
        assertEquals("auto", config.watchImplementation());
    }

    @Test
    void noUserFileMeansDefaults() throws IOException {
        assertEquals(TranspilerConfig.defaults(), TranspilerConfig.load(null));
    }

    @Test
    void userFileOverridesOnlyWhatItNames() throws IOException {
        var file = tempDir.resolve("twinscript.json");
        Files.writeString(file, """
                { "indentWidth": 2, "watchImplementation": "POLLING", "companionTypes": ["Only"] }
                """);

        var config = TranspilerConfig.load(file);

        assertEquals(2, config.indentWidth());
        assertEquals("polling", config.watchImplementation());
        assertEquals(java.util.Set.of("Only"), config.companionTypes());
        assertEquals(TranspilerConfig.defaults().plainDataTypes(), config.plainDataTypes());
        assertEquals(300, config.debounceMillis());
    }

    @Test
    void unknownKeysAreRejected() throws IOException {
        var file = tempDir.resolve("typo.json");
        Files.writeString(file, "{ \"indentWdith\": 2 }");
        assertThrows(IOException.class, () -> TranspilerConfig.load(file));
    }

    @Test
    void invalidValuesAreRejected() throws IOException {
        var file = tempDir.resolve("bad.json");
        Files.writeString(file, "{ \"outputExtension\": \"ts\" }");
        assertThrows(IOException.class, () -> TranspilerConfig.load(file));
    }

    @Test
    void nonObjectFileIsRejected() throws IOException {
        var file = tempDir.resolve("array.json");
        Files.writeString(file, "[1, 2]");
        var e = assertThrows(IOException.class, () -> TranspilerConfig.load(file));
        assertTrue(e.getMessage().contains("JSON object"));
    }

    @Test
    void missingFileIsAnIoError() {
        assertThrows(IOException.class, () -> TranspilerConfig.load(tempDir.resolve("absent.json")));
    }

    @Test
    void sourceFilesAreMatchedByExtension() {
        var config = TranspilerConfig.defaults();
        assertTrue(config.isSourceFile(Path.of("a", "Engine.cs")));
        assertFalse(config.isSourceFile(Path.of("a", "Engine.ts")));
        assertFalse(config.isSourceFile(Path.of("a", "Engine.csproj")));
    }
}
