package ai.twinscript.cli;

import static org.junit.jupiter.api.Assertions.*;

import ai.twinscript.testutil.TestSources;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class TwinscriptCliTest {

    @TempDir
    Path tempDir;

    private static int run(String... args) {
        return new CommandLine(new TwinscriptCli()).execute(args);
    }

    @Test
    void cleanTreeExitsZero() throws Exception {
        var input = tempDir.resolve("in");
        Files.createDirectories(input);
        Files.writeString(input.resolve("Point.cs"), "public class Point { public double X; }");
        var output = tempDir.resolve("out");

        assertEquals(TwinscriptCli.EXIT_OK, run(input.toString(), output.toString()));
        assertTrue(Files.readString(output.resolve("Point.ts")).contains("export class Point {"));
    }

    @Test
    void frontEndFailureExitsOne() throws Exception {
        var input = TestSources.copyFixtures(tempDir.resolve("in"));
        var output = tempDir.resolve("out");

        assertEquals(TwinscriptCli.EXIT_FRONT_END_FAILURE, run(input.toString(), output.toString()));
        // the other files are still translated
        assertTrue(Files.exists(output.resolve("Worker/GeometryMath.ts")));
    }

    @Test
    void missingInputDirectoryIsAUsageError() {
        assertEquals(
                TwinscriptCli.EXIT_USAGE,
                run(tempDir.resolve("absent").toString(), tempDir.resolve("out").toString()));
    }

    @Test
    void missingArgumentsIsAUsageError() {
        assertEquals(TwinscriptCli.EXIT_USAGE, run());
    }

    @Test
    void badConfigIsAUsageError() throws Exception {
        var input = Files.createDirectories(tempDir.resolve("in"));
        var config = tempDir.resolve("config.json");
        Files.writeString(config, "{ \"noSuchSetting\": true }");

        assertEquals(
                TwinscriptCli.EXIT_USAGE,
                run("--config", config.toString(), input.toString(), tempDir.resolve("out").toString()));
    }

    @Test
    void configChangesTheOutput() throws Exception {
        var input = Files.createDirectories(tempDir.resolve("in"));
        Files.writeString(input.resolve("Point.cs"), "public class Point { public double X; }");
        var config = tempDir.resolve("config.json");
        Files.writeString(config, "{ \"indentWidth\": 2, \"outputExtension\": \".g.ts\" }");
        var output = tempDir.resolve("out");

        assertEquals(TwinscriptCli.EXIT_OK, run("--config", config.toString(), input.toString(), output.toString()));
        assertTrue(Files.readString(output.resolve("Point.g.ts")).contains("\n  x: number;"));
    }
}
