package ai.twinscript.cli;

import ai.twinscript.TranslationOrchestrator;
import ai.twinscript.TranslationWatcher;
import ai.twinscript.TranspilerConfig;
import ai.twinscript.frontend.csharp.CSharpFrontEnd;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@SuppressWarnings("NullAway.Init") // picocli assigns the positional fields before call()
@CommandLine.Command(
        name = "twinscript",
        mixinStandardHelpOptions = true,
        version = "twinscript 0.1.0",
        description = "Translates a directory of C# worker sources to TypeScript, once or continuously.")
public final class TwinscriptCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(TwinscriptCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FRONT_END_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    @CommandLine.Parameters(index = "0", paramLabel = "<input>", description = "Directory of C# sources.")
    private Path inputDir;

    @CommandLine.Parameters(index = "1", paramLabel = "<output>", description = "Directory for TypeScript output.")
    private Path outputDir;

    @CommandLine.Option(
            names = {"-w", "--watch"},
            description = "After the initial pass, re-translate whenever a source file changes.")
    private boolean watch = false;

    @CommandLine.Option(names = "--config", description = "JSON file overriding the default settings.")
    @Nullable
    private Path configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TwinscriptCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (!Files.isDirectory(inputDir)) {
            System.err.println("Input path is not a directory: " + inputDir);
            return EXIT_USAGE;
        }

        TranspilerConfig config;
        try {
            config = TranspilerConfig.load(configFile);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Unable to load config " + configFile + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        var orchestrator = new TranslationOrchestrator(config, new CSharpFrontEnd());
        if (!watch) {
            var result = orchestrator.translateDirectory(inputDir, outputDir);
            result.failures().forEach(f -> System.err.println(f));
            return result.hasFrontEndFailures() ? EXIT_FRONT_END_FAILURE : EXIT_OK;
        }

        try (var watcher = new TranslationWatcher(orchestrator, config, inputDir, outputDir)) {
            Runtime.getRuntime().addShutdownHook(new Thread(watcher::close, "twinscript-shutdown"));
            watcher.start();
            logger.info("Watching {} (Ctrl-C to stop)", inputDir.toAbsolutePath());
            watcher.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Watch interrupted; exiting");
        }
        return EXIT_OK;
    }
}
