package ai.twinscript;

import ai.twinscript.frontend.FrontEnd;
import ai.twinscript.frontend.FrontEndException;
import ai.twinscript.frontend.ParsedSource;
import ai.twinscript.frontend.SourceFile;
import ai.twinscript.frontend.TranslationUnit;
import ai.twinscript.frontend.csharp.CSharpSymbolResolver;
import ai.twinscript.frontend.csharp.SymbolIndex;
import ai.twinscript.transpiler.TypeScriptGenerator;
import com.google.common.io.Files;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Batch translation of a source tree. All files are parsed first so that one symbol index spans the whole batch;
 * each file is then translated and written independently.
 */
public class TranslationOrchestrator {
    private static final Logger logger = LogManager.getLogger(TranslationOrchestrator.class);

    private final TranspilerConfig config;
    private final FrontEnd frontEnd;

    public TranslationOrchestrator(TranspilerConfig config, FrontEnd frontEnd) {
        this.config = config;
        this.frontEnd = frontEnd;
    }

    /**
     * Translates every source file under {@code inputRoot} into the mirrored location under {@code outputRoot}.
     * Per-file failures are recorded in the result; only failing to list the input tree is thrown.
     */
    public BatchResult translateDirectory(Path inputRoot, Path outputRoot) throws IOException {
        var root = inputRoot.toAbsolutePath().normalize();
        var sources = enumerate(root);
        logger.debug("Found {} source files under {}", sources.size(), root);

        var failures = new ArrayList<BatchResult.Failure>();
        var parsed = new ArrayList<ParsedSource>();
        for (var file : sources) {
            try {
                parsed.add(frontEnd.parse(file, file.read()));
            } catch (FrontEndException e) {
                logger.warn("Skipping {}: {}", file, e.getMessage());
                failures.add(new BatchResult.Failure(file, BatchResult.Stage.FRONT_END, e.getMessage()));
            } catch (IOException | UncheckedIOException e) {
                logger.warn("Unable to read {}", file, e);
                failures.add(new BatchResult.Failure(file, BatchResult.Stage.IO, String.valueOf(e.getMessage())));
            } catch (StackOverflowError e) {
                failures.add(tooDeep(file));
            }
        }

        var index = SymbolIndex.build(parsed);
        var translated = new ArrayList<SourceFile>();
        for (var source : parsed) {
            var file = source.file();
            try {
                var unit = new TranslationUnit(source, new CSharpSymbolResolver(index, source));
                var output = new TypeScriptGenerator(unit, config).generate();
                write(outputPath(outputRoot, file), output);
                translated.add(file);
                logger.debug("Translated {}", file);
            } catch (IOException | UncheckedIOException e) {
                logger.warn("Unable to write translation of {}", file, e);
                failures.add(new BatchResult.Failure(file, BatchResult.Stage.IO, String.valueOf(e.getMessage())));
            } catch (RuntimeException e) {
                logger.error("Translation of {} failed", file, e);
                failures.add(new BatchResult.Failure(file, BatchResult.Stage.INTERNAL, String.valueOf(e)));
            } catch (StackOverflowError e) {
                failures.add(tooDeep(file));
            }
        }

        var result = new BatchResult(translated, failures);
        logger.info(
                "Translated {} of {} files from {} to {}",
                translated.size(),
                sources.size(),
                root,
                outputRoot.toAbsolutePath());
        failures.forEach(f -> logger.info("  failed: {}", f));
        return result;
    }

    private static BatchResult.Failure tooDeep(SourceFile file) {
        logger.error("Giving up on {}: syntax nested too deeply", file);
        return new BatchResult.Failure(file, BatchResult.Stage.INTERNAL, "syntax nested too deeply");
    }

    /** Source files under the root, sorted, skipping excluded directories at any depth. */
    List<SourceFile> enumerate(Path root) throws IOException {
        try (Stream<Path> walk = java.nio.file.Files.walk(root)) {
            return walk.filter(java.nio.file.Files::isRegularFile)
                    .filter(config::isSourceFile)
                    .map(root::relativize)
                    .filter(rel -> !isExcluded(rel))
                    .map(rel -> new SourceFile(root, rel))
                    .sorted()
                    .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    boolean isExcluded(Path relative) {
        var parent = relative.getParent();
        if (parent == null) {
            return false;
        }
        for (var segment : parent) {
            if (config.excludedDirectories().contains(segment.toString())) {
                return true;
            }
        }
        return false;
    }

    /** {@code out/<rel dir>/<base name><outputExtension>} */
    Path outputPath(Path outputRoot, SourceFile file) {
        var baseName = Files.getNameWithoutExtension(file.getFileName());
        return outputRoot.resolve(file.getParent()).resolve(baseName + config.outputExtension());
    }

    private static void write(Path target, String content) throws IOException {
        var parent = target.getParent();
        if (parent != null) {
            java.nio.file.Files.createDirectories(parent);
        }
        java.nio.file.Files.writeString(target, content, StandardCharsets.UTF_8);
    }
}
