package ai.twinscript;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Watch mode: one batch pass up front, then another pass whenever a source file changes. Passes never overlap; a
 * change that arrives during a pass is delivered after it and triggers the next one. Nothing a pass throws stops the
 * watcher.
 */
public class TranslationWatcher implements IWatchService.Listener, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TranslationWatcher.class);

    private final TranslationOrchestrator orchestrator;
    private final TranspilerConfig config;
    private final Path inputRoot;
    private final Path outputRoot;
    private final CountDownLatch closed = new CountDownLatch(1);
    private final AtomicInteger passes = new AtomicInteger();

    @Nullable
    private IWatchService watchService;

    @Nullable
    private volatile BatchResult lastResult;

    public TranslationWatcher(
            TranslationOrchestrator orchestrator, TranspilerConfig config, Path inputRoot, Path outputRoot) {
        this.orchestrator = orchestrator;
        this.config = config;
        this.inputRoot = inputRoot.toAbsolutePath().normalize();
        this.outputRoot = outputRoot;
    }

    /** Starts watching with the configured implementation and runs the initial pass. */
    public BatchResult start() {
        return start(WatchServiceFactory.create(inputRoot, config, List.of()));
    }

    /** Starts watching with the given service. Events raised during the initial pass are held until it finishes. */
    public synchronized BatchResult start(IWatchService service) {
        this.watchService = service;
        service.addListener(this);
        var initialPassDone = new CompletableFuture<Void>();
        service.start(initialPassDone);
        try {
            return runPass("initial");
        } finally {
            initialPassDone.complete(null);
        }
    }

    @Override
    public void onFilesChanged(IWatchService.EventBatch batch) {
        if (!batch.isOverflowed() && batch.files().stream().noneMatch(f -> config.isSourceFile(f.absPath()))) {
            logger.trace("Ignoring non-source changes: {}", batch);
            return;
        }
        logger.info("Change detected ({} files{}); re-translating",
                batch.files().size(),
                batch.isOverflowed() ? ", overflow" : "");
        runPass("change");
    }

    /** Runs one batch pass. Serialized, so a pass requested during another waits for it. */
    synchronized BatchResult runPass(String reason) {
        int number = passes.incrementAndGet();
        try {
            var result = orchestrator.translateDirectory(inputRoot, outputRoot);
            lastResult = result;
            logger.info(
                    "Pass {} ({}): {} translated, {} failed",
                    number,
                    reason,
                    result.translated().size(),
                    result.failures().size());
            return result;
        } catch (Exception e) {
            logger.error("Pass {} ({}) failed", number, reason, e);
            var result = new BatchResult(List.of(), List.of());
            lastResult = result;
            return result;
        }
    }

    public int passCount() {
        return passes.get();
    }

    public @Nullable BatchResult lastResult() {
        return lastResult;
    }

    /** Blocks until {@link #close()} is called or the thread is interrupted. */
    public void awaitTermination() throws InterruptedException {
        closed.await();
    }

    @Override
    public void close() {
        var service = watchService;
        if (service != null) {
            service.close();
        }
        closed.countDown();
    }
}
