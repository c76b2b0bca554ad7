package ai.twinscript;

import ai.twinscript.frontend.SourceFile;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Watches a source tree with the JDK {@link WatchService}, registering every directory individually. Events that
 * arrive within the debounce window of the first one are delivered as a single batch.
 */
public class PollingSourceWatchService implements IWatchService {

    private final Logger logger = LogManager.getLogger(PollingSourceWatchService.class);

    private static final long POLL_TIMEOUT_MS = 1000;

    private final Path root;
    private final Set<String> excludedDirectories;
    private final long debounceMillis;
    private final List<Listener> listeners;

    private volatile boolean running = true;

    public PollingSourceWatchService(
            Path root, Set<String> excludedDirectories, long debounceMillis, List<Listener> listeners) {
        this.root = root.toAbsolutePath().normalize();
        this.excludedDirectories = Set.copyOf(excludedDirectories);
        this.debounceMillis = debounceMillis;
        this.listeners = new CopyOnWriteArrayList<>(listeners);
    }

    @Override
    public void start(CompletableFuture<?> delayNotificationsUntilCompleted) {
        Thread watcherThread = new Thread(() -> beginWatching(delayNotificationsUntilCompleted));
        watcherThread.setName("SourceWatcher@" + Long.toHexString(watcherThread.getId()));
        watcherThread.setDaemon(true);
        watcherThread.start();
    }

    private void beginWatching(CompletableFuture<?> delayNotificationsUntilCompleted) {
        logger.debug("Setting up WatchService for {}", root);
        try (WatchService watchService = FileSystems.getDefault().newWatchService()) {
            registerAllDirectories(root, watchService);

            // The WatchService queues events that arrive while we wait.
            try {
                delayNotificationsUntilCompleted.get();
            } catch (ExecutionException e) {
                logger.debug("Initial pass failed; watching anyway", e);
            }

            while (running) {
                WatchKey key = watchService.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (key == null) {
                    notifyNoFilesChanged();
                    continue;
                }

                var batch = new EventBatch();
                collectEventsFromKey(key, watchService, batch);

                long deadline = System.currentTimeMillis() + debounceMillis;
                while (true) {
                    long remaining = deadline - System.currentTimeMillis();
                    if (remaining <= 0) break;
                    WatchKey nextKey = watchService.poll(remaining, TimeUnit.MILLISECONDS);
                    if (nextKey == null) break;
                    collectEventsFromKey(nextKey, watchService, batch);
                }

                if (batch.isOverflowed || !batch.files.isEmpty()) {
                    notifyFilesChanged(batch);
                }
            }
        } catch (IOException e) {
            logger.error("Error setting up watch service", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Source watcher thread interrupted; shutting down");
        }
    }

    private void collectEventsFromKey(WatchKey key, WatchService watchService, EventBatch batch) {
        Path watchPath = (Path) key.watchable();
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                batch.isOverflowed = true;
                continue;
            }
            if (!(event.context() instanceof Path ctx)) {
                logger.warn("Event is not overflow but has no path: {}", event);
                continue;
            }

            Path eventPath = watchPath.resolve(ctx);
            Path relativized = root.relativize(eventPath);
            if (isExcluded(relativized)) {
                continue;
            }
            batch.files.add(new SourceFile(root, relativized));

            // new directories need their own registration
            if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(eventPath)) {
                try {
                    registerAllDirectories(eventPath, watchService);
                } catch (IOException ex) {
                    logger.warn("Failed to register new directory for watching: {}", eventPath, ex);
                }
            }
        }

        if (!key.reset()) {
            logger.debug("Watch key no longer valid: {}", key.watchable());
        }
    }

    boolean isExcluded(Path relative) {
        for (var segment : relative) {
            if (excludedDirectories.contains(segment.toString())) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param start either the root or a newly created directory below it
     */
    private void registerAllDirectories(Path start, WatchService watchService) throws IOException {
        if (!Files.isDirectory(start)) return;

        for (int attempt = 1; attempt <= 3; attempt++) {
            try (var walker = Files.walk(start)) {
                walker.filter(Files::isDirectory)
                        .filter(dir -> !isExcluded(root.relativize(dir)))
                        .forEach(dir -> {
                            try {
                                dir.register(
                                        watchService,
                                        StandardWatchEventKinds.ENTRY_CREATE,
                                        StandardWatchEventKinds.ENTRY_DELETE,
                                        StandardWatchEventKinds.ENTRY_MODIFY);
                            } catch (IOException e) {
                                logger.warn("Failed to register directory for watching: {}", dir, e);
                            }
                        });
                return;
            } catch (IOException | UncheckedIOException e) {
                Throwable cause = (e instanceof UncheckedIOException uioe) ? uioe.getCause() : e;
                // directories can vanish mid-walk while an editor saves
                if (cause instanceof NoSuchFileException && attempt < 3) {
                    logger.debug("Attempt {} to walk {} hit a vanished file; retrying", attempt, start);
                    try {
                        Thread.sleep(10);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                } else {
                    throw cause instanceof IOException io ? io : new IOException(cause);
                }
            }
        }
        logger.debug("Failed to (completely) register directory `{}` for watching", start);
    }

    @Override
    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        running = false;
    }

    private void notifyFilesChanged(EventBatch batch) {
        for (Listener listener : listeners) {
            try {
                listener.onFilesChanged(batch);
            } catch (Exception e) {
                logger.error(
                        "Error notifying listener {} of file changes",
                        listener.getClass().getSimpleName(),
                        e);
            }
        }
    }

    private void notifyNoFilesChanged() {
        for (Listener listener : listeners) {
            try {
                listener.onNoFilesChangedDuringPollInterval();
            } catch (Exception e) {
                logger.error(
                        "Error notifying listener {} of no file changes",
                        listener.getClass().getSimpleName(),
                        e);
            }
        }
    }
}
