package ai.twinscript;

import ai.twinscript.frontend.SourceFile;
import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryWatcher;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * File watching service using io.methvin:directory-watcher, which watches recursively with the platform's native
 * facility (FSEvents, inotify, or the Windows file-tree watch). The library reports one event at a time; listeners
 * are wrapped in a {@link DebouncingListener} so they see coalesced batches.
 */
public class NativeSourceWatchService implements IWatchService {
    private static final Logger logger = LogManager.getLogger(NativeSourceWatchService.class);

    private final Path root;
    private final Set<String> excludedDirectories;
    private final long debounceMillis;
    private final List<DebouncingListener> listeners = new CopyOnWriteArrayList<>();

    @Nullable
    private volatile DirectoryWatcher watcher;

    private volatile boolean running = true;

    @Nullable
    private volatile Thread watcherThread;

    public NativeSourceWatchService(
            Path root, Set<String> excludedDirectories, long debounceMillis, List<Listener> listeners) {
        this.root = root.toAbsolutePath().normalize();
        this.excludedDirectories = Set.copyOf(excludedDirectories);
        this.debounceMillis = debounceMillis;
        listeners.forEach(this::addListener);
    }

    @Override
    public void start(CompletableFuture<?> delayNotificationsUntilCompleted) {
        var thread = new Thread(() -> beginWatching(delayNotificationsUntilCompleted));
        thread.setName("NativeSourceWatcher@" + Long.toHexString(thread.getId()));
        thread.setDaemon(true);
        watcherThread = thread;
        thread.start();
    }

    private void beginWatching(CompletableFuture<?> delayNotificationsUntilCompleted) {
        logger.debug("Setting up native directory watcher for {}", root);
        try {
            var built = DirectoryWatcher.builder()
                    .path(root)
                    .listener(this::handleEvent)
                    .fileHashing(false)
                    .build();
            watcher = built;

            try {
                delayNotificationsUntilCompleted.get();
            } catch (Exception e) {
                logger.error("Error while waiting for the initial Future to complete", e);
                return;
            }

            logger.info("Starting native directory watcher for: {}", root);
            built.watch(); // blocks until the watcher is closed
        } catch (IOException e) {
            logger.error("Error setting up native directory watcher", e);
        } catch (Exception e) {
            logger.error("Error starting native directory watcher", e);
        }
    }

    private boolean shouldInclude(Path path) {
        try {
            for (var segment : root.relativize(path)) {
                if (excludedDirectories.contains(segment.toString())) {
                    return false;
                }
            }
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private void handleEvent(DirectoryChangeEvent event) {
        if (!running) return;

        try {
            var batch = new EventBatch();
            if (event.eventType() == DirectoryChangeEvent.EventType.OVERFLOW) {
                batch.isOverflowed = true;
            } else {
                Path changedPath = event.path();
                if (changedPath == null || !shouldInclude(changedPath)) {
                    logger.trace("Skipping excluded path: {}", changedPath);
                    return;
                }
                logger.trace("File event: {} on {}", event.eventType(), changedPath);
                batch.files.add(new SourceFile(root, root.relativize(changedPath)));
            }
            for (var listener : listeners) {
                listener.onFilesChanged(batch);
            }
        } catch (Exception e) {
            logger.error("Error handling directory change event", e);
        }
    }

    @Override
    public void addListener(Listener listener) {
        listeners.add(new DebouncingListener(listener, debounceMillis));
    }

    @Override
    public synchronized void close() {
        running = false;
        listeners.forEach(DebouncingListener::close);

        var current = watcher;
        if (current != null) {
            try {
                logger.info("Closing native directory watcher for: {}", root);
                current.close();
            } catch (IOException e) {
                logger.error("Error closing native directory watcher", e);
            }
        }

        var thread = watcherThread;
        if (thread != null) {
            try {
                thread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for watcher thread to stop");
            }
        }
    }
}
