package ai.twinscript;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Coalesces single-event notifications into one batch, delivered to the delegate once no new event has arrived for
 * the debounce delay. Delivery happens on one dedicated thread, so the delegate never runs concurrently with itself.
 */
public class DebouncingListener implements IWatchService.Listener, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(DebouncingListener.class);

    private final IWatchService.Listener delegate;
    private final long delayMillis;
    private final ScheduledExecutorService scheduler;

    private IWatchService.EventBatch pending = new IWatchService.EventBatch();

    @Nullable
    private ScheduledFuture<?> scheduled;

    public DebouncingListener(IWatchService.Listener delegate, long delayMillis) {
        this.delegate = delegate;
        this.delayMillis = delayMillis;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("watch-debounce-%d")
                .setDaemon(true)
                .build());
    }

    @Override
    public synchronized void onFilesChanged(IWatchService.EventBatch batch) {
        pending.addAll(batch);
        if (scheduled != null) {
            scheduled.cancel(false);
        }
        scheduled = scheduler.schedule(this::flush, delayMillis, TimeUnit.MILLISECONDS);
    }

    private void flush() {
        IWatchService.EventBatch batch;
        synchronized (this) {
            batch = pending;
            pending = new IWatchService.EventBatch();
            scheduled = null;
        }
        if (batch.isOverflowed() || !batch.files().isEmpty()) {
            logger.trace("Delivering debounced {}", batch);
            try {
                delegate.onFilesChanged(batch);
            } catch (RuntimeException e) {
                logger.error("Error delivering {}", batch, e);
            }
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
