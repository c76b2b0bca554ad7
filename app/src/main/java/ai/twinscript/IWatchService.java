package ai.twinscript;

import ai.twinscript.frontend.SourceFile;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

public interface IWatchService extends AutoCloseable {
    /** Starts watching; notifications are held back until the given future completes. */
    default void start(CompletableFuture<?> delayNotificationsUntilCompleted) {}

    default void addListener(Listener listener) {}

    default void removeListener(Listener listener) {}

    @Override
    default void close() {}

    interface Listener {
        void onFilesChanged(EventBatch batch);

        default void onNoFilesChangedDuringPollInterval() {}
    }

    /** mutable since we will collect events until they stop arriving */
    class EventBatch {
        boolean isOverflowed;
        final Set<SourceFile> files = new HashSet<>();

        public boolean isOverflowed() {
            return isOverflowed;
        }

        public Set<SourceFile> files() {
            return files;
        }

        void addAll(EventBatch other) {
            isOverflowed |= other.isOverflowed;
            files.addAll(other.files);
        }

        @Override
        public String toString() {
            return "EventBatch{" + "isOverflowed=" + isOverflowed + ", files=" + files + '}';
        }
    }
}
