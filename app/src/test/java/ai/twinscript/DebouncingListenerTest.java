package ai.twinscript;

import static org.junit.jupiter.api.Assertions.*;

import ai.twinscript.frontend.SourceFile;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DebouncingListenerTest {

    @TempDir
    Path tempDir;

    private IWatchService.EventBatch batchOf(String... relPaths) {
        var batch = new IWatchService.EventBatch();
        for (var relPath : relPaths) {
            batch.files.add(new SourceFile(tempDir.toAbsolutePath().normalize(), relPath));
        }
        return batch;
    }

    @Test
    void burstIsDeliveredAsOneBatch() throws Exception {
        var delivered = new CopyOnWriteArrayList<IWatchService.EventBatch>();
        var latch = new CountDownLatch(1);
        try (var listener = new DebouncingListener(
                batch -> {
                    delivered.add(batch);
                    latch.countDown();
                },
                200)) {
            listener.onFilesChanged(batchOf("A.cs"));
            listener.onFilesChanged(batchOf("B.cs"));
            listener.onFilesChanged(batchOf("A.cs", "C.cs"));

            assertTrue(latch.await(5, TimeUnit.SECONDS), "batch should be delivered");
            Thread.sleep(400);
        }

        assertEquals(1, delivered.size());
        var names = delivered.get(0).files().stream().map(SourceFile::toString).sorted().toList();
        assertEquals(List.of("A.cs", "B.cs", "C.cs"), names);
    }

    @Test
    void overflowIsCarriedThrough() throws Exception {
        var latch = new CountDownLatch(1);
        var overflowed = new boolean[1];
        try (var listener = new DebouncingListener(
                batch -> {
                    overflowed[0] = batch.isOverflowed();
                    latch.countDown();
                },
                50)) {
            var overflow = new IWatchService.EventBatch();
            overflow.isOverflowed = true;
            listener.onFilesChanged(batchOf("A.cs"));
            listener.onFilesChanged(overflow);
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
        assertTrue(overflowed[0]);
    }

    @Test
    void emptyBatchesAreNotDelivered() throws Exception {
        var calls = new CopyOnWriteArrayList<IWatchService.EventBatch>();
        try (var listener = new DebouncingListener(calls::add, 20)) {
            listener.onFilesChanged(new IWatchService.EventBatch());
            Thread.sleep(300);
        }
        assertTrue(calls.isEmpty());
    }

    @Test
    void delegateFailureDoesNotStopLaterDeliveries() throws Exception {
        var latch = new CountDownLatch(2);
        try (var listener = new DebouncingListener(
                batch -> {
                    latch.countDown();
                    throw new IllegalStateException("listener failure");
                },
                20)) {
            listener.onFilesChanged(batchOf("A.cs"));
            Thread.sleep(300);
            listener.onFilesChanged(batchOf("B.cs"));
            assertTrue(latch.await(5, TimeUnit.SECONDS), "second batch should still be delivered");
        }
    }
}
