package com.questrail.radiometer.reader;

import com.questrail.radiometer.model.SpectrumFile;
import org.junit.jupiter.api.Test;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static com.questrail.radiometer.codec.SpectrumChunkFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AsyncSequenceLoader}, driven by a manual executor so
 * task ordering is deterministic.
 */
final class AsyncSequenceLoaderTest
{
    private static final Path FIRST = Path.of("SEQ_0001.spe");
    private static final Path SECOND = Path.of("SEQ_0002.spe");
    private static final Path CORRUPT = Path.of("SEQ_0003.spe");

    private final ManualExecutor executor = new ManualExecutor();

    private final Map<Path, byte[]> files = Map.of(
            FIRST, concat(visChunk(1L, 1)),
            SECOND, concat(visChunk(2L, 2), visChunk(3L, 3)),
            CORRUPT, new byte[] { 0x01 });

    private final SequenceReader reader = SequenceReader.builder()
            .withSource(path -> {
                byte[] bytes = files.get(path);
                if (bytes == null) {
                    throw new NoSuchFileException(path.toString());
                }
                return bytes;
            })
            .build();

    private final AsyncSequenceLoader loader = new AsyncSequenceLoader(reader, executor);

    @Test
    void completesWithDecodedFile() throws Exception
    {
        CompletableFuture<SpectrumFile> future = loader.load(SECOND);
        assertFalse(future.isDone());

        executor.runAll();

        assertEquals(2, future.get().size());
    }

    @Test
    void laterRequestSupersedesPendingOne() throws Exception
    {
        CompletableFuture<SpectrumFile> first = loader.load(FIRST);
        CompletableFuture<SpectrumFile> second = loader.load(SECOND);

        executor.runAll();

        assertTrue(first.isCancelled());
        assertEquals("SEQ_0002.spe", second.get().source());
    }

    @Test
    void discardPendingCancelsOutstandingLoad()
    {
        CompletableFuture<SpectrumFile> future = loader.load(FIRST);

        loader.discardPending();
        executor.runAll();

        assertTrue(future.isCancelled());
    }

    @Test
    void loadFailureCompletesExceptionally()
    {
        CompletableFuture<SpectrumFile> future = loader.load(CORRUPT);

        executor.runAll();

        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(SequenceLoadException.class, e.getCause());
    }

    @Test
    void rejectedSubmissionCompletesExceptionally()
    {
        AsyncSequenceLoader rejecting = new AsyncSequenceLoader(reader, task -> {
            throw new RejectedExecutionException("shut down");
        });

        CompletableFuture<SpectrumFile> future = rejecting.load(FIRST);

        assertTrue(future.isCompletedExceptionally());
    }

    private static final class ManualExecutor implements Executor
    {
        private final Deque<Runnable> tasks = new ArrayDeque<>();

        @Override
        public void execute(Runnable task)
        {
            tasks.add(task);
        }

        void runAll()
        {
            while (!tasks.isEmpty()) {
                tasks.poll().run();
            }
        }
    }
}
