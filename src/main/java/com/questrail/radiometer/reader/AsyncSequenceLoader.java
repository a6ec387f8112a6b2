package com.questrail.radiometer.reader;

import com.questrail.radiometer.model.SpectrumFile;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * AsyncSequenceLoader
 * =============================================================================
 * Runs {@link SequenceReader#load(Path)} on a worker executor so that a caller
 * such as a UI thread stays responsive while large files decode.
 *
 * <h2>Latest request wins</h2>
 * <p>Every call to {@link #load(Path)} supersedes all earlier ones. A superseded
 * load is not interrupted; its result is discarded when it finishes and its
 * future completes with a {@link java.util.concurrent.CancellationException}. A
 * load superseded before it starts never runs.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own or manage the lifecycle of the
 * provided executor. Callers are responsible for shutdown.</p>
 */
public final class AsyncSequenceLoader
{
    private final SequenceReader reader;
    private final Executor executor;
    private final AtomicLong generation = new AtomicLong();

    public AsyncSequenceLoader(SequenceReader reader, Executor executor) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Schedules a load of {@code path}, superseding any load still pending.
     *
     * @return a future completing with the decoded file, exceptionally with
     *         {@link SequenceLoadException} on failure, or cancelled if superseded
     */
    public CompletableFuture<SpectrumFile> load(Path path) {
        Objects.requireNonNull(path, "path");
        final long ticket = generation.incrementAndGet();
        final CompletableFuture<SpectrumFile> result = new CompletableFuture<>();

        try {
            executor.execute(() -> run(ticket, path, result));
        }
        catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Discards the results of all pending loads.
     */
    public void discardPending() {
        generation.incrementAndGet();
    }

    private void run(long ticket, Path path, CompletableFuture<SpectrumFile> result) {
        if (isSuperseded(ticket)) {
            result.cancel(false);
            return;
        }

        try {
            SpectrumFile file = reader.load(path);
            if (isSuperseded(ticket)) {
                result.cancel(false);
            }
            else {
                result.complete(file);
            }
        }
        catch (SequenceLoadException | RuntimeException e) {
            if (isSuperseded(ticket)) {
                result.cancel(false);
            }
            else {
                result.completeExceptionally(e);
            }
        }
    }

    private boolean isSuperseded(long ticket) {
        return generation.get() != ticket;
    }
}
