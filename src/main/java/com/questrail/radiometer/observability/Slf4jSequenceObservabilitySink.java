package com.questrail.radiometer.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SequenceObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSequenceObservabilitySink implements SequenceObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSequenceObservabilitySink.class);

    @Override
    public void onSequenceLoaded(SequenceLoadedEvent event) {
        if (event.skippedCount() == 0) {
            log.info("Loaded {}: {} spectra", event.source(), event.recordCount());
        }
        else {
            log.warn("Loaded {}: {} spectra, {} of {} chunks skipped",
                event.source(),
                event.recordCount(),
                event.skippedCount(),
                event.chunkCount());
        }
    }

    @Override
    public void onRecordSkipped(RecordSkippedEvent event) {
        log.warn("Skipped chunk {} of {} at offset {}: {}",
            event.chunk().index(),
            event.source(),
            event.chunk().offset(),
            event.chunk().reason());
    }

    @Override
    public void onError(SequenceErrorEvent event) {
        log.error("Failed to load {}: {}", event.source(), event.message(), event.cause());
    }
}
