package com.questrail.radiometer.observability;

/**
 * Receives observability events from the sequence reader.
 * Implementations can provide logging, metrics, or UI status reporting.
 */
public interface SequenceObservabilitySink {
    /**
     * Called after a sequence file has been decoded.
     * @param event load summary
     */
    void onSequenceLoaded(SequenceLoadedEvent event);

    /**
     * Called when a record is dropped under the skip policy.
     * @param event the skipped chunk and the decode failure
     */
    void onRecordSkipped(RecordSkippedEvent event);

    /**
     * Called when a sequence file load fails.
     * @param event the error event
     */
    void onError(SequenceErrorEvent event);
}
