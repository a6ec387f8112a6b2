package com.questrail.radiometer.observability;

/**
 * No-op implementation of SequenceObservabilitySink.
 */
public final class NullObservabilitySink implements SequenceObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSequenceLoaded(SequenceLoadedEvent event) {}

    @Override
    public void onRecordSkipped(RecordSkippedEvent event) {}

    @Override
    public void onError(SequenceErrorEvent event) {}
}
