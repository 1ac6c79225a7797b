package com.questrail.expectations.observability;

/**
 * No-op implementation of UpdateObservabilitySink.
 */
public final class NullObservabilitySink implements UpdateObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTestCoalesced(TestCoalescedEvent event) {}

    @Override
    public void onFileWritten(FileWrittenEvent event) {}

    @Override
    public void onError(UpdateErrorEvent event) {}
}
