package com.questrail.expectations.observability;

/**
 * Main interface for receiving expectation update events.
 * Implementations can provide logging, metrics, or reporting.
 */
public interface UpdateObservabilitySink {
    /**
     * Called after a test's evidence has been folded into its stored expectations.
     * @param event the coalesce details
     */
    void onTestCoalesced(TestCoalescedEvent event);

    /**
     * Called after a table has been written or deleted.
     * @param event the file details
     */
    void onFileWritten(FileWrittenEvent event);

    /**
     * Called when a fatal error aborts part of an update, before it is rethrown.
     * @param event the error event
     */
    void onError(UpdateErrorEvent event);
}
