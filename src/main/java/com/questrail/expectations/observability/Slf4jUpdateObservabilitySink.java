package com.questrail.expectations.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of UpdateObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jUpdateObservabilitySink implements UpdateObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jUpdateObservabilitySink.class);

    @Override
    public void onTestCoalesced(TestCoalescedEvent event) {
        if (!event.outcome().changed()) {
            log.debug("{} [{}]: expectations unchanged", event.testPath(), describe(event));
            return;
        }
        log.info("{} [{}]: {} updated, {} removed, {} added",
            event.testPath(),
            describe(event),
            event.outcome().updated(),
            event.outcome().removed(),
            event.outcome().added());
    }

    @Override
    public void onFileWritten(FileWrittenEvent event) {
        if (event.deleted()) {
            log.info("Deleted empty table {}", event.path());
        } else {
            log.info("Wrote {} ({} tests)", event.path(), event.tests());
        }
    }

    @Override
    public void onError(UpdateErrorEvent event) {
        log.error("Expectation update failed for {}: {}", event.testPath(), event.message(), event.cause());
    }

    private static String describe(TestCoalescedEvent event) {
        return event.subtest() == null ? event.test() : event.test() + " / " + event.subtest();
    }
}
