package com.previewstudio.orchestrator.event;

/**
 * Handle returned by {@link JobEventBus#subscribe}; closing it removes exactly
 * the handler it was created for. Closing twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
