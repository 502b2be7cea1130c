package io.github.clickin.batch.core;

/**
 * Execution mode chosen when a writer is constructed.
 */
public enum ConcurrencyMode {
    /** Flushing to the transport may block the calling thread. */
    BLOCKING,

    /** Flushing to the transport completes asynchronously through a {@link java.util.concurrent.CompletableFuture}. */
    NON_BLOCKING
}
