package io.github.clickin.batch.core;

/**
 * States of a batch writer.
 *
 * <p>{@link #START} is the initial state, {@link #BATCH_COMPLETED} and {@link #ERROR} are terminal.
 */
public enum BatchWriterState {
    /** Nothing has been written yet. */
    START,

    /** The batch has been started; no bytes have been written. */
    BATCH_STARTED,

    /** A changeset has been started and is still open. */
    CHANGESET_STARTED,

    /** An operation message has been created; its headers may still be pending. */
    OPERATION_CREATED,

    /** The caller owns the output and is writing the operation body. */
    OPERATION_STREAM_REQUESTED,

    /** The operation body has been written and its stream closed. */
    OPERATION_STREAM_DISPOSED,

    /** The current changeset has been closed. */
    CHANGESET_COMPLETED,

    /** The batch has been closed. */
    BATCH_COMPLETED,

    /** The writer failed; it cannot be used anymore. */
    ERROR;

    /**
     * Whether no further transition out of this state exists.
     *
     * @return {@code true} for {@link #BATCH_COMPLETED} and {@link #ERROR}
     */
    public boolean isTerminal() {
        return this == BATCH_COMPLETED || this == ERROR;
    }
}
