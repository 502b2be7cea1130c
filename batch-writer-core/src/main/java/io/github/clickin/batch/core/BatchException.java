package io.github.clickin.batch.core;

import java.util.Objects;

/**
 * Raised when a batch writer is used in a way the batch format does not allow.
 *
 * <p>All violations surface as this single unchecked type; {@link #reason()} tells them apart.
 * Transport failures are not reported through this class, they propagate as {@link java.io.IOException}.
 */
public class BatchException extends RuntimeException {

    /**
     * Reason codes of an invalid batch operation.
     */
    public enum Reason {
        /** The requested call is not legal in the writer's current state. */
        INVALID_STATE_TRANSITION,
        /** A changeset was started while another one is open. */
        CHANGESET_ALREADY_ACTIVE,
        /** A changeset was ended while none is open. */
        NO_ACTIVE_CHANGESET,
        /** The batch was ended while a changeset is still open. */
        ACTIVE_CHANGESET_AT_BATCH_END,
        /** A query method was used for a request inside a changeset. */
        INVALID_METHOD_IN_CHANGESET,
        /** A request inside a changeset carries no Content-ID. */
        MISSING_CONTENT_ID,
        /** An in-stream error was reported; the batch format cannot represent it. */
        IN_STREAM_ERROR,
        /** The HTTP method is not supported for batch operations. */
        INVALID_HTTP_METHOD,
        /** The Content-ID was already used by an earlier operation of the batch. */
        DUPLICATE_CONTENT_ID,
        /** A {@code $id} reference names an operation that has not been written. */
        UNRESOLVED_CONTENT_ID_REFERENCE,
        /** A relative operation URI cannot be resolved because no base URI is configured. */
        RELATIVE_URI_WITHOUT_BASE_URI,
        /** The batch has more parts than allowed. */
        MAX_BATCH_SIZE_EXCEEDED,
        /** The changeset has more operations than allowed. */
        MAX_CHANGESET_SIZE_EXCEEDED,
        /** A request operation was created on a writer that writes responses. */
        REQUEST_ON_RESPONSE_WRITER,
        /** A response operation was created on a writer that writes requests. */
        RESPONSE_ON_REQUEST_WRITER,
        /** A blocking call was made on a non-blocking writer. */
        SYNC_CALL_ON_ASYNC_WRITER,
        /** An asynchronous call was made on a blocking writer. */
        ASYNC_CALL_ON_SYNC_WRITER,
        /** The writer was flushed while the caller owns the operation body stream. */
        FLUSH_IN_STREAM_REQUESTED_STATE,
        /** An operation message was modified after its headers were written. */
        MESSAGE_ALREADY_COMPLETED
    }

    private final Reason reason;

    public BatchException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    /**
     * Why the operation was rejected.
     *
     * @return the reason code
     */
    public Reason reason() {
        return reason;
    }
}
