package io.github.clickin.batch.spi;

import java.io.OutputStream;
import java.util.function.Supplier;

/**
 * A response operation. The status code may be changed until the writer writes the status line.
 */
public final class BatchOperationResponseMessage extends BatchOperationMessage {
    private int statusCode = 200;

    /**
     * Creates a response operation.
     *
     * @param contentId the Content-ID (may be null)
     * @param listener the writer notified around the body stream
     * @param contentStreamSource supplies the stream the body is written to
     */
    public BatchOperationResponseMessage(String contentId, BatchOperationListener listener,
                                         Supplier<OutputStream> contentStreamSource) {
        super(contentId, listener, contentStreamSource);
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * Sets the HTTP status code.
     *
     * @param statusCode the status code
     * @return this message (for chaining)
     * @throws io.github.clickin.batch.core.BatchException if the status line was already written
     */
    public BatchOperationResponseMessage statusCode(int statusCode) {
        verifyNotCompleted();
        if (statusCode < 100 || statusCode > 999) {
            throw new IllegalArgumentException("statusCode must be a three digit code: " + statusCode);
        }
        this.statusCode = statusCode;
        return this;
    }
}
