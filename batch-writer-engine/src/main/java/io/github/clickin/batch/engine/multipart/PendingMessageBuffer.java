package io.github.clickin.batch.engine.multipart;

import io.github.clickin.batch.core.BatchProtocol;
import io.github.clickin.batch.spi.BatchOperationMessage;
import io.github.clickin.batch.spi.BatchOperationRequestMessage;
import io.github.clickin.batch.spi.BatchOperationResponseMessage;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;

/**
 * The operation currently open and the part of its preamble not written yet.
 *
 * <p>Callers may set headers (and a response status) after the operation is created, so the
 * status line and headers are written only when the writer reaches the next flush point. At most
 * one of request and response is held at any time.
 */
final class PendingMessageBuffer {
    private BatchOperationRequestMessage request;
    private BatchOperationResponseMessage response;
    private boolean written;

    void attach(BatchOperationRequestMessage message) {
        this.request = message;
        this.response = null;
        this.written = false;
    }

    void attach(BatchOperationResponseMessage message) {
        this.request = null;
        this.response = message;
        this.written = false;
    }

    BatchOperationMessage current() {
        return request != null ? request : response;
    }

    boolean isEmpty() {
        return current() == null;
    }

    /**
     * Writes the pending status line, headers and blank line once.
     *
     * @param reportCompleted whether the operation is finished; its handles are released afterwards
     */
    void write(Writer writer, boolean reportCompleted) throws IOException {
        BatchOperationMessage message = current();
        if (message == null) return;

        if (!written) {
            if (response != null) {
                MultipartMixedWriterUtils.writeStatusLine(writer, response.statusCode());
            }
            for (Map.Entry<String, String> header : message.headers().entrySet()) {
                MultipartMixedWriterUtils.writeHeader(writer, header.getKey(), header.getValue());
            }
            writer.write(BatchProtocol.CRLF);
            written = true;
            message.partHeaderProcessingCompleted();
        }

        if (reportCompleted) {
            clear();
        }
    }

    void clear() {
        request = null;
        response = null;
        written = false;
    }
}
