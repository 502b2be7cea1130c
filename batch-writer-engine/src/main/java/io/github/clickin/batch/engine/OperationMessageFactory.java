package io.github.clickin.batch.engine;

import io.github.clickin.batch.spi.BatchOperationListener;
import io.github.clickin.batch.spi.BatchOperationRequestMessage;
import io.github.clickin.batch.spi.BatchOperationResponseMessage;

import java.io.OutputStream;
import java.net.URI;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Creates operation messages bound to one writer and its body output.
 */
public final class OperationMessageFactory {
    private final BatchOperationListener listener;
    private final Supplier<OutputStream> contentStreamSource;

    /**
     * @param listener the writer notified when a body stream is requested and closed
     * @param contentStreamSource supplies the stream operation bodies are written to
     */
    public OperationMessageFactory(BatchOperationListener listener, Supplier<OutputStream> contentStreamSource) {
        this.listener = Objects.requireNonNull(listener, "listener");
        this.contentStreamSource = Objects.requireNonNull(contentStreamSource, "contentStreamSource");
    }

    public BatchOperationRequestMessage newRequest(String method, URI uri, String contentId) {
        return new BatchOperationRequestMessage(method, uri, contentId, listener, contentStreamSource);
    }

    public BatchOperationResponseMessage newResponse(String contentId) {
        return new BatchOperationResponseMessage(contentId, listener, contentStreamSource);
    }
}
