package io.github.clickin.batch.spi;

import java.io.OutputStream;
import java.net.URI;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A request operation. Method and URI are fixed when the operation is created.
 */
public final class BatchOperationRequestMessage extends BatchOperationMessage {
    private final String method;
    private final URI uri;

    /**
     * Creates a request operation.
     *
     * @param method the HTTP method
     * @param uri the resolved request URI
     * @param contentId the Content-ID (may be null)
     * @param listener the writer notified around the body stream
     * @param contentStreamSource supplies the stream the body is written to
     */
    public BatchOperationRequestMessage(String method, URI uri, String contentId,
                                        BatchOperationListener listener, Supplier<OutputStream> contentStreamSource) {
        super(contentId, listener, contentStreamSource);
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
    }

    public String method() {
        return method;
    }

    public URI uri() {
        return uri;
    }
}
