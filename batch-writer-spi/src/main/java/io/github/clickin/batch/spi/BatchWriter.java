package io.github.clickin.batch.spi;

import io.github.clickin.batch.core.BatchPayloadUriOption;
import io.github.clickin.batch.core.BatchWriterState;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Writer of a single batch payload.
 *
 * <p>Calls must follow the batch grammar:
 * <pre>{@code
 * writeStartBatch
 *   ( createOperation* | writeStartChangeset createOperation* writeEndChangeset )*
 * writeEndBatch
 * }</pre>
 * A writer is single-use, bound to one output for its whole life and not thread-safe. Any rule
 * violation throws {@link io.github.clickin.batch.core.BatchException} and leaves the writer in
 * {@link BatchWriterState#ERROR}, after which every call fails.
 *
 * <p>Implementations exist per encoding (multipart/mixed, JSON) and share their validation rules.
 */
public interface BatchWriter extends BatchOperationListener {

    /**
     * Starts the batch. Nothing is written yet.
     */
    void writeStartBatch();

    /**
     * Ends the batch and flushes the text encoder.
     */
    void writeEndBatch() throws IOException;

    /**
     * Opens a changeset (an atomic group of operations). Changesets cannot be nested.
     */
    void writeStartChangeset() throws IOException;

    /**
     * Closes the open changeset.
     */
    void writeEndChangeset() throws IOException;

    /**
     * Creates a request operation using the configured URI option.
     *
     * @param method the HTTP method
     * @param uri the request URI, absolute, relative to the base URI or a {@code $id} reference
     * @param contentId the Content-ID; required inside a changeset
     * @return the request message whose headers and body the caller fills in
     */
    BatchOperationRequestMessage createOperationRequestMessage(String method, URI uri, String contentId) throws IOException;

    /**
     * Creates a request operation.
     *
     * @param method the HTTP method
     * @param uri the request URI, absolute, relative to the base URI or a {@code $id} reference
     * @param contentId the Content-ID; required inside a changeset
     * @param payloadUriOption how an absolute URI is written
     * @return the request message whose headers and body the caller fills in
     */
    BatchOperationRequestMessage createOperationRequestMessage(String method, URI uri, String contentId,
                                                               BatchPayloadUriOption payloadUriOption) throws IOException;

    /**
     * Creates a response operation.
     *
     * @param contentId the Content-ID of the request this responds to (may be null)
     * @return the response message whose status, headers and body the caller fills in
     */
    BatchOperationResponseMessage createOperationResponseMessage(String contentId) throws IOException;

    /**
     * Flushes written data to the transport. Only allowed on blocking writers.
     */
    void flush() throws IOException;

    /**
     * Flushes written data to the transport. Only allowed on non-blocking writers.
     *
     * @return future completing once the data reached the transport
     */
    CompletableFuture<Void> flushAsync();

    /**
     * Reports an error that happened while producing the batch. Always fails: the batch format has no
     * way to carry an error outside of an operation body.
     *
     * @throws io.github.clickin.batch.core.BatchException always
     */
    void onInStreamError();

    /**
     * @return the current writer state
     */
    BatchWriterState state();
}
