package io.github.clickin.batch.spi;

import io.github.clickin.batch.core.BatchException;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * An operation inside a batch payload, as handed out by a batch writer.
 *
 * <p>Headers keep their insertion order, which is the order they are written in. Names are unique
 * regardless of case: setting an existing name replaces its value in place. Once the writer has
 * written the headers the message is completed and can no longer be modified.
 */
public abstract class BatchOperationMessage {
    private final Map<String, String> headers = new LinkedHashMap<>();
    private final String contentId;
    private final BatchOperationListener listener;
    private final Supplier<OutputStream> contentStreamSource;
    private boolean completed;

    protected BatchOperationMessage(String contentId, BatchOperationListener listener, Supplier<OutputStream> contentStreamSource) {
        this.contentId = contentId;
        this.listener = Objects.requireNonNull(listener, "listener");
        this.contentStreamSource = Objects.requireNonNull(contentStreamSource, "contentStreamSource");
    }

    /**
     * Content-ID of the operation.
     *
     * @return the Content-ID, or {@code null} if the operation has none
     */
    public String contentId() {
        return contentId;
    }

    /**
     * Headers in the order they will be written.
     *
     * @return an unmodifiable view of the headers
     */
    public Map<String, String> headers() {
        return Collections.unmodifiableMap(headers);
    }

    /**
     * Case-insensitive header lookup.
     *
     * @param name the header name
     * @return the header value if present
     */
    public Optional<String> header(String name) {
        if (name == null) return Optional.empty();
        String key = findKey(name);
        return key == null ? Optional.empty() : Optional.of(headers.get(key));
    }

    /**
     * Sets, replaces or (with a {@code null} value) removes a header.
     *
     * @param name the header name
     * @param value the header value, or {@code null} to remove the header
     * @return this message (for chaining)
     */
    public BatchOperationMessage setHeader(String name, String value) {
        Objects.requireNonNull(name, "name");
        verifyNotCompleted();
        String existing = findKey(name);
        if (value == null) {
            if (existing != null) headers.remove(existing);
        } else {
            headers.put(existing == null ? name : existing, value);
        }
        return this;
    }

    /**
     * Requests the stream the operation body is written to. Closing the returned stream ends the body
     * but leaves the batch output open.
     *
     * @return the body stream
     * @throws IOException if pending output cannot be flushed
     */
    public OutputStream getContentStream() throws IOException {
        verifyNotCompleted();
        listener.contentStreamRequested();
        return new BatchOperationOutputStream(contentStreamSource.get(), listener);
    }

    /**
     * Non-blocking variant of {@link #getContentStream()}.
     *
     * @return future completing with the body stream
     */
    public CompletableFuture<OutputStream> getContentStreamAsync() {
        verifyNotCompleted();
        return listener.contentStreamRequestedAsync()
                .thenApply(ignored -> new BatchOperationOutputStream(contentStreamSource.get(), listener));
    }

    /**
     * Called by the writer once the headers have been written.
     */
    public void partHeaderProcessingCompleted() {
        this.completed = true;
    }

    /**
     * @return whether the headers have been written
     */
    public boolean isCompleted() {
        return completed;
    }

    /**
     * Fails with {@link BatchException.Reason#MESSAGE_ALREADY_COMPLETED} once the headers were written.
     */
    protected final void verifyNotCompleted() {
        if (completed) {
            throw new BatchException(BatchException.Reason.MESSAGE_ALREADY_COMPLETED,
                    "The operation message cannot be modified after its headers were written.");
        }
    }

    private String findKey(String name) {
        if (headers.containsKey(name)) return name;
        String target = name.toLowerCase(Locale.ROOT);
        for (String key : headers.keySet()) {
            if (key.toLowerCase(Locale.ROOT).equals(target)) return key;
        }
        return null;
    }
}
