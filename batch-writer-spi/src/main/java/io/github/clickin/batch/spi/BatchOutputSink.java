package io.github.clickin.batch.spi;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.util.concurrent.CompletableFuture;

/**
 * Ordered output of a batch payload.
 *
 * <p>Text (boundaries, preambles) goes through {@link #textWriter()}, operation bodies go to
 * {@link #outputStream()} as raw bytes. Before a body is written the text writer is flushed and
 * detached so both views never interleave; it is re-initialized once the body stream is closed.
 *
 * <p>Implementations are used by a single writer and need not be thread-safe.
 */
public interface BatchOutputSink {

    /**
     * The current text encoder.
     *
     * @return the attached writer
     * @throws IllegalStateException if the text writer is detached
     */
    Writer textWriter();

    /**
     * Byte stream that operation bodies are written to. Closing it must not be required.
     *
     * @return the raw output stream
     */
    OutputStream outputStream();

    /**
     * Pushes encoded text down to {@link #outputStream()} without flushing the transport.
     */
    void flushTextWriter() throws IOException;

    /**
     * Flushes and detaches the text encoder; the caller owns {@link #outputStream()} until
     * {@link #initializeTextWriter()} is called.
     */
    void detachTextWriter() throws IOException;

    /**
     * Attaches a fresh text encoder after a body has been written.
     */
    void initializeTextWriter();

    /**
     * Flushes everything down to the transport, blocking the caller if needed.
     */
    void flush() throws IOException;

    /**
     * Flushes everything down to the transport without blocking the caller.
     *
     * @return future completing when the data was handed to the transport; an {@link IOException}
     *         is reported as the failure cause
     */
    CompletableFuture<Void> flushAsync();
}
