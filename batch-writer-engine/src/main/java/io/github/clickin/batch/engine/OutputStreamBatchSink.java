package io.github.clickin.batch.engine;

import io.github.clickin.batch.spi.BatchOutputSink;

import java.io.BufferedOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * {@link BatchOutputSink} over a plain {@link OutputStream}.
 *
 * <p>Text and bodies share one buffer in front of the transport stream. Flushing the text writer
 * only moves encoded bytes into that buffer; {@link #flush()} and {@link #flushAsync()} are the
 * only calls that flush the transport. {@link #flushAsync()} runs the blocking flush on the given
 * executor.
 *
 * <p>The transport stream is never closed by this class.
 */
public final class OutputStreamBatchSink implements BatchOutputSink {
    private final BufferedOutputStream buffered;
    private final OutputStream textTarget;
    private final Charset charset;
    private final Executor executor;
    private Writer textWriter;

    /**
     * Creates a sink whose asynchronous flushes run on the common fork-join pool.
     *
     * @param out the transport stream
     * @param charset encoding of boundaries and preambles
     */
    public OutputStreamBatchSink(OutputStream out, Charset charset) {
        this(out, charset, ForkJoinPool.commonPool());
    }

    /**
     * @param out the transport stream
     * @param charset encoding of boundaries and preambles
     * @param executor runs {@link #flushAsync()}
     */
    public OutputStreamBatchSink(OutputStream out, Charset charset, Executor executor) {
        this.buffered = new BufferedOutputStream(Objects.requireNonNull(out, "out"));
        this.textTarget = new NonFlushingOutputStream(buffered);
        this.charset = Objects.requireNonNull(charset, "charset");
        this.executor = Objects.requireNonNull(executor, "executor");
        initializeTextWriter();
    }

    @Override
    public Writer textWriter() {
        if (textWriter == null) {
            throw new IllegalStateException("The text writer is detached while an operation body is being written.");
        }
        return textWriter;
    }

    @Override
    public OutputStream outputStream() {
        return buffered;
    }

    @Override
    public void flushTextWriter() throws IOException {
        if (textWriter != null) textWriter.flush();
    }

    @Override
    public void detachTextWriter() throws IOException {
        flushTextWriter();
        textWriter = null;
    }

    @Override
    public void initializeTextWriter() {
        if (textWriter == null) {
            textWriter = new OutputStreamWriter(textTarget, charset);
        }
    }

    @Override
    public void flush() throws IOException {
        flushTextWriter();
        buffered.flush();
    }

    @Override
    public CompletableFuture<Void> flushAsync() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                flush();
                future.complete(null);
            } catch (IOException | RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    /** Lets the encoder push bytes into the shared buffer without flushing the transport. */
    private static final class NonFlushingOutputStream extends FilterOutputStream {
        NonFlushingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    }
}
