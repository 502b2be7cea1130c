package io.github.clickin.batch.spi;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Body stream of a single operation.
 *
 * <p>Writes go straight to the batch output. Closing the stream does not close the batch output,
 * it tells the writer that the body is complete.
 */
public final class BatchOperationOutputStream extends FilterOutputStream {
    private final BatchOperationListener listener;
    private boolean closed;

    public BatchOperationOutputStream(OutputStream out, BatchOperationListener listener) {
        super(out);
        this.listener = listener;
    }

    @Override
    public void write(int b) throws IOException {
        ensureOpen();
        out.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        ensureOpen();
        out.write(b, off, len);
    }

    @Override
    public void flush() throws IOException {
        ensureOpen();
        out.flush();
    }

    @Override
    public void close() throws IOException {
        if (closed) return;
        closed = true;
        listener.contentStreamDisposed();
    }

    private void ensureOpen() throws IOException {
        if (closed) throw new IOException("operation content stream is closed");
    }
}
