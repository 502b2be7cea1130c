package io.github.clickin.batch.engine;

import io.github.clickin.batch.engine.multipart.MultipartMixedBatchWriter;
import io.github.clickin.batch.spi.BatchWriterSettings;

import java.io.OutputStream;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Entry point for creating batch writers over an {@link OutputStream}.
 *
 * <pre>{@code
 * MultipartMixedBatchWriter writer = BatchWriters.multipartMixed(out, BatchWriterSettings.defaults());
 * writer.writeStartBatch();
 * BatchOperationRequestMessage get = writer.createOperationRequestMessage("GET", URI.create("http://host/Customers"), null);
 * writer.writeEndBatch();
 * writer.flush();
 * }</pre>
 */
public final class BatchWriters {
    private BatchWriters() {}

    /**
     * Creates a multipart/mixed writer; asynchronous flushes run on the common fork-join pool.
     */
    public static MultipartMixedBatchWriter multipartMixed(OutputStream out, BatchWriterSettings settings) {
        Objects.requireNonNull(settings, "settings");
        return new MultipartMixedBatchWriter(new OutputStreamBatchSink(out, settings.charset()), settings);
    }

    /**
     * Creates a multipart/mixed writer whose asynchronous flushes run on {@code executor}.
     */
    public static MultipartMixedBatchWriter multipartMixed(OutputStream out, BatchWriterSettings settings, Executor executor) {
        Objects.requireNonNull(settings, "settings");
        return new MultipartMixedBatchWriter(new OutputStreamBatchSink(out, settings.charset(), executor), settings);
    }
}
