package io.github.clickin.batch.engine.multipart;

import io.github.clickin.batch.core.BatchException;
import io.github.clickin.batch.core.BatchException.Reason;
import io.github.clickin.batch.core.BatchWriterState;
import io.github.clickin.batch.core.ConcurrencyMode;
import io.github.clickin.batch.engine.BatchWriters;
import io.github.clickin.batch.spi.BatchOperationRequestMessage;
import io.github.clickin.batch.spi.BatchWriterSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MultipartMixedBatchWriterAsyncTest {

    private static final BatchWriterSettings NON_BLOCKING = BatchWriterSettings.builder()
            .baseUri(URI.create("http://host/service"))
            .concurrencyMode(ConcurrencyMode.NON_BLOCKING)
            .build();

    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void writesBodyThroughAsyncStream() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        MultipartMixedBatchWriter writer = BatchWriters.multipartMixed(out, NON_BLOCKING, executor);

        writer.writeStartBatch();
        BatchOperationRequestMessage post = writer.createOperationRequestMessage("POST", URI.create("Customers"), "1");
        post.setHeader("Content-Type", "text/plain");
        OutputStream body = post.getContentStreamAsync().get(5, TimeUnit.SECONDS);
        assertThat(writer.state()).isEqualTo(BatchWriterState.OPERATION_STREAM_REQUESTED);
        body.write("hello".getBytes(UTF_8));
        body.close();
        writer.writeEndBatch();
        writer.flushAsync().get(5, TimeUnit.SECONDS);

        String b = writer.batchBoundary();
        assertThat(out.toString(UTF_8)).isEqualTo(
                "--" + b + "\r\n"
                        + "Content-Type: application/http\r\n"
                        + "Content-Transfer-Encoding: binary\r\n"
                        + "Content-ID: 1\r\n"
                        + "\r\n"
                        + "POST http://host/service/Customers HTTP/1.1\r\n"
                        + "Content-Type: text/plain\r\n"
                        + "\r\n"
                        + "hello"
                        + "\r\n--" + b + "--\r\n");
    }

    @Test
    void blockingCallsAreRejected() throws IOException {
        MultipartMixedBatchWriter writer = BatchWriters.multipartMixed(new ByteArrayOutputStream(), NON_BLOCKING, executor);
        writer.writeStartBatch();
        BatchOperationRequestMessage post = writer.createOperationRequestMessage("POST", URI.create("Customers"), "1");

        assertThatThrownBy(post::getContentStream).isInstanceOfSatisfying(BatchException.class,
                e -> assertThat(e.reason()).isEqualTo(Reason.SYNC_CALL_ON_ASYNC_WRITER));
        assertThat(writer.state()).isEqualTo(BatchWriterState.ERROR);
    }

    @Test
    void transportFailureSurfacesInFuture() throws IOException {
        MultipartMixedBatchWriter writer = BatchWriters.multipartMixed(new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("connection reset");
            }
        }, NON_BLOCKING, executor);
        writer.writeStartBatch();
        writer.createOperationRequestMessage("GET", URI.create("Customers"), null);

        assertThatThrownBy(() -> writer.flushAsync().get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IOException.class);
        assertThat(writer.state()).isEqualTo(BatchWriterState.OPERATION_CREATED);
    }
}
