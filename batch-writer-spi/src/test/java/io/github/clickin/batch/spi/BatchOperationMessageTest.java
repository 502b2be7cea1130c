package io.github.clickin.batch.spi;

import io.github.clickin.batch.core.BatchException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchOperationMessageTest {

    private final RecordingListener listener = new RecordingListener();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    @Test
    void headersKeepInsertionOrderAndReplaceInPlace() {
        BatchOperationRequestMessage message = request();
        message.setHeader("Content-Type", "application/json")
                .setHeader("Accept", "application/json")
                .setHeader("content-type", "text/plain");

        assertThat(message.headers()).containsExactly(
                Map.entry("Content-Type", "text/plain"),
                Map.entry("Accept", "application/json"));
        assertThat(message.header("CONTENT-TYPE")).hasValue("text/plain");
    }

    @Test
    void nullValueRemovesHeader() {
        BatchOperationRequestMessage message = request();
        message.setHeader("Accept", "application/json");
        message.setHeader("accept", null);

        assertThat(message.headers()).isEmpty();
    }

    @Test
    void completedMessageRejectsChanges() {
        BatchOperationRequestMessage message = request();
        message.partHeaderProcessingCompleted();

        assertThatThrownBy(() -> message.setHeader("Accept", "*/*"))
                .isInstanceOfSatisfying(BatchException.class,
                        e -> assertThat(e.reason()).isEqualTo(BatchException.Reason.MESSAGE_ALREADY_COMPLETED));
    }

    @Test
    void contentStreamNotifiesListenerAndLeavesOutputOpen() throws Exception {
        BatchOperationRequestMessage message = request();

        try (OutputStream body = message.getContentStream()) {
            body.write("{}".getBytes(StandardCharsets.UTF_8));
        }

        assertThat(listener.requested).isEqualTo(1);
        assertThat(listener.disposed).isEqualTo(1);
        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("{}");
    }

    @Test
    void closingTwiceDisposesOnce() throws Exception {
        OutputStream body = request().getContentStream();
        body.close();
        body.close();

        assertThat(listener.disposed).isEqualTo(1);
    }

    @Test
    void responseStatusMustHaveThreeDigits() {
        BatchOperationResponseMessage response = new BatchOperationResponseMessage(null, listener, () -> out);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.statusCode(201).statusCode()).isEqualTo(201);
        assertThatThrownBy(() -> response.statusCode(42)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void completedResponseRejectsStatusChange() {
        BatchOperationResponseMessage response = new BatchOperationResponseMessage(null, listener, () -> out);
        response.statusCode(201);
        response.partHeaderProcessingCompleted();

        assertThatThrownBy(() -> response.statusCode(500))
                .isInstanceOfSatisfying(BatchException.class,
                        e -> assertThat(e.reason()).isEqualTo(BatchException.Reason.MESSAGE_ALREADY_COMPLETED));
        assertThat(response.statusCode()).isEqualTo(201);
    }

    private BatchOperationRequestMessage request() {
        return new BatchOperationRequestMessage("POST", URI.create("Customers"), "1", listener, () -> out);
    }

    private static final class RecordingListener implements BatchOperationListener {
        private int requested;
        private int disposed;

        @Override
        public void contentStreamRequested() {
            requested++;
        }

        @Override
        public CompletableFuture<Void> contentStreamRequestedAsync() {
            requested++;
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void contentStreamDisposed() {
            disposed++;
        }
    }
}
