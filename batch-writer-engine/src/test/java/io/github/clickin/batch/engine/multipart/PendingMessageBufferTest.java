package io.github.clickin.batch.engine.multipart;

import io.github.clickin.batch.engine.OperationMessageFactory;
import io.github.clickin.batch.spi.BatchOperationListener;
import io.github.clickin.batch.spi.BatchOperationRequestMessage;
import io.github.clickin.batch.spi.BatchOperationResponseMessage;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.net.URI;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class PendingMessageBufferTest {

    private final OperationMessageFactory messages = new OperationMessageFactory(new IdleListener(), ByteArrayOutputStream::new);
    private final PendingMessageBuffer pending = new PendingMessageBuffer();
    private final StringWriter out = new StringWriter();

    @Test
    void writesHeadersOnceThenReleases() throws IOException {
        BatchOperationRequestMessage request = messages.newRequest("POST", URI.create("http://host/Customers"), "1");
        request.setHeader("Content-Type", "application/json");
        pending.attach(request);

        pending.write(out, false);
        pending.write(out, false);

        assertThat(out.toString()).isEqualTo("Content-Type: application/json\r\n\r\n");
        assertThat(request.isCompleted()).isTrue();
        assertThat(pending.current()).isSameAs(request);

        pending.write(out, true);
        assertThat(out.toString()).isEqualTo("Content-Type: application/json\r\n\r\n");
        assertThat(pending.isEmpty()).isTrue();
    }

    @Test
    void responseGetsStatusLineFirst() throws IOException {
        BatchOperationResponseMessage response = messages.newResponse(null);
        response.statusCode(404).setHeader("Content-Length", "0");
        pending.attach(response);

        pending.write(out, true);

        assertThat(out.toString()).isEqualTo("HTTP/1.1 404 Not Found\r\nContent-Length: 0\r\n\r\n");
        assertThat(pending.isEmpty()).isTrue();
    }

    @Test
    void holdsAtMostOneMessage() {
        BatchOperationRequestMessage request = messages.newRequest("GET", URI.create("http://host/A"), null);
        BatchOperationResponseMessage response = messages.newResponse(null);

        pending.attach(request);
        pending.attach(response);

        assertThat(pending.current()).isSameAs(response);
    }

    @Test
    void emptyBufferWritesNothing() throws IOException {
        pending.write(out, true);

        assertThat(out.toString()).isEmpty();
    }

    private static final class IdleListener implements BatchOperationListener {
        @Override
        public void contentStreamRequested() {
        }

        @Override
        public CompletableFuture<Void> contentStreamRequestedAsync() {
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void contentStreamDisposed() {
        }
    }
}
