package io.github.clickin.batch.engine.multipart;

import io.github.clickin.batch.engine.BatchWriters;
import io.github.clickin.batch.engine.multipart.MultipartBatchTestReader.Operation;
import io.github.clickin.batch.spi.BatchOperationRequestMessage;
import io.github.clickin.batch.spi.BatchWriterSettings;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

class MultipartMixedRoundTripTest {

    @Test
    void readerSeesEveryOperation() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        MultipartMixedBatchWriter writer = BatchWriters.multipartMixed(out,
                BatchWriterSettings.builder().baseUri(URI.create("http://host/service/")).build());

        writer.writeStartBatch();
        writer.createOperationRequestMessage("GET", URI.create("Customers"), null)
                .setHeader("Accept", "application/json");
        writer.writeStartChangeset();
        BatchOperationRequestMessage post = writer.createOperationRequestMessage("POST", URI.create("Customers"), "c1");
        post.setHeader("Content-Type", "application/json");
        try (OutputStream body = post.getContentStream()) {
            body.write("{\"Name\":\"Ann\"}".getBytes(UTF_8));
        }
        BatchOperationRequestMessage link = writer.createOperationRequestMessage("POST", URI.create("$c1/Orders"), "c2");
        link.setHeader("Content-Type", "application/json");
        try (OutputStream body = link.getContentStream()) {
            body.write("{\"Total\":3}".getBytes(UTF_8));
        }
        writer.writeEndChangeset();
        writer.createOperationRequestMessage("DELETE", URI.create("Customers(7)"), "d1");
        writer.writeEndBatch();
        writer.flush();

        List<Operation> operations = MultipartBatchTestReader.read(out.toString(UTF_8), writer.batchBoundary());

        assertThat(operations).hasSize(4);
        String changeset = operations.get(1).changeset();
        assertThat(changeset).startsWith("changeset_");
        assertThat(operations).containsExactly(
                new Operation(null, null, "GET http://host/service/Customers HTTP/1.1",
                        Map.of("Accept", "application/json"), ""),
                new Operation(changeset, "c1", "POST http://host/service/Customers HTTP/1.1",
                        Map.of("Content-Type", "application/json"), "{\"Name\":\"Ann\"}"),
                new Operation(changeset, "c2", "POST $c1/Orders HTTP/1.1",
                        Map.of("Content-Type", "application/json"), "{\"Total\":3}"),
                new Operation(null, "d1", "DELETE http://host/service/Customers(7) HTTP/1.1", Map.of(), ""));
    }
}
