package io.github.clickin.batch.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.clickin.batch.core.BatchException;
import io.github.clickin.batch.core.BatchPayloadUriOption;
import io.github.clickin.batch.core.BatchProtocol;
import io.github.clickin.batch.core.BatchWriterState;
import io.github.clickin.batch.engine.BatchStateMachine;
import io.github.clickin.batch.engine.BoundaryAllocator;
import io.github.clickin.batch.engine.ContentIdReferenceResolver;
import io.github.clickin.batch.engine.OperationMessageFactory;
import io.github.clickin.batch.engine.RequestUris;
import io.github.clickin.batch.spi.BatchOperationMessage;
import io.github.clickin.batch.spi.BatchOperationRequestMessage;
import io.github.clickin.batch.spi.BatchOperationResponseMessage;
import io.github.clickin.batch.spi.BatchOutputSink;
import io.github.clickin.batch.spi.BatchWriter;
import io.github.clickin.batch.spi.BatchWriterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Batch writer for the JSON batch format.
 *
 * <p>Output shape:
 * <pre>{@code
 * {"requests":[
 *   {"id":"1","atomicityGroup":"changeset_...","method":"POST","url":"http://host/service/Customers",
 *    "headers":{"Content-Type":"application/json"},"body":{"Name":"Ann"}}
 * ]}
 * }</pre>
 * A response batch uses {@code "responses"} and carries {@code "status"} instead of method and url.
 *
 * <p>Operation bodies are buffered while their content stream is open and written when the stream
 * is closed: JSON media types as JSON values, {@code text/*} as strings and anything else as
 * base64. The text writer of the sink is never detached.
 */
public final class JsonBatchWriter implements BatchWriter {
    private static final Logger logger = LoggerFactory.getLogger(JsonBatchWriter.class);

    private static final String F_REQUESTS = "requests";
    private static final String F_RESPONSES = "responses";
    private static final String F_ID = "id";
    private static final String F_ATOMICITY_GROUP = "atomicityGroup";
    private static final String F_METHOD = "method";
    private static final String F_URL = "url";
    private static final String F_STATUS = "status";
    private static final String F_HEADERS = "headers";
    private static final String F_BODY = "body";

    private final BatchOutputSink sink;
    private final BatchWriterSettings settings;
    private final BoundaryAllocator boundaries;
    private final ObjectMapper mapper;
    private final JsonGenerator generator;
    private final BatchStateMachine stateMachine;
    private final ContentIdReferenceResolver contentIds;
    private final OperationMessageFactory messages;

    private boolean batchStartWritten;
    /** Non-null exactly while a changeset is open. */
    private String atomicityGroup;

    private BatchOperationMessage pendingMessage;
    private String pendingHost;
    private boolean pendingHeadersWritten;
    private ByteArrayOutputStream pendingBody;

    private String currentOperationContentId;
    private URI currentOperationUri;

    public JsonBatchWriter(BatchOutputSink sink, BatchWriterSettings settings) {
        this(sink, settings, new ObjectMapper(new JsonFactory()), new BoundaryAllocator());
    }

    /**
     * @param sink output of the batch
     * @param settings writer settings
     * @param mapper mapper used to parse JSON bodies and create the generator
     * @param boundaries source of atomicity group names and generated ids
     */
    public JsonBatchWriter(BatchOutputSink sink, BatchWriterSettings settings, ObjectMapper mapper,
                           BoundaryAllocator boundaries) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.boundaries = Objects.requireNonNull(boundaries, "boundaries");
        this.stateMachine = new BatchStateMachine(settings);
        this.contentIds = new ContentIdReferenceResolver(settings.payloadUriConverter());
        this.messages = new OperationMessageFactory(this, this::openBodyBuffer);
        try {
            this.generator = mapper.getFactory().createGenerator(sink.textWriter())
                    .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create the JSON generator", e);
        }
    }

    /**
     * @return {@code application/json}
     */
    public String batchContentType() {
        return BatchProtocol.CT_APPLICATION_JSON;
    }

    @Override
    public BatchWriterState state() {
        return stateMachine.state();
    }

    @Override
    public void writeStartBatch() {
        stateMachine.transitionTo(BatchWriterState.BATCH_STARTED, false);
    }

    @Override
    public void writeStartChangeset() throws IOException {
        stateMachine.validateTransition(BatchWriterState.CHANGESET_STARTED, changesetActive());
        stateMachine.countChangeset();

        finishPendingMessage();
        atomicityGroup = boundaries.changesetBoundary(settings.writingResponse());
        stateMachine.setState(BatchWriterState.CHANGESET_STARTED);
        logger.debug("started atomicity group {}", atomicityGroup);
    }

    @Override
    public void writeEndChangeset() throws IOException {
        stateMachine.validateTransition(BatchWriterState.CHANGESET_COMPLETED, changesetActive());

        finishPendingMessage();
        atomicityGroup = null;
        currentOperationContentId = null;
        currentOperationUri = null;
        stateMachine.setState(BatchWriterState.CHANGESET_COMPLETED);
    }

    @Override
    public void writeEndBatch() throws IOException {
        stateMachine.validateTransition(BatchWriterState.BATCH_COMPLETED, changesetActive());

        finishPendingMessage();
        stateMachine.setState(BatchWriterState.BATCH_COMPLETED);

        writeBatchStart();
        generator.writeEndArray();
        generator.writeEndObject();
        generator.flush();
    }

    @Override
    public BatchOperationRequestMessage createOperationRequestMessage(String method, URI uri, String contentId) throws IOException {
        return createOperationRequestMessage(method, uri, contentId, settings.payloadUriOption());
    }

    @Override
    public BatchOperationRequestMessage createOperationRequestMessage(String method, URI uri, String contentId,
                                                                      BatchPayloadUriOption payloadUriOption) throws IOException {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(payloadUriOption, "payloadUriOption");
        String id = emptyToNull(contentId);
        boolean inChangeset = changesetActive();
        stateMachine.verifyCanCreateRequest(method, id, inChangeset);
        stateMachine.verifyUniqueContentId(id);
        stateMachine.validateTransition(BatchWriterState.OPERATION_CREATED, inChangeset);
        stateMachine.countOperation(inChangeset);

        finishPendingMessage();

        if (currentOperationContentId != null) {
            contentIds.register(currentOperationContentId, currentOperationUri);
        }
        URI resolved = stateMachine.intercept(() -> contentIds.resolve(uri, settings.baseUri(), inChangeset));

        BatchOperationRequestMessage message = messages.newRequest(method, resolved, id);
        attach(message);
        pendingHost = RequestUris.usesHostHeader(resolved, payloadUriOption) ? RequestUris.hostHeaderValue(resolved) : null;
        currentOperationContentId = id;
        currentOperationUri = resolved;
        stateMachine.setState(BatchWriterState.OPERATION_CREATED);

        writeOperationStart(id);
        generator.writeStringField(F_METHOD, method);
        generator.writeStringField(F_URL, RequestUris.requestTarget(resolved, settings.baseUri(), payloadUriOption));
        return message;
    }

    @Override
    public BatchOperationResponseMessage createOperationResponseMessage(String contentId) throws IOException {
        boolean inChangeset = changesetActive();
        stateMachine.verifyCanCreateResponse();
        stateMachine.validateTransition(BatchWriterState.OPERATION_CREATED, inChangeset);
        stateMachine.countOperation(inChangeset);

        finishPendingMessage();

        BatchOperationResponseMessage message = messages.newResponse(emptyToNull(contentId));
        attach(message);
        stateMachine.setState(BatchWriterState.OPERATION_CREATED);

        writeOperationStart(message.contentId());
        return message;
    }

    @Override
    public void contentStreamRequested() throws IOException {
        stateMachine.verifyCallAllowed(true);
        stateMachine.validateTransition(BatchWriterState.OPERATION_STREAM_REQUESTED, changesetActive());

        writePendingHeaders();
        stateMachine.setState(BatchWriterState.OPERATION_STREAM_REQUESTED);
    }

    @Override
    public CompletableFuture<Void> contentStreamRequestedAsync() {
        stateMachine.verifyCallAllowed(false);
        stateMachine.validateTransition(BatchWriterState.OPERATION_STREAM_REQUESTED, changesetActive());

        try {
            writePendingHeaders();
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
        stateMachine.setState(BatchWriterState.OPERATION_STREAM_REQUESTED);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void contentStreamDisposed() throws IOException {
        stateMachine.transitionTo(BatchWriterState.OPERATION_STREAM_DISPOSED, changesetActive());
        finishPendingMessage();
    }

    @Override
    public void flush() throws IOException {
        stateMachine.verifyCanFlush(true);
        generator.flush();
        sink.flush();
    }

    @Override
    public CompletableFuture<Void> flushAsync() {
        stateMachine.verifyCanFlush(false);
        try {
            generator.flush();
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sink.flushAsync();
    }

    @Override
    public void onInStreamError() {
        stateMachine.verifyNotFaulted();
        BatchWriterState previous = stateMachine.state();
        stateMachine.enterError();

        BatchException error = new BatchException(BatchException.Reason.IN_STREAM_ERROR,
                "An in-stream error cannot be written to a JSON batch; the format has no error representation outside of an operation body.");
        try {
            generator.flush();
        } catch (IOException e) {
            error.addSuppressed(e);
        }
        logger.warn("in-stream error reported in state {}; JSON batch is abandoned", previous);
        throw error;
    }

    private static String emptyToNull(String contentId) {
        return contentId == null || contentId.isEmpty() ? null : contentId;
    }

    private boolean changesetActive() {
        return atomicityGroup != null;
    }

    private OutputStream openBodyBuffer() {
        pendingBody = new ByteArrayOutputStream();
        return pendingBody;
    }

    private void attach(BatchOperationMessage message) {
        pendingMessage = message;
        pendingHost = null;
        pendingHeadersWritten = false;
        pendingBody = null;
    }

    private void writeBatchStart() throws IOException {
        if (batchStartWritten) return;
        generator.writeStartObject();
        generator.writeArrayFieldStart(settings.writingResponse() ? F_RESPONSES : F_REQUESTS);
        batchStartWritten = true;
    }

    private void writeOperationStart(String contentId) throws IOException {
        writeBatchStart();
        generator.writeStartObject();
        generator.writeStringField(F_ID, contentId != null ? contentId : boundaries.operationId());
        if (atomicityGroup != null) {
            generator.writeStringField(F_ATOMICITY_GROUP, atomicityGroup);
        }
    }

    /**
     * Writes the status (responses) and headers of the pending operation once and freezes it.
     */
    private void writePendingHeaders() throws IOException {
        if (pendingMessage == null || pendingHeadersWritten) return;

        if (pendingMessage instanceof BatchOperationResponseMessage) {
            generator.writeNumberField(F_STATUS, ((BatchOperationResponseMessage) pendingMessage).statusCode());
        }
        Map<String, String> headers = pendingMessage.headers();
        if (!headers.isEmpty() || pendingHost != null) {
            generator.writeObjectFieldStart(F_HEADERS);
            if (pendingHost != null) {
                generator.writeStringField(BatchProtocol.H_HOST, pendingHost);
            }
            for (Map.Entry<String, String> header : headers.entrySet()) {
                generator.writeStringField(header.getKey(), header.getValue());
            }
            generator.writeEndObject();
        }
        pendingHeadersWritten = true;
        pendingMessage.partHeaderProcessingCompleted();
    }

    private void finishPendingMessage() throws IOException {
        if (pendingMessage == null) return;

        writePendingHeaders();
        if (pendingBody != null && pendingBody.size() > 0) {
            writeBody(pendingMessage.header(BatchProtocol.H_CONTENT_TYPE).orElse(null), pendingBody.toByteArray());
        }
        generator.writeEndObject();
        pendingMessage = null;
        pendingHost = null;
        pendingBody = null;
    }

    private void writeBody(String contentType, byte[] body) throws IOException {
        String mediaType = mediaType(contentType);
        if (isJson(mediaType)) {
            JsonNode node = parseJsonBody(body);
            generator.writeFieldName(F_BODY);
            mapper.writeTree(generator, node);
        } else if (mediaType.startsWith("text/")) {
            generator.writeStringField(F_BODY, new String(body, settings.charset()));
        } else {
            generator.writeFieldName(F_BODY);
            generator.writeBinary(body);
        }
    }

    /**
     * Parses a JSON body before anything of it is generated; a malformed body faults the writer.
     */
    private JsonNode parseJsonBody(byte[] body) throws IOException {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            stateMachine.enterError();
            logger.debug("malformed JSON operation body: {}", e.getOriginalMessage());
            throw e;
        }
    }

    private static String mediaType(String contentType) {
        if (contentType == null) return "";
        int semicolon = contentType.indexOf(';');
        String type = semicolon < 0 ? contentType : contentType.substring(0, semicolon);
        return type.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isJson(String mediaType) {
        return mediaType.equals(BatchProtocol.CT_APPLICATION_JSON) || mediaType.endsWith("+json");
    }
}
