package io.github.clickin.batch.engine.multipart;

import io.github.clickin.batch.core.BatchException;
import io.github.clickin.batch.core.BatchPayloadUriOption;
import io.github.clickin.batch.core.BatchProtocol;
import io.github.clickin.batch.core.BatchWriterState;
import io.github.clickin.batch.engine.BatchStateMachine;
import io.github.clickin.batch.engine.BoundaryAllocator;
import io.github.clickin.batch.engine.ContentIdReferenceResolver;
import io.github.clickin.batch.engine.OperationMessageFactory;
import io.github.clickin.batch.spi.BatchOperationRequestMessage;
import io.github.clickin.batch.spi.BatchOperationResponseMessage;
import io.github.clickin.batch.spi.BatchOutputSink;
import io.github.clickin.batch.spi.BatchWriter;
import io.github.clickin.batch.spi.BatchWriterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Batch writer for the multipart/mixed format.
 *
 * <p>Layout of a request batch with one changeset:
 * <pre>
 * --batch_X
 * Content-Type: multipart/mixed; boundary=changeset_Y
 *
 * --changeset_Y
 * Content-Type: application/http
 * Content-Transfer-Encoding: binary
 * Content-ID: 1
 *
 * POST http://host/service/Customers HTTP/1.1
 * Content-Type: application/json
 *
 * {}
 * --changeset_Y--
 * --batch_X--
 * </pre>
 *
 * <p>An empty changeset is written as its closing delimiter only, and so is an empty batch. One
 * extra line break follows the closing batch delimiter.
 */
public final class MultipartMixedBatchWriter implements BatchWriter {
    private static final Logger logger = LoggerFactory.getLogger(MultipartMixedBatchWriter.class);

    private final BatchOutputSink sink;
    private final BatchWriterSettings settings;
    private final BoundaryAllocator boundaries;
    private final BatchStateMachine stateMachine;
    private final ContentIdReferenceResolver contentIds;
    private final OperationMessageFactory messages;
    private final PendingMessageBuffer pending = new PendingMessageBuffer();
    private final String batchBoundary;

    /** Non-null exactly while a changeset is open. */
    private String changesetBoundary;
    private boolean batchStartWritten;
    private boolean changesetStartWritten;

    /** Content-ID and URI of the last request, registered when the next request is created. */
    private String currentOperationContentId;
    private URI currentOperationUri;

    public MultipartMixedBatchWriter(BatchOutputSink sink, BatchWriterSettings settings) {
        this(sink, settings, new BoundaryAllocator());
    }

    public MultipartMixedBatchWriter(BatchOutputSink sink, BatchWriterSettings settings, BoundaryAllocator boundaries) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.boundaries = Objects.requireNonNull(boundaries, "boundaries");
        this.stateMachine = new BatchStateMachine(settings);
        this.contentIds = new ContentIdReferenceResolver(settings.payloadUriConverter());
        this.messages = new OperationMessageFactory(this, sink::outputStream);
        this.batchBoundary = boundaries.batchBoundary(settings.writingResponse());
    }

    public String batchBoundary() {
        return batchBoundary;
    }

    /**
     * Content-Type of the HTTP message that carries this batch.
     *
     * @return {@code multipart/mixed; boundary=<batch boundary>}
     */
    public String batchContentType() {
        return MultipartMixedWriterUtils.multipartContentType(batchBoundary);
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

        writePendingMessageData(true);

        changesetBoundary = boundaries.changesetBoundary(settings.writingResponse());
        stateMachine.setState(BatchWriterState.CHANGESET_STARTED);
        logger.debug("started changeset {}", changesetBoundary);

        Writer writer = sink.textWriter();
        MultipartMixedWriterUtils.writeStartBoundary(writer, batchBoundary, !batchStartWritten);
        batchStartWritten = true;
        MultipartMixedWriterUtils.writeChangesetPreamble(writer, changesetBoundary);
        changesetStartWritten = false;
    }

    @Override
    public void writeEndChangeset() throws IOException {
        stateMachine.validateTransition(BatchWriterState.CHANGESET_COMPLETED, changesetActive());

        writePendingMessageData(true);

        String closing = changesetBoundary;
        changesetBoundary = null;
        // the last Content-ID of a changeset is never referenced
        currentOperationContentId = null;
        currentOperationUri = null;
        stateMachine.setState(BatchWriterState.CHANGESET_COMPLETED);

        // an empty changeset is only its closing delimiter
        MultipartMixedWriterUtils.writeEndBoundary(sink.textWriter(), closing, !changesetStartWritten);
    }

    @Override
    public void writeEndBatch() throws IOException {
        stateMachine.validateTransition(BatchWriterState.BATCH_COMPLETED, changesetActive());

        writePendingMessageData(true);
        stateMachine.setState(BatchWriterState.BATCH_COMPLETED);

        Writer writer = sink.textWriter();
        MultipartMixedWriterUtils.writeEndBoundary(writer, batchBoundary, !batchStartWritten);
        writer.write(BatchProtocol.CRLF);
        sink.flushTextWriter();
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

        writePendingMessageData(true);

        if (currentOperationContentId != null) {
            contentIds.register(currentOperationContentId, currentOperationUri);
        }
        URI resolved = stateMachine.intercept(() -> contentIds.resolve(uri, settings.baseUri(), inChangeset));

        BatchOperationRequestMessage message = messages.newRequest(method, resolved, id);
        pending.attach(message);
        currentOperationContentId = id;
        currentOperationUri = resolved;
        stateMachine.setState(BatchWriterState.OPERATION_CREATED);

        Writer writer = sink.textWriter();
        writeStartBoundaryForOperation(writer);
        MultipartMixedWriterUtils.writeRequestPreamble(writer, method, resolved, settings.baseUri(), id, payloadUriOption);
        return message;
    }

    @Override
    public BatchOperationResponseMessage createOperationResponseMessage(String contentId) throws IOException {
        boolean inChangeset = changesetActive();
        stateMachine.verifyCanCreateResponse();
        stateMachine.validateTransition(BatchWriterState.OPERATION_CREATED, inChangeset);
        stateMachine.countOperation(inChangeset);

        writePendingMessageData(true);

        BatchOperationResponseMessage message = messages.newResponse(emptyToNull(contentId));
        pending.attach(message);
        stateMachine.setState(BatchWriterState.OPERATION_CREATED);

        Writer writer = sink.textWriter();
        writeStartBoundaryForOperation(writer);
        MultipartMixedWriterUtils.writeResponsePreamble(writer, inChangeset ? message.contentId() : null);
        return message;
    }

    @Override
    public void contentStreamRequested() throws IOException {
        stateMachine.verifyCallAllowed(true);
        stateMachine.validateTransition(BatchWriterState.OPERATION_STREAM_REQUESTED, changesetActive());

        startOperationContent();
        sink.flush();
        sink.detachTextWriter();
        stateMachine.setState(BatchWriterState.OPERATION_STREAM_REQUESTED);
        logger.debug("operation body stream handed out in batch {}", batchBoundary);
    }

    @Override
    public CompletableFuture<Void> contentStreamRequestedAsync() {
        stateMachine.verifyCallAllowed(false);
        stateMachine.validateTransition(BatchWriterState.OPERATION_STREAM_REQUESTED, changesetActive());

        try {
            startOperationContent();
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sink.flushAsync().thenCompose(ignored -> {
            try {
                sink.detachTextWriter();
            } catch (IOException e) {
                return CompletableFuture.failedFuture(e);
            }
            stateMachine.setState(BatchWriterState.OPERATION_STREAM_REQUESTED);
            return CompletableFuture.completedFuture(null);
        });
    }

    @Override
    public void contentStreamDisposed() {
        stateMachine.transitionTo(BatchWriterState.OPERATION_STREAM_DISPOSED, changesetActive());
        pending.clear();
        sink.initializeTextWriter();
    }

    @Override
    public void flush() throws IOException {
        stateMachine.verifyCanFlush(true);
        sink.flush();
    }

    @Override
    public CompletableFuture<Void> flushAsync() {
        stateMachine.verifyCanFlush(false);
        return sink.flushAsync();
    }

    @Override
    public void onInStreamError() {
        stateMachine.verifyNotFaulted();
        BatchWriterState previous = stateMachine.state();
        stateMachine.enterError();

        BatchException error = new BatchException(BatchException.Reason.IN_STREAM_ERROR,
                "An in-stream error cannot be written to a multipart batch; the format has no error representation outside of an operation body.");
        if (previous != BatchWriterState.OPERATION_STREAM_REQUESTED) {
            try {
                sink.flushTextWriter();
            } catch (IOException e) {
                error.addSuppressed(e);
            }
        }
        logger.warn("in-stream error reported in state {}; batch {} is abandoned", previous, batchBoundary);
        throw error;
    }

    private static String emptyToNull(String contentId) {
        return contentId == null || contentId.isEmpty() ? null : contentId;
    }

    private boolean changesetActive() {
        return changesetBoundary != null;
    }

    /**
     * Writes the pending headers and pushes them into the byte stream ahead of the body.
     */
    private void startOperationContent() throws IOException {
        writePendingMessageData(false);
        sink.flushTextWriter();
    }

    private void writeStartBoundaryForOperation(Writer writer) throws IOException {
        if (changesetBoundary == null) {
            MultipartMixedWriterUtils.writeStartBoundary(writer, batchBoundary, !batchStartWritten);
            batchStartWritten = true;
        } else {
            MultipartMixedWriterUtils.writeStartBoundary(writer, changesetBoundary, !changesetStartWritten);
            changesetStartWritten = true;
        }
    }

    private void writePendingMessageData(boolean reportMessageCompleted) throws IOException {
        if (!pending.isEmpty()) {
            pending.write(sink.textWriter(), reportMessageCompleted);
        }
    }
}
