package io.github.clickin.batch.engine;

import io.github.clickin.batch.core.BatchException;
import io.github.clickin.batch.core.BatchException.Reason;
import io.github.clickin.batch.core.BatchWriterState;
import io.github.clickin.batch.core.ConcurrencyMode;
import io.github.clickin.batch.core.HttpMethods;
import io.github.clickin.batch.spi.BatchWriterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

import static io.github.clickin.batch.core.BatchWriterState.*;

/**
 * State and validation rules shared by every batch writer encoding.
 *
 * <p>Writers own one instance and consult it before they write anything: violations are detected at
 * the offending call, move the writer to {@link BatchWriterState#ERROR} and throw a
 * {@link BatchException}. Once in error every further call fails with
 * {@link Reason#INVALID_STATE_TRANSITION}.
 */
public final class BatchStateMachine {
    private static final Logger logger = LoggerFactory.getLogger(BatchStateMachine.class);

    private static final Map<BatchWriterState, Set<BatchWriterState>> TRANSITIONS = new EnumMap<>(BatchWriterState.class);

    static {
        TRANSITIONS.put(START, EnumSet.of(BATCH_STARTED));
        TRANSITIONS.put(BATCH_STARTED, EnumSet.of(CHANGESET_STARTED, OPERATION_CREATED, BATCH_COMPLETED));
        TRANSITIONS.put(CHANGESET_STARTED, EnumSet.of(OPERATION_CREATED, CHANGESET_COMPLETED));
        TRANSITIONS.put(OPERATION_CREATED, EnumSet.of(OPERATION_CREATED, OPERATION_STREAM_REQUESTED,
                CHANGESET_STARTED, CHANGESET_COMPLETED, BATCH_COMPLETED));
        TRANSITIONS.put(OPERATION_STREAM_REQUESTED, EnumSet.of(OPERATION_STREAM_DISPOSED));
        TRANSITIONS.put(OPERATION_STREAM_DISPOSED, EnumSet.of(OPERATION_CREATED, CHANGESET_STARTED,
                CHANGESET_COMPLETED, BATCH_COMPLETED));
        TRANSITIONS.put(CHANGESET_COMPLETED, EnumSet.of(OPERATION_CREATED, CHANGESET_STARTED, BATCH_COMPLETED));
        TRANSITIONS.put(BATCH_COMPLETED, EnumSet.noneOf(BatchWriterState.class));
        TRANSITIONS.put(ERROR, EnumSet.noneOf(BatchWriterState.class));
    }

    private final BatchWriterSettings settings;
    private final Set<String> usedContentIds = new HashSet<>();
    private BatchWriterState state = START;
    private int batchSize;
    private int changesetSize;

    public BatchStateMachine(BatchWriterSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public BatchWriterState state() {
        return state;
    }

    /**
     * Whether {@code to} directly follows {@code from} in the batch grammar, ignoring changeset rules.
     */
    public static boolean isLegal(BatchWriterState from, BatchWriterState to) {
        if (to == ERROR) return true;
        return TRANSITIONS.get(from).contains(to);
    }

    /**
     * Checks that the writer may move to {@code newState}.
     *
     * @param newState the target state
     * @param changesetActive whether a changeset is currently open
     */
    public void validateTransition(BatchWriterState newState, boolean changesetActive) {
        verifyNotFaulted();
        if (newState == ERROR) return;

        if (newState == CHANGESET_STARTED && changesetActive) {
            throw fail(Reason.CHANGESET_ALREADY_ACTIVE,
                    "Cannot start a changeset while another changeset is active; changesets cannot be nested.");
        }
        if (newState == CHANGESET_COMPLETED && !changesetActive) {
            throw fail(Reason.NO_ACTIVE_CHANGESET, "Cannot end a changeset because no changeset is active.");
        }
        if (newState == BATCH_COMPLETED && changesetActive) {
            throw fail(Reason.ACTIVE_CHANGESET_AT_BATCH_END,
                    "Cannot end the batch while a changeset is still active; end the changeset first.");
        }
        if (!isLegal(state, newState)) {
            throw fail(Reason.INVALID_STATE_TRANSITION, "Cannot move the batch writer from " + state + " to " + newState + ".");
        }
    }

    /**
     * Moves to {@code newState} without validation; call {@link #validateTransition} first.
     */
    public void setState(BatchWriterState newState) {
        logger.trace("batch writer {} -> {}", state, newState);
        this.state = newState;
    }

    /**
     * Validates and performs a transition.
     */
    public void transitionTo(BatchWriterState newState, boolean changesetActive) {
        validateTransition(newState, changesetActive);
        setState(newState);
    }

    /**
     * Fails if the writer already entered {@link BatchWriterState#ERROR}.
     */
    public void verifyNotFaulted() {
        if (state == ERROR) {
            throw new BatchException(Reason.INVALID_STATE_TRANSITION,
                    "The batch writer is in the ERROR state and cannot be used anymore.");
        }
    }

    /**
     * Checks a blocking ({@code synchronousCall}) or asynchronous call against the configured mode.
     */
    public void verifyCallAllowed(boolean synchronousCall) {
        verifyNotFaulted();
        ConcurrencyMode mode = settings.concurrencyMode();
        if (synchronousCall && mode == ConcurrencyMode.NON_BLOCKING) {
            throw fail(Reason.SYNC_CALL_ON_ASYNC_WRITER, "A blocking call was made on a non-blocking batch writer.");
        }
        if (!synchronousCall && mode == ConcurrencyMode.BLOCKING) {
            throw fail(Reason.ASYNC_CALL_ON_SYNC_WRITER, "An asynchronous call was made on a blocking batch writer.");
        }
    }

    public void verifyCanFlush(boolean synchronousCall) {
        verifyCallAllowed(synchronousCall);
        if (state == OPERATION_STREAM_REQUESTED) {
            throw fail(Reason.FLUSH_IN_STREAM_REQUESTED_STATE,
                    "Cannot flush the batch writer while an operation content stream is open.");
        }
    }

    /**
     * Validates the arguments of a request operation.
     *
     * @param method the HTTP method
     * @param contentId the Content-ID (may be null)
     * @param changesetActive whether the request goes into a changeset
     */
    public void verifyCanCreateRequest(String method, String contentId, boolean changesetActive) {
        verifyNotFaulted();
        if (settings.writingResponse()) {
            throw fail(Reason.REQUEST_ON_RESPONSE_WRITER, "Cannot create a request operation on a writer that writes responses.");
        }
        if (!HttpMethods.isSupported(method)) {
            throw fail(Reason.INVALID_HTTP_METHOD, "The HTTP method '" + method + "' is not supported for batch operations.");
        }
        if (changesetActive) {
            if (HttpMethods.isQueryMethod(method)) {
                throw fail(Reason.INVALID_METHOD_IN_CHANGESET,
                        "The HTTP method '" + method + "' is not allowed for a request inside a changeset.");
            }
            if (contentId == null || contentId.isEmpty()) {
                throw fail(Reason.MISSING_CONTENT_ID, "A request inside a changeset requires a Content-ID header.");
            }
        }
    }

    public void verifyCanCreateResponse() {
        verifyNotFaulted();
        if (!settings.writingResponse()) {
            throw fail(Reason.RESPONSE_ON_REQUEST_WRITER, "Cannot create a response operation on a writer that writes requests.");
        }
    }

    /**
     * Rejects a Content-ID already used in the batch and records it otherwise.
     *
     * <p>Every request Content-ID counts, including ones that can no longer be referenced such as
     * the last Content-ID of a closed changeset.
     *
     * @param contentId the new Content-ID (may be null)
     */
    public void verifyUniqueContentId(String contentId) {
        if (contentId == null) return;
        if (!usedContentIds.add(contentId)) {
            throw fail(Reason.DUPLICATE_CONTENT_ID, "The Content-ID '" + contentId + "' was already used in this batch.");
        }
    }

    /**
     * Counts a new operation against the batch or changeset quota.
     */
    public void countOperation(boolean changesetActive) {
        if (changesetActive) {
            if (++changesetSize > settings.maxOperationsPerChangeset()) {
                throw fail(Reason.MAX_CHANGESET_SIZE_EXCEEDED,
                        "The changeset exceeds the maximum of " + settings.maxOperationsPerChangeset() + " operations.");
            }
        } else {
            countBatchPart();
        }
    }

    /**
     * Counts a new changeset against the batch quota and starts counting its operations.
     */
    public void countChangeset() {
        countBatchPart();
        changesetSize = 0;
    }

    private void countBatchPart() {
        if (++batchSize > settings.maxPartsPerBatch()) {
            throw fail(Reason.MAX_BATCH_SIZE_EXCEEDED,
                    "The batch exceeds the maximum of " + settings.maxPartsPerBatch() + " parts.");
        }
    }

    /**
     * Runs {@code action}; a {@link BatchException} it throws faults the writer before propagating.
     */
    public <T> T intercept(Supplier<T> action) {
        try {
            return action.get();
        } catch (BatchException e) {
            enterError();
            throw e;
        }
    }

    /**
     * Faults the writer and returns the exception to throw.
     */
    public BatchException fail(Reason reason, String message) {
        enterError();
        return new BatchException(reason, message);
    }

    public void enterError() {
        if (state != ERROR) {
            logger.debug("batch writer failed in state {}", state);
            state = ERROR;
        }
    }
}
