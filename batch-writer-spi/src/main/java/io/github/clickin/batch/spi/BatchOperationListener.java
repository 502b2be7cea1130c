package io.github.clickin.batch.spi;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Notifications an operation message sends to its writer around the body stream.
 */
public interface BatchOperationListener {

    /**
     * The caller is about to write the operation body; pending output must be flushed first.
     */
    void contentStreamRequested() throws IOException;

    /**
     * Non-blocking variant of {@link #contentStreamRequested()}.
     *
     * @return future completing once the caller may write the body
     */
    CompletableFuture<Void> contentStreamRequestedAsync();

    /**
     * The operation body stream was closed; the writer regains the output.
     */
    void contentStreamDisposed() throws IOException;
}
