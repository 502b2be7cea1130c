package io.github.clickin.batch.spi;

import java.net.URI;
import java.util.Optional;

/**
 * Read-only view of the Content-IDs registered so far in a batch.
 */
public interface ContentIdLookup {

    /**
     * @param contentId the Content-ID without the leading {@code $}
     * @return whether an earlier operation of the batch registered it
     */
    boolean contains(String contentId);

    /**
     * @param contentId the Content-ID without the leading {@code $}
     * @return the request URI of the operation that carried it
     */
    Optional<URI> uriOf(String contentId);
}
