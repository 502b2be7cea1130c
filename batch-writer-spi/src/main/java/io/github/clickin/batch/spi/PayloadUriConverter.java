package io.github.clickin.batch.spi;

import java.net.URI;

/**
 * Hook that lets applications rewrite operation URIs before they are written.
 */
@FunctionalInterface
public interface PayloadUriConverter {

    /**
     * Converts an operation URI.
     *
     * @param baseUri the configured base URI (may be null)
     * @param payloadUri the URI given for the operation, possibly relative or a {@code $id} reference
     * @param contentIds Content-IDs registered so far in the batch
     * @return the URI to write, or {@code null} to apply the default resolution rules
     */
    URI convertPayloadUri(URI baseUri, URI payloadUri, ContentIdLookup contentIds);
}
