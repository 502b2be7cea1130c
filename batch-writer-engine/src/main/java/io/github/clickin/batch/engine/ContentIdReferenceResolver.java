package io.github.clickin.batch.engine;

import io.github.clickin.batch.core.BatchException;
import io.github.clickin.batch.core.BatchProtocol;
import io.github.clickin.batch.spi.ContentIdLookup;
import io.github.clickin.batch.spi.PayloadUriConverter;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Batch-scoped Content-ID table and operation URI resolution.
 *
 * <p>A writer registers an operation's Content-ID only after the operation is complete, so the
 * table never holds the id of the operation being written. Resolution rules, in order:
 * <ol>
 *   <li>a configured {@link PayloadUriConverter} may return the URI to use</li>
 *   <li>absolute URIs are kept</li>
 *   <li>{@code $id} or {@code $id/...} with a registered id is kept verbatim, the reader resolves it</li>
 *   <li>inside a changeset, a {@code $id} reference to an unknown id fails</li>
 *   <li>anything else is resolved against the base URI</li>
 * </ol>
 */
public final class ContentIdReferenceResolver implements ContentIdLookup {
    private final Map<String, URI> table = new LinkedHashMap<>();
    private final PayloadUriConverter converter;

    /**
     * @param converter custom URI converter (may be null)
     */
    public ContentIdReferenceResolver(PayloadUriConverter converter) {
        this.converter = converter;
    }

    /**
     * Records the Content-ID of a completed operation.
     */
    public void register(String contentId, URI uri) {
        Objects.requireNonNull(contentId, "contentId");
        table.put(contentId, uri);
    }

    @Override
    public boolean contains(String contentId) {
        return contentId != null && table.containsKey(contentId);
    }

    @Override
    public Optional<URI> uriOf(String contentId) {
        return Optional.ofNullable(contentId == null ? null : table.get(contentId));
    }

    /**
     * Resolves an operation URI.
     *
     * @param uri the URI given by the caller
     * @param baseUri the configured base URI (may be null)
     * @param changesetActive whether the operation goes into a changeset
     * @return the URI to write
     * @throws BatchException if a reference is unknown or a relative URI cannot be resolved
     */
    public URI resolve(URI uri, URI baseUri, boolean changesetActive) {
        Objects.requireNonNull(uri, "uri");
        if (converter != null) {
            URI converted = converter.convertPayloadUri(baseUri, uri, this);
            if (converted != null) return converted;
        }
        if (uri.isAbsolute()) return uri;

        String reference = referencedContentId(uri.toString());
        if (reference != null) {
            if (contains(reference)) return uri;
            if (changesetActive) {
                throw new BatchException(BatchException.Reason.UNRESOLVED_CONTENT_ID_REFERENCE,
                        "The URI '" + uri + "' references Content-ID '" + reference + "' which no earlier operation declared.");
            }
        }
        if (baseUri == null) {
            throw new BatchException(BatchException.Reason.RELATIVE_URI_WITHOUT_BASE_URI,
                    "The relative URI '" + uri + "' cannot be resolved because no base URI was configured.");
        }
        return baseUri.resolve(uri);
    }

    /**
     * Extracts {@code id} from {@code $id}, {@code $id/segment} or {@code $id?query}.
     *
     * @return the id, or {@code null} if the string is not a reference
     */
    static String referencedContentId(String uri) {
        if (uri.length() < 2 || uri.charAt(0) != BatchProtocol.CONTENT_ID_REFERENCE_PREFIX) return null;
        int end = uri.length();
        for (int i = 1; i < uri.length(); i++) {
            char c = uri.charAt(i);
            if (c == '/' || c == '?') {
                end = i;
                break;
            }
        }
        return end > 1 ? uri.substring(1, end) : null;
    }
}
