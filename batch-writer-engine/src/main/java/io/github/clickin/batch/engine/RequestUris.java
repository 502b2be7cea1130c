package io.github.clickin.batch.engine;

import io.github.clickin.batch.core.BatchPayloadUriOption;

import java.net.URI;

/**
 * Formats the request target of an operation according to a {@link BatchPayloadUriOption}.
 */
public final class RequestUris {
    private RequestUris() {}

    /**
     * @param uri the resolved operation URI
     * @param baseUri the configured base URI (may be null)
     * @param option how absolute URIs are written
     * @return the text written after the method on the request line
     */
    public static String requestTarget(URI uri, URI baseUri, BatchPayloadUriOption option) {
        if (!uri.isAbsolute()) return uri.toString();
        switch (option) {
            case ABSOLUTE_URI_USING_HOST_HEADER: {
                String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
                return uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
            }
            case RELATIVE_URI:
                return baseUri == null ? uri.toString() : baseUri.relativize(uri).toString();
            case ABSOLUTE_URI:
            default:
                return uri.toString();
        }
    }

    /**
     * Whether a {@code Host} line follows the request line.
     */
    public static boolean usesHostHeader(URI uri, BatchPayloadUriOption option) {
        return uri.isAbsolute() && option == BatchPayloadUriOption.ABSOLUTE_URI_USING_HOST_HEADER;
    }

    /**
     * @return {@code host:port}, with the scheme's default port if the URI has none
     */
    public static String hostHeaderValue(URI uri) {
        int port = uri.getPort();
        if (port < 0) {
            port = "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        }
        return uri.getHost() + ":" + port;
    }
}
