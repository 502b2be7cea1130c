package io.github.clickin.batch.core;

/**
 * How an absolute operation URI is written on the request line.
 */
public enum BatchPayloadUriOption {
    /** {@code GET http://host/service/Customers HTTP/1.1} */
    ABSOLUTE_URI,

    /** {@code GET /service/Customers HTTP/1.1} followed by {@code Host: host:port}. */
    ABSOLUTE_URI_USING_HOST_HEADER,

    /** {@code GET Customers HTTP/1.1}, relative to the configured base URI. */
    RELATIVE_URI
}
