package io.github.clickin.batch.core;

/**
 * Batch protocol constants (header names, media types, boundary prefixes and well-known values).
 *
 * <p>This class only models wire-level concerns that are shared across the multipart and JSON encodings.
 */
public final class BatchProtocol {
    private BatchProtocol() {}

    /** Line terminator used everywhere in a multipart payload. */
    public static final String CRLF = "\r\n";

    /** HTTP version written in request and status lines of batch operations. */
    public static final String HTTP_VERSION = "HTTP/1.1";

    // Header names
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CONTENT_TRANSFER_ENCODING = "Content-Transfer-Encoding";
    public static final String H_CONTENT_ID = "Content-ID";
    public static final String H_HOST = "Host";

    // Media types
    public static final String CT_MULTIPART_MIXED = "multipart/mixed";
    public static final String CT_APPLICATION_HTTP = "application/http";
    public static final String CT_APPLICATION_JSON = "application/json";

    /** Content-Transfer-Encoding of every operation part. */
    public static final String TRANSFER_ENCODING_BINARY = "binary";

    /** Media type parameter carrying the boundary token. */
    public static final String P_BOUNDARY = "boundary";

    // Boundary prefixes
    public static final String BATCH_BOUNDARY_PREFIX = "batch_";
    public static final String BATCH_RESPONSE_BOUNDARY_PREFIX = "batchresponse_";
    public static final String CHANGESET_BOUNDARY_PREFIX = "changeset_";
    public static final String CHANGESET_RESPONSE_BOUNDARY_PREFIX = "changesetresponse_";

    /** Leading character of a Content-ID reference inside a request URI ({@code $1/Orders}). */
    public static final char CONTENT_ID_REFERENCE_PREFIX = '$';

    /** Dash pair that opens every multipart boundary delimiter. */
    public static final String BOUNDARY_DELIMITER = "--";

    // Defaults for message quotas
    public static final int DEFAULT_MAX_PARTS_PER_BATCH = 100;
    public static final int DEFAULT_MAX_OPERATIONS_PER_CHANGESET = 1000;
}
