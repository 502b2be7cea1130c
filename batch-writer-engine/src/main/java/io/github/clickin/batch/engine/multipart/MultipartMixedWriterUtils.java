package io.github.clickin.batch.engine.multipart;

import io.github.clickin.batch.core.BatchPayloadUriOption;
import io.github.clickin.batch.core.HttpStatusMessages;
import io.github.clickin.batch.engine.RequestUris;

import java.io.IOException;
import java.io.Writer;
import java.net.URI;

import static io.github.clickin.batch.core.BatchProtocol.*;

/**
 * Byte-exact serialization rules of the multipart/mixed batch format.
 *
 * <p>The CRLF before a delimiter belongs to the delimiter (RFC 2046, 5.1.1), so it is written
 * by the delimiter itself unless the delimiter is the first thing of its part.
 */
public final class MultipartMixedWriterUtils {
    private MultipartMixedWriterUtils() {}

    /**
     * @return {@code multipart/mixed; boundary=<boundary>}
     */
    public static String multipartContentType(String boundary) {
        return CT_MULTIPART_MIXED + "; " + P_BOUNDARY + "=" + boundary;
    }

    /**
     * Writes {@code --boundary}.
     *
     * @param firstBoundary whether nothing precedes the delimiter in its scope
     */
    static void writeStartBoundary(Writer writer, String boundary, boolean firstBoundary) throws IOException {
        if (!firstBoundary) writer.write(CRLF);
        writeLine(writer, BOUNDARY_DELIMITER + boundary);
    }

    /**
     * Writes {@code --boundary--} without a trailing line break.
     *
     * @param missingStartBoundary whether no opening delimiter was written for the scope
     */
    static void writeEndBoundary(Writer writer, String boundary, boolean missingStartBoundary) throws IOException {
        if (!missingStartBoundary) writer.write(CRLF);
        writer.write(BOUNDARY_DELIMITER + boundary + BOUNDARY_DELIMITER);
    }

    static void writeChangesetPreamble(Writer writer, String changesetBoundary) throws IOException {
        writeHeader(writer, H_CONTENT_TYPE, multipartContentType(changesetBoundary));
        writer.write(CRLF);
    }

    /**
     * Writes the part headers, the separator line and the request line of a request operation.
     */
    static void writeRequestPreamble(Writer writer, String method, URI uri, URI baseUri, String contentId,
                                     BatchPayloadUriOption option) throws IOException {
        writePartHeaders(writer, contentId);
        writeLine(writer, method + " " + RequestUris.requestTarget(uri, baseUri, option) + " " + HTTP_VERSION);
        if (RequestUris.usesHostHeader(uri, option)) {
            writeHeader(writer, H_HOST, RequestUris.hostHeaderValue(uri));
        }
    }

    /**
     * Writes the part headers and the separator line of a response operation; the status line
     * stays pending until the status code is final.
     */
    static void writeResponsePreamble(Writer writer, String contentId) throws IOException {
        writePartHeaders(writer, contentId);
    }

    static void writeStatusLine(Writer writer, int statusCode) throws IOException {
        writeLine(writer, HTTP_VERSION + " " + statusCode + " " + HttpStatusMessages.of(statusCode));
    }

    static void writeHeader(Writer writer, String name, String value) throws IOException {
        writeLine(writer, name + ": " + value);
    }

    private static void writePartHeaders(Writer writer, String contentId) throws IOException {
        writeHeader(writer, H_CONTENT_TYPE, CT_APPLICATION_HTTP);
        writeHeader(writer, H_CONTENT_TRANSFER_ENCODING, TRANSFER_ENCODING_BINARY);
        if (contentId != null) {
            writeHeader(writer, H_CONTENT_ID, contentId);
        }
        writer.write(CRLF);
    }

    private static void writeLine(Writer writer, String line) throws IOException {
        writer.write(line);
        writer.write(CRLF);
    }
}
