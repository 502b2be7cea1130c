package io.github.clickin.batch.spi;

import io.github.clickin.batch.core.BatchPayloadUriOption;
import io.github.clickin.batch.core.BatchProtocol;
import io.github.clickin.batch.core.ConcurrencyMode;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Immutable configuration of a batch writer.
 *
 * <p>Use {@link #builder()}; every option has a default:
 * <ul>
 *   <li>no base URI, {@link BatchPayloadUriOption#ABSOLUTE_URI}</li>
 *   <li>writes requests, {@link ConcurrencyMode#BLOCKING}, UTF-8</li>
 *   <li>at most 100 parts per batch and 1000 operations per changeset</li>
 * </ul>
 */
public final class BatchWriterSettings {
    private final URI baseUri;
    private final BatchPayloadUriOption payloadUriOption;
    private final boolean writingResponse;
    private final ConcurrencyMode concurrencyMode;
    private final Charset charset;
    private final int maxPartsPerBatch;
    private final int maxOperationsPerChangeset;
    private final PayloadUriConverter payloadUriConverter;

    private BatchWriterSettings(Builder b) {
        this.baseUri = b.baseUri;
        this.payloadUriOption = b.payloadUriOption;
        this.writingResponse = b.writingResponse;
        this.concurrencyMode = b.concurrencyMode;
        this.charset = b.charset;
        this.maxPartsPerBatch = b.maxPartsPerBatch;
        this.maxOperationsPerChangeset = b.maxOperationsPerChangeset;
        this.payloadUriConverter = b.payloadUriConverter;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Settings with every default applied.
     */
    public static BatchWriterSettings defaults() {
        return builder().build();
    }

    /**
     * Base URI relative operation URIs are resolved against; always ends with {@code /}.
     *
     * @return the base URI, or {@code null} if not set
     */
    public URI baseUri() {
        return baseUri;
    }

    public BatchPayloadUriOption payloadUriOption() {
        return payloadUriOption;
    }

    /**
     * @return {@code true} if the writer produces a response batch, {@code false} for a request batch
     */
    public boolean writingResponse() {
        return writingResponse;
    }

    public ConcurrencyMode concurrencyMode() {
        return concurrencyMode;
    }

    public Charset charset() {
        return charset;
    }

    public int maxPartsPerBatch() {
        return maxPartsPerBatch;
    }

    public int maxOperationsPerChangeset() {
        return maxOperationsPerChangeset;
    }

    /**
     * @return the custom URI converter, or {@code null}
     */
    public PayloadUriConverter payloadUriConverter() {
        return payloadUriConverter;
    }

    /**
     * Builder for {@link BatchWriterSettings}.
     */
    public static final class Builder {
        private URI baseUri;
        private BatchPayloadUriOption payloadUriOption = BatchPayloadUriOption.ABSOLUTE_URI;
        private boolean writingResponse;
        private ConcurrencyMode concurrencyMode = ConcurrencyMode.BLOCKING;
        private Charset charset = StandardCharsets.UTF_8;
        private int maxPartsPerBatch = BatchProtocol.DEFAULT_MAX_PARTS_PER_BATCH;
        private int maxOperationsPerChangeset = BatchProtocol.DEFAULT_MAX_OPERATIONS_PER_CHANGESET;
        private PayloadUriConverter payloadUriConverter;

        private Builder() {}

        /**
         * Sets the base URI. A trailing {@code /} is appended if missing so that relative URIs resolve
         * below the last path segment.
         *
         * @param baseUri an absolute URI, or {@code null} to clear it
         * @return this builder
         */
        public Builder baseUri(URI baseUri) {
            if (baseUri != null && !baseUri.isAbsolute()) {
                throw new IllegalArgumentException("baseUri must be absolute: " + baseUri);
            }
            this.baseUri = baseUri == null ? null : withTrailingSlash(baseUri);
            return this;
        }

        public Builder payloadUriOption(BatchPayloadUriOption payloadUriOption) {
            this.payloadUriOption = Objects.requireNonNull(payloadUriOption, "payloadUriOption");
            return this;
        }

        public Builder writingResponse(boolean writingResponse) {
            this.writingResponse = writingResponse;
            return this;
        }

        public Builder concurrencyMode(ConcurrencyMode concurrencyMode) {
            this.concurrencyMode = Objects.requireNonNull(concurrencyMode, "concurrencyMode");
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder maxPartsPerBatch(int maxPartsPerBatch) {
            if (maxPartsPerBatch <= 0) throw new IllegalArgumentException("maxPartsPerBatch must be > 0");
            this.maxPartsPerBatch = maxPartsPerBatch;
            return this;
        }

        public Builder maxOperationsPerChangeset(int maxOperationsPerChangeset) {
            if (maxOperationsPerChangeset <= 0) throw new IllegalArgumentException("maxOperationsPerChangeset must be > 0");
            this.maxOperationsPerChangeset = maxOperationsPerChangeset;
            return this;
        }

        public Builder payloadUriConverter(PayloadUriConverter payloadUriConverter) {
            this.payloadUriConverter = payloadUriConverter;
            return this;
        }

        public BatchWriterSettings build() {
            return new BatchWriterSettings(this);
        }

        private static URI withTrailingSlash(URI uri) {
            String s = uri.toString();
            return s.endsWith("/") ? uri : URI.create(s + "/");
        }
    }
}
