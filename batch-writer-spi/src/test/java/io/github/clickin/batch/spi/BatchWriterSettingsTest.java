package io.github.clickin.batch.spi;

import io.github.clickin.batch.core.BatchPayloadUriOption;
import io.github.clickin.batch.core.ConcurrencyMode;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchWriterSettingsTest {

    @Test
    void defaultsMatchProtocolQuotas() {
        BatchWriterSettings settings = BatchWriterSettings.defaults();

        assertThat(settings.baseUri()).isNull();
        assertThat(settings.payloadUriOption()).isEqualTo(BatchPayloadUriOption.ABSOLUTE_URI);
        assertThat(settings.writingResponse()).isFalse();
        assertThat(settings.concurrencyMode()).isEqualTo(ConcurrencyMode.BLOCKING);
        assertThat(settings.charset()).isEqualTo(StandardCharsets.UTF_8);
        assertThat(settings.maxPartsPerBatch()).isEqualTo(100);
        assertThat(settings.maxOperationsPerChangeset()).isEqualTo(1000);
        assertThat(settings.payloadUriConverter()).isNull();
    }

    @Test
    void baseUriGetsTrailingSlash() {
        BatchWriterSettings settings = BatchWriterSettings.builder()
                .baseUri(URI.create("http://localhost/service"))
                .build();

        assertThat(settings.baseUri()).isEqualTo(URI.create("http://localhost/service/"));
        assertThat(settings.baseUri().resolve("Customers")).isEqualTo(URI.create("http://localhost/service/Customers"));
    }

    @Test
    void rejectsRelativeBaseUri() {
        assertThatThrownBy(() -> BatchWriterSettings.builder().baseUri(URI.create("service/")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonPositiveQuotas() {
        assertThatThrownBy(() -> BatchWriterSettings.builder().maxPartsPerBatch(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BatchWriterSettings.builder().maxOperationsPerChangeset(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
