package io.github.clickin.batch.engine;

import io.github.clickin.batch.core.BatchPayloadUriOption;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class RequestUrisTest {

    private static final URI BASE = URI.create("http://host/service/");
    private static final URI ORDERS = URI.create("http://host/service/Orders?$top=2");

    @Test
    void absoluteOptionWritesFullUri() {
        assertThat(RequestUris.requestTarget(ORDERS, BASE, BatchPayloadUriOption.ABSOLUTE_URI))
                .isEqualTo("http://host/service/Orders?$top=2");
        assertThat(RequestUris.usesHostHeader(ORDERS, BatchPayloadUriOption.ABSOLUTE_URI)).isFalse();
    }

    @Test
    void hostHeaderOptionWritesPathAndQuery() {
        assertThat(RequestUris.requestTarget(ORDERS, BASE, BatchPayloadUriOption.ABSOLUTE_URI_USING_HOST_HEADER))
                .isEqualTo("/service/Orders?$top=2");
        assertThat(RequestUris.usesHostHeader(ORDERS, BatchPayloadUriOption.ABSOLUTE_URI_USING_HOST_HEADER)).isTrue();
        assertThat(RequestUris.hostHeaderValue(ORDERS)).isEqualTo("host:80");
        assertThat(RequestUris.hostHeaderValue(URI.create("https://secure:8443/x"))).isEqualTo("secure:8443");
        assertThat(RequestUris.hostHeaderValue(URI.create("https://secure/x"))).isEqualTo("secure:443");
    }

    @Test
    void relativeOptionStripsBase() {
        assertThat(RequestUris.requestTarget(ORDERS, BASE, BatchPayloadUriOption.RELATIVE_URI))
                .isEqualTo("Orders?$top=2");
        assertThat(RequestUris.requestTarget(URI.create("http://other/Orders"), BASE, BatchPayloadUriOption.RELATIVE_URI))
                .isEqualTo("http://other/Orders");
    }

    @Test
    void relativeUrisAreWrittenAsGiven() {
        URI reference = URI.create("$1/Orders");
        for (BatchPayloadUriOption option : BatchPayloadUriOption.values()) {
            assertThat(RequestUris.requestTarget(reference, BASE, option)).isEqualTo("$1/Orders");
            assertThat(RequestUris.usesHostHeader(reference, option)).isFalse();
        }
    }
}
