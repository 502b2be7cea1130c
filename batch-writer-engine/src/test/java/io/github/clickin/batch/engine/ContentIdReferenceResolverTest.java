package io.github.clickin.batch.engine;

import io.github.clickin.batch.core.BatchException;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentIdReferenceResolverTest {

    private static final URI BASE = URI.create("http://host/service/");

    @Test
    void registeredReferenceIsKeptVerbatim() {
        ContentIdReferenceResolver resolver = new ContentIdReferenceResolver(null);
        resolver.register("1", URI.create("http://host/service/Customers"));

        assertThat(resolver.resolve(URI.create("$1/Orders"), BASE, true)).isEqualTo(URI.create("$1/Orders"));
        assertThat(resolver.resolve(URI.create("$1"), BASE, true)).isEqualTo(URI.create("$1"));
        assertThat(resolver.uriOf("1")).hasValue(URI.create("http://host/service/Customers"));
    }

    @Test
    void unknownReferenceInsideChangesetFails() {
        ContentIdReferenceResolver resolver = new ContentIdReferenceResolver(null);

        assertThatThrownBy(() -> resolver.resolve(URI.create("$9/Orders"), BASE, true))
                .isInstanceOfSatisfying(BatchException.class,
                        e -> assertThat(e.reason()).isEqualTo(BatchException.Reason.UNRESOLVED_CONTENT_ID_REFERENCE));
    }

    @Test
    void unknownReferenceOutsideChangesetResolvesAgainstBase() {
        ContentIdReferenceResolver resolver = new ContentIdReferenceResolver(null);

        assertThat(resolver.resolve(URI.create("$metadata"), BASE, false))
                .isEqualTo(URI.create("http://host/service/$metadata"));
    }

    @Test
    void relativeUriWithoutBaseFails() {
        ContentIdReferenceResolver resolver = new ContentIdReferenceResolver(null);

        assertThatThrownBy(() -> resolver.resolve(URI.create("Customers"), null, false))
                .isInstanceOfSatisfying(BatchException.class,
                        e -> assertThat(e.reason()).isEqualTo(BatchException.Reason.RELATIVE_URI_WITHOUT_BASE_URI));
    }

    @Test
    void absoluteUriIsKept() {
        ContentIdReferenceResolver resolver = new ContentIdReferenceResolver(null);
        URI absolute = URI.create("http://other/Customers");

        assertThat(resolver.resolve(absolute, BASE, false)).isSameAs(absolute);
    }

    @Test
    void converterSeesRegisteredIdsAndMayDecline() {
        ContentIdReferenceResolver resolver = new ContentIdReferenceResolver((base, uri, ids) ->
                ids.contains("1") && uri.toString().equals("latest") ? ids.uriOf("1").orElseThrow() : null);

        assertThat(resolver.resolve(URI.create("latest"), BASE, false)).isEqualTo(URI.create("http://host/service/latest"));

        resolver.register("1", URI.create("http://host/service/Customers"));
        assertThat(resolver.resolve(URI.create("latest"), BASE, false)).isEqualTo(URI.create("http://host/service/Customers"));
    }

    @Test
    void extractsReferencedId() {
        assertThat(ContentIdReferenceResolver.referencedContentId("$1")).isEqualTo("1");
        assertThat(ContentIdReferenceResolver.referencedContentId("$abc/Orders")).isEqualTo("abc");
        assertThat(ContentIdReferenceResolver.referencedContentId("$2?$select=Name")).isEqualTo("2");
        assertThat(ContentIdReferenceResolver.referencedContentId("$")).isNull();
        assertThat(ContentIdReferenceResolver.referencedContentId("Customers")).isNull();
    }
}
