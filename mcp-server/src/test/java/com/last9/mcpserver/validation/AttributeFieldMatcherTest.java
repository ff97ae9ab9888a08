package com.last9.mcpserver.validation;

import com.last9.mcpserver.catalog.AttributeCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AttributeFieldMatcherTest {

    private final AttributeCatalog catalog = AttributeCatalog.of(List.of("http.method", "resource_service.name"));

    @Test
    void bracketKeyExtraction() {
        assertThat(AttributeFieldMatcher.bracketKey("attributes['a.b']", "attributes")).contains("a.b");
        assertThat(AttributeFieldMatcher.bracketKey("attributes[\"a.b\"]", "attributes")).contains("a.b");
        assertThat(AttributeFieldMatcher.bracketKey("attributes['']", "attributes")).isEmpty();
        assertThat(AttributeFieldMatcher.bracketKey("attributes['a.b\"]", "attributes")).isEmpty();
    }

    @Test
    void attributeBracketFallsBackToResourcePrefix() {
        assertThat(AttributeFieldMatcher.isAllowed("attributes['service.name']", catalog)).isTrue();
        assertThat(AttributeFieldMatcher.isAllowed("attributes['http.method']", catalog)).isTrue();
        assertThat(AttributeFieldMatcher.isAllowed("attributes['db.system']", catalog)).isFalse();
    }

    @Test
    void resourcePrefixedNameMatchesStrippedEntry() {
        assertThat(AttributeFieldMatcher.isAllowed("resource_http.method", catalog)).isTrue();
        assertThat(AttributeFieldMatcher.isAllowed("resource_service.name", catalog)).isTrue();
        assertThat(AttributeFieldMatcher.isAllowed("resource_db.system", catalog)).isFalse();
    }
}
