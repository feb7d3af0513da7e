package io.mockdispatch.core.routing;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PathTemplateTest {

    @Test
    void literalTemplateMatchesOnlyItself() {
        PathTemplate template = PathTemplate.compile("/health/check");

        assertThat(template.isParameterized()).isFalse();
        assertThat(template.match("/health/check")).contains(Map.of());
        assertThat(template.match("/health/other")).isEmpty();
    }

    @Test
    void parameterBindsOneSegment() {
        PathTemplate template = PathTemplate.compile("/users/:id/posts/:postId");

        assertThat(template.isParameterized()).isTrue();
        assertThat(template.match("/users/42/posts/7")).contains(Map.of("id", "42", "postId", "7"));
    }

    @Test
    @DisplayName("Parameters never span segments")
    void parameterDoesNotSpanSegments() {
        PathTemplate template = PathTemplate.compile("/files/:name");

        assertThat(template.match("/files/a/b")).isEmpty();
        assertThat(template.match("/files")).isEmpty();
    }

    @Test
    void boundValuesAreUrlDecoded() {
        PathTemplate template = PathTemplate.compile("/tags/:tag");

        assertThat(template.match("/tags/hello%20world")).contains(Map.of("tag", "hello world"));
        assertThat(template.match("/tags/c+plus")).contains(Map.of("tag", "c+plus"));
    }

    @Test
    void trailingAndDoubledSlashesAreIgnored() {
        PathTemplate template = PathTemplate.compile("/users/:id");

        assertThat(template.match("/users/1/")).contains(Map.of("id", "1"));
        assertThat(template.match("//users//1")).contains(Map.of("id", "1"));
    }
}
