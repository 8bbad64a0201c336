package io.waypoint.core.pattern;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PathSegmentsTest {

    @Test
    void normalizeHandlesBlankAndSlashes() {
        assertThat(PathSegments.normalize(null)).isEqualTo("/");
        assertThat(PathSegments.normalize("  ")).isEqualTo("/");
        assertThat(PathSegments.normalize("a//b/")).isEqualTo("/a/b");
        assertThat(PathSegments.normalize("///")).isEqualTo("/");
    }

    @Test
    void splitAndJoin() {
        assertThat(PathSegments.split("/")).isEmpty();
        assertThat(PathSegments.split("/a/b")).containsExactly("a", "b");
        assertThat(PathSegments.join(PathSegments.split("/a/b"))).isEqualTo("/a/b");
    }

    @Test
    void decodeKeepsPlusAndMalformedEscapes() {
        assertThat(PathSegments.decode("a+b")).isEqualTo("a+b");
        assertThat(PathSegments.decode("%E2%9C%93")).isEqualTo("✓");
        assertThat(PathSegments.decode("100%")).isEqualTo("100%");
    }
}
