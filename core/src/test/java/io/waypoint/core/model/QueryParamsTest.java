package io.waypoint.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("QueryParams")
class QueryParamsTest {

    @Test
    @DisplayName("repeated keys keep every value in order")
    void repeatedKeys() {
        QueryParams query = QueryParams.parse("?tag=a&tag=b&page=2");

        assertThat(query.all("tag")).containsExactly("a", "b");
        assertThat(query.first("tag")).isEqualTo("a");
        assertThat(query.first("page")).isEqualTo("2");
        assertThat(query.first("missing")).isNull();
        assertThat(query.all("missing")).isEmpty();
    }

    @Test
    @DisplayName("values are decoded, plus becomes a space")
    void decoding() {
        QueryParams query = QueryParams.parse("q=hello+world&path=%2Fa%2Fb&flag");

        assertThat(query.first("q")).isEqualTo("hello world");
        assertThat(query.first("path")).isEqualTo("/a/b");
        assertThat(query.first("flag")).isEmpty();
    }

    @Test
    @DisplayName("a malformed escape is kept verbatim")
    void malformedEscape() {
        assertThat(QueryParams.parse("x=%zz").first("x")).isEqualTo("%zz");
    }

    @Test
    @DisplayName("serialization encodes spaces as %20 and renders empty values as bare keys")
    void serialization() {
        QueryParams query = QueryParams.ofMulti(Map.of("q", List.of("a b")))
                .with("flag", "");

        assertThat(query.toQueryString()).isEqualTo("q=a%20b&flag");
    }

    @Test
    @DisplayName("empty input yields the shared empty instance")
    void empty() {
        assertThat(QueryParams.parse(null)).isSameAs(QueryParams.empty());
        assertThat(QueryParams.parse("?")).isSameAs(QueryParams.empty());
        assertThat(QueryParams.parse("&&").isEmpty()).isTrue();
        assertThat(QueryParams.empty().toQueryString()).isEmpty();
    }

    @Test
    @DisplayName("with replaces earlier values without touching the original")
    void withIsCopy() {
        QueryParams original = QueryParams.parse("a=1&a=2");

        QueryParams updated = original.with("a", "3");

        assertThat(updated.all("a")).containsExactly("3");
        assertThat(original.all("a")).containsExactly("1", "2");
        assertThat(updated).isNotEqualTo(original);
        assertThat(QueryParams.of(Map.of("a", "3"))).isEqualTo(updated);
    }
}
