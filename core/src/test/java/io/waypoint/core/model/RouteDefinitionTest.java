package io.waypoint.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.waypoint.core.matcher.MatcherOptions;
import io.waypoint.core.matcher.MatcherRegistry;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RouteDefinition")
class RouteDefinitionTest {

    @Test
    @DisplayName("meta accepts null values and keeps insertion order")
    void nullMetaValue() {
        RouteDefinition definition = RouteDefinition.builder("/x")
                .meta("title", null)
                .meta("layout", "wide")
                .build();

        assertThat(definition.meta()).containsKey("title").containsEntry("layout", "wide");
        assertThat(definition.meta().get("title")).isNull();
        assertThat(definition.meta().keySet()).containsExactly("title", "layout");
    }

    @Test
    @DisplayName("a null meta value survives registration and shows up in the resolved meta")
    void nullMetaValueRegistered() {
        MatcherRegistry registry = new MatcherRegistry(MatcherOptions.DEFAULT);
        registry.addRoute(RouteDefinition.builder("/x").meta("title", null).build());

        MatchResult match = registry.match("/x").orElseThrow();
        ResolvedLocation location =
                ResolvedLocation.of("/x", match.params(), QueryParams.empty(), "", match.matchedChain());

        assertThat(location.meta()).containsKey("title");
        assertThat(location.meta().get("title")).isNull();
    }

    @Test
    @DisplayName("meta is copied and read-only")
    void metaIsCopied() {
        Map<String, Object> source = new HashMap<>();
        source.put("a", 1);
        RouteDefinition definition = RouteDefinition.builder("/x").meta(source).build();
        source.put("b", 2);

        assertThat(definition.meta()).containsOnlyKeys("a");
        assertThatThrownBy(() -> definition.meta().put("c", 3)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("redirect overloads wrap string, location and function targets")
    void redirectForms() {
        assertThat(RouteDefinition.builder("/a").redirect("/b?x=1").build().redirect())
                .isInstanceOfSatisfying(RouteRedirect.Fixed.class, r -> {
                    assertThat(r.location().path()).isEqualTo("/b");
                    assertThat(r.location().query().first("x")).isEqualTo("1");
                });
        assertThat(RouteDefinition.builder("/a")
                        .redirect(RawLocation.named("home", Map.of()))
                        .build()
                        .redirect())
                .isInstanceOfSatisfying(
                        RouteRedirect.Fixed.class, r -> assertThat(r.location().name()).isEqualTo("home"));
        assertThat(RouteDefinition.builder("/a")
                        .redirect(to -> RawLocation.parse("/b"))
                        .build()
                        .redirect())
                .isInstanceOf(RouteRedirect.Computed.class);
        assertThat(RouteDefinition.builder("/a").redirect((String) null).build().redirect()).isNull();
    }

    @Test
    @DisplayName("a computed redirect returning null is rejected")
    void computedRedirectReturningNull() {
        RouteRedirect redirect = RouteRedirect.computed(to -> null);
        ResolvedLocation to = ResolvedLocation.unmatched("/a", QueryParams.empty(), "");

        assertThatThrownBy(() -> redirect.target(to))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Redirect function for '/a' returned null");
    }
}
