package io.waypoint.core.trie;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.waypoint.core.error.DuplicateRouteException;
import io.waypoint.core.model.RouteRecord;
import io.waypoint.core.pattern.PathCompiler;
import io.waypoint.core.pattern.PathSegments;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RouteTrie")
class RouteTrieTest {

    private RouteTrie trie;
    private long nextId;

    @BeforeEach
    void setUp() {
        trie = new RouteTrie("default", false);
        nextId = 1;
    }

    private RouteRecord insert(String pattern) {
        RouteRecord record = new RouteRecord(
                nextId++, "default", PathCompiler.compile(pattern), null, null, null, null, null, null, null, null);
        trie.insert(record);
        return record;
    }

    private Optional<TrieMatch> match(String path) {
        return trie.match(PathSegments.split(PathSegments.normalize(path)));
    }

    @Nested
    @DisplayName("priority")
    class Priority {

        @Test
        @DisplayName("static segment beats param regardless of registration order")
        void staticBeatsParam() {
            RouteRecord param = insert("/user/:id");
            RouteRecord fixed = insert("/user/profile");

            assertThat(match("/user/profile")).get().extracting(TrieMatch::record).isEqualTo(fixed);
            assertThat(match("/user/42")).get().extracting(TrieMatch::record).isEqualTo(param);
        }

        @Test
        @DisplayName("param beats wildcard")
        void paramBeatsWildcard() {
            RouteRecord wildcard = insert("/files/*");
            RouteRecord param = insert("/files/:name");

            assertThat(match("/files/readme")).get().extracting(TrieMatch::record).isEqualTo(param);
            assertThat(match("/files/a/b")).get().extracting(TrieMatch::record).isEqualTo(wildcard);
        }

        @Test
        @DisplayName("walk backtracks out of a static branch that dead-ends")
        void backtracksFromStaticBranch() {
            insert("/user/profile/edit");
            RouteRecord settings = insert("/user/:id/settings");

            Optional<TrieMatch> hit = match("/user/profile/settings");

            assertThat(hit).get().extracting(TrieMatch::record).isEqualTo(settings);
            assertThat(hit.get().captures()).containsExactly("profile");
        }

        @Test
        @DisplayName("backtracking into a wildcard after param branch fails")
        void backtracksIntoWildcard() {
            insert("/docs/:section/intro");
            RouteRecord catchAll = insert("/docs/*");

            Optional<TrieMatch> hit = match("/docs/guide/advanced");

            assertThat(hit).get().extracting(TrieMatch::record).isEqualTo(catchAll);
            assertThat(hit.get().captures()).containsExactly("guide/advanced");
        }
    }

    @Nested
    @DisplayName("ambiguous end-of-path terminals")
    class Ambiguity {

        @Test
        @DisplayName("exact terminal beats optional param and empty wildcard")
        void exactBeatsLoose() {
            RouteRecord wildcard = insert("/posts/*");
            RouteRecord optional = insert("/posts/:page?");
            RouteRecord exact = insert("/posts");

            assertThat(match("/posts")).get().extracting(TrieMatch::record).isEqualTo(exact);
            assertThat(trie.remove(exact.id())).isTrue();

            // optional and wildcard tie on score; the earlier registration wins
            assertThat(match("/posts")).get().extracting(TrieMatch::record).isEqualTo(wildcard);
            assertThat(trie.remove(wildcard.id())).isTrue();

            Optional<TrieMatch> hit = match("/posts");
            assertThat(hit).get().extracting(TrieMatch::record).isEqualTo(optional);
            assertThat(hit.get().captures()).containsExactly((String) null);
        }

        @Test
        @DisplayName("optional param matches with and without a value")
        void optionalParam() {
            RouteRecord record = insert("/archive/:year?");

            assertThat(match("/archive")).get().extracting(TrieMatch::record).isEqualTo(record);
            assertThat(match("/archive/2024").get().captures()).containsExactly("2024");
            assertThat(match("/archive/2024/01")).isEmpty();
        }

        @Test
        @DisplayName("score reflects the pattern's specificity")
        void scoreOfHit() {
            insert("/a/:b");
            assertThat(match("/a/x").get().score()).isEqualTo(1000);
        }
    }

    @Nested
    @DisplayName("insert and remove")
    class Mutation {

        @Test
        @DisplayName("two records on the same node conflict even with different param names")
        void conflictingInsert() {
            RouteRecord first = insert("/user/:id");

            assertThatThrownBy(() -> insert("/user/:uid"))
                    .isInstanceOfSatisfying(
                            DuplicateRouteException.class,
                            e -> assertThat(e.existingRecordId()).isEqualTo(first.id()));
        }

        @Test
        @DisplayName("literal edges are case-insensitive by default")
        void caseInsensitive() {
            RouteRecord about = insert("/About");
            assertThat(match("/about")).get().extracting(TrieMatch::record).isEqualTo(about);
        }

        @Test
        @DisplayName("case-sensitive trie keeps literal case")
        void caseSensitive() {
            RouteTrie strict = new RouteTrie("strict", true);
            strict.insert(new RouteRecord(
                    1, "strict", PathCompiler.compile("/About"), null, null, null, null, null, null, null, null));

            assertThat(strict.match(PathSegments.split("/about"))).isEmpty();
            assertThat(strict.match(PathSegments.split("/About"))).isPresent();
        }

        @Test
        @DisplayName("remove prunes empty branches but keeps shared prefixes")
        void removePrunes() {
            RouteRecord deep = insert("/a/b/c");
            RouteRecord shallow = insert("/a");

            assertThat(trie.remove(deep.id())).isTrue();

            assertThat(match("/a/b/c")).isEmpty();
            assertThat(match("/a")).get().extracting(TrieMatch::record).isEqualTo(shallow);
            assertThat(trie.find(PathCompiler.compile("/a/b"))).isEmpty();
            assertThat(trie.size()).isEqualTo(1);
            assertThat(trie.remove(deep.id())).isFalse();

            RouteRecord again = insert("/a/b/c");
            assertThat(match("/a/b/c")).get().extracting(TrieMatch::record).isEqualTo(again);
        }

        @Test
        @DisplayName("find looks up the exact node of a pattern")
        void find() {
            RouteRecord record = insert("/user/:id");
            assertThat(trie.find(PathCompiler.compile("/user/:other"))).contains(record);
            assertThat(trie.find(PathCompiler.compile("/user"))).isEmpty();
        }

        @Test
        @DisplayName("node keys ignore param names")
        void nodeKey() {
            assertThat(RouteTrie.nodeKey(PathCompiler.compile("/User/:id"), false))
                    .isEqualTo(RouteTrie.nodeKey(PathCompiler.compile("/user/:uid?"), false));
            assertThat(RouteTrie.nodeKey(PathCompiler.compile("/User/:id"), true))
                    .isNotEqualTo(RouteTrie.nodeKey(PathCompiler.compile("/user/:id"), true));
        }
    }

    @Test
    @DisplayName("root pattern matches only the root path")
    void rootMatch() {
        RouteRecord root = insert("/");
        assertThat(match("/")).get().extracting(TrieMatch::record).isEqualTo(root);
        assertThat(match("/x")).isEmpty();
    }
}
