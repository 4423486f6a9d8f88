package ru.xodavit.deadsimple.framework;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests for {@link RouteTable}.
 */
class RouteTableTest
{
    private static final Handler<Void> A = request -> Response.text("a");
    private static final Handler<Void> B = request -> Response.text("b");

    private final RouteTable<Void> testee = new RouteTable<>();

    @Test
    void match_root() {
        testee.register(HttpMethod.GET, "/", A);
        assertMatch(HttpMethod.GET, "/", A, Map.of());
        assertNoMatch(HttpMethod.GET, "/blabla");
    }

    @Test
    void wildcards_bind_positionally() {
        testee.register(HttpMethod.GET, "/user/{id}/post/{pid}", A);
        assertMatch(HttpMethod.GET, "/user/42/post/7", A, Map.of("id", "42", "pid", "7"));
    }

    @Test
    void literal_segments_must_be_equal() {
        testee.register(HttpMethod.GET, "/user/{id}/post/{pid}", A);
        assertNoMatch(HttpMethod.GET, "/user/42/comment/7");
        assertNoMatch(HttpMethod.GET, "/User/42/post/7");
    }

    @Test
    void segment_count_must_be_equal() {
        testee.register(HttpMethod.GET, "/a/{x}", A);
        assertNoMatch(HttpMethod.GET, "/a");
        assertNoMatch(HttpMethod.GET, "/a/b/c");
    }

    // "/a/" has one segment more than "/a"
    @Test
    void trailing_slash_matters() {
        testee.register(HttpMethod.GET, "/a", A);
        assertNoMatch(HttpMethod.GET, "/a/");

        testee.register(HttpMethod.GET, "/a/", B);
        assertMatch(HttpMethod.GET, "/a/", B, Map.of());
    }

    @Test
    void empty_segment_is_a_literal() {
        testee.register(HttpMethod.GET, "/a//b", A);
        assertMatch(HttpMethod.GET, "/a//b", A, Map.of());
        assertNoMatch(HttpMethod.GET, "/a/x/b");
    }

    @Test
    void first_registered_wins() {
        testee.register(HttpMethod.GET, "/a/{x}", A);
        testee.register(HttpMethod.GET, "/a/b", B);
        assertMatch(HttpMethod.GET, "/a/b", A, Map.of("x", "b"));
    }

    @Test
    void literal_before_wildcard_wins_when_registered_first() {
        testee.register(HttpMethod.GET, "/a/b", B);
        testee.register(HttpMethod.GET, "/a/{x}", A);
        assertMatch(HttpMethod.GET, "/a/b", B, Map.of());
        assertMatch(HttpMethod.GET, "/a/c", A, Map.of("x", "c"));
    }

    @Test
    void query_is_stripped_before_matching() {
        testee.register(HttpMethod.GET, "/search/{term}", A);
        assertMatch(HttpMethod.GET, "/search/cats?page=2&size=10", A, Map.of("term", "cats"));
    }

    @Test
    void segments_are_not_url_decoded() {
        testee.register(HttpMethod.GET, "/file/{name}", A);
        assertMatch(HttpMethod.GET, "/file/a%20b", A, Map.of("name", "a%20b"));
    }

    @Test
    void buckets_are_per_method() {
        testee.register(HttpMethod.POST, "/chat", A);
        testee.register(HttpMethod.TRACE, "/chat", B);
        assertNoMatch(HttpMethod.GET, "/chat");
        assertMatch(HttpMethod.POST, "/chat", A, Map.of());
        assertMatch(HttpMethod.TRACE, "/chat", B, Map.of());
    }

    @Test
    void not_found_pattern_is_an_ordinary_literal() {
        testee.register(HttpMethod.GET, "404", A);
        assertNoMatch(HttpMethod.GET, "/missing");
        assertMatch(HttpMethod.GET, "404", A, Map.of());
    }

    @Test
    void duplicates_are_kept_in_order() {
        testee.register(HttpMethod.GET, "/x", A);
        testee.register(HttpMethod.GET, "/x", B);
        assertThat(testee.routes(HttpMethod.GET))
                .extracting(Route::getHandler)
                .containsExactly(A, B);
        assertMatch(HttpMethod.GET, "/x", A, Map.of());
    }

    @Test
    void unbraced_wildcard_is_a_literal() {
        testee.register(HttpMethod.GET, "/a/{x", A);
        assertNoMatch(HttpMethod.GET, "/a/b");
        assertMatch(HttpMethod.GET, "/a/{x", A, Map.of());
    }

    private void assertMatch(HttpMethod method, String path, Handler<Void> expected, Map<String, String> params) {
        final var match = testee.find(method, path);
        assertThat(match).isPresent();
        assertThat(match.get().getHandler()).isSameAs(expected);
        assertThat(match.get().getParams()).isEqualTo(params);
    }

    private void assertNoMatch(HttpMethod method, String path) {
        assertThat(testee.find(method, path)).isEmpty();
    }
}
