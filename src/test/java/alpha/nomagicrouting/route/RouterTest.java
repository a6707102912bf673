package alpha.nomagicrouting.route;

import alpha.nomagicrouting.Config;
import alpha.nomagicrouting.handler.Handler;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static alpha.nomagicrouting.handler.Handlers.noop;
import static alpha.nomagicrouting.handler.Handlers.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for the registration API of {@link Router}.<p>
 *
 * How a router dispatches is tested by {@code DispatchTest}.
 *
 * @author NoMagicRouting contributors
 */
class RouterTest
{
    private final Router testee = Router.create();

    @Test
    void children_in_registration_order() {
        var a = testee.get("/a", noop());
        var g = testee.group("/g", r -> {});
        var b = testee.use(noop());
        var c = testee.error(noop());
        assertThat(testee.children()).containsExactly(a, g, b, c);
    }

    @Test
    void children_is_unmodifiable() {
        assertThatThrownBy(() -> testee.children().add(Route.of("/x")))
                .isExactlyInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void method_shortcuts() {
        assertThat(testee.get("/x").pattern().methods()).containsExactly("GET");
        assertThat(testee.post("/x").pattern().methods()).containsExactly("POST");
        assertThat(testee.put("/x").pattern().methods()).containsExactly("PUT");
        assertThat(testee.patch("/x").pattern().methods()).containsExactly("PATCH");
        assertThat(testee.delete("/x").pattern().methods()).containsExactly("DELETE");
        assertThat(testee.head("/x").pattern().methods()).containsExactly("HEAD");
        assertThat(testee.options("/x").pattern().methods()).containsExactly("OPTIONS");
        assertThat(testee.children()).hasSize(7);
    }

    @Test
    void to_with_many_methods() {
        var r = testee.to("GET,POST /users/<id>", noop());
        assertThat(r.pattern().methods()).containsExactly("GET", "POST");
        assertThat(r.pattern().path()).isEqualTo("/users/<id>");
        assertThat(r.isErrorRoute()).isFalse();
        assertThat(r.isMiddleware()).isFalse();
    }

    @Test
    void handlers_kept_in_order() {
        Handler h1 = text("1"), h2 = text("2");
        assertThat(testee.to("/x", h1, h2).handlers()).containsExactly(h1, h2);
    }

    @Test
    void use_is_catch_all_middleware() {
        var r = testee.use(noop());
        assertThat(r.isMiddleware()).isTrue();
        assertThat(r.isErrorRoute()).isFalse();
        assertThat(r.pattern()).isSameAs(RoutePattern.any());
    }

    @Test
    void error_is_catch_all_error_route() {
        var r = testee.error(noop());
        assertThat(r.isErrorRoute()).isTrue();
        assertThat(r.isMiddleware()).isFalse();
        assertThat(r.pattern()).isSameAs(RoutePattern.any());
    }

    @Test
    void group_registers_nested() {
        Handler auth = noop();
        var admin = testee.group("/admin", r -> {
            r.get("/users", noop());
            r.group("/<id:\\d+>", r2 -> r2.delete("", noop()));
        }, auth);
        assertThat(admin.parent()).isSameAs(testee);
        assertThat(admin.handlers()).containsExactly(auth);
        assertThat(admin.pattern().path()).isEqualTo("/admin");
        assertThat(admin.children()).hasSize(2);
        var inner = (Router) admin.children().get(1);
        assertThat(inner.parent()).isSameAs(admin);
        assertThat(inner.pattern().tokenNames()).containsExactly("id");
    }

    @Test
    void group_child_added_before_configure_runs() {
        testee.group("/g", r ->
            assertThat(testee.children()).containsExactly(r));
    }

    @Test
    void config_resolved_through_root() {
        var config = Config.configuration().ignoreTrailingSlash(true).build();
        var root = Router.create(config);
        var leaf = new Router[1];
        root.group("/a", a -> a.group("/b", b -> leaf[0] = b));
        assertThat(leaf[0].config()).isSameAs(config);
        assertThat(root.parent()).isNull();
    }

    @Test
    void default_config() {
        assertThat(testee.config()).isSameAs(Config.DEFAULT);
    }

    @Test
    void root_pattern_is_empty() {
        assertThat(testee.pattern().path()).isEmpty();
        assertThat(testee.handlers()).isEmpty();
    }

    @Test
    void add_route() {
        var r = Route.of("/x", noop());
        assertThat(testee.add(r)).isSameAs(r);
        assertThat(testee.children()).containsExactly(r);
    }

    @Test
    void null_handler() {
        assertThatThrownBy(() -> testee.get("/x", noop(), null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> testee.use((Handler) null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThat(testee.children()).isEmpty();
    }

    @Test
    void invalid_pattern_registers_nothing() {
        assertThatThrownBy(() -> testee.get("/<id", noop()))
                .isExactlyInstanceOf(RoutePatternInvalidException.class);
        assertThatThrownBy(() -> testee.group("/<>", r -> {}))
                .isExactlyInstanceOf(RoutePatternInvalidException.class);
        assertThat(testee.children()).isEmpty();
    }

    @Test
    void match_delegates_to_pattern() {
        var g = testee.group("GET /users", r -> {});
        assertThat(g.match("GET", "/users/1"))
                .isEqualTo(new Match("/users", "/1", Map.of()));
        assertThat(g.match("POST", "/users/1")).isNull();
        assertThat(g.matchPath("/users")).isNotNull();
    }
}
