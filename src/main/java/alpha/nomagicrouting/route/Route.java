package alpha.nomagicrouting.route;

import alpha.nomagicrouting.handler.Handler;
import alpha.nomagicrouting.message.Context;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A leaf of the routing tree; a pattern and the handlers to invoke when the
 * pattern matches.<p>
 *
 * Routes are normally created through the registration methods of {@link
 * Router}, which also decide the kind of route:
 *
 * <ul>
 *   <li>{@link Router#to(String, Handler...) to} (and the method shortcuts)
 *       creates a normal route. When the last handler of a normal route
 *       returns, the request has been handled and the dispatch ends.</li>
 *   <li>{@link Router#use(Handler...) use} creates a middleware route. It
 *       matches everything and when its last handler returns, the dispatch
 *       continues with the next sibling.</li>
 *   <li>{@link Router#error(Handler...) error} creates an error route. It
 *       matches everything, but only while an {@linkplain Context#error()
 *       error is pending}.</li>
 * </ul>
 *
 * Normal and middleware routes never run while an error is pending.<p>
 *
 * The implementation is immutable and thread-safe. It may be added to many
 * routers.
 *
 * @author NoMagicRouting contributors
 */
public final class Route implements Matchable
{
    /**
     * Creates a normal route.
     *
     * @param spec     route specification (see {@link RoutePattern})
     * @param handlers of the route
     *
     * @return a new route
     *
     * @throws NullPointerException
     *             if any argument or handler is {@code null}
     * @throws RoutePatternInvalidException
     *             if the specification is invalid
     */
    public static Route of(String spec, Handler... handlers) {
        return new Route(RoutePattern.parse(spec), handlers, Kind.NORMAL);
    }

    static Route middleware(Handler... handlers) {
        return new Route(RoutePattern.any(), handlers, Kind.MIDDLEWARE);
    }

    static Route onError(Handler... handlers) {
        return new Route(RoutePattern.any(), handlers, Kind.ERROR);
    }

    private enum Kind {
        NORMAL, MIDDLEWARE, ERROR
    }

    private final RoutePattern pattern;
    private final List<Handler> handlers;
    private final Kind kind;

    private Route(RoutePattern pattern, Handler[] handlers, Kind kind) {
        this.pattern  = pattern;
        // List.of() rejects null elements
        this.handlers = List.of(requireNonNull(handlers));
        this.kind     = kind;
    }

    @Override
    public RoutePattern pattern() {
        return pattern;
    }

    @Override
    public List<Handler> handlers() {
        return handlers;
    }

    /**
     * Returns {@code true} if this route runs only while an error is pending.
     *
     * @return {@code true} if this route runs only while an error is pending
     *
     * @see Router#error(Handler...)
     */
    public boolean isErrorRoute() {
        return kind == Kind.ERROR;
    }

    /**
     * Returns {@code true} if the dispatch continues with the next sibling
     * once the handlers of this route have run.
     *
     * @return {@code true} if this route is middleware
     *
     * @see Router#use(Handler...)
     */
    public boolean isMiddleware() {
        return kind == Kind.MIDDLEWARE;
    }

    @Override
    public String toString() {
        return "Route{" + pattern + ", " + kind + ", handlers=" + handlers.size() + '}';
    }
}
