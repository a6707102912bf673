package alpha.nomagicrouting.route;

import alpha.nomagicrouting.Config;
import alpha.nomagicrouting.HttpConstants.Method;
import alpha.nomagicrouting.handler.Handler;
import alpha.nomagicrouting.internal.Dispatch;
import alpha.nomagicrouting.message.Context;
import alpha.nomagicrouting.message.ResponseSink;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * Dispatches a request to its matching routes, which call their associated
 * handlers. Also known as a "route group" when it is a child of another
 * router.<p>
 *
 * A router holds an ordered list of children; routes and child routers. The
 * order in which children are registered is the order in which they are
 * matched, and the first child that accepts the request is the one that will
 * be dispatched to. When the dispatch returns from that child without the
 * request having been handled, the next matching child is tried.
 *
 * <pre>{@code
 *   Router router = Router.create();
 *   router.use(logging);
 *   router.get("/users/<id:\\d+>", ctx -> Output.of("user " + ctx.param("id").get()));
 *   router.group("/admin", admin -> {
 *       admin.get("/users", listUsers);
 *       admin.post("/users", createUser);
 *   }, authenticate);
 *   router.error(ctx -> Output.of("Oops: " + ctx.error().getMessage()));
 * }</pre>
 *
 * A router may have handlers of its own (given to {@link #group(String,
 * Consumer, Handler...) group}). They run before any of the router's children
 * are tried, for all requests matching the router's prefix. They are middleware
 * scoped to the subtree.<p>
 *
 * The router tree must be built before the first dispatch and must not be
 * modified thereafter. Once built, the tree may be dispatched to concurrently
 * by many threads. The registration methods are not thread-safe.<p>
 *
 * How specifications are parsed and paths matched has been documented in
 * {@link RoutePattern}. How handlers steer a dispatch has been documented in
 * {@link Handler}.
 *
 * @author NoMagicRouting contributors
 */
public final class Router implements Matchable
{
    /**
     * Creates a root router using {@link Config#DEFAULT}.
     *
     * @return a new router
     */
    public static Router create() {
        return create(Config.DEFAULT);
    }

    /**
     * Creates a root router.
     *
     * @param config of the router and all of its descendants
     *
     * @return a new router
     *
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public static Router create(Config config) {
        return new Router(null, requireNonNull(config), RoutePattern.parse(""), new Handler[0]);
    }

    // Lookup only, a child router never outlives its parent in practice
    private final Router parent;
    // Only set for a root
    private final Config config;
    private final RoutePattern pattern;
    private final List<Handler> handlers;
    private final List<Matchable> children;

    private Router(Router parent, Config config, RoutePattern pattern, Handler[] handlers) {
        this.parent   = parent;
        this.config   = config;
        this.pattern  = pattern;
        this.handlers = List.of(requireNonNull(handlers));
        this.children = new ArrayList<>();
    }

    /**
     * Returns the parent router.
     *
     * @return the parent router ({@code null} if this is a root)
     */
    public Router parent() {
        return parent;
    }

    /**
     * Returns the configuration of the root router.
     *
     * @return the configuration of the root router
     */
    public Config config() {
        Router r = this;
        while (r.parent != null) {
            r = r.parent;
        }
        return r.config;
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
     * Returns the children of this router, in registration order.
     *
     * @return the children of this router (unmodifiable view)
     */
    public List<Matchable> children() {
        return unmodifiableList(children);
    }

    /**
     * Adds a group of routes sharing a common path prefix.<p>
     *
     * A child router is created using the given prefix and handlers, added as
     * the next child of this router, and then given to {@code configure},
     * which should register the routes of the group. For example:
     *
     * <pre>{@code
     *   router.group("/admin", r -> {
     *       r.get("/users", ...);
     *       r.post("/users", ...);
     *   });
     * }</pre>
     *
     * The prefix is a route specification and may declare methods and tokens.
     * The handlers of the group run before any of its routes are tried.
     *
     * @param prefix    route specification of the group
     * @param configure registers the group's routes
     * @param handlers  of the group
     *
     * @return the child router
     *
     * @throws NullPointerException
     *             if any argument or handler is {@code null}
     * @throws RoutePatternInvalidException
     *             if the prefix is invalid
     */
    public Router group(String prefix, Consumer<? super Router> configure, Handler... handlers) {
        requireNonNull(configure);
        Router child = new Router(this, null, RoutePattern.parse(prefix), handlers);
        children.add(child);
        configure.accept(child);
        return child;
    }

    /**
     * Creates a route and adds it to this router.<p>
     *
     * The specification should be of the form {@code "GET,POST /users/<id:\\d+>"}
     * where "GET,POST" are the methods the route should match and the rest is
     * the path pattern. If no method is specified, the route matches any
     * method.
     *
     * @param spec     route specification
     * @param handlers of the route
     *
     * @return the route
     *
     * @throws NullPointerException
     *             if any argument or handler is {@code null}
     * @throws RoutePatternInvalidException
     *             if the specification is invalid
     */
    public Route to(String spec, Handler... handlers) {
        return add(Route.of(spec, handlers));
    }

    /**
     * Adds a route matching only method GET.
     *
     * @param pattern  path pattern
     * @param handlers of the route
     * @return the route
     * @see #to(String, Handler...)
     */
    public Route get(String pattern, Handler... handlers) {
        return to(Method.GET + " " + pattern, handlers);
    }

    /**
     * Adds a route matching only method POST.
     *
     * @param pattern  path pattern
     * @param handlers of the route
     * @return the route
     * @see #to(String, Handler...)
     */
    public Route post(String pattern, Handler... handlers) {
        return to(Method.POST + " " + pattern, handlers);
    }

    /**
     * Adds a route matching only method PUT.
     *
     * @param pattern  path pattern
     * @param handlers of the route
     * @return the route
     * @see #to(String, Handler...)
     */
    public Route put(String pattern, Handler... handlers) {
        return to(Method.PUT + " " + pattern, handlers);
    }

    /**
     * Adds a route matching only method PATCH.
     *
     * @param pattern  path pattern
     * @param handlers of the route
     * @return the route
     * @see #to(String, Handler...)
     */
    public Route patch(String pattern, Handler... handlers) {
        return to(Method.PATCH + " " + pattern, handlers);
    }

    /**
     * Adds a route matching only method DELETE.
     *
     * @param pattern  path pattern
     * @param handlers of the route
     * @return the route
     * @see #to(String, Handler...)
     */
    public Route delete(String pattern, Handler... handlers) {
        return to(Method.DELETE + " " + pattern, handlers);
    }

    /**
     * Adds a route matching only method HEAD.
     *
     * @param pattern  path pattern
     * @param handlers of the route
     * @return the route
     * @see #to(String, Handler...)
     */
    public Route head(String pattern, Handler... handlers) {
        return to(Method.HEAD + " " + pattern, handlers);
    }

    /**
     * Adds a route matching only method OPTIONS.
     *
     * @param pattern  path pattern
     * @param handlers of the route
     * @return the route
     * @see #to(String, Handler...)
     */
    public Route options(String pattern, Handler... handlers) {
        return to(Method.OPTIONS + " " + pattern, handlers);
    }

    /**
     * Adds middleware.<p>
     *
     * The handlers are added to a route that matches any method and any path.
     * The route runs for all requests that reach it, i.e. requests not already
     * handled by a previously registered sibling. When its last handler
     * returns, the dispatch continues with the next sibling.
     *
     * @param handlers the middleware
     *
     * @return the route
     *
     * @throws NullPointerException if any handler is {@code null}
     */
    public Route use(Handler... handlers) {
        return add(Route.middleware(handlers));
    }

    /**
     * Adds error handlers.<p>
     *
     * The handlers are added to a route that matches any method and any path,
     * but only while an error is pending. An error becomes pending when a
     * handler throws an exception. An error handler is like a normal handler;
     * it may call {@link Context#next()} to pass control to the next error
     * handler.<p>
     *
     * An error handler that clears the error using {@link Context#clearError()}
     * recovers the request. The remaining handlers of the route will not run.
     * If the handler returns, the request is handled and the dispatch ends. If
     * it calls {@code next()}, the dispatch continues with the next sibling of
     * the route, for which normal routes are eligible again.
     *
     * @param handlers the error handlers
     *
     * @return the route
     *
     * @throws NullPointerException if any handler is {@code null}
     */
    public Route error(Handler... handlers) {
        return add(Route.onError(handlers));
    }

    /**
     * Adds a route.
     *
     * @param route to add
     *
     * @return the route (for chaining/fluency)
     *
     * @throws NullPointerException if {@code route} is {@code null}
     */
    public Route add(Route route) {
        children.add(requireNonNull(route));
        return route;
    }

    /**
     * Dispatches a request to the handlers of this router and its matching
     * children.<p>
     *
     * This router itself is not matched; the dispatch begins with its
     * handlers and then its children are matched against the given path.<p>
     *
     * The dispatch is synchronous and returns when no more handlers will run.
     * It never throws an exception on behalf of a handler. The returned
     * context tells whether the request was {@linkplain Context#isHandled()
     * handled} and whether an {@linkplain Context#error() error} remained
     * pending. Generating a "not found" or "internal server error" response is
     * the responsibility of the caller.
     *
     * @param method of request
     * @param path   of request
     * @param sink   where handler output is written
     *
     * @return the context of the completed dispatch
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    public Context dispatch(String method, String path, ResponseSink sink) {
        return Dispatch.execute(this, method, path, sink);
    }

    /**
     * Dispatches a request, discarding all handler output.
     *
     * @param method of request
     * @param path   of request
     *
     * @return the context of the completed dispatch
     *
     * @throws NullPointerException if any argument is {@code null}
     *
     * @see #dispatch(String, String, ResponseSink)
     */
    public Context dispatch(String method, String path) {
        return dispatch(method, path, ResponseSink.discarding());
    }

    @Override
    public String toString() {
        return "Router{" + pattern + ", handlers=" + handlers.size() +
                ", children=" + children.size() + '}';
    }
}
