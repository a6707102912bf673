package alpha.nomagicrouting.handler;

import alpha.nomagicrouting.message.Context;
import alpha.nomagicrouting.route.Router;

/**
 * A unit of request-processing logic associated with a {@link Router} or a
 * route.<p>
 *
 * Within a handler, call {@link Context#next()} to pass control to the next
 * handler on the same router or route, or to the first handler of the next
 * matching route. Call {@link Context#nextRoute()} to skip the remaining
 * handlers of the current node and pass control to the next matching route of
 * the enclosing router. Both calls return only when the rest of the dispatch
 * has run, which makes it possible to do work after it:
 *
 * <pre>{@code
 *   router.use(ctx -> {
 *       long start = System.nanoTime();
 *       ctx.next();
 *       log(ctx.path() + " took " + (System.nanoTime() - start) + " ns");
 *       return Output.none();
 *   });
 * }</pre>
 *
 * A handler returning without calling either method is treated as if it
 * called {@code next()}, except when it is the last handler of a route
 * registered using {@link Router#to(String, Handler...) to} or {@link
 * Router#error(Handler...) error}; the request is then considered handled and
 * the dispatch ends.<p>
 *
 * A handler that throws an exception does not fail the dispatch. The
 * exception becomes the {@linkplain Context#error() pending error}, no more
 * normal handlers will run, and control passes to the next matching error
 * route.<p>
 *
 * Handlers are shared by all concurrent dispatches and must be thread-safe.
 *
 * @see Handlers
 *
 * @author NoMagicRouting contributors
 */
@FunctionalInterface
public interface Handler
{
    /**
     * Processes the request.
     *
     * @param ctx request context (never {@code null})
     *
     * @return the output to write ({@code null} is the same as {@link
     *         Output#none()})
     *
     * @throws Exception
     *             anything, becomes the pending error of the request
     */
    Output handle(Context ctx) throws Exception;
}
