package alpha.nomagicrouting.message;

import alpha.nomagicrouting.handler.Handler;
import alpha.nomagicrouting.route.Router;
import alpha.nomagicrouting.util.Attributes;

import java.util.Map;
import java.util.Optional;

/**
 * The state of one dispatch; what a {@link Handler} is given.<p>
 *
 * A context is created by {@link Router#dispatch(String, String,
 * ResponseSink)} and is discarded when the dispatch returns. It is confined to
 * the thread running the dispatch and must not be shared with other
 * threads.<p>
 *
 * The control-transfer methods {@link #next()}, {@link #nextRoute()} and
 * {@link #abort()} belong to the handler invocation currently running. They
 * may only be called by that handler, while it is running. Only the first call
 * to any one of them has an effect, subsequent calls are NOP. Calling them from
 * outside a running handler throws {@link UnsupportedOperationException}.
 *
 * @author NoMagicRouting contributors
 */
public interface Context
{
    /**
     * Returns the request method.
     *
     * @return the request method (never {@code null})
     */
    String method();

    /**
     * Returns the request path as it was given to the dispatch.<p>
     *
     * The value never changes, even as routers consume prefixes of it.
     *
     * @return the request path (never {@code null})
     */
    String path();

    /**
     * Returns the path parameters captured by the nodes leading to the running
     * handler.<p>
     *
     * Parameters captured by a node are visible to the handlers of that node
     * and all of its descendants, and to no one else.
     *
     * @return the path parameters (unmodifiable, never {@code null})
     */
    Map<String, String> params();

    /**
     * Returns the value of a path parameter.
     *
     * @param name of parameter
     * @return the value (never {@code null} but possibly empty)
     * @throws NullPointerException if {@code name} is {@code null}
     * @see #params()
     */
    Optional<String> param(String name);

    /**
     * Returns the pending error.<p>
     *
     * The pending error is the exception thrown by a handler (or by the write
     * of its output). While an error is pending, only error routes run.
     *
     * @return the pending error (may be {@code null})
     */
    Exception error();

    /**
     * Returns {@code true} if an error is pending.
     *
     * @return {@code true} if an error is pending
     */
    default boolean hasError() {
        return error() != null;
    }

    /**
     * Clears the pending error.<p>
     *
     * An error handler that has recovered from the error may clear it and
     * call {@link #next()}, in order for normal routes to be eligible again.
     *
     * @return the error that was pending (may be {@code null})
     */
    Exception clearError();

    /**
     * Passes control to the next handler of the current node, or, if there is
     * none, to the first handler of the next matching node.<p>
     *
     * Returns when the rest of the dispatch has run.
     *
     * @throws UnsupportedOperationException
     *             if not called from within a running handler
     */
    void next();

    /**
     * Passes control to the next matching node of the enclosing router.<p>
     *
     * The remaining handlers and children of the node the running handler
     * belongs to are skipped.<p>
     *
     * Returns when the rest of the dispatch has run.
     *
     * @throws UnsupportedOperationException
     *             if not called from within a running handler
     */
    void nextRoute();

    /**
     * Ends the dispatch.<p>
     *
     * No more handlers will be invoked and the request is considered handled.
     * The running handler continues until it returns, and its output, if any,
     * is written.
     *
     * @throws UnsupportedOperationException
     *             if not called from within a running handler
     */
    void abort();

    /**
     * Returns {@code true} if the request has been handled.<p>
     *
     * A request is handled when a route (other than a middleware route) has
     * run to completion, or a handler aborted the dispatch. A dispatch that
     * reached no route, or which only passed through middleware, returns a
     * context where this method returns {@code false}.
     *
     * @return {@code true} if the request has been handled
     */
    boolean isHandled();

    /**
     * Returns the response sink.
     *
     * @return the response sink (never {@code null})
     */
    ResponseSink response();

    /**
     * Returns the attributes of this request.
     *
     * @return the attributes of this request (never {@code null})
     */
    Attributes attributes();
}
