package alpha.nomagicrouting.route;

import alpha.nomagicrouting.handler.Handler;

import java.util.List;

/**
 * A node of the routing tree; either a {@link Router} or a {@link Route}.<p>
 *
 * The node decides whether it accepts a request given its method and path,
 * how much of the path it consumes, and which parameters it captures. The
 * rules have been documented in {@link RoutePattern}.
 *
 * @author NoMagicRouting contributors
 */
public sealed interface Matchable permits Router, Route
{
    /**
     * Returns the pattern of this node.
     *
     * @return the pattern of this node
     */
    RoutePattern pattern();

    /**
     * Returns the handlers owned by this node.
     *
     * @return the handlers owned by this node (unmodifiable)
     */
    List<Handler> handlers();

    /**
     * Matches a method and a path.
     *
     * @param method of request
     * @param path   to match (possibly already consumed by a parent router)
     *
     * @return the match, or {@code null} if rejected
     *
     * @throws NullPointerException if any argument is {@code null}
     *
     * @see RoutePattern#match(String, String)
     */
    default Match match(String method, String path) {
        return pattern().match(method, path);
    }

    /**
     * Matches a path.<p>
     *
     * This method is similar to {@link #match(String, String)}, except that
     * it only matches the path.
     *
     * @param path to match
     *
     * @return the match, or {@code null} if rejected
     *
     * @throws NullPointerException if {@code path} is {@code null}
     *
     * @see RoutePattern#matchPath(String)
     */
    default Match matchPath(String path) {
        return pattern().matchPath(path);
    }
}
