/**
 * The routing tree.<p>
 *
 * A {@link alpha.nomagicrouting.route.Router Router} is a node that has
 * children, a {@link alpha.nomagicrouting.route.Route Route} is a leaf. Both
 * are {@link alpha.nomagicrouting.route.Matchable Matchable} using a {@link
 * alpha.nomagicrouting.route.RoutePattern RoutePattern} compiled from a route
 * specification such as {@code "GET,POST /users/<id:\\d+>"}.
 */
package alpha.nomagicrouting.route;
