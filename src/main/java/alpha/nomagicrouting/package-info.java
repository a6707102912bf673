/**
 * Home of the router {@link alpha.nomagicrouting.Config Config}.<p>
 *
 * <strong>Architectural Overview</strong>. A {@link
 * alpha.nomagicrouting.route.Router Router} owns an ordered list of child
 * routers and {@link alpha.nomagicrouting.route.Route Route}s. Each node may
 * own {@link alpha.nomagicrouting.handler.Handler Handler}s. A dispatch walks
 * the tree depth-first, invoking the handlers of each matched node, and the
 * handlers steer the walk through the {@link
 * alpha.nomagicrouting.message.Context Context}.
 */
package alpha.nomagicrouting;
