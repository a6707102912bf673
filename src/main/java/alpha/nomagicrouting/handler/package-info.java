/**
 * Handlers make things happen.<p>
 *
 * A {@link alpha.nomagicrouting.handler.Handler Handler} processes a {@link
 * alpha.nomagicrouting.message.Context Context} into an {@link
 * alpha.nomagicrouting.handler.Output Output}, which is written to the {@link
 * alpha.nomagicrouting.message.ResponseSink ResponseSink} of the request. The
 * {@link alpha.nomagicrouting.handler.HandlerInvoker HandlerInvoker} decides
 * how a handler is called.
 */
package alpha.nomagicrouting.handler;
