package alpha.nomagicrouting.handler;

import alpha.nomagicrouting.Config;
import alpha.nomagicrouting.message.Context;

/**
 * Invokes a handler on behalf of the dispatch engine.<p>
 *
 * The invoker is the seam between the router and the application's calling
 * convention. The default, {@link #DIRECT}, simply calls the handler. An
 * application can install a different invoker using {@link
 * Config.Builder#handlerInvoker(HandlerInvoker)}, for example to resolve
 * handler arguments from the context or to time each invocation:
 *
 * <pre>{@code
 *   HandlerInvoker timed = (ctx, h) -> {
 *       long start = System.nanoTime();
 *       try {
 *           return h.handle(ctx);
 *       } finally {
 *           metrics.record(System.nanoTime() - start);
 *       }
 *   };
 * }</pre>
 *
 * Whatever the invoker throws is treated the same as if the handler threw it.
 *
 * @author NoMagicRouting contributors
 */
@FunctionalInterface
public interface HandlerInvoker
{
    /**
     * Calls {@link Handler#handle(Context)}.
     */
    HandlerInvoker DIRECT = new HandlerInvoker() {
        @Override
        public Output invoke(Context ctx, Handler handler) throws Exception {
            return handler.handle(ctx);
        }

        @Override
        public String toString() {
            return "HandlerInvoker.DIRECT";
        }
    };

    /**
     * Invokes the given handler.
     *
     * @param ctx     request context
     * @param handler to invoke
     *
     * @return the output of the handler (may be {@code null})
     *
     * @throws Exception from the handler, or from the invoker itself
     */
    Output invoke(Context ctx, Handler handler) throws Exception;
}
