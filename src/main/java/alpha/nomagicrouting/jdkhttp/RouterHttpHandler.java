package alpha.nomagicrouting.jdkhttp;

import alpha.nomagicrouting.HttpConstants.Method;
import alpha.nomagicrouting.message.Context;
import alpha.nomagicrouting.message.ResponseSink;
import alpha.nomagicrouting.route.Router;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;

import static alpha.nomagicrouting.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.nomagicrouting.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static alpha.nomagicrouting.HttpConstants.StatusCode.TWO_HUNDRED;
import static alpha.nomagicrouting.HttpConstants.StatusCode.TWO_HUNDRED_FOUR;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Serves the requests of a JDK {@link com.sun.net.httpserver.HttpServer}
 * using a router.
 *
 * <pre>{@code
 *   Router router = Router.create();
 *   router.get("/hello", text("Hello"));
 *   HttpServer server = HttpServer.create(new InetSocketAddress(8080), 0);
 *   server.createContext("/", new RouterHttpHandler(router));
 *   server.start();
 * }</pre>
 *
 * The dispatched path is the decoded path of the request URI ({@link
 * java.net.URI#getPath()}). Path parameters are therefore decoded, and a
 * pattern is written in decoded form, e.g. {@code "/café"}.<p>
 *
 * The output of all handlers is buffered and sent when the dispatch has
 * returned. The response status code is decided as follows:
 *
 * <ul>
 *   <li>A code set by a handler using {@link #status(Context, int)}.</li>
 *   <li>500 (Internal Server Error) if the dispatch ended with a pending
 *       error.</li>
 *   <li>404 (Not Found) if the request was not handled.</li>
 *   <li>200 (OK), or 204 (No Content) if there was no output.</li>
 * </ul>
 *
 * Response headers, if any, should be set by a handler on the exchange
 * returned from {@link #exchange(Context)}.
 *
 * @author NoMagicRouting contributors
 */
public final class RouterHttpHandler implements HttpHandler
{
    private static final System.Logger LOG
            = System.getLogger(RouterHttpHandler.class.getPackageName());

    private static final String STATUS = RouterHttpHandler.class.getName() + ".status";

    /**
     * Returns the exchange of the request being dispatched.
     *
     * @param ctx request context
     *
     * @return the exchange
     *
     * @throws IllegalArgumentException
     *             if the dispatch was not started by this class
     */
    public static HttpExchange exchange(Context ctx) {
        if (ctx.response() instanceof ExchangeSink s) {
            return s.exchange;
        }
        throw new IllegalArgumentException(
                "Context is not from a " + RouterHttpHandler.class.getSimpleName() + ".");
    }

    /**
     * Sets the status code of the response.
     *
     * @param ctx  request context
     * @param code status code
     *
     * @throws IllegalArgumentException
     *             if {@code code} is not in the range 100 to 599
     */
    public static void status(Context ctx, int code) {
        if (code < 100 || code > 599) {
            throw new IllegalArgumentException("Status code out of range: " + code);
        }
        ctx.attributes().set(STATUS, code);
    }

    private final Router router;

    /**
     * Initializes this object.
     *
     * @param router to dispatch to
     *
     * @throws NullPointerException if {@code router} is {@code null}
     */
    public RouterHttpHandler(Router router) {
        this.router = requireNonNull(router);
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            respond(exchange);
        } catch (IOException e) {
            LOG.log(WARNING, "Failed to respond.", e);
            throw e;
        } finally {
            exchange.close();
        }
    }

    private void respond(HttpExchange exchange) throws IOException {
        var buf = new ByteArrayOutputStream();
        String method = exchange.getRequestMethod(),
               path   = exchange.getRequestURI().getPath();
        var ctx = router.dispatch(method, path, new ExchangeSink(exchange, buf));
        int code = statusOf(ctx, buf.size());
        LOG.log(DEBUG, () -> method + " " + path + " -> " + code);
        byte[] body = buf.toByteArray();
        boolean noBody = body.length == 0 || method.equals(Method.HEAD);
        exchange.sendResponseHeaders(code, noBody ? -1 : body.length);
        if (!noBody) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        }
    }

    private static int statusOf(Context ctx, int size) {
        Integer custom = ctx.attributes().getAny(STATUS);
        if (custom != null) {
            return custom;
        }
        if (ctx.hasError()) {
            return FIVE_HUNDRED;
        }
        if (!ctx.isHandled()) {
            return FOUR_HUNDRED_FOUR;
        }
        return size == 0 ? TWO_HUNDRED_FOUR : TWO_HUNDRED;
    }

    /**
     * Buffers the output, and makes the exchange available to handlers.
     */
    private static final class ExchangeSink implements ResponseSink {
        final HttpExchange exchange;
        private final OutputStream buf;

        ExchangeSink(HttpExchange exchange, OutputStream buf) {
            this.exchange = exchange;
            this.buf = buf;
        }

        @Override
        public void write(byte[] bytes) throws IOException {
            buf.write(bytes);
        }
    }
}
