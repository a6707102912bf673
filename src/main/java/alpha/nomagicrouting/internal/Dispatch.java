package alpha.nomagicrouting.internal;

import alpha.nomagicrouting.Config;
import alpha.nomagicrouting.handler.Handler;
import alpha.nomagicrouting.handler.HandlerInvoker;
import alpha.nomagicrouting.handler.Output;
import alpha.nomagicrouting.message.Context;
import alpha.nomagicrouting.message.DataWriter;
import alpha.nomagicrouting.message.ResponseSink;
import alpha.nomagicrouting.route.Match;
import alpha.nomagicrouting.route.Matchable;
import alpha.nomagicrouting.route.Route;
import alpha.nomagicrouting.route.Router;

import java.nio.charset.Charset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * The dispatch engine; walks the router tree for one request.<p>
 *
 * The engine keeps a stack of frames, one frame for each node entered. A
 * frame remembers how far its handlers and children have been iterated. One
 * step of the engine looks at the top frame and either invokes its next
 * handler, enters its next matching child, or pops the frame when both have
 * been exhausted. The dispatch ends when the stack is empty, when a normal or
 * error route runs to completion, or when a handler aborts.<p>
 *
 * A handler that calls {@link Context#next()} or {@link Context#nextRoute()}
 * recursively runs the steps that remain, and gets control back when the
 * dispatch has ended. A handler that returns without calling either lets the
 * engine continue where it was, which has the same effect.<p>
 *
 * An instance is confined to the thread that called {@link #execute(Router,
 * String, String, ResponseSink)}.
 *
 * @author NoMagicRouting contributors
 */
public final class Dispatch
{
    private static final System.Logger LOG
            = System.getLogger(Dispatch.class.getPackageName());

    /**
     * Dispatches a request.<p>
     *
     * The given router is not matched. It is entered as-is, with the request
     * path remaining to be matched by its children.
     *
     * @param root   router to dispatch to
     * @param method of request
     * @param path   of request
     * @param sink   where handler output is written
     *
     * @return the context of the completed dispatch
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    public static Context execute(Router root, String method, String path, ResponseSink sink) {
        requireNonNull(root);
        requireNonNull(method);
        requireNonNull(path);
        requireNonNull(sink);
        var d = new Dispatch(root.config(), method, path, sink);
        d.start(root);
        return d.ctx;
    }

    /**
     * Returns the path to dispatch, with one trailing slash removed if so
     * configured.
     */
    static String effectivePath(Config config, String path) {
        if (config.ignoreTrailingSlash() && path.length() > 1 && path.endsWith("/")) {
            return path.substring(0, path.length() - 1);
        }
        return path;
    }

    private final DefaultContext ctx;
    private final HandlerInvoker invoker;
    private final Charset charset;
    private final Deque<Frame> stack;
    // The invocation of the handler currently running
    private Invocation active;
    // Set when no more handlers will run
    private boolean done;

    private Dispatch(Config config, String method, String path, ResponseSink sink) {
        this.ctx     = new DefaultContext(this, method, path, sink);
        this.invoker = config.handlerInvoker();
        this.charset = config.textCharset();
        this.stack   = new ArrayDeque<>();
        this.active  = null;
        this.done    = false;
    }

    private void start(Router root) {
        String p = effectivePath(root.config(), ctx.path());
        LOG.log(DEBUG, () -> "Dispatching " + ctx.method() + " " + p);
        stack.push(new Frame(root, p, Map.of()));
        run();
        ctx.params(Map.of());
        if (ctx.hasError()) {
            LOG.log(WARNING, "Dispatch of " + ctx.method() + " " + ctx.path() +
                    " ended with an unhandled error.", ctx.error());
        } else {
            LOG.log(DEBUG, () -> "Dispatch of " + ctx.method() + " " + ctx.path() +
                    " ended, handled: " + ctx.isHandled());
        }
    }

    private void run() {
        while (!done && !stack.isEmpty()) {
            step();
        }
    }

    private void step() {
        final Frame f = stack.peek();
        final var handlers = f.node.handlers();
        if (f.handlerCursor < handlers.size()) {
            if (ctx.hasError() ? f.node instanceof Router : isErrorRoute(f.node)) {
                // Router handlers do not run while an error is pending, error
                // route handlers only while one is
                f.handlerCursor = handlers.size();
                return;
            }
            invoke(f, handlers.get(f.handlerCursor++));
            return;
        }
        if (f.node instanceof Router r && f.childCursor < r.children().size()) {
            Matchable child = r.children().get(f.childCursor++);
            if (!isEligible(child)) {
                return;
            }
            Match m = child.match(ctx.method(), f.remaining);
            if (m != null) {
                push(child, m, f);
            }
            return;
        }
        pop();
    }

    private static boolean isErrorRoute(Matchable node) {
        return node instanceof Route r && r.isErrorRoute();
    }

    private boolean isEligible(Matchable child) {
        if (child instanceof Route r) {
            return r.isErrorRoute() == ctx.hasError();
        }
        // Routers are entered regardless, they may have error routes
        return true;
    }

    private void push(Matchable child, Match m, Frame parent) {
        final Map<String, String> params;
        if (m.params().isEmpty()) {
            params = parent.params;
        } else if (parent.params.isEmpty()) {
            params = m.params();
        } else {
            var merged = new LinkedHashMap<>(parent.params);
            merged.putAll(m.params());
            params = unmodifiableMap(merged);
        }
        LOG.log(DEBUG, () -> "Entering " + child + " with remaining path \"" +
                m.remaining() + "\"");
        stack.push(new Frame(child, m.remaining(), params));
        ctx.params(params);
    }

    private void pop() {
        stack.pop();
        ctx.params(stack.isEmpty() ? Map.of() : stack.peek().params);
    }

    /**
     * Pops frames up to and including the given frame.
     */
    private void popThrough(Frame f) {
        while (!stack.isEmpty()) {
            if (stack.pop() == f) {
                break;
            }
        }
        ctx.params(stack.isEmpty() ? Map.of() : stack.peek().params);
    }

    private void invoke(Frame f, Handler h) {
        if (Thread.currentThread().isInterrupted()) {
            LOG.log(DEBUG, () -> "Thread interrupted, dispatch of " +
                    ctx.method() + " " + ctx.path() + " ends.");
            done = true;
            return;
        }
        final var inv = new Invocation(f);
        final var prev = active;
        active = inv;
        ctx.params(f.params);
        try {
            write(invoker.invoke(ctx, h));
        } catch (Exception e) {
            fail(inv, e);
            return;
        } finally {
            inv.running = false;
            active = prev;
        }
        if (inv.transferred) {
            return;
        }
        if (f.node instanceof Route r && !r.isMiddleware() &&
            (f.handlerCursor == r.handlers().size() ||
             r.isErrorRoute() && !ctx.hasError())) {
            LOG.log(DEBUG, () -> r + " completed, request handled.");
            ctx.handled();
            done = true;
        }
        // Else implicit next; the loop carries on from the same frame
    }

    private void write(Output out) throws Exception {
        if (out == null || out instanceof Output.None) {
            return;
        }
        final ResponseSink sink = ctx.response();
        if (sink instanceof DataWriter dw) {
            dw.writeData(out.value());
            return;
        }
        final byte[] bytes;
        if (out instanceof Output.Bytes b) {
            bytes = b.bytes();
        } else if (out instanceof Output.Text t) {
            bytes = t.text().getBytes(charset);
        } else {
            bytes = String.valueOf(out.value()).getBytes(charset);
        }
        sink.write(bytes);
    }

    private void fail(Invocation inv, Exception e) {
        ctx.error(e);
        if (inv.transferred) {
            LOG.log(DEBUG, () -> "Handler of " + inv.frame.node +
                    " failed after passing control, error recorded: " + e);
            return;
        }
        LOG.log(DEBUG, () -> "Handler of " + inv.frame.node +
                " failed, error recorded: " + e);
        popThrough(inv.frame);
    }

    void next() {
        final Invocation inv = transfer("next");
        if (inv == null) {
            return;
        }
        resume(inv);
    }

    void nextRoute() {
        final Invocation inv = transfer("nextRoute");
        if (inv == null) {
            return;
        }
        popThrough(inv.frame);
        resume(inv);
    }

    void abort() {
        final Invocation inv = transfer("abort");
        if (inv == null) {
            return;
        }
        LOG.log(DEBUG, () -> "Handler of " + inv.frame.node + " aborted the dispatch.");
        ctx.handled();
        done = true;
    }

    /**
     * Marks the running invocation as transferred.
     *
     * @return the invocation, or {@code null} if it has already transferred
     */
    private Invocation transfer(String method) {
        final Invocation inv = active;
        if (inv == null || !inv.running) {
            throw new UnsupportedOperationException(Context.class.getSimpleName() +
                    "." + method + "() not called from within a running handler");
        }
        if (inv.transferred) {
            LOG.log(DEBUG, () -> Context.class.getSimpleName() + "." + method +
                    "() ignored, control has already been passed.");
            return null;
        }
        inv.transferred = true;
        return inv;
    }

    private void resume(Invocation inv) {
        // Run the rest, then hand back to the invoking handler
        active = null;
        try {
            run();
        } finally {
            active = inv;
            ctx.params(inv.frame.params);
        }
    }

    private static final class Frame {
        final Matchable node;
        // Path left for the children
        final String remaining;
        final Map<String, String> params;
        int handlerCursor;
        int childCursor;

        Frame(Matchable node, String remaining, Map<String, String> params) {
            this.node = node;
            this.remaining = remaining;
            this.params = params;
        }
    }

    private static final class Invocation {
        final Frame frame;
        boolean running = true;
        boolean transferred;

        Invocation(Frame frame) {
            this.frame = frame;
        }
    }
}
