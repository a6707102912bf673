package alpha.nomagicrouting.handler;

import alpha.nomagicrouting.message.Context;

import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Utility methods for building handlers.
 *
 * <pre>{@code
 *   router.get("/ping", text("pong"));
 *   router.use(run(ctx -> ctx.attributes().set("start", System.nanoTime())));
 * }</pre>
 *
 * @see Handler
 *
 * @author NoMagicRouting contributors
 */
public final class Handlers
{
    private Handlers() {
        // Empty
    }

    /**
     * An action against the context that produces no output.
     */
    @FunctionalInterface
    public interface Action {
        /**
         * Performs the action.
         *
         * @param ctx request context
         * @throws Exception anything
         */
        void accept(Context ctx) throws Exception;
    }

    private static final Handler NOOP = ctx -> Output.none();

    /**
     * Returns a handler that does nothing.
     *
     * @return a handler that does nothing
     */
    public static Handler noop() {
        return NOOP;
    }

    /**
     * Returns a handler that runs the given action and outputs nothing.
     *
     * @param action to run
     * @return a handler
     * @throws NullPointerException if {@code action} is {@code null}
     */
    public static Handler run(Action action) {
        requireNonNull(action);
        return ctx -> {
            action.accept(ctx);
            return Output.none();
        };
    }

    /**
     * Returns a handler that outputs the given text.
     *
     * @param text to output
     * @return a handler
     * @throws NullPointerException if {@code text} is {@code null}
     */
    public static Handler text(String text) {
        Output out = Output.of(text);
        return ctx -> out;
    }

    /**
     * Returns a handler that outputs text retrieved from a supplier on each
     * invocation.
     *
     * @param text supplier of text
     * @return a handler
     * @throws NullPointerException if {@code text} is {@code null}
     */
    public static Handler text(Supplier<String> text) {
        requireNonNull(text);
        return ctx -> Output.of(text.get());
    }

    /**
     * Returns a handler that outputs the given bytes.<p>
     *
     * The array is not copied.
     *
     * @param bytes to output
     * @return a handler
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    public static Handler bytes(byte[] bytes) {
        Output out = Output.of(bytes);
        return ctx -> out;
    }

    /**
     * Returns a handler that outputs the given structured value.
     *
     * @param value to output
     * @return a handler
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public static Handler data(Object value) {
        Output out = Output.data(requireNonNull(value));
        return ctx -> out;
    }

    /**
     * Returns a handler that always throws the given exception.<p>
     *
     * Useful for routes that exist only to trigger the error routes.
     *
     * @param exc to throw
     * @return a handler
     * @throws NullPointerException if {@code exc} is {@code null}
     */
    public static Handler fail(Exception exc) {
        requireNonNull(exc);
        return ctx -> {
            throw exc;
        };
    }
}
