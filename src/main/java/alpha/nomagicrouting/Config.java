package alpha.nomagicrouting;

import alpha.nomagicrouting.handler.HandlerInvoker;
import alpha.nomagicrouting.handler.Output;
import alpha.nomagicrouting.route.Router;

import java.nio.charset.Charset;

/**
 * Router configuration.<p>
 *
 * A configuration is given to a root {@link Router} and is shared by all
 * routers grouped beneath it. {@link Config#toBuilder()} allows for any
 * configuration object to be used as a template for a new instance:
 *
 * <pre>{@code
 *   Router root = Router.create(Config.configuration()
 *           .ignoreTrailingSlash(true)
 *           .build());
 * }</pre>
 *
 * The implementation is immutable.
 *
 * @see Router#create(Config)
 *
 * @author NoMagicRouting contributors
 */
public interface Config
{
    /**
     * The configuration used by {@link Router#create()}.<p>
     *
     * This instance contains the following values:
     *
     * <pre>
     *   Text charset = UTF-8
     *   Ignore trailing slash = false
     *   Handler invoker = {@link HandlerInvoker#DIRECT}
     * </pre>
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();

    /**
     * Returns a builder initialized with the values of {@link #DEFAULT}.
     *
     * @return a builder initialized with the values of {@link #DEFAULT}
     */
    static Builder configuration() {
        return DEFAULT.toBuilder();
    }

    /**
     * Returns the charset used to encode {@linkplain Output.Text text} and
     * {@linkplain Output.Data formatted} handler output.<p>
     *
     * The default value is UTF-8.
     *
     * @return the charset used to encode handler output
     */
    Charset textCharset();

    /**
     * Returns whether to remove one trailing forward slash from the path
     * before a dispatch begins.<p>
     *
     * If {@code true}, a request to "/users/" dispatches as if the request was
     * made to "/users". The root path "/" is left untouched.<p>
     *
     * The default value is {@code false}.
     *
     * @return whether to remove one trailing forward slash
     */
    boolean ignoreTrailingSlash();

    /**
     * Returns the capability used to invoke handlers.<p>
     *
     * The default value is {@link HandlerInvoker#DIRECT}.
     *
     * @return the capability used to invoke handlers
     */
    HandlerInvoker handlerInvoker();

    /**
     * Returns a builder pre-populated with the values of this configuration.
     *
     * @return a builder pre-populated with the values of this configuration
     */
    Builder toBuilder();

    /**
     * Builder of a {@link Config}.<p>
     *
     * The builder is immutable. All setter methods return a new builder
     * representing the new state.
     */
    interface Builder {
        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#textCharset()
         */
        Builder textCharset(Charset newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#ignoreTrailingSlash()
         */
        Builder ignoreTrailingSlash(boolean newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#handlerInvoker()
         */
        Builder handlerInvoker(HandlerInvoker newVal);

        /**
         * Builds the configuration.
         *
         * @return a new configuration
         */
        Config build();
    }
}
