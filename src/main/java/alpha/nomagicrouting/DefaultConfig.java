package alpha.nomagicrouting;

import alpha.nomagicrouting.handler.HandlerInvoker;

import java.nio.charset.Charset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 *
 * @author NoMagicRouting contributors
 */
final class DefaultConfig implements Config {
    private final Builder        builder;
    private final Charset        textCharset;
    private final boolean        ignoreTrailingSlash;
    private final HandlerInvoker handlerInvoker;

    private DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder             = b;
        textCharset         = s.textCharset;
        ignoreTrailingSlash = s.ignoreTrailingSlash;
        handlerInvoker      = s.handlerInvoker;
    }

    @Override
    public Charset textCharset() {
        return textCharset;
    }

    @Override
    public boolean ignoreTrailingSlash() {
        return ignoreTrailingSlash;
    }

    @Override
    public HandlerInvoker handlerInvoker() {
        return handlerInvoker;
    }

    @Override
    public Builder toBuilder() {
        return builder;
    }

    @Override
    public String toString() {
        return "DefaultConfig{" +
                "textCharset=" + textCharset +
                ", ignoreTrailingSlash=" + ignoreTrailingSlash +
                ", handlerInvoker=" + handlerInvoker + '}';
    }

    /**
     * Each builder stores only the one modification it represents and a link
     * to the builder it was derived from. The modifications are replayed from
     * the root when the configuration is built.
     */
    static final class DefaultBuilder implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder(null, null);

        static final class MutableState {
            Charset        textCharset         = UTF_8;
            boolean        ignoreTrailingSlash = false;
            HandlerInvoker handlerInvoker      = HandlerInvoker.DIRECT;
        }

        private final DefaultBuilder prev;
        private final Consumer<MutableState> modifier;

        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            this.prev = prev;
            this.modifier = modifier;
        }

        private DefaultBuilder derive(Consumer<MutableState> modifier) {
            return new DefaultBuilder(this, modifier);
        }

        @Override
        public Builder textCharset(Charset newVal) {
            requireNonNull(newVal);
            return derive(s -> s.textCharset = newVal);
        }

        @Override
        public Builder ignoreTrailingSlash(boolean newVal) {
            return derive(s -> s.ignoreTrailingSlash = newVal);
        }

        @Override
        public Builder handlerInvoker(HandlerInvoker newVal) {
            requireNonNull(newVal);
            return derive(s -> s.handlerInvoker = newVal);
        }

        @Override
        public Config build() {
            Deque<Consumer<MutableState>> mods = new ArrayDeque<>();
            for (DefaultBuilder b = this; b.modifier != null; b = b.prev) {
                mods.addFirst(b.modifier);
            }
            MutableState s = new MutableState();
            mods.forEach(m -> m.accept(s));
            return new DefaultConfig(this, s);
        }
    }
}
