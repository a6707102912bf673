package alpha.nomagicrouting;

import alpha.nomagicrouting.handler.HandlerInvoker;
import org.junit.jupiter.api.Test;

import static alpha.nomagicrouting.Config.DEFAULT;
import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link Config}.
 *
 * @author NoMagicRouting contributors
 */
class ConfigTest {
    @Test
    void defaults() {
        assertThat(DEFAULT.textCharset()).isEqualTo(UTF_8);
        assertThat(DEFAULT.ignoreTrailingSlash()).isFalse();
        assertThat(DEFAULT.handlerInvoker()).isSameAs(HandlerInvoker.DIRECT);
    }

    @Test
    void parentStateUnaffected() {
        final var mod = DEFAULT.toBuilder().ignoreTrailingSlash(true).build();

        // Default not modified
        assertThat(DEFAULT.ignoreTrailingSlash()).isFalse();
        // Mod is
        assertThat(mod.ignoreTrailingSlash()).isTrue();
    }

    @Test
    void builderIsImmutable() {
        var b1 = Config.configuration().textCharset(US_ASCII);
        var b2 = b1.ignoreTrailingSlash(true);

        var c1 = b1.build();
        var c2 = b2.build();

        assertThat(c1.textCharset()).isEqualTo(US_ASCII);
        assertThat(c1.ignoreTrailingSlash()).isFalse();
        assertThat(c2.textCharset()).isEqualTo(US_ASCII);
        assertThat(c2.ignoreTrailingSlash()).isTrue();
    }

    @Test
    void laterModificationWins() {
        var c = Config.configuration()
                .ignoreTrailingSlash(true)
                .ignoreTrailingSlash(false)
                .build();
        assertThat(c.ignoreTrailingSlash()).isFalse();
    }

    @Test
    void toBuilderIsTemplate() {
        HandlerInvoker inv = (ctx, h) -> h.handle(ctx);
        var c1 = Config.configuration().handlerInvoker(inv).build();
        var c2 = c1.toBuilder().textCharset(US_ASCII).build();
        assertThat(c2.handlerInvoker()).isSameAs(inv);
        assertThat(c2.textCharset()).isEqualTo(US_ASCII);
        assertThat(c1.textCharset()).isEqualTo(UTF_8);
    }

    @Test
    void nullRejected() {
        assertThatThrownBy(() -> Config.configuration().textCharset(null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Config.configuration().handlerInvoker(null))
                .isExactlyInstanceOf(NullPointerException.class);
    }
}
