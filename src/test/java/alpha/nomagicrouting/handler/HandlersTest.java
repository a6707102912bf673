package alpha.nomagicrouting.handler;

import alpha.nomagicrouting.message.Context;
import alpha.nomagicrouting.util.Attributes;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Small tests for {@link Handlers}.
 *
 * @author NoMagicRouting contributors
 */
class HandlersTest
{
    private final Context ctx = mock(Context.class);

    @Test
    void noop() throws Exception {
        assertThat(Handlers.noop().handle(ctx)).isSameAs(Output.none());
        verifyNoInteractions(ctx);
    }

    @Test
    void run() throws Exception {
        var attrs = mock(Attributes.class);
        when(ctx.attributes()).thenReturn(attrs);
        var h = Handlers.run(c -> c.attributes().set("k", "v"));
        assertThat(h.handle(ctx)).isSameAs(Output.none());
        verify(attrs).set("k", "v");
    }

    @Test
    void text() throws Exception {
        assertThat(Handlers.text("hi").handle(ctx)).isEqualTo(Output.of("hi"));
    }

    @Test
    void text_supplier_called_each_time() throws Exception {
        var n = new AtomicInteger();
        var h = Handlers.text(() -> "#" + n.incrementAndGet());
        assertThat(h.handle(ctx)).isEqualTo(Output.of("#1"));
        assertThat(h.handle(ctx)).isEqualTo(Output.of("#2"));
    }

    @Test
    void bytes_not_copied() throws Exception {
        byte[] b = {1, 2, 3};
        assertThat(Handlers.bytes(b).handle(ctx).value()).isSameAs(b);
    }

    @Test
    void data() throws Exception {
        assertThat(Handlers.data(42).handle(ctx)).isEqualTo(Output.data(42));
        assertThatThrownBy(() -> Handlers.data(null))
                .isExactlyInstanceOf(NullPointerException.class);
    }

    @Test
    void fail() {
        var exc = new IOException("boom");
        assertThatThrownBy(() -> Handlers.fail(exc).handle(ctx)).isSameAs(exc);
    }
}
