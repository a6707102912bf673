package alpha.nomagicrouting.handler;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link Output}.
 *
 * @author NoMagicRouting contributors
 */
class OutputTest
{
    @Test
    void none() {
        assertThat(Output.none()).isSameAs(Output.None.INSTANCE);
        assertThat(Output.none().value()).isNull();
    }

    @Test
    void kinds() {
        byte[] b = {1};
        assertThat(Output.of(b)).isInstanceOf(Output.Bytes.class);
        assertThat(Output.of(b).value()).isSameAs(b);
        assertThat(Output.of("x")).isEqualTo(new Output.Text("x"));
        assertThat(Output.of("x").value()).isEqualTo("x");
        assertThat(Output.data(42)).isEqualTo(new Output.Data(42));
        assertThat(Output.data(42).value()).isEqualTo(42);
    }

    @Test
    void null_data_is_none() {
        assertThat(Output.data(null)).isSameAs(Output.none());
    }

    @Test
    void null_rejected() {
        assertThatThrownBy(() -> Output.of((String) null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Output.of((byte[]) null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new Output.Data(null))
                .isExactlyInstanceOf(NullPointerException.class);
    }
}
