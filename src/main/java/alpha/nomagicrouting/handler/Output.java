package alpha.nomagicrouting.handler;

import alpha.nomagicrouting.Config;
import alpha.nomagicrouting.message.DataWriter;
import alpha.nomagicrouting.message.ResponseSink;

import static java.util.Objects.requireNonNull;

/**
 * What a handler produced.<p>
 *
 * The set of output kinds is closed. After the handler returns, the output is
 * written to the {@link ResponseSink} of the request using this precedence:
 *
 * <ol>
 *   <li>If the sink is a {@link DataWriter}, the {@link #value() value} is
 *       given to {@link DataWriter#writeData(Object)}, whatever the kind.</li>
 *   <li>{@link Bytes} are written as-is.</li>
 *   <li>{@link Text} is encoded using {@link Config#textCharset()}.</li>
 *   <li>{@link Data} is formatted using {@link String#valueOf(Object)} and
 *       then encoded as text.</li>
 *   <li>{@link None} writes nothing.</li>
 * </ol>
 *
 * A failure to write is treated as a failure of the handler.
 *
 * @author NoMagicRouting contributors
 */
public sealed interface Output
        permits Output.None, Output.Bytes, Output.Text, Output.Data
{
    /**
     * Returns the empty output.
     *
     * @return the empty output
     */
    static Output none() {
        return None.INSTANCE;
    }

    /**
     * Returns an output of bytes.
     *
     * @param bytes to write
     * @return an output of bytes
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    static Output of(byte[] bytes) {
        return new Bytes(bytes);
    }

    /**
     * Returns an output of text.
     *
     * @param text to write
     * @return an output of text
     * @throws NullPointerException if {@code text} is {@code null}
     */
    static Output of(String text) {
        return new Text(text);
    }

    /**
     * Returns an output of a structured value.<p>
     *
     * A {@code null} value is the same as {@link #none()}.
     *
     * @param value to write
     * @return an output of a structured value
     */
    static Output data(Object value) {
        return value == null ? none() : new Data(value);
    }

    /**
     * Returns the value carried by this output.
     *
     * @return the value carried by this output ({@code null} only for {@link None})
     */
    Object value();

    /**
     * No output.
     */
    enum None implements Output {
        /** The only instance. */
        INSTANCE;

        @Override
        public Object value() {
            return null;
        }
    }

    /**
     * Bytes written verbatim.
     *
     * @param bytes the bytes
     */
    record Bytes(byte[] bytes) implements Output {
        /**
         * Initializes this object.
         *
         * @param bytes the bytes
         * @throws NullPointerException if {@code bytes} is {@code null}
         */
        public Bytes {
            requireNonNull(bytes);
        }

        @Override
        public Object value() {
            return bytes;
        }
    }

    /**
     * Text.
     *
     * @param text the text
     */
    record Text(String text) implements Output {
        /**
         * Initializes this object.
         *
         * @param text the text
         * @throws NullPointerException if {@code text} is {@code null}
         */
        public Text {
            requireNonNull(text);
        }

        @Override
        public Object value() {
            return text;
        }
    }

    /**
     * A structured value.
     *
     * @param value the value
     */
    record Data(Object value) implements Output {
        /**
         * Initializes this object.
         *
         * @param value the value
         * @throws NullPointerException if {@code value} is {@code null}
         */
        public Data {
            requireNonNull(value);
        }
    }
}
