package alpha.nomagicrouting.message;

import alpha.nomagicrouting.handler.Output;

/**
 * A {@link ResponseSink} that knows how to write typed data, for example by
 * serializing it into JSON.<p>
 *
 * When the sink of a request is a {@code DataWriter}, the router calls {@link
 * #writeData(Object)} with the {@link Output#value() value} of every non-empty
 * handler output, and never calls {@link #write(byte[])} itself.
 *
 * @author NoMagicRouting contributors
 */
public interface DataWriter extends ResponseSink
{
    /**
     * Writes the given value.
     *
     * @param data to write; a {@code byte[]}, a {@code String} or any other
     *             structured value (never {@code null})
     *
     * @throws Exception
     *             if writing fails, which is treated as a failure of the
     *             handler that produced the value
     */
    void writeData(Object data) throws Exception;
}
