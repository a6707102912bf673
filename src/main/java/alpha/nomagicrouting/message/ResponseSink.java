package alpha.nomagicrouting.message;

import java.io.IOException;
import java.io.OutputStream;

import static java.util.Objects.requireNonNull;

/**
 * Where handler output goes.<p>
 *
 * The sink is provided by the transport that started the dispatch. If the
 * sink also implements {@link DataWriter}, all output is given to {@link
 * DataWriter#writeData(Object)} instead of being encoded into bytes.
 *
 * @author NoMagicRouting contributors
 */
@FunctionalInterface
public interface ResponseSink
{
    /**
     * Returns a sink that discards all bytes.
     *
     * @return a sink that discards all bytes
     */
    static ResponseSink discarding() {
        return bytes -> {};
    }

    /**
     * Returns a sink that writes to the given stream.<p>
     *
     * The stream is never flushed nor closed by the sink.
     *
     * @param out stream to write to
     * @return a sink that writes to the given stream
     * @throws NullPointerException if {@code out} is {@code null}
     */
    static ResponseSink to(OutputStream out) {
        requireNonNull(out);
        return out::write;
    }

    /**
     * Writes bytes.
     *
     * @param bytes to write
     * @throws IOException if an I/O error occurs
     */
    void write(byte[] bytes) throws IOException;
}
