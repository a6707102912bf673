package alpha.nomagicrouting.route;

import java.io.Serial;

/**
 * Thrown by {@link RoutePattern#parse(String)} if a route specification is
 * invalid.<p>
 *
 * An invalid specification is a programming error; the exception is thrown
 * during registration and is never the result of a request.
 *
 * @author NoMagicRouting contributors
 */
public class RoutePatternInvalidException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;

    private final String spec;

    /**
     * Constructs this object.
     *
     * @param spec    the offending specification
     * @param message detail message
     */
    public RoutePatternInvalidException(String spec, String message) {
        super(message + " Specification: \"" + spec + "\"");
        this.spec = spec;
    }

    /**
     * Constructs this object.
     *
     * @param spec    the offending specification
     * @param message detail message
     * @param cause   passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public RoutePatternInvalidException(String spec, String message, Throwable cause) {
        super(message + " Specification: \"" + spec + "\"", cause);
        this.spec = spec;
    }

    /**
     * Returns the offending specification.
     *
     * @return the offending specification
     */
    public String spec() {
        return spec;
    }
}
