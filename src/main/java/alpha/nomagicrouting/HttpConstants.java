package alpha.nomagicrouting;

import alpha.nomagicrouting.route.Router;

/**
 * Namespace of constants related to the HTTP protocol.
 *
 * @author NoMagicRouting contributors
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }

    /**
     * Method tokens used by the registration shortcuts of {@link Router}.<p>
     *
     * A method token is case-sensitive. The router compares tokens exactly,
     * so "get" does not match a route registered for {@link #GET}.
     *
     * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.1">RFC 7231 §4.1</a>
     */
    public static final class Method {
        private Method() {
            // Private
        }

        /** Retrieve a representation of the target resource. */
        public static final String GET = "GET";

        /** Same as {@link #GET} except the response carries no body. */
        public static final String HEAD = "HEAD";

        /** Let the target resource process the enclosed payload. */
        public static final String POST = "POST";

        /** Create or replace the target resource. */
        public static final String PUT = "PUT";

        /** Partially modify the target resource. */
        public static final String PATCH = "PATCH";

        /** Remove the target resource. */
        public static final String DELETE = "DELETE";

        /** Describe the communication options of the target resource. */
        public static final String OPTIONS = "OPTIONS";
    }

    /**
     * Status codes used by the server adapter.
     */
    public static final class StatusCode {
        private StatusCode() {
            // Private
        }

        /** {@value} OK. */
        public static final int TWO_HUNDRED = 200;

        /** {@value} No Content. */
        public static final int TWO_HUNDRED_FOUR = 204;

        /** {@value} Not Found. */
        public static final int FOUR_HUNDRED_FOUR = 404;

        /** {@value} Internal Server Error. */
        public static final int FIVE_HUNDRED = 500;
    }
}
