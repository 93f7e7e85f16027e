package alpha.handlerkit;

/**
 * Namespace of constants related to the HTTP protocol.<p>
 *
 * Only the constants used by the library are declared. The servlet API has its
 * own set of status codes, but those are named after the reason phrase, which
 * does not read well next to a status code in a decision table.
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }

    /**
     * Method tokens.
     *
     * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3">RFC 7231 §4.3</a>
     */
    public static final class Method {
        private Method() {
            // Private
        }

        /** {@value} */
        public static final String GET = "GET";

        /** {@value} */
        public static final String POST = "POST";
    }

    /**
     * Status codes used by the library.
     */
    public static final class StatusCode {
        private StatusCode() {
            // Private
        }

        /**
         * {@value} {@value ReasonPhrase#OK}.
         *
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.3.1">RFC 7231 §6.3.1</a>
         */
        public static final int TWO_HUNDRED = 200;

        /**
         * {@value} {@value ReasonPhrase#MOVED_PERMANENTLY}.<p>
         *
         * Written by a permanent redirect.
         *
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.4.2">RFC 7231 §6.4.2</a>
         */
        public static final int THREE_HUNDRED_ONE = 301;

        /**
         * {@value} {@value ReasonPhrase#FOUND}.<p>
         *
         * Written by a temporary redirect.
         *
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.4.3">RFC 7231 §6.4.3</a>
         */
        public static final int THREE_HUNDRED_TWO = 302;

        /**
         * {@value} {@value ReasonPhrase#BAD_REQUEST}.<p>
         *
         * Request data that can not be decoded is a bad request.
         *
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.5.1">RFC 7231 §6.5.1</a>
         */
        public static final int FOUR_HUNDRED = 400;

        /**
         * {@value} {@value ReasonPhrase#FORBIDDEN}.
         *
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.5.3">RFC 7231 §6.5.3</a>
         */
        public static final int FOUR_HUNDRED_THREE = 403;

        /**
         * {@value} {@value ReasonPhrase#NOT_FOUND}.
         *
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.5.4">RFC 7231 §6.5.4</a>
         */
        public static final int FOUR_HUNDRED_FOUR = 404;

        /**
         * {@value} {@value ReasonPhrase#METHOD_NOT_ALLOWED}.
         *
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.5.5">RFC 7231 §6.5.5</a>
         */
        public static final int FOUR_HUNDRED_FIVE = 405;

        /**
         * {@value} {@value ReasonPhrase#INTERNAL_SERVER_ERROR}.<p>
         *
         * The catch-all for unclassified failures and recovered faults.
         *
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.6.1">RFC 7231 §6.6.1</a>
         */
        public static final int FIVE_HUNDRED = 500;

        /**
         * Returns {@code true} if the given status code is in the 4XX (Client
         * Error) series, otherwise {@code false}.
         *
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isClientError(int code) {
            return code >= 400 && code <= 499;
        }

        /**
         * Returns {@code true} if the given status code is in the 5XX (Server
         * Error) series, otherwise {@code false}.
         *
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isServerError(int code) {
            return code >= 500 && code <= 599;
        }
    }

    /**
     * Reason phrases of the {@link StatusCode}s.
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Private
        }

        /** {@value} */
        public static final String OK = "OK";
        /** {@value} */
        public static final String MOVED_PERMANENTLY = "Moved Permanently";
        /** {@value} */
        public static final String FOUND = "Found";
        /** {@value} */
        public static final String BAD_REQUEST = "Bad Request";
        /** {@value} */
        public static final String FORBIDDEN = "Forbidden";
        /** {@value} */
        public static final String NOT_FOUND = "Not Found";
        /** {@value} */
        public static final String METHOD_NOT_ALLOWED = "Method Not Allowed";
        /** {@value} */
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";
    }

    /**
     * Header names used by the library.
     */
    public static final class HeaderName {
        private HeaderName() {
            // Private
        }

        /**
         * Target of a redirect.
         *
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-7.1.2">RFC 7231 §7.1.2</a>
         */
        public static final String LOCATION = "Location";

        /**
         * Media type of the response body.
         *
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-3.1.1.5">RFC 7231 §3.1.1.5</a>
         */
        public static final String CONTENT_TYPE = "Content-Type";

        /**
         * Identifies the client, copied into error notifications.
         *
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-5.5.3">RFC 7231 §5.5.3</a>
         */
        public static final String USER_AGENT = "User-Agent";

        /**
         * Asks legacy Internet Explorer for a rendering engine. Set on every
         * response by default, see {@link Config#compatibilityHeaders()}.
         */
        public static final String X_UA_COMPATIBLE = "X-UA-Compatible";
    }
}
