package villagecompute.metering.integration.inference;

import java.util.Optional;

/**
 * Failure reported by the inference provider client.
 */
public class ProviderException extends RuntimeException {

    /**
     * Error taxonomy. Only {@link #CONTEXT_LENGTH_EXCEEDED} is ever retried, and only once.
     */
    public enum Kind {
        CONTEXT_LENGTH_EXCEEDED,
        AUTHENTICATION,
        INVALID_REQUEST,
        RATE_LIMITED,
        UNAVAILABLE,
        TIMEOUT,
        ABORTED,
        UNKNOWN
    }

    private final Kind kind;
    private final ContextLengthError contextLengthError;

    public ProviderException(String message) {
        this(Kind.UNKNOWN, message, null, null);
    }

    public ProviderException(String message, Throwable cause) {
        this(Kind.UNKNOWN, message, null, cause);
    }

    public ProviderException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public ProviderException(Kind kind, String message, ContextLengthError contextLengthError, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.contextLengthError = contextLengthError;
    }

    /**
     * Context-length rejection with parsed limits.
     */
    public static ProviderException contextLength(String message, ContextLengthError details, Throwable cause) {
        return new ProviderException(Kind.CONTEXT_LENGTH_EXCEEDED, message, details, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public Optional<ContextLengthError> getContextLengthError() {
        return Optional.ofNullable(contextLengthError);
    }
}
