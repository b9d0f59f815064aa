package villagecompute.metering.exceptions;

/**
 * Thrown when the model cannot serve even the minimum response given the prompt size.
 *
 * <p>
 * The user should shorten the conversation or pick a model with a larger context window. Never retried.
 */
public class ContextCapacityTooLowException extends RuntimeException {

    private final int maxContextTokens;
    private final int inputTokens;

    public ContextCapacityTooLowException(String message) {
        this(message, 0, 0);
    }

    public ContextCapacityTooLowException(String message, Throwable cause) {
        super(message, cause);
        this.maxContextTokens = 0;
        this.inputTokens = 0;
    }

    public ContextCapacityTooLowException(String message, int maxContextTokens, int inputTokens) {
        super(message);
        this.maxContextTokens = maxContextTokens;
        this.inputTokens = inputTokens;
    }

    public int getMaxContextTokens() {
        return maxContextTokens;
    }

    public int getInputTokens() {
        return inputTokens;
    }
}
