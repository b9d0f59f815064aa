package villagecompute.metering.integration.inference;

/**
 * Outcome of a completed stream. Token counts are as reported by the provider; an empty {@code content} is a valid
 * completion.
 */
public record InferenceResult(String content, int inputTokens, int outputTokens, int cachedTokens) {

    public int outputCharacterCount() {
        return content == null ? 0 : content.length();
    }
}
