package villagecompute.metering.integration.inference;

import java.util.List;

/**
 * Streaming completion request. {@code maxTokens} is the output-token ceiling the budget allows.
 */
public record InferenceRequest(String model, List<PromptMessage> messages, int maxTokens) {

    public InferenceRequest {
        messages = List.copyOf(messages);
    }

    /** Same request with a different output ceiling. */
    public InferenceRequest withMaxTokens(int correctedMaxTokens) {
        return new InferenceRequest(model, messages, correctedMaxTokens);
    }

    public long characterCount() {
        long total = 0;
        for (PromptMessage message : messages) {
            total += message.characterCount();
        }
        return total;
    }
}
