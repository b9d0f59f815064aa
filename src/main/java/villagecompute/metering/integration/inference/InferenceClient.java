package villagecompute.metering.integration.inference;

import java.util.function.Consumer;

/**
 * Streaming chat-completion client of the inference provider.
 */
public interface InferenceClient {

    /**
     * Runs a completion, handing each streamed token to {@code onToken}, and blocks until the stream ends.
     *
     * @param request
     *            model, messages and output-token ceiling
     * @param onToken
     *            receives partial output in order; throwing from it aborts the stream
     * @return content and token usage of the finished completion
     * @throws ProviderException
     *             on any provider failure, including an aborted stream
     */
    InferenceResult streamCompletion(InferenceRequest request, Consumer<String> onToken);
}
