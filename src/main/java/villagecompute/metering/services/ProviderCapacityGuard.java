package villagecompute.metering.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.metering.billing.PricingPolicy;
import villagecompute.metering.exceptions.ContextCapacityTooLowException;
import villagecompute.metering.integration.inference.ContextLengthError;
import villagecompute.metering.integration.inference.InferenceClient;
import villagecompute.metering.integration.inference.InferenceRequest;
import villagecompute.metering.integration.inference.InferenceResult;
import villagecompute.metering.integration.inference.ProviderException;
import villagecompute.metering.observability.BillingMetrics;

import java.util.function.Consumer;

/**
 * Wraps the inference call with a single retry for context-length rejections.
 *
 * <p>
 * <b>States:</b>
 * <ul>
 * <li><b>NORMAL</b> - first attempt with the budgeted {@code max_tokens}</li>
 * <li><b>RETRYING</b> - one resend with {@code max_tokens = maxContext - textInput} from the rejection</li>
 * </ul>
 * A correction below the minimum output floor fails with {@link ContextCapacityTooLowException} and is not sent. Any
 * other error, and any failure while retrying, propagates unchanged.
 */
@ApplicationScoped
public class ProviderCapacityGuard {

    private static final Logger LOG = Logger.getLogger(ProviderCapacityGuard.class);

    enum State {
        NORMAL,
        RETRYING
    }

    @Inject
    InferenceClient inferenceClient;

    @Inject
    BillingMetrics metrics;

    public InferenceResult complete(InferenceRequest request, Consumer<String> onToken) {
        State state = State.NORMAL;
        InferenceRequest current = request;

        while (true) {
            try {
                InferenceResult result = inferenceClient.streamCompletion(current, onToken);
                if (state == State.RETRYING) {
                    metrics.recordCapacityRetry("succeeded");
                }
                return result;
            } catch (ProviderException e) {
                if (state == State.RETRYING) {
                    metrics.recordCapacityRetry("failed");
                    throw e;
                }
                if (e.getKind() != ProviderException.Kind.CONTEXT_LENGTH_EXCEEDED
                        || e.getContextLengthError().isEmpty()) {
                    throw e;
                }

                ContextLengthError details = e.getContextLengthError().get();
                int corrected = details.maxContext() - details.textInput();
                if (corrected < PricingPolicy.MINIMUM_OUTPUT_TOKENS) {
                    metrics.recordCapacityRetry("too_low");
                    throw new ContextCapacityTooLowException("Model " + request.model() + " has room for only "
                            + Math.max(0, corrected) + " output tokens after the prompt", details.maxContext(),
                            details.textInput());
                }

                LOG.infof("Retrying model %s with corrected max_tokens=%d (was %d)", request.model(), corrected,
                        current.maxTokens());
                current = current.withMaxTokens(corrected);
                state = State.RETRYING;
            }
        }
    }
}
