package villagecompute.metering.api.types;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import villagecompute.metering.billing.FundingSource;
import villagecompute.metering.billing.UserTier;
import villagecompute.metering.integration.inference.PromptMessage;

/**
 * One billable chat turn as handed over by the session layer.
 *
 * <p>
 * {@code userId} is null for guest and trial turns, which are identified by {@code guestToken} and {@code ipHash}
 * instead. The session tier is only trusted for unauthenticated requesters; authenticated tiers are derived from
 * wallets. {@code userMessageId} is the client-generated id of the new user message and serves as the idempotency
 * key.
 *
 * <p>
 * Example:
 *
 * <pre>{@code
 * {
 *   "tier": "FREE",
 *   "funding_source": "FREE_ALLOWANCE",
 *   "conversation_id": "1e7e1c9a-...",
 *   "user_id": "5b1f0f3e-...",
 *   "model": "openai/gpt-4o-mini",
 *   "user_message_id": "a3c2...",
 *   "user_message": "Summarise this thread",
 *   "history": [{"role": "user", "content": "..."}]
 * }
 * }</pre>
 */
public record ChatTurnRequestType(@JsonProperty("tier") @NotNull UserTier tier,

        @JsonProperty("funding_source") FundingSource declaredFundingSource,

        @JsonProperty("conversation_id") UUID conversationId,

        @JsonProperty("user_id") UUID userId,

        @JsonProperty("guest_token") String guestToken,

        @JsonProperty("ip_hash") String ipHash,

        @JsonProperty("model") @NotBlank(
                message = "Model is required") String model,

        @JsonProperty("user_message_id") UUID userMessageId,

        @JsonProperty("user_message") @NotNull(
                message = "User message is required") String userMessage,

        @JsonProperty("history") List<PromptMessage> history) {

    public ChatTurnRequestType {
        history = history == null ? List.of() : List.copyOf(history);
    }

    /** Messages sent to the provider: history followed by the new user message. */
    public List<PromptMessage> promptMessages() {
        List<PromptMessage> messages = new ArrayList<>(history);
        messages.add(PromptMessage.user(userMessage));
        return messages;
    }

    public long promptCharacterCount() {
        long total = userMessage.length();
        for (PromptMessage message : history) {
            total += message.characterCount();
        }
        return total;
    }

    public boolean isGuest() {
        return userId == null;
    }
}
