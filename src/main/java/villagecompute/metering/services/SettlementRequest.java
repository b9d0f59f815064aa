package villagecompute.metering.services;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Input of {@link ChargeSettlementService#saveChatTurn(SettlementRequest)}.
 *
 * @param conversationId
 *            conversation receiving both messages
 * @param userMessageId
 *            client-supplied id of the user message, the idempotency key
 * @param senderId
 *            user who sent the message
 * @param userMessage
 *            plaintext of the user message
 * @param assistantContent
 *            plaintext of the completion, possibly empty
 * @param payerId
 *            user whose wallets are charged
 * @param costDollars
 *            actual cost including fees and storage
 * @param model
 *            provider model id
 * @param inputTokens
 *            provider-reported input tokens
 * @param outputTokens
 *            provider-reported output tokens
 * @param cachedTokens
 *            provider-reported cached input tokens
 * @param allowNegativeBalance
 *            whether the purchased wallet may absorb a remainder down to the cushion
 * @param groupMemberId
 *            member id on owner-funded turns, otherwise null
 */
public record SettlementRequest(UUID conversationId, UUID userMessageId, UUID senderId, String userMessage,
        String assistantContent, UUID payerId, BigDecimal costDollars, String model, int inputTokens,
        int outputTokens, int cachedTokens, boolean allowNegativeBalance, UUID groupMemberId) {
}
