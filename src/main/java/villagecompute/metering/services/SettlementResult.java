package villagecompute.metering.services;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Rows written by a committed settlement.
 */
public record SettlementResult(UUID userMessageId, UUID assistantMessageId, UUID usageRecordId, BigDecimal cost,
        int userSequence, int assistantSequence) {
}
