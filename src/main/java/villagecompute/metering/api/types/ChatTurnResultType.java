package villagecompute.metering.api.types;

import java.math.BigDecimal;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.metering.billing.FundingSource;

/**
 * Outcome of a billable turn. Guest turns are not persisted, so their ids are null and the cost is what the turn would
 * have cost.
 */
public record ChatTurnResultType(@JsonProperty("cost") BigDecimal cost,

        @JsonProperty("usage_record_id") UUID usageRecordId,

        @JsonProperty("assistant_message_id") UUID assistantMessageId,

        @JsonProperty("max_output_tokens") int maxOutputTokens,

        @JsonProperty("funding_source") FundingSource fundingSource,

        @JsonProperty("content") String content,

        @JsonProperty("input_tokens") int inputTokens,

        @JsonProperty("output_tokens") int outputTokens) {
}
