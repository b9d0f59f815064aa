package villagecompute.metering.api.types;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Owner-funded budget ceilings of a group conversation and what has been spent against them, in dollars.
 */
public record ConversationBudgetsType(@JsonProperty("conversation_budget") BigDecimal conversationBudget,

        @JsonProperty("total_spent") BigDecimal totalSpent,

        @JsonProperty("members") List<MemberBudgetType> members) {

    /**
     * Budget of one active member. Members without a budget row report a zero budget.
     */
    public record MemberBudgetType(@JsonProperty("member_id") UUID memberId,

            @JsonProperty("user_id") UUID userId,

            @JsonProperty("budget") BigDecimal budget,

            @JsonProperty("spent") BigDecimal spent) {
    }
}
