package villagecompute.metering.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.metering.billing.UserTier;

/**
 * Tier classification of a requester with raw balances in fractional cents (no rounding).
 */
public record UserTierInfoType(@JsonProperty("tier") UserTier tier,

        @JsonProperty("balance_cents") double balanceCents,

        @JsonProperty("free_allowance_cents") double freeAllowanceCents) {

    public static final UserTierInfoType GUEST = new UserTierInfoType(UserTier.GUEST, 0, 0);
}
