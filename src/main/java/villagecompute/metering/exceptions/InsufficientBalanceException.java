package villagecompute.metering.exceptions;

import villagecompute.metering.billing.DenialReason;

/**
 * Thrown when the funding source genuinely cannot cover a call: budgeting denied it, or settlement ran out of wallets
 * to debit.
 *
 * <p>
 * User-correctable by adding funds, shortening the prompt or choosing a cheaper model.
 */
public class InsufficientBalanceException extends RuntimeException {

    private final DenialReason reason;

    public InsufficientBalanceException(String message) {
        this(message, DenialReason.INSUFFICIENT_BALANCE);
    }

    public InsufficientBalanceException(String message, Throwable cause) {
        super(message, cause);
        this.reason = DenialReason.INSUFFICIENT_BALANCE;
    }

    public InsufficientBalanceException(String message, DenialReason reason) {
        super(message);
        this.reason = reason;
    }

    public DenialReason getReason() {
        return reason;
    }
}
