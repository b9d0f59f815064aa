package villagecompute.metering.services;

/**
 * Receives streamed output of a billable turn and how the stream ended.
 */
public interface StreamOutcomeListener {

    /** How the provider stream of a turn ended. */
    enum StreamOutcome {
        COMPLETED,
        FAILED,
        ABORTED
    }

    StreamOutcomeListener NONE = token -> {
    };

    /**
     * Called for each streamed token, in order. Throwing aborts the stream; the turn is then not charged.
     */
    void onToken(String token);

    /**
     * Called once the provider call has ended, before settlement.
     */
    default void onOutcome(StreamOutcome outcome) {
    }
}
