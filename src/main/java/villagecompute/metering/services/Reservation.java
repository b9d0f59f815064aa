package villagecompute.metering.services;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on reserved cents. Closing it releases every scope key exactly once; further closes are no-ops, so it can be
 * used in try-with-resources alongside explicit early releases.
 */
public final class Reservation implements AutoCloseable {

    private final List<String> keys;
    private final double amountCents;
    private final String scope;
    private final ReservationService service;
    private final AtomicBoolean released = new AtomicBoolean(false);

    Reservation(List<String> keys, double amountCents, String scope, ReservationService service) {
        this.keys = List.copyOf(keys);
        this.amountCents = amountCents;
        this.scope = scope;
        this.service = service;
    }

    public List<String> getKeys() {
        return keys;
    }

    /** Reserved amount in cents, already rounded up. */
    public double getAmountCents() {
        return amountCents;
    }

    public String getScope() {
        return scope;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Releases the reservation if it is still held.
     */
    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            service.release(this);
        }
    }
}
