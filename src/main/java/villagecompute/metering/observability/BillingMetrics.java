package villagecompute.metering.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer meters for the billing pipeline.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counters:</b> {@code metering_reservations_total{scope,result}} - reserve outcomes; scope is {@code personal}
 * or {@code group}, result is {@code accepted}, {@code rejected} or {@code released}</li>
 * <li><b>Counters:</b> {@code metering_billing_decisions_total{source}} - resolved funding source, or
 * {@code denied_<reason>}</li>
 * <li><b>Counters:</b> {@code metering_settlements_total{result}} - {@code committed} or {@code rolled_back}</li>
 * <li><b>Counters:</b> {@code metering_capacity_retries_total{result}} - capacity guard outcomes</li>
 * <li><b>Gauges:</b> {@code metering_reservations_in_flight} - reservations held by this instance</li>
 * </ul>
 *
 * @see LoggingConfig for structured logging field definitions
 */
@ApplicationScoped
public class BillingMetrics {

    private static final Logger LOG = Logger.getLogger(BillingMetrics.class);

    @Inject
    MeterRegistry registry;

    private final AtomicInteger reservationsInFlight = new AtomicInteger(0);

    /**
     * Counters indexed by metric:tag-values.
     */
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        Gauge.builder("metering_reservations_in_flight", reservationsInFlight, AtomicInteger::get)
                .description("Reservations currently held by this instance").register(registry);
        LOG.debug("Registered gauge: metering_reservations_in_flight");
    }

    public void recordReservation(String scope, String result) {
        increment("metering_reservations_total", "Reservation outcomes",
                List.of(Tag.of("scope", scope), Tag.of("result", result)));
        if ("accepted".equals(result)) {
            reservationsInFlight.incrementAndGet();
        } else if ("released".equals(result)) {
            reservationsInFlight.decrementAndGet();
        }
    }

    public void recordBillingDecision(String source) {
        increment("metering_billing_decisions_total", "Billing decisions by funding source",
                List.of(Tag.of("source", source)));
    }

    public void recordSettlement(String result) {
        increment("metering_settlements_total", "Charge settlements by outcome", List.of(Tag.of("result", result)));
    }

    public void recordCapacityRetry(String result) {
        increment("metering_capacity_retries_total", "Context-capacity retry outcomes",
                List.of(Tag.of("result", result)));
    }

    private void increment(String name, String description, List<Tag> tags) {
        StringBuilder key = new StringBuilder(name);
        for (Tag tag : tags) {
            key.append(':').append(tag.getValue());
        }

        Counter counter = counters.computeIfAbsent(key.toString(), k -> {
            return Counter.builder(name).description(description).tags(tags).register(registry);
        });

        counter.increment();
    }
}
