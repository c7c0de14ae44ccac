package bf2marc;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;

/**
 * Counters for one run. Each converter gets its own registry so that runs (and tests) do not add up.
 */
public class ConversionMetrics {
    private final CollectorRegistry registry = new CollectorRegistry();

    private final Counter descriptions = Counter.build()
            .name("bf2marc_descriptions_total")
            .help("The number of descriptions handled, by outcome.")
            .labelNames("status")
            .register(registry);

    private final Counter dereferences = Counter.build()
            .name("bf2marc_dereferences_total")
            .help("The number of external lookups, by outcome.")
            .labelNames("outcome")
            .register(registry);

    public void countDescription(ConversionResult.Status status) {
        descriptions.labels(status.name().toLowerCase()).inc();
    }

    public void countDereference(boolean succeeded) {
        dereferences.labels(succeeded ? "fetched" : "failed").inc();
    }

    public long getDescriptions(ConversionResult.Status status) {
        return (long) descriptions.labels(status.name().toLowerCase()).get();
    }

    public long getDereferences(boolean succeeded) {
        return (long) dereferences.labels(succeeded ? "fetched" : "failed").get();
    }
}
