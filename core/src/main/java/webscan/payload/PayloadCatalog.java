package webscan.payload;

import webscan.model.DetectionStrategy;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Immutable, ordered collection of payloads for one vulnerability class.
 */
public final class PayloadCatalog {
    private final List<Payload> payloads;
    private final Map<DetectionStrategy, List<Payload>> byStrategy;

    public PayloadCatalog(List<Payload> payloads) {
        this.payloads = List.copyOf(payloads);
        this.byStrategy = Collections.unmodifiableMap(this.payloads.stream()
            .collect(Collectors.groupingBy(Payload::getStrategy,
                () -> new EnumMap<>(DetectionStrategy.class),
                Collectors.collectingAndThen(Collectors.toList(), List::copyOf))));
    }

    public List<Payload> all() {
        return payloads;
    }

    public List<Payload> forStrategy(DetectionStrategy strategy) {
        return byStrategy.getOrDefault(strategy, List.of());
    }

    /**
     * Standard (non-aggressive) payloads of a strategy.
     */
    public List<Payload> standard(DetectionStrategy strategy) {
        return forStrategy(strategy).stream().filter(p -> !p.isAggressive()).toList();
    }

    public List<Payload> aggressive(DetectionStrategy strategy) {
        return forStrategy(strategy).stream().filter(Payload::isAggressive).toList();
    }

    public int size() {
        return payloads.size();
    }
}
