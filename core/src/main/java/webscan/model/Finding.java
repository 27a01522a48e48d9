package webscan.model;

import java.time.Instant;
import java.util.*;

/**
 * Подтвержденная уязвимость, обнаруженная стратегией детектирования.
 *
 * <p>Экземпляры неизменяемы. Уверенность всегда лежит в диапазоне [0, 1],
 * а эндпоинт, параметр и полезная нагрузка не могут быть пустыми: билдер
 * отклоняет такие значения.
 */
public final class Finding {
    private final String id;
    private final String title;
    private final String description;
    private final DetectionStrategy strategy;
    private final Severity risk;
    private final double confidence;
    private final String endpoint;
    private final String parameter;
    private final ParameterLocation parameterLocation;
    private final String method;
    private final String payload;
    private final Map<String, Object> evidence;
    private final Optional<ExchangeSnapshot> exchange;
    private final List<String> remediation;
    private final String cweId;
    private final Instant discoveredAt;

    private Finding(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.title = Objects.requireNonNull(builder.title, "title cannot be null");
        this.description = builder.description != null ? builder.description : "";
        this.strategy = Objects.requireNonNull(builder.strategy, "strategy cannot be null");
        this.risk = Objects.requireNonNull(builder.risk, "risk cannot be null");
        this.confidence = requireConfidence(builder.confidence);
        this.endpoint = requireText(builder.endpoint, "endpoint");
        this.parameter = requireText(builder.parameter, "parameter");
        this.parameterLocation = Objects.requireNonNull(builder.parameterLocation, "parameterLocation cannot be null");
        this.method = builder.method != null ? builder.method.toUpperCase(Locale.ROOT) : "GET";
        this.payload = requireText(builder.payload, "payload");
        this.evidence = Collections.unmodifiableMap(new LinkedHashMap<>(builder.evidence));
        this.exchange = Optional.ofNullable(builder.exchange);
        this.remediation = List.copyOf(builder.remediation);
        this.cweId = builder.cweId != null ? builder.cweId : strategy.getVulnerabilityClass().getCweId();
        this.discoveredAt = builder.discoveredAt != null ? builder.discoveredAt : Instant.now();
    }

    private static double requireConfidence(double confidence) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
        return confidence;
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public VulnerabilityClass getVulnerabilityClass() {
        return strategy.getVulnerabilityClass();
    }

    public DetectionStrategy getStrategy() {
        return strategy;
    }

    public Severity getRisk() {
        return risk;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getParameter() {
        return parameter;
    }

    public ParameterLocation getParameterLocation() {
        return parameterLocation;
    }

    public String getMethod() {
        return method;
    }

    public String getPayload() {
        return payload;
    }

    public Map<String, Object> getEvidence() {
        return evidence;
    }

    public Optional<ExchangeSnapshot> getExchange() {
        return exchange;
    }

    public List<String> getRemediation() {
        return remediation;
    }

    public String getCweId() {
        return cweId;
    }

    public Instant getDiscoveredAt() {
        return discoveredAt;
    }

    @Override
    public String toString() {
        return "Finding{" + strategy.getTag() + " " + getVulnerabilityClass().getDisplayName() +
               ", risk=" + risk.getTag() +
               ", confidence=" + String.format(Locale.ROOT, "%.2f", confidence) +
               ", endpoint=" + endpoint +
               ", parameter=" + parameter + "}";
    }

    public static class Builder {
        private String id;
        private String title;
        private String description;
        private DetectionStrategy strategy;
        private Severity risk;
        private double confidence;
        private String endpoint;
        private String parameter;
        private ParameterLocation parameterLocation = ParameterLocation.QUERY;
        private String method;
        private String payload;
        private final Map<String, Object> evidence = new LinkedHashMap<>();
        private ExchangeSnapshot exchange;
        private final List<String> remediation = new ArrayList<>();
        private String cweId;
        private Instant discoveredAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder strategy(DetectionStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder risk(Severity risk) {
            this.risk = risk;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder parameter(String parameter) {
            this.parameter = parameter;
            return this;
        }

        public Builder parameterLocation(ParameterLocation parameterLocation) {
            this.parameterLocation = parameterLocation;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder evidence(Map<String, Object> evidence) {
            this.evidence.clear();
            if (evidence != null) {
                this.evidence.putAll(evidence);
            }
            return this;
        }

        public Builder addEvidence(String key, Object value) {
            this.evidence.put(key, value);
            return this;
        }

        public Builder exchange(ExchangeSnapshot exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder remediation(List<String> remediation) {
            this.remediation.clear();
            if (remediation != null) {
                this.remediation.addAll(remediation);
            }
            return this;
        }

        public Builder addRemediation(String step) {
            this.remediation.add(step);
            return this;
        }

        public Builder cweId(String cweId) {
            this.cweId = cweId;
            return this;
        }

        public Builder discoveredAt(Instant discoveredAt) {
            this.discoveredAt = discoveredAt;
            return this;
        }

        public Finding build() {
            return new Finding(this);
        }
    }
}
