package webscan.payload;

import webscan.model.DetectionStrategy;
import webscan.model.Severity;

import java.util.Objects;
import java.util.Optional;

/**
 * Атакующая строка с метаданными: стратегия обнаружения, уровень риска и описание.
 *
 * <p>XSS нагрузки могут содержать плейсхолдер {@link #MARKER_PLACEHOLDER}, который
 * перед отправкой заменяется уникальным маркером запроса.
 */
public final class Payload {
    public static final String MARKER_PLACEHOLDER = "{marker}";

    private final String name;
    private final String value;
    private final DetectionStrategy strategy;
    private final Severity risk;
    private final String description;
    private final Optional<String> cweId;
    private final Optional<DatabaseDialect> dialect;
    private final Optional<InjectionContext> context;
    private final boolean aggressive;

    private Payload(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name cannot be null");
        this.value = Objects.requireNonNull(builder.value, "value cannot be null");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("payload value cannot be empty");
        }
        this.strategy = Objects.requireNonNull(builder.strategy, "strategy cannot be null");
        this.risk = Objects.requireNonNull(builder.risk, "risk cannot be null");
        this.description = builder.description != null ? builder.description : "";
        this.cweId = Optional.ofNullable(builder.cweId);
        this.dialect = Optional.ofNullable(builder.dialect);
        this.context = Optional.ofNullable(builder.context);
        this.aggressive = builder.aggressive;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public DetectionStrategy getStrategy() {
        return strategy;
    }

    public Severity getRisk() {
        return risk;
    }

    public String getDescription() {
        return description;
    }

    public Optional<String> getCweId() {
        return cweId;
    }

    public Optional<DatabaseDialect> getDialect() {
        return dialect;
    }

    public Optional<InjectionContext> getContext() {
        return context;
    }

    /**
     * Heavy fallback payloads, tried only once standard ones have failed.
     */
    public boolean isAggressive() {
        return aggressive;
    }

    public boolean hasMarker() {
        return value.contains(MARKER_PLACEHOLDER);
    }

    /**
     * Returns the payload string with the marker placeholder replaced.
     */
    public String render(String marker) {
        return hasMarker() ? value.replace(MARKER_PLACEHOLDER, marker) : value;
    }

    @Override
    public String toString() {
        return "Payload{" + strategy.getTag() + ": " + name + "}";
    }

    public static class Builder {
        private String name;
        private String value;
        private DetectionStrategy strategy;
        private Severity risk = Severity.HIGH;
        private String description;
        private String cweId;
        private DatabaseDialect dialect;
        private InjectionContext context;
        private boolean aggressive;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder value(String value) {
            this.value = value;
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

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder cweId(String cweId) {
            this.cweId = cweId;
            return this;
        }

        public Builder dialect(DatabaseDialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder context(InjectionContext context) {
            this.context = context;
            return this;
        }

        public Builder aggressive(boolean aggressive) {
            this.aggressive = aggressive;
            return this;
        }

        public Payload build() {
            return new Payload(this);
        }
    }
}
