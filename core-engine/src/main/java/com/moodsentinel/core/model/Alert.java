package com.moodsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Alert admitted by the gate and persisted by the alert store.
 *
 * <p>
 * The store owns every {@code Alert}: identity and {@code createdAt} are
 * assigned at persistence time and the delivery fields change only through the
 * store's state transitions. Instances handed out are snapshots of a row.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code subjectId}, {@code type}, {@code severity},
 * {@code createdAt} and {@code status} are required; omitting any of them
 * throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long id;
    private final String subjectId;
    private final AlertType type;
    private final Severity severity;
    private final String summary;
    private final Instant createdAt;

    /** Observation instant of the originating snapshot. */
    private final Instant observedAt;

    private final DeliveryStatus status;

    /** Set once the alert reached {@link DeliveryStatus#DELIVERED}. */
    private final Instant deliveredAt;

    /** Name of the channel that acknowledged the alert. */
    private final String deliveryChannel;

    private Alert(Builder builder) {
        this.id = builder.id;
        this.subjectId = Objects.requireNonNull(builder.subjectId, "subjectId must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.summary = builder.summary;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
        this.observedAt = builder.observedAt;
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.deliveredAt = builder.deliveredAt;
        this.deliveryChannel = builder.deliveryChannel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private long id;
        private String subjectId;
        private AlertType type;
        private Severity severity;
        private String summary;
        private Instant createdAt;
        private Instant observedAt;
        private DeliveryStatus status = DeliveryStatus.PENDING;
        private Instant deliveredAt;
        private String deliveryChannel;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder type(AlertType type) {
            this.type = type;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        public Builder status(DeliveryStatus status) {
            this.status = status;
            return this;
        }

        public Builder deliveredAt(Instant deliveredAt) {
            this.deliveredAt = deliveredAt;
            return this;
        }

        public Builder deliveryChannel(String deliveryChannel) {
            this.deliveryChannel = deliveryChannel;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    public long getId() {
        return id;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public AlertType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getSummary() {
        return summary;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * @return observation instant of the originating snapshot, or
     *         {@code null} for alerts built outside the store
     */
    public Instant getObservedAt() {
        return observedAt;
    }

    public DeliveryStatus getStatus() {
        return status;
    }

    /**
     * @return delivery instant, or {@code null} while not delivered
     */
    public Instant getDeliveredAt() {
        return deliveredAt;
    }

    /**
     * @return acknowledging channel name, or {@code null} while not delivered
     */
    public String getDeliveryChannel() {
        return deliveryChannel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return id == alert.id
                && subjectId.equals(alert.subjectId)
                && type == alert.type
                && severity == alert.severity
                && Objects.equals(summary, alert.summary)
                && createdAt.equals(alert.createdAt)
                && Objects.equals(observedAt, alert.observedAt)
                && status == alert.status
                && Objects.equals(deliveredAt, alert.deliveredAt)
                && Objects.equals(deliveryChannel, alert.deliveryChannel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, subjectId, type, severity, createdAt, status);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id=" + id +
                ", subjectId='" + subjectId + '\'' +
                ", type=" + type +
                ", severity=" + severity +
                ", summary='" + summary + '\'' +
                ", createdAt=" + createdAt +
                ", observedAt=" + observedAt +
                ", status=" + status +
                ", deliveredAt=" + deliveredAt +
                ", deliveryChannel='" + deliveryChannel + '\'' +
                '}';
    }
}
