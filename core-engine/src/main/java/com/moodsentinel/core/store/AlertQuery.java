package com.moodsentinel.core.store;

import com.moodsentinel.core.model.AlertType;
import com.moodsentinel.core.model.DeliveryStatus;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only filter for browsing persisted alerts.
 *
 * <p>
 * Every filter is optional. Results are ordered newest first and paged with
 * {@code limit}/{@code offset}. The time range is half-open:
 * {@code from <= createdAt < to}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertQuery {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1_000;

    private final String subjectId;
    private final AlertType type;
    private final DeliveryStatus status;
    private final Instant from;
    private final Instant to;
    private final int limit;
    private final int offset;

    private AlertQuery(Builder b) {
        this.subjectId = b.subjectId;
        this.type = b.type;
        this.status = b.status;
        this.from = b.from;
        this.to = b.to;
        this.limit = b.limit;
        this.offset = b.offset;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AlertQuery}.
     */
    public static class Builder {
        private String subjectId;
        private AlertType type;
        private DeliveryStatus status;
        private Instant from;
        private Instant to;
        private int limit = DEFAULT_LIMIT;
        private int offset;

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder type(AlertType type) {
            this.type = type;
            return this;
        }

        public Builder status(DeliveryStatus status) {
            this.status = status;
            return this;
        }

        public Builder from(Instant from) {
            this.from = from;
            return this;
        }

        public Builder to(Instant to) {
            this.to = to;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        /**
         * @return the validated query
         * @throws IllegalArgumentException if paging values or the time range
         *                                  are invalid
         */
        public AlertQuery build() {
            if (limit < 1 || limit > MAX_LIMIT) {
                throw new IllegalArgumentException(
                        "limit must be in [1, " + MAX_LIMIT + "], got: " + limit);
            }
            if (offset < 0) {
                throw new IllegalArgumentException("offset must be >= 0, got: " + offset);
            }
            if (from != null && to != null && to.isBefore(from)) {
                throw new IllegalArgumentException("time range end " + to + " is before start " + from);
            }
            return new AlertQuery(this);
        }
    }

    public Optional<String> getSubjectId() {
        return Optional.ofNullable(subjectId);
    }

    public Optional<AlertType> getType() {
        return Optional.ofNullable(type);
    }

    public Optional<DeliveryStatus> getStatus() {
        return Optional.ofNullable(status);
    }

    public Optional<Instant> getFrom() {
        return Optional.ofNullable(from);
    }

    public Optional<Instant> getTo() {
        return Optional.ofNullable(to);
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertQuery that))
            return false;
        return limit == that.limit && offset == that.offset
                && Objects.equals(subjectId, that.subjectId)
                && type == that.type && status == that.status
                && Objects.equals(from, that.from) && Objects.equals(to, that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectId, type, status, from, to, limit, offset);
    }

    @Override
    public String toString() {
        return "AlertQuery{" +
                "subjectId='" + subjectId + '\'' +
                ", type=" + type +
                ", status=" + status +
                ", from=" + from +
                ", to=" + to +
                ", limit=" + limit +
                ", offset=" + offset +
                '}';
    }
}
