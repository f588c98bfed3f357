package com.nudge.core;

import com.nudge.priority.Urgency;

import java.util.Optional;

/**
 * Caller options for an evaluation run. Immutable.
 */
public final class EvaluationOptions {

    private static final EvaluationOptions DEFAULTS = new Builder().build();

    private final Urgency urgency;
    private final Integer limit;
    private final String recordKind;

    private EvaluationOptions(Builder builder) {
        this.urgency = builder.urgency;
        this.limit = builder.limit != null && builder.limit > 0 ? builder.limit : null;
        this.recordKind = builder.recordKind;
    }

    /**
     * No urgency filter, no limit, all record kinds.
     */
    public static EvaluationOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Only items with this urgency are kept. Empty means every urgency.
     */
    public Optional<Urgency> getUrgency() {
        return Optional.ofNullable(urgency);
    }

    /**
     * Maximum number of items returned. Empty means unlimited.
     */
    public Optional<Integer> getLimit() {
        return Optional.ofNullable(limit);
    }

    /**
     * Only batches of this record kind are evaluated. Empty means every kind.
     */
    public Optional<String> getRecordKind() {
        return Optional.ofNullable(recordKind);
    }

    public boolean accepts(Urgency candidate) {
        return urgency == null || urgency == candidate;
    }

    public boolean includesKind(String kind) {
        return recordKind == null || recordKind.equals(kind);
    }

    @Override
    public String toString() {
        return "EvaluationOptions{" +
                "urgency=" + urgency +
                ", limit=" + limit +
                ", recordKind=" + recordKind +
                '}';
    }

    /**
     * Builder for EvaluationOptions.
     */
    public static class Builder {
        private Urgency urgency;
        private Integer limit;
        private String recordKind;

        public Builder urgency(Urgency urgency) {
            this.urgency = urgency;
            return this;
        }

        /**
         * Set the urgency filter from a tag. "all", null and unknown tags clear the filter.
         */
        public Builder urgency(String tag) {
            this.urgency = Urgency.fromTag(tag).orElse(null);
            return this;
        }

        /**
         * Set the maximum number of items. Null or non-positive values mean unlimited.
         */
        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder recordKind(String recordKind) {
            this.recordKind = recordKind != null && !recordKind.isBlank() ? recordKind : null;
            return this;
        }

        public EvaluationOptions build() {
            return new EvaluationOptions(this);
        }
    }
}
