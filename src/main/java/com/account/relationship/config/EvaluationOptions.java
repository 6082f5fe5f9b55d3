package com.account.relationship.config;

import com.account.relationship.coherence.PostalCodeTolerance;
import com.account.relationship.domain.BadDomainListLoader;
import com.account.relationship.source.RecordIds;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for flag evaluation: batch concurrency and deadline, the address postal-code
 * tolerance, where the bad-domain list is loaded from and the expected record-id prefix.
 */
public class EvaluationOptions {

    private static final int DEFAULT_MAX_CONCURRENCY = 8;
    private static final Duration DEFAULT_BATCH_TIMEOUT = Duration.ofSeconds(60);

    private final int maxConcurrency;
    private final Duration batchTimeout;
    private final PostalCodeTolerance postalCodeTolerance;
    private final String badDomainListLocation;
    private final String recordIdPrefix;

    private EvaluationOptions(Builder builder) {
        this.maxConcurrency = builder.maxConcurrency;
        this.batchTimeout = builder.batchTimeout;
        this.postalCodeTolerance = builder.postalCodeTolerance;
        this.badDomainListLocation = builder.badDomainListLocation;
        this.recordIdPrefix = builder.recordIdPrefix;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public Duration getBatchTimeout() {
        return batchTimeout;
    }

    public PostalCodeTolerance getPostalCodeTolerance() {
        return postalCodeTolerance;
    }

    public String getBadDomainListLocation() {
        return badDomainListLocation;
    }

    public String getRecordIdPrefix() {
        return recordIdPrefix;
    }

    public static EvaluationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "EvaluationOptions{" +
                "maxConcurrency=" + maxConcurrency +
                ", batchTimeout=" + batchTimeout +
                ", postalCodeTolerance=" + postalCodeTolerance +
                ", badDomainListLocation='" + badDomainListLocation + '\'' +
                ", recordIdPrefix='" + recordIdPrefix + '\'' +
                '}';
    }

    public static class Builder {
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private Duration batchTimeout = DEFAULT_BATCH_TIMEOUT;
        private PostalCodeTolerance postalCodeTolerance = PostalCodeTolerance.AT_LEAST_ONE_SIDE_MISSING;
        private String badDomainListLocation = BadDomainListLoader.DEFAULT_LOCATION;
        private String recordIdPrefix = RecordIds.DEFAULT_PREFIX;

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency <= 0) {
                throw new IllegalArgumentException("maxConcurrency must be > 0, got " + maxConcurrency);
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder batchTimeout(Duration batchTimeout) {
            Objects.requireNonNull(batchTimeout, "batchTimeout is required");
            if (batchTimeout.isNegative() || batchTimeout.isZero()) {
                throw new IllegalArgumentException("batchTimeout must be positive, got " + batchTimeout);
            }
            this.batchTimeout = batchTimeout;
            return this;
        }

        public Builder postalCodeTolerance(PostalCodeTolerance postalCodeTolerance) {
            this.postalCodeTolerance = Objects.requireNonNull(postalCodeTolerance, "postalCodeTolerance is required");
            return this;
        }

        public Builder badDomainListLocation(String badDomainListLocation) {
            Objects.requireNonNull(badDomainListLocation, "badDomainListLocation is required");
            if (badDomainListLocation.isBlank()) {
                throw new IllegalArgumentException("badDomainListLocation must not be blank");
            }
            this.badDomainListLocation = badDomainListLocation;
            return this;
        }

        /**
         * Expected key prefix of record ids. An empty prefix accepts any id of valid shape.
         */
        public Builder recordIdPrefix(String recordIdPrefix) {
            this.recordIdPrefix = Objects.requireNonNull(recordIdPrefix, "recordIdPrefix is required");
            return this;
        }

        public EvaluationOptions build() {
            return new EvaluationOptions(this);
        }
    }
}
