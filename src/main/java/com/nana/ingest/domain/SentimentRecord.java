package com.nana.ingest.domain;

import java.util.Objects;

/**
 * SentimentRecord - One row of the sentiment interaction export.
 *
 * <p>Immutable and string-typed like {@link CustomerRecord}. A usable
 * record always has a non-empty case number and customer ID; the
 * sentiment shape rejects rows without them before a record is built.
 */
public final class SentimentRecord {

    private final String sentimentScore;
    private final String interactionCreatedDate;
    private final String caseNumber;
    private final String customerId;

    private SentimentRecord(Builder builder) {
        this.sentimentScore         = builder.sentimentScore;
        this.interactionCreatedDate = builder.interactionCreatedDate;
        this.caseNumber             = builder.caseNumber;
        this.customerId             = builder.customerId;
    }

    /** @return a new, empty builder */
    public static Builder builder() {
        return new Builder();
    }

    /** @return a builder seeded from this record */
    public Builder toBuilder() {
        return new Builder()
                .sentimentScore(sentimentScore)
                .interactionCreatedDate(interactionCreatedDate)
                .caseNumber(caseNumber)
                .customerId(customerId);
    }

    public String getSentimentScore()         { return sentimentScore; }
    public String getInteractionCreatedDate() { return interactionCreatedDate; }
    public String getCaseNumber()             { return caseNumber; }
    public String getCustomerId()             { return customerId; }

    /**
     * Reads a column by its field constant.
     *
     * @param field the column to read
     * @return the value, never null
     */
    public String get(SentimentField field) {
        return field.extract(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SentimentRecord)) return false;
        SentimentRecord other = (SentimentRecord) o;
        return sentimentScore.equals(other.sentimentScore)
               && interactionCreatedDate.equals(other.interactionCreatedDate)
               && caseNumber.equals(other.caseNumber)
               && customerId.equals(other.customerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sentimentScore, interactionCreatedDate,
                caseNumber, customerId);
    }

    @Override
    public String toString() {
        return "SentimentRecord{case='" + caseNumber
               + "', customerId='" + customerId
               + "', score='" + sentimentScore + "'}";
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: Builder
    // -----------------------------------------------------------------------

    public static final class Builder {

        private String sentimentScore         = "";
        private String interactionCreatedDate = "";
        private String caseNumber             = "";
        private String customerId             = "";

        private Builder() {
        }

        public Builder sentimentScore(String v) {
            sentimentScore = v == null ? "" : v;
            return this;
        }

        public Builder interactionCreatedDate(String v) {
            interactionCreatedDate = v == null ? "" : v;
            return this;
        }

        public Builder caseNumber(String v) {
            caseNumber = v == null ? "" : v;
            return this;
        }

        public Builder customerId(String v) {
            customerId = v == null ? "" : v;
            return this;
        }

        public Builder set(SentimentField field, String value) {
            field.apply(this, value);
            return this;
        }

        public SentimentRecord build() {
            return new SentimentRecord(this);
        }
    }
}
