package com.nana.ingest.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * SentimentField - Columns of the customer-sentiment interaction export.
 *
 * <p>Works the same way as {@link CustomerField}: each constant knows its
 * header, how to read itself from a {@link SentimentRecord} and how to
 * write itself into a {@link SentimentRecord.Builder}.
 */
public enum SentimentField implements RecordField<SentimentRecord> {

    SENTIMENT_SCORE(
        "Customer Sentiment Score",
        SentimentRecord::getSentimentScore,
        SentimentRecord.Builder::sentimentScore
    ),

    INTERACTION_CREATED_DATE(
        "Interaction: Created Date",
        SentimentRecord::getInteractionCreatedDate,
        SentimentRecord.Builder::interactionCreatedDate
    ),

    /** Support case number. Required. */
    CASE(
        "Case",
        SentimentRecord::getCaseNumber,
        SentimentRecord.Builder::caseNumber
    ),

    /** Customer the interaction belongs to. Required. */
    ACCOUNT_CUSTOMER_ID(
        "Account: Sirvoy Customer ID",
        SentimentRecord::getCustomerId,
        SentimentRecord.Builder::customerId
    );

    private final String headerName;
    private final Function<SentimentRecord, String> extractor;
    private final BiConsumer<SentimentRecord.Builder, String> setter;

    SentimentField(String headerName,
                   Function<SentimentRecord, String> extractor,
                   BiConsumer<SentimentRecord.Builder, String> setter) {
        this.headerName = headerName;
        this.extractor  = extractor;
        this.setter     = setter;
    }

    @Override
    public String getHeaderName() {
        return headerName;
    }

    @Override
    public String extract(SentimentRecord record) {
        if (record == null) {
            return "";
        }
        String value = extractor.apply(record);
        return value == null ? "" : value;
    }

    /**
     * Writes a value for this column into a record builder.
     *
     * @param builder the builder to populate
     * @param value   the column value
     */
    public void apply(SentimentRecord.Builder builder, String value) {
        setter.accept(builder, value);
    }

    /** @return every sentiment header in canonical export order */
    public static List<String> headerNames() {
        List<String> names = new ArrayList<>();
        for (SentimentField field : values()) {
            names.add(field.headerName);
        }
        return Collections.unmodifiableList(names);
    }

    @Override
    public String toString() {
        return headerName;
    }
}
