package com.nana.ingest.util;

import com.nana.ingest.domain.Result;
import com.nana.ingest.domain.SentimentField;
import com.nana.ingest.domain.SentimentRecord;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * SentimentRecordShape - Maps rows of the sentiment interaction export.
 *
 * <p>Both the account customer ID and the case number must be present;
 * the customer ID is checked first, so a row missing both reports the
 * customer ID.
 */
public final class SentimentRecordShape implements RecordShape<SentimentRecord> {

    private static final HeaderContract CONTRACT =
            new HeaderContract(SentimentField.headerNames());

    private static final List<SentimentField> FIELDS =
            Collections.unmodifiableList(Arrays.asList(SentimentField.values()));

    @Override
    public String getName() {
        return "sentiment";
    }

    @Override
    public HeaderContract getHeaderContract() {
        return CONTRACT;
    }

    @Override
    public List<SentimentField> getFields() {
        return FIELDS;
    }

    @Override
    public Result<SentimentRecord, String> mapFields(List<String> fields,
                                                     List<String> headers,
                                                     int rowNumber) {
        String countError = RecordShapes.checkFieldCount(fields, headers, rowNumber);
        if (countError != null) {
            return Result.failure(countError);
        }

        Map<String, String> lookup = RecordShapes.buildLookup(fields, headers);

        for (SentimentField required : List.of(
                SentimentField.ACCOUNT_CUSTOMER_ID, SentimentField.CASE)) {
            if (lookup.getOrDefault(required.getHeaderName(), "").isEmpty()) {
                return Result.failure(RecordShapes.missingFieldMessage(
                        rowNumber, required.getHeaderName()));
            }
        }

        return Result.success(fromValues(lookup));
    }

    @Override
    public SentimentRecord fromValues(Map<String, String> valuesByHeader) {
        SentimentRecord.Builder builder = SentimentRecord.builder();
        for (SentimentField field : FIELDS) {
            builder.set(field, valuesByHeader.getOrDefault(field.getHeaderName(), ""));
        }
        return builder.build();
    }
}
