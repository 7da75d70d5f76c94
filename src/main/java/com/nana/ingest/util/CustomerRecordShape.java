package com.nana.ingest.util;

import com.nana.ingest.domain.CustomerField;
import com.nana.ingest.domain.CustomerRecord;
import com.nana.ingest.domain.Result;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * CustomerRecordShape - Maps rows of the customer-account export.
 *
 * <p>A row is accepted when it has exactly as many fields as the header
 * row and a non-blank {@code Sirvoy Customer ID}. Values are looked up by
 * header name, so reordered columns map correctly.
 */
public final class CustomerRecordShape implements RecordShape<CustomerRecord> {

    private static final HeaderContract CONTRACT =
            new HeaderContract(CustomerField.headerNames());

    private static final List<CustomerField> FIELDS =
            Collections.unmodifiableList(Arrays.asList(CustomerField.values()));

    @Override
    public String getName() {
        return "customer";
    }

    @Override
    public HeaderContract getHeaderContract() {
        return CONTRACT;
    }

    @Override
    public List<CustomerField> getFields() {
        return FIELDS;
    }

    @Override
    public Result<CustomerRecord, String> mapFields(List<String> fields,
                                                    List<String> headers,
                                                    int rowNumber) {
        String countError = RecordShapes.checkFieldCount(fields, headers, rowNumber);
        if (countError != null) {
            return Result.failure(countError);
        }

        Map<String, String> lookup = RecordShapes.buildLookup(fields, headers);

        String customerId = lookup.getOrDefault(
                CustomerField.CUSTOMER_ID.getHeaderName(), "");
        if (customerId.isEmpty()) {
            return Result.failure(RecordShapes.missingFieldMessage(
                    rowNumber, CustomerField.CUSTOMER_ID.getHeaderName()));
        }

        return Result.success(fromValues(lookup));
    }

    @Override
    public CustomerRecord fromValues(Map<String, String> valuesByHeader) {
        CustomerRecord.Builder builder = CustomerRecord.builder();
        for (CustomerField field : FIELDS) {
            builder.set(field, valuesByHeader.getOrDefault(field.getHeaderName(), ""));
        }
        return builder.build();
    }
}
