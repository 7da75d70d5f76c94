package com.nana.ingest.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * CustomerField - Customer Export Column Enumeration
 *
 * <p>One constant per column of the CRM customer-account export. Each
 * constant carries:
 * <ol>
 *   <li>{@code headerName} - the exact column header in the CSV file</li>
 *   <li>{@code extractor} - reads the value from a {@link CustomerRecord}</li>
 *   <li>{@code setter} - writes the value into a {@link CustomerRecord.Builder}</li>
 * </ol>
 *
 * <p>The declaration order is the canonical column order of the export
 * and is the order {@link #headerNames()} returns.
 */
public enum CustomerField implements RecordField<CustomerRecord> {

    // -----------------------------------------------------------------------
    // COLUMN DEFINITIONS
    // -----------------------------------------------------------------------

    /** Customer success manager assigned to the account. */
    ACCOUNT_OWNER(
        "Account Owner",
        CustomerRecord::getAccountOwner,
        CustomerRecord.Builder::accountOwner
    ),

    /** Display name of the account (usually the property name). */
    ACCOUNT_NAME(
        "Account Name",
        CustomerRecord::getAccountName,
        CustomerRecord.Builder::accountName
    ),

    /** Last login, {@code DD/MM/YYYY, HH:mm}. Empty if never logged in. */
    LATEST_LOGIN(
        "Latest Login",
        CustomerRecord::getLatestLogin,
        CustomerRecord.Builder::latestLogin
    ),

    /** Account creation date, {@code DD/MM/YYYY}. */
    CREATED_DATE(
        "Created Date",
        CustomerRecord::getCreatedDate,
        CustomerRecord.Builder::createdDate
    ),

    LAST_CS_CONTACT_DATE(
        "Last Customer Success Contact Date",
        CustomerRecord::getLastCustomerSuccessContactDate,
        CustomerRecord.Builder::lastCustomerSuccessContactDate
    ),

    BILLING_COUNTRY(
        "Billing Country",
        CustomerRecord::getBillingCountry,
        CustomerRecord.Builder::billingCountry
    ),

    /** Account tier, see {@link AccountType}. */
    ACCOUNT_TYPE(
        "Account Type",
        CustomerRecord::getAccountType,
        CustomerRecord.Builder::accountType
    ),

    /** Preferred languages, semicolon-separated. */
    LANGUAGE(
        "Language",
        CustomerRecord::getLanguage,
        CustomerRecord.Builder::language
    ),

    /** Activity status, see {@link CustomerStatus}. */
    STATUS(
        "Status",
        CustomerRecord::getStatus,
        CustomerRecord.Builder::status
    ),

    /** Loyalty status (e.g. "Loyal"). */
    SIRVOY_ACCOUNT_STATUS(
        "Sirvoy Account Status",
        CustomerRecord::getSirvoyAccountStatus,
        CustomerRecord.Builder::sirvoyAccountStatus
    ),

    /** Unique customer identifier. Required for a row to be usable. */
    CUSTOMER_ID(
        "Sirvoy Customer ID",
        CustomerRecord::getCustomerId,
        CustomerRecord.Builder::customerId
    ),

    /** Hotel, B&amp;B, Hostel and so on. */
    PROPERTY_TYPE(
        "Property Type",
        CustomerRecord::getPropertyType,
        CustomerRecord.Builder::propertyType
    ),

    MRR_CURRENCY(
        "MRR (converted) Currency",
        CustomerRecord::getMrrCurrency,
        CustomerRecord.Builder::mrrCurrency
    ),

    /** Monthly recurring revenue, as exported (may carry currency symbols). */
    MRR(
        "MRR (converted)",
        CustomerRecord::getMrr,
        CustomerRecord.Builder::mrr
    ),

    /** Connected distribution channels, semicolon-separated. */
    CHANNELS(
        "Channels",
        CustomerRecord::getChannels,
        CustomerRecord.Builder::channels
    );

    // -----------------------------------------------------------------------
    // FIELDS
    // -----------------------------------------------------------------------

    private final String headerName;
    private final Function<CustomerRecord, String> extractor;
    private final BiConsumer<CustomerRecord.Builder, String> setter;

    CustomerField(String headerName,
                  Function<CustomerRecord, String> extractor,
                  BiConsumer<CustomerRecord.Builder, String> setter) {
        this.headerName = headerName;
        this.extractor  = extractor;
        this.setter     = setter;
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    @Override
    public String getHeaderName() {
        return headerName;
    }

    @Override
    public String extract(CustomerRecord record) {
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
    public void apply(CustomerRecord.Builder builder, String value) {
        setter.accept(builder, value);
    }

    /**
     * Returns every customer header in canonical export order.
     *
     * @return an unmodifiable list of header names
     */
    public static List<String> headerNames() {
        List<String> names = new ArrayList<>();
        for (CustomerField field : values()) {
            names.add(field.headerName);
        }
        return Collections.unmodifiableList(names);
    }

    @Override
    public String toString() {
        return headerName;
    }
}
