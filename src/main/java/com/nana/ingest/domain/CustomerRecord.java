package com.nana.ingest.domain;

import java.util.Objects;

/**
 * CustomerRecord - One Row of the Customer-Account Export
 *
 * <p>An immutable, string-typed snapshot of a single CSV data row. The
 * values are exactly what the file contained (trimmed by the tokenizer);
 * no type conversion happens here. Conversion to numbers and dates is the
 * job of downstream consumers once the record has passed the
 * {@code FieldValidator}.
 *
 * <p>No property is ever null. Missing values are empty strings.
 *
 * <p>The header-name lookup used while parsing lives in
 * {@link CustomerField}; this class only exposes named getters.
 */
public final class CustomerRecord {

    private final String accountOwner;
    private final String accountName;
    private final String latestLogin;
    private final String createdDate;
    private final String lastCustomerSuccessContactDate;
    private final String billingCountry;
    private final String accountType;
    private final String language;
    private final String status;
    private final String sirvoyAccountStatus;
    private final String customerId;
    private final String propertyType;
    private final String mrrCurrency;
    private final String mrr;
    private final String channels;

    private CustomerRecord(Builder builder) {
        this.accountOwner                   = builder.accountOwner;
        this.accountName                    = builder.accountName;
        this.latestLogin                    = builder.latestLogin;
        this.createdDate                    = builder.createdDate;
        this.lastCustomerSuccessContactDate = builder.lastCustomerSuccessContactDate;
        this.billingCountry                 = builder.billingCountry;
        this.accountType                    = builder.accountType;
        this.language                       = builder.language;
        this.status                         = builder.status;
        this.sirvoyAccountStatus            = builder.sirvoyAccountStatus;
        this.customerId                     = builder.customerId;
        this.propertyType                   = builder.propertyType;
        this.mrrCurrency                    = builder.mrrCurrency;
        this.mrr                            = builder.mrr;
        this.channels                       = builder.channels;
    }

    // -----------------------------------------------------------------------
    // FACTORIES
    // -----------------------------------------------------------------------

    /** @return a new, empty builder (every field defaults to "") */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this record's values, for
     * producing a modified copy.
     *
     * @return a builder seeded from this record
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        for (CustomerField field : CustomerField.values()) {
            field.apply(builder, field.extract(this));
        }
        return builder;
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public String getAccountOwner()   { return accountOwner; }
    public String getAccountName()    { return accountName; }
    public String getLatestLogin()    { return latestLogin; }
    public String getCreatedDate()    { return createdDate; }
    public String getLastCustomerSuccessContactDate() {
        return lastCustomerSuccessContactDate;
    }
    public String getBillingCountry() { return billingCountry; }
    public String getAccountType()    { return accountType; }
    public String getLanguage()       { return language; }
    public String getStatus()         { return status; }
    public String getSirvoyAccountStatus() { return sirvoyAccountStatus; }
    public String getCustomerId()     { return customerId; }
    public String getPropertyType()   { return propertyType; }
    public String getMrrCurrency()    { return mrrCurrency; }
    public String getMrr()            { return mrr; }
    public String getChannels()       { return channels; }

    /**
     * Reads a column by its field constant.
     *
     * @param field the column to read
     * @return the value, never null
     */
    public String get(CustomerField field) {
        return field.extract(this);
    }

    // -----------------------------------------------------------------------
    // OBJECT CONTRACT
    // -----------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CustomerRecord)) return false;
        CustomerRecord other = (CustomerRecord) o;
        for (CustomerField field : CustomerField.values()) {
            if (!field.extract(this).equals(field.extract(other))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountOwner, accountName, latestLogin, createdDate,
                lastCustomerSuccessContactDate, billingCountry, accountType,
                language, status, sirvoyAccountStatus, customerId,
                propertyType, mrrCurrency, mrr, channels);
    }

    @Override
    public String toString() {
        return "CustomerRecord{customerId='" + customerId
               + "', accountName='" + accountName
               + "', status='" + status
               + "', accountType='" + accountType + "'}";
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: Builder
    // -----------------------------------------------------------------------

    /**
     * Mutable accumulator for a {@link CustomerRecord}. Null values are
     * stored as empty strings.
     */
    public static final class Builder {

        private String accountOwner                   = "";
        private String accountName                    = "";
        private String latestLogin                    = "";
        private String createdDate                    = "";
        private String lastCustomerSuccessContactDate = "";
        private String billingCountry                 = "";
        private String accountType                    = "";
        private String language                       = "";
        private String status                         = "";
        private String sirvoyAccountStatus            = "";
        private String customerId                     = "";
        private String propertyType                   = "";
        private String mrrCurrency                    = "";
        private String mrr                            = "";
        private String channels                       = "";

        private Builder() {
        }

        public Builder accountOwner(String v)   { accountOwner = nz(v);   return this; }
        public Builder accountName(String v)    { accountName = nz(v);    return this; }
        public Builder latestLogin(String v)    { latestLogin = nz(v);    return this; }
        public Builder createdDate(String v)    { createdDate = nz(v);    return this; }
        public Builder lastCustomerSuccessContactDate(String v) {
            lastCustomerSuccessContactDate = nz(v);
            return this;
        }
        public Builder billingCountry(String v) { billingCountry = nz(v); return this; }
        public Builder accountType(String v)    { accountType = nz(v);    return this; }
        public Builder language(String v)       { language = nz(v);       return this; }
        public Builder status(String v)         { status = nz(v);         return this; }
        public Builder sirvoyAccountStatus(String v) {
            sirvoyAccountStatus = nz(v);
            return this;
        }
        public Builder customerId(String v)     { customerId = nz(v);     return this; }
        public Builder propertyType(String v)   { propertyType = nz(v);   return this; }
        public Builder mrrCurrency(String v)    { mrrCurrency = nz(v);    return this; }
        public Builder mrr(String v)            { mrr = nz(v);            return this; }
        public Builder channels(String v)       { channels = nz(v);       return this; }

        /**
         * Sets a column by its field constant.
         *
         * @param field the column to set
         * @param value the value; null is stored as ""
         * @return this builder for chaining
         */
        public Builder set(CustomerField field, String value) {
            field.apply(this, value);
            return this;
        }

        /** @return the immutable record */
        public CustomerRecord build() {
            return new CustomerRecord(this);
        }

        private static String nz(String value) {
            return value == null ? "" : value;
        }
    }
}
