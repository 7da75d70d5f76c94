package com.nana.ingest.service;

/**
 * Field-level validation failures for customer records.
 */
public enum ValidationErrorCode {
    MISSING_CUSTOMER_ID,
    MISSING_ACCOUNT_OWNER,
    MISSING_STATUS,
    MISSING_ACCOUNT_TYPE,
    MISSING_CREATED_DATE,
    INVALID_STATUS,
    INVALID_ACCOUNT_TYPE,
    INVALID_DATE_FORMAT,
    INVALID_NUMBER,
    INVALID_MRR
}
