package com.nana.ingest.service;

import com.nana.ingest.domain.CustomerRecord;
import com.nana.ingest.domain.Result;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.nana.ingest.CsvFixtures.validCustomer;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FieldValidator}.
 */
class FieldValidatorTest {

    private final FieldValidator strict  = new FieldValidator();
    private final FieldValidator lenient = new FieldValidator(ValidationMode.LENIENT);

    private static List<ValidationErrorCode> codes(List<ValidationError> errors) {
        return errors.stream().map(ValidationError::getCode).toList();
    }

    private List<ValidationError> strictErrors(CustomerRecord record) {
        Result<ValidatedRecord, List<ValidationError>> result = strict.validate(record, 7);
        return result.isSuccess() ? List.of() : result.getError();
    }

    // ======================================================================
    // MODES
    // ======================================================================

    @Nested
    @DisplayName("Strict and lenient modes")
    class ModeTests {

        @Test
        @DisplayName("Valid record passes in strict mode unchanged")
        void validStrict() {
            CustomerRecord record = validCustomer();
            Result<ValidatedRecord, List<ValidationError>> result = strict.validate(record, 2);

            assertTrue(result.isSuccess());
            assertTrue(result.getValue().isValid());
            assertSame(record, result.getValue().getRecord());
        }

        @Test
        @DisplayName("Status 'Unknown' fails strict with INVALID_STATUS")
        void unknownStatusStrict() {
            CustomerRecord record = validCustomer().toBuilder().status("Unknown").build();
            Result<ValidatedRecord, List<ValidationError>> result = strict.validate(record, 4);

            assertTrue(result.isFailure());
            assertEquals(List.of(ValidationErrorCode.INVALID_STATUS), codes(result.getError()));
            ValidationError error = result.getError().get(0);
            assertEquals(4, error.getRowNumber());
            assertEquals("Status", error.getField());
            assertEquals("Unknown", error.getValue());
            assertEquals("Invalid status. Must be 'Active Customer' or 'Inactive Customer'",
                    error.getMessage());
        }

        @Test
        @DisplayName("Status 'Unknown' passes lenient with the same error attached")
        void unknownStatusLenient() {
            CustomerRecord record = validCustomer().toBuilder().status("Unknown").build();
            Result<ValidatedRecord, List<ValidationError>> result = lenient.validate(record, 4);

            assertTrue(result.isSuccess());
            assertFalse(result.getValue().isValid());
            assertEquals(List.of(ValidationErrorCode.INVALID_STATUS),
                    codes(result.getValue().getErrors()));
        }

        @Test
        @DisplayName("Lenient mode fills blank optional fields with defaults")
        void lenientDefaults() {
            CustomerRecord record = validCustomer().toBuilder()
                    .mrr("").channels("").language("").propertyType("").build();

            CustomerRecord defaulted = lenient.validate(record, 2).getValue().getRecord();
            assertEquals("0", defaulted.getMrr());
            assertEquals("", defaulted.getChannels());
            assertEquals("Unknown", defaulted.getLanguage());
            assertEquals("Other", defaulted.getPropertyType());
        }

        @Test
        @DisplayName("Strict mode applies no defaults")
        void strictNoDefaults() {
            CustomerRecord record = validCustomer().toBuilder().language("").build();
            assertEquals("", strict.validate(record, 2).getValue().getRecord().getLanguage());
        }

        @Test
        @DisplayName("withMode returns a validator in the new mode and leaves the old one alone")
        void withMode() {
            FieldValidator switched = strict.withMode(ValidationMode.LENIENT);
            assertEquals(ValidationMode.LENIENT, switched.getMode());
            assertEquals(ValidationMode.STRICT, strict.getMode());
            assertSame(strict, strict.withMode(ValidationMode.STRICT));
        }

        @Test
        @DisplayName("Null mode and null record are rejected")
        void nullArguments() {
            assertThrows(IllegalArgumentException.class, () -> new FieldValidator(null));
            assertThrows(IllegalArgumentException.class, () -> strict.validate(null, 1));
        }
    }

    // ======================================================================
    // FIELD CHECKS
    // ======================================================================

    @Nested
    @DisplayName("Field checks")
    class FieldCheckTests {

        @Test
        @DisplayName("Every blank required field is reported, in order")
        void requiredFields() {
            CustomerRecord record = CustomerRecord.builder().accountName("Acme").build();
            List<ValidationError> errors = strictErrors(record);

            assertEquals(List.of(
                    ValidationErrorCode.MISSING_CUSTOMER_ID,
                    ValidationErrorCode.MISSING_ACCOUNT_OWNER,
                    ValidationErrorCode.MISSING_STATUS,
                    ValidationErrorCode.MISSING_ACCOUNT_TYPE,
                    ValidationErrorCode.MISSING_CREATED_DATE), codes(errors));
            assertEquals("Required field 'Sirvoy Customer ID' is missing", errors.get(0).getMessage());
        }

        @ParameterizedTest
        @ValueSource(strings = {"01/01/2020", "1/1/1900", "31/12/2100", "15/01/2024, 10:30",
                "31/02/2024", "9/9/2024, 9:05"})
        @DisplayName("Accepted date formats")
        void validDates(String date) {
            CustomerRecord record = validCustomer().toBuilder().createdDate(date).latestLogin(date).build();
            assertTrue(strictErrors(record).isEmpty(), date);
        }

        @ParameterizedTest
        @ValueSource(strings = {"2024-01-15", "32/01/2024", "00/01/2024", "01/13/2024",
                "01/00/2024", "01/01/1899", "01/01/2101", "15/01/2024 10:30", "15/01/24"})
        @DisplayName("Rejected date formats report INVALID_DATE_FORMAT")
        void invalidDates(String date) {
            CustomerRecord record = validCustomer().toBuilder().createdDate(date).build();
            List<ValidationError> errors = strictErrors(record);

            assertEquals(List.of(ValidationErrorCode.INVALID_DATE_FORMAT), codes(errors), date);
            assertEquals("Created Date", errors.get(0).getField());
        }

        @Test
        @DisplayName("Blank Latest Login is allowed")
        void blankLatestLogin() {
            assertTrue(strictErrors(validCustomer().toBuilder().latestLogin("").build()).isEmpty());
        }

        @ParameterizedTest
        @ValueSource(strings = {"250", "0", "1,234.50", "$99", "12.5 EUR", ".5", "7.", "1.2.3"})
        @DisplayName("MRR values that contain a leading number are accepted")
        void validMrr(String mrr) {
            assertTrue(strictErrors(validCustomer().toBuilder().mrr(mrr).build()).isEmpty(), mrr);
        }

        @ParameterizedTest
        @ValueSource(strings = {"abc", "N/A", "--5", ".", "-"})
        @DisplayName("MRR without a number is INVALID_NUMBER")
        void invalidNumber(String mrr) {
            assertEquals(List.of(ValidationErrorCode.INVALID_NUMBER),
                    codes(strictErrors(validCustomer().toBuilder().mrr(mrr).build())), mrr);
        }

        @ParameterizedTest
        @CsvSource({"-100", "'$-5.50'", "-0.01"})
        @DisplayName("Negative MRR is INVALID_MRR")
        void negativeMrr(String mrr) {
            List<ValidationError> errors = strictErrors(validCustomer().toBuilder().mrr(mrr).build());
            assertEquals(List.of(ValidationErrorCode.INVALID_MRR), codes(errors), mrr);
            assertEquals("MRR must be non-negative", errors.get(0).getMessage());
        }

        @ParameterizedTest
        @ValueSource(strings = {"Active Customer", "Inactive Customer", "Active", "Inactive"})
        @DisplayName("Known status labels are accepted")
        void validStatus(String status) {
            assertTrue(strictErrors(validCustomer().toBuilder().status(status).build()).isEmpty());
        }

        @ParameterizedTest
        @ValueSource(strings = {"active", "ACTIVE CUSTOMER", "Churned"})
        @DisplayName("Status matching is exact")
        void invalidStatus(String status) {
            assertEquals(List.of(ValidationErrorCode.INVALID_STATUS),
                    codes(strictErrors(validCustomer().toBuilder().status(status).build())));
        }

        @Test
        @DisplayName("Unknown account type is INVALID_ACCOUNT_TYPE")
        void invalidAccountType() {
            List<ValidationError> errors =
                    strictErrors(validCustomer().toBuilder().accountType("Enterprise").build());
            assertEquals(List.of(ValidationErrorCode.INVALID_ACCOUNT_TYPE), codes(errors));
            assertEquals("Invalid account type. Must be 'Pro' or 'Starter'", errors.get(0).getMessage());
        }

        @Test
        @DisplayName("Errors from different checks accumulate in check order")
        void accumulate() {
            CustomerRecord record = validCustomer().toBuilder()
                    .accountOwner("")
                    .latestLogin("yesterday")
                    .status("Gone")
                    .mrr("-3")
                    .build();
            assertEquals(List.of(
                    ValidationErrorCode.MISSING_ACCOUNT_OWNER,
                    ValidationErrorCode.INVALID_DATE_FORMAT,
                    ValidationErrorCode.INVALID_STATUS,
                    ValidationErrorCode.INVALID_MRR), codes(strictErrors(record)));
        }
    }

    // ======================================================================
    // BATCH
    // ======================================================================

    @Nested
    @DisplayName("validateBatch")
    class BatchTests {

        private final List<CustomerRecord> batch = List.of(
                validCustomer(),
                validCustomer().toBuilder().customerId("C-2").status("Unknown").build(),
                validCustomer().toBuilder().customerId("C-3").build());

        @Test
        @DisplayName("Strict batch counts rejects and keeps the original record")
        void strictBatch() {
            BatchValidationResult result = strict.validateBatch(batch);

            assertEquals(3, result.getTotalRecords());
            assertEquals(2, result.getValidRecords());
            assertEquals(1, result.getInvalidRecords());
            assertEquals(3, result.getValidatedData().size());

            ValidatedRecord rejected = result.getValidatedData().get(1);
            assertFalse(rejected.isValid());
            assertEquals("C-2", rejected.getRecord().getCustomerId());
            assertEquals(2, result.getErrors().get(0).getRowNumber());
        }

        @Test
        @DisplayName("Lenient batch gives the same counts")
        void lenientBatch() {
            BatchValidationResult result = lenient.validateBatch(batch);
            assertEquals(2, result.getValidRecords());
            assertEquals(1, result.getInvalidRecords());
            assertEquals(1, result.getErrors().size());
        }

        @Test
        @DisplayName("Source row numbers are carried into errors")
        void sourceRows() {
            BatchValidationResult result = strict.validateBatch(batch, List.of(2, 5, 9));
            assertEquals(5, result.getErrors().get(0).getRowNumber());
        }

        @Test
        @DisplayName("Mismatched row numbers are rejected")
        void mismatchedRows() {
            assertThrows(IllegalArgumentException.class,
                    () -> strict.validateBatch(batch, List.of(2)));
        }

        @Test
        @DisplayName("Empty batch is all zeros")
        void emptyBatch() {
            BatchValidationResult result = strict.validateBatch(List.of());
            assertEquals(0, result.getTotalRecords());
            assertTrue(result.getErrors().isEmpty());
        }
    }
}
