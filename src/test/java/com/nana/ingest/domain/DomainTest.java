package com.nana.ingest.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import static com.nana.ingest.CsvFixtures.validCustomer;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the record types, column enums and vocabularies.
 */
class DomainTest {

    // ======================================================================
    // RESULT
    // ======================================================================

    @Nested
    @DisplayName("Result")
    class ResultTests {

        @Test
        @DisplayName("Success exposes its value only")
        void success() {
            Result<Integer, String> ok = Result.success(3);
            assertTrue(ok.isSuccess());
            assertEquals(3, ok.getValue());
            assertThrows(NoSuchElementException.class, ok::getError);
        }

        @Test
        @DisplayName("Failure exposes its error only")
        void failure() {
            Result<Integer, String> bad = Result.failure("Row 2: broken");
            assertTrue(bad.isFailure());
            assertEquals("Row 2: broken", bad.getError());
            assertThrows(NoSuchElementException.class, bad::getValue);
        }

        @Test
        @DisplayName("map transforms success and passes failure through")
        void map() {
            assertEquals("3", Result.<Integer, String>success(3).map(String::valueOf).getValue());
            assertEquals("x", Result.<Integer, String>failure("x").map(String::valueOf).getError());
        }

        @Test
        @DisplayName("Null payloads are rejected")
        void nulls() {
            assertThrows(NullPointerException.class, () -> Result.success(null));
            assertThrows(NullPointerException.class, () -> Result.failure(null));
        }
    }

    // ======================================================================
    // RECORDS AND FIELDS
    // ======================================================================

    @Nested
    @DisplayName("Records and fields")
    class RecordTests {

        @Test
        @DisplayName("Customer headers are the fifteen export columns in order")
        void customerHeaders() {
            assertEquals(15, CustomerField.headerNames().size());
            assertEquals("Account Owner", CustomerField.headerNames().get(0));
            assertEquals("Sirvoy Customer ID", CustomerField.CUSTOMER_ID.getHeaderName());
            assertEquals("MRR (converted)", CustomerField.MRR.toString());
            assertEquals("Channels", CustomerField.headerNames().get(14));
        }

        @Test
        @DisplayName("Sentiment headers are the four export columns in order")
        void sentimentHeaders() {
            assertEquals(List.of("Customer Sentiment Score", "Interaction: Created Date",
                    "Case", "Account: Sirvoy Customer ID"), SentimentField.headerNames());
        }

        @Test
        @DisplayName("Builder stores null as empty and fields round-trip through set/get")
        void builderNulls() {
            CustomerRecord record = CustomerRecord.builder()
                    .customerId(null)
                    .set(CustomerField.BILLING_COUNTRY, "Sweden")
                    .build();

            assertEquals("", record.getCustomerId());
            assertEquals("Sweden", record.get(CustomerField.BILLING_COUNTRY));
            assertEquals("", CustomerField.ACCOUNT_NAME.extract(null));
        }

        @Test
        @DisplayName("toBuilder copies every field; equality is by value")
        void toBuilderEquality() {
            CustomerRecord original = validCustomer();
            CustomerRecord copy = original.toBuilder().build();
            assertEquals(original, copy);
            assertEquals(original.hashCode(), copy.hashCode());
            assertNotEquals(original, original.toBuilder().mrr("1").build());
        }

        @Test
        @DisplayName("Sentiment record is set through its field enum")
        void sentimentSet() {
            SentimentRecord record = SentimentRecord.builder()
                    .set(SentimentField.CASE, "00012345")
                    .set(SentimentField.ACCOUNT_CUSTOMER_ID, "C-1")
                    .build();
            assertEquals("00012345", record.getCaseNumber());
            assertEquals("C-1", record.get(SentimentField.ACCOUNT_CUSTOMER_ID));
            assertEquals("", record.getSentimentScore());
        }
    }

    // ======================================================================
    // VOCABULARIES
    // ======================================================================

    @Nested
    @DisplayName("Status and account type")
    class VocabularyTests {

        @ParameterizedTest
        @CsvSource({
                "Active Customer,   ACTIVE",
                "Active,            ACTIVE",
                "Inactive Customer, INACTIVE",
                "Inactive,          INACTIVE"
        })
        @DisplayName("Status labels and short forms resolve")
        void statusLabels(String label, CustomerStatus expected) {
            assertEquals(Optional.of(expected), CustomerStatus.fromLabel(label));
        }

        @Test
        @DisplayName("Every short form resolves back to its own status")
        void shortLabelsRoundTrip() {
            assertEquals("Active", CustomerStatus.ACTIVE.getShortLabel());
            assertEquals("Inactive", CustomerStatus.INACTIVE.getShortLabel());
            for (CustomerStatus status : CustomerStatus.values()) {
                assertEquals(Optional.of(status), CustomerStatus.fromLabel(status.getShortLabel()));
                assertEquals(Optional.of(status), CustomerStatus.fromLabel(status.getLabel()));
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"active", "Unknown", " Active", ""})
        @DisplayName("Status matching is exact and case-sensitive")
        void statusUnknown(String label) {
            assertTrue(CustomerStatus.fromLabel(label).isEmpty());
        }

        @Test
        @DisplayName("Null status is unknown")
        void statusNull() {
            assertTrue(CustomerStatus.fromLabel(null).isEmpty());
        }

        @Test
        @DisplayName("Account types resolve by exact label")
        void accountTypes() {
            assertEquals(Optional.of(AccountType.PRO), AccountType.fromLabel("Pro"));
            assertEquals(Optional.of(AccountType.STARTER), AccountType.fromLabel("Starter"));
            assertTrue(AccountType.fromLabel("pro").isEmpty());
            assertEquals("Starter", AccountType.STARTER.toString());
        }
    }
}
