package com.nana.ingest.service;

import com.nana.ingest.domain.CustomerRecord;

/**
 * Computes a customer's health score from a validated record.
 *
 * <p>The scoring arithmetic lives outside the import pipeline;
 * {@link CsvImportService} only calls this for records that passed
 * validation. An implementation may throw a runtime exception for a
 * record it cannot score; the import logs it and leaves that customer
 * without a score.
 */
@FunctionalInterface
public interface HealthScoreCalculator {

    /**
     * @param record a record that passed validation
     * @return the customer's health score
     */
    double calculate(CustomerRecord record);
}
