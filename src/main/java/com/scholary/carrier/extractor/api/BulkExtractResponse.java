package com.scholary.carrier.extractor.api;

/**
 * Response for a bulk extraction request.
 *
 * <p>Returns the job ID to poll with {@code /extract-status/{jobId}}.
 */
public record BulkExtractResponse(
    String jobId, int totalMcNumbers, String status, String message) {}
