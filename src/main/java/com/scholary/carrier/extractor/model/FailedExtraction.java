package com.scholary.carrier.extractor.model;

import java.time.Instant;

/** An identifier that exhausted its retries. Written once and never updated. */
public record FailedExtraction(
    String jobId, String mcNumber, String errorReason, int retryCount, Instant failedAt) {}
