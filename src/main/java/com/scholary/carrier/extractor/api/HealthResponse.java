package com.scholary.carrier.extractor.api;

import java.time.Instant;

/** Liveness answer with the number of jobs currently running or queued. */
public record HealthResponse(String status, Instant timestamp, int activeJobs) {}
