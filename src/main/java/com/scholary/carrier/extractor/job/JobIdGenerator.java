package com.scholary.carrier.extractor.job;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Generates job ids of the form {@code job_20240131_142501_1a2b3c4d}. */
@Component
public class JobIdGenerator {

  private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final Clock clock = Clock.systemDefaultZone();

  public String next() {
    String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    return "job_" + LocalDateTime.now(clock).format(FORMAT) + "_" + suffix;
  }
}
