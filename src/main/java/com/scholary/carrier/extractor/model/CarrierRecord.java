package com.scholary.carrier.extractor.model;

import com.scholary.carrier.extractor.source.RawCarrierRecord;
import java.time.Instant;

/**
 * An enriched carrier record: the result of one successful identifier lookup.
 *
 * <p>Raw fields come from the carrier data source. {@code safetyScore}, {@code riskLevel} and
 * {@code extractedDate} are derived by the enrichment engine and never supplied by the source.
 */
public record CarrierRecord(
    String jobId,
    String mcNumber,
    String dotNumber,
    String companyName,
    String authorityStatus,
    String authorityType,
    String insuranceStatus,
    String insuranceExpiry,
    String safetyRating,
    int violations12mo,
    int accidents12mo,
    String authorityDate,
    String email,
    String phone,
    String state,
    double safetyScore,
    RiskLevel riskLevel,
    Instant extractedDate) {

  public CarrierRecord {
    if (violations12mo < 0 || accidents12mo < 0) {
      throw new IllegalArgumentException("violation and accident counts must be non-negative");
    }
    if (safetyScore < 1.0 || safetyScore > 10.0) {
      throw new IllegalArgumentException("safety score out of range: " + safetyScore);
    }
  }

  /** Strip the derived fields, giving back the raw shape this record was built from. */
  public RawCarrierRecord toRaw() {
    return new RawCarrierRecord(
        mcNumber,
        dotNumber,
        companyName,
        authorityStatus,
        authorityType,
        insuranceStatus,
        insuranceExpiry,
        safetyRating,
        violations12mo,
        accidents12mo,
        authorityDate,
        email,
        phone,
        state);
  }
}
