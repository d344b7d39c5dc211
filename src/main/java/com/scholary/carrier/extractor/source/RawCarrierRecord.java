package com.scholary.carrier.extractor.source;

/**
 * Carrier data as returned by a data source, before validation and enrichment.
 *
 * <p>Every field is optional. Counts are boxed so "not reported" can be told apart from zero; the
 * enrichment engine treats both as zero when scoring.
 */
public record RawCarrierRecord(
    String mcNumber,
    String dotNumber,
    String companyName,
    String authorityStatus,
    String authorityType,
    String insuranceStatus,
    String insuranceExpiry,
    String safetyRating,
    Integer violations12mo,
    Integer accidents12mo,
    String authorityDate,
    String email,
    String phone,
    String state) {

  public boolean hasMcNumber() {
    return mcNumber != null && !mcNumber.isBlank();
  }

  public boolean hasCompanyName() {
    return companyName != null && !companyName.isBlank();
  }
}
