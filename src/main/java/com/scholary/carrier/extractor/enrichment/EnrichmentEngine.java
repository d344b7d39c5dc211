package com.scholary.carrier.extractor.enrichment;

import com.scholary.carrier.extractor.model.CarrierRecord;
import com.scholary.carrier.extractor.model.FailedExtraction;
import com.scholary.carrier.extractor.model.RiskLevel;
import com.scholary.carrier.extractor.source.RawCarrierRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Derives safety metrics from raw carrier data and formats records for export.
 *
 * <p>Enrichment has no side effects beyond reading the clock for the extraction timestamp, so
 * enriching the same raw record twice yields the same derived fields.
 */
@Component
public class EnrichmentEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(EnrichmentEngine.class);

  /** Export column order for carrier records. */
  public static final List<String> OUTPUT_COLUMNS =
      List.of(
          "MC#",
          "DOT#",
          "Company Name",
          "Authority Status",
          "Insurance Status",
          "Insurance Expiry",
          "Safety Score",
          "Violations (12mo)",
          "Accidents (12mo)",
          "Phone",
          "Email",
          "State",
          "Risk Level",
          "Extracted Date");

  /** Export column order for failed extractions. */
  public static final List<String> FAILURE_COLUMNS =
      List.of("MC Number", "Error Reason", "Retry Count");

  private static final double MAX_SCORE = 10.0;
  private static final double MIN_SCORE = 1.0;
  private static final double VIOLATION_PENALTY = 0.5;
  private static final double MAX_VIOLATION_DEDUCTION = 4.0;
  private static final double ACCIDENT_PENALTY = 1.5;
  private static final double MAX_ACCIDENT_DEDUCTION = 4.5;

  private final Clock clock;

  @Autowired
  public EnrichmentEngine() {
    this(Clock.systemUTC());
  }

  public EnrichmentEngine(Clock clock) {
    this.clock = clock;
  }

  /**
   * Check that a raw record is usable.
   *
   * @return false if the record has no MC number
   */
  public boolean validate(RawCarrierRecord raw) {
    if (raw == null || !raw.hasMcNumber()) {
      return false;
    }
    if (!raw.hasCompanyName()) {
      LOGGER.warn("MC {} missing company name", raw.mcNumber());
    }
    return true;
  }

  /**
   * Enrich a validated raw record.
   *
   * @param raw the record returned by the data source
   * @param jobId the owning job
   * @return an immutable record with derived fields filled in
   */
  public CarrierRecord enrich(RawCarrierRecord raw, String jobId) {
    int violations = countOrZero(raw.violations12mo());
    int accidents = countOrZero(raw.accidents12mo());

    CarrierRecord enriched =
        new CarrierRecord(
            jobId,
            raw.mcNumber(),
            raw.dotNumber(),
            raw.companyName(),
            AuthorityStatusClassifier.normalize(raw.authorityStatus()),
            raw.authorityType(),
            raw.insuranceStatus(),
            raw.insuranceExpiry(),
            raw.safetyRating(),
            violations,
            accidents,
            raw.authorityDate(),
            raw.email(),
            raw.phone(),
            raw.state(),
            safetyScore(violations, accidents),
            riskLevel(violations, accidents),
            clock.instant());

    LOGGER.debug("Enriched data for MC {}", raw.mcNumber());
    return enriched;
  }

  /**
   * Safety score on a 1.0 (worst) to 10.0 (best) scale, rounded to one decimal.
   *
   * <p>Violations cost 0.5 each, capped at 4.0. Accidents cost 1.5 each, capped at 4.5.
   */
  public double safetyScore(int violations, int accidents) {
    double score = MAX_SCORE;
    score -= Math.min(violations * VIOLATION_PENALTY, MAX_VIOLATION_DEDUCTION);
    score -= Math.min(accidents * ACCIDENT_PENALTY, MAX_ACCIDENT_DEDUCTION);
    score = Math.max(score, MIN_SCORE);
    return BigDecimal.valueOf(score).setScale(1, RoundingMode.HALF_UP).doubleValue();
  }

  public RiskLevel riskLevel(int violations, int accidents) {
    if (violations > 3 || accidents > 1) {
      return RiskLevel.HIGH;
    }
    if (violations > 0 || accidents > 0) {
      return RiskLevel.MEDIUM;
    }
    return RiskLevel.LOW;
  }

  /** Format a record as an ordered column map. Absent values become empty strings. */
  public Map<String, String> formatForOutput(CarrierRecord record) {
    Map<String, String> row = new LinkedHashMap<>();
    row.put("MC#", str(record.mcNumber()));
    row.put("DOT#", str(record.dotNumber()));
    row.put("Company Name", str(record.companyName()));
    row.put("Authority Status", str(record.authorityStatus()));
    row.put("Insurance Status", str(record.insuranceStatus()));
    row.put("Insurance Expiry", str(record.insuranceExpiry()));
    row.put("Safety Score", String.format(Locale.ROOT, "%.1f", record.safetyScore()));
    row.put("Violations (12mo)", String.valueOf(record.violations12mo()));
    row.put("Accidents (12mo)", String.valueOf(record.accidents12mo()));
    row.put("Phone", str(record.phone()));
    row.put("Email", str(record.email()));
    row.put("State", str(record.state()));
    row.put("Risk Level", record.riskLevel() == null ? "" : record.riskLevel().label());
    row.put("Extracted Date", str(record.extractedDate()));
    return row;
  }

  public Map<String, String> formatFailure(FailedExtraction failure) {
    Map<String, String> row = new LinkedHashMap<>();
    row.put("MC Number", str(failure.mcNumber()));
    row.put("Error Reason", str(failure.errorReason()));
    row.put("Retry Count", String.valueOf(failure.retryCount()));
    return row;
  }

  private static int countOrZero(Integer value) {
    return value == null ? 0 : Math.max(value, 0);
  }

  private static String str(Object value) {
    return value == null ? "" : value.toString();
  }
}
