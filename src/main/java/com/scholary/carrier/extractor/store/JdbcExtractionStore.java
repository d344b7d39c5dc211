package com.scholary.carrier.extractor.store;

import com.scholary.carrier.extractor.job.ExtractionJob;
import com.scholary.carrier.extractor.job.JobStatus;
import com.scholary.carrier.extractor.model.CarrierRecord;
import com.scholary.carrier.extractor.model.FailedExtraction;
import com.scholary.carrier.extractor.model.RiskLevel;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Relational store backed by {@link JdbcTemplate}.
 *
 * <p>Tables are created by {@code schema.sql}. Status updates only touch rows that are still
 * {@code processing}, which keeps terminal states final without a read-modify-write cycle.
 */
public class JdbcExtractionStore implements ExtractionStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcExtractionStore.class);

  private static final String JOB_COLUMNS =
      "job_id, status, total_mc_numbers, processed_count, failed_count, created_at,"
          + " completed_at, error_message";

  private static final String CARRIER_COLUMNS =
      "job_id, mc_number, dot_number, company_name, authority_status, authority_type,"
          + " insurance_status, insurance_expiry, safety_rating, violations_12mo,"
          + " accidents_12mo, authority_date, email, phone, state, safety_score, risk_level,"
          + " extracted_date";

  private final JdbcTemplate jdbcTemplate;
  private final Clock clock;

  public JdbcExtractionStore(JdbcTemplate jdbcTemplate) {
    this(jdbcTemplate, Clock.systemUTC());
  }

  public JdbcExtractionStore(JdbcTemplate jdbcTemplate, Clock clock) {
    this.jdbcTemplate = jdbcTemplate;
    this.clock = clock;
  }

  @Override
  public void createJob(String jobId, int total) {
    jdbcTemplate.update(
        "INSERT INTO jobs (job_id, status, total_mc_numbers, processed_count, failed_count,"
            + " created_at) VALUES (?, ?, ?, 0, 0, ?)",
        jobId,
        JobStatus.PROCESSING.value(),
        total,
        Timestamp.from(clock.instant()));
  }

  @Override
  public boolean updateJob(
      String jobId, JobStatus status, Integer processed, Integer failed, String errorMessage) {
    StringBuilder sql = new StringBuilder("UPDATE jobs SET status = ?");
    List<Object> args = new ArrayList<>();
    args.add(status.value());
    if (processed != null) {
      sql.append(", processed_count = ?");
      args.add(processed);
    }
    if (failed != null) {
      sql.append(", failed_count = ?");
      args.add(failed);
    }
    if (errorMessage != null) {
      sql.append(", error_message = ?");
      args.add(errorMessage);
    }
    if (status.isTerminal()) {
      sql.append(", completed_at = ?");
      args.add(Timestamp.from(clock.instant()));
    }
    sql.append(" WHERE job_id = ? AND status = ?");
    args.add(jobId);
    args.add(JobStatus.PROCESSING.value());

    int rows = jdbcTemplate.update(sql.toString(), args.toArray());
    if (rows == 0) {
      LOGGER.debug("Ignored update of job {} to {}: unknown or already terminal", jobId, status);
    }
    return rows > 0;
  }

  @Override
  public int failProcessingJobs(String errorMessage) {
    return jdbcTemplate.update(
        "UPDATE jobs SET status = ?, error_message = ?, completed_at = ? WHERE status = ?",
        JobStatus.FAILED.value(),
        errorMessage,
        Timestamp.from(clock.instant()),
        JobStatus.PROCESSING.value());
  }

  @Override
  public void saveRecord(CarrierRecord record) {
    jdbcTemplate.update(
        "INSERT INTO carriers (" + CARRIER_COLUMNS + ")"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
        record.jobId(),
        record.mcNumber(),
        record.dotNumber(),
        record.companyName(),
        record.authorityStatus(),
        record.authorityType(),
        record.insuranceStatus(),
        record.insuranceExpiry(),
        record.safetyRating(),
        record.violations12mo(),
        record.accidents12mo(),
        record.authorityDate(),
        record.email(),
        record.phone(),
        record.state(),
        record.safetyScore(),
        record.riskLevel().label(),
        Timestamp.from(record.extractedDate()));
  }

  @Override
  public void saveFailure(String jobId, String mcNumber, String reason, int retryCount) {
    jdbcTemplate.update(
        "INSERT INTO failed_extractions (job_id, mc_number, error_reason, retry_count, failed_at)"
            + " VALUES (?, ?, ?, ?, ?)",
        jobId,
        mcNumber,
        reason,
        retryCount,
        Timestamp.from(clock.instant()));
  }

  @Override
  public Optional<ExtractionJob> getJob(String jobId) {
    List<ExtractionJob> jobs =
        jdbcTemplate.query(
            "SELECT " + JOB_COLUMNS + " FROM jobs WHERE job_id = ?",
            (rs, rowNum) -> mapJob(rs),
            jobId);
    return jobs.stream().findFirst();
  }

  @Override
  public List<CarrierRecord> getRecords(String jobId) {
    return jdbcTemplate.query(
        "SELECT " + CARRIER_COLUMNS + " FROM carriers WHERE job_id = ? ORDER BY id",
        (rs, rowNum) -> mapRecord(rs),
        jobId);
  }

  @Override
  public List<FailedExtraction> getFailures(String jobId) {
    return jdbcTemplate.query(
        "SELECT job_id, mc_number, error_reason, retry_count, failed_at"
            + " FROM failed_extractions WHERE job_id = ? ORDER BY id",
        (rs, rowNum) ->
            new FailedExtraction(
                rs.getString("job_id"),
                rs.getString("mc_number"),
                rs.getString("error_reason"),
                rs.getInt("retry_count"),
                toInstant(rs.getTimestamp("failed_at"))),
        jobId);
  }

  @Override
  public List<ExtractionJob> listJobs(int limit) {
    return jdbcTemplate.query(
        "SELECT " + JOB_COLUMNS + " FROM jobs ORDER BY created_at DESC, job_id DESC LIMIT ?",
        (rs, rowNum) -> mapJob(rs),
        limit);
  }

  private static ExtractionJob mapJob(ResultSet rs) throws SQLException {
    return new ExtractionJob(
        rs.getString("job_id"),
        JobStatus.fromValue(rs.getString("status")),
        rs.getInt("total_mc_numbers"),
        rs.getInt("processed_count"),
        rs.getInt("failed_count"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("completed_at")),
        rs.getString("error_message"));
  }

  private static CarrierRecord mapRecord(ResultSet rs) throws SQLException {
    return new CarrierRecord(
        rs.getString("job_id"),
        rs.getString("mc_number"),
        rs.getString("dot_number"),
        rs.getString("company_name"),
        rs.getString("authority_status"),
        rs.getString("authority_type"),
        rs.getString("insurance_status"),
        rs.getString("insurance_expiry"),
        rs.getString("safety_rating"),
        rs.getInt("violations_12mo"),
        rs.getInt("accidents_12mo"),
        rs.getString("authority_date"),
        rs.getString("email"),
        rs.getString("phone"),
        rs.getString("state"),
        rs.getDouble("safety_score"),
        RiskLevel.fromLabel(rs.getString("risk_level")),
        toInstant(rs.getTimestamp("extracted_date")));
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
