package com.scholary.carrier.extractor.api;

import com.scholary.carrier.extractor.export.ResultExporter;
import com.scholary.carrier.extractor.identifier.IdentifierNormalizer;
import com.scholary.carrier.extractor.job.ExtractionJob;
import com.scholary.carrier.extractor.job.ExtractionOrchestrator;
import com.scholary.carrier.extractor.job.JobIdGenerator;
import com.scholary.carrier.extractor.job.JobRegistry;
import com.scholary.carrier.extractor.job.JobRejectedException;
import com.scholary.carrier.extractor.model.CarrierRecord;
import com.scholary.carrier.extractor.model.FailedExtraction;
import com.scholary.carrier.extractor.store.ExtractionStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for bulk carrier extraction.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a job from an uploaded file or a manual list (returns job ID immediately)
 *   <li>Job status polling and cancellation
 *   <li>Downloading results and failed MC numbers
 *   <li>Job history
 *   <li>Health check
 * </ul>
 */
@RestController
@Tag(name = "Extraction", description = "Bulk carrier data extraction API")
public class ExtractionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionController.class);

  private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

  private final IdentifierNormalizer normalizer;
  private final ExtractionOrchestrator orchestrator;
  private final ExtractionStore store;
  private final JobRegistry registry;
  private final JobIdGenerator jobIdGenerator;
  private final ResultExporter exporter;

  public ExtractionController(
      IdentifierNormalizer normalizer,
      ExtractionOrchestrator orchestrator,
      ExtractionStore store,
      JobRegistry registry,
      JobIdGenerator jobIdGenerator,
      ResultExporter exporter) {
    this.normalizer = normalizer;
    this.orchestrator = orchestrator;
    this.store = store;
    this.registry = registry;
    this.jobIdGenerator = jobIdGenerator;
    this.exporter = exporter;
  }

  /** Start a job from an uploaded text or CSV file of MC numbers. */
  @PostMapping(value = "/extract-bulk", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Start bulk extraction from file",
      description =
          "Upload a file with one MC number per line or comma-separated. "
              + "Returns a job ID for status polling.")
  public ResponseEntity<BulkExtractResponse> extractBulk(@RequestPart("file") MultipartFile file)
      throws IOException {
    String text = new String(file.getBytes(), StandardCharsets.UTF_8);
    LOGGER.info(
        "Bulk extraction request: file={}, bytes={}", file.getOriginalFilename(), file.getSize());
    return startJob(normalizer.normalize(text));
  }

  /** Start a job from a manually entered list. */
  @PostMapping("/extract")
  @Operation(
      summary = "Start extraction from a list",
      description = "Accepts a JSON list of MC numbers and/or free-form text")
  public ResponseEntity<BulkExtractResponse> extract(@RequestBody ExtractRequest request) {
    List<String> tokens = new ArrayList<>();
    if (request.mcNumbers() != null) {
      tokens.addAll(request.mcNumbers());
    }
    if (request.text() != null) {
      tokens.addAll(normalizer.normalize(request.text()));
    }
    return startJob(normalizer.normalizeAll(tokens));
  }

  @GetMapping("/extract-status/{jobId}")
  @Operation(summary = "Get job status", description = "Check progress of an extraction job")
  public ResponseEntity<JobStatusResponse> getStatus(@PathVariable String jobId) {
    return store
        .getJob(jobId)
        .map(job -> ResponseEntity.ok(JobStatusResponse.from(job, registry.isActive(jobId))))
        .orElse(ResponseEntity.notFound().build());
  }

  /**
   * Download extracted records.
   *
   * <p>Available while the job runs as well as after; a running job returns what has been
   * extracted so far.
   */
  @GetMapping("/extract-results/{jobId}")
  @Operation(
      summary = "Download results",
      description = "Download extracted carrier records as CSV (default) or JSON")
  public ResponseEntity<byte[]> getResults(
      @PathVariable String jobId, @RequestParam(defaultValue = "csv") String format)
      throws IOException {
    if (store.getJob(jobId).isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    List<CarrierRecord> records = store.getRecords(jobId);
    if (records.isEmpty()) {
      return ResponseEntity.notFound().build();
    }

    if ("json".equalsIgnoreCase(format)) {
      return download(
          exporter.recordsToJson(records), MediaType.APPLICATION_JSON, jobId + "_results.json");
    }
    if ("csv".equalsIgnoreCase(format)) {
      return download(exporter.recordsToCsv(records), TEXT_CSV, jobId + "_results.csv");
    }
    return ResponseEntity.badRequest().build();
  }

  @GetMapping("/extract-failed/{jobId}")
  @Operation(summary = "Download failures", description = "Download failed MC numbers as CSV")
  public ResponseEntity<byte[]> getFailed(@PathVariable String jobId) throws IOException {
    if (store.getJob(jobId).isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    List<FailedExtraction> failures = store.getFailures(jobId);
    if (failures.isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    return download(exporter.failuresToCsv(failures), TEXT_CSV, jobId + "_failed.csv");
  }

  @PostMapping("/jobs/{jobId}/cancel")
  @Operation(summary = "Cancel job", description = "Stop a queued or running job")
  public ResponseEntity<Map<String, String>> cancel(@PathVariable String jobId) {
    if (!orchestrator.cancel(jobId)) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.accepted()
        .body(Map.of("jobId", jobId, "message", "Cancellation requested"));
  }

  @GetMapping("/history")
  @Operation(summary = "Job history", description = "Most recent jobs first")
  public List<JobStatusResponse> history(@RequestParam(defaultValue = "100") int limit) {
    List<JobStatusResponse> jobs = new ArrayList<>();
    for (ExtractionJob job : store.listJobs(Math.max(1, limit))) {
      jobs.add(JobStatusResponse.from(job, registry.isActive(job.id())));
    }
    return jobs;
  }

  @GetMapping("/health")
  @Operation(summary = "Health check")
  public HealthResponse health() {
    return new HealthResponse("healthy", Instant.now(), registry.activeJobIds().size());
  }

  @ExceptionHandler(JobRejectedException.class)
  public ResponseEntity<Map<String, String>> handleRejected(JobRejectedException e) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", e.getMessage()));
  }

  private ResponseEntity<BulkExtractResponse> startJob(List<String> mcNumbers) {
    if (mcNumbers.isEmpty()) {
      return ResponseEntity.badRequest()
          .body(new BulkExtractResponse(null, 0, "rejected", "No valid MC numbers found"));
    }

    String jobId = jobIdGenerator.next();
    orchestrator.start(jobId, mcNumbers);
    LOGGER.info("Created extraction job {} for {} MC numbers", jobId, mcNumbers.size());

    return ResponseEntity.accepted()
        .body(
            new BulkExtractResponse(
                jobId,
                mcNumbers.size(),
                "processing",
                "Extraction started for " + mcNumbers.size() + " MC numbers"));
  }

  private static ResponseEntity<byte[]> download(
      byte[] body, MediaType contentType, String filename) {
    return ResponseEntity.ok()
        .contentType(contentType)
        .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
        .body(body);
  }
}
