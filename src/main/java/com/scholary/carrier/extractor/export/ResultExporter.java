package com.scholary.carrier.extractor.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVWriter;
import com.scholary.carrier.extractor.enrichment.EnrichmentEngine;
import com.scholary.carrier.extractor.model.CarrierRecord;
import com.scholary.carrier.extractor.model.FailedExtraction;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Writes job results as downloadable files.
 *
 * <p>Supports CSV (spreadsheet-friendly, header row first) and JSON (an array of objects). Column
 * names and order are the ones the enrichment engine formats records with. All output is UTF-8.
 */
@Component
public class ResultExporter {

  private final EnrichmentEngine enrichmentEngine;
  private final ObjectMapper objectMapper;

  public ResultExporter(EnrichmentEngine enrichmentEngine, ObjectMapper objectMapper) {
    this.enrichmentEngine = enrichmentEngine;
    this.objectMapper = objectMapper;
  }

  /** Write extracted records as CSV with the output column header. */
  public byte[] recordsToCsv(List<CarrierRecord> records) throws IOException {
    List<Map<String, String>> rows = new ArrayList<>(records.size());
    for (CarrierRecord record : records) {
      rows.add(enrichmentEngine.formatForOutput(record));
    }
    return writeCsv(EnrichmentEngine.OUTPUT_COLUMNS, rows);
  }

  /**
   * Write extracted records as JSON.
   *
   * <p>Format:
   *
   * <pre>
   * [
   *   {"MC#": "123456", "DOT#": "987654", ..., "Risk Level": "Low", ...}
   * ]
   * </pre>
   */
  public byte[] recordsToJson(List<CarrierRecord> records) throws IOException {
    List<Map<String, String>> rows = new ArrayList<>(records.size());
    for (CarrierRecord record : records) {
      rows.add(enrichmentEngine.formatForOutput(record));
    }
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(rows);
  }

  /** Write failed identifiers as CSV: MC Number, Error Reason, Retry Count. */
  public byte[] failuresToCsv(List<FailedExtraction> failures) throws IOException {
    List<Map<String, String>> rows = new ArrayList<>(failures.size());
    for (FailedExtraction failure : failures) {
      rows.add(enrichmentEngine.formatFailure(failure));
    }
    return writeCsv(EnrichmentEngine.FAILURE_COLUMNS, rows);
  }

  private static byte[] writeCsv(List<String> columns, Collection<Map<String, String>> rows)
      throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (CSVWriter writer =
        new CSVWriter(
            new OutputStreamWriter(out, StandardCharsets.UTF_8),
            CSVWriter.DEFAULT_SEPARATOR,
            CSVWriter.DEFAULT_QUOTE_CHARACTER,
            CSVWriter.DEFAULT_ESCAPE_CHARACTER,
            CSVWriter.DEFAULT_LINE_END)) {

      writer.writeNext(columns.toArray(new String[0]), false);
      for (Map<String, String> row : rows) {
        String[] line = new String[columns.size()];
        for (int i = 0; i < line.length; i++) {
          line[i] = str(row.get(columns.get(i)));
        }
        writer.writeNext(line, false);
      }
    }
    return out.toByteArray();
  }

  private static String str(String value) {
    return value == null ? "" : value;
  }
}
