package com.scholary.carrier.extractor.api;

import java.util.List;

/**
 * Manual extraction request.
 *
 * <p>MC numbers may be given as a list, as free-form text (one per line or comma-separated), or
 * both. Both are cleaned the same way as an uploaded file.
 */
public record ExtractRequest(List<String> mcNumbers, String text) {}
