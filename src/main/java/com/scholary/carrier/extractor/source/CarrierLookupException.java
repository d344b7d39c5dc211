package com.scholary.carrier.extractor.source;

/**
 * Exception thrown when a carrier lookup fails.
 *
 * <p>This could be due to network issues, a timeout, an unparseable response or a record that
 * fails validation. Also thrown when a data source session cannot be opened.
 */
public class CarrierLookupException extends RuntimeException {

  public CarrierLookupException(String message) {
    super(message);
  }

  public CarrierLookupException(String message, Throwable cause) {
    super(message, cause);
  }
}
