package com.scholary.carrier.extractor.source;

import java.time.Duration;
import java.util.Optional;

/** An open connection to a carrier data source, used by one job at a time. */
public interface CarrierSession extends AutoCloseable {

  /**
   * Look up a single carrier.
   *
   * @param mcNumber the normalized identifier
   * @param timeout upper bound for the whole lookup
   * @return the raw record, or empty if the source has no carrier for this identifier
   * @throws CarrierLookupException on timeout, transport or parse errors
   */
  Optional<RawCarrierRecord> lookup(String mcNumber, Duration timeout);

  @Override
  void close();
}
