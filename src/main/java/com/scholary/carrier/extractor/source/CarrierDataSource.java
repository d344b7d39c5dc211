package com.scholary.carrier.extractor.source;

/**
 * Interface for carrier data providers.
 *
 * <p>This abstraction lets the orchestrator work against a hosted scraping API, a browser
 * automation backend or a test double without changing job logic. A job opens one session,
 * performs all of its lookups through it and closes it when done.
 */
public interface CarrierDataSource {

  /**
   * Open a lookup session.
   *
   * @return a session ready to serve lookups
   * @throws CarrierLookupException if the source cannot be initialised (missing credentials,
   *     unreachable backend)
   */
  CarrierSession openSession();
}
