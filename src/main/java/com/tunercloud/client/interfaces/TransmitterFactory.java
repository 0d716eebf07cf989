package com.tunercloud.client.interfaces;

/**
 * Interface for a factory that creates some implementation of {@link Transmitter}.
 *
 * @see com.tunercloud.client.ReportingConfig.Builder#transmitter(TransmitterFactory)
 */
public interface TransmitterFactory {
  /**
   * Called by the client to create the implementation object.
   *
   * @param httpConfiguration HTTP configuration properties
   * @return a {@link Transmitter}
   */
  Transmitter createTransmitter(HttpConfiguration httpConfiguration);
}
