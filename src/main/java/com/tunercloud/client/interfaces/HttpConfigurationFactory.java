package com.tunercloud.client.interfaces;

/**
 * Interface for a factory that creates an {@link HttpConfiguration}.
 *
 * @see com.tunercloud.client.Components#httpConfiguration()
 * @see com.tunercloud.client.ReportingConfig.Builder#http(HttpConfigurationFactory)
 */
public interface HttpConfigurationFactory {
  /**
   * Creates the configuration object.
   * @return an {@link HttpConfiguration}
   */
  public HttpConfiguration createHttpConfiguration();
}
