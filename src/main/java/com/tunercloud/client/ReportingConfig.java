package com.tunercloud.client;

import com.tunercloud.client.interfaces.CredentialValidatorFactory;
import com.tunercloud.client.interfaces.HttpConfiguration;
import com.tunercloud.client.interfaces.HttpConfigurationFactory;
import com.tunercloud.client.interfaces.TransmitterFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * This class exposes advanced configuration options for the {@link ReportingClient}. Instances of this
 * class must be constructed with a {@link ReportingConfig.Builder}.
 */
public final class ReportingConfig {
  static final URI DEFAULT_BASE_URI = URI.create("https://us-central1-kerastuner-prod.cloudfunctions.net/api/");
  static final Duration DEFAULT_DEBOUNCE_INTERVAL = Duration.ofSeconds(5);
  static final int DEFAULT_WORKER_THREADS = 5;

  static final ReportingConfig DEFAULT = new Builder().build();

  final URI baseUri;
  final Duration debounceInterval;
  final int workerThreads;
  final HttpConfiguration httpConfig;
  final TransmitterFactory transmitterFactory;
  final CredentialValidatorFactory credentialValidatorFactory;
  final Clock clock;

  ReportingConfig(Builder builder) {
    this.baseUri = builder.baseUri;
    this.debounceInterval = builder.debounceInterval;
    this.workerThreads = builder.workerThreads;
    this.httpConfig = builder.httpConfigFactory == null ?
        Components.httpConfiguration().createHttpConfiguration() :
        builder.httpConfigFactory.createHttpConfiguration();
    this.transmitterFactory = builder.transmitterFactory == null ?
        Components.defaultTransmitter() : builder.transmitterFactory;
    this.credentialValidatorFactory = builder.credentialValidatorFactory == null ?
        Components.defaultCredentialValidator() : builder.credentialValidatorFactory;
    this.clock = builder.clock;
  }

  /**
   * Returns the base URI of the cloud service.
   * @return the base URI
   */
  public URI getBaseUri() {
    return baseUri;
  }

  /**
   * Returns the minimum time between two accepted status sends.
   * @return the debounce interval
   */
  public Duration getDebounceInterval() {
    return debounceInterval;
  }

  /**
   * Returns the number of background workers used for non-blocking sends.
   * @return the worker count
   */
  public int getWorkerThreads() {
    return workerThreads;
  }

  /**
   * A <a href="http://en.wikipedia.org/wiki/Builder_pattern">builder</a> that helps construct
   * {@link ReportingConfig} objects. Builder calls can be chained, enabling the following pattern:
   * <pre>
   * ReportingConfig config = new ReportingConfig.Builder()
   *      .debounceInterval(Duration.ofSeconds(10))
   *      .workerThreads(2)
   *      .build()
   * </pre>
   */
  public static class Builder {
    private URI baseUri = DEFAULT_BASE_URI;
    private Duration debounceInterval = DEFAULT_DEBOUNCE_INTERVAL;
    private int workerThreads = DEFAULT_WORKER_THREADS;
    private HttpConfigurationFactory httpConfigFactory = null;
    private TransmitterFactory transmitterFactory = null;
    private CredentialValidatorFactory credentialValidatorFactory = null;
    private Clock clock = Clock.systemUTC();

    /**
     * Creates a builder with all configuration parameters set to the default.
     */
    public Builder() {
    }

    /**
     * Sets the base URI of the cloud service. {@link ReportingClient#enable(String, URI)} can override
     * this per client.
     *
     * @param baseUri the base URI; null restores the default
     * @return the builder
     */
    public Builder baseUri(URI baseUri) {
      this.baseUri = baseUri == null ? DEFAULT_BASE_URI : baseUri;
      return this;
    }

    /**
     * Sets the minimum time that must pass between two status sends. Status updates that arrive sooner
     * are dropped, not queued. The default is 5 seconds.
     *
     * @param debounceInterval the interval; null restores the default
     * @return the builder
     */
    public Builder debounceInterval(Duration debounceInterval) {
      checkArgument(debounceInterval == null || !debounceInterval.isNegative(), "debounceInterval must not be negative");
      this.debounceInterval = debounceInterval == null ? DEFAULT_DEBOUNCE_INTERVAL : debounceInterval;
      return this;
    }

    /**
     * Sets the number of background workers that perform non-blocking sends. The default is
     * {@value ReportingConfig#DEFAULT_WORKER_THREADS}.
     *
     * @param workerThreads the number of workers; must be positive
     * @return the builder
     */
    public Builder workerThreads(int workerThreads) {
      checkArgument(workerThreads > 0, "workerThreads must be positive");
      this.workerThreads = workerThreads;
      return this;
    }

    /**
     * Sets the client's networking configuration, using a factory object. This object is normally a
     * configuration builder obtained from {@link Components#httpConfiguration()}.
     *
     * @param factory the factory
     * @return the builder
     */
    public Builder http(HttpConfigurationFactory factory) {
      this.httpConfigFactory = factory;
      return this;
    }

    /**
     * Sets the component that delivers payloads. The default is {@link Components#defaultTransmitter()}.
     *
     * @param factory the factory
     * @return the builder
     */
    public Builder transmitter(TransmitterFactory factory) {
      this.transmitterFactory = factory;
      return this;
    }

    /**
     * Sets the component that checks API keys in {@link ReportingClient#enable(String)}. The default is
     * {@link Components#defaultCredentialValidator()}; test harnesses can use
     * {@link Components#testKeyCredentialValidator()}.
     *
     * @param factory the factory
     * @return the builder
     */
    public Builder credentialValidator(CredentialValidatorFactory factory) {
      this.credentialValidatorFactory = factory;
      return this;
    }

    // Only tests need a clock other than the system clock.
    Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the configured {@link ReportingConfig} object.
     *
     * @return the {@link ReportingConfig} configured by this builder
     */
    public ReportingConfig build() {
      return new ReportingConfig(this);
    }
  }
}
