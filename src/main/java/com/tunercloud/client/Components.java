package com.tunercloud.client;

import com.tunercloud.client.integrations.HttpConfigurationBuilder;
import com.tunercloud.client.interfaces.CredentialValidator;
import com.tunercloud.client.interfaces.CredentialValidatorFactory;
import com.tunercloud.client.interfaces.HttpConfiguration;
import com.tunercloud.client.interfaces.TransmitterFactory;

import java.net.InetSocketAddress;
import java.net.Proxy;

/**
 * Provides configurable factories for the standard implementations of the client's component interfaces.
 * <p>
 * Call one of the static methods here, apply any configuration change to the object it returns, and
 * pass that object to the corresponding method of {@link ReportingConfig.Builder}.
 */
public abstract class Components {
  private static final TransmitterFactory defaultTransmitterFactory = new DefaultTransmitterFactory();
  private static final CredentialValidatorFactory defaultCredentialValidatorFactory = new DefaultCredentialValidatorFactory();

  private Components() {}

  /**
   * Returns a configurable factory for the client's networking configuration.
   * <p>
   * Passing this to {@link ReportingConfig.Builder#http(com.tunercloud.client.interfaces.HttpConfigurationFactory)}
   * applies this configuration to all HTTP requests made by the client.
   *
   * @return a factory object
   */
  public static HttpConfigurationBuilder httpConfiguration() {
    return new HttpConfigurationBuilderImpl();
  }

  /**
   * Returns a factory for the default HTTP implementation of
   * {@link com.tunercloud.client.interfaces.Transmitter}.
   *
   * @return a factory object
   */
  public static TransmitterFactory defaultTransmitter() {
    return defaultTransmitterFactory;
  }

  /**
   * Returns a factory for the default credential check, which asks the cloud service whether the key is valid.
   *
   * @return a factory object
   */
  public static CredentialValidatorFactory defaultCredentialValidator() {
    return defaultCredentialValidatorFactory;
  }

  /**
   * Returns a factory for a credential check intended only for test harnesses. It accepts the key
   * {@code "test_key_true"} and rejects the key
   * {@code "test_key_false"} without any network access; every other key
   * is checked by the default implementation.
   * <p>
   * Do not use this in production configurations.
   *
   * @return a factory object
   */
  public static CredentialValidatorFactory testKeyCredentialValidator() {
    return httpConfig -> new TestKeyCredentialValidator(defaultCredentialValidatorFactory.createCredentialValidator(httpConfig));
  }

  private static final class DefaultTransmitterFactory implements TransmitterFactory {
    @Override
    public DefaultTransmitter createTransmitter(HttpConfiguration httpConfiguration) {
      return new DefaultTransmitter(httpConfiguration);
    }
  }

  private static final class DefaultCredentialValidatorFactory implements CredentialValidatorFactory {
    @Override
    public CredentialValidator createCredentialValidator(HttpConfiguration httpConfiguration) {
      return new DefaultCredentialValidator(httpConfiguration);
    }
  }

  private static final class HttpConfigurationBuilderImpl extends HttpConfigurationBuilder {
    @Override
    public HttpConfiguration createHttpConfiguration() {
      return new HttpConfigurationImpl(
          connectTimeoutMillis,
          proxyHost == null ? null : new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxyHost, proxyPort)),
          socketTimeoutMillis,
          sslSocketFactory,
          trustManager
      );
    }
  }
}
