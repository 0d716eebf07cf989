package com.tunercloud.client.integrations;

import com.tunercloud.client.Components;
import com.tunercloud.client.interfaces.HttpConfigurationFactory;

import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.X509TrustManager;

/**
 * Contains methods for configuring the client's networking behavior.
 * <p>
 * If you want to set non-default values for any of these properties, create a builder with
 * {@link Components#httpConfiguration()}, change its properties with the methods of this class,
 * and pass it to {@link com.tunercloud.client.ReportingConfig.Builder#http(HttpConfigurationFactory)}:
 * <pre><code>
 *     ReportingConfig config = new ReportingConfig.Builder()
 *         .http(
 *           Components.httpConfiguration()
 *             .connectTimeoutMillis(3000)
 *             .proxyHostAndPort("my-proxy", 8080)
 *          )
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#httpConfiguration()}.
 */
public abstract class HttpConfigurationBuilder implements HttpConfigurationFactory {
  /**
   * The default value for {@link #connectTimeoutMillis(int)}.
   */
  public static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 2000;

  /**
   * The default value for {@link #socketTimeoutMillis(int)}.
   */
  public static final int DEFAULT_SOCKET_TIMEOUT_MILLIS = 10000;

  protected int connectTimeoutMillis = DEFAULT_CONNECT_TIMEOUT_MILLIS;
  protected String proxyHost;
  protected int proxyPort;
  protected int socketTimeoutMillis = DEFAULT_SOCKET_TIMEOUT_MILLIS;
  protected SSLSocketFactory sslSocketFactory;
  protected X509TrustManager trustManager;

  /**
   * Sets the connection timeout. This is the time allowed for the client to make a socket connection to
   * the cloud service.
   * <p>
   * The default is {@link #DEFAULT_CONNECT_TIMEOUT_MILLIS}.
   *
   * @param connectTimeoutMillis the connection timeout, in milliseconds
   * @return the builder
   */
  public HttpConfigurationBuilder connectTimeoutMillis(int connectTimeoutMillis) {
    this.connectTimeoutMillis = connectTimeoutMillis;
    return this;
  }

  /**
   * Sets an HTTP proxy for making connections to the cloud service.
   *
   * @param host the proxy hostname
   * @param port the proxy port
   * @return the builder
   */
  public HttpConfigurationBuilder proxyHostAndPort(String host, int port) {
    this.proxyHost = host;
    this.proxyPort = port;
    return this;
  }

  /**
   * Sets the socket timeout. This is the amount of time without receiving data on a connection that the
   * client will tolerate before signaling an error.
   * <p>
   * The default is {@link #DEFAULT_SOCKET_TIMEOUT_MILLIS}.
   *
   * @param socketTimeoutMillis the socket timeout, in milliseconds
   * @return the builder
   */
  public HttpConfigurationBuilder socketTimeoutMillis(int socketTimeoutMillis) {
    this.socketTimeoutMillis = socketTimeoutMillis;
    return this;
  }

  /**
   * Specifies a custom security configuration for HTTPS connections, for instance to trust a
   * self-signed certificate on a private deployment of the service.
   *
   * @param sslSocketFactory the SSL socket factory
   * @param trustManager the trust manager
   * @return the builder
   */
  public HttpConfigurationBuilder sslSocketFactory(SSLSocketFactory sslSocketFactory, X509TrustManager trustManager) {
    this.sslSocketFactory = sslSocketFactory;
    this.trustManager = trustManager;
    return this;
  }
}
