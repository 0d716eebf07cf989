package com.tunercloud.client.interfaces;

import com.tunercloud.client.integrations.HttpConfigurationBuilder;

import java.net.Proxy;

import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.X509TrustManager;

/**
 * Encapsulates top-level HTTP configuration that applies to all of the client's network connections.
 * <p>
 * Use {@link HttpConfigurationBuilder} to construct an instance.
 */
public interface HttpConfiguration {
  /**
   * The connection timeout. This is the time allowed for the underlying HTTP client to connect
   * to the cloud service.
   *
   * @return the connection timeout, in milliseconds
   */
  int getConnectTimeoutMillis();

  /**
   * The proxy configuration, if any.
   *
   * @return a {@link Proxy} instance or null
   */
  Proxy getProxy();

  /**
   * The socket timeout. This is the amount of time without receiving data on a connection that the
   * client will tolerate before signaling an error. Since sends are never cancelled, it also bounds
   * how long a hung request can occupy a background worker.
   *
   * @return the socket timeout, in milliseconds
   */
  int getSocketTimeoutMillis();

  /**
   * The configured socket factory for secure connections.
   *
   * @return a SSLSocketFactory or null
   */
  SSLSocketFactory getSslSocketFactory();

  /**
   * The configured trust manager for secure connections, if custom certificate verification is needed.
   *
   * @return an X509TrustManager or null
   */
  X509TrustManager getTrustManager();
}
