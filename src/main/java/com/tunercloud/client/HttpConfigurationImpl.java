package com.tunercloud.client;

import com.tunercloud.client.interfaces.HttpConfiguration;

import java.net.Proxy;

import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.X509TrustManager;

final class HttpConfigurationImpl implements HttpConfiguration {
  final int connectTimeoutMillis;
  final Proxy proxy;
  final int socketTimeoutMillis;
  final SSLSocketFactory sslSocketFactory;
  final X509TrustManager trustManager;

  HttpConfigurationImpl(int connectTimeoutMillis, Proxy proxy, int socketTimeoutMillis,
      SSLSocketFactory sslSocketFactory, X509TrustManager trustManager) {
    this.connectTimeoutMillis = connectTimeoutMillis;
    this.proxy = proxy;
    this.socketTimeoutMillis = socketTimeoutMillis;
    this.sslSocketFactory = sslSocketFactory;
    this.trustManager = trustManager;
  }

  @Override
  public int getConnectTimeoutMillis() {
    return connectTimeoutMillis;
  }

  @Override
  public Proxy getProxy() {
    return proxy;
  }

  @Override
  public int getSocketTimeoutMillis() {
    return socketTimeoutMillis;
  }

  @Override
  public SSLSocketFactory getSslSocketFactory() {
    return sslSocketFactory;
  }

  @Override
  public X509TrustManager getTrustManager() {
    return trustManager;
  }
}
