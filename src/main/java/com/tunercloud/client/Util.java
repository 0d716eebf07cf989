package com.tunercloud.client;

import com.tunercloud.client.interfaces.HttpConfiguration;

import java.net.URI;
import java.util.concurrent.TimeUnit;

import okhttp3.ConnectionPool;
import okhttp3.Headers;
import okhttp3.OkHttpClient;

class Util {
  static final String AUTH_HEADER = "X-AUTH";

  /**
   * Joins a base URL with one or more path segments, using exactly one separator between each pair.
   * <p>
   * {@code https://example.com/a/b/} joined with {@code update} gives {@code https://example.com/a/b/update};
   * removing the trailing slash from the base, or adding a leading slash to the segment, gives the same result.
   *
   * @param base the base URL
   * @param segments path segments to append
   * @return the joined URL
   */
  static String joinUrl(String base, String... segments) {
    StringBuilder sb = new StringBuilder(stripTrailingSlashes(base));
    for (String segment: segments) {
      sb.append('/').append(stripTrailingSlashes(stripLeadingSlashes(segment)));
    }
    return sb.toString();
  }

  static String joinUrl(URI base, String... segments) {
    return joinUrl(base.toString(), segments);
  }

  private static String stripLeadingSlashes(String s) {
    int start = 0;
    while (start < s.length() && s.charAt(start) == '/') {
      start++;
    }
    return s.substring(start);
  }

  private static String stripTrailingSlashes(String s) {
    int end = s.length();
    while (end > 0 && s.charAt(end - 1) == '/') {
      end--;
    }
    return s.substring(0, end);
  }

  static Headers.Builder getHeadersBuilderFor(String credential) {
    Headers.Builder builder = new Headers.Builder()
        .add("User-Agent", "TunerCloudJavaClient/" + ReportingClient.CLIENT_VERSION);
    if (credential != null) {
      builder.add(AUTH_HEADER, credential);
    }
    return builder;
  }

  static OkHttpClient makeHttpClient(HttpConfiguration config) {
    OkHttpClient.Builder builder = new OkHttpClient.Builder()
        .connectionPool(new ConnectionPool(5, 5, TimeUnit.SECONDS))
        .connectTimeout(config.getConnectTimeoutMillis(), TimeUnit.MILLISECONDS)
        .readTimeout(config.getSocketTimeoutMillis(), TimeUnit.MILLISECONDS)
        .writeTimeout(config.getSocketTimeoutMillis(), TimeUnit.MILLISECONDS)
        .retryOnConnectionFailure(false); // a failed send is reported, never retried

    if (config.getSslSocketFactory() != null) {
      builder.sslSocketFactory(config.getSslSocketFactory(), config.getTrustManager());
    }
    if (config.getProxy() != null) {
      builder.proxy(config.getProxy());
    }
    return builder.build();
  }

  static void shutdownHttpClient(OkHttpClient client) {
    if (client.dispatcher() != null) {
      client.dispatcher().cancelAll();
      if (client.dispatcher().executorService() != null) {
        client.dispatcher().executorService().shutdown();
      }
    }
    if (client.connectionPool() != null) {
      client.connectionPool().evictAll();
    }
  }

  /**
   * Builds a log message for an HTTP error status.
   * @param statusCode the HTTP status
   * @param context description of what we were trying to do
   * @return a message string
   */
  static String httpErrorMessage(int statusCode, String context) {
    StringBuilder sb = new StringBuilder();
    sb.append("Received HTTP error ").append(statusCode);
    switch (statusCode) {
    case 401:
    case 403:
      sb.append(" (invalid API key)");
    }
    sb.append(" for ").append(context);
    return sb.toString();
  }
}
