package com.tunercloud.client.interfaces;

import java.io.Closeable;
import java.net.URI;

/**
 * Interface for a component that checks whether an API key is accepted by the cloud service.
 */
public interface CredentialValidator extends Closeable {
  /**
   * Performs a blocking access check. Network failures count as a rejected credential; this method
   * does not throw.
   *
   * @param baseUri the base URI of the cloud service
   * @param credential the API key to check
   * @return true if the key is valid
   */
  boolean check(URI baseUri, String credential);
}
