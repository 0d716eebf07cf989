package com.tunercloud.client.interfaces;

/**
 * Interface for a factory that creates some implementation of {@link CredentialValidator}.
 *
 * @see com.tunercloud.client.ReportingConfig.Builder#credentialValidator(CredentialValidatorFactory)
 */
public interface CredentialValidatorFactory {
  /**
   * Called by the client to create the implementation object.
   *
   * @param httpConfiguration HTTP configuration properties
   * @return a {@link CredentialValidator}
   */
  CredentialValidator createCredentialValidator(HttpConfiguration httpConfiguration);
}
