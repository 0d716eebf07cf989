package com.tunercloud.client;

import com.tunercloud.client.interfaces.CredentialValidator;

import java.io.IOException;
import java.net.URI;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A credential check for test harnesses. Two reserved keys get a fixed answer without any network
 * access; every other key goes to the wrapped validator.
 *
 * @see Components#testKeyCredentialValidator()
 */
final class TestKeyCredentialValidator implements CredentialValidator {
  static final String ALWAYS_VALID_KEY = "test_key_true";
  static final String ALWAYS_INVALID_KEY = "test_key_false";

  private final CredentialValidator delegate;

  TestKeyCredentialValidator(CredentialValidator delegate) {
    this.delegate = checkNotNull(delegate, "delegate must not be null");
  }

  @Override
  public boolean check(URI baseUri, String credential) {
    if (ALWAYS_VALID_KEY.equals(credential)) {
      return true;
    }
    if (ALWAYS_INVALID_KEY.equals(credential)) {
      return false;
    }
    return delegate.check(baseUri, credential);
  }

  @Override
  public void close() throws IOException {
    delegate.close();
  }
}
