package com.tunercloud.client;

import com.tunercloud.client.interfaces.CredentialValidator;
import com.tunercloud.client.interfaces.HttpConfiguration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;

import static com.tunercloud.client.Util.getHeadersBuilderFor;
import static com.tunercloud.client.Util.httpErrorMessage;
import static com.tunercloud.client.Util.joinUrl;
import static com.tunercloud.client.Util.makeHttpClient;
import static com.tunercloud.client.Util.shutdownHttpClient;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

final class DefaultCredentialValidator implements CredentialValidator {
  private static final Logger logger = LoggerFactory.getLogger(DefaultCredentialValidator.class);
  static final String CHECK_ACCESS_PATH = "v1/check-access";

  private final OkHttpClient httpClient;

  DefaultCredentialValidator(HttpConfiguration httpConfiguration) {
    this.httpClient = makeHttpClient(httpConfiguration);
  }

  @Override
  public boolean check(URI baseUri, String credential) {
    String url = joinUrl(baseUri, CHECK_ACCESS_PATH);
    Request request = new Request.Builder()
        .url(url)
        .post(RequestBody.create(null, new byte[0]))
        .headers(getHeadersBuilderFor(credential).build())
        .build();

    logger.debug("Checking API key against {}", url);
    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        logger.debug(httpErrorMessage(response.code(), "checking API key"));
      }
      return response.isSuccessful();
    } catch (IOException e) {
      logger.warn("Unable to reach cloud service to check API key ({})", e.toString());
      return false;
    }
  }

  @Override
  public void close() throws IOException {
    shutdownHttpClient(httpClient);
  }
}
