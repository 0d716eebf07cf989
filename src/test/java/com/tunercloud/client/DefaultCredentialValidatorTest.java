package com.tunercloud.client;

import com.tunercloud.client.interfaces.CredentialValidator;

import org.junit.Test;

import java.net.URI;

import static com.tunercloud.client.TestHttpUtil.baseUri;
import static com.tunercloud.client.TestHttpUtil.jsonResponse;
import static com.tunercloud.client.TestHttpUtil.makeStartedServer;
import static com.tunercloud.client.TestHttpUtil.okResponse;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

@SuppressWarnings("javadoc")
public class DefaultCredentialValidatorTest {
  private static CredentialValidator makeValidator() {
    return new DefaultCredentialValidator(Components.httpConfiguration().createHttpConfiguration());
  }

  @Test
  public void acceptedKeyIsValid() throws Exception {
    try (MockWebServer server = makeStartedServer(okResponse())) {
      try (CredentialValidator v = makeValidator()) {
        assertTrue(v.check(baseUri(server), "good-key"));
      }
    }
  }

  @Test
  public void checkPostsKeyToAccessPath() throws Exception {
    try (MockWebServer server = makeStartedServer(okResponse())) {
      try (CredentialValidator v = makeValidator()) {
        v.check(baseUri(server), "good-key");
      }

      RecordedRequest req = server.takeRequest();
      assertEquals("POST", req.getMethod());
      assertEquals("/api/v1/check-access", req.getPath());
      assertThat(req.getHeader("X-AUTH"), equalTo("good-key"));
      assertEquals(0, req.getBodySize());
    }
  }

  @Test
  public void baseUriWithoutTrailingSlashIsAccepted() throws Exception {
    try (MockWebServer server = makeStartedServer(okResponse())) {
      URI uriWithoutSlash = URI.create(server.url("/api").toString());
      try (CredentialValidator v = makeValidator()) {
        assertTrue(v.check(uriWithoutSlash, "good-key"));
      }
      assertEquals("/api/v1/check-access", server.takeRequest().getPath());
    }
  }

  @Test
  public void rejectedKeyIsInvalid() throws Exception {
    try (MockWebServer server = makeStartedServer(jsonResponse(401, "{\"status\":\"Unauthorized\"}"))) {
      try (CredentialValidator v = makeValidator()) {
        assertFalse(v.check(baseUri(server), "bad-key"));
      }
    }
  }

  @Test
  public void unreachableServiceMeansInvalid() throws Exception {
    MockWebServer server = makeStartedServer();
    URI uri = baseUri(server);
    server.shutdown();

    try (CredentialValidator v = makeValidator()) {
      assertFalse(v.check(uri, "good-key"));
    }
  }
}
