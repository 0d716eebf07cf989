package com.tunercloud.client;

import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.tunercloud.client.interfaces.Transmitter;

import org.junit.Test;

import static com.tunercloud.client.TestHttpUtil.jsonResponse;
import static com.tunercloud.client.TestHttpUtil.makeStartedServer;
import static com.tunercloud.client.TestHttpUtil.okResponse;
import static com.tunercloud.client.TestHttpUtil.requestBodyAsJson;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

@SuppressWarnings("javadoc")
public class DefaultTransmitterTest {
  private static final String API_KEY = "API_KEY";

  private static Transmitter makeTransmitter() {
    return new DefaultTransmitter(Components.httpConfiguration().createHttpConfiguration());
  }

  private static JsonObject resultsPayload() {
    JsonObject modelConfig = new JsonObject();
    modelConfig.addProperty("layers", 3);
    JsonObject payload = new JsonObject();
    payload.add("model_config", modelConfig);
    payload.addProperty("score", 0.9);
    return payload;
  }

  private static Outcome sendTo(MockWebServer server) throws Exception {
    try (Transmitter t = makeTransmitter()) {
      return t.send(server.url("/v1/update").toString(), API_KEY, InfoType.RESULTS, resultsPayload());
    }
  }

  @Test
  public void successfulResponseIsOk() throws Exception {
    try (MockWebServer server = makeStartedServer(okResponse())) {
      assertEquals(Outcome.OK, sendTo(server));
    }
  }

  @Test
  public void requestCarriesKeyTypeAndSanitizedData() throws Exception {
    try (MockWebServer server = makeStartedServer(okResponse())) {
      sendTo(server);

      RecordedRequest req = server.takeRequest();
      assertEquals("POST", req.getMethod());
      assertEquals("/v1/update", req.getPath());
      assertThat(req.getHeader("X-AUTH"), equalTo(API_KEY));
      assertThat(req.getHeader("User-Agent"), startsWith("TunerCloudJavaClient/"));
      assertEquals("application/json; charset=utf-8", req.getHeader("content-type"));

      JsonObject body = requestBodyAsJson(req);
      assertEquals("results", body.get("type").getAsString());
      JsonObject data = body.getAsJsonObject("data");
      assertFalse(data.has("model_config"));
      assertEquals(0.9, data.get("score").getAsDouble(), 0);
    }
  }

  @Test
  public void nullValuesAreSentAsJsonNull() throws Exception {
    JsonObject payload = new JsonObject();
    payload.add("best_trial", JsonNull.INSTANCE);
    payload.addProperty("score", 0.9);
    try (MockWebServer server = makeStartedServer(okResponse())) {
      try (Transmitter t = makeTransmitter()) {
        t.send(server.url("/v1/update").toString(), API_KEY, InfoType.RESULTS, payload);
      }

      JsonObject data = requestBodyAsJson(server.takeRequest()).getAsJsonObject("data");
      assertTrue(data.has("best_trial"));
      assertTrue(data.get("best_trial").isJsonNull());
    }
  }

  @Test
  public void payloadObjectIsNotModified() throws Exception {
    JsonObject payload = resultsPayload();
    try (MockWebServer server = makeStartedServer(okResponse())) {
      try (Transmitter t = makeTransmitter()) {
        t.send(server.url("/v1/update").toString(), API_KEY, InfoType.STATUS, payload);
      }
    }
    assertTrue(payload.has("model_config"));
  }

  @Test
  public void unauthorizedStatusIsAuthError() throws Exception {
    try (MockWebServer server = makeStartedServer(jsonResponse(401, "{\"status\":\"Unauthorized\"}"))) {
      assertEquals(Outcome.AUTH_ERROR, sendTo(server));
    }
  }

  @Test
  public void otherJsonFailureIsUploadError() throws Exception {
    try (MockWebServer server = makeStartedServer(jsonResponse(400, "{\"status\":\"Invalid payload\"}"))) {
      assertEquals(Outcome.UPLOAD_ERROR, sendTo(server));
    }
  }

  @Test
  public void jsonFailureWithoutStatusIsUploadError() throws Exception {
    try (MockWebServer server = makeStartedServer(jsonResponse(500, "{\"error\":\"quota exceeded\"}"))) {
      assertEquals(Outcome.UPLOAD_ERROR, sendTo(server));
    }
  }

  @Test
  public void htmlFailureIsConnectError() throws Exception {
    MockResponse resp = new MockResponse().setResponseCode(502)
        .setHeader("Content-Type", "text/html")
        .setBody("<html><body>Bad Gateway</body></html>");
    try (MockWebServer server = makeStartedServer(resp)) {
      assertEquals(Outcome.CONNECT_ERROR, sendTo(server));
    }
  }

  @Test
  public void emptyFailureBodyIsConnectError() throws Exception {
    try (MockWebServer server = makeStartedServer(new MockResponse().setResponseCode(503))) {
      assertEquals(Outcome.CONNECT_ERROR, sendTo(server));
    }
  }

  @Test
  public void unreachableServiceIsConnectError() throws Exception {
    MockWebServer server = makeStartedServer();
    String url = server.url("/v1/update").toString();
    server.shutdown();

    try (Transmitter t = makeTransmitter()) {
      assertEquals(Outcome.CONNECT_ERROR, t.send(url, API_KEY, InfoType.STATUS, resultsPayload()));
    }
  }

  @Test
  public void classifyFailureRecognizesUnauthorized() {
    assertEquals(Outcome.AUTH_ERROR, DefaultTransmitter.classifyFailure("{\"status\":\"Unauthorized\"}"));
    assertEquals(Outcome.UPLOAD_ERROR, DefaultTransmitter.classifyFailure("{\"status\":\"unauthorized\"}"));
    assertEquals(Outcome.CONNECT_ERROR, DefaultTransmitter.classifyFailure("[\"Unauthorized\"]"));
    assertEquals(Outcome.CONNECT_ERROR, DefaultTransmitter.classifyFailure("{not json"));
  }
}
