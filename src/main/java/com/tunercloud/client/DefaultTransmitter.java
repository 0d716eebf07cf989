package com.tunercloud.client;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.tunercloud.client.interfaces.HttpConfiguration;
import com.tunercloud.client.interfaces.Transmitter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

import static com.tunercloud.client.Util.getHeadersBuilderFor;
import static com.tunercloud.client.Util.httpErrorMessage;
import static com.tunercloud.client.Util.makeHttpClient;
import static com.tunercloud.client.Util.shutdownHttpClient;

import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

final class DefaultTransmitter implements Transmitter {
  private static final Logger logger = LoggerFactory.getLogger(DefaultTransmitter.class);
  private static final MediaType JSON_CONTENT_TYPE = MediaType.parse("application/json; charset=utf-8");
  static final String UNAUTHORIZED_STATUS = "Unauthorized";

  private final Gson gson = new GsonBuilder().serializeNulls().create();
  private final OkHttpClient httpClient;

  DefaultTransmitter(HttpConfiguration httpConfiguration) {
    this.httpClient = makeHttpClient(httpConfiguration);
  }

  @Override
  public void close() throws IOException {
    shutdownHttpClient(httpClient);
  }

  @Override
  public Outcome send(String url, String credential, InfoType type, JsonObject payload) {
    JsonObject body = new JsonObject();
    body.addProperty("type", type.getWireName());
    body.add("data", PayloadSanitizer.sanitize(payload));
    String json = gson.toJson(body);

    Headers headers = getHeadersBuilderFor(credential).build();
    Request request = new Request.Builder()
        .url(url)
        .post(RequestBody.create(JSON_CONTENT_TYPE, json))
        .headers(headers)
        .build();

    logger.debug("Posting {} to {} with payload: {}", type.getWireName(), url, json);

    long startTime = System.currentTimeMillis();
    try (Response response = httpClient.newCall(request).execute()) {
      long endTime = System.currentTimeMillis();
      logger.debug("{} delivery took {} ms, response status {}", type.getWireName(), endTime - startTime, response.code());

      if (response.isSuccessful()) {
        return Outcome.OK;
      }
      ResponseBody responseBody = response.body();
      String text = responseBody == null ? "" : responseBody.string();
      logger.debug(httpErrorMessage(response.code(), "posting " + type.getWireName()));
      return classifyFailure(text);
    } catch (IOException e) {
      logger.warn("Cloud service unreachable -- data not uploaded ({})", e.toString());
      return Outcome.CONNECT_ERROR;
    }
  }

  /**
   * Decides why a non-2xx response failed, based on its body.
   */
  static Outcome classifyFailure(String text) {
    JsonElement parsed;
    try {
      parsed = JsonParser.parseString(text);
    } catch (JsonParseException e) {
      parsed = null;
    }
    if (parsed == null || !parsed.isJsonObject()) {
      logger.warn("Cloud service down -- data not uploaded: {}", text);
      return Outcome.CONNECT_ERROR;
    }

    JsonElement status = parsed.getAsJsonObject().get("status");
    if (status != null && status.isJsonPrimitive() && UNAUTHORIZED_STATUS.equals(status.getAsString())) {
      logger.warn("Invalid backend API key");
      return Outcome.AUTH_ERROR;
    }
    logger.warn("Cloud service upload failed: {}", text);
    return Outcome.UPLOAD_ERROR;
  }
}
