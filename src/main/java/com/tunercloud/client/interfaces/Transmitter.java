package com.tunercloud.client.interfaces;

import com.google.gson.JsonObject;
import com.tunercloud.client.InfoType;
import com.tunercloud.client.Outcome;

import java.io.Closeable;

/**
 * Interface for a component that performs one blocking delivery of a payload to the cloud service.
 * <p>
 * The client calls {@link #send(String, String, InfoType, JsonObject)} from its background workers,
 * or from the caller's thread for a blocking send, so implementations must be thread-safe.
 */
public interface Transmitter extends Closeable {
  /**
   * Attempts to deliver a payload once. Implementations must remove the unbounded-size fields from
   * the payload before sending it, must not modify the payload object, and must never throw: every
   * failure is reported as one of the error values of {@link Outcome}.
   *
   * @param url the full update URL
   * @param credential the API key to authenticate with
   * @param type the kind of information being sent
   * @param payload the payload
   * @return the classified outcome; never {@link Outcome#DISABLED}
   */
  Outcome send(String url, String credential, InfoType type, JsonObject payload);
}
