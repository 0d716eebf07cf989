package com.tunercloud.client;

import com.google.gson.JsonObject;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * This interface defines the public methods of {@link ReportingClient}.
 * <p>
 * Applications will normally interact directly with {@link ReportingClient}, and must use its
 * constructor to initialize the client. The interface allows the client to be replaced by a
 * mock in the host process's tests.
 */
public interface ReportingClientInterface extends Closeable {
  /**
   * Checks an API key with the cloud service and enables reporting if it is accepted. Blocks until
   * the check completes. The result is visible through {@link #isEnabled()} and {@link #getStatus()};
   * this method does not throw for a rejected key or an unreachable service.
   *
   * @param credential the API key
   */
  void enable(String credential);

  /**
   * Same as {@link #enable(String)}, but first replaces the base URI of the cloud service.
   *
   * @param credential the API key
   * @param baseUri the base URI to use from now on; null keeps the current one
   */
  void enable(String credential, URI baseUri);

  /**
   * Sends the progress of a running session in the background. Calls that arrive within the debounce
   * interval of the previous accepted call are dropped.
   *
   * @param status the status payload
   * @return true if a send was dispatched
   */
  boolean sendStatus(JsonObject status);

  /**
   * Same as {@link #sendStatus(JsonObject)}, for a payload held in a map.
   *
   * @param status the status payload
   * @return true if a send was dispatched
   */
  boolean sendStatus(Map<String, ?> status);

  /**
   * Sends the results of a trial in the background. Every call is dispatched while the client is enabled.
   *
   * @param results the results payload
   * @return true if a send was dispatched; false if the client is disabled
   */
  boolean sendResults(JsonObject results);

  /**
   * Same as {@link #sendResults(JsonObject)}, for a payload held in a map.
   *
   * @param results the results payload
   * @return true if a send was dispatched; false if the client is disabled
   */
  boolean sendResults(Map<String, ?> results);

  /**
   * Sends a payload on the calling thread and records the outcome as the client's status.
   *
   * @param type the kind of information
   * @param payload the payload
   * @return the outcome, or {@link Outcome#DISABLED} if the client is not enabled
   */
  Outcome sendBlocking(InfoType type, JsonObject payload);

  /**
   * Waits until every background send dispatched so far has finished. The client stays usable.
   */
  void complete();

  /**
   * Returns whether a valid API key has been provided.
   *
   * @return true if reporting is enabled
   */
  boolean isEnabled();

  /**
   * Returns the last known outcome. Background sends do not update this value, so it can be stale.
   *
   * @return the status
   */
  Outcome getStatus();

  /**
   * Returns the time of the last accepted status send.
   *
   * @return milliseconds since the epoch, or -1 if no status has been sent
   */
  long getLastUpdate();

  /**
   * Returns the base URI of the cloud service currently in use.
   *
   * @return the base URI
   */
  URI getBaseUri();

  /**
   * Returns a human-readable description of the client's state.
   *
   * @param extended true to include configuration details
   * @return a multi-line description
   */
  String summary(boolean extended);

  /**
   * Returns a snapshot of the client's state suitable for recording with the rest of a session's
   * configuration. The API key is never included.
   *
   * @return an immutable map with the keys {@code enabled}, {@code status} and {@code last_update}
   */
  Map<String, Object> getConfig();

  /**
   * Waits for outstanding background sends, then releases all resources. Sends made after this
   * call are dropped.
   *
   * @throws IOException if a component could not be closed cleanly
   */
  @Override
  void close() throws IOException;
}
