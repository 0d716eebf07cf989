package com.tunercloud.client;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.tunercloud.client.interfaces.CredentialValidator;
import com.tunercloud.client.interfaces.Transmitter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.tunercloud.client.Util.joinUrl;

/**
 * Reports the status and results of a tuning session to the cloud service.
 * <p>
 * Reporting stays disabled until {@link #enable(String)} has validated an API key. Sends then run on
 * background workers: they never block the caller, and their failures are logged rather than thrown.
 * Client instances are thread-safe. Create one client per tuning session; {@link #complete()} lets the
 * same instance be reused for a following session.
 */
public final class ReportingClient implements ReportingClientInterface {
  private static final Logger logger = LoggerFactory.getLogger(ReportingClient.class);

  static final String CLIENT_VERSION = getClientVersion();
  static final String UPDATE_PATH = "v1/update";
  private static final long NEVER = -1;

  private final ReportingConfig config;
  private final Clock clock;
  private final Gson gson = new GsonBuilder().serializeNulls().create();
  final Transmitter transmitter;
  final CredentialValidator credentialValidator;
  final AsyncDispatcher dispatcher;

  private volatile boolean enabled = false;
  private volatile Outcome status = Outcome.DISABLED;
  private volatile URI baseUri;
  private volatile String credential;
  private final AtomicLong lastUpdate = new AtomicLong(NEVER);

  /**
   * Creates a new client with the default configuration. Reporting is disabled until
   * {@link #enable(String)} is called.
   */
  public ReportingClient() {
    this(ReportingConfig.DEFAULT);
  }

  /**
   * Creates a new client with a custom configuration.
   *
   * @param config a client configuration object
   */
  public ReportingClient(ReportingConfig config) {
    this.config = checkNotNull(config, "config must not be null");
    this.clock = config.clock;
    this.baseUri = config.baseUri;
    this.transmitter = config.transmitterFactory.createTransmitter(config.httpConfig);
    this.credentialValidator = config.credentialValidatorFactory.createCredentialValidator(config.httpConfig);
    this.dispatcher = new AsyncDispatcher(config.workerThreads);
  }

  @Override
  public void enable(String credential) {
    enable(credential, null);
  }

  @Override
  public void enable(String credential, URI baseUri) {
    this.credential = checkNotNull(credential, "credential must not be null");
    if (baseUri != null) {
      this.baseUri = baseUri;
    }
    if (checkAccess(credential)) {
      logger.info("Cloud service enabled - tuning results at {} can be tracked in realtime", this.baseUri);
      status = Outcome.OK;
      enabled = true;
    } else {
      logger.warn("Invalid cloud API key");
      status = Outcome.AUTH_ERROR;
      enabled = false;
    }
  }

  private boolean checkAccess(String credential) {
    try {
      return credentialValidator.check(baseUri, credential);
    } catch (RuntimeException e) {
      logger.error("Unexpected error while checking API key: {}", e.toString());
      logger.debug(e.toString(), e);
      return false;
    }
  }

  @Override
  public boolean sendStatus(JsonObject status) {
    return sendStatusCopy(status == null ? new JsonObject() : status.deepCopy());
  }

  @Override
  public boolean sendStatus(Map<String, ?> status) {
    if (!enabled) {
      return false;
    }
    return sendStatusCopy(toJson(status));
  }

  private boolean sendStatusCopy(JsonObject payload) {
    if (!enabled) {
      return false;
    }
    long now = clock.millis();
    long last = lastUpdate.get();
    if (last != NEVER && now - last <= config.debounceInterval.toMillis()) {
      return false;
    }
    // Only the caller that wins the swap dispatches; the timestamp moves before the send completes.
    if (!lastUpdate.compareAndSet(last, now)) {
      return false;
    }
    dispatch(InfoType.STATUS, payload);
    return true;
  }

  @Override
  public boolean sendResults(JsonObject results) {
    return sendResultsCopy(results == null ? new JsonObject() : results.deepCopy());
  }

  @Override
  public boolean sendResults(Map<String, ?> results) {
    if (!enabled) {
      return false;
    }
    return sendResultsCopy(toJson(results));
  }

  private boolean sendResultsCopy(JsonObject payload) {
    if (!enabled) {
      return false;
    }
    dispatch(InfoType.RESULTS, payload);
    return true;
  }

  private void dispatch(final InfoType type, final JsonObject payload) {
    final String url = joinUrl(baseUri, UPDATE_PATH);
    final String key = credential;
    dispatcher.submit(() -> {
      Outcome outcome = transmitter.send(url, key, type, payload);
      logger.debug("Background {} send finished: {}", type.getWireName(), outcome);
    });
  }

  @Override
  public Outcome sendBlocking(InfoType type, JsonObject payload) {
    if (!enabled) {
      return Outcome.DISABLED;
    }
    Outcome outcome = transmitter.send(joinUrl(baseUri, UPDATE_PATH), credential, type,
        payload == null ? new JsonObject() : payload);
    status = outcome;
    return outcome;
  }

  @Override
  public void complete() {
    dispatcher.drain();
  }

  @Override
  public boolean isEnabled() {
    return enabled;
  }

  @Override
  public Outcome getStatus() {
    return status;
  }

  @Override
  public long getLastUpdate() {
    return lastUpdate.get();
  }

  @Override
  public URI getBaseUri() {
    return baseUri;
  }

  /**
   * Same as {@code summary(false)}.
   *
   * @return a multi-line description
   */
  public String summary() {
    return summary(false);
  }

  @Override
  public String summary(boolean extended) {
    StringBuilder sb = new StringBuilder("Cloud service status\n");
    sb.append("  status: ").append(status.getDescription()).append('\n');
    sb.append("  last update: ").append(formatTime(lastUpdate.get())).append('\n');
    if (extended) {
      sb.append("  enabled: ").append(enabled).append('\n');
      sb.append("  base url: ").append(baseUri).append('\n');
      sb.append("  debounce interval: ").append(config.debounceInterval.toMillis()).append(" ms\n");
      sb.append("  worker threads: ").append(dispatcher.getWorkerThreads()).append('\n');
    }
    return sb.toString();
  }

  @Override
  public Map<String, Object> getConfig() {
    return ImmutableMap.<String, Object>of(
        "enabled", enabled,
        "status", status.getDescription(),
        "last_update", lastUpdate.get());
  }

  @Override
  public void close() throws IOException {
    logger.info("Closing cloud service client");
    dispatcher.close();
    try {
      transmitter.close();
    } finally {
      credentialValidator.close();
    }
  }

  @VisibleForTesting
  static String formatTime(long epochMillis) {
    if (epochMillis == NEVER) {
      return "never";
    }
    return DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochMilli(epochMillis).truncatedTo(ChronoUnit.SECONDS));
  }

  private JsonObject toJson(Map<String, ?> map) {
    if (map == null) {
      return new JsonObject();
    }
    return gson.toJsonTree(map).getAsJsonObject();
  }

  private static String getClientVersion() {
    String version = ReportingClient.class.getPackage().getImplementationVersion();
    return version == null ? "Unknown" : version;
  }
}
