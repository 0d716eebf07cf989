package com.tunercloud.client;

/**
 * The classified result of a send attempt or credential check.
 * <p>
 * A {@link ReportingClient} exposes the last known value through {@link ReportingClient#getStatus()}.
 * That value is advisory: sends that run in the background do not update it.
 */
public enum Outcome {
  /**
   * The service accepted the request.
   */
  OK("ok"),

  /**
   * The credential was missing, invalid, or rejected by the service.
   */
  AUTH_ERROR("authentication error"),

  /**
   * The service could not be reached, or answered with something that was not a JSON object.
   */
  CONNECT_ERROR("connection error"),

  /**
   * The service was reachable but rejected the request for a reason other than authentication.
   */
  UPLOAD_ERROR("upload error"),

  /**
   * No attempt was made because the client is not enabled.
   */
  DISABLED("disable");

  private final String description;

  private Outcome(String description) {
    this.description = description;
  }

  /**
   * Returns the human-readable form used in summaries and exported state.
   * @return the description
   */
  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return description;
  }
}
