package com.tunercloud.client;

/**
 * The kind of information carried by a payload. Sent as the {@code type} field of the request body.
 */
public enum InfoType {
  /**
   * Periodic progress of a running tuning session. Subject to debouncing.
   */
  STATUS("status"),

  /**
   * The results of a completed trial. Never debounced.
   */
  RESULTS("results");

  private final String wireName;

  private InfoType(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the value used for the {@code type} field on the wire.
   * @return the wire name
   */
  public String getWireName() {
    return wireName;
  }
}
