package com.tunercloud.client;

import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonObject;

/**
 * Removes the parts of a payload that are unbounded in size before it is sent.
 */
final class PayloadSanitizer {
  /**
   * Top-level keys that are never transmitted: full model configurations and full epoch histories
   * can grow without limit.
   */
  static final ImmutableSet<String> EXCLUDED_FIELDS = ImmutableSet.of("model_config", "epoch_history");

  private PayloadSanitizer() {}

  /**
   * Returns a deep copy of the payload without any of the {@link #EXCLUDED_FIELDS}. The input is
   * not modified.
   *
   * @param payload the payload to clean; may be null
   * @return a new object
   */
  static JsonObject sanitize(JsonObject payload) {
    if (payload == null) {
      return new JsonObject();
    }
    JsonObject copy = payload.deepCopy();
    for (String key: EXCLUDED_FIELDS) {
      copy.remove(key);
    }
    return copy;
  }
}
