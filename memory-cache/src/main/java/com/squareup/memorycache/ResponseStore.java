/*
 * Copyright (C) 2026 Square, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.squareup.memorycache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Responses keyed by host and path. Server threads look responses up while test threads add and
 * change them, so all state is guarded by this store's monitor. No method does more than a
 * constant number of map operations while holding it; logging happens after it is released.
 */
public final class ResponseStore {
  private static final Logger logger = Logger.getLogger(ResponseStore.class.getName());

  /** Neither hosts nor paths may contain a line feed. */
  private static final char KEY_SEPARATOR = '\n';

  private final Map<String, CachedResponse> responses = new LinkedHashMap<>();
  private @Nullable CachedResponse defaultResponse;
  private @Nullable CachedResponse generateBytesResponse;

  /**
   * Returns the response for {@code host} and {@code path}. On a miss this returns the default
   * response if one is set. Otherwise if dynamic responses are enabled and {@code path} is a
   * number, this returns a new {@link SpecialResponseType#GENERATE_BYTES} response of that many
   * bytes; that response is not retained. Returns null if none of these apply.
   */
  public @Nullable CachedResponse lookup(String host, String path) {
    String key = key(host, path);
    CachedResponse response;
    CachedResponse fallback;
    CachedResponse generator;
    synchronized (this) {
      response = responses.get(key);
      fallback = defaultResponse;
      generator = generateBytesResponse;
    }
    if (response != null) return response;

    logger.fine("Get response for resource failed: host " + host + " path " + path);
    if (fallback != null) return fallback;

    if (generator != null) {
      long length = parseGeneratedLength(path);
      if (length != -1) {
        return generator.newBuilder()
            .header("content-length", Long.toString(length))
            .build();
      }
    }
    return null;
  }

  /** Returns true if a response was stored for exactly {@code host} and {@code path}. */
  public synchronized boolean contains(String host, String path) {
    return responses.containsKey(key(host, path));
  }

  /** Stores {@code response}, replacing any response already stored for the same key. */
  public void put(String host, String path, CachedResponse response) {
    if (response == null) throw new NullPointerException("response == null");
    String key = key(host, path);
    CachedResponse replaced;
    synchronized (this) {
      replaced = responses.put(key, response);
    }
    if (replaced != null) {
      logger.warning("Response for '" + host + path + "' already exists! Replacing it.");
    }
  }

  /**
   * Holds back delivery of the response for {@code host} and {@code path} by {@code delay}.
   * Returns false if no such response is stored.
   */
  public synchronized boolean setDelay(String host, String path, long delay, TimeUnit unit) {
    String key = key(host, path);
    CachedResponse response = responses.get(key);
    if (response == null) return false;
    responses.put(key, response.withDelay(delay, unit));
    return true;
  }

  /** Sets the response returned on cache misses, or null to return nothing. */
  public synchronized void setDefault(@Nullable CachedResponse response) {
    this.defaultResponse = response;
  }

  /**
   * Once called, misses for numeric paths like {@code /1024} return a generated response of that
   * many bytes. This cannot be undone.
   */
  public synchronized void enableDynamicMode() {
    if (generateBytesResponse != null) return;
    generateBytesResponse = new CachedResponse.Builder()
        .code(200)
        .responseType(SpecialResponseType.GENERATE_BYTES)
        .build();
  }

  public synchronized boolean isDynamicModeEnabled() {
    return generateBytesResponse != null;
  }

  /** Returns the number of stored responses. Defaults and generated responses aren't counted. */
  public synchronized int size() {
    return responses.size();
  }

  /**
   * Returns the number of bytes requested by a path like {@code /1024}, or -1 if {@code path}
   * isn't a non-negative decimal number.
   */
  static long parseGeneratedLength(String path) {
    String digits = path.startsWith("/") ? path.substring(1) : path;
    if (digits.isEmpty() || digits.length() > 18) return -1;
    for (int i = 0; i < digits.length(); i++) {
      char c = digits.charAt(i);
      if (c < '0' || c > '9') return -1;
    }
    return Long.parseLong(digits);
  }

  /** Returns the map key for {@code host} and {@code path}. Any port on the host is ignored. */
  static String key(String host, String path) {
    if (host == null) throw new NullPointerException("host == null");
    if (path == null) throw new NullPointerException("path == null");
    int colon;
    if (host.startsWith("[")) {
      // IPv6 literal: only a colon after the closing bracket starts a port.
      int bracket = host.indexOf(']');
      colon = bracket != -1 ? host.indexOf(':', bracket) : -1;
    } else {
      colon = host.indexOf(':');
    }
    String hostName = colon != -1 ? host.substring(0, colon) : host;
    return hostName + KEY_SEPARATOR + path;
  }
}
