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

import javax.annotation.Nullable;
import okhttp3.Headers;
import okhttp3.internal.http2.Header;

/** A backend's answer to a request to open a {@link SecondaryTransportSession}. */
public final class SecondaryTransportResponse {
  private final Headers headers;
  private final @Nullable SecondaryTransportSession session;

  private SecondaryTransportResponse(Headers headers, @Nullable SecondaryTransportSession session) {
    this.headers = headers;
    this.session = session;
  }

  /** Accepts {@code session} with a 200 response. */
  public static SecondaryTransportResponse accept(SecondaryTransportSession session) {
    if (session == null) throw new NullPointerException("session == null");
    return new SecondaryTransportResponse(statusHeaders(200), session);
  }

  public static SecondaryTransportResponse reject(int code) {
    if (code >= 200 && code < 300) {
      throw new IllegalArgumentException("rejections must not be successful: " + code);
    }
    return new SecondaryTransportResponse(statusHeaders(code), null);
  }

  private static Headers statusHeaders(int code) {
    return Headers.of(Header.RESPONSE_STATUS.utf8(), Integer.toString(code));
  }

  public Headers headers() {
    return headers;
  }

  public int code() {
    return Integer.parseInt(headers.get(Header.RESPONSE_STATUS.utf8()));
  }

  public boolean isAccepted() {
    return session != null;
  }

  /** Returns the accepted session, or null if the request was rejected. */
  public @Nullable SecondaryTransportSession session() {
    return session;
  }

  @Override public String toString() {
    return "SecondaryTransportResponse{code=" + code() + ", accepted=" + isAccepted() + '}';
  }
}
