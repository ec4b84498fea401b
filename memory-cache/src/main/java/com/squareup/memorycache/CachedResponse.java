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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import okhttp3.Headers;
import okhttp3.internal.Util;
import okhttp3.internal.http2.Header;
import okio.ByteString;

/**
 * A response held by the memory cache. Instances are immutable; use {@link #newBuilder} or {@link
 * #withDelay} to derive a modified copy.
 *
 * <p>Headers use HTTP/2 conventions: names are lowercase and the status code is carried by the
 * {@code :status} pseudo-header.
 */
public final class CachedResponse {
  final Headers headers;
  final ByteString body;
  final @Nullable Headers trailers;
  final List<Headers> earlyHints;
  final SpecialResponseType responseType;
  final long delayNanos;

  CachedResponse(Builder builder) {
    this.headers = builder.headers.build();
    this.body = builder.body;
    this.trailers = builder.trailers;
    this.earlyHints = Util.immutableList(builder.earlyHints);
    this.responseType = builder.responseType;
    this.delayNanos = builder.delayNanos;
  }

  public Headers headers() {
    return headers;
  }

  public @Nullable String header(String name) {
    return headers.get(name);
  }

  /** Returns the numeric {@code :status}, or -1 if it is absent or not a number. */
  public int code() {
    String status = headers.get(Header.RESPONSE_STATUS.utf8());
    if (status == null) return -1;
    try {
      return Integer.parseInt(status);
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  public ByteString body() {
    return body;
  }

  /** Returns the headers sent after the body, or null if this response has none. */
  public @Nullable Headers trailers() {
    return trailers;
  }

  /** Returns the 103 informational header sets sent before {@link #headers}, in order. */
  public List<Headers> earlyHints() {
    return earlyHints;
  }

  public SpecialResponseType responseType() {
    return responseType;
  }

  /** Returns how long delivery of this response is held back, or 0 to send it immediately. */
  public long delay(TimeUnit unit) {
    return unit.convert(delayNanos, TimeUnit.NANOSECONDS);
  }

  /** Returns a copy of this response that is delivered {@code delay} after it is looked up. */
  public CachedResponse withDelay(long delay, TimeUnit unit) {
    return newBuilder().delay(delay, unit).build();
  }

  public Builder newBuilder() {
    return new Builder(this);
  }

  @Override public String toString() {
    return "CachedResponse{status="
        + headers.get(Header.RESPONSE_STATUS.utf8())
        + ", type="
        + responseType
        + ", bodyLength="
        + body.size()
        + (delayNanos != 0 ? ", delayMs=" + delay(TimeUnit.MILLISECONDS) : "")
        + '}';
  }

  public static final class Builder {
    Headers.Builder headers;
    ByteString body = ByteString.EMPTY;
    @Nullable Headers trailers;
    List<Headers> earlyHints = new ArrayList<>();
    SpecialResponseType responseType = SpecialResponseType.REGULAR_RESPONSE;
    long delayNanos;

    public Builder() {
      this.headers = new Headers.Builder();
    }

    Builder(CachedResponse response) {
      this.headers = response.headers.newBuilder();
      this.body = response.body;
      this.trailers = response.trailers;
      this.earlyHints = new ArrayList<>(response.earlyHints);
      this.responseType = response.responseType;
      this.delayNanos = response.delayNanos;
    }

    /** Sets the {@code :status} pseudo-header to {@code code}. */
    public Builder code(int code) {
      if (code < 100 || code > 999) {
        throw new IllegalArgumentException("code out of range: " + code);
      }
      headers.set(Header.RESPONSE_STATUS.utf8(), Integer.toString(code));
      return this;
    }

    /** Replaces all headers with {@code headers}. */
    public Builder headers(Headers headers) {
      if (headers == null) throw new NullPointerException("headers == null");
      this.headers = headers.newBuilder();
      return this;
    }

    public Builder addHeader(String name, String value) {
      headers.add(name, value);
      return this;
    }

    /** Removes all headers named {@code name}, then adds a new header with the name and value. */
    public Builder header(String name, String value) {
      headers.set(name, value);
      return this;
    }

    public Builder body(ByteString body) {
      if (body == null) throw new NullPointerException("body == null");
      this.body = body;
      return this;
    }

    /** Sets the response body to the UTF-8 encoded bytes of {@code body}. */
    public Builder body(String body) {
      return body(ByteString.encodeUtf8(body));
    }

    public Builder trailers(@Nullable Headers trailers) {
      this.trailers = trailers;
      return this;
    }

    public Builder addEarlyHints(Headers earlyHints) {
      if (earlyHints == null) throw new NullPointerException("earlyHints == null");
      this.earlyHints.add(earlyHints);
      return this;
    }

    public Builder responseType(SpecialResponseType responseType) {
      if (responseType == null) throw new NullPointerException("responseType == null");
      this.responseType = responseType;
      return this;
    }

    public Builder delay(long delay, TimeUnit unit) {
      if (delay < 0) throw new IllegalArgumentException("delay < 0");
      if (unit == null) throw new NullPointerException("unit == null");
      this.delayNanos = unit.toNanos(delay);
      return this;
    }

    public CachedResponse build() {
      return new CachedResponse(this);
    }
  }
}
