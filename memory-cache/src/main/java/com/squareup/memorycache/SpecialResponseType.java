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

/** How the backend should answer a request whose cached response carries this type. */
public enum SpecialResponseType {
  /** Send the cached early hints, headers, body and trailers. This is the default. */
  REGULAR_RESPONSE,

  /**
   * Close the connection without writing a response. Use this to simulate servers that drop
   * connections mid-exchange.
   */
  CLOSE_CONNECTION,

  /**
   * Don't respond to the request and keep the stream open. For testing read response header
   * timeouts.
   */
  IGNORE_REQUEST,

  /** Respond with a 500 regardless of what was cached. */
  BACKEND_ERROR,

  /** Send the cached headers and body but never end the stream. */
  INCOMPLETE_RESPONSE,

  /**
   * Respond with a 503 and a {@code retry-after} header. The cached {@code retry-after} value is
   * kept if present.
   */
  RETRY_LATER,

  /**
   * Send the cached headers followed by a freshly generated body whose length is the numeric
   * request path. Requests for {@code /4096} receive 4096 bytes.
   */
  GENERATE_BYTES
}
