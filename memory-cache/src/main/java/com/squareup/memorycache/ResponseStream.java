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

import okhttp3.Headers;
import okio.ByteString;

/**
 * The server's side of one request stream. A backend writes a response to it in order: any early
 * hints, then headers, then body frames, then optional trailers. The stream ends with the first
 * frame sent with {@code endOfStream} set, or with the trailers.
 *
 * <p>Backends may call these methods from any thread, but never concurrently for the same stream.
 */
public interface ResponseStream {
  /** Sends a 103 informational response carrying {@code hints}. */
  void sendEarlyHints(Headers hints);

  void sendHeaders(Headers headers, boolean endOfStream);

  void sendBody(ByteString data, boolean endOfStream);

  /** Sends {@code trailers} and ends the stream. */
  void sendTrailers(Headers trailers);

  /** Closes the whole connection carrying this stream without completing the response. */
  void closeConnection(String reason);
}
