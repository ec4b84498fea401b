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
 * Decides what a server sends in response to each request. The server owns connections and
 * streams; the backend is told about each request and writes its answer to the request's
 * {@link ResponseStream}, either before {@link #fetch} returns or later from another thread.
 */
public interface ServerBackend {
  /**
   * Prepares this backend to serve the contents of {@code directory}. Returns false if it
   * couldn't be loaded.
   */
  boolean initialize(String directory);

  boolean isInitialized();

  /**
   * Answers a request. {@code requestHeaders} uses HTTP/2 pseudo-headers such as {@code
   * :authority} and {@code :path}. This never throws; requests that can't be served get an error
   * response.
   */
  void fetch(Headers requestHeaders, ByteString requestBody, ResponseStream stream);

  /**
   * Called when {@code stream} is closed by either peer. Nothing will be written to it after this
   * returns.
   */
  void closeResponseStream(ResponseStream stream);

  boolean supportsSecondaryTransport();

  /**
   * Decides whether to accept a secondary transport session. Servers only call this if {@link
   * #supportsSecondaryTransport} returns true.
   */
  SecondaryTransportResponse processSecondaryTransportRequest(Headers requestHeaders,
      SecondaryTransportSession session);
}
