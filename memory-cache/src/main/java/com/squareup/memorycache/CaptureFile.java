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

import java.util.List;
import okhttp3.Headers;
import okio.ByteString;

/**
 * A captured response file after parsing. The body is a view into the file's bytes; call {@link
 * #toCachedResponse} to get a response that owns its own copy.
 */
public final class CaptureFile {
  private final String fileName;
  private final ByteString contents;
  private final int bodyOffset;
  private final Headers headers;
  private final List<String> pushUrls;
  private final String host;
  private final String path;

  CaptureFile(String fileName, ByteString contents, int bodyOffset, Headers headers,
      List<String> pushUrls, String host, String path) {
    this.fileName = fileName;
    this.contents = contents;
    this.bodyOffset = bodyOffset;
    this.headers = headers;
    this.pushUrls = pushUrls;
    this.host = host;
    this.path = path;
  }

  /** The file's path relative to the capture directory. */
  public String fileName() {
    return fileName;
  }

  public String host() {
    return host;
  }

  public String path() {
    return path;
  }

  public Headers headers() {
    return headers;
  }

  /** Returns a copy of the bytes following the blank line that ends the headers. */
  public ByteString body() {
    return contents.substring(bodyOffset);
  }

  public long bodySize() {
    return contents.size() - bodyOffset;
  }

  /** Returns the {@code x-push-url} targets with their schemes removed, like "host/path". */
  public List<String> pushUrls() {
    return pushUrls;
  }

  public CachedResponse toCachedResponse() {
    return new CachedResponse.Builder()
        .headers(headers)
        .body(body())
        .build();
  }

  @Override public String toString() {
    return fileName + " -> " + host + path;
  }
}
