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
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import okhttp3.Headers;
import okhttp3.internal.http2.Header;
import okio.ByteString;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * Reads responses saved by {@code wget -p --save-headers <url>}. Each file holds an HTTP status
 * line, {@code Name: Value} header lines, a blank line, and then the raw body. Both Unix and DOS
 * line endings are accepted.
 *
 * <p>Two headers are interpreted by the parser:
 *
 * <ul>
 *   <li>{@code X-Original-Url} replaces the host and path that would otherwise be derived from the
 *       file's location.
 *   <li>{@code X-Push-Url} names another resource to load along with this one. It may be repeated,
 *       and one value may list several URLs separated by whitespace.
 * </ul>
 *
 * <p>Header lines that can't be parsed are logged and skipped. Only a missing status line, an
 * unparseable status line, or a missing blank line make a file malformed.
 *
 * <p>Without an {@code X-Original-Url} header, the first segment of the file's path relative to
 * the capture directory is the host and the rest is the path. The file {@code
 * www.example.com/images/logo.png} is served for {@code https://www.example.com/images/logo.png}.
 */
public final class CaptureFileParser {
  private static final Logger logger = Logger.getLogger(CaptureFileParser.class.getName());

  static final String ORIGINAL_URL = "x-original-url";
  static final String PUSH_URL = "x-push-url";

  private static final ByteString NEWLINE = ByteString.encodeUtf8("\n");

  private CaptureFileParser() {
  }

  /**
   * Parses the captured response {@code contents}.
   *
   * @param fileName the file's path relative to the capture directory, using either separator.
   */
  public static CaptureFile parse(String fileName, ByteString contents)
      throws MalformedCaptureException {
    Headers.Builder headers = new Headers.Builder();
    int bodyOffset = -1;
    for (int start = 0; start < contents.size(); ) {
      int newline = contents.indexOf(NEWLINE, start);
      if (newline == -1) {
        throw new MalformedCaptureException("Headers invalid or empty: " + fileName);
      }
      int end = newline;
      if (end > start && contents.getByte(end - 1) == '\r') end--;
      String line = contents.substring(start, end).string(ISO_8859_1);
      start = newline + 1;

      // Headers end with an empty line.
      if (line.isEmpty()) {
        bodyOffset = start;
        break;
      }

      if (line.startsWith("HTTP")) {
        headers.set(Header.RESPONSE_STATUS.utf8(), parseStatusCode(fileName, line));
        continue;
      }

      int separator = line.indexOf(':');
      if (separator <= 0) {
        logger.warning("Skipping header line without a name in " + fileName + ": " + line);
        continue;
      }
      String name = line.substring(0, separator).toLowerCase(Locale.US);
      String value = line.substring(separator + 1).trim();
      try {
        // Captured values are Latin-1 and may contain bytes okhttp won't send; keep them as-is.
        headers.addUnsafeNonAscii(name, value);
      } catch (IllegalArgumentException e) {
        logger.warning("Skipping unexpected header in " + fileName + ": " + e.getMessage());
      }
    }

    if (bodyOffset == -1) {
      throw new MalformedCaptureException("No blank line after the headers of " + fileName);
    }
    if (headers.get(Header.RESPONSE_STATUS.utf8()) == null) {
      throw new MalformedCaptureException("No status line in " + fileName);
    }

    // The connection header is prohibited in HTTP/2.
    headers.removeAll("connection");
    Headers parsed = headers.build();

    String base;
    String originalUrl = parsed.get(ORIGINAL_URL);
    if (originalUrl != null) {
      base = removeScheme(originalUrl);
    } else {
      base = fileName.replace('\\', '/');
      if (base.startsWith("/")) base = base.substring(1);
      // wget writes the query of a saved URL after a comma; it isn't part of the path.
      int comma = base.indexOf(',');
      if (comma != -1) base = base.substring(0, comma);
    }

    return new CaptureFile(fileName, contents, bodyOffset, parsed, pushUrls(parsed),
        hostOf(base), pathOf(base));
  }

  /** Returns the three digit code following the first space of {@code statusLine}. */
  private static String parseStatusCode(String fileName, String statusLine)
      throws MalformedCaptureException {
    int space = statusLine.indexOf(' ');
    if (space == -1 || statusLine.length() < space + 4) {
      throw new MalformedCaptureException("Unexpected status line in " + fileName + ": "
          + statusLine);
    }
    String code = statusLine.substring(space + 1, space + 4);
    for (int i = 0; i < code.length(); i++) {
      char c = code.charAt(i);
      if (c < '0' || c > '9') {
        throw new MalformedCaptureException("Unexpected status line in " + fileName + ": "
            + statusLine);
      }
    }
    if (statusLine.length() > space + 4 && statusLine.charAt(space + 4) != ' ') {
      throw new MalformedCaptureException("Unexpected status line in " + fileName + ": "
          + statusLine);
    }
    return code;
  }

  private static List<String> pushUrls(Headers headers) {
    List<String> values = headers.values(PUSH_URL);
    if (values.isEmpty()) return Collections.emptyList();

    List<String> result = new ArrayList<>();
    for (String value : values) {
      for (String url : value.trim().split("\\s+")) {
        if (!url.isEmpty()) result.add(removeScheme(url));
      }
    }
    return Collections.unmodifiableList(result);
  }

  /** Returns {@code url} without a leading {@code http://} or {@code https://}. */
  public static String removeScheme(String url) {
    if (url.startsWith("https://")) return url.substring("https://".length());
    if (url.startsWith("http://")) return url.substring("http://".length());
    return url;
  }

  /** Returns everything before the first slash of {@code base}, like "www.example.com". */
  static String hostOf(String base) {
    int slash = base.indexOf('/');
    return slash != -1 ? base.substring(0, slash) : base;
  }

  /** Returns everything from the first slash of {@code base}, or "/" if it has no slash. */
  static String pathOf(String base) {
    int slash = base.indexOf('/');
    return slash != -1 ? base.substring(slash) : "/";
  }
}
