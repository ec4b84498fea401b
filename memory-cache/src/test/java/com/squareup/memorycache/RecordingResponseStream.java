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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import okhttp3.Headers;
import okio.Buffer;
import okio.ByteString;

/** Records the frames a backend writes to a stream. */
final class RecordingResponseStream implements ResponseStream {
  private final CountDownLatch finished = new CountDownLatch(1);
  private final List<String> events = new ArrayList<>();
  private final List<Headers> earlyHints = new ArrayList<>();
  private final Buffer body = new Buffer();
  private Headers headers;
  private Headers trailers;
  private String closeReason;
  private int bodyFrames;
  private long firstFrameNanos = -1;

  @Override public synchronized void sendEarlyHints(Headers hints) {
    frame("earlyHints");
    earlyHints.add(hints);
  }

  @Override public synchronized void sendHeaders(Headers headers, boolean endOfStream) {
    if (this.headers != null) throw new AssertionError("headers already sent");
    frame("headers");
    this.headers = headers;
    if (endOfStream) end();
  }

  @Override public synchronized void sendBody(ByteString data, boolean endOfStream) {
    if (headers == null) throw new AssertionError("body before headers");
    frame("body");
    body.write(data);
    bodyFrames++;
    if (endOfStream) end();
  }

  @Override public synchronized void sendTrailers(Headers trailers) {
    frame("trailers");
    this.trailers = trailers;
    end();
  }

  @Override public synchronized void closeConnection(String reason) {
    frame("closeConnection");
    this.closeReason = reason;
    finished.countDown();
  }

  private void frame(String name) {
    if (firstFrameNanos == -1) firstFrameNanos = System.nanoTime();
    if (events.contains("end")) throw new AssertionError(name + " after end of stream");
    events.add(name);
  }

  private void end() {
    events.add("end");
    finished.countDown();
  }

  /** Returns true once the stream ended or its connection was closed. */
  boolean await(long timeout, TimeUnit unit) throws InterruptedException {
    return finished.await(timeout, unit);
  }

  synchronized List<String> events() {
    return new ArrayList<>(events);
  }

  synchronized List<Headers> earlyHints() {
    return new ArrayList<>(earlyHints);
  }

  synchronized Headers headers() {
    return headers;
  }

  synchronized ByteString body() {
    return body.snapshot();
  }

  synchronized int bodyFrames() {
    return bodyFrames;
  }

  synchronized Headers trailers() {
    return trailers;
  }

  synchronized String closeReason() {
    return closeReason;
  }

  synchronized long firstFrameNanos() {
    return firstFrameNanos;
  }
}
