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

import java.io.Closeable;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import okhttp3.Headers;
import okhttp3.internal.NamedRunnable;
import okhttp3.internal.Util;
import okhttp3.internal.http2.Header;
import okhttp3.internal.io.FileSystem;
import okio.BufferedSource;
import okio.ByteString;
import okio.Okio;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * A server backend that answers requests from responses held in memory. Responses are loaded from
 * a directory written by {@code wget -p --save-headers <url>} (see {@link CaptureFileParser}), or
 * added directly by tests.
 *
 * <p>Responses can be configured to misbehave: to arrive late, to never arrive, to close the
 * connection, or to have a body generated on demand. See {@link SpecialResponseType}.
 */
public final class MemoryCacheBackend implements ServerBackend, Closeable {
  private static final Logger logger = Logger.getLogger(MemoryCacheBackend.class.getName());

  static final ByteString NOT_FOUND_BODY = ByteString.encodeUtf8("file not found");
  static final ByteString ERROR_BODY = ByteString.encodeUtf8("bad");

  private static final String STATUS = Header.RESPONSE_STATUS.utf8();
  private static final String AUTHORITY = Header.TARGET_AUTHORITY.utf8();
  private static final String PATH = Header.TARGET_PATH.utf8();

  private final ResponseStore store = new ResponseStore();
  private final FileSystem fileSystem;
  private final ScheduledThreadPoolExecutor scheduler;

  private final Map<ResponseStream, DelayedDelivery> pendingDeliveries = new ConcurrentHashMap<>();
  private final Set<ResponseStream> closedStreams = Collections.synchronizedSet(
      Collections.newSetFromMap(new WeakHashMap<ResponseStream, Boolean>()));

  private volatile boolean initialized;
  private volatile boolean secondaryTransportEnabled;
  private volatile int generatedChunkSize = 16 * 1024;

  public MemoryCacheBackend() {
    this(FileSystem.SYSTEM);
  }

  /** Creates a backend that reads captured responses using {@code fileSystem}. */
  public MemoryCacheBackend(FileSystem fileSystem) {
    if (fileSystem == null) throw new NullPointerException("fileSystem == null");
    this.fileSystem = fileSystem;
    this.scheduler = new ScheduledThreadPoolExecutor(1,
        Util.threadFactory("MemoryCacheBackend Delayed Delivery", true));
    this.scheduler.setRemoveOnCancelPolicy(true);
  }

  /** Returns the response for {@code host} and {@code path}, or null if there isn't one. */
  public @Nullable CachedResponse getResponse(String host, String path) {
    return store.lookup(host, path);
  }

  /** Returns the number of responses stored for specific hosts and paths. */
  public int responseCount() {
    return store.size();
  }

  /** Adds a response whose only headers are its status and content length. */
  public void addSimpleResponse(String host, String path, int code, String body) {
    ByteString bytes = ByteString.encodeUtf8(body);
    Headers headers = new Headers.Builder()
        .add(STATUS, Integer.toString(code))
        .add("content-length", Integer.toString(bytes.size()))
        .build();
    addResponse(host, path, headers, bytes);
  }

  public void addResponse(String host, String path, Headers headers, ByteString body) {
    addResponse(host, path, headers, body, null);
  }

  public void addResponse(String host, String path, Headers headers, ByteString body,
      @Nullable Headers trailers) {
    store.put(host, path, new CachedResponse.Builder()
        .headers(headers)
        .body(body)
        .trailers(trailers)
        .build());
  }

  /** Adds a response that is preceded by 103 responses carrying each of {@code earlyHints}. */
  public void addResponseWithEarlyHints(String host, String path, Headers headers,
      ByteString body, List<Headers> earlyHints) {
    CachedResponse.Builder builder = new CachedResponse.Builder()
        .headers(headers)
        .body(body);
    for (Headers hints : earlyHints) {
      builder.addEarlyHints(hints);
    }
    store.put(host, path, builder.build());
  }

  /** Simulates {@code responseType} for requests to {@code host} and {@code path}. */
  public void addSpecialResponse(String host, String path, SpecialResponseType responseType) {
    addSpecialResponse(host, path, Headers.of(), ByteString.EMPTY, responseType);
  }

  public void addSpecialResponse(String host, String path, Headers headers, ByteString body,
      SpecialResponseType responseType) {
    store.put(host, path, new CachedResponse.Builder()
        .headers(headers)
        .body(body)
        .responseType(responseType)
        .build());
  }

  /** Adds or replaces a fully-built response. */
  public void addResponse(String host, String path, CachedResponse response) {
    store.put(host, path, response);
  }

  /**
   * Holds back the response for {@code host} and {@code path} by {@code delay}. Returns false if
   * there is no such response.
   */
  public boolean setResponseDelay(String host, String path, long delay, TimeUnit unit) {
    return store.setDelay(host, path, delay, unit);
  }

  /** Sets the response sent for requests that match nothing else. */
  public void addDefaultResponse(@Nullable CachedResponse response) {
    store.setDefault(response);
  }

  /**
   * Once called, requests for numeric paths like {@code /4096} that match nothing else receive a
   * generated body of that many bytes.
   */
  public void generateDynamicResponses() {
    store.enableDynamicMode();
  }

  /** Accepts secondary transport sessions for stored resources. Call this before serving. */
  public void enableSecondaryTransport() {
    secondaryTransportEnabled = true;
  }

  /** Sets the size of the body frames used to send generated responses. */
  public void setGeneratedChunkSize(int generatedChunkSize) {
    if (generatedChunkSize <= 0) throw new IllegalArgumentException("generatedChunkSize <= 0");
    this.generatedChunkSize = generatedChunkSize;
  }

  @Override public boolean initialize(String directory) {
    if (directory == null || directory.isEmpty()) {
      logger.warning("cache directory must not be empty");
      return false;
    }
    logger.info("Attempting to initialize MemoryCacheBackend from directory: " + directory);

    File root = new File(directory);
    int loaded;
    try {
      List<File> files = new ArrayList<>();
      listFilesRecursively(root, files);

      Deque<String> pushUrls = new ArrayDeque<>();
      for (File file : files) {
        CaptureFile captureFile = read(root, file);
        store.put(captureFile.host(), captureFile.path(), captureFile.toCachedResponse());
        pushUrls.addAll(captureFile.pushUrls());
      }
      loaded = files.size() + loadPushedResources(root, pushUrls);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Failed to initialize MemoryCacheBackend from " + directory, e);
      return false;
    }

    initialized = true;
    logger.info("Loaded " + loaded + " responses from " + directory);
    return true;
  }

  /**
   * Loads the targets of {@code pushUrls}, and the targets they push in turn. Targets that are
   * already stored, or that were already visited, are skipped. Returns the number of files read.
   */
  private int loadPushedResources(File root, Deque<String> pushUrls) throws IOException {
    int loaded = 0;
    Set<String> visited = new HashSet<>();
    while (!pushUrls.isEmpty()) {
      String url = pushUrls.removeFirst();
      if (!visited.add(url)) continue;
      if (store.contains(CaptureFileParser.hostOf(url), CaptureFileParser.pathOf(url))) continue;

      if (url.equals("..") || url.startsWith("../") || url.contains("/../")
          || url.endsWith("/..")) {
        throw new MalformedCaptureException("Push URL '" + url + "' is outside " + root);
      }
      File file = new File(root, url);
      if (!file.isFile()) {
        throw new FileNotFoundException("Push URL '" + url + "' not found in " + root);
      }

      CaptureFile captureFile = read(root, file);
      store.put(captureFile.host(), captureFile.path(), captureFile.toCachedResponse());
      pushUrls.addAll(captureFile.pushUrls());
      loaded++;
    }
    return loaded;
  }

  private CaptureFile read(File root, File file) throws IOException {
    String name = file.getPath().substring(root.getPath().length());
    ByteString contents;
    try (BufferedSource source = Okio.buffer(fileSystem.source(file))) {
      contents = source.readByteString();
    }
    CaptureFile captureFile = CaptureFileParser.parse(name, contents);
    logger.fine("Loaded " + captureFile);
    return captureFile;
  }

  private static void listFilesRecursively(File directory, List<File> result) throws IOException {
    File[] files = directory.listFiles();
    if (files == null) {
      throw new IOException("not a readable directory: " + directory);
    }
    Arrays.sort(files);
    for (File file : files) {
      if (file.isDirectory()) {
        listFilesRecursively(file, result);
      } else if (file.isFile()) {
        result.add(file);
      }
    }
  }

  @Override public boolean isInitialized() {
    return initialized;
  }

  @Override public void fetch(Headers requestHeaders, ByteString requestBody,
      ResponseStream stream) {
    if (closedStreams.contains(stream)) {
      logger.fine("Not responding on closed stream " + stream);
      return;
    }

    String authority = authority(requestHeaders);
    String path = requestHeaders.get(PATH);
    logger.fine("Fetching response from backend in-memory cache for url "
        + (authority != null ? authority : "") + (path != null ? path : ""));

    CachedResponse response = authority != null && path != null
        ? store.lookup(authority, path)
        : null;
    if (response == null) {
      sendNotFound(stream);
      return;
    }
    if (response.responseType() == SpecialResponseType.IGNORE_REQUEST) {
      logger.fine("Ignoring request for " + authority + path);
      return;
    }

    long delayNanos = response.delay(NANOSECONDS);
    if (delayNanos > 0) {
      scheduleDelivery(new DelayedDelivery(response, path, stream), delayNanos);
    } else {
      deliver(response, path, stream);
    }
  }

  private void scheduleDelivery(DelayedDelivery delivery, long delayNanos) {
    ResponseStream stream = delivery.stream;
    DelayedDelivery previous = pendingDeliveries.put(stream, delivery);
    if (previous != null && previous.cancel()) {
      logger.warning("Replaced a pending response on " + stream);
    }

    // Closing the stream marks it closed before canceling; check again to avoid missing a close.
    if (closedStreams.contains(stream)) {
      delivery.cancel();
      pendingDeliveries.remove(stream, delivery);
      return;
    }

    try {
      delivery.future = scheduler.schedule(delivery, delayNanos, NANOSECONDS);
    } catch (RejectedExecutionException e) {
      logger.fine("MemoryCacheBackend is closed; dropping response for " + delivery.path);
      delivery.cancel();
      pendingDeliveries.remove(stream, delivery);
    }
  }

  private void deliver(CachedResponse response, String path, ResponseStream stream) {
    switch (response.responseType()) {
      case IGNORE_REQUEST:
        return;

      case CLOSE_CONNECTION:
        stream.closeConnection("MemoryCacheBackend forcing close");
        return;

      case BACKEND_ERROR:
        sendResponse(stream, statusHeaders(500, ERROR_BODY.size()), ERROR_BODY, null);
        return;

      case INCOMPLETE_RESPONSE:
        stream.sendHeaders(response.headers(), false);
        stream.sendBody(response.body(), false);
        return;

      case RETRY_LATER:
        Headers.Builder retryHeaders = response.headers().newBuilder().set(STATUS, "503");
        if (response.header("retry-after") == null) retryHeaders.set("retry-after", "1");
        sendResponse(stream, retryHeaders.build(), response.body(), response.trailers());
        return;

      case GENERATE_BYTES:
        sendGeneratedBytes(response, path, stream);
        return;

      case REGULAR_RESPONSE:
      default:
        for (Headers hints : response.earlyHints()) {
          stream.sendEarlyHints(hints);
        }
        sendResponse(stream, response.headers(), response.body(), response.trailers());
    }
  }

  private void sendResponse(ResponseStream stream, Headers headers, ByteString body,
      @Nullable Headers trailers) {
    boolean hasBody = body.size() > 0;
    stream.sendHeaders(headers, !hasBody && trailers == null);
    if (hasBody) stream.sendBody(body, trailers == null);
    if (trailers != null) stream.sendTrailers(trailers);
  }

  private void sendGeneratedBytes(CachedResponse response, String path, ResponseStream stream) {
    long length = ResponseStore.parseGeneratedLength(path);
    if (length == -1) {
      logger.warning("Path is not a number: " + path);
      sendNotFound(stream);
      return;
    }

    Headers headers = response.headers().newBuilder()
        .set("content-length", Long.toString(length))
        .build();
    if (length == 0) {
      stream.sendHeaders(headers, true);
      return;
    }
    stream.sendHeaders(headers, false);

    byte[] chunk = new byte[(int) Math.min(length, generatedChunkSize)];
    Arrays.fill(chunk, (byte) 'a');
    ByteString fullChunk = ByteString.of(chunk);
    for (long remaining = length; remaining > 0; ) {
      if (closedStreams.contains(stream)) return;
      int size = (int) Math.min(remaining, fullChunk.size());
      remaining -= size;
      stream.sendBody(size == fullChunk.size() ? fullChunk : fullChunk.substring(0, size),
          remaining == 0);
    }
  }

  private void sendNotFound(ResponseStream stream) {
    sendResponse(stream, statusHeaders(404, NOT_FOUND_BODY.size()), NOT_FOUND_BODY, null);
  }

  private static Headers statusHeaders(int code, int contentLength) {
    return new Headers.Builder()
        .add(STATUS, Integer.toString(code))
        .add("content-length", Integer.toString(contentLength))
        .build();
  }

  private static @Nullable String authority(Headers requestHeaders) {
    String authority = requestHeaders.get(AUTHORITY);
    return authority != null ? authority : requestHeaders.get("host");
  }

  @Override public void closeResponseStream(ResponseStream stream) {
    closedStreams.add(stream);
    DelayedDelivery delivery = pendingDeliveries.remove(stream);
    if (delivery != null && delivery.cancel()) {
      logger.fine("Canceled delayed response for " + delivery.path);
    }
  }

  @Override public boolean supportsSecondaryTransport() {
    return secondaryTransportEnabled;
  }

  @Override public SecondaryTransportResponse processSecondaryTransportRequest(
      Headers requestHeaders, SecondaryTransportSession session) {
    if (!secondaryTransportEnabled) {
      return SecondaryTransportResponse.reject(400);
    }
    String path = requestHeaders.get(PATH);
    if (path == null) {
      return SecondaryTransportResponse.reject(400);
    }
    String authority = authority(requestHeaders);
    if (authority == null || !store.contains(authority, path)) {
      return SecondaryTransportResponse.reject(404);
    }
    logger.info("Accepted secondary transport session " + session.sessionId() + " for "
        + authority + path);
    return SecondaryTransportResponse.accept(session);
  }

  /** Stops delivering delayed responses. Responses that haven't been sent yet never will be. */
  @Override public void close() {
    scheduler.shutdownNow();
    for (Iterator<DelayedDelivery> i = pendingDeliveries.values().iterator(); i.hasNext(); ) {
      i.next().cancel();
      i.remove();
    }
  }

  @Override public String toString() {
    return "MemoryCacheBackend{responses=" + store.size() + ", initialized=" + initialized + '}';
  }

  /** A response waiting for its delay to elapse. It runs at most once, and never if canceled. */
  final class DelayedDelivery extends NamedRunnable {
    final CachedResponse response;
    final String path;
    final ResponseStream stream;
    final AtomicBoolean claimed = new AtomicBoolean();
    volatile @Nullable ScheduledFuture<?> future;

    DelayedDelivery(CachedResponse response, String path, ResponseStream stream) {
      super("MemoryCacheBackend delayed %s", path);
      this.response = response;
      this.path = path;
      this.stream = stream;
    }

    /** Returns true if this canceled the delivery, or false if it already ran or was canceled. */
    boolean cancel() {
      if (!claimed.compareAndSet(false, true)) return false;
      ScheduledFuture<?> future = this.future;
      if (future != null) future.cancel(false);
      return true;
    }

    @Override protected void execute() {
      if (!claimed.compareAndSet(false, true)) return;
      pendingDeliveries.remove(stream, this);
      if (closedStreams.contains(stream)) return;
      try {
        deliver(response, path, stream);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Delayed response for " + path + " crashed", e);
      }
    }
  }
}
