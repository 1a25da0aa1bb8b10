/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.pagefetch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Streams;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

/**
 * Reads every item of a cursor-paginated collection.
 * <p>
 * Pages are requested {@value #PAGE_SIZE} items at a time. The first request
 * carries no cursor; each following request passes the cursor the previous
 * page returned, and the traversal ends at the first page without one. A page
 * with no items but a cursor doesn't end it.
 * </p>
 * <p>
 * A body that can't be read as a page is treated as an empty last page.
 * </p>
 */
public class PaginatedFetcher {
  private static final Logger log = LoggerFactory.getLogger(PaginatedFetcher.class);
  static final int PAGE_SIZE = 100;

  private static final ExecutorService DEFAULT_EXECUTOR = Executors.newCachedThreadPool(
      new ThreadFactoryBuilder().setNameFormat("pagefetch-lookahead-%d").setDaemon(true).build());

  private final RateLimitedDispatcher dispatcher;
  private final ObjectMapper mapper;
  private final PageFormat format;
  private final Executor lookaheadExecutor;

  /**
   * A fully configurable fetcher.
   *
   * @param mapper
   *          reads response bodies and converts items to the requested type
   * @param format
   *          where items and cursors are found in a response body
   * @param lookaheadExecutor
   *          runs the fetch of each next page; its tasks block on the network
   */
  public PaginatedFetcher(RateLimitedDispatcher dispatcher, ObjectMapper mapper, PageFormat format,
      Executor lookaheadExecutor) {
    this.dispatcher = dispatcher;
    this.mapper = mapper;
    this.format = format;
    this.lookaheadExecutor = lookaheadExecutor;
  }

  /**
   * A fetcher for the default page format, which runs lookahead fetches on a
   * shared pool of daemon threads.
   */
  public PaginatedFetcher(RateLimitedDispatcher dispatcher) {
    this(dispatcher, defaultMapper(), PageFormat.DEFAULT, DEFAULT_EXECUTOR);
  }

  /**
   * An object mapper that ignores fields the item types don't declare.
   */
  public static ObjectMapper defaultMapper() {
    return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * Start a traversal of {@code endpoint}. Nothing is requested until the
   * iterator is first used.
   *
   * @param signal
   *          cancels the traversal; the iterator then throws
   *          {@link java.util.concurrent.CancellationException}
   */
  public <T> PagedItemIterator<T> fetchItems(String endpoint, Class<T> itemType, CancellationSignal signal) {
    return fetchItems(endpoint, mapper.getTypeFactory().constructType(itemType), signal);
  }

  /**
   * As {@link #fetchItems(String, Class, CancellationSignal)}, for generic item
   * types such as {@code Map<String, Object>}.
   */
  public <T> PagedItemIterator<T> fetchItems(String endpoint, TypeReference<T> itemType,
      CancellationSignal signal) {
    return fetchItems(endpoint, mapper.getTypeFactory().constructType(itemType), signal);
  }

  private <T> PagedItemIterator<T> fetchItems(String endpoint, JavaType itemType, CancellationSignal signal) {
    return new PagedItemIterator<T>((cursor, pageSignal) -> fetchPage(endpoint, cursor, itemType, pageSignal),
        lookaheadExecutor, signal.newChild());
  }

  /**
   * As {@link #fetchItems(String, Class, CancellationSignal)}, as a sequential
   * stream. Closing the stream stops the traversal.
   */
  public <T> Stream<T> streamItems(String endpoint, Class<T> itemType, CancellationSignal signal) {
    var items = fetchItems(endpoint, itemType, signal);
    return Streams.stream(items).onClose(items::close);
  }

  private <T> Page<T> fetchPage(String endpoint, @Nullable String cursor, JavaType itemType,
      CancellationSignal signal) throws IOException, InterruptedException {
    var url = pageUrl(endpoint, cursor);
    var response = dispatcher.get(url, signal);
    return parsePage(url, response.body(), itemType);
  }

  @VisibleForTesting
  static String pageUrl(String endpoint, @Nullable String cursor) {
    var separator = endpoint.indexOf('?') >= 0 ? '&' : '?';
    var url = endpoint + separator + "limit=" + PAGE_SIZE;
    if (cursor == null) {
      return url;
    }
    return url + "&cursor=" + URLEncoder.encode(cursor, StandardCharsets.UTF_8);
  }

  @VisibleForTesting
  <T> Page<T> parsePage(String url, String body, JavaType itemType) {
    try {
      var root = mapper.readTree(body);
      if (root == null || !root.isObject()) {
        log.warn("Response from {} is not a JSON object, treating it as the last page", url);
        return Page.empty();
      }

      var itemsNode = root.at(format.items());
      List<T> items = new ArrayList<>();
      if (itemsNode.isArray()) {
        var reader = mapper.readerFor(itemType);
        for (var node : itemsNode) {
          if (!node.isNull()) {
            items.add(reader.readValue(node));
          }
        }
      } else if (!itemsNode.isMissingNode() && !itemsNode.isNull()) {
        log.warn("Items in the response from {} are not an array, treating it as the last page", url);
        return Page.empty();
      }

      var cursorNode = root.at(format.nextCursor());
      var cursor = cursorNode.isTextual() ? cursorNode.textValue() : null;
      return new Page<>(items, cursor);
    } catch (IOException e) {
      log.warn("Could not read the response from {} as a page, treating it as the last page", url, e);
      return Page.empty();
    }
  }
}
