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

/**
 * Reading paginated collections from an HTTP API that rate limits its
 * clients.
 * <p>
 * A {@link eu.aylett.pagefetch.RateLimitedDispatcher} bounds the number of
 * requests in flight, and once the server answers with HTTP 429 it holds
 * <i>every</i> caller back until the server's retry interval has passed.
 * Successful responses are kept in a
 * {@link eu.aylett.pagefetch.ResponseCache} for an hour, and concurrent
 * requests for the same URL share one network call.
 * </p>
 * <p>
 * A {@link eu.aylett.pagefetch.PaginatedFetcher} walks the cursor-linked pages
 * of an endpoint and hands back a single iterator over their items, fetching
 * the next page while the current one is being consumed.
 * </p>
 * <p>
 * Use one dispatcher per remote service. Several fetchers, and any number of
 * concurrent traversals, may share it.
 * </p>
 */
@NullMarked
package eu.aylett.pagefetch;

import org.jspecify.annotations.NullMarked;
