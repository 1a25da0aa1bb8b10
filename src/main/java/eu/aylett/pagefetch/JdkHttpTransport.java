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

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * A {@link Transport} using the JDK's HTTP client.
 * <p>
 * Relative URLs are resolved against the base URI, which should end with a
 * {@code /} if it has a path.
 * </p>
 */
public final class JdkHttpTransport implements Transport {
  private final HttpClient client;
  private final URI baseUri;
  private final Duration requestTimeout;

  /**
   * @param client
   *          sends the requests
   * @param baseUri
   *          what relative request URLs are resolved against
   * @param requestTimeout
   *          how long to wait for each response
   */
  public JdkHttpTransport(HttpClient client, URI baseUri, Duration requestTimeout) {
    this.client = client;
    this.baseUri = baseUri;
    this.requestTimeout = requestTimeout;
  }

  /**
   * A transport that follows redirects and waits up to 100 seconds for each
   * response.
   */
  public JdkHttpTransport(URI baseUri) {
    this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build(), baseUri,
        Duration.ofSeconds(100));
  }

  @Override
  public ApiResponse get(String url) throws IOException, InterruptedException {
    var request = HttpRequest.newBuilder(resolve(url))
        .header("Accept", "application/json")
        .timeout(requestTimeout)
        .GET()
        .build();
    var response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    return new ApiResponse(response.statusCode(), response.headers(), response.body());
  }

  URI resolve(String url) {
    return baseUri.resolve(url);
  }
}
