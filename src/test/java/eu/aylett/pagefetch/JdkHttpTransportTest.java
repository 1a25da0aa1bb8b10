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

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

class JdkHttpTransportTest {
  private HttpServer server;
  private URI baseUri;
  private final AtomicReference<String> lastRequest = new AtomicReference<>();
  private final AtomicReference<String> lastAccept = new AtomicReference<>();

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.createContext("/v1/", exchange -> {
      lastRequest.set(exchange.getRequestURI().toString());
      lastAccept.set(exchange.getRequestHeaders().getFirst("Accept"));
      byte[] body;
      if (exchange.getRequestURI().getPath().endsWith("/limited")) {
        exchange.getResponseHeaders().add("Retry-After", "7");
        body = new byte[0];
        exchange.sendResponseHeaders(429, -1);
      } else {
        body = "{\"data\":{\"items\":[]}}".getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(200, body.length);
      }
      try (var out = exchange.getResponseBody()) {
        out.write(body);
      }
    });
    server.start();
    baseUri = URI.create("http://" + server.getAddress().getHostString() + ":" + server.getAddress().getPort()
        + "/v1/");
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  @Test
  void resolvesRelativeUrls() {
    var transport = new JdkHttpTransport(URI.create("https://api.example.com/v1/"));
    assertThat(transport.resolve("connectors?limit=100"),
        equalTo(URI.create("https://api.example.com/v1/connectors?limit=100")));
    assertThat(transport.resolve("https://other.example.com/x"), equalTo(URI.create("https://other.example.com/x")));
  }

  @Test
  void fetchesBodyAndStatus() throws Exception {
    var transport = new JdkHttpTransport(baseUri);

    var response = transport.get("groups/g1/connectors?limit=100&cursor=a%2Bb");

    assertThat(response.statusCode(), equalTo(200));
    assertThat(response.isSuccess(), is(true));
    assertThat(response.body(), equalTo("{\"data\":{\"items\":[]}}"));
    assertThat(lastRequest.get(), equalTo("/v1/groups/g1/connectors?limit=100&cursor=a%2Bb"));
    assertThat(lastAccept.get(), equalTo("application/json"));
  }

  @Test
  void keepsRateLimitHeaders() throws Exception {
    var transport = new JdkHttpTransport(baseUri);

    var response = transport.get("limited");

    assertThat(response.isRateLimited(), is(true));
    assertThat(response.headers().firstValue("retry-after").orElseThrow(), equalTo("7"));
  }
}
