package com.scholary.summarizer.webhook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.summarizer.config.WebhookProperties;
import com.sun.net.httpserver.HttpServer;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpClientWebhookTransportTest {

  private HttpServer server;
  private HttpClientWebhookTransport transport;
  private final AtomicReference<String> receivedBody = new AtomicReference<>();
  private final AtomicReference<String> receivedContentType = new AtomicReference<>();

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.setExecutor(Executors.newCachedThreadPool());
    server.createContext(
        "/hook",
        exchange -> {
          receivedBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          receivedContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
          byte[] response = "{\"summary\":\"résumé\"}".getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(200, response.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(response);
          }
        });
    server.createContext(
        "/slow",
        exchange -> {
          try {
            Thread.sleep(2000);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          exchange.sendResponseHeaders(200, -1);
          exchange.close();
        });
    server.start();

    transport = new HttpClientWebhookTransport(new WebhookProperties("", 10, 5, 5, null));
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void postJson_shouldSendUtf8JsonAndReturnBody() throws Exception {
    TransportResponse response =
        transport.postJson(uri("/hook"), "{\"content\":\"naïve\"}", Duration.ofSeconds(5));

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.isSuccessful()).isTrue();
    assertThat(response.body()).isEqualTo("{\"summary\":\"résumé\"}");
    assertThat(receivedBody.get()).isEqualTo("{\"content\":\"naïve\"}");
    assertThat(receivedContentType.get()).isEqualTo("application/json");
  }

  @Test
  void postJson_shouldReturnNotFoundStatus() throws Exception {
    TransportResponse response = transport.postJson(uri("/missing"), "{}", Duration.ofSeconds(5));

    assertThat(response.statusCode()).isEqualTo(404);
    assertThat(response.isSuccessful()).isFalse();
  }

  @Test
  void postJson_shouldTimeOut() {
    assertThatThrownBy(() -> transport.postJson(uri("/slow"), "{}", Duration.ofMillis(200)))
        .isInstanceOf(HttpTimeoutException.class);
  }

  private URI uri(String path) {
    return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
  }
}
