package com.scholary.summarizer.webhook;

import com.scholary.summarizer.config.WebhookProperties;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Webhook transport built on the Java 11+ HttpClient.
 *
 * <p>The connect timeout is fixed when the client is built; the read timeout is applied per
 * request so that reachability probes can use a shorter one than regular pieces.
 */
@Component
public class HttpClientWebhookTransport implements WebhookTransport {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpClientWebhookTransport.class);

  private final HttpClient httpClient;

  public HttpClientWebhookTransport(WebhookProperties properties) {
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeoutSeconds()))
            .build();

    LOGGER.info(
        "Initialized webhook transport: connectTimeout={}s", properties.connectTimeoutSeconds());
  }

  @Override
  public TransportResponse postJson(URI endpoint, String jsonPayload, Duration timeout)
      throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(endpoint)
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(jsonPayload, StandardCharsets.UTF_8))
            .build();

    LOGGER.debug("Posting {} chars to {}", jsonPayload.length(), endpoint);

    HttpResponse<String> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

    LOGGER.debug("Webhook answered with status {}", response.statusCode());
    return new TransportResponse(response.statusCode(), response.body());
  }
}
