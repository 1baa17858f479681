package com.scholary.summarizer.webhook;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Transport used to post one JSON payload to the webhook.
 *
 * <p>This abstraction keeps socket and TLS handling out of the dispatch logic, and lets tests
 * replace the network with a stub.
 */
public interface WebhookTransport {

  /**
   * Post a JSON payload.
   *
   * @param endpoint the webhook address
   * @param jsonPayload the serialized request body
   * @param timeout how long to wait for the response
   * @return the status code and body of the response, whatever the status
   * @throws IOException on timeout, connection failure or any other I/O problem
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  TransportResponse postJson(URI endpoint, String jsonPayload, Duration timeout)
      throws IOException, InterruptedException;
}
