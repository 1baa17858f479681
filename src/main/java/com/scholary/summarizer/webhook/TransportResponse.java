package com.scholary.summarizer.webhook;

/**
 * Raw response from the webhook.
 *
 * @param statusCode HTTP status code
 * @param body response body, possibly empty
 */
public record TransportResponse(int statusCode, String body) {

  public TransportResponse {
    body = body == null ? "" : body;
  }

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
