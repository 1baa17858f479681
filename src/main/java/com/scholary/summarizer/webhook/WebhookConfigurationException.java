package com.scholary.summarizer.webhook;

/**
 * Thrown when the webhook cannot be called at all because it is not configured properly.
 *
 * <p>Raised before any request is sent, unlike per-piece failures which are recorded as outcomes.
 */
public class WebhookConfigurationException extends RuntimeException {

  public WebhookConfigurationException(String message) {
    super(message);
  }

  public WebhookConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
