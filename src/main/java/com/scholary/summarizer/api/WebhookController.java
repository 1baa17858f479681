package com.scholary.summarizer.api;

import com.scholary.summarizer.service.SummarizationService;
import com.scholary.summarizer.webhook.TransportResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Webhook settings and diagnostics. */
@RestController
@Tag(name = "Webhook", description = "Webhook settings and connectivity")
public class WebhookController {

  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookController.class);

  private final SummarizationService summarizationService;

  public WebhookController(SummarizationService summarizationService) {
    this.summarizationService = summarizationService;
  }

  @GetMapping("/api/webhook/settings")
  @Operation(summary = "Get settings", description = "Current webhook URL and chunk size")
  public ResponseEntity<WebhookSettingsResponse> getSettings() {
    return ResponseEntity.ok(
        WebhookSettingsResponse.from(summarizationService.currentSettings()));
  }

  /**
   * Change the webhook URL and/or chunk size.
   *
   * <p>Jobs already running keep the settings they started with.
   */
  @PutMapping("/api/webhook/settings")
  @Operation(
      summary = "Update settings",
      description = "Change webhook URL and chunk size for jobs started afterwards")
  public ResponseEntity<WebhookSettingsResponse> updateSettings(
      @Valid @RequestBody WebhookSettingsRequest request) {
    if (request.url() != null) {
      summarizationService.setEndpoint(request.url());
    }
    if (request.chunkSizeBytes() != null) {
      summarizationService.setChunkSize(request.chunkSizeBytes());
    }
    LOGGER.info("Webhook settings updated: {}", summarizationService.currentSettings());
    return ResponseEntity.ok(
        WebhookSettingsResponse.from(summarizationService.currentSettings()));
  }

  @GetMapping("/api/webhook/reachability")
  @Operation(
      summary = "Test connection",
      description = "Post a test payload; 2xx, 400 and 404 all count as reachable")
  public ResponseEntity<ReachabilityResponse> testReachability() {
    boolean reachable = summarizationService.testReachability();
    return ResponseEntity.ok(
        new ReachabilityResponse(summarizationService.currentSettings().endpoint(), reachable));
  }

  /** Raw body of the last webhook response, for debugging unexpected response shapes. */
  @GetMapping("/api/webhook/last-response")
  @Operation(summary = "Last response", description = "Raw status and body of the last response")
  public ResponseEntity<TransportResponse> lastResponse() {
    return summarizationService
        .lastResponse()
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.noContent().build());
  }
}
