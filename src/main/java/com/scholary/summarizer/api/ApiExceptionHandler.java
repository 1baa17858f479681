package com.scholary.summarizer.api;

import com.scholary.summarizer.service.BulkSummaryException;
import com.scholary.summarizer.webhook.WebhookConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps request-level failures to 400 responses. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(WebhookConfigurationException.class)
  public ProblemDetail handleConfiguration(WebhookConfigurationException e) {
    LOGGER.warn("Rejected request: {}", e.getMessage());
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler(BulkSummaryException.class)
  public ProblemDetail handleBulk(BulkSummaryException e) {
    LOGGER.warn("Rejected bulk request: {}", e.getMessage());
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, e.getMessage());
  }
}
