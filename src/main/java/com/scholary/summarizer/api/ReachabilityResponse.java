package com.scholary.summarizer.api;

/** Result of probing the webhook. */
public record ReachabilityResponse(String url, boolean reachable) {}
