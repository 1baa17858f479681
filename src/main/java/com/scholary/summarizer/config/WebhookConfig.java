package com.scholary.summarizer.config;

import com.scholary.summarizer.chunking.ChunkConfig;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the webhook client.
 *
 * <p>Builds the session-wide {@link ChunkConfig} from application.yml. Runtime changes go through
 * that bean and are not written back.
 */
@Configuration
@EnableConfigurationProperties({WebhookProperties.class, SummarizerProperties.class})
public class WebhookConfig {

  @Bean
  public ChunkConfig chunkConfig(WebhookProperties properties) {
    return new ChunkConfig(
        properties.url(),
        Duration.ofSeconds(properties.timeoutSeconds()),
        properties.chunkSizeBytes());
  }
}
