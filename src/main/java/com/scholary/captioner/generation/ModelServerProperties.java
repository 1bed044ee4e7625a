package com.scholary.captioner.generation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the model server client.
 *
 * <p>Every device is served from {@code baseUrl} unless {@code deviceBaseUrls} names a dedicated
 * server for it (one server process per GPU is a common deployment). Timeouts are in seconds.
 */
@ConfigurationProperties(prefix = "model-server")
@Validated
public record ModelServerProperties(
    @NotBlank String baseUrl,
    Map<String, String> deviceBaseUrls,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int loadTimeout,
    @Positive int maxRetries) {

  public String baseUrlFor(String device) {
    if (deviceBaseUrls == null) {
      return baseUrl;
    }
    return deviceBaseUrls.getOrDefault(device, baseUrl);
  }
}
