package com.scholary.captioner.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.captioner.job.GenerationSettings;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the vision-language model server.
 *
 * <p>The server keeps one model instance per device. This client loads and unloads those instances
 * and streams caption generation back token by token.
 *
 * <p>Caption responses are newline-delimited JSON:
 *
 * <pre>
 * {"token": "A"}
 * {"token": " dog"}
 * {"done": true, "text": "A dog runs on a beach.", "output_tokens": 7, "tokens_per_sec": 41.5}
 * </pre>
 *
 * <p>or a single {@code {"error": "..."}} line. Model loads are retried with exponential backoff;
 * caption requests are not.
 */
@Component
public class ModelServerClient implements CaptionGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModelServerClient.class);

  private static final int SERVICE_UNAVAILABLE = 503;

  private final HttpClient httpClient;
  private final ModelServerProperties properties;
  private final ObjectMapper objectMapper;

  public ModelServerClient(ModelServerProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized model server client: baseUrl={}", properties.baseUrl());
  }

  /**
   * Load the model onto a device.
   *
   * @throws ModelLoadException if the model cannot be loaded after retries
   */
  public void loadModel(String device, GenerationSettings settings) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("model_id", settings.modelId());
    body.put("device", device);
    body.put("dtype", settings.dtype());

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        postJson(device, "/api/v1/models/load", body, properties.loadTimeout());
        LOGGER.info("Model {} loaded on {}", settings.modelId(), device);
        return;
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Model load attempt {} on {} failed, retrying in {}ms: {}",
              attempt,
              device,
              backoffMs,
              e.getMessage());
          sleepBeforeRetry(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ModelLoadException("Model load interrupted on " + device, e);
      }
    }

    throw new ModelLoadException(
        String.format(
            "Failed to load model %s on %s after %d attempts",
            settings.modelId(), device, properties.maxRetries()),
        lastException);
  }

  /**
   * Release the model instance held on a device. Failures are logged, not thrown: the run is
   * already over when this is called.
   */
  public void unloadModel(String device) {
    try {
      postJson(device, "/api/v1/models/unload", Map.of("device", device), properties.readTimeout());
      LOGGER.info("Model unloaded from {}", device);
    } catch (IOException e) {
      LOGGER.warn("Failed to unload model from {}: {}", device, e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while unloading model from {}", device);
    }
  }

  @Override
  public GenerationResult generate(
      String device,
      List<String> encodedFrames,
      String prompt,
      int maxTokens,
      double temperature,
      TokenProgressListener listener) {

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("device", device);
    body.put("prompt", prompt);
    body.put("max_tokens", maxTokens);
    body.put("temperature", temperature);
    body.put("images", encodedFrames);

    HttpRequest request;
    try {
      request = jsonRequest(device, "/api/v1/caption", body, properties.readTimeout());
    } catch (JsonProcessingException e) {
      throw new GenerationException("Failed to encode caption request", e);
    }

    LOGGER.debug(
        "Requesting caption on {}: {} frames, maxTokens={}",
        device,
        encodedFrames.size(),
        maxTokens);

    HttpResponse<Stream<String>> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
    } catch (ConnectException e) {
      throw new DeviceUnavailableException(device, "Model server unreachable for " + device, e);
    } catch (IOException e) {
      throw new GenerationException(
          "Caption request failed on " + device + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GenerationException("Caption request interrupted on " + device, e);
    }

    try (Stream<String> lines = response.body()) {
      if (response.statusCode() == SERVICE_UNAVAILABLE) {
        throw new DeviceUnavailableException(
            device, "Device " + device + " unavailable: " + joinBody(lines));
      }
      if (response.statusCode() != 200) {
        throw new GenerationException(
            String.format(
                "Model server returned status %d: %s", response.statusCode(), joinBody(lines)));
      }
      return consumeStream(lines, maxTokens, listener);
    }
  }

  /**
   * Read the NDJSON token stream until the final line.
   *
   * <p>Anything the listener throws propagates unchanged; closing the stream then abandons the
   * response.
   */
  GenerationResult consumeStream(
      Stream<String> lines, int maxTokens, TokenProgressListener listener) {
    int tokens = 0;
    StringBuilder text = new StringBuilder();

    Iterator<String> iterator = lines.iterator();
    while (iterator.hasNext()) {
      String line = iterator.next();
      if (line.isBlank()) {
        continue;
      }

      JsonNode node;
      try {
        node = objectMapper.readTree(line);
      } catch (JsonProcessingException e) {
        throw new GenerationException("Malformed line from model server: " + line, e);
      }

      if (node.hasNonNull("error")) {
        throw new GenerationException("Model error: " + node.get("error").asText());
      }
      if (node.path("done").asBoolean(false)) {
        String finalText = node.hasNonNull("text") ? node.get("text").asText() : text.toString();
        int outputTokens = node.path("output_tokens").asInt(tokens);
        double tokensPerSec = node.path("tokens_per_sec").asDouble(0.0);
        return new GenerationResult(finalText.trim(), outputTokens, tokensPerSec);
      }
      if (node.has("token")) {
        text.append(node.get("token").asText());
        tokens++;
        listener.onToken(tokens, maxTokens);
      }
    }

    throw new GenerationException(
        String.format("Model stream ended after %d tokens without completing", tokens));
  }

  private void postJson(String device, String path, Map<String, Object> body, int timeoutSeconds)
      throws IOException, InterruptedException {
    HttpRequest request = jsonRequest(device, path, body, timeoutSeconds);
    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Model server returned status %d for %s: %s",
              response.statusCode(), path, response.body()));
    }
  }

  private HttpRequest jsonRequest(
      String device, String path, Map<String, Object> body, int timeoutSeconds)
      throws JsonProcessingException {
    return HttpRequest.newBuilder()
        .uri(URI.create(properties.baseUrlFor(device) + path))
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .header("Content-Type", "application/json")
        .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body)))
        .build();
  }

  private static String joinBody(Stream<String> lines) {
    return lines.collect(Collectors.joining("\n"));
  }

  private static void sleepBeforeRetry(long backoffMs) {
    try {
      Thread.sleep(backoffMs);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new ModelLoadException("Model load interrupted", ie);
    }
  }
}
