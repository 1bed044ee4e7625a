package com.scholary.captioner.monitoring;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Generates Kibana Discover URLs for captioning jobs.
 *
 * <p>Every log line written while a job runs carries its {@code jobId} in MDC, so a single kuery
 * filter is enough to follow one run across the coordinator and all workers.
 */
@Component
public class KibanaUrlGenerator {

  private static final String DISCOVER_FORMAT =
      "%s/app/discover#/?_a=(index:'%s',query:(language:kuery,query:'%s'))";

  private final String kibanaBaseUrl;
  private final String indexPattern;

  public KibanaUrlGenerator(
      @Value("${kibana.baseUrl:http://localhost:5601}") String kibanaBaseUrl,
      @Value("${kibana.indexPattern:captioner-logs-*}") String indexPattern) {
    this.kibanaBaseUrl = kibanaBaseUrl;
    this.indexPattern = indexPattern;
  }

  /**
   * Generate Kibana Discover URL for a specific job.
   *
   * @param jobId the job ID to filter by
   * @return Kibana URL with pre-filtered query
   */
  public String generateJobUrl(String jobId) {
    return discoverUrl(String.format("jobId:\"%s\"", jobId));
  }

  private String discoverUrl(String query) {
    String encodedQuery = URLEncoder.encode(query, StandardCharsets.UTF_8);
    return String.format(DISCOVER_FORMAT, kibanaBaseUrl, indexPattern, encodedQuery);
  }
}
