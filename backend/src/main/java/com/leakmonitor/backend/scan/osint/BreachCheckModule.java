package com.leakmonitor.backend.scan.osint;

import com.fasterxml.jackson.databind.JsonNode;
import com.leakmonitor.backend.scan.osint.IntelligenceResult.Observation;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

/** Reports known breaches for domain keywords via LeakCheck. Adds no keywords. */
@Component
public class BreachCheckModule implements IntelligenceModule {

  private static final Logger log = LoggerFactory.getLogger(BreachCheckModule.class);

  private static final Duration TIMEOUT = Duration.ofSeconds(30);

  private final WebClient webClient;

  public BreachCheckModule(WebClient.Builder webClientBuilder) {
    this.webClient = webClientBuilder.baseUrl("https://leakcheck.io").build();
  }

  @Override
  public String key() {
    return "breach-check";
  }

  @Override
  public String displayName() {
    return "Breach check";
  }

  @Override
  public String description() {
    return "Checks domain keywords against the LeakCheck breach database (api_key required).";
  }

  @Override
  public Map<String, String> defaultConfig() {
    return Map.of("api_key", "", "limit", "100");
  }

  @Override
  public IntelligenceResult run(List<String> keywords, Map<String, String> config) {
    String apiKey = config.getOrDefault("api_key", "");
    if (apiKey.isBlank()) {
      log.info("breach-check has no api_key configured, skipping");
      return IntelligenceResult.empty();
    }
    int limit = KeywordHeuristics.intConfig(config, "limit", 100);

    List<Observation> observations = new ArrayList<>();
    for (String domain : KeywordHeuristics.domains(keywords)) {
      JsonNode body;
      try {
        body =
            webClient
                .get()
                .uri(
                    uri ->
                        uri.path("/api/v2/query/{query}")
                            .queryParam("type", "domain")
                            .queryParam("limit", limit)
                            .build(domain))
                .header("X-API-Key", apiKey)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(TIMEOUT);
      } catch (WebClientException ex) {
        log.warn("LeakCheck lookup failed for {}: {}", domain, ex.getMessage());
        continue;
      }
      if (body == null || !body.path("success").asBoolean(false)) {
        continue;
      }
      for (JsonNode entry : body.path("result")) {
        String source = entry.path("source").path("name").asText("unknown");
        String account = entry.path("email").asText(entry.path("username").asText(""));
        observations.add(
            new Observation(
                "breach",
                account.isEmpty() ? domain : account,
                "leakcheck",
                Map.of(
                    "domain", domain,
                    "breach", source,
                    "breach_date", entry.path("source").path("breach_date").asText(""))));
      }
    }
    return new IntelligenceResult(List.of(), observations);
  }
}
