package com.leakmonitor.backend.scan.osint;

import com.fasterxml.jackson.databind.JsonNode;
import com.leakmonitor.backend.scan.domain.KeywordCategory;
import com.leakmonitor.backend.scan.osint.IntelligenceResult.DiscoveredKeyword;
import com.leakmonitor.backend.scan.osint.IntelligenceResult.Observation;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

/** Queries the Hunter.io domain search for addresses under each domain keyword. */
@Component
public class EmailFinderModule implements IntelligenceModule {

  private static final Logger log = LoggerFactory.getLogger(EmailFinderModule.class);

  private static final Duration TIMEOUT = Duration.ofSeconds(30);

  private final WebClient webClient;

  public EmailFinderModule(WebClient.Builder webClientBuilder) {
    this.webClient = webClientBuilder.baseUrl("https://api.hunter.io").build();
  }

  @Override
  public String key() {
    return "email-finder";
  }

  @Override
  public String displayName() {
    return "Email finder";
  }

  @Override
  public String description() {
    return "Looks up known addresses of domain keywords through the Hunter.io API (api_key required).";
  }

  @Override
  public Map<String, String> defaultConfig() {
    return Map.of("api_key", "", "limit", "25");
  }

  @Override
  public IntelligenceResult run(List<String> keywords, Map<String, String> config) {
    String apiKey = config.getOrDefault("api_key", "");
    if (apiKey.isBlank()) {
      log.info("email-finder has no api_key configured, skipping");
      return IntelligenceResult.empty();
    }
    int limit = KeywordHeuristics.intConfig(config, "limit", 25);

    List<DiscoveredKeyword> discovered = new ArrayList<>();
    List<Observation> observations = new ArrayList<>();
    for (String domain : KeywordHeuristics.domains(keywords)) {
      JsonNode body;
      try {
        body =
            webClient
                .get()
                .uri(
                    uri ->
                        uri.path("/v2/domain-search")
                            .queryParam("domain", domain)
                            .queryParam("limit", limit)
                            .queryParam("api_key", apiKey)
                            .build())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(TIMEOUT);
      } catch (WebClientException ex) {
        log.warn("Hunter.io lookup failed for {}: {}", domain, ex.getMessage());
        continue;
      }
      if (body == null) {
        continue;
      }
      for (JsonNode email : body.path("data").path("emails")) {
        String value = email.path("value").asText("");
        if (value.isEmpty()) {
          continue;
        }
        Map<String, String> metadata = new HashMap<>();
        metadata.put("domain", domain);
        metadata.put("confidence", email.path("confidence").asText(""));
        metadata.put("type", email.path("type").asText(""));
        discovered.add(new DiscoveredKeyword(value, KeywordCategory.EMAIL));
        observations.add(new Observation("email", value, "hunter.io", metadata));
      }
    }
    return new IntelligenceResult(discovered, observations);
  }
}
