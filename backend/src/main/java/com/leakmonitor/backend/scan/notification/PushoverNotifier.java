package com.leakmonitor.backend.scan.notification;

import com.leakmonitor.backend.scan.domain.Scan;
import java.time.Duration;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class PushoverNotifier implements ScanNotifier {

  private static final Duration TIMEOUT = Duration.ofSeconds(15);

  private final PushoverProperties properties;
  private final WebClient webClient;

  public PushoverNotifier(PushoverProperties properties, WebClient.Builder webClientBuilder) {
    this.properties = properties;
    this.webClient = webClientBuilder.baseUrl(properties.getApiUrl()).build();
  }

  @Override
  public String channel() {
    return "pushover";
  }

  @Override
  public boolean isEnabled() {
    return properties.isConfigured();
  }

  @Override
  public void notify(Scan scan) {
    if (properties.isOnlyWithNewFindings() && scan.getNewFindings() == 0) {
      return;
    }
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("token", properties.getToken().trim());
    form.add("user", properties.getUserKey().trim());
    form.add("title", "Leak Monitor: scan #" + scan.getId());
    form.add("message", ScanSummaryFormatter.summary(scan));
    form.add("priority", scan.getNewFindings() > 0 ? "1" : "0");

    webClient
        .post()
        .uri("/1/messages.json")
        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
        .body(BodyInserters.fromFormData(form))
        .retrieve()
        .toBodilessEntity()
        .block(TIMEOUT);
  }
}
