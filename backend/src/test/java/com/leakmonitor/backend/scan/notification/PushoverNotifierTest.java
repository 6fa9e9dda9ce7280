package com.leakmonitor.backend.scan.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.domain.ScanStatus;
import com.leakmonitor.backend.scan.domain.ScanTrigger;
import com.leakmonitor.backend.support.TestEntities;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class PushoverNotifierTest {

  private final List<ClientRequest> requests = new ArrayList<>();
  private PushoverProperties properties;
  private PushoverNotifier notifier;

  @BeforeEach
  void setUp() {
    properties = new PushoverProperties();
    properties.setToken("app-token");
    properties.setUserKey("user-key");
    WebClient.Builder builder =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  requests.add(request);
                  return Mono.just(ClientResponse.create(HttpStatus.OK).build());
                });
    notifier = new PushoverNotifier(properties, builder);
  }

  @Test
  void postsMessageWhenScanFoundSomething() {
    notifier.notify(scan(2));

    assertThat(requests).singleElement().satisfies(request -> {
      assertThat(request.method()).isEqualTo(HttpMethod.POST);
      assertThat(request.url().toString()).isEqualTo("https://api.pushover.net/1/messages.json");
    });
  }

  @Test
  void quietRunsAreNotAnnouncedByDefault() {
    notifier.notify(scan(0));

    assertThat(requests).isEmpty();
  }

  @Test
  void quietRunsAreAnnouncedWhenConfigured() {
    properties.setOnlyWithNewFindings(false);

    notifier.notify(scan(0));

    assertThat(requests).hasSize(1);
  }

  @Test
  void enabledOnlyWithCredentials() {
    assertThat(notifier.isEnabled()).isTrue();

    properties.setUserKey(" ");

    assertThat(notifier.isEnabled()).isFalse();
  }

  private static Scan scan(int newFindings) {
    Scan scan = TestEntities.withId(new Scan(ScanTrigger.SCHEDULED), 11L);
    scan.setStartedAt(Instant.parse("2024-05-10T01:00:00Z"));
    scan.finish(ScanStatus.COMPLETED, Instant.parse("2024-05-10T01:05:00Z"));
    scan.setNewFindings(newFindings);
    return scan;
  }
}
