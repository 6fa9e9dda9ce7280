package com.leakmonitor.backend.scan.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leakmonitor.backend.scan.config.AssessmentProperties;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.ai.chat.client.ChatClient;

class ChatAssessmentClientTest {

  @Mock private ChatClient.Builder chatClientBuilder;

  private AssessmentProperties properties;
  private ChatAssessmentClient client;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    properties = new AssessmentProperties();
    client = new ChatAssessmentClient(chatClientBuilder, properties, new ObjectMapper());
  }

  @Test
  void parsesJsonWrappedInProse() {
    RelevanceVerdict verdict =
        client.parseRelevance(
            "Sure! Here is my answer:\n{\"score\": 0.15, \"summary\": \"Homework project\"}\nThanks");

    assertThat(verdict.score()).isEqualTo(0.15);
    assertThat(verdict.summary()).isEqualTo("Homework project");
  }

  @Test
  void clampsScoreIntoUnitRange() {
    assertThat(client.parseRelevance("{\"score\": 7, \"summary\": \"x\"}").score()).isEqualTo(1.0);
    assertThat(client.parseRelevance("{\"score\": -2}").score()).isEqualTo(0.0);
  }

  @Test
  void proseAnswerGetsNeutralScore() {
    properties.setMaxSummaryChars(10);

    RelevanceVerdict verdict = client.parseRelevance("  This looks like a corporate repo  ");

    assertThat(verdict.score()).isEqualTo(0.5);
    assertThat(verdict.summary()).isEqualTo("This looks");
  }

  @Test
  void answerWithoutScoreMeansScan() {
    RelevanceVerdict verdict = client.parseRelevance("{\"summary\": \"unsure\"}");

    assertThat(verdict.score()).isEqualTo(1.0);
    assertThat(verdict.summary()).isEqualTo("unsure");
  }

  @Test
  void nonNumericScoreMeansScan() {
    assertThat(client.parseRelevance("{\"score\": \"high\", \"summary\": \"x\"}").score())
        .isEqualTo(1.0);
    assertThat(client.parseRelevance("{\"score\": null}").score()).isEqualTo(1.0);
  }

  @Test
  void brokenJsonMeansScan() {
    RelevanceVerdict verdict = client.parseRelevance("{\"score\": 0.1, \"summary\": }");

    assertThat(verdict.score()).isEqualTo(1.0);
    assertThat(verdict.summary()).isEqualTo("Unreadable AI response");
  }

  @Test
  void emptyAnswerMeansScan() {
    assertThat(client.parseRelevance(" ").score()).isEqualTo(1.0);
  }

  @Test
  void unreachableModelDegradesToScan() {
    when(chatClientBuilder.clone()).thenThrow(new IllegalStateException("connection refused"));

    RelevanceVerdict verdict =
        client.assessRelevance(new RepoProfile("acme/api", "", "Java", "", List.of("acme")));

    assertThat(verdict.score()).isEqualTo(1.0);
    assertThat(verdict.summary()).isEqualTo("AI unavailable");
  }

  @Test
  void disabledAssessmentSkipsModel() {
    properties.setEnabled(false);

    assertThat(client.assessRelevance(new RepoProfile("acme/api", null, null, null, null)).score())
        .isEqualTo(1.0);
    assertThat(
            client.assessFinding(
                new FindingContext(
                    "acme/api", "", "gitleaks", "aws", false, "a.env", 1, "HIGH", "AKIA", "", "")))
        .isEmpty();
    verifyNoInteractions(chatClientBuilder);
  }
}
