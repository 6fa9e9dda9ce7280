package com.leakmonitor.backend.scan.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leakmonitor.backend.scan.config.AssessmentProperties;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
class ChatAssessmentClient implements AssessmentClient {

  private static final Logger log = LoggerFactory.getLogger(ChatAssessmentClient.class);

  private final ChatClient.Builder chatClientBuilder;
  private final AssessmentProperties properties;
  private final ObjectMapper objectMapper;

  ChatAssessmentClient(
      ChatClient.Builder chatClientBuilder,
      AssessmentProperties properties,
      ObjectMapper objectMapper) {
    this.chatClientBuilder = Objects.requireNonNull(chatClientBuilder, "chatClientBuilder");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  public RelevanceVerdict assessRelevance(RepoProfile profile) {
    if (!properties.isEnabled()) {
      return RelevanceVerdict.scanOnUncertainty("AI assessment disabled");
    }
    try {
      String text = call(AssessmentPrompts.relevance(profile), properties.getRelevanceTemperature());
      return parseRelevance(text);
    } catch (RuntimeException ex) {
      log.warn("Relevance assessment failed for {}: {}", profile.fullName(), ex.getMessage());
      return RelevanceVerdict.scanOnUncertainty("AI unavailable");
    }
  }

  @Override
  public String assessFinding(FindingContext context) {
    if (!properties.isEnabled()) {
      return "";
    }
    try {
      String text = call(AssessmentPrompts.finding(context), properties.getFindingTemperature());
      if (!StringUtils.hasText(text)) {
        return "";
      }
      String trimmed = text.strip();
      int max = properties.getMaxFindingChars();
      return trimmed.length() > max ? trimmed.substring(0, max) : trimmed;
    } catch (RuntimeException ex) {
      log.warn(
          "Finding assessment failed for {} {}: {}",
          context.repoFullName(),
          context.filePath(),
          ex.getMessage());
      return "";
    }
  }

  RelevanceVerdict parseRelevance(String text) {
    if (!StringUtils.hasText(text)) {
      return RelevanceVerdict.scanOnUncertainty("Empty AI response");
    }
    int start = text.indexOf('{');
    int end = text.lastIndexOf('}');
    if (start >= 0 && end > start) {
      JsonNode node;
      try {
        node = objectMapper.readTree(text.substring(start, end + 1));
      } catch (Exception ex) {
        log.debug("Relevance answer is not valid JSON: {}", ex.getMessage());
        return RelevanceVerdict.scanOnUncertainty("Unreadable AI response");
      }
      JsonNode scoreNode = node.path("score");
      double score = scoreNode.isMissingNode() || scoreNode.isNull() ? 1.0 : scoreNode.asDouble(1.0);
      String summary = truncateSummary(node.path("summary").asText(text));
      return new RelevanceVerdict(Math.max(0.0, Math.min(1.0, score)), summary);
    }
    return new RelevanceVerdict(0.5, truncateSummary(text));
  }

  private String truncateSummary(String text) {
    String summary = text.strip();
    int max = properties.getMaxSummaryChars();
    return summary.length() > max ? summary.substring(0, max) : summary;
  }

  private String call(String prompt, double temperature) {
    ChatClient chatClient = chatClientBuilder.clone().build();
    ChatResponse response =
        chatClient
            .prompt()
            .options(ChatOptions.builder().temperature(temperature).build())
            .user(prompt)
            .call()
            .chatResponse();
    if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
      return null;
    }
    return response.getResult().getOutput().getText();
  }
}
