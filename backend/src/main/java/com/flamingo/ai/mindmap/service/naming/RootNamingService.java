package com.flamingo.ai.mindmap.service.naming;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.mindmap.domain.enums.Language;
import com.flamingo.ai.mindmap.domain.model.ClusterNode;
import com.flamingo.ai.mindmap.domain.model.ClusterTree;
import com.flamingo.ai.mindmap.domain.model.RootSummary;
import com.flamingo.ai.mindmap.service.generation.CallPacer;
import com.flamingo.ai.mindmap.service.generation.PromptTemplateService;
import com.flamingo.ai.mindmap.service.generation.ResponseCleaner;
import com.flamingo.ai.mindmap.service.generation.TextGenerationProvider;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Names the whole mindmap from an indented outline of its labelled nodes.
 *
 * <p>Makes a single generation call that asks for a JSON object with a title and a summary. Any
 * failure gives a fallback title and a localized "no overview" summary; naming never fails the
 * pipeline.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RootNamingService {

  public static final String FALLBACK_TITLE = "Untitled Mindmap";

  private static final Pattern JSON_OBJECT = Pattern.compile("\\{.*\\}", Pattern.DOTALL);

  private final TextGenerationProvider textGenerationProvider;
  private final PromptTemplateService promptTemplateService;
  private final ResponseCleaner responseCleaner;
  private final CallPacer callPacer;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  /**
   * Generates the title and overview.
   *
   * @param tree the enriched tree
   * @param language language of the title and summary
   * @return the summary, with {@code fallback} set when generation failed
   */
  public RootSummary name(ClusterTree tree, Language language) {
    String outline = buildOutline(tree);
    try {
      String prompt =
          promptTemplateService.render(
              PromptTemplateService.TREE_TITLE,
              Map.of("outline", outline, "language", language.getDisplayName()));
      callPacer.awaitTurn();
      String response = responseCleaner.stripReasoning(textGenerationProvider.generate(prompt));

      JsonNode json = parse(response);
      String title = text(json, "title");
      if (title.isEmpty()) {
        throw new IllegalArgumentException("Response has no title: " + response);
      }
      String summary = text(json, "summary");
      if (summary.isEmpty()) {
        summary = language.getNoOverviewMessage();
      }
      log.info("Mindmap named '{}' ({})", title, language.getDisplayName());
      return new RootSummary(title, summary, false);
    } catch (RuntimeException e) {
      log.warn("Tree naming failed, using fallback title: {}", e.getMessage());
      meterRegistry.counter("root.naming.fallbacks").increment();
      return new RootSummary(FALLBACK_TITLE, language.getNoOverviewMessage(), true);
    }
  }

  /**
   * Renders the tree depth-first, two spaces of indentation per level, one {@code - label:
   * description} line per labelled node.
   */
  public String buildOutline(ClusterTree tree) {
    StringBuilder outline = new StringBuilder();
    for (ClusterNode node : tree.preOrder()) {
      if (!node.hasLabel()) {
        continue;
      }
      outline.append("  ".repeat(node.getDepth())).append("- ").append(node.getLabel());
      if (node.getDescription() != null && !node.getDescription().isBlank()) {
        outline.append(": ").append(node.getDescription());
      }
      outline.append('\n');
    }
    return outline.toString().stripTrailing();
  }

  private JsonNode parse(String response) {
    try {
      return objectMapper.readTree(response);
    } catch (Exception e) {
      Matcher matcher = JSON_OBJECT.matcher(response);
      if (!matcher.find()) {
        throw new IllegalArgumentException("No JSON object in response", e);
      }
      try {
        return objectMapper.readTree(matcher.group());
      } catch (Exception nested) {
        throw new IllegalArgumentException("Invalid JSON in response: " + nested.getMessage(), e);
      }
    }
  }

  private static String text(JsonNode json, String field) {
    if (json == null || !json.isObject()) {
      return "";
    }
    JsonNode value = json.get(field);
    return value == null || value.isNull() ? "" : value.asText().trim();
  }
}
