package com.flamingo.ai.mindmap.service.enrichment;

import com.flamingo.ai.mindmap.config.MindmapConfig;
import com.flamingo.ai.mindmap.domain.enums.Language;
import com.flamingo.ai.mindmap.domain.model.ClusterNode;
import com.flamingo.ai.mindmap.domain.model.ClusterTree;
import com.flamingo.ai.mindmap.domain.model.TextSegment;
import com.flamingo.ai.mindmap.service.generation.GenerationRequest;
import com.flamingo.ai.mindmap.service.generation.GenerationResult;
import com.flamingo.ai.mindmap.service.generation.PromptTemplateService;
import com.flamingo.ai.mindmap.service.generation.ValidatedGenerationService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Gives every node of a cluster tree a label and a description.
 *
 * <p>Each node is labelled from a sample of its own member texts, with the parent's label and the
 * depth as context. A node whose generation is exhausted gets a deterministic fallback, and a node
 * whose enrichment throws gets sentinel texts cut to the label word ceiling; neither affects other
 * nodes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NodeEnrichmentService {

  public static final String ROOT_PARENT_LABEL = "ROOT";
  public static final String UNTITLED_TOPIC = "Untitled Topic";

  private final ValidatedGenerationService validatedGenerationService;
  private final PromptTemplateService promptTemplateService;
  private final FallbackTextFactory fallbackTextFactory;
  private final MindmapConfig mindmapConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Enriches all nodes in pre-order, so parents are labelled before their children.
   *
   * @param tree the tree to enrich in place
   * @param segments the segments the tree's member indices refer to
   * @param language target language
   */
  @Timed(value = "mindmap.enrichment", description = "Time to label and describe all nodes")
  public void enrich(ClusterTree tree, List<TextSegment> segments, Language language) {
    int fallbacks = 0;
    for (ClusterNode node : tree.preOrder()) {
      try {
        fallbacks += enrichNode(tree, node, segments, language);
      } catch (RuntimeException e) {
        log.error("Enrichment failed for node '{}': {}", node.getId(), e.getMessage(), e);
        meterRegistry.counter("enrichment.node.failures").increment();
        String sentinel =
            fallbackTextFactory.fallbackLabel(
                List.of(UNTITLED_TOPIC), mindmapConfig.getGeneration().getLabelMaxWords());
        node.setLabel(sentinel);
        node.setDescription(language.fallbackDescription(sentinel));
      }
    }
    log.info(
        "Enriched {} nodes in {} ({} fallback texts)",
        tree.size(),
        language.getDisplayName(),
        fallbacks);
  }

  /** Returns the number of fallback texts used for the node. */
  private int enrichNode(
      ClusterTree tree, ClusterNode node, List<TextSegment> segments, Language language) {
    MindmapConfig.Generation settings = mindmapConfig.getGeneration();
    List<String> memberTexts = memberTexts(node, segments);
    String sample = sample(memberTexts, settings.getSampleSize());
    String parentLabel =
        tree.parentOf(node)
            .filter(ClusterNode::hasLabel)
            .map(ClusterNode::getLabel)
            .orElse(ROOT_PARENT_LABEL);
    int fallbacks = 0;

    String labelPrompt =
        promptTemplateService.render(
            PromptTemplateService.TOPIC_LABEL,
            Map.of(
                "text", truncate(sample, settings.getLabelCharBudget()),
                "language", language.getDisplayName(),
                "parentLabel", parentLabel,
                "depth", node.getDepth(),
                "maxWords", settings.getLabelMaxWords()));
    GenerationResult labelResult =
        validatedGenerationService.generateValidated(
            new GenerationRequest(
                labelPrompt, language, settings.getMaxRetries(), settings.getLabelMaxWords()));
    String label;
    if (labelResult.isSuccess()) {
      label = labelResult.text();
    } else {
      label = fallbackTextFactory.fallbackLabel(memberTexts, settings.getLabelMaxWords());
      log.warn(
          "Using fallback label '{}' for node '{}' ({})",
          label,
          node.getId(),
          labelResult.lastFailure());
      meterRegistry.counter("enrichment.fallbacks", "field", "label").increment();
      fallbacks++;
    }
    node.setLabel(label);

    String descriptionPrompt =
        promptTemplateService.render(
            PromptTemplateService.NODE_DESCRIPTION,
            Map.of(
                "text", truncate(sample, settings.getDescriptionCharBudget()),
                "language", language.getDisplayName(),
                "label", label,
                "parentLabel", parentLabel,
                "maxWords", settings.getDescriptionMaxWords()));
    GenerationResult descriptionResult =
        validatedGenerationService.generateValidated(
            new GenerationRequest(
                descriptionPrompt,
                language,
                settings.getMaxRetries(),
                settings.getDescriptionMaxWords()));
    if (descriptionResult.isSuccess()) {
      node.setDescription(descriptionResult.text());
    } else {
      log.warn(
          "Using fallback description for node '{}' ({})",
          node.getId(),
          descriptionResult.lastFailure());
      meterRegistry.counter("enrichment.fallbacks", "field", "description").increment();
      node.setDescription(language.fallbackDescription(label));
      fallbacks++;
    }

    log.debug(
        "Node '{}' (depth {}, {} members) labelled '{}'",
        node.getId(),
        node.getDepth(),
        node.size(),
        label);
    return fallbacks;
  }

  private static List<String> memberTexts(ClusterNode node, List<TextSegment> segments) {
    List<String> texts = new ArrayList<>(node.size());
    for (int index : node.getMemberIndices()) {
      texts.add(segments.get(index).cleanedText());
    }
    return texts;
  }

  private static String sample(List<String> texts, int sampleSize) {
    return String.join("\n", texts.subList(0, Math.min(Math.max(1, sampleSize), texts.size())));
  }

  private static String truncate(String text, int budget) {
    return text.length() > budget ? text.substring(0, budget) : text;
  }
}
