package com.flamingo.ai.mindmap.service.enrichment;

import java.util.Arrays;
import java.util.List;
import org.springframework.stereotype.Component;

/** Deterministic labels used when generation does not produce a valid one. */
@Component
public class FallbackTextFactory {

  public static final String UNTITLED = "Untitled";
  static final int MAX_CHARS = 50;
  static final int MAX_WORDS = 8;

  /**
   * Builds a label from the beginning of the first member text: at most 50 characters and 8 words
   * (fewer when {@code maxWords} is lower), with an ellipsis when the text was cut.
   *
   * @param memberTexts the node's member texts
   * @param maxWords word ceiling for labels
   * @return a non-empty label
   */
  public String fallbackLabel(List<String> memberTexts, int maxWords) {
    if (memberTexts == null || memberTexts.isEmpty() || memberTexts.get(0) == null) {
      return UNTITLED;
    }
    String normalized = memberTexts.get(0).replaceAll("\\s+", " ").trim();
    if (normalized.isEmpty()) {
      return UNTITLED;
    }
    String head = normalized.length() > MAX_CHARS ? normalized.substring(0, MAX_CHARS) : normalized;
    String[] words = head.trim().split(" ");
    int wordLimit = Math.max(1, Math.min(MAX_WORDS, maxWords));
    String label = String.join(" ", Arrays.copyOf(words, Math.min(words.length, wordLimit)));
    if (label.length() < normalized.length()) {
      label += "...";
    }
    return label;
  }
}
