package com.flamingo.ai.mindmap.service.generation;

import com.flamingo.ai.mindmap.domain.enums.Language;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Structural and language checks for generated text. Checks run in the order of {@link
 * ValidationFailure}; the first violation is reported.
 */
@Component
public class ResponseValidator {

  private static final Pattern REASONING_TAG =
      Pattern.compile("</?(think|thinking|reasoning|analysis)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern TAG = Pattern.compile("</?[A-Za-z][^<>]*>");
  private static final List<String> PREAMBLES =
      List.of(
          "this section",
          "this cluster",
          "this text",
          "this document",
          "the document",
          "description:",
          "label:",
          "here is",
          "here's",
          "as an ai",
          "sure,");
  private static final String MARKDOWN_CHARS = "*_#`~";
  private static final double MAX_MARKDOWN_RATIO = 0.10;

  /**
   * Validates a cleaned response.
   *
   * @param text cleaned response
   * @param language language the response must be written in
   * @param maxWords word ceiling
   * @return the first violated rule, or empty when the text is acceptable
   */
  public Optional<ValidationFailure> validate(String text, Language language, int maxWords) {
    if (text == null || text.isBlank()) {
      return Optional.of(ValidationFailure.EMPTY);
    }
    if (REASONING_TAG.matcher(text).find()) {
      return Optional.of(ValidationFailure.REASONING_MARKUP);
    }
    if (TAG.matcher(text).find()) {
      return Optional.of(ValidationFailure.MARKUP_TAGS);
    }
    String lower = text.strip().toLowerCase(Locale.ROOT);
    for (String preamble : PREAMBLES) {
      if (lower.startsWith(preamble)) {
        return Optional.of(ValidationFailure.EXPLANATORY_PREAMBLE);
      }
    }
    if (language.isScriptDistinguishable() && !language.containsOwnScript(text)) {
      return Optional.of(ValidationFailure.WRONG_SCRIPT);
    }
    if (markdownRatio(text) > MAX_MARKDOWN_RATIO) {
      return Optional.of(ValidationFailure.MARKDOWN_NOISE);
    }
    if (countWords(text) > maxWords) {
      return Optional.of(ValidationFailure.TOO_LONG);
    }
    return Optional.empty();
  }

  static int countWords(String text) {
    String trimmed = text.strip();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }

  private static double markdownRatio(String text) {
    long markdown = text.chars().filter(c -> MARKDOWN_CHARS.indexOf(c) >= 0).count();
    return (double) markdown / text.length();
  }
}
